package com.phillippitts.commandrouter.presentation.controller;

import com.phillippitts.commandrouter.domain.CommandOutcome;
import com.phillippitts.commandrouter.domain.ExecutionResult;
import com.phillippitts.commandrouter.domain.IntentCategory;
import com.phillippitts.commandrouter.domain.WorkflowRequest;
import com.phillippitts.commandrouter.exception.CommandTimeoutException;
import com.phillippitts.commandrouter.service.command.CommandService;
import com.phillippitts.commandrouter.service.executor.ExecutorRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CommandController.class)
class CommandControllerWebTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private CommandService commandService;

    @MockBean
    private ExecutorRegistry executorRegistry;

    @Test
    void returnsCommandResultShape() throws Exception {
        when(commandService.processWithTimeout(any())).thenAnswer(inv -> {
            WorkflowRequest request = inv.getArgument(0);
            return CommandOutcome.aggregate(request.correlationId(), List.of(ExecutionResult.success(
                    "Searching google for 'cats'.", Map.of("url", "https://www.google.com/search?q=cats"),
                    "web_search", IntentCategory.WEB_SEARCH)));
        });

        mvc.perform(post("/api/commands")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"command\": \"search cats\", \"correlation_id\": \"corr-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("command_result"))
                .andExpect(jsonPath("$.correlation_id").value("corr-1"))
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.intent").value("web_search"))
                .andExpect(jsonPath("$.results.steps[0].payload.url").value("https://www.google.com/search?q=cats"));
    }

    @Test
    void blankCommandIsValidationError() throws Exception {
        mvc.perform(post("/api/commands")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"command\": \"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("ValidationError"))
                .andExpect(jsonPath("$.details").value("command must not be blank"));
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mvc.perform(post("/api/commands")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("call mom"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("MalformedRequest"));
    }

    @Test
    void timeoutMapsToGatewayTimeout() throws Exception {
        when(commandService.processWithTimeout(any())).thenThrow(new CommandTimeoutException("corr-2", 30_000));

        mvc.perform(post("/api/commands")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"command\": \"find my resume\"}"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.errorCode").value("CommandTimeoutException"));
    }
}
