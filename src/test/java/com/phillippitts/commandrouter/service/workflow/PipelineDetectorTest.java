package com.phillippitts.commandrouter.service.workflow;

import com.phillippitts.commandrouter.domain.IntentCategory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineDetectorTest {

    private final PipelineDetector detector =
            new PipelineDetector(WorkflowTestSupport.patternOnlyClassifier(WorkflowTestSupport.metrics()));

    @Test
    void detectsFileToMessagingPipeline() {
        PipelinePlan plan = detector.detect("find my resume and send it to Jay").orElseThrow();

        assertThat(plan.producer().intent()).isEqualTo(IntentCategory.FILE_LOOKUP);
        assertThat(plan.producer().slot("query")).isEqualTo("resume");
        assertThat(plan.consumer().intent()).isEqualTo(IntentCategory.MESSAGING);
        assertThat(plan.consumer().slot("recipient")).isEqualTo("Jay");
        assertThat(plan.rule().outputKey()).isEqualTo("file_path");
        assertThat(plan.rule().inputSlot()).isEqualTo("attachment");
    }

    @Test
    void commaBeforeMarkerIsConsumed() {
        PipelinePlan plan = detector.detect("find my resume, then send it to mom").orElseThrow();

        assertThat(plan.producer().sourceText()).isEqualTo("find my resume");
        assertThat(plan.consumer().sourceText()).isEqualTo("send it to mom");
    }

    @Test
    void conjunctionInsideASingleCommandIsNotAPipeline() {
        assertThat(detector.detect("search for rock and roll")).isEmpty();
        assertThat(detector.detect("call mom and dad")).isEmpty();
    }

    @Test
    void pairWithoutRuleIsNotAPipeline() {
        // Both halves classify, but nothing flows from a call into an app launch
        assertThat(detector.detect("call mom and open chrome")).isEmpty();
    }

    @Test
    void noRulesMeansNoPipelines() {
        PipelineDetector none = new PipelineDetector(
                WorkflowTestSupport.patternOnlyClassifier(WorkflowTestSupport.metrics()), List.of());

        assertThat(none.detect("find my resume and send it to Jay")).isEmpty();
    }

    @Test
    void blankInputIsIgnored() {
        assertThat(detector.detect("  ")).isEmpty();
        assertThat(detector.detect(null)).isEmpty();
    }
}
