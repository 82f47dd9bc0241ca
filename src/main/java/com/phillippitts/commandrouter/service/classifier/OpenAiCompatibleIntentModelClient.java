package com.phillippitts.commandrouter.service.classifier;

import com.phillippitts.commandrouter.config.properties.ClassifierProperties;
import com.phillippitts.commandrouter.config.properties.FallbackHealthProperties;
import com.phillippitts.commandrouter.exception.ClassificationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * {@link IntentModelClient} for OpenAI-compatible chat completion endpoints (Groq by default).
 *
 * <p>Requests go to {@code <base-url>/chat/completions}; the probe issues {@code GET <base-url>/models}.
 * Both use bearer authentication with {@code router.classifier.api-key}.
 */
@Component
public class OpenAiCompatibleIntentModelClient implements IntentModelClient {

    private static final Logger LOG = LogManager.getLogger(OpenAiCompatibleIntentModelClient.class);

    private final ClassifierProperties properties;
    private final Duration probeTimeout;
    private final HttpClient httpClient;

    public OpenAiCompatibleIntentModelClient(ClassifierProperties properties,
                                             FallbackHealthProperties healthProperties) {
        this.properties = properties;
        this.probeTimeout = Duration.ofMillis(healthProperties.getProbeTimeoutMs());
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(properties.getFallbackTimeoutMs()))
                .build();
    }

    @Override
    public String complete(String systemPrompt, String userText) {
        if (!isConfigured()) {
            throw new ClassificationException("Fallback model has no API key configured");
        }
        JSONObject payload = new JSONObject()
                .put("model", properties.getModel())
                .put("temperature", properties.getTemperature())
                .put("max_tokens", properties.getMaxTokens())
                .put("messages", new JSONArray()
                        .put(new JSONObject().put("role", "system").put("content", systemPrompt))
                        .put(new JSONObject().put("role", "user").put("content", userText)));

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl() + "/chat/completions"))
                .timeout(Duration.ofMillis(properties.getFallbackTimeoutMs()))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + properties.getApiKey())
                .POST(HttpRequest.BodyPublishers.ofString(payload.toString(), StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ClassificationException("Fallback model call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClassificationException("Fallback model call interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new ClassificationException("Fallback model returned HTTP " + status);
        }
        return extractContent(response.body());
    }

    @Override
    public boolean probe() {
        if (!isConfigured()) {
            return false;
        }
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl() + "/models"))
                .timeout(probeTimeout)
                .header("Authorization", "Bearer " + properties.getApiKey())
                .GET()
                .build();
        try {
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            return response.statusCode() >= 200 && response.statusCode() < 300;
        } catch (IOException e) {
            LOG.debug("Fallback backend probe failed: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public boolean isConfigured() {
        return properties.hasApiKey();
    }

    /**
     * Pulls {@code choices[0].message.content} out of a chat completion response.
     */
    static String extractContent(String body) {
        try {
            JSONObject json = new JSONObject(body);
            JSONArray choices = json.optJSONArray("choices");
            if (choices == null || choices.isEmpty()) {
                throw new ClassificationException("Fallback model response has no choices");
            }
            JSONObject message = choices.getJSONObject(0).optJSONObject("message");
            String content = message == null ? null : message.optString("content", null);
            if (content == null || content.isBlank()) {
                throw new ClassificationException("Fallback model response has empty content");
            }
            return content;
        } catch (JSONException e) {
            throw new ClassificationException("Fallback model response is not valid JSON", e);
        }
    }

    private String baseUrl() {
        String url = properties.getBaseUrl().trim();
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
