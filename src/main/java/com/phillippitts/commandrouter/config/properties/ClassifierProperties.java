package com.phillippitts.commandrouter.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for intent classification and the fallback language model.
 */
@Validated
@ConfigurationProperties(prefix = "router.classifier")
public class ClassifierProperties {

    private final boolean fallbackEnabled;

    @Min(100)
    private final long fallbackTimeoutMs;

    /**
     * Tier-1 candidates below this confidence do not short-circuit the fallback model.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double minPatternConfidence;

    @NotBlank
    private final String model;

    @NotBlank
    private final String baseUrl;

    // Empty means the fallback backend is permanently unavailable
    private final String apiKey;

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private final double temperature;

    @Min(16)
    private final int maxTokens;

    @ConstructorBinding
    public ClassifierProperties(Boolean fallbackEnabled,
                                Long fallbackTimeoutMs,
                                Double minPatternConfidence,
                                String model,
                                String baseUrl,
                                String apiKey,
                                Double temperature,
                                Integer maxTokens) {
        this.fallbackEnabled = fallbackEnabled == null || fallbackEnabled;
        this.fallbackTimeoutMs = fallbackTimeoutMs == null ? 4000L : fallbackTimeoutMs;
        this.minPatternConfidence = minPatternConfidence == null ? 0.6 : minPatternConfidence;
        this.model = model == null ? "llama-3.1-8b-instant" : model;
        this.baseUrl = baseUrl == null ? "https://api.groq.com/openai/v1" : baseUrl;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.temperature = temperature == null ? 0.1 : temperature;
        this.maxTokens = maxTokens == null ? 256 : maxTokens;
    }

    /**
     * Convenience constructor for tests: fallback settings only, model defaults.
     */
    public ClassifierProperties(boolean fallbackEnabled, long fallbackTimeoutMs, double minPatternConfidence) {
        this(fallbackEnabled, fallbackTimeoutMs, minPatternConfidence, null, null, null, null, null);
    }

    public boolean isFallbackEnabled() {
        return fallbackEnabled;
    }

    public long getFallbackTimeoutMs() {
        return fallbackTimeoutMs;
    }

    public double getMinPatternConfidence() {
        return minPatternConfidence;
    }

    public String getModel() {
        return model;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return !apiKey.isEmpty();
    }

    public double getTemperature() {
        return temperature;
    }

    public int getMaxTokens() {
        return maxTokens;
    }
}
