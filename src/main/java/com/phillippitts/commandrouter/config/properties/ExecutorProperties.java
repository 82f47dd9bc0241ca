package com.phillippitts.commandrouter.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Settings for the built-in action executors.
 */
@Validated
@ConfigurationProperties(prefix = "router.executors")
public class ExecutorProperties {

    /**
     * Directories searched by the file lookup executor. Defaults to the user's home.
     */
    private final List<String> fileSearchRoots;

    @Min(1)
    private final int maxFileResults;

    @Min(1)
    private final int maxFileSearchDepth;

    @NotBlank
    private final String defaultPaymentApp;

    /**
     * Upper bound on matching files collected before ranking; the walk stops once reached.
     */
    @Min(1)
    private final int maxFileCandidates;

    @ConstructorBinding
    public ExecutorProperties(List<String> fileSearchRoots,
                              Integer maxFileResults,
                              Integer maxFileSearchDepth,
                              String defaultPaymentApp,
                              Integer maxFileCandidates) {
        this.fileSearchRoots = fileSearchRoots == null || fileSearchRoots.isEmpty()
                ? List.of(System.getProperty("user.home"))
                : List.copyOf(fileSearchRoots);
        this.maxFileResults = maxFileResults == null ? 5 : maxFileResults;
        this.maxFileSearchDepth = maxFileSearchDepth == null ? 6 : maxFileSearchDepth;
        this.defaultPaymentApp = defaultPaymentApp == null ? "gpay" : defaultPaymentApp;
        this.maxFileCandidates = maxFileCandidates == null ? 500 : maxFileCandidates;
    }

    public List<String> getFileSearchRoots() {
        return fileSearchRoots;
    }

    public int getMaxFileResults() {
        return maxFileResults;
    }

    public int getMaxFileSearchDepth() {
        return maxFileSearchDepth;
    }

    public String getDefaultPaymentApp() {
        return defaultPaymentApp;
    }

    public int getMaxFileCandidates() {
        return maxFileCandidates;
    }
}
