package com.prepair.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Tunables of the evaluation pipeline, bound from {@code evaluation.*}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "evaluation")
public class EvaluationProperties {

    /** Pause between two attempts of the same generation task. */
    private Duration retryDelay = Duration.ofMillis(300);

    /** Upper bound for one embedding chain; a slower chain counts as failed. */
    private Duration providerTimeout = Duration.ofSeconds(30);

    private Feedback feedback = new Feedback();
    private Analysis analysis = new Analysis();
    private Keywords keywords = new Keywords();
    private Executor executor = new Executor();

    @Data
    public static class Feedback {
        private int maxRetries = 2;
        private int maxOutputTokens = 1024;
    }

    @Data
    public static class Analysis {
        private int maxRetries = 2;
        private int historyLimit = 20;
        private int lowConfidenceThreshold = 3;
        private int maxOutputTokens = 2048;
        private Duration cacheTtl = Duration.ofMinutes(30);
    }

    @Data
    public static class Keywords {
        private int maxOutputTokens = 256;
        private Duration cacheTtl = Duration.ofHours(24);
    }

    @Data
    public static class Executor {
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 100;
    }
}
