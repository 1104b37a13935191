package com.vidnyan.sigmaeval.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the evaluation engine.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "sigmaeval")
public class EvaluationProperties {

    private Ai ai = new Ai();

    private Evaluation evaluation = new Evaluation();

    private Corpus corpus = new Corpus();

    /**
     * OpenAI-compatible endpoint used by the LLM judge and the embedding client.
     */
    @Data
    public static class Ai {
        private String baseUrl = "http://localhost:1234/v1";
        private String apiKey = "";
        private boolean judgeEnabled = false;
        private String judgeModel = "llama-3.3-70b-versatile";
        private boolean embeddingEnabled = false;
        private String embeddingModel = "text-embedding-nomic-embed-text-v1.5";

        /**
         * Upper bound for a single judge or embedding call.
         */
        private Duration timeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Evaluation {
        /**
         * Size of the worker pool used for dataset evaluation.
         */
        private int maxWorkers = 4;
        private boolean stabilityEnabled = true;
        private int stabilityRuns = 5;
        private Duration stabilityRunTimeout = Duration.ofSeconds(120);
    }

    @Data
    public static class Corpus {
        /**
         * Comma-separated Spring resource patterns for existing rules used in novelty detection.
         */
        private String path = "classpath*:corpus/*.yml,classpath*:corpus/*.yaml";
    }
}
