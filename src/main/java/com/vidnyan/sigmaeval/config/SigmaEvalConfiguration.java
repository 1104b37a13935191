package com.vidnyan.sigmaeval.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.sigmaeval.adapter.out.ai.EmbeddingClient;
import com.vidnyan.sigmaeval.adapter.out.ai.LlmClient;
import com.vidnyan.sigmaeval.adapter.out.ai.LlmJudgeClient;
import com.vidnyan.sigmaeval.application.port.out.EmbeddingProvider;
import com.vidnyan.sigmaeval.application.port.out.LlmJudge;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for the evaluation engine.
 * Wires the optional AI capabilities and the dataset worker pool.
 */
@Slf4j
@Configuration
public class SigmaEvalConfiguration {

    /**
     * ObjectMapper for JSON parsing.
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public LlmClient llmClient(EvaluationProperties properties, ObjectMapper objectMapper) {
        EvaluationProperties.Ai ai = properties.getAi();
        return new LlmClient(ai.getBaseUrl(), ai.getApiKey(), ai.getTimeout(), objectMapper);
    }

    /**
     * LLM judge, only when explicitly enabled.
     */
    @Bean
    @ConditionalOnProperty(prefix = "sigmaeval.ai", name = "judge-enabled", havingValue = "true")
    public LlmJudge llmJudge(LlmClient llmClient, EvaluationProperties properties) {
        log.info("LLM judge enabled with model {}", properties.getAi().getJudgeModel());
        return new LlmJudgeClient(llmClient, properties.getAi().getJudgeModel());
    }

    /**
     * Embedding capability, only when explicitly enabled.
     */
    @Bean
    @ConditionalOnProperty(prefix = "sigmaeval.ai", name = "embedding-enabled", havingValue = "true")
    public EmbeddingProvider embeddingProvider(LlmClient llmClient, EvaluationProperties properties) {
        log.info("Embedding capability enabled with model {}", properties.getAi().getEmbeddingModel());
        return new EmbeddingClient(llmClient, properties.getAi().getEmbeddingModel());
    }

    /**
     * Bounded pool for rule-level evaluations of a dataset.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService evaluationExecutor(EvaluationProperties properties) {
        int workers = Math.max(1, properties.getEvaluation().getMaxWorkers());
        AtomicInteger counter = new AtomicInteger();
        log.info("Dataset evaluation pool: {} workers", workers);
        return Executors.newFixedThreadPool(workers, runnable -> {
            Thread thread = new Thread(runnable, "sigma-eval-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
