package com.vidnyan.sigmaeval.config;

import com.vidnyan.sigmaeval.application.port.out.EmbeddingProvider;
import com.vidnyan.sigmaeval.application.port.out.LlmJudge;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.concurrent.ExecutorService;

import static org.junit.jupiter.api.Assertions.*;

class SigmaEvalConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(SigmaEvalConfiguration.class)
            .withBean(EvaluationProperties.class);

    @Test
    void capabilities_ShouldBeAbsentByDefault() {
        contextRunner.run(context -> {
            assertTrue(context.getBeansOfType(LlmJudge.class).isEmpty());
            assertTrue(context.getBeansOfType(EmbeddingProvider.class).isEmpty());
            assertNotNull(context.getBean("evaluationExecutor", ExecutorService.class));
        });
    }

    @Test
    void capabilities_ShouldBeCreatedWhenEnabled() {
        contextRunner
                .withPropertyValues("sigmaeval.ai.judge-enabled=true", "sigmaeval.ai.embedding-enabled=true")
                .run(context -> {
                    assertEquals(1, context.getBeansOfType(LlmJudge.class).size());
                    assertEquals(1, context.getBeansOfType(EmbeddingProvider.class).size());
                });
    }
}
