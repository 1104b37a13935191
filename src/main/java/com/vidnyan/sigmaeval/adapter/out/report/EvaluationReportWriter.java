package com.vidnyan.sigmaeval.adapter.out.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.vidnyan.sigmaeval.application.port.in.EvaluateRuleUseCase.DatasetEvaluation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes reports and metrics as snake_case JSON.
 */
@Slf4j
@Component
public class EvaluationReportWriter {

    private final ObjectMapper objectMapper;

    public EvaluationReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    /**
     * Serialize a {@code RuleReport}, {@code CorpusMetrics} or {@link DatasetEvaluation}.
     */
    public String toJson(Object report) throws JsonProcessingException {
        return objectMapper.writeValueAsString(report);
    }

    public void write(DatasetEvaluation evaluation, Path target) throws IOException {
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        objectMapper.writeValue(target.toFile(), evaluation);
        log.info("Wrote {} reports to {}", evaluation.reports().size(), target);
    }
}
