package com.vidnyan.sigmaeval.adapter.out.corpus;

import com.vidnyan.sigmaeval.adapter.out.parser.SigmaRuleParser;
import com.vidnyan.sigmaeval.application.port.out.RuleCorpus;
import com.vidnyan.sigmaeval.config.EvaluationProperties;
import com.vidnyan.sigmaeval.domain.rule.RuleParseException;
import com.vidnyan.sigmaeval.domain.rule.SigmaRule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * File system based rule corpus.
 * Loads SIGMA rules from YAML files matching the configured resource pattern(s).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileSystemRuleCorpus implements RuleCorpus {

    private final SigmaRuleParser parser;
    private final EvaluationProperties properties;

    private final List<CorpusRule> rules = new CopyOnWriteArrayList<>();

    @PostConstruct
    public void loadRules() {
        rules.clear();
        PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
        for (String pattern : patterns(properties.getCorpus().getPath())) {
            try {
                for (Resource resource : resolver.getResources(pattern)) {
                    load(resource);
                }
            } catch (IOException e) {
                log.error("Failed to resolve corpus pattern {}", pattern, e);
            }
        }
        log.info("Loaded {} corpus rules from {}", rules.size(), properties.getCorpus().getPath());
    }

    @Override
    public List<CorpusRule> findAll() {
        return List.copyOf(rules);
    }

    private void load(Resource resource) {
        String fileName = resource.getFilename() != null ? resource.getFilename() : resource.getDescription();
        String text;
        try {
            text = resource.getContentAsString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Failed to read corpus rule from {}: {}", fileName, e.getMessage());
            return;
        }

        String id = stripExtension(fileName);
        String title = fileName;
        try {
            SigmaRule rule = parser.parse(text);
            if (rule.id() != null && !rule.id().isBlank()) {
                id = rule.id();
            }
            if (rule.title() != null && !rule.title().isBlank()) {
                title = rule.title();
            }
        } catch (RuleParseException e) {
            // kept so that novelty detection reports it as skipped
            log.warn("Corpus rule {} is not valid YAML: {}", fileName, e.getMessage());
        }
        rules.add(new CorpusRule(id, title, text));
        log.debug("Loaded corpus rule: {} - {}", id, title);
    }

    private static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    /**
     * Number of rules currently loaded.
     */
    public int size() {
        return rules.size();
    }

    /**
     * Comma-separated resource patterns.
     */
    static List<String> patterns(String path) {
        List<String> patterns = new ArrayList<>();
        for (String pattern : path.split(",")) {
            if (!pattern.isBlank()) {
                patterns.add(pattern.trim());
            }
        }
        return patterns;
    }
}
