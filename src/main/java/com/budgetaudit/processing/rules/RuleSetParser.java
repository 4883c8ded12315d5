package com.budgetaudit.processing.rules;

import com.budgetaudit.shared.model.RuleSet;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reads rule sets written as JSON or YAML (snake_case keys, unknown keys ignored).
 */
@Component
public class RuleSetParser {
    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public RuleSetParser() {
        this.jsonMapper = JsonMapper.builder()
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .build();

        this.yamlMapper = YAMLMapper.builder()
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .build();
    }

    /**
     * @throws RuleSetValidationException when the content is neither valid JSON nor valid YAML
     */
    public RuleSet parse(String content) {
        if (content == null || content.isBlank()) {
            throw new RuleSetValidationException(List.of("Rule set is empty"));
        }
        String trimmed = content.trim();
        try {
            if (trimmed.startsWith("{")) {
                return jsonMapper.readValue(trimmed, RuleSet.class);
            }
            return yamlMapper.readValue(content, RuleSet.class);
        } catch (Exception e) {
            throw new RuleSetValidationException("Unreadable rule set: " + e.getMessage(), e);
        }
    }
}
