package com.iotwatch.anomaly.rule;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.iotwatch.anomaly.config.PipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Reads alert rules from a JSON resource.
 *
 * <pre>
 * [
 *   {
 *     "id": "high-temperature",
 *     "predicate": { "field": "temperature", "comparator": ">", "threshold": 100 },
 *     "action": { "channels": ["log"] },
 *     "cooldown": "PT60S"
 *   }
 * ]
 * </pre>
 */
@Component
@Slf4j
public class RuleSetLoader {

    private static final TypeReference<List<AlertRule>> RULE_LIST = new TypeReference<>() {};

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final String location;

    public RuleSetLoader(ResourceLoader resourceLoader, ObjectMapper objectMapper, PipelineProperties properties) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.location = properties.getRules().getLocation();
    }

    /**
     * Load rules from the configured location.
     *
     * @throws RuleValidationException if the resource is missing or not parseable
     */
    public List<AlertRule> load() {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new RuleValidationException(List.of("rule file not found: " + location));
        }
        try (InputStream in = resource.getInputStream()) {
            List<AlertRule> rules = parse(in);
            log.info("[RULES] Loaded {} rule definitions from {}", rules.size(), location);
            return rules;
        } catch (IOException e) {
            throw new RuleValidationException("cannot read " + location + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parse a JSON rule array.
     */
    public List<AlertRule> parse(InputStream in) throws IOException {
        List<AlertRule> rules = objectMapper.readValue(in, RULE_LIST);
        return rules == null ? List.of() : rules;
    }

    public String getLocation() {
        return location;
    }
}
