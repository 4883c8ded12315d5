package com.budgetaudit.processing.rules;

import com.budgetaudit.processing.matching.TemplateDetection;
import com.budgetaudit.processing.matching.TemplateDetector;
import com.budgetaudit.shared.model.Document;
import com.budgetaudit.shared.model.RuleSet;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current version of each rule set, keyed by name.
 *
 * <p>A reload swaps in a new immutable {@link RuleSet}; jobs keep the instance they captured at
 * submission, so in-flight work never sees a half-applied version.
 */
@Service
public class RuleSetRegistry {

    private static final Logger logger = LoggerFactory.getLogger(RuleSetRegistry.class);

    private final RuleSetParser parser;
    private final RuleSetValidator validator;
    private final TemplateDetector templateDetector;
    private final List<String> locations;
    private final String defaultName;
    private final ResourceLoader resourceLoader = new DefaultResourceLoader();
    private final AtomicReference<Map<String, RuleSet>> current = new AtomicReference<>(new LinkedHashMap<>());

    public RuleSetRegistry(RuleSetParser parser,
                           TemplateDetector templateDetector,
                           @Value("${budgetaudit.rules.locations:classpath:rules/department-final-v1.yaml}") List<String> locations,
                           @Value("${budgetaudit.rules.default-name:部门决算}") String defaultName) {
        this.parser = parser;
        this.validator = new RuleSetValidator();
        this.templateDetector = templateDetector;
        this.locations = locations;
        this.defaultName = defaultName;
    }

    @PostConstruct
    public void loadConfigured() {
        for (String location : locations) {
            Resource resource = resourceLoader.getResource(location.trim());
            try (InputStream in = resource.getInputStream()) {
                RuleSet loaded = reload(new String(in.readAllBytes(), StandardCharsets.UTF_8));
                logger.info("Loaded rule set {} from {}", loaded, location);
            } catch (IOException e) {
                throw new IllegalStateException("Cannot read rule set " + location, e);
            }
        }
    }

    /**
     * Parses, validates and publishes a rule set version, replacing any version with the same name.
     *
     * @throws RuleSetValidationException when the content is unreadable or invalid; the current version stays
     */
    public RuleSet reload(String content) {
        RuleSet candidate = parser.parse(content);
        List<String> errors = validator.validate(candidate);
        if (!errors.isEmpty()) {
            logger.warn("Rejected rule set {}: {}", candidate, errors);
            throw new RuleSetValidationException(errors);
        }
        Map<String, RuleSet> previous;
        Map<String, RuleSet> next;
        do {
            previous = current.get();
            next = new LinkedHashMap<>(previous);
            next.put(candidate.getName(), candidate);
        } while (!current.compareAndSet(previous, next));

        RuleSet replaced = previous.get(candidate.getName());
        if (replaced != null) {
            logger.info("Rule set {} upgraded from version {} to {}", candidate.getName(), replaced.getVersion(), candidate.getVersion());
        }
        return candidate;
    }

    public RuleSet get(String name) {
        RuleSet ruleSet = current.get().get(name);
        if (ruleSet == null) {
            throw new IllegalArgumentException("Unknown rule set: " + name);
        }
        return ruleSet;
    }

    public List<RuleSet> all() {
        return new ArrayList<>(current.get().values());
    }

    public RuleSet defaultRuleSet() {
        Map<String, RuleSet> sets = current.get();
        RuleSet ruleSet = sets.get(defaultName);
        if (ruleSet != null) {
            return ruleSet;
        }
        if (sets.isEmpty()) {
            throw new IllegalStateException("No rule set loaded");
        }
        return sets.values().iterator().next();
    }

    /**
     * Chooses the rule set for a document from its cover page, falling back to the default set when
     * detection is not conclusive.
     */
    public RuleSet select(Document document) {
        List<RuleSet> candidates = all();
        if (candidates.size() <= 1) {
            return defaultRuleSet();
        }
        TemplateDetection detection = templateDetector.detect(document, candidates);
        if (detection.isDetermined()) {
            return detection.getRuleSet();
        }
        logger.info("Template not determined for document {}, using default rule set", document.getId());
        return defaultRuleSet();
    }
}
