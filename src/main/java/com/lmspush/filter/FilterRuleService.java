package com.lmspush.filter;

import com.lmspush.content.ContentRecord;
import com.lmspush.content.ContentRecordValidator;
import com.lmspush.content.ContentValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Rule management and the rule-debugging diagnostic. The diagnostic only
 * invokes the {@link FilterEngine}; it never starts a push.
 */
@Service
public class FilterRuleService {

    private static final Logger log = LoggerFactory.getLogger(FilterRuleService.class);

    private final FilterRuleRepository repository;
    private final FilterEngine filterEngine;
    private final ContentRecordValidator contentValidator;
    private final Clock clock;

    public FilterRuleService(FilterRuleRepository repository,
                             FilterEngine filterEngine,
                             ContentRecordValidator contentValidator,
                             Clock clock) {
        this.repository = repository;
        this.filterEngine = filterEngine;
        this.contentValidator = contentValidator;
        this.clock = clock;
    }

    public FilterRule create(FilterRule definition) {
        validateDefinition(definition);
        FilterRule rule = repository.save(
            definition.withIdentity(UUID.randomUUID().toString(), clock.instant()));
        log.info("Created filter rule id={} name={}", rule.id(), rule.name());
        return rule;
    }

    public List<FilterRule> list() {
        return repository.findAll();
    }

    public Optional<FilterRule> find(String ruleId) {
        return repository.findById(ruleId);
    }

    /**
     * Tests a content record against a stored rule, an inline rule, or (neither given)
     * every active rule.
     */
    public FilterDecision diagnose(ContentRecord content, String ruleId, FilterRule inlineRule) {
        contentValidator.validate(content);
        if (ruleId != null && !ruleId.isBlank()) {
            FilterRule rule = repository.findById(ruleId)
                .orElseThrow(() -> new UnknownFilterRuleException(ruleId));
            return filterEngine.evaluate(content, rule);
        }
        if (inlineRule != null) {
            validateDefinition(inlineRule);
            return filterEngine.evaluate(content, inlineRule);
        }
        return filterEngine.evaluateAny(content, repository.findActive());
    }

    private void validateDefinition(FilterRule definition) {
        if (definition == null) {
            throw new ContentValidationException("rule definition is required");
        }
        if (definition.name() == null || definition.name().isBlank()) {
            throw new ContentValidationException("rule.name is required");
        }
        if (definition.contentTypes().contains(null)) {
            throw new ContentValidationException("rule.content_types must not contain null");
        }
        for (String tag : definition.requiredTags()) {
            if (tag == null || tag.isBlank()) {
                throw new ContentValidationException("rule.required_tags must not contain blank entries");
            }
        }
        for (String group : definition.learnerGroups()) {
            if (group == null || group.isBlank()) {
                throw new ContentValidationException("rule.learner_groups must not contain blank entries");
            }
        }
    }
}
