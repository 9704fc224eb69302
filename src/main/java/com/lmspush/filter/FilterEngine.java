package com.lmspush.filter;

import com.lmspush.content.ContentRecord;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Evaluates content records against filter rules. Pure: no I/O, no state.
 *
 * Checks run in a fixed order and stop at the first failure:
 * content type, grade threshold, required tags, learner group.
 */
@Component
public class FilterEngine {

    public boolean matches(ContentRecord content, FilterRule rule) {
        return evaluate(content, rule).passed();
    }

    public FilterDecision evaluate(ContentRecord content, FilterRule rule) {
        if (!rule.contentTypes().isEmpty() && !rule.contentTypes().contains(content.contentType())) {
            return FilterDecision.reject(FilterCheck.CONTENT_TYPE,
                "content type " + content.contentType().getValue() + " is not allowed by rule " + rule.name());
        }

        if (rule.minGrade() != null) {
            if (!content.hasGrade()) {
                return FilterDecision.reject(FilterCheck.GRADE_THRESHOLD,
                    "rule " + rule.name() + " requires grade " + rule.minGrade() + " but content is ungraded");
            }
            if (!content.grade().isAtLeast(rule.minGrade())) {
                return FilterDecision.reject(FilterCheck.GRADE_THRESHOLD,
                    "grade " + content.grade() + " is below minimum " + rule.minGrade() + " of rule " + rule.name());
            }
        }

        if (!content.tags().containsAll(rule.requiredTags())) {
            List<String> missing = rule.requiredTags().stream()
                .filter(tag -> !content.tags().contains(tag))
                .toList();
            return FilterDecision.reject(FilterCheck.REQUIRED_TAGS,
                "missing required tags " + missing + " for rule " + rule.name());
        }

        if (!rule.learnerGroups().isEmpty()
                && (content.learnerGroup() == null || !rule.learnerGroups().contains(content.learnerGroup()))) {
            return FilterDecision.reject(FilterCheck.LEARNER_GROUP,
                "learner group " + content.learnerGroup() + " is not allowed by rule " + rule.name());
        }

        return FilterDecision.pass("matches rule: " + rule.name());
    }

    /**
     * Evaluates against a destination's rule, if it has one. No rule always passes.
     */
    public FilterDecision evaluate(ContentRecord content, Optional<FilterRule> rule) {
        return rule.map(r -> evaluate(content, r))
            .orElseGet(() -> FilterDecision.pass("no filter rule configured"));
    }

    /**
     * Passes if any rule matches; passes when there are no rules at all.
     * When every rule rejects, the last rejection's check is reported.
     */
    public FilterDecision evaluateAny(ContentRecord content, List<FilterRule> rules) {
        if (rules.isEmpty()) {
            return FilterDecision.pass("no active filter rules - allowing all content");
        }
        FilterDecision last = null;
        for (FilterRule rule : rules) {
            FilterDecision decision = evaluate(content, rule);
            if (decision.passed()) {
                return decision;
            }
            last = decision;
        }
        return FilterDecision.reject(last.failedCheck(),
            "content does not match any filter rules (last: " + last.reason() + ")");
    }
}
