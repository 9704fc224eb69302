package com.lmspush.filter;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryFilterRuleRepository implements FilterRuleRepository {

    private static final Comparator<FilterRule> BY_CREATION =
        Comparator.comparing(FilterRule::createdAt).thenComparing(FilterRule::id);

    private final ConcurrentHashMap<String, FilterRule> rules = new ConcurrentHashMap<>();

    @Override
    public FilterRule save(FilterRule rule) {
        rules.put(rule.id(), rule);
        return rule;
    }

    @Override
    public Optional<FilterRule> findById(String id) {
        return Optional.ofNullable(rules.get(id));
    }

    @Override
    public List<FilterRule> findAll() {
        return rules.values().stream()
            .sorted(BY_CREATION)
            .toList();
    }

    @Override
    public List<FilterRule> findActive() {
        return rules.values().stream()
            .filter(FilterRule::isActive)
            .sorted(BY_CREATION)
            .toList();
    }
}
