package com.lmspush.filter;

import java.util.List;
import java.util.Optional;

public interface FilterRuleRepository {
    FilterRule save(FilterRule rule);

    Optional<FilterRule> findById(String id);

    List<FilterRule> findAll();

    List<FilterRule> findActive();
}
