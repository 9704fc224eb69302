package com.lmspush.filter;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.lmspush.content.ContentType;
import com.lmspush.content.Grade;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Named predicate restricting which content records may be pushed.
 *
 * Empty {@code contentTypes} / {@code learnerGroups} mean "no restriction".
 * A null {@code minGrade} means no threshold. All {@code requiredTags} must be present.
 */
public record FilterRule(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("content_types") Set<ContentType> contentTypes,
    @JsonProperty("min_grade") @JsonAlias("grade_threshold") Grade minGrade,
    @JsonProperty("required_tags") @JsonAlias("tags_required") Set<String> requiredTags,
    @JsonProperty("learner_groups") Set<String> learnerGroups,
    @JsonProperty("active") Boolean active,
    @JsonProperty("created_at") Instant createdAt
) {

    public FilterRule {
        contentTypes = copy(contentTypes);
        requiredTags = copy(requiredTags);
        learnerGroups = copy(learnerGroups);
        active = active == null ? Boolean.TRUE : active;
    }

    public boolean isActive() {
        return active;
    }

    public FilterRule withIdentity(String newId, Instant newCreatedAt) {
        return new FilterRule(newId, name, contentTypes, minGrade, requiredTags, learnerGroups, active, newCreatedAt);
    }

    private static <T> Set<T> copy(Set<T> values) {
        return values == null
            ? Collections.emptySet()
            : Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }
}
