package com.lmspush.content;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A normalized unit of learner work handed to the push pipeline.
 *
 * Immutable: tag and metadata collections are copied on construction.
 * {@code grade} and {@code learnerGroup} may be null.
 */
public record ContentRecord(
    @JsonProperty("learner_id") String learnerId,
    @JsonProperty("learner_name") String learnerName,
    @JsonProperty("learner_email") String learnerEmail,
    @JsonProperty("content_id") String contentId,
    @JsonProperty("content_type") ContentType contentType,
    @JsonProperty("title") String title,
    @JsonProperty("description") String description,
    @JsonProperty("content_url") String contentUrl,
    @JsonProperty("submission_date") Instant submissionDate,
    @JsonProperty("grade") Grade grade,
    @JsonProperty("tags") Set<String> tags,
    @JsonProperty("metadata") Map<String, Object> metadata,
    @JsonProperty("learner_group") String learnerGroup
) {

    public ContentRecord {
        tags = tags == null
            ? Collections.emptySet()
            : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        metadata = metadata == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public boolean hasGrade() {
        return grade != null;
    }

    public ContentRecord withContentUrl(String newContentUrl) {
        return new ContentRecord(learnerId, learnerName, learnerEmail, contentId, contentType,
            title, description, newContentUrl, submissionDate, grade, tags, metadata, learnerGroup);
    }
}
