package com.lmspush.destination;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lmspush.content.ContentRecord;
import com.lmspush.statement.ActivityStatement;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Body posted to generic webhooks: the statement plus selected content fields.
 */
public record WebhookPayload(
    @JsonProperty("xapi_statement") ActivityStatement statement,
    @JsonProperty("content_metadata") ContentMetadata contentMetadata,
    @JsonProperty("timestamp") Instant timestamp
) {

    public record ContentMetadata(
        @JsonProperty("learner_id") String learnerId,
        @JsonProperty("content_id") String contentId,
        @JsonProperty("content_type") String contentType,
        @JsonProperty("title") String title,
        @JsonProperty("content_url") String contentUrl,
        @JsonProperty("submission_date") Instant submissionDate,
        @JsonProperty("grade") String grade,
        @JsonProperty("tags") Set<String> tags,
        @JsonProperty("metadata") Map<String, Object> metadata,
        @JsonProperty("learner_group") String learnerGroup
    ) {

        static ContentMetadata from(ContentRecord content) {
            return new ContentMetadata(
                content.learnerId(),
                content.contentId(),
                content.contentType().getValue(),
                content.title(),
                content.contentUrl(),
                content.submissionDate(),
                content.hasGrade() ? content.grade().getValue() : null,
                content.tags(),
                content.metadata(),
                content.learnerGroup());
        }
    }
}
