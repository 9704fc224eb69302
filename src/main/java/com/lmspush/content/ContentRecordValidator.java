package com.lmspush.content;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

@Component
public class ContentRecordValidator {

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+$");

    public void validate(ContentRecord content) {
        requireNonNull(content, "content is required");
        requireString(content.learnerId(), "content.learner_id is required");
        requireString(content.learnerName(), "content.learner_name is required");
        String email = requireString(content.learnerEmail(), "content.learner_email is required");
        if (!EMAIL.matcher(email).matches()) {
            throw new ContentValidationException("content.learner_email must be an email address");
        }
        requireString(content.contentId(), "content.content_id is required");
        requireNonNull(content.contentType(), "content.content_type is required");
        requireString(content.title(), "content.title is required");
        requireString(content.contentUrl(), "content.content_url is required");
        requireNonNull(content.submissionDate(), "content.submission_date is required");

        for (String tag : content.tags()) {
            requireString(tag, "content.tags must not contain blank entries");
        }
        for (String key : content.metadata().keySet()) {
            requireString(key, "content.metadata keys must not be blank");
        }
        if (content.learnerGroup() != null && content.learnerGroup().isBlank()) {
            throw new ContentValidationException("content.learner_group must not be blank when provided");
        }
    }

    private String requireString(Object value, String message) {
        if (!(value instanceof String text) || text.isBlank()) {
            throw new ContentValidationException(message);
        }
        return text;
    }

    private void requireNonNull(Object value, String message) {
        if (value == null) {
            throw new ContentValidationException(message);
        }
    }
}
