package com.lmspush.content;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Content records for tests. Every field can be overridden through the wither methods.
 */
public final class ContentFixtures {

    public static final Instant SUBMITTED_AT = Instant.parse("2026-03-02T10:15:30Z");

    private ContentFixtures() {
    }

    public static ContentRecord essay(Grade grade, String... tags) {
        return new ContentRecord(
            "learner-42",
            "Ada Lovelace",
            "ada@example.edu",
            "essay-7",
            ContentType.ESSAY,
            "On the Analytical Engine",
            "Notes on Menabrea's memoir",
            "https://lms.example.com/files/essay-7.pdf",
            SUBMITTED_AT,
            grade,
            Set.of(tags),
            Map.of("word_count", 2400),
            null);
    }

    public static ContentRecord ofType(ContentType type, Grade grade, String... tags) {
        ContentRecord base = essay(grade, tags);
        return new ContentRecord(base.learnerId(), base.learnerName(), base.learnerEmail(), base.contentId(),
            type, base.title(), base.description(), base.contentUrl(), base.submissionDate(),
            base.grade(), base.tags(), base.metadata(), base.learnerGroup());
    }

    public static ContentRecord inGroup(ContentRecord base, String learnerGroup) {
        return new ContentRecord(base.learnerId(), base.learnerName(), base.learnerEmail(), base.contentId(),
            base.contentType(), base.title(), base.description(), base.contentUrl(), base.submissionDate(),
            base.grade(), base.tags(), base.metadata(), learnerGroup);
    }

    public static ContentRecord withEmail(ContentRecord base, String email) {
        return new ContentRecord(base.learnerId(), base.learnerName(), email, base.contentId(),
            base.contentType(), base.title(), base.description(), base.contentUrl(), base.submissionDate(),
            base.grade(), base.tags(), base.metadata(), base.learnerGroup());
    }
}
