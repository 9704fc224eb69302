package com.lmspush.statement;

import com.lmspush.content.ContentRecord;
import com.lmspush.content.ContentType;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Maps a content record to an activity statement.
 *
 * Deterministic apart from the statement id and timestamp, which are minted per call.
 * Completion and success are both true exactly when the record carries a grade; the
 * source data has no other completion signal.
 */
@Component
public class StatementGenerator {

    public static final String LANGUAGE = "en-US";
    public static final String ACTIVITY_NAMESPACE = "http://lms.example.com/content/";
    public static final String EXTENSION_CONTENT_TYPE = "http://lms.example.com/content_type";
    public static final String EXTENSION_TAGS = "http://lms.example.com/tags";
    public static final String EXTENSION_METADATA = "http://lms.example.com/metadata";

    static final String PLATFORM = "LMS Platform";
    static final String INSTRUCTOR_NAME = "LMS System";

    private static final Map<ContentType, String> ACTIVITY_TYPES = activityTypes();

    private final Clock clock;

    public StatementGenerator(Clock clock) {
        this.clock = clock;
    }

    public ActivityStatement generate(ContentRecord content) {
        return generate(content, StatementVerb.COMPLETED);
    }

    public ActivityStatement generate(ContentRecord content, StatementVerb verb) {
        ActivityStatement.Actor actor = new ActivityStatement.Actor(
            "mailto:" + content.learnerEmail(), content.learnerName(), "Agent");

        ActivityStatement.ActivityObject object = new ActivityStatement.ActivityObject(
            ACTIVITY_NAMESPACE + content.contentId(),
            new ActivityStatement.Definition(
                Map.of(LANGUAGE, content.title()),
                Map.of(LANGUAGE, content.description() == null ? "" : content.description()),
                ACTIVITY_TYPES.get(content.contentType())),
            "Activity");

        ActivityStatement.Result result = null;
        if (content.hasGrade()) {
            result = new ActivityStatement.Result(
                new ActivityStatement.Score(content.grade().getValue()), true, true);
        }

        Map<String, Object> extensions = new LinkedHashMap<>();
        extensions.put(EXTENSION_CONTENT_TYPE, content.contentType().getValue());
        extensions.put(EXTENSION_TAGS, Collections.unmodifiableList(new ArrayList<>(content.tags())));
        extensions.put(EXTENSION_METADATA, content.metadata());

        ActivityStatement.Context context = new ActivityStatement.Context(
            new ActivityStatement.Actor(null, INSTRUCTOR_NAME, "Agent"),
            PLATFORM,
            LANGUAGE,
            Collections.unmodifiableMap(extensions));

        return new ActivityStatement(
            UUID.randomUUID().toString(),
            clock.instant(),
            actor,
            verb.toVerb(),
            object,
            result,
            context);
    }

    private static Map<ContentType, String> activityTypes() {
        Map<ContentType, String> types = new EnumMap<>(ContentType.class);
        types.put(ContentType.ESSAY, "http://adlnet.gov/expapi/activities/essay");
        types.put(ContentType.VIDEO, "http://adlnet.gov/expapi/activities/video");
        types.put(ContentType.AUDIO, "http://adlnet.gov/expapi/activities/audio");
        types.put(ContentType.PRESENTATION, "http://adlnet.gov/expapi/activities/presentation");
        types.put(ContentType.CODE, "http://adlnet.gov/expapi/activities/code");
        types.put(ContentType.QUIZ, "http://adlnet.gov/expapi/activities/quiz");
        types.put(ContentType.PROJECT, "http://adlnet.gov/expapi/activities/project");
        return Collections.unmodifiableMap(types);
    }
}
