package com.lmspush.statement;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * xAPI-style activity statement: actor performed verb on object, with result, in context.
 * Generated per delivery attempt and handed to an adapter; never stored as pipeline state.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActivityStatement(
    @JsonProperty("id") String id,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("actor") Actor actor,
    @JsonProperty("verb") Verb verb,
    @JsonProperty("object") ActivityObject object,
    @JsonProperty("result") Result result,
    @JsonProperty("context") Context context
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Actor(
        @JsonProperty("mbox") String mbox,
        @JsonProperty("name") String name,
        @JsonProperty("objectType") String objectType
    ) {}

    public record Verb(
        @JsonProperty("id") String id,
        @JsonProperty("display") Map<String, String> display
    ) {}

    public record ActivityObject(
        @JsonProperty("id") String id,
        @JsonProperty("definition") Definition definition,
        @JsonProperty("objectType") String objectType
    ) {}

    public record Definition(
        @JsonProperty("name") Map<String, String> name,
        @JsonProperty("description") Map<String, String> description,
        @JsonProperty("type") String type
    ) {}

    public record Result(
        @JsonProperty("score") Score score,
        @JsonProperty("completion") boolean completion,
        @JsonProperty("success") boolean success
    ) {}

    public record Score(@JsonProperty("raw") String raw) {}

    public record Context(
        @JsonProperty("instructor") Actor instructor,
        @JsonProperty("platform") String platform,
        @JsonProperty("language") String language,
        @JsonProperty("extensions") Map<String, Object> extensions
    ) {}
}
