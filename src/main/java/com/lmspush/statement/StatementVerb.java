package com.lmspush.statement;

import java.util.Map;

/**
 * Fixed verb vocabulary. The push pipeline always uses {@link #COMPLETED}.
 */
public enum StatementVerb {
    COMPLETED("completed", "http://adlnet.gov/expapi/verbs/completed"),
    SUBMITTED("submitted", "http://adlnet.gov/expapi/verbs/answered");

    private final String display;
    private final String iri;

    StatementVerb(String display, String iri) {
        this.display = display;
        this.iri = iri;
    }

    ActivityStatement.Verb toVerb() {
        return new ActivityStatement.Verb(iri, Map.of(StatementGenerator.LANGUAGE, display));
    }
}
