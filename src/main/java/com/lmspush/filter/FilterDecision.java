package com.lmspush.filter;

/**
 * Outcome of evaluating a content record against a rule.
 *
 * @param passed      whether the record may be pushed
 * @param reason      human-readable explanation
 * @param failedCheck the first failing check, or null when passed
 */
public record FilterDecision(boolean passed, String reason, FilterCheck failedCheck) {

    public static FilterDecision pass(String reason) {
        return new FilterDecision(true, reason, null);
    }

    public static FilterDecision reject(FilterCheck check, String reason) {
        return new FilterDecision(false, reason, check);
    }
}
