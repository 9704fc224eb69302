package com.lmspush.filter;

public class UnknownFilterRuleException extends RuntimeException {

    public UnknownFilterRuleException(String ruleId) {
        super("filter rule not found: " + ruleId);
    }
}
