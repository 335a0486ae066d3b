package com.umitunal.qcron.trigger;

/**
 * Thrown when a cron rule is malformed or has a field out of range.
 */
public class InvalidRuleException extends Exception {
    private final String rule;

    public InvalidRuleException(String rule, String message) {
        super(message + ": '" + rule + "'");
        this.rule = rule;
    }

    public InvalidRuleException(String rule, String message, Throwable cause) {
        super(message + ": '" + rule + "'", cause);
        this.rule = rule;
    }

    public String getRule() {
        return rule;
    }
}
