package com.umitunal.qcron.trigger;

/**
 * Thrown when a syntactically valid rule has no matching instant within the search window,
 * e.g. {@code 0 0 31 2 *}.
 */
public class UnsatisfiableRuleException extends Exception {
    private final String rule;

    public UnsatisfiableRuleException(String rule, String message) {
        super(message + ": '" + rule + "'");
        this.rule = rule;
    }

    public String getRule() {
        return rule;
    }
}
