package com.tictac.server;

public class GameRuleException extends RuntimeException {
    private final RuleViolation violation;

    public GameRuleException(RuleViolation violation, String message) {
        super(message);
        this.violation = violation;
    }

    public RuleViolation getViolation() {
        return violation;
    }
}
