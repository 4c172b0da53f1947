package com.ulbaudit.audit.rules;

public class RuleNotFoundException extends RuntimeException {

    public RuleNotFoundException(String ruleId) {
        super("No rule with id " + ruleId);
    }
}
