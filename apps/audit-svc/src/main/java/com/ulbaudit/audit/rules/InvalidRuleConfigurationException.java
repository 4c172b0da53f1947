package com.ulbaudit.audit.rules;

public class InvalidRuleConfigurationException extends RuntimeException {

    public InvalidRuleConfigurationException(String message) {
        super(message);
    }
}
