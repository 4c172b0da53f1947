package com.ulbaudit.audit.data;

public class DataProviderUnavailableException extends RuntimeException {

    private final String ruleId;

    public DataProviderUnavailableException(String message) {
        this(message, null, null);
    }

    public DataProviderUnavailableException(String message, String ruleId, Throwable cause) {
        super(message, cause);
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }

    public DataProviderUnavailableException forRule(String ruleId) {
        if (this.ruleId != null) {
            return this;
        }
        return new DataProviderUnavailableException("rule " + ruleId + ": " + getMessage(), ruleId, this);
    }
}
