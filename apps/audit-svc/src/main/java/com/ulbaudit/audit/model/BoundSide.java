package com.ulbaudit.audit.model;

public enum BoundSide {
    BELOW_LOWER("below lower bound", "lower"),
    ABOVE_UPPER("above upper bound", "higher");

    private final String position;
    private final String direction;

    BoundSide(String position, String direction) {
        this.position = position;
        this.direction = direction;
    }

    public String position() {
        return position;
    }

    public String direction() {
        return direction;
    }
}
