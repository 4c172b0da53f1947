package com.ulbaudit.audit.model;

public record OutlierFlag(String entityId, String cohortName, double value, Bounds bounds, BoundSide side) {
}
