package com.ulbaudit.audit.model;

import java.util.List;

public record Cohort(String name, List<String> memberIds) {

    public Cohort {
        memberIds = List.copyOf(memberIds);
    }

    public int size() {
        return memberIds.size();
    }
}
