package com.acme.workplan.domain.entity;

import com.acme.workplan.common.InvalidArgumentException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

// declaration order is hierarchy order, root first
public enum WorkItemType {
    PROJECT("project", "projects"),
    PHASE("phase", "phases"),
    TASK("task", "tasks"),
    SUBTASK("subtask", "subtasks");

    private final String wireName;
    private final String plural;

    WorkItemType(String wireName, String plural) {
        this.wireName = wireName;
        this.plural = plural;
    }

    @JsonValue
    public String wireName() { return wireName; }

    public String plural() { return plural; }

    public boolean canContain(WorkItemType child) {
        return switch (this) {
            case PROJECT -> child == PHASE || child == TASK;
            case PHASE -> child == TASK || child == SUBTASK;
            case TASK -> child == SUBTASK;
            case SUBTASK -> false;
        };
    }

    @JsonCreator
    public static WorkItemType fromWireName(String value) {
        if (value == null) throw new InvalidArgumentException("type is required");
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new InvalidArgumentException("Invalid type '" + value + "'. Must be one of: project, phase, task, subtask"));
    }
}
