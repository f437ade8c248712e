package com.acme.workplan.domain.entity;

import com.acme.workplan.common.InvalidArgumentException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum WorkStatus {
    NOT_STARTED("not_started"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed");

    private final String wireName;

    WorkStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() { return wireName; }

    public boolean isCompleted() { return this == COMPLETED; }

    // completed items may only be reopened to in_progress
    public Set<WorkStatus> allowedTransitions() {
        return switch (this) {
            case NOT_STARTED -> EnumSet.of(IN_PROGRESS, COMPLETED);
            case IN_PROGRESS -> EnumSet.of(NOT_STARTED, COMPLETED);
            case COMPLETED -> EnumSet.of(IN_PROGRESS);
        };
    }

    public void checkTransitionTo(WorkStatus next) {
        if (next == this || allowedTransitions().contains(next)) return;
        throw new InvalidArgumentException("Invalid status transition from '" + wireName + "' to '" + next.wireName
                + "'. Valid transitions: " + allowedTransitions().stream().map(WorkStatus::wireName).toList());
    }

    @JsonCreator
    public static WorkStatus fromWireName(String value) {
        if (value == null) throw new InvalidArgumentException("status is required");
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(s -> s.wireName.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new InvalidArgumentException("Invalid status '" + value + "'. Must be one of: not_started, in_progress, completed"));
    }
}
