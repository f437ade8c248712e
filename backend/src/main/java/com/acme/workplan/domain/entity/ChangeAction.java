package com.acme.workplan.domain.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ChangeAction {
    CREATE("create"),
    // parent link changed
    UPDATE("update"),
    COMPLETE("complete"),
    FIELD_CHANGE("field-change");

    private final String wireName;

    ChangeAction(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() { return wireName; }
}
