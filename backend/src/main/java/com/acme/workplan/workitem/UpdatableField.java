package com.acme.workplan.workitem;

public enum UpdatableField {
    TITLE("title"),
    DESCRIPTION("description"),
    STATUS("status"),
    NOTES("notes"),
    PARENT_ID("parentId"),
    ORDER_INDEX("orderIndex");

    private final String key;

    UpdatableField(String key) {
        this.key = key;
    }

    public String key() { return key; }
}
