package com.acme.workplan.hierarchy;

public enum HierarchyViolation {
    BAD_NESTING("bad-nesting"),
    CROSS_PROJECT("cross-project"),
    DEPTH_EXCEEDED("depth-exceeded"),
    MISSING_PARENT("missing-parent");

    private final String code;

    HierarchyViolation(String code) {
        this.code = code;
    }

    public String code() { return code; }
}
