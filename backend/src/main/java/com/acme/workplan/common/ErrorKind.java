package com.acme.workplan.common;

public enum ErrorKind {
    INVALID_ARGUMENT,
    NOT_FOUND,
    INVALID_HIERARCHY,
    STORAGE_FAILURE
}
