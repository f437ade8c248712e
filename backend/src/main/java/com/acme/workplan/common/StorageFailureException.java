package com.acme.workplan.common;

public class StorageFailureException extends WorkPlanException {
    public StorageFailureException(String message, Throwable cause) {
        super(ErrorKind.STORAGE_FAILURE, message, cause);
    }
}
