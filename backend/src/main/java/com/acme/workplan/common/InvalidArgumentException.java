package com.acme.workplan.common;

public class InvalidArgumentException extends WorkPlanException {
    public InvalidArgumentException(String message) {
        super(ErrorKind.INVALID_ARGUMENT, message);
    }
}
