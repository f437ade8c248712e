package com.acme.workplan.common;

public abstract class WorkPlanException extends RuntimeException {
    private final ErrorKind kind;

    protected WorkPlanException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected WorkPlanException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() { return kind; }
}
