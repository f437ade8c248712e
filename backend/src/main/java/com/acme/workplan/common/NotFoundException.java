package com.acme.workplan.common;

public class NotFoundException extends WorkPlanException {
    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public static NotFoundException workItem(long id, String projectId) {
        return new NotFoundException("Work item " + id + " not found in project " + projectId);
    }
}
