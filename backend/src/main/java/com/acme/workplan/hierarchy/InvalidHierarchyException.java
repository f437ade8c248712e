package com.acme.workplan.hierarchy;

import com.acme.workplan.common.ErrorKind;
import com.acme.workplan.common.WorkPlanException;

public class InvalidHierarchyException extends WorkPlanException {
    private final HierarchyViolation violation;

    public InvalidHierarchyException(HierarchyViolation violation, String message) {
        super(ErrorKind.INVALID_HIERARCHY, message);
        this.violation = violation;
    }

    public HierarchyViolation getViolation() { return violation; }
}
