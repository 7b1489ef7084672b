package com.liftlog.engine;

import com.liftlog.contract.ValidationException;

/**
 * A well-formed event that the current workout lifecycle does not allow, such
 * as logging a set with no active workout. Rejected before anything is appended.
 */
public class WorkoutStateException extends ValidationException {

    public WorkoutStateException(String field, String constraint) {
        super(field, constraint);
    }
}
