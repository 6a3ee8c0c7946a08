package com.dcruver.organizer.domain.planning;

/**
 * Thrown when asked to execute a plan that would break a project boundary.
 */
public class PlanRejectedException extends RuntimeException {

    public PlanRejectedException(String message) {
        super(message);
    }
}
