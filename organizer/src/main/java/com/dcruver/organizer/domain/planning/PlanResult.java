package com.dcruver.organizer.domain.planning;

/**
 * A plan together with the rollback that would undo all of it.
 */
public record PlanResult(Plan plan, Rollback rollback) {
}
