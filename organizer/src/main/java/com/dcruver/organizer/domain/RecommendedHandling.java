package com.dcruver.organizer.domain;

/**
 * What the planner should do with a manifest item.
 */
public enum RecommendedHandling {
    /**
     * Leave in place (project roots, generated folders, anything inside a project)
     */
    KEEP,

    /**
     * Confident enough to be grouped with similar items
     */
    GROUP,

    /**
     * Needs a human look before it is moved
     */
    REVIEW
}
