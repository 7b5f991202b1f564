package org.automatacourse.regex.dfa;

/**
 * How {@link Minimizer} refines its partition.
 */
public enum RefinementMode {
    /**
     * Only the first group (seeded with the non-accepting states) is split,
     * pass after pass. Groups split off from it are never examined again.
     */
    FIRST_GROUP,

    /** Moore refinement: every group is split each pass until nothing changes. */
    ALL_GROUPS
}
