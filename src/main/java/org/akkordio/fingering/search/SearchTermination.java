package org.akkordio.fingering.search;

/**
 * Why a search stopped.
 */
public enum SearchTermination {
    /** The last event was settled. */
    GOAL_REACHED,
    /** The open set emptied before the last event was reached. */
    EXHAUSTED,
    /** The expansion budget ran out. */
    EXPANSION_BUDGET_EXCEEDED,
    /** The wall-clock budget ran out. */
    TIMEOUT_EXCEEDED,
    /** The caller requested cancellation. */
    CANCELLED
}
