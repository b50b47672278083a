package org.akkordio.fingering.heuristic;

/**
 * Supported remaining-cost heuristic modes.
 *
 * <p>{@code NONE} disables guidance, so the search behaves like Dijkstra.</p>
 * <p>{@code BOUNDING_BOX} derives admissible lower bounds from the candidate-button boxes of
 * the remaining events.</p>
 */
public enum HeuristicType {
    NONE,
    BOUNDING_BOX
}
