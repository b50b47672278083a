package org.akkordio.fingering.core;

/**
 * Search strategy selector.
 */
public enum FingeringAlgorithm {
    DIJKSTRA,
    A_STAR
}
