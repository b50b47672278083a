package org.akkordio.fingering.heuristic;

import org.akkordio.fingering.model.NodeState;

/**
 * Immutable estimator bound to one event sequence.
 */
@FunctionalInterface
public interface RemainingCostHeuristic {

    /**
     * Estimates the cost of playing every event after {@code node.eventIndex()}.
     *
     * @param node scored or unscored search node.
     * @return admissible lower-bound estimate, never negative.
     */
    double estimate(NodeState node);
}
