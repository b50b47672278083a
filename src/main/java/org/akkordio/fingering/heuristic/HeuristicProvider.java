package org.akkordio.fingering.heuristic;

import org.akkordio.fingering.model.BellowsDirection;
import org.akkordio.fingering.model.MusicalEvent;

import java.util.List;

/**
 * Heuristic provider contract used by the fingering search.
 *
 * <p>Providers are immutable and thread-safe. Binding precomputes per-sequence data and
 * returns an estimator owned by a single solve.</p>
 */
public interface HeuristicProvider {

    /**
     * @return heuristic mode of this provider.
     */
    HeuristicType type();

    /**
     * Binds one event sequence and returns an estimator for nodes of that sequence.
     *
     * @param events full event sequence of the solve.
     * @param rootBellows bellows state of the resting hand.
     * @return estimator bound to the sequence.
     */
    RemainingCostHeuristic bindSequence(List<MusicalEvent> events, BellowsDirection rootBellows);
}
