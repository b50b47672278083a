package org.akkordio.fingering.heuristic;

import org.akkordio.fingering.model.BellowsDirection;
import org.akkordio.fingering.model.MusicalEvent;

import java.util.List;
import java.util.Objects;

/**
 * Null heuristic provider.
 *
 * <p>Always returns zero estimates and therefore turns A* into plain Dijkstra.</p>
 */
public final class NullHeuristicProvider implements HeuristicProvider {
    private static final RemainingCostHeuristic ZERO = node -> 0.0d;

    @Override
    public HeuristicType type() {
        return HeuristicType.NONE;
    }

    @Override
    public RemainingCostHeuristic bindSequence(List<MusicalEvent> events, BellowsDirection rootBellows) {
        Objects.requireNonNull(events, "events");
        return ZERO;
    }
}
