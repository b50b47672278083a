package org.akkordio.fingering.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.akkordio.fingering.heuristic.HeuristicType;
import org.akkordio.fingering.model.BellowsDirection;
import org.akkordio.fingering.model.MusicalEvent;
import org.akkordio.fingering.search.SearchBudget;

import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Client-facing fingering request for one right-hand event sequence.
 */
@Value
@Builder
public class FingeringRequest {
    /** Time-ordered events. */
    @Singular
    List<MusicalEvent> events;
    /** Bellows state before the first event. */
    @Builder.Default
    BellowsDirection startBellows = BellowsDirection.NEUTRAL;
    /** Resting centroid row override; the keyboard middle is used when absent. */
    Double restingRow;
    /** Resting centroid column override; the keyboard middle is used when absent. */
    Double restingColumn;
    /** Search algorithm to execute. */
    @Builder.Default
    FingeringAlgorithm algorithm = FingeringAlgorithm.A_STAR;
    /** Heuristic mode (must be NONE for Dijkstra). */
    @Builder.Default
    HeuristicType heuristicType = HeuristicType.BOUNDING_BOX;
    /** Per-request budget override; the engine default applies when absent. */
    SearchBudget budget;
    /** Cooperative cancellation signal polled by the search. */
    BooleanSupplier cancellation;
}
