package org.akkordio.fingering.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.akkordio.fingering.heuristic.HeuristicType;
import org.akkordio.fingering.search.SearchTermination;

import java.util.List;
import java.util.Locale;

/**
 * Client-facing fingering result.
 *
 * <p>When {@code complete=false} the event list stops at the furthest event the search could
 * place. {@code optimal=false} marks results cut short by a budget or trimmed by the beam.</p>
 */
@Value
@Builder
public class FingeringSolution {
    /** Layout the solution was computed for. */
    String layoutId;
    /** Search algorithm that produced this solution. */
    FingeringAlgorithm algorithm;
    /** Heuristic bound during the search. */
    HeuristicType heuristicType;
    /** Total accumulated transition cost. */
    double totalCost;
    /** Whether every input event is fingered. */
    boolean complete;
    /** Whether the cost is guaranteed minimal. */
    boolean optimal;
    /** Why the search stopped. */
    SearchTermination termination;
    /** Expanded search nodes. */
    int expandedNodes;
    /** Generated search nodes. */
    int generatedNodes;
    /** Largest open-set size. */
    int peakFrontierSize;
    /** Per-event fingerings in input order. */
    @Singular
    List<EventFingering> events;

    /**
     * Stable algorithm identifier, for example {@code a-star/bounding-box}.
     */
    public String getAlgorithmId() {
        return (algorithm.name() + "/" + heuristicType.name()).toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
