package org.akkordio.fingering.core;

import lombok.Getter;
import org.akkordio.fingering.FingeringException;

/**
 * Thrown when every branch died before the last event.
 *
 * <p>Carries the furthest-progressed partial solution; {@link #getFailedEventIndex()} is the
 * first event no surviving configuration could play.</p>
 */
@Getter
public final class NoFeasiblePathException extends FingeringException {
    private final transient FingeringSolution partialSolution;
    private final int failedEventIndex;

    public NoFeasiblePathException(FingeringSolution partialSolution, int failedEventIndex) {
        super(
                FingeringEngine.REASON_NO_FEASIBLE_PATH,
                "no physically feasible fingering reaches event " + failedEventIndex
                        + " (" + partialSolution.getEvents().size() + " events placed)"
        );
        this.partialSolution = partialSolution;
        this.failedEventIndex = failedEventIndex;
    }
}
