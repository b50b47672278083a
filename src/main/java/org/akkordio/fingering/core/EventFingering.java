package org.akkordio.fingering.core;

import java.util.List;

/**
 * Fingering of one event.
 *
 * @param eventIndex zero-based index into the input sequence.
 * @param assignments one entry per distinct pitch, in event order.
 * @param transitionCost cost of moving into this event.
 * @param accumulatedCost cost from the resting hand up to and including this event.
 */
public record EventFingering(int eventIndex, List<FingerAssignment> assignments, double transitionCost, double accumulatedCost) {
    public EventFingering {
        assignments = List.copyOf(assignments);
    }
}
