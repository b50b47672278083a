package org.akkordio.fingering.model;

import java.util.List;
import java.util.Objects;

/**
 * Search vertex: one full hand configuration after accounting for a prefix of the event sequence.
 *
 * <p>Nodes are immutable. Parents are referenced by arena index rather than by object reference,
 * so a finished search can be walked backwards without holding a linked chain of nodes.</p>
 *
 * @param fingers exactly five finger states ordered thumb to pinky.
 * @param geometry derived hand geometry.
 * @param bellows bellows state after the last accounted event.
 * @param eventIndex index of the last accounted event, {@link #START_EVENT_INDEX} for the resting hand.
 * @param parentIndex arena index of the parent node, {@link #NO_PARENT} when unscored or root.
 * @param g accumulated cost from the resting hand.
 * @param h admissible estimate of the remaining cost.
 */
public record NodeState(
        List<FingerState> fingers,
        HandGeometry geometry,
        BellowsDirection bellows,
        int eventIndex,
        int parentIndex,
        double g,
        double h
) {
    public static final int START_EVENT_INDEX = -1;
    public static final int NO_PARENT = -1;

    public NodeState {
        fingers = List.copyOf(Objects.requireNonNull(fingers, "fingers"));
        if (fingers.size() != FingerState.FINGER_COUNT) {
            throw new IllegalArgumentException("node must carry exactly 5 fingers, got " + fingers.size());
        }
        for (int i = 0; i < FingerState.FINGER_COUNT; i++) {
            if (fingers.get(i).finger() != i + 1) {
                throw new IllegalArgumentException(
                        "finger slot " + i + " holds finger " + fingers.get(i).finger() + ", expected " + (i + 1)
                );
            }
        }
        Objects.requireNonNull(geometry, "geometry");
        Objects.requireNonNull(bellows, "bellows");
        if (eventIndex < START_EVENT_INDEX) {
            throw new IllegalArgumentException("eventIndex must be >= -1, got " + eventIndex);
        }
    }

    /**
     * Total priority {@code g + h}.
     */
    public double f() {
        return g + h;
    }

    /**
     * Returns the state of finger {@code finger} (1 to 5).
     */
    public FingerState finger(int finger) {
        return fingers.get(finger - 1);
    }

    /**
     * Returns the non-free finger currently sounding {@code midi}, or {@code null}.
     */
    public FingerState fingerHolding(int midi) {
        for (FingerState state : fingers) {
            if (!state.isFree() && state.midi() == midi) {
                return state;
            }
        }
        return null;
    }

    public boolean isStart() {
        return eventIndex == START_EVENT_INDEX;
    }

    /**
     * Returns a copy carrying search bookkeeping.
     */
    public NodeState withSearchScores(int parentIndex, double g, double h) {
        return new NodeState(fingers, geometry, bellows, eventIndex, parentIndex, g, h);
    }
}
