package org.akkordio.fingering.model;

/**
 * Bellows air direction attached to an event as an input hint.
 *
 * <p>{@code UNSPECIFIED} keeps whatever state the hand was already in; every other value
 * becomes the new bellows state of the node that accounts for the event.</p>
 */
public enum BellowsDirection {
    PUSH,
    PULL,
    NEUTRAL,
    UNSPECIFIED;

    /**
     * Returns the bellows state after applying one event hint to a previous state.
     */
    public static BellowsDirection resolve(BellowsDirection previous, BellowsDirection hint) {
        if (hint == null || hint == UNSPECIFIED) {
            return previous == null ? NEUTRAL : previous;
        }
        return hint;
    }

    /**
     * Returns whether an explicit hint changes the bellows state relative to {@code previous}.
     * Moving to or from {@code NEUTRAL} counts as a change; {@code UNSPECIFIED} never does.
     */
    public static boolean isShift(BellowsDirection previous, BellowsDirection hint) {
        if (hint == null || hint == UNSPECIFIED) {
            return false;
        }
        return hint != resolve(NEUTRAL, previous);
    }
}
