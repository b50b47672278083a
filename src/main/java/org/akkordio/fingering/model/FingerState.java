package org.akkordio.fingering.model;

import java.util.Objects;

/**
 * State of one finger inside a hand configuration.
 *
 * @param finger finger index, 1 (thumb) to 5 (pinky).
 * @param status occupation state.
 * @param position occupied button, {@code null} when free.
 * @param midi occupied pitch, {@link #NO_PITCH} when free.
 * @param heldEvents consecutive events the current pitch has been sustained.
 */
public record FingerState(int finger, FingerStatus status, ButtonPosition position, int midi, int heldEvents) {
    public static final int THUMB = 1;
    public static final int PINKY = 5;
    public static final int FINGER_COUNT = 5;
    public static final int NO_PITCH = -1;

    public FingerState {
        if (finger < THUMB || finger > PINKY) {
            throw new IllegalArgumentException("finger must be in [1, 5], got " + finger);
        }
        Objects.requireNonNull(status, "status");
        if (status == FingerStatus.FREE) {
            if (position != null || midi != NO_PITCH) {
                throw new IllegalArgumentException("free finger " + finger + " cannot occupy a button");
            }
        } else if (position == null || midi == NO_PITCH) {
            throw new IllegalArgumentException("finger " + finger + " is " + status + " but has no button");
        }
        if (heldEvents < 0) {
            throw new IllegalArgumentException("heldEvents must be >= 0");
        }
    }

    public static FingerState free(int finger) {
        return new FingerState(finger, FingerStatus.FREE, null, NO_PITCH, 0);
    }

    public static FingerState pressing(int finger, ButtonPosition position, int midi) {
        return new FingerState(finger, FingerStatus.PRESSING, position, midi, 0);
    }

    /**
     * Returns the state of this finger after sustaining its pitch into the next event.
     */
    public FingerState hold() {
        if (isFree()) {
            throw new IllegalStateException("finger " + finger + " has nothing to hold");
        }
        return new FingerState(finger, FingerStatus.LOCKED_HOLDING, position, midi, heldEvents + 1);
    }

    public boolean isFree() {
        return status == FingerStatus.FREE;
    }
}
