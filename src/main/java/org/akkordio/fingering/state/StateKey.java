package org.akkordio.fingering.state;

import org.akkordio.fingering.model.FingerState;
import org.akkordio.fingering.model.NodeState;

import java.util.Arrays;

/**
 * Deterministic closed-set key of a node: event index plus per-finger status, button and pitch.
 *
 * <p>When every finger is free (rests, the resting hand) the centroid is inherited from the
 * path rather than derived from the fingers, so its row and column bits join the key.</p>
 *
 * <p>Bellows state and hold counters are not part of the key; both are fixed by the event
 * prefix, so two nodes with equal keys always share them.</p>
 */
public final class StateKey {
    private static final int FIELDS_PER_FINGER = 4;
    private static final int FINGER_FIELDS = FingerState.FINGER_COUNT * FIELDS_PER_FINGER;
    private static final int CENTROID_FIELDS = 4;

    private final int eventIndex;
    private final int[] fingerFields;
    private final int hash;

    private StateKey(int eventIndex, int[] fingerFields) {
        this.eventIndex = eventIndex;
        this.fingerFields = fingerFields;
        this.hash = 31 * eventIndex + Arrays.hashCode(fingerFields);
    }

    /**
     * Builds the key of one node.
     */
    public static StateKey of(NodeState node) {
        boolean allFree = true;
        for (FingerState finger : node.fingers()) {
            allFree &= finger.isFree();
        }
        int[] fields = new int[allFree ? FINGER_FIELDS + CENTROID_FIELDS : FINGER_FIELDS];
        int cursor = 0;
        for (FingerState finger : node.fingers()) {
            fields[cursor++] = finger.status().ordinal();
            fields[cursor++] = finger.isFree() ? -1 : finger.position().row();
            fields[cursor++] = finger.isFree() ? -1 : finger.position().column();
            fields[cursor++] = finger.midi();
        }
        if (allFree) {
            cursor = putBits(fields, cursor, node.geometry().centroidRow());
            putBits(fields, cursor, node.geometry().centroidColumn());
        }
        return new StateKey(node.eventIndex(), fields);
    }

    private static int putBits(int[] fields, int cursor, double value) {
        long bits = Double.doubleToLongBits(value == 0.0d ? 0.0d : value);
        fields[cursor++] = (int) (bits >>> 32);
        fields[cursor++] = (int) bits;
        return cursor;
    }

    public int eventIndex() {
        return eventIndex;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof StateKey that)) {
            return false;
        }
        return eventIndex == that.eventIndex && Arrays.equals(fingerFields, that.fingerFields);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "StateKey{event=" + eventIndex + ", fingers=" + Arrays.toString(fingerFields) + '}';
    }
}
