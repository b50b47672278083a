package org.akkordio.fingering.testutil;

import org.akkordio.fingering.cost.FingeringCostConfig;
import org.akkordio.fingering.cost.HandCostModel;
import org.akkordio.fingering.layout.ChromaticLayouts;
import org.akkordio.fingering.layout.KeyboardLayout;
import org.akkordio.fingering.model.BellowsDirection;
import org.akkordio.fingering.model.ButtonPosition;
import org.akkordio.fingering.model.FingerState;
import org.akkordio.fingering.model.FingerStatus;
import org.akkordio.fingering.model.NodeState;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared layouts and hand configurations for fingering tests.
 */
public final class FingeringFixtures {
    private FingeringFixtures() {
    }

    /**
     * Single button: MIDI 60 at row 2, column 5 with 15 mm / 18 mm spacing.
     */
    public static KeyboardLayout singleButtonLayout() {
        return KeyboardLayout.builder()
                .layoutId("single-c4")
                .rowSpacingMm(15.0d)
                .columnSpacingMm(18.0d)
                .maxHandSpanMm(110.0d)
                .button(2, 5, 60)
                .build();
    }

    /**
     * One row of a C major scale: 60, 62, 64, 65, 67, 69, 71, 72 on columns 0 to 7.
     */
    public static KeyboardLayout scaleRowLayout() {
        int[] scale = {60, 62, 64, 65, 67, 69, 71, 72};
        KeyboardLayout.Builder builder = KeyboardLayout.builder().layoutId("scale-row");
        for (int column = 0; column < scale.length; column++) {
            builder.button(0, column, scale[column]);
        }
        return builder.build();
    }

    /**
     * MIDI 60 at column 0 and MIDI 72 far away at column 10 only.
     */
    public static KeyboardLayout wideLayout() {
        return KeyboardLayout.builder()
                .layoutId("wide")
                .button(0, 0, 60)
                .button(0, 1, 62)
                .button(0, 10, 72)
                .build();
    }

    /**
     * MIDI 72 on a far button (column 10) and a near duplicate (row 1, column 3).
     */
    public static KeyboardLayout duplicateFarNearLayout() {
        return KeyboardLayout.builder()
                .layoutId("far-near")
                .button(0, 0, 60)
                .button(0, 10, 72)
                .button(1, 3, 72)
                .build();
    }

    /**
     * MIDI 60 at both ends of a row (columns 0 and 10) and MIDI 62 at column 12.
     * Playing 60 far from the resting point pays off only after a rest.
     */
    public static KeyboardLayout restDetourLayout() {
        return KeyboardLayout.builder()
                .layoutId("rest-detour")
                .button(0, 0, 60)
                .button(0, 10, 60)
                .button(0, 12, 62)
                .build();
    }

    /**
     * Standard 5x12 C-system.
     */
    public static KeyboardLayout cSystem() {
        return ChromaticLayouts.cSystem(5, 12);
    }

    public static HandCostModel costModel(KeyboardLayout layout) {
        return new HandCostModel(layout, FingeringCostConfig.defaults());
    }

    public static FingerState pressing(int finger, int row, int column, int midi) {
        return FingerState.pressing(finger, new ButtonPosition(row, column), midi);
    }

    public static FingerState holding(int finger, int row, int column, int midi) {
        return new FingerState(finger, FingerStatus.LOCKED_HOLDING, new ButtonPosition(row, column), midi, 1);
    }

    /**
     * Builds a node from the given occupied fingers; every other finger is free.
     */
    public static NodeState node(HandCostModel costModel, int eventIndex, BellowsDirection bellows, FingerState... occupied) {
        FingerState[] slots = new FingerState[FingerState.FINGER_COUNT];
        for (FingerState state : occupied) {
            slots[state.finger() - 1] = state;
        }
        List<FingerState> fingers = new ArrayList<>();
        for (int i = 0; i < slots.length; i++) {
            fingers.add(slots[i] == null ? FingerState.free(i + 1) : slots[i]);
        }
        return new NodeState(
                fingers,
                costModel.measure(fingers, 0.0d, 0.0d),
                bellows,
                eventIndex,
                NodeState.NO_PARENT,
                0.0d,
                0.0d
        );
    }
}
