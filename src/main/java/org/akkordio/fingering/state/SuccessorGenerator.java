package org.akkordio.fingering.state;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import lombok.extern.slf4j.Slf4j;
import org.akkordio.fingering.cost.HandCostModel;
import org.akkordio.fingering.layout.KeyboardLayout;
import org.akkordio.fingering.model.BellowsDirection;
import org.akkordio.fingering.model.ButtonPosition;
import org.akkordio.fingering.model.EventNote;
import org.akkordio.fingering.model.FingerState;
import org.akkordio.fingering.model.HandGeometry;
import org.akkordio.fingering.model.MusicalEvent;
import org.akkordio.fingering.model.NodeState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Enumerates legal successor hand configurations for the next event.
 *
 * <p>Execution flow for one call:</p>
 * <ul>
 * <li>Lock every finger that must sustain a tied pitch. A tie with no holding finger kills the branch.</li>
 * <li>Enumerate every injective assignment of free fingers to the fresh notes, crossed with each
 * note's candidate buttons. Surplus fingers stay free.</li>
 * <li>Drop configurations whose span exceeds the layout limit or whose finger inversion is
 * anatomically impossible.</li>
 * </ul>
 * <p>Successors are returned unscored ({@code g = h = 0}, no parent) in a deterministic order:
 * notes in event order, fingers thumb to pinky, buttons in layout order.</p>
 */
@Slf4j
public final class SuccessorGenerator {
    private final HandCostModel costModel;
    private final KeyboardLayout layout;
    private final double maxSpanMm;

    public SuccessorGenerator(HandCostModel costModel) {
        this.costModel = Objects.requireNonNull(costModel, "costModel");
        this.layout = costModel.layout();
        this.maxSpanMm = layout.maxHandSpanMm();
    }

    /**
     * Creates the root node: all fingers free, hand resting over the given point.
     */
    public NodeState restingNode(double row, double column, BellowsDirection bellows) {
        List<FingerState> fingers = new ArrayList<>(FingerState.FINGER_COUNT);
        for (int finger = FingerState.THUMB; finger <= FingerState.PINKY; finger++) {
            fingers.add(FingerState.free(finger));
        }
        BellowsDirection initial = BellowsDirection.resolve(BellowsDirection.NEUTRAL, bellows);
        return new NodeState(
                fingers,
                HandGeometry.resting(row, column),
                initial,
                NodeState.START_EVENT_INDEX,
                NodeState.NO_PARENT,
                0.0d,
                0.0d
        );
    }

    /**
     * Returns every legal configuration that plays {@code target} after {@code current}.
     *
     * @return successors accounting for event {@code current.eventIndex() + 1}; empty when the branch dies.
     * @throws org.akkordio.fingering.layout.UnmappablePitchException when a fresh note has no button.
     */
    public List<NodeState> successors(NodeState current, MusicalEvent target) {
        Objects.requireNonNull(current, "current");
        Objects.requireNonNull(target, "target");
        int targetIndex = current.eventIndex() + 1;

        FingerState[] slots = new FingerState[FingerState.FINGER_COUNT];
        IntOpenHashSet heldPitches = new IntOpenHashSet();
        for (EventNote note : target.heldNotes()) {
            if (!heldPitches.add(note.midi())) {
                continue;
            }
            FingerState holder = current.fingerHolding(note.midi());
            if (holder == null) {
                log.debug("event {}: tied MIDI {} has no holding finger, branch pruned", targetIndex, note.midi());
                return List.of();
            }
            slots[holder.finger() - 1] = holder.hold();
        }

        IntArrayList freshPitches = new IntArrayList();
        IntOpenHashSet seenFresh = new IntOpenHashSet();
        for (EventNote note : target.newNotes()) {
            if (!heldPitches.contains(note.midi()) && seenFresh.add(note.midi())) {
                freshPitches.add(note.midi());
            }
        }

        IntArrayList freeFingers = new IntArrayList();
        for (int finger = FingerState.THUMB; finger <= FingerState.PINKY; finger++) {
            if (slots[finger - 1] == null) {
                freeFingers.add(finger);
            }
        }
        if (freshPitches.size() > freeFingers.size()) {
            log.debug("event {}: {} fresh notes but only {} free fingers, branch pruned",
                    targetIndex, freshPitches.size(), freeFingers.size());
            return List.of();
        }

        List<List<ButtonPosition>> candidates = new ArrayList<>(freshPitches.size());
        for (int i = 0; i < freshPitches.size(); i++) {
            candidates.add(layout.candidates(freshPitches.getInt(i)));
        }

        BellowsDirection bellows = BellowsDirection.resolve(current.bellows(), target.getBellows());
        Enumeration enumeration = new Enumeration(current, targetIndex, bellows, freshPitches, candidates, freeFingers);
        enumeration.assign(0, slots, new boolean[FingerState.FINGER_COUNT + 1]);

        if (log.isDebugEnabled() && enumeration.pruned > 0) {
            log.debug("event {}: {} successors kept, {} pruned by span/inversion limits",
                    targetIndex, enumeration.results.size(), enumeration.pruned);
        }
        return enumeration.results;
    }

    /**
     * Recursive bipartite assignment of fresh notes to free fingers and buttons.
     */
    private final class Enumeration {
        private final NodeState current;
        private final int targetIndex;
        private final BellowsDirection bellows;
        private final IntArrayList pitches;
        private final List<List<ButtonPosition>> candidates;
        private final IntArrayList freeFingers;
        private final List<NodeState> results = new ArrayList<>();
        private int pruned;

        private Enumeration(
                NodeState current,
                int targetIndex,
                BellowsDirection bellows,
                IntArrayList pitches,
                List<List<ButtonPosition>> candidates,
                IntArrayList freeFingers
        ) {
            this.current = current;
            this.targetIndex = targetIndex;
            this.bellows = bellows;
            this.pitches = pitches;
            this.candidates = candidates;
            this.freeFingers = freeFingers;
        }

        private void assign(int noteIndex, FingerState[] slots, boolean[] usedFinger) {
            if (noteIndex == pitches.size()) {
                emit(slots);
                return;
            }
            int midi = pitches.getInt(noteIndex);
            for (int f = 0; f < freeFingers.size(); f++) {
                int finger = freeFingers.getInt(f);
                if (usedFinger[finger]) {
                    continue;
                }
                for (ButtonPosition position : candidates.get(noteIndex)) {
                    if (isOccupied(slots, position)) {
                        continue;
                    }
                    if (exceedsSpan(slots, position)) {
                        pruned++;
                        continue;
                    }
                    slots[finger - 1] = FingerState.pressing(finger, position, midi);
                    usedFinger[finger] = true;
                    assign(noteIndex + 1, slots, usedFinger);
                    usedFinger[finger] = false;
                    slots[finger - 1] = null;
                }
            }
        }

        private void emit(FingerState[] slots) {
            FingerState[] fingers = Arrays.copyOf(slots, slots.length);
            for (int i = 0; i < fingers.length; i++) {
                if (fingers[i] == null) {
                    fingers[i] = FingerState.free(i + 1);
                }
            }
            List<FingerState> fingerList = List.of(fingers);
            HandGeometry previous = current.geometry();
            NodeState candidate = new NodeState(
                    fingerList,
                    costModel.measure(fingerList, previous.centroidRow(), previous.centroidColumn()),
                    bellows,
                    targetIndex,
                    NodeState.NO_PARENT,
                    0.0d,
                    0.0d
            );
            if (costModel.span(candidate) > maxSpanMm || costModel.isInversionImpossible(candidate)) {
                pruned++;
                return;
            }
            results.add(candidate);
        }

        private boolean isOccupied(FingerState[] slots, ButtonPosition position) {
            for (FingerState slot : slots) {
                if (slot != null && position.equals(slot.position())) {
                    return true;
                }
            }
            return false;
        }

        /**
         * Early span check against already placed fingers; the full filter runs again on emit.
         */
        private boolean exceedsSpan(FingerState[] slots, ButtonPosition position) {
            for (FingerState slot : slots) {
                if (slot == null) {
                    continue;
                }
                double rowMm = (slot.position().row() - position.row()) * layout.rowSpacingMm();
                double columnMm = (slot.position().column() - position.column()) * layout.columnSpacingMm();
                if (Math.hypot(rowMm, columnMm) > maxSpanMm) {
                    return true;
                }
            }
            return false;
        }
    }
}
