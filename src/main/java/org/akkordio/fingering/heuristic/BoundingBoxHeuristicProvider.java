package org.akkordio.fingering.heuristic;

import org.akkordio.fingering.cost.FingeringCostConfig;
import org.akkordio.fingering.cost.HandCostModel;
import org.akkordio.fingering.layout.KeyboardLayout;
import org.akkordio.fingering.model.BellowsDirection;
import org.akkordio.fingering.model.ButtonPosition;
import org.akkordio.fingering.model.EventNote;
import org.akkordio.fingering.model.FingerState;
import org.akkordio.fingering.model.HandGeometry;
import org.akkordio.fingering.model.MusicalEvent;
import org.akkordio.fingering.model.NodeState;

import java.util.List;
import java.util.Objects;

/**
 * Admissible lower bound built from candidate-button bounding boxes.
 *
 * <p>Every occupied finger of a node for event {@code t} sits on a candidate button of one of
 * event {@code t}'s notes, so the hand centroid lies inside the axis-aligned box of those
 * candidates. The gap between two consecutive boxes therefore bounds the centroid travel and
 * the row change of that transition from below:</p>
 * <pre>
 * bound(t-1, t) = pivot * (hypot(rowGap * rowMm, colGap * colMm) * distanceWeight * bellows
 *                          + rowGap * rowJumpWeight)
 * </pre>
 * <p>{@code bellows} is {@code 1 - bellowsShiftBonus} when event {@code t} reverses air
 * direction (the bellows state before each event is fixed by the event prefix). Disjoint boxes
 * share no button, so no finger can pivot and {@code pivot = 1}. Crossing and weak-finger
 * penalties are non-negative and left out. Rest events contribute zero on both sides.</p>
 */
public final class BoundingBoxHeuristicProvider implements HeuristicProvider {
    private final HandCostModel costModel;

    public BoundingBoxHeuristicProvider(HandCostModel costModel) {
        this.costModel = Objects.requireNonNull(costModel, "costModel");
    }

    @Override
    public HeuristicType type() {
        return HeuristicType.BOUNDING_BOX;
    }

    @Override
    public RemainingCostHeuristic bindSequence(List<MusicalEvent> events, BellowsDirection rootBellows) {
        Objects.requireNonNull(events, "events");
        KeyboardLayout layout = costModel.layout();
        int count = events.size();

        CandidateBox[] boxes = new CandidateBox[count];
        BellowsDirection[] bellowsBefore = new BellowsDirection[count];
        BellowsDirection bellows = rootBellows == null ? BellowsDirection.NEUTRAL : rootBellows;
        for (int t = 0; t < count; t++) {
            MusicalEvent event = events.get(t);
            boxes[t] = CandidateBox.of(event, layout);
            bellowsBefore[t] = bellows;
            bellows = BellowsDirection.resolve(bellows, event.getBellows());
        }

        double[] suffix = new double[count + 1];
        for (int t = count - 1; t >= 1; t--) {
            double pair = 0.0d;
            if (boxes[t - 1] != null && boxes[t] != null) {
                boolean shift = BellowsDirection.isShift(bellowsBefore[t], events.get(t).getBellows());
                pair = boxes[t - 1].gapCost(boxes[t], shift, costModel);
            }
            suffix[t] = suffix[t + 1] + pair;
        }
        return new BoundSequence(events, boxes, suffix, costModel);
    }

    private static final class BoundSequence implements RemainingCostHeuristic {
        private final List<MusicalEvent> events;
        private final CandidateBox[] boxes;
        private final double[] suffix;
        private final HandCostModel costModel;

        private BoundSequence(List<MusicalEvent> events, CandidateBox[] boxes, double[] suffix, HandCostModel costModel) {
            this.events = events;
            this.boxes = boxes;
            this.suffix = suffix;
            this.costModel = costModel;
        }

        @Override
        public double estimate(NodeState node) {
            int next = node.eventIndex() + 1;
            if (next >= boxes.length) {
                return 0.0d;
            }
            double first = 0.0d;
            CandidateBox box = boxes[next];
            if (box != null) {
                HandGeometry geometry = node.geometry();
                CandidateBox here = CandidateBox.point(geometry.centroidRow(), geometry.centroidColumn());
                boolean shift = BellowsDirection.isShift(node.bellows(), events.get(next).getBellows());
                first = here.gapCost(box, shift, costModel);
                if (box.containsAnyButton(node.fingers())) {
                    first *= costModel.config().getPivotFactor();
                }
            }
            return first + suffix[next + 1];
        }
    }

    /**
     * Axis-aligned box in button coordinates.
     */
    private record CandidateBox(double minRow, double maxRow, double minColumn, double maxColumn) {

        private static CandidateBox of(MusicalEvent event, KeyboardLayout layout) {
            if (event.isRest()) {
                return null;
            }
            double minRow = Double.POSITIVE_INFINITY;
            double maxRow = Double.NEGATIVE_INFINITY;
            double minColumn = Double.POSITIVE_INFINITY;
            double maxColumn = Double.NEGATIVE_INFINITY;
            for (EventNote note : event.getNotes()) {
                for (ButtonPosition position : layout.candidates(note.midi())) {
                    minRow = Math.min(minRow, position.row());
                    maxRow = Math.max(maxRow, position.row());
                    minColumn = Math.min(minColumn, position.column());
                    maxColumn = Math.max(maxColumn, position.column());
                }
            }
            return new CandidateBox(minRow, maxRow, minColumn, maxColumn);
        }

        private static CandidateBox point(double row, double column) {
            return new CandidateBox(row, row, column, column);
        }

        private double gapCost(CandidateBox other, boolean bellowsShift, HandCostModel costModel) {
            FingeringCostConfig config = costModel.config();
            KeyboardLayout layout = costModel.layout();
            double rowGap = Math.max(0.0d, Math.max(minRow - other.maxRow, other.minRow - maxRow));
            double columnGap = Math.max(0.0d, Math.max(minColumn - other.maxColumn, other.minColumn - maxColumn));
            double distance = Math.hypot(rowGap * layout.rowSpacingMm(), columnGap * layout.columnSpacingMm());
            double distanceTerm = distance * config.getDistanceWeight();
            if (bellowsShift) {
                distanceTerm *= 1.0d - config.getBellowsShiftBonus();
            }
            return distanceTerm + rowGap * config.getRowJumpWeight();
        }

        private boolean containsAnyButton(List<FingerState> fingers) {
            for (FingerState finger : fingers) {
                if (finger.isFree()) {
                    continue;
                }
                ButtonPosition position = finger.position();
                if (position.row() >= minRow && position.row() <= maxRow
                        && position.column() >= minColumn && position.column() <= maxColumn) {
                    return true;
                }
            }
            return false;
        }
    }
}
