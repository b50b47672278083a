package org.akkordio.fingering.cost;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.akkordio.fingering.layout.KeyboardLayout;
import org.akkordio.fingering.model.BellowsDirection;
import org.akkordio.fingering.model.FingerState;
import org.akkordio.fingering.model.FingerStatus;
import org.akkordio.fingering.model.HandGeometry;
import org.akkordio.fingering.model.MusicalEvent;
import org.akkordio.fingering.model.NodeState;

import java.util.List;
import java.util.Objects;

/**
 * Biomechanical transition cost between two hand configurations.
 * <p>
 * Canonical composition, evaluated in this order:
 * </p>
 * <pre>
 * distance_term = centroid_distance_mm * distance_weight
 * row_term      = |delta centroid row| * row_jump_weight
 * penalties     = crossing_severity * crossing_penalty + weak_finger_penalties (strong beats only)
 * pivot         : distance_term and row_term *= pivot_factor when a finger keeps its button
 * bellows shift : distance_term *= (1 - bellows_shift_bonus) when the event reverses air direction
 * edge_cost     = max(0, distance_term + row_term + penalties)
 * </pre>
 * <p>
 * Instances are immutable and safe to share between concurrent solves.
 * </p>
 */
@Accessors(fluent = true)
public final class HandCostModel {

    @Getter
    private final KeyboardLayout layout;
    @Getter
    private final FingeringCostConfig config;
    private final double rowSpacingMm;
    private final double columnSpacingMm;

    public HandCostModel(KeyboardLayout layout, FingeringCostConfig config) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.config = Objects.requireNonNull(config, "config").validate();
        this.rowSpacingMm = layout.rowSpacingMm();
        this.columnSpacingMm = layout.columnSpacingMm();
    }

    /**
     * Derives hand geometry from finger states.
     *
     * <p>When every finger is free the hand is assumed to hover where it last was, so the
     * supplied resting point becomes the centroid.</p>
     */
    public HandGeometry measure(List<FingerState> fingers, double restingRow, double restingColumn) {
        int occupied = 0;
        double rowSum = 0.0d;
        double columnSum = 0.0d;
        FingerState lowest = null;
        FingerState highest = null;
        for (FingerState finger : fingers) {
            if (finger.isFree()) {
                continue;
            }
            occupied++;
            rowSum += finger.position().row();
            columnSum += finger.position().column();
            if (lowest == null) {
                lowest = finger;
            }
            highest = finger;
        }
        if (occupied == 0) {
            return HandGeometry.resting(restingRow, restingColumn);
        }
        double wristAngle = 0.0d;
        if (occupied > 1) {
            double dx = (highest.position().column() - lowest.position().column()) * columnSpacingMm;
            double dy = (highest.position().row() - lowest.position().row()) * rowSpacingMm;
            wristAngle = Math.toDegrees(Math.atan2(dy, dx));
        }
        return new HandGeometry(rowSum / occupied, columnSum / occupied, spanOf(fingers), wristAngle);
    }

    /**
     * Euclidean distance in millimetres between two hand centroids.
     */
    public double distance(HandGeometry from, HandGeometry to) {
        double rowMm = (to.centroidRow() - from.centroidRow()) * rowSpacingMm;
        double columnMm = (to.centroidColumn() - from.centroidColumn()) * columnSpacingMm;
        return Math.hypot(rowMm, columnMm);
    }

    /**
     * Maximum pairwise physical distance between non-free fingers of a node.
     */
    public double span(NodeState node) {
        return spanOf(node.fingers());
    }

    /**
     * Maximum pairwise physical distance between non-free fingers.
     */
    public double spanOf(List<FingerState> fingers) {
        double max = 0.0d;
        for (int i = 0; i < fingers.size(); i++) {
            FingerState a = fingers.get(i);
            if (a.isFree()) {
                continue;
            }
            for (int j = i + 1; j < fingers.size(); j++) {
                FingerState b = fingers.get(j);
                if (b.isFree()) {
                    continue;
                }
                double rowMm = (a.position().row() - b.position().row()) * rowSpacingMm;
                double columnMm = (a.position().column() - b.position().column()) * columnSpacingMm;
                max = Math.max(max, Math.hypot(rowMm, columnMm));
            }
        }
        return max;
    }

    /**
     * Returns true when a lower-index finger sits at a strictly higher column than a higher-index finger.
     */
    public boolean isGeometricInversion(NodeState node) {
        return crossingSeverity(node) > 0;
    }

    /**
     * Sum, over all inverted finger pairs, of the number of columns by which they overlap.
     */
    public int crossingSeverity(NodeState node) {
        List<FingerState> fingers = node.fingers();
        int severity = 0;
        for (int i = 0; i < fingers.size(); i++) {
            FingerState lower = fingers.get(i);
            if (lower.isFree()) {
                continue;
            }
            for (int j = i + 1; j < fingers.size(); j++) {
                FingerState higher = fingers.get(j);
                if (higher.isFree()) {
                    continue;
                }
                int overlap = lower.position().column() - higher.position().column();
                if (overlap > 0) {
                    severity += overlap;
                }
            }
        }
        return severity;
    }

    /**
     * Returns true when any inverted pair exceeds the configured anatomical limits.
     */
    public boolean isInversionImpossible(NodeState node) {
        List<FingerState> fingers = node.fingers();
        for (int i = 0; i < fingers.size(); i++) {
            FingerState lower = fingers.get(i);
            if (lower.isFree()) {
                continue;
            }
            for (int j = i + 1; j < fingers.size(); j++) {
                FingerState higher = fingers.get(j);
                if (higher.isFree()) {
                    continue;
                }
                int overlap = lower.position().column() - higher.position().column();
                if (overlap <= 0) {
                    continue;
                }
                int rowGap = Math.abs(lower.position().row() - higher.position().row());
                if (overlap > config.getMaxInversionColumns() || rowGap > config.getMaxInversionRows()) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Returns whether at least one finger occupies the same button in both nodes.
     */
    public boolean hasPivot(NodeState previous, NodeState next) {
        for (int finger = FingerState.THUMB; finger <= FingerState.PINKY; finger++) {
            FingerState before = previous.finger(finger);
            FingerState after = next.finger(finger);
            if (!before.isFree() && !after.isFree() && before.position().equals(after.position())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Fast-path scalar transition cost.
     *
     * @return non-negative finite cost of moving from {@code previous} to {@code next} for {@code event}.
     */
    public double edgeCost(NodeState previous, NodeState next, MusicalEvent event) {
        return computeInternal(previous, next, event, null);
    }

    /**
     * Explainable transition cost. Intended for debugging and tests.
     */
    public CostBreakdown explainEdgeCost(NodeState previous, NodeState next, MusicalEvent event) {
        MutableCostBreakdown breakdown = new MutableCostBreakdown();
        computeInternal(previous, next, event, breakdown);
        return breakdown.toImmutable();
    }

    private double computeInternal(NodeState previous, NodeState next, MusicalEvent event, MutableCostBreakdown out) {
        Objects.requireNonNull(previous, "previous");
        Objects.requireNonNull(next, "next");
        Objects.requireNonNull(event, "event");

        double centroidDistance = distance(previous.geometry(), next.geometry());
        double rowDelta = Math.abs(next.geometry().centroidRow() - previous.geometry().centroidRow());
        double distanceTerm = centroidDistance * config.getDistanceWeight();
        double rowTerm = rowDelta * config.getRowJumpWeight();

        int severity = crossingSeverity(next);
        double crossingTerm = severity * config.getCrossingPenalty();
        double weaknessTerm = event.isStrongBeat() ? weaknessPenalty(next) : 0.0d;

        boolean pivot = hasPivot(previous, next);
        if (pivot) {
            distanceTerm *= config.getPivotFactor();
            rowTerm *= config.getPivotFactor();
        }

        boolean bellowsShift = BellowsDirection.isShift(previous.bellows(), event.getBellows());
        if (bellowsShift) {
            distanceTerm *= 1.0d - config.getBellowsShiftBonus();
        }

        double total = Math.max(0.0d, distanceTerm + rowTerm + crossingTerm + weaknessTerm);
        if (!Double.isFinite(total)) {
            throw new IllegalStateException("edge cost must be finite, got " + total);
        }

        if (out != null) {
            out.centroidDistanceMm = centroidDistance;
            out.distanceTerm = distanceTerm;
            out.rowDelta = rowDelta;
            out.rowTerm = rowTerm;
            out.crossingSeverity = severity;
            out.crossingTerm = crossingTerm;
            out.weaknessTerm = weaknessTerm;
            out.pivotApplied = pivot;
            out.bellowsShiftApplied = bellowsShift;
            out.totalCost = total;
        }
        return total;
    }

    /**
     * Sums weak-finger penalties of fingers striking fresh notes.
     */
    private double weaknessPenalty(NodeState next) {
        double penalty = 0.0d;
        for (FingerState finger : next.fingers()) {
            if (finger.status() == FingerStatus.PRESSING) {
                penalty += config.weakFingerPenalty(finger.finger());
            }
        }
        return penalty;
    }

    /**
     * Immutable explain output of one transition.
     *
     * @param centroidDistanceMm raw centroid travel.
     * @param distanceTerm weighted travel after pivot and bellows discounts.
     * @param rowDelta absolute centroid row change.
     * @param rowTerm weighted row change after pivot discount.
     * @param crossingSeverity summed column overlap of inverted pairs.
     * @param crossingTerm crossing penalty contribution.
     * @param weaknessTerm weak-finger contribution.
     * @param pivotApplied whether a finger kept its button.
     * @param bellowsShiftApplied whether the bellows bonus applied.
     * @param totalCost final clamped cost.
     */
    public record CostBreakdown(
            double centroidDistanceMm,
            double distanceTerm,
            double rowDelta,
            double rowTerm,
            int crossingSeverity,
            double crossingTerm,
            double weaknessTerm,
            boolean pivotApplied,
            boolean bellowsShiftApplied,
            double totalCost
    ) {
    }

    private static final class MutableCostBreakdown {
        private double centroidDistanceMm;
        private double distanceTerm;
        private double rowDelta;
        private double rowTerm;
        private int crossingSeverity;
        private double crossingTerm;
        private double weaknessTerm;
        private boolean pivotApplied;
        private boolean bellowsShiftApplied;
        private double totalCost;

        private CostBreakdown toImmutable() {
            return new CostBreakdown(
                    centroidDistanceMm,
                    distanceTerm,
                    rowDelta,
                    rowTerm,
                    crossingSeverity,
                    crossingTerm,
                    weaknessTerm,
                    pivotApplied,
                    bellowsShiftApplied,
                    totalCost
            );
        }
    }
}
