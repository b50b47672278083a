package org.akkordio.fingering.cost;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Tunable weights of the hand transition cost.
 *
 * <p>Threaded explicitly into the cost model, state generator and heuristic so that two
 * solves with different tunings never share mutable state.</p>
 */
@Value
@Builder(toBuilder = true)
public class FingeringCostConfig {
    /** Multiplier of centroid travel in millimetres. */
    @Builder.Default
    double distanceWeight = 1.0d;
    /** Multiplier of absolute centroid row change. */
    @Builder.Default
    double rowJumpWeight = 2.0d;
    /** Penalty per column of finger inversion. */
    @Builder.Default
    double crossingPenalty = 10.0d;
    /** Extra cost per weak finger striking a note on a strong beat, keyed by finger index. */
    @Builder.Default
    Map<Integer, Double> weakFingerPenalties = Map.of(4, 1.5d, 5, 1.0d);
    /** Factor applied to movement terms when at least one finger keeps its button. */
    @Builder.Default
    double pivotFactor = 0.5d;
    /** Fraction of the distance term removed when the bellows changes direction. */
    @Builder.Default
    double bellowsShiftBonus = 0.25d;
    /** Largest column overlap of an inverted finger pair that is still playable. */
    @Builder.Default
    int maxInversionColumns = 3;
    /** Largest row gap of an inverted finger pair that is still playable. */
    @Builder.Default
    int maxInversionRows = 2;

    public static FingeringCostConfig defaults() {
        return FingeringCostConfig.builder().build();
    }

    /**
     * Weak-finger penalty for one finger, zero when not configured.
     */
    public double weakFingerPenalty(int finger) {
        Double penalty = weakFingerPenalties == null ? null : weakFingerPenalties.get(finger);
        return penalty == null ? 0.0d : penalty;
    }

    /**
     * Validates weight ranges.
     *
     * @throws IllegalArgumentException when any weight is out of range.
     */
    public FingeringCostConfig validate() {
        requireNonNegative(distanceWeight, "distanceWeight");
        requireNonNegative(rowJumpWeight, "rowJumpWeight");
        requireNonNegative(crossingPenalty, "crossingPenalty");
        if (weakFingerPenalties != null) {
            for (Map.Entry<Integer, Double> entry : weakFingerPenalties.entrySet()) {
                int finger = entry.getKey();
                if (finger < 1 || finger > 5) {
                    throw new IllegalArgumentException("weak finger index must be in [1, 5], got " + finger);
                }
                requireNonNegative(entry.getValue(), "weakFingerPenalties[" + finger + "]");
            }
        }
        if (!Double.isFinite(pivotFactor) || pivotFactor <= 0.0d || pivotFactor > 1.0d) {
            throw new IllegalArgumentException("pivotFactor must be in (0, 1], got " + pivotFactor);
        }
        if (!Double.isFinite(bellowsShiftBonus) || bellowsShiftBonus < 0.0d || bellowsShiftBonus >= 1.0d) {
            throw new IllegalArgumentException("bellowsShiftBonus must be in [0, 1), got " + bellowsShiftBonus);
        }
        if (maxInversionColumns < 0 || maxInversionRows < 0) {
            throw new IllegalArgumentException("inversion limits must be >= 0");
        }
        return this;
    }

    private static void requireNonNegative(Double value, String field) {
        if (value == null || !Double.isFinite(value) || value < 0.0d) {
            throw new IllegalArgumentException(field + " must be finite and >= 0, got " + value);
        }
    }
}
