package org.akkordio.fingering.model;

/**
 * Derived geometry of one hand configuration.
 *
 * @param centroidRow mean row of all non-free fingers (resting row when every finger is free).
 * @param centroidColumn mean column of all non-free fingers (resting column when every finger is free).
 * @param spanMm maximum pairwise physical distance between non-free fingers.
 * @param wristAngleDegrees angle of the lowest-to-highest occupied finger vector; diagnostic only.
 */
public record HandGeometry(double centroidRow, double centroidColumn, double spanMm, double wristAngleDegrees) {

    /**
     * Geometry of an idle hand resting over one point of the keyboard.
     */
    public static HandGeometry resting(double row, double column) {
        return new HandGeometry(row, column, 0.0d, 0.0d);
    }
}
