package org.akkordio.fingering.model;

/**
 * Integer row/column coordinate of one treble button.
 *
 * @param row zero-based row index (row 0 is nearest the bellows edge).
 * @param column zero-based column index along the keyboard.
 */
public record ButtonPosition(int row, int column) {
    public ButtonPosition {
        if (row < 0 || column < 0) {
            throw new IllegalArgumentException("button coordinates must be >= 0, got (" + row + ", " + column + ")");
        }
    }

    @Override
    public String toString() {
        return "r" + row + "c" + column;
    }
}
