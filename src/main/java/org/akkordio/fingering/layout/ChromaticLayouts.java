package org.akkordio.fingering.layout;

import lombok.experimental.UtilityClass;

/**
 * Builders for standard chromatic treble layouts.
 *
 * <p>Both systems raise pitch by one semitone per row and a whole tone per column, so every
 * pitch reachable from the third row onwards also exists on a lower row (duplicate buttons).</p>
 */
@UtilityClass
public final class ChromaticLayouts {
    public static final int C_SYSTEM_START_MIDI = 48;
    public static final int B_SYSTEM_START_MIDI = 47;

    private static final int SEMITONES_PER_ROW = 1;
    private static final int SEMITONES_PER_COLUMN = 2;

    /**
     * Standard 5-row C-system with default spacing.
     */
    public static KeyboardLayout cSystem(int rows, int columns) {
        return chromatic("c-system-" + rows + "x" + columns, rows, columns, C_SYSTEM_START_MIDI,
                KeyboardLayout.DEFAULT_ROW_SPACING_MM, KeyboardLayout.DEFAULT_COLUMN_SPACING_MM,
                KeyboardLayout.DEFAULT_MAX_HAND_SPAN_MM);
    }

    /**
     * Standard B-system (bayan) with default spacing.
     */
    public static KeyboardLayout bSystem(int rows, int columns) {
        return chromatic("b-system-" + rows + "x" + columns, rows, columns, B_SYSTEM_START_MIDI,
                KeyboardLayout.DEFAULT_ROW_SPACING_MM, KeyboardLayout.DEFAULT_COLUMN_SPACING_MM,
                KeyboardLayout.DEFAULT_MAX_HAND_SPAN_MM);
    }

    /**
     * Generic chromatic grid: {@code midi = startMidi + row + 2 * column}.
     */
    public static KeyboardLayout chromatic(
            String layoutId,
            int rows,
            int columns,
            int startMidi,
            double rowSpacingMm,
            double columnSpacingMm,
            double maxHandSpanMm
    ) {
        if (rows <= 0 || columns <= 0) {
            throw new IllegalArgumentException("rows and columns must be > 0");
        }
        int highest = startMidi + (rows - 1) * SEMITONES_PER_ROW + (columns - 1) * SEMITONES_PER_COLUMN;
        if (startMidi < 0 || highest > 127) {
            throw new IllegalArgumentException("layout range [" + startMidi + ", " + highest + "] exceeds MIDI range");
        }
        KeyboardLayout.Builder builder = KeyboardLayout.builder()
                .layoutId(layoutId)
                .rowSpacingMm(rowSpacingMm)
                .columnSpacingMm(columnSpacingMm)
                .maxHandSpanMm(maxHandSpanMm);
        for (int row = 0; row < rows; row++) {
            for (int column = 0; column < columns; column++) {
                builder.button(row, column, startMidi + row * SEMITONES_PER_ROW + column * SEMITONES_PER_COLUMN);
            }
        }
        return builder.build();
    }
}
