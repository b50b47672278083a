package org.akkordio.fingering.layout;

import lombok.experimental.UtilityClass;

/**
 * MIDI pitch naming helpers (sharps only, scientific octave numbering with C4 = 60).
 */
@UtilityClass
public final class PitchNames {
    private static final String[] NAMES = {"C", "C#", "D", "D#", "E", "F", "F#", "G", "G#", "A", "A#", "B"};

    /**
     * Returns the note name with octave, for example {@code 61 -> C#4}.
     */
    public static String name(int midi) {
        if (midi < 0 || midi > 127) {
            throw new IllegalArgumentException("midi must be in [0, 127], got " + midi);
        }
        int octave = (midi / 12) - 1;
        return NAMES[midi % 12] + octave;
    }
}
