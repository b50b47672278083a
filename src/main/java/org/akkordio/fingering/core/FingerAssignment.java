package org.akkordio.fingering.core;

import org.akkordio.fingering.model.ButtonPosition;

/**
 * One note of one event bound to a finger and a button.
 *
 * @param midi MIDI pitch.
 * @param note pitch name, for example {@code C#4}.
 * @param finger finger index, 1 (thumb) to 5 (pinky).
 * @param button pressed button.
 * @param crossing whether the finger is part of an inverted pair in this event.
 * @param held whether the note is sustained from the previous event.
 */
public record FingerAssignment(int midi, String note, int finger, ButtonPosition button, boolean crossing, boolean held) {
}
