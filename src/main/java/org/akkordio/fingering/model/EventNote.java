package org.akkordio.fingering.model;

/**
 * One sounding pitch inside a {@link MusicalEvent}.
 *
 * @param midi MIDI pitch number.
 * @param tiedFromPrevious true when the pitch is sustained from the previous event by the same finger.
 */
public record EventNote(int midi, boolean tiedFromPrevious) {
    public EventNote {
        if (midi < 0 || midi > 127) {
            throw new IllegalArgumentException("midi must be in [0, 127], got " + midi);
        }
    }

    public static EventNote struck(int midi) {
        return new EventNote(midi, false);
    }

    public static EventNote tied(int midi) {
        return new EventNote(midi, true);
    }
}
