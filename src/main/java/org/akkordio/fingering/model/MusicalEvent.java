package org.akkordio.fingering.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * One time-slice of the right-hand part.
 *
 * <p>Notes keep the order supplied by the score parser. An event without notes is a rest:
 * every finger not holding a tie is released.</p>
 */
@Value
@Builder
public class MusicalEvent {
    /** Sounding notes in parser order. */
    @Singular
    List<EventNote> notes;
    /** Bellows hint for this event. */
    @Builder.Default
    BellowsDirection bellows = BellowsDirection.UNSPECIFIED;
    /** True when the event falls on a metrically strong beat. */
    boolean strongBeat;

    /**
     * Returns notes flagged as tied from the previous event.
     */
    public List<EventNote> heldNotes() {
        List<EventNote> held = new ArrayList<>();
        for (EventNote note : notes) {
            if (note.tiedFromPrevious()) {
                held.add(note);
            }
        }
        return held;
    }

    /**
     * Returns notes struck fresh in this event.
     */
    public List<EventNote> newNotes() {
        List<EventNote> fresh = new ArrayList<>();
        for (EventNote note : notes) {
            if (!note.tiedFromPrevious()) {
                fresh.add(note);
            }
        }
        return fresh;
    }

    public boolean isRest() {
        return notes.isEmpty();
    }

    /**
     * Convenience factory for an event of freshly struck pitches.
     */
    public static MusicalEvent of(int... midis) {
        MusicalEventBuilder builder = MusicalEvent.builder();
        for (int midi : midis) {
            builder.note(EventNote.struck(midi));
        }
        return builder.build();
    }
}
