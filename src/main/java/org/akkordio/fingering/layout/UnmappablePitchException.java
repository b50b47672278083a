package org.akkordio.fingering.layout;

import lombok.Getter;
import org.akkordio.fingering.FingeringException;

/**
 * Thrown when a pitch has no button on the active layout.
 *
 * <p>Fatal for a solve: the pitch cannot be played on this instrument, so no fingering exists.</p>
 */
@Getter
public final class UnmappablePitchException extends FingeringException {
    public static final String REASON_UNMAPPABLE_PITCH = "FG_UNMAPPABLE_PITCH";

    private final int midi;
    private final String layoutId;

    /**
     * Creates an unmappable-pitch failure for one layout.
     *
     * @param midi offending MIDI pitch.
     * @param layoutId identifier of the layout that was queried.
     */
    public UnmappablePitchException(int midi, String layoutId) {
        super(REASON_UNMAPPABLE_PITCH,
                "MIDI " + midi + " (" + PitchNames.name(midi) + ") has no button on layout " + layoutId);
        this.midi = midi;
        this.layoutId = layoutId;
    }
}
