package org.akkordio.fingering.testutil;

import org.akkordio.fingering.model.BellowsDirection;
import org.akkordio.fingering.model.EventNote;
import org.akkordio.fingering.model.MusicalEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Seeded random event sequences with ties, rests, bellows hints and strong beats.
 */
public final class RandomSequences {
    private RandomSequences() {
    }

    /**
     * Builds a sequence of up to two-note events with pitches in {@code [lowMidi, highMidi]}.
     */
    public static List<MusicalEvent> melody(Random random, int length, int lowMidi, int highMidi) {
        return melody(random, length, lowMidi, highMidi, 2, 8);
    }

    /**
     * Builds a sequence of single struck notes (plus an occasional tie) with a rest roughly every
     * {@code restOneIn} events. Small enough for exhaustive enumeration.
     */
    public static List<MusicalEvent> sparseMelody(Random random, int length, int lowMidi, int highMidi, int restOneIn) {
        return melody(random, length, lowMidi, highMidi, 1, restOneIn);
    }

    private static List<MusicalEvent> melody(
            Random random,
            int length,
            int lowMidi,
            int highMidi,
            int maxFresh,
            int restOneIn
    ) {
        List<MusicalEvent> events = new ArrayList<>(length);
        List<Integer> previous = List.of();
        for (int i = 0; i < length; i++) {
            MusicalEvent.MusicalEventBuilder builder = MusicalEvent.builder()
                    .strongBeat(i % 4 == 0)
                    .bellows(randomBellows(random));
            List<Integer> pitches = new ArrayList<>();
            if (i > 0 && random.nextInt(restOneIn) == 0) {
                events.add(builder.build());
                previous = List.of();
                continue;
            }
            if (!previous.isEmpty() && random.nextInt(3) == 0) {
                int tied = previous.get(random.nextInt(previous.size()));
                builder.note(EventNote.tied(tied));
                pitches.add(tied);
            }
            int fresh = 1 + random.nextInt(pitches.isEmpty() ? maxFresh : 1);
            while (fresh > 0) {
                int midi = lowMidi + random.nextInt(highMidi - lowMidi + 1);
                if (pitches.contains(midi)) {
                    continue;
                }
                builder.note(EventNote.struck(midi));
                pitches.add(midi);
                fresh--;
            }
            events.add(builder.build());
            previous = pitches;
        }
        return events;
    }

    private static BellowsDirection randomBellows(Random random) {
        int roll = random.nextInt(7);
        if (roll == 0) {
            return BellowsDirection.PUSH;
        }
        if (roll == 1) {
            return BellowsDirection.PULL;
        }
        if (roll == 2) {
            return BellowsDirection.NEUTRAL;
        }
        return BellowsDirection.UNSPECIFIED;
    }
}
