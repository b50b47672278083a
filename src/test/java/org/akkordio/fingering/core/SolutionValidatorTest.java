package org.akkordio.fingering.core;

import org.akkordio.fingering.heuristic.HeuristicType;
import org.akkordio.fingering.layout.KeyboardLayout;
import org.akkordio.fingering.model.ButtonPosition;
import org.akkordio.fingering.model.EventNote;
import org.akkordio.fingering.model.MusicalEvent;
import org.akkordio.fingering.search.SearchTermination;
import org.akkordio.fingering.testutil.FingeringFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Solution Validator Tests")
class SolutionValidatorTest {
    private final KeyboardLayout layout = FingeringFixtures.wideLayout();
    private final SolutionValidator validator = new SolutionValidator(layout);

    private static FingerAssignment assign(int midi, int finger, int row, int column, boolean held) {
        return new FingerAssignment(midi, "n" + midi, finger, new ButtonPosition(row, column), false, held);
    }

    private static FingeringSolution solution(EventFingering... events) {
        FingeringSolution.FingeringSolutionBuilder builder = FingeringSolution.builder()
                .layoutId("wide")
                .algorithm(FingeringAlgorithm.A_STAR)
                .heuristicType(HeuristicType.BOUNDING_BOX)
                .termination(SearchTermination.GOAL_REACHED)
                .complete(true)
                .optimal(true);
        for (EventFingering event : events) {
            builder.event(event);
        }
        return builder.build();
    }

    private static EventFingering fingering(int index, FingerAssignment... assignments) {
        return new EventFingering(index, List.of(assignments), 0.0, 0.0);
    }

    @Test
    @DisplayName("Consistent solutions pass")
    void testValid() {
        List<MusicalEvent> events = List.of(
                MusicalEvent.of(60, 62),
                MusicalEvent.builder().note(EventNote.tied(60)).build()
        );
        SolutionValidator.Report report = validator.validate(solution(
                fingering(0, assign(60, 1, 0, 0, false), assign(62, 2, 0, 1, false)),
                fingering(1, assign(60, 1, 0, 0, true))
        ), events);

        assertTrue(report.isValid());
        assertTrue(report.isComplete());
        assertEquals(2, report.getFingeredEvents());
    }

    @Test
    @DisplayName("Shared fingers, shared buttons and wrong pitches are counted")
    void testCollisionsAndMismatches() {
        List<MusicalEvent> events = List.of(MusicalEvent.of(60, 62));
        SolutionValidator.Report report = validator.validate(solution(
                fingering(0, assign(60, 1, 0, 0, false), assign(62, 1, 0, 0, false))
        ), events);

        assertFalse(report.isValid());
        assertEquals(1, report.getFingerCollisions());
        assertEquals(1, report.getButtonCollisions());
        assertEquals(1, report.getPitchMismatches());
    }

    @Test
    @DisplayName("Tie handed to another finger is a violation")
    void testTieViolation() {
        List<MusicalEvent> events = List.of(
                MusicalEvent.of(60),
                MusicalEvent.builder().note(EventNote.tied(60)).build()
        );
        SolutionValidator.Report report = validator.validate(solution(
                fingering(0, assign(60, 1, 0, 0, false)),
                fingering(1, assign(60, 2, 0, 0, true))
        ), events);

        assertEquals(1, report.getTieViolations());
        assertFalse(report.isValid());
    }

    @Test
    @DisplayName("Stretch beyond the hand span and missing notes are flagged")
    void testSpanAndUnassigned() {
        List<MusicalEvent> events = List.of(MusicalEvent.of(60, 72), MusicalEvent.of(62));
        SolutionValidator.Report report = validator.validate(solution(
                fingering(0, assign(60, 1, 0, 0, false), assign(72, 5, 0, 10, false))
        ), events);

        assertEquals(1, report.getSpanViolations());
        assertFalse(report.isComplete());
        assertEquals(0, report.getUnassignedNotes());

        SolutionValidator.Report missing = validator.validate(solution(
                fingering(0, assign(60, 1, 0, 0, false))
        ), List.of(MusicalEvent.of(60, 62)));
        assertEquals(1, missing.getUnassignedNotes());
    }
}
