package org.akkordio.fingering.core;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.akkordio.fingering.layout.KeyboardLayout;
import org.akkordio.fingering.model.ButtonPosition;
import org.akkordio.fingering.model.EventNote;
import org.akkordio.fingering.model.MusicalEvent;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Post-hoc checks of a solution against its input sequence and layout.
 *
 * <p>Independent of the search internals, so it doubles as a regression oracle for tests and
 * as a sanity gate for callers that persist solutions.</p>
 */
@Slf4j
public final class SolutionValidator {
    private static final double SPAN_EPSILON_MM = 1e-9d;

    private final KeyboardLayout layout;

    public SolutionValidator(KeyboardLayout layout) {
        this.layout = Objects.requireNonNull(layout, "layout");
    }

    /**
     * Validates one solution.
     *
     * @param solution engine output.
     * @param events input sequence the solution was computed for.
     * @return validation report; {@link Report#isValid()} is false on any violation.
     */
    public Report validate(FingeringSolution solution, List<MusicalEvent> events) {
        Objects.requireNonNull(solution, "solution");
        Objects.requireNonNull(events, "events");

        int unassignedNotes = 0;
        int fingerCollisions = 0;
        int buttonCollisions = 0;
        int pitchMismatches = 0;
        int spanViolations = 0;
        int tieViolations = 0;

        Int2IntOpenHashMap previousFingerByPitch = new Int2IntOpenHashMap();
        previousFingerByPitch.defaultReturnValue(-1);
        List<EventFingering> fingered = solution.getEvents();
        for (int i = 0; i < fingered.size(); i++) {
            EventFingering eventFingering = fingered.get(i);
            MusicalEvent event = events.get(eventFingering.eventIndex());

            Int2IntOpenHashMap fingerByPitch = new Int2IntOpenHashMap();
            fingerByPitch.defaultReturnValue(-1);
            Set<Integer> fingers = new HashSet<>();
            Set<ButtonPosition> buttons = new HashSet<>();
            for (FingerAssignment assignment : eventFingering.assignments()) {
                if (!fingers.add(assignment.finger())) {
                    fingerCollisions++;
                }
                if (!buttons.add(assignment.button())) {
                    buttonCollisions++;
                }
                if (layout.pitchAt(assignment.button()) != assignment.midi()) {
                    pitchMismatches++;
                }
                fingerByPitch.put(assignment.midi(), assignment.finger());
            }

            for (EventNote note : event.getNotes()) {
                int finger = fingerByPitch.get(note.midi());
                if (finger == -1) {
                    unassignedNotes++;
                    continue;
                }
                if (note.tiedFromPrevious() && previousFingerByPitch.get(note.midi()) != finger) {
                    tieViolations++;
                }
            }

            if (span(eventFingering.assignments()) > layout.maxHandSpanMm() + SPAN_EPSILON_MM) {
                spanViolations++;
            }
            previousFingerByPitch = fingerByPitch;
        }

        Report report = Report.builder()
                .eventCount(events.size())
                .fingeredEvents(fingered.size())
                .unassignedNotes(unassignedNotes)
                .fingerCollisions(fingerCollisions)
                .buttonCollisions(buttonCollisions)
                .pitchMismatches(pitchMismatches)
                .spanViolations(spanViolations)
                .tieViolations(tieViolations)
                .build();
        if (!report.isValid()) {
            log.warn("fingering solution for layout {} failed validation: {}", layout.layoutId(), report);
        }
        return report;
    }

    private double span(List<FingerAssignment> assignments) {
        double max = 0.0d;
        for (int i = 0; i < assignments.size(); i++) {
            ButtonPosition a = assignments.get(i).button();
            for (int j = i + 1; j < assignments.size(); j++) {
                ButtonPosition b = assignments.get(j).button();
                double rowMm = (a.row() - b.row()) * layout.rowSpacingMm();
                double columnMm = (a.column() - b.column()) * layout.columnSpacingMm();
                max = Math.max(max, Math.hypot(rowMm, columnMm));
            }
        }
        return max;
    }

    /**
     * Immutable validation summary.
     */
    @Value
    @Builder
    public static class Report {
        int eventCount;
        int fingeredEvents;
        int unassignedNotes;
        int fingerCollisions;
        int buttonCollisions;
        int pitchMismatches;
        int spanViolations;
        int tieViolations;

        public boolean isComplete() {
            return fingeredEvents == eventCount;
        }

        public boolean isValid() {
            return isComplete()
                    && unassignedNotes == 0
                    && fingerCollisions == 0
                    && buttonCollisions == 0
                    && pitchMismatches == 0
                    && spanViolations == 0
                    && tieViolations == 0;
        }
    }
}
