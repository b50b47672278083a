package org.akkordio.fingering.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.akkordio.fingering.model.MusicalEvent;
import org.akkordio.fingering.search.SearchBudget;
import org.akkordio.fingering.testutil.FingeringFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Solution JSON Tests")
class FingeringSolutionJsonTest {

    private static FingeringSolution solveSingleNote() {
        FingeringEngine engine = FingeringEngine.builder()
                .layout(FingeringFixtures.singleButtonLayout())
                .defaultBudget(SearchBudget.unbounded())
                .build();
        return engine.solve(FingeringRequest.builder()
                .event(MusicalEvent.of(60))
                .restingRow(3.0)
                .restingColumn(0.0)
                .build());
    }

    @Test
    @DisplayName("Solution fields and nested assignments are rendered")
    void testJsonShape() throws Exception {
        String json = FingeringSolutionJson.toJson(solveSingleNote());
        JsonNode root = new ObjectMapper().readTree(json);

        assertEquals("single-c4", root.get("layoutId").asText());
        assertEquals("a-star/bounding-box", root.get("algorithmId").asText());
        assertEquals("GOAL_REACHED", root.get("termination").asText());
        assertTrue(root.get("complete").asBoolean());
        assertEquals(93.24, root.get("totalCost").asDouble(), 0.01);

        JsonNode assignment = root.get("events").get(0).get("assignments").get(0);
        assertEquals(60, assignment.get("midi").asInt());
        assertEquals("C4", assignment.get("note").asText());
        assertEquals(1, assignment.get("finger").asInt());
        assertEquals(2, assignment.get("button").get("row").asInt());
        assertEquals(5, assignment.get("button").get("column").asInt());
        assertFalse(assignment.get("held").asBoolean());
    }

    @Test
    @DisplayName("Pretty output spans several lines")
    void testPrettyJson() {
        String pretty = FingeringSolutionJson.toPrettyJson(solveSingleNote());

        assertTrue(pretty.contains(System.lineSeparator()) || pretty.contains("\n"));
        assertThrows(NullPointerException.class, () -> FingeringSolutionJson.toJson(null));
    }
}
