package org.akkordio.fingering.search;

import org.akkordio.fingering.cost.HandCostModel;
import org.akkordio.fingering.heuristic.BoundingBoxHeuristicProvider;
import org.akkordio.fingering.heuristic.NullHeuristicProvider;
import org.akkordio.fingering.heuristic.RemainingCostHeuristic;
import org.akkordio.fingering.layout.KeyboardLayout;
import org.akkordio.fingering.model.BellowsDirection;
import org.akkordio.fingering.model.MusicalEvent;
import org.akkordio.fingering.model.NodeState;
import org.akkordio.fingering.state.SuccessorGenerator;
import org.akkordio.fingering.testutil.FingeringFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Fingering Search Tests")
class FingeringSearchTest {

    private static final List<MusicalEvent> SCALE = List.of(
            MusicalEvent.of(60), MusicalEvent.of(62), MusicalEvent.of(64), MusicalEvent.of(65),
            MusicalEvent.of(67), MusicalEvent.of(65), MusicalEvent.of(64), MusicalEvent.of(62)
    );

    private final KeyboardLayout layout = FingeringFixtures.cSystem();
    private final HandCostModel costModel = FingeringFixtures.costModel(layout);
    private final SuccessorGenerator generator = new SuccessorGenerator(costModel);
    private final FingeringSearch search = new FingeringSearch(generator, costModel);

    private NodeState root() {
        return generator.restingNode(layout.middleRow(), layout.middleColumn(), BellowsDirection.NEUTRAL);
    }

    private static RemainingCostHeuristic zero(List<MusicalEvent> events) {
        return new NullHeuristicProvider().bindSequence(events, BellowsDirection.NEUTRAL);
    }

    private RemainingCostHeuristic bound(List<MusicalEvent> events) {
        return new BoundingBoxHeuristicProvider(costModel).bindSequence(events, BellowsDirection.NEUTRAL);
    }

    @Nested
    @DisplayName("Unbounded Search")
    class Unbounded {

        @Test
        @DisplayName("Finds a complete optimal path with one node per event")
        void testCompletePath() {
            SearchOutcome outcome = search.search(root(), SCALE, bound(SCALE), SearchBudget.unbounded(), null);

            assertEquals(SearchTermination.GOAL_REACHED, outcome.termination());
            assertTrue(outcome.complete());
            assertTrue(outcome.optimal());
            assertEquals(SCALE.size(), outcome.path().size());
            for (int i = 0; i < outcome.path().size(); i++) {
                assertEquals(i, outcome.path().get(i).eventIndex());
            }
            for (int i = 1; i < outcome.path().size(); i++) {
                assertTrue(outcome.path().get(i).g() >= outcome.path().get(i - 1).g());
            }
            assertEquals(outcome.path().get(SCALE.size() - 1).g(), outcome.totalCost(), 0.0);
            assertTrue(outcome.generatedNodes() > outcome.expandedNodes());
            assertTrue(outcome.peakFrontierSize() > 0);
        }

        @Test
        @DisplayName("Empty sequences succeed immediately with zero cost")
        void testEmptySequence() {
            SearchOutcome outcome = search.search(root(), List.of(), zero(List.of()), SearchBudget.unbounded(), null);

            assertEquals(SearchTermination.GOAL_REACHED, outcome.termination());
            assertTrue(outcome.path().isEmpty());
            assertTrue(outcome.complete());
            assertEquals(0.0, outcome.totalCost(), 0.0);
        }

        @Test
        @DisplayName("Dead branches everywhere exhaust the open set")
        void testExhausted() {
            KeyboardLayout wide = FingeringFixtures.wideLayout();
            HandCostModel wideModel = FingeringFixtures.costModel(wide);
            SuccessorGenerator wideGenerator = new SuccessorGenerator(wideModel);
            FingeringSearch wideSearch = new FingeringSearch(wideGenerator, wideModel);
            List<MusicalEvent> events = List.of(MusicalEvent.of(60), MusicalEvent.of(60, 72));

            SearchOutcome outcome = wideSearch.search(
                    wideGenerator.restingNode(0.0, 0.0, BellowsDirection.NEUTRAL),
                    events, zero(events), SearchBudget.unbounded(), null);

            assertEquals(SearchTermination.EXHAUSTED, outcome.termination());
            assertFalse(outcome.complete());
            assertFalse(outcome.optimal());
            assertEquals(1, outcome.path().size());
            assertEquals(0, outcome.path().get(0).eventIndex());
        }
    }

    @Nested
    @DisplayName("Budgets")
    class Budgets {

        @Test
        @DisplayName("Expansion budget returns the furthest partial path")
        void testExpansionBudget() {
            SearchOutcome outcome = search.search(root(), SCALE, zero(SCALE), SearchBudget.of(1, 0, null), null);

            assertEquals(SearchTermination.EXPANSION_BUDGET_EXCEEDED, outcome.termination());
            assertFalse(outcome.complete());
            assertFalse(outcome.optimal());
            assertEquals(1, outcome.expandedNodes());
            assertEquals(1, outcome.path().size());
        }

        @Test
        @DisplayName("Expansion budget after the goal was generated returns a complete non-optimal path")
        void testBudgetWithGoalGenerated() {
            List<MusicalEvent> single = List.of(MusicalEvent.of(60));
            SearchOutcome outcome = search.search(root(), single, zero(single), SearchBudget.of(1, 0, null), null);

            assertEquals(SearchTermination.EXPANSION_BUDGET_EXCEEDED, outcome.termination());
            assertTrue(outcome.complete());
            assertFalse(outcome.optimal());
            assertEquals(1, outcome.path().size());
        }

        @Test
        @DisplayName("Timeout is measured on the injected clock")
        void testTimeout() {
            AtomicLong clock = new AtomicLong();
            SearchBudget budget = SearchBudget.of(0, 0, Duration.ofMillis(3), () -> clock.addAndGet(1_000_000L));

            SearchOutcome outcome = search.search(root(), SCALE, zero(SCALE), budget, null);

            assertEquals(SearchTermination.TIMEOUT_EXCEEDED, outcome.termination());
            assertFalse(outcome.optimal());
            assertFalse(outcome.complete());
        }

        @Test
        @DisplayName("Beam trimming still completes but is not optimal")
        void testBeam() {
            SearchOutcome optimal = search.search(root(), SCALE, zero(SCALE), SearchBudget.unbounded(), null);
            SearchOutcome beam = search.search(root(), SCALE, zero(SCALE), SearchBudget.of(0, 1, null), null);

            assertEquals(SearchTermination.GOAL_REACHED, beam.termination());
            assertTrue(beam.complete());
            assertFalse(beam.optimal());
            assertEquals(SCALE.size(), beam.path().size());
            assertTrue(beam.totalCost() >= optimal.totalCost() - 1e-9);
            assertTrue(beam.peakFrontierSize() >= 1);
        }

        @Test
        @DisplayName("Cancellation stops before the first expansion")
        void testCancellation() {
            AtomicInteger polls = new AtomicInteger();
            SearchOutcome outcome = search.search(root(), SCALE, zero(SCALE), SearchBudget.unbounded(), () -> {
                polls.incrementAndGet();
                return true;
            });

            assertEquals(SearchTermination.CANCELLED, outcome.termination());
            assertEquals(0, outcome.expandedNodes());
            assertTrue(outcome.path().isEmpty());
            assertFalse(outcome.complete());
            assertEquals(1, polls.get());
        }
    }

    @Nested
    @DisplayName("Budget Configuration")
    class BudgetConfiguration {

        @Test
        @DisplayName("Non-positive bounds mean unbounded")
        void testNormalization() {
            SearchBudget budget = SearchBudget.of(-5, 0, Duration.ZERO);

            assertEquals(SearchBudget.UNBOUNDED, budget.maxExpandedNodes());
            assertFalse(budget.hasBeam());
            assertFalse(budget.hasTimeout());
            assertFalse(budget.isExpansionExhausted(Integer.MAX_VALUE - 1));
            assertFalse(budget.isPastDeadline(budget.deadlineFromNow()));
        }

        @Test
        @DisplayName("Defaults are read from system properties")
        void testSystemProperties() {
            System.setProperty(SearchBudget.PROP_MAX_EXPANDED, "250");
            System.setProperty(SearchBudget.PROP_BEAM_WIDTH, "16");
            System.setProperty(SearchBudget.PROP_TIMEOUT_MILLIS, "not-a-number");
            try {
                SearchBudget budget = SearchBudget.defaults();
                assertEquals(250, budget.maxExpandedNodes());
                assertEquals(16, budget.beamWidth());
                assertTrue(budget.hasBeam());
                assertFalse(budget.hasTimeout());
                assertTrue(budget.isExpansionExhausted(250));
                assertFalse(budget.isExpansionExhausted(249));
            } finally {
                System.clearProperty(SearchBudget.PROP_MAX_EXPANDED);
                System.clearProperty(SearchBudget.PROP_BEAM_WIDTH);
                System.clearProperty(SearchBudget.PROP_TIMEOUT_MILLIS);
            }
        }

        @Test
        @DisplayName("Deadline passes once the clock reaches it")
        void testDeadline() {
            AtomicLong clock = new AtomicLong(100L);
            SearchBudget budget = SearchBudget.of(0, 0, Duration.ofNanos(50), clock::get);

            long deadline = budget.deadlineFromNow();
            assertEquals(150L, deadline);
            assertFalse(budget.isPastDeadline(deadline));
            clock.set(150L);
            assertTrue(budget.isPastDeadline(deadline));
        }
    }
}
