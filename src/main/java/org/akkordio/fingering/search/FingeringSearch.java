package org.akkordio.fingering.search;

import it.unimi.dsi.fastutil.objects.Object2DoubleOpenHashMap;
import lombok.extern.slf4j.Slf4j;
import org.akkordio.fingering.cost.HandCostModel;
import org.akkordio.fingering.heuristic.RemainingCostHeuristic;
import org.akkordio.fingering.model.MusicalEvent;
import org.akkordio.fingering.model.NodeState;
import org.akkordio.fingering.state.StateKey;
import org.akkordio.fingering.state.SuccessorGenerator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.function.BooleanSupplier;

/**
 * A* search over hand configurations, one layer per event.
 *
 * <p>The open set is ordered by {@code f = g + h} with arena index as tie-breaker. A closed map
 * keyed by {@link StateKey} remembers the best settled {@code g}; a node is re-expanded only
 * when it arrives with a strictly better {@code g}. All per-solve state (arena, open set,
 * closed map) is created inside {@link #search} so one instance can serve concurrent solves.</p>
 *
 * <p>Budget stops return the best path found so far: the cheapest generated node at the last
 * event if any, else the furthest-progressed node (lowest {@code g} among equals).</p>
 */
@Slf4j
public final class FingeringSearch {
    private static final int CANCELLATION_POLL_INTERVAL = 64;

    private final SuccessorGenerator successorGenerator;
    private final HandCostModel costModel;

    public FingeringSearch(SuccessorGenerator successorGenerator, HandCostModel costModel) {
        this.successorGenerator = Objects.requireNonNull(successorGenerator, "successorGenerator");
        this.costModel = Objects.requireNonNull(costModel, "costModel");
    }

    /**
     * Runs one search from {@code root} over {@code events}.
     *
     * @param root unscored resting node produced by the successor generator.
     * @param events full event sequence.
     * @param heuristic estimator bound to {@code events}.
     * @param budget work and time limits.
     * @param cancelled cooperative cancellation signal, polled between expansions.
     * @return search outcome; never throws for infeasible input.
     */
    public SearchOutcome search(
            NodeState root,
            List<MusicalEvent> events,
            RemainingCostHeuristic heuristic,
            SearchBudget budget,
            BooleanSupplier cancelled
    ) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(events, "events");
        Objects.requireNonNull(heuristic, "heuristic");
        Objects.requireNonNull(budget, "budget");
        BooleanSupplier cancellation = cancelled == null ? () -> false : cancelled;

        if (events.isEmpty()) {
            return new SearchOutcome(List.of(), true, true, SearchTermination.GOAL_REACHED, 0, 0, 0);
        }

        Run run = new Run(events, heuristic, budget, cancellation);
        return run.execute(root);
    }

    /**
     * Mutable state of one search invocation.
     */
    private final class Run {
        private final List<MusicalEvent> events;
        private final int lastEventIndex;
        private final RemainingCostHeuristic heuristic;
        private final SearchBudget budget;
        private final BooleanSupplier cancellation;

        private final NodeArena arena = new NodeArena();
        private final PriorityQueue<FrontierEntry> frontier = new PriorityQueue<>();
        private final Object2DoubleOpenHashMap<StateKey> bestGenerated = new Object2DoubleOpenHashMap<>();
        private final Object2DoubleOpenHashMap<StateKey> closed = new Object2DoubleOpenHashMap<>();

        private int expandedNodes;
        private int peakFrontierSize;
        private boolean beamTrimmed;
        private int furthestIndex = NodeState.NO_PARENT;
        private int bestGoalIndex = NodeState.NO_PARENT;

        private Run(
                List<MusicalEvent> events,
                RemainingCostHeuristic heuristic,
                SearchBudget budget,
                BooleanSupplier cancellation
        ) {
            this.events = events;
            this.lastEventIndex = events.size() - 1;
            this.heuristic = heuristic;
            this.budget = budget;
            this.cancellation = cancellation;
            bestGenerated.defaultReturnValue(Double.POSITIVE_INFINITY);
            closed.defaultReturnValue(Double.POSITIVE_INFINITY);
        }

        private SearchOutcome execute(NodeState root) {
            long deadline = budget.deadlineFromNow();
            NodeState scoredRoot = root.withSearchScores(NodeState.NO_PARENT, 0.0d, estimate(root));
            push(scoredRoot);

            while (!frontier.isEmpty()) {
                if (expandedNodes % CANCELLATION_POLL_INTERVAL == 0 && cancellation.getAsBoolean()) {
                    return stopEarly(SearchTermination.CANCELLED);
                }
                if (budget.isPastDeadline(deadline)) {
                    return stopEarly(SearchTermination.TIMEOUT_EXCEEDED);
                }
                if (budget.isExpansionExhausted(expandedNodes)) {
                    return stopEarly(SearchTermination.EXPANSION_BUDGET_EXCEEDED);
                }

                FrontierEntry entry = frontier.poll();
                int index = entry.arenaIndex();
                NodeState node = arena.get(index);
                StateKey key = StateKey.of(node);
                if (node.g() > bestGenerated.getDouble(key)) {
                    continue;
                }
                if (closed.getDouble(key) <= node.g()) {
                    continue;
                }
                closed.put(key, node.g());

                if (node.eventIndex() == lastEventIndex) {
                    return outcome(index, true, !beamTrimmed, SearchTermination.GOAL_REACHED);
                }

                expandedNodes++;
                expand(index, node);
            }

            log.debug("open set exhausted after {} expansions; furthest event {}",
                    expandedNodes, furthestIndex == NodeState.NO_PARENT ? -1 : arena.get(furthestIndex).eventIndex());
            return outcome(furthestIndex, false, false, SearchTermination.EXHAUSTED);
        }

        private void expand(int parentIndex, NodeState parent) {
            MusicalEvent event = events.get(parent.eventIndex() + 1);
            for (NodeState successor : successorGenerator.successors(parent, event)) {
                double g = parent.g() + costModel.edgeCost(parent, successor, event);
                StateKey key = StateKey.of(successor);
                if (g >= bestGenerated.getDouble(key)) {
                    continue;
                }
                push(successor.withSearchScores(parentIndex, g, estimate(successor)));
            }
            if (budget.hasBeam() && frontier.size() > budget.beamWidth()) {
                trimFrontier();
            }
        }

        private void push(NodeState scored) {
            int index = arena.add(scored);
            bestGenerated.put(StateKey.of(scored), scored.g());
            frontier.add(new FrontierEntry(scored.f(), index));
            peakFrontierSize = Math.max(peakFrontierSize, frontier.size());

            if (furthestIndex == NodeState.NO_PARENT || isFurther(scored, arena.get(furthestIndex))) {
                furthestIndex = index;
            }
            if (scored.eventIndex() == lastEventIndex
                    && (bestGoalIndex == NodeState.NO_PARENT || scored.g() < arena.get(bestGoalIndex).g())) {
                bestGoalIndex = index;
            }
        }

        /**
         * Keeps the best {@code beamWidth} open entries.
         */
        private void trimFrontier() {
            int width = budget.beamWidth();
            List<FrontierEntry> kept = new ArrayList<>(width);
            for (int i = 0; i < width; i++) {
                kept.add(frontier.poll());
            }
            int dropped = frontier.size();
            frontier.clear();
            frontier.addAll(kept);
            beamTrimmed = true;
            log.debug("beam trimmed {} open entries (width {})", dropped, width);
        }

        private double estimate(NodeState node) {
            double estimate = heuristic.estimate(node);
            if (!Double.isFinite(estimate) || estimate < 0.0d) {
                return 0.0d;
            }
            return estimate;
        }

        private SearchOutcome stopEarly(SearchTermination termination) {
            log.warn("fingering search stopped early ({}) after {} expansions, {} nodes generated",
                    termination, expandedNodes, arena.size());
            if (bestGoalIndex != NodeState.NO_PARENT) {
                return outcome(bestGoalIndex, true, false, termination);
            }
            return outcome(furthestIndex, false, false, termination);
        }

        private SearchOutcome outcome(int terminalIndex, boolean complete, boolean optimal, SearchTermination termination) {
            List<NodeState> path = terminalIndex == NodeState.NO_PARENT ? List.of() : arena.pathTo(terminalIndex);
            return new SearchOutcome(
                    path,
                    complete,
                    optimal,
                    termination,
                    expandedNodes,
                    arena.size(),
                    peakFrontierSize
            );
        }
    }

    /**
     * Progress order for partial results: later event first, then lower cost.
     */
    private static boolean isFurther(NodeState candidate, NodeState current) {
        if (candidate.eventIndex() != current.eventIndex()) {
            return candidate.eventIndex() > current.eventIndex();
        }
        return candidate.g() < current.g();
    }
}
