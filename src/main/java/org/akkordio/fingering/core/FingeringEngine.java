package org.akkordio.fingering.core;

import lombok.Builder;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.akkordio.fingering.FingeringException;
import org.akkordio.fingering.cost.FingeringCostConfig;
import org.akkordio.fingering.cost.HandCostModel;
import org.akkordio.fingering.heuristic.HeuristicFactory;
import org.akkordio.fingering.heuristic.HeuristicProvider;
import org.akkordio.fingering.heuristic.HeuristicType;
import org.akkordio.fingering.heuristic.RemainingCostHeuristic;
import org.akkordio.fingering.layout.KeyboardLayout;
import org.akkordio.fingering.layout.PitchNames;
import org.akkordio.fingering.layout.UnmappablePitchException;
import org.akkordio.fingering.model.EventNote;
import org.akkordio.fingering.model.FingerState;
import org.akkordio.fingering.model.MusicalEvent;
import org.akkordio.fingering.model.NodeState;
import org.akkordio.fingering.search.FingeringSearch;
import org.akkordio.fingering.search.SearchBudget;
import org.akkordio.fingering.search.SearchOutcome;
import org.akkordio.fingering.search.SearchTermination;
import org.akkordio.fingering.state.SuccessorGenerator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Main fingering entry point.
 *
 * <p>The facade owns the layout, cost model and successor generator and validates every
 * request before search starts. Execution flow:</p>
 * <ul>
 * <li>Validate request fields and algorithm/heuristic compatibility.</li>
 * <li>Check every pitch against the layout so unplayable notes fail fast.</li>
 * <li>Create the resting root node and bind the heuristic to the sequence.</li>
 * <li>Run the search and convert the node path into a {@link FingeringSolution}.</li>
 * </ul>
 * <p>Engines are immutable; each {@link #solve} call owns its search state, so one engine may
 * serve concurrent requests.</p>
 */
@Slf4j
@Accessors(fluent = true)
public final class FingeringEngine {
    public static final String REASON_REQUEST_REQUIRED = "FG_REQUEST_REQUIRED";
    public static final String REASON_EVENTS_REQUIRED = "FG_EVENTS_REQUIRED";
    public static final String REASON_EVENT_REQUIRED = "FG_EVENT_REQUIRED";
    public static final String REASON_ALGORITHM_REQUIRED = "FG_ALGORITHM_REQUIRED";
    public static final String REASON_HEURISTIC_REQUIRED = "FG_HEURISTIC_REQUIRED";
    public static final String REASON_DIJKSTRA_HEURISTIC_MISMATCH = "FG_DIJKSTRA_HEURISTIC_MISMATCH";
    public static final String REASON_RESTING_POSITION_INVALID = "FG_RESTING_POSITION_INVALID";
    public static final String REASON_NO_FEASIBLE_PATH = "FG_NO_FEASIBLE_PATH";

    @Getter
    private final KeyboardLayout layout;
    @Getter
    private final HandCostModel costModel;
    private final SuccessorGenerator successorGenerator;
    private final FingeringSearch search;
    private final SearchBudget defaultBudget;
    private final ConcurrentMap<HeuristicType, HeuristicProvider> heuristicProviders = new ConcurrentHashMap<>();

    /**
     * Creates the engine.
     *
     * @param layout treble layout (geometry oracle and physical constants).
     * @param costConfig cost weights, {@link FingeringCostConfig#defaults()} when null.
     * @param defaultBudget budget for requests without their own, {@link SearchBudget#defaults()} when null.
     */
    @Builder
    public FingeringEngine(KeyboardLayout layout, FingeringCostConfig costConfig, SearchBudget defaultBudget) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.costModel = new HandCostModel(layout, costConfig == null ? FingeringCostConfig.defaults() : costConfig);
        this.successorGenerator = new SuccessorGenerator(costModel);
        this.search = new FingeringSearch(successorGenerator, costModel);
        this.defaultBudget = defaultBudget == null ? SearchBudget.defaults() : defaultBudget;
    }

    /**
     * Computes a fingering for one event sequence.
     *
     * @param request events plus search options.
     * @return complete optimal solution, or a non-optimal (possibly partial) one when a budget stopped the search.
     * @throws FingeringException when request contracts fail.
     * @throws UnmappablePitchException when a pitch has no button on the layout.
     * @throws NoFeasiblePathException when every branch dies before the last event.
     */
    public FingeringSolution solve(FingeringRequest request) {
        validate(request);
        List<MusicalEvent> events = request.getEvents();
        ensureMappable(events);

        double restingRow = request.getRestingRow() == null ? layout.middleRow() : request.getRestingRow();
        double restingColumn = request.getRestingColumn() == null ? layout.middleColumn() : request.getRestingColumn();
        NodeState root = successorGenerator.restingNode(restingRow, restingColumn, request.getStartBellows());

        RemainingCostHeuristic heuristic = heuristicProvider(request.getHeuristicType())
                .bindSequence(events, root.bellows());
        SearchBudget budget = request.getBudget() == null ? defaultBudget : request.getBudget();

        SearchOutcome outcome = search.search(root, events, heuristic, budget, request.getCancellation());
        FingeringSolution solution = toSolution(request, events, outcome);

        if (outcome.termination() == SearchTermination.EXHAUSTED) {
            int failedEvent = outcome.path().size();
            log.info("no feasible fingering on layout {}: {} of {} events placed",
                    layout.layoutId(), failedEvent, events.size());
            throw new NoFeasiblePathException(solution, failedEvent);
        }
        log.info("fingered {} of {} events on layout {}: cost={}, expanded={}, termination={}, optimal={}",
                solution.getEvents().size(), events.size(), layout.layoutId(),
                String.format("%.3f", solution.getTotalCost()), outcome.expandedNodes(),
                outcome.termination(), outcome.optimal());
        return solution;
    }

    private void validate(FingeringRequest request) {
        if (request == null) {
            throw new FingeringException(REASON_REQUEST_REQUIRED, "fingering request must be provided");
        }
        if (request.getEvents() == null) {
            throw new FingeringException(REASON_EVENTS_REQUIRED, "event sequence must be provided");
        }
        for (int i = 0; i < request.getEvents().size(); i++) {
            if (request.getEvents().get(i) == null) {
                throw new FingeringException(REASON_EVENT_REQUIRED, "event " + i + " is null");
            }
        }
        if (request.getAlgorithm() == null) {
            throw new FingeringException(REASON_ALGORITHM_REQUIRED, "algorithm must be provided");
        }
        if (request.getHeuristicType() == null) {
            throw new FingeringException(REASON_HEURISTIC_REQUIRED, "heuristicType must be provided");
        }
        if (request.getAlgorithm() == FingeringAlgorithm.DIJKSTRA && request.getHeuristicType() != HeuristicType.NONE) {
            throw new FingeringException(
                    REASON_DIJKSTRA_HEURISTIC_MISMATCH,
                    "DIJKSTRA requires heuristicType NONE, got " + request.getHeuristicType()
            );
        }
        ensureRestingCoordinate(request.getRestingRow(), "restingRow");
        ensureRestingCoordinate(request.getRestingColumn(), "restingColumn");
    }

    private static void ensureRestingCoordinate(Double value, String field) {
        if (value != null && (!Double.isFinite(value) || value < 0.0d)) {
            throw new FingeringException(REASON_RESTING_POSITION_INVALID, field + " must be finite and >= 0, got " + value);
        }
    }

    /**
     * Fails before search when any pitch is outside the instrument range.
     */
    private void ensureMappable(List<MusicalEvent> events) {
        for (int i = 0; i < events.size(); i++) {
            for (EventNote note : events.get(i).getNotes()) {
                if (!layout.isMappable(note.midi())) {
                    log.info("event {}: MIDI {} is outside layout {}", i, note.midi(), layout.layoutId());
                    throw new UnmappablePitchException(note.midi(), layout.layoutId());
                }
            }
        }
    }

    private HeuristicProvider heuristicProvider(HeuristicType type) {
        return heuristicProviders.computeIfAbsent(type, t -> HeuristicFactory.create(t, costModel));
    }

    private FingeringSolution toSolution(FingeringRequest request, List<MusicalEvent> events, SearchOutcome outcome) {
        FingeringSolution.FingeringSolutionBuilder builder = FingeringSolution.builder()
                .layoutId(layout.layoutId())
                .algorithm(request.getAlgorithm())
                .heuristicType(request.getHeuristicType())
                .totalCost(outcome.totalCost())
                .complete(outcome.complete())
                .optimal(outcome.optimal())
                .termination(outcome.termination())
                .expandedNodes(outcome.expandedNodes())
                .generatedNodes(outcome.generatedNodes())
                .peakFrontierSize(outcome.peakFrontierSize());

        double previousG = 0.0d;
        for (NodeState node : outcome.path()) {
            MusicalEvent event = events.get(node.eventIndex());
            builder.event(new EventFingering(
                    node.eventIndex(),
                    assignments(node, event),
                    node.g() - previousG,
                    node.g()
            ));
            previousG = node.g();
        }
        return builder.build();
    }

    private List<FingerAssignment> assignments(NodeState node, MusicalEvent event) {
        boolean[] crossing = crossingFingers(node);
        List<FingerAssignment> assignments = new ArrayList<>(event.getNotes().size());
        boolean[] emitted = new boolean[FingerState.FINGER_COUNT + 1];
        for (EventNote note : event.getNotes()) {
            FingerState finger = node.fingerHolding(note.midi());
            if (finger == null || emitted[finger.finger()]) {
                continue;
            }
            emitted[finger.finger()] = true;
            assignments.add(new FingerAssignment(
                    note.midi(),
                    PitchNames.name(note.midi()),
                    finger.finger(),
                    finger.position(),
                    crossing[finger.finger()],
                    note.tiedFromPrevious()
            ));
        }
        return assignments;
    }

    /**
     * Flags every finger that belongs to an inverted pair.
     */
    private static boolean[] crossingFingers(NodeState node) {
        boolean[] crossing = new boolean[FingerState.FINGER_COUNT + 1];
        for (int lower = FingerState.THUMB; lower < FingerState.PINKY; lower++) {
            FingerState a = node.finger(lower);
            if (a.isFree()) {
                continue;
            }
            for (int higher = lower + 1; higher <= FingerState.PINKY; higher++) {
                FingerState b = node.finger(higher);
                if (!b.isFree() && a.position().column() > b.position().column()) {
                    crossing[lower] = true;
                    crossing[higher] = true;
                }
            }
        }
        return crossing;
    }
}
