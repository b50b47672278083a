package org.akkordio.fingering.search;

import org.akkordio.fingering.model.NodeState;

import java.util.List;

/**
 * Raw search output.
 *
 * @param path scored nodes from the first event onward (root excluded).
 * @param complete whether the path accounts for every event.
 * @param optimal whether the path is guaranteed minimal (goal settled, no beam trimming).
 * @param termination stop reason.
 * @param expandedNodes nodes whose successors were generated.
 * @param generatedNodes nodes appended to the arena, root included.
 * @param peakFrontierSize largest open-set size observed.
 */
public record SearchOutcome(
        List<NodeState> path,
        boolean complete,
        boolean optimal,
        SearchTermination termination,
        int expandedNodes,
        int generatedNodes,
        int peakFrontierSize
) {
    public SearchOutcome {
        path = List.copyOf(path);
    }

    /**
     * Accumulated cost of the last node on the path, zero for an empty path.
     */
    public double totalCost() {
        return path.isEmpty() ? 0.0d : path.get(path.size() - 1).g();
    }
}
