package org.akkordio.fingering.search;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.akkordio.fingering.model.NodeState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only node storage. Arena indices are stable, so parents are referenced by index.
 */
final class NodeArena {
    private final ObjectArrayList<NodeState> nodes = new ObjectArrayList<>();

    /**
     * Appends a node and returns its arena index.
     */
    int add(NodeState node) {
        int index = nodes.size();
        nodes.add(node);
        return index;
    }

    NodeState get(int index) {
        return nodes.get(index);
    }

    int size() {
        return nodes.size();
    }

    /**
     * Walks parent indices back to the root and returns the path without the root.
     */
    List<NodeState> pathTo(int index) {
        List<NodeState> reversed = new ArrayList<>();
        int cursor = index;
        while (cursor != NodeState.NO_PARENT) {
            NodeState node = nodes.get(cursor);
            if (!node.isStart()) {
                reversed.add(node);
            }
            cursor = node.parentIndex();
        }
        Collections.reverse(reversed);
        return reversed;
    }
}
