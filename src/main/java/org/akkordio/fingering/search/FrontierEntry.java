package org.akkordio.fingering.search;

/**
 * Deterministic open-set entry.
 */
record FrontierEntry(double priority, int arenaIndex) implements Comparable<FrontierEntry> {
    /**
     * Orders by priority, then by arena index so the earlier generated node wins ties.
     */
    @Override
    public int compareTo(FrontierEntry other) {
        int byPriority = Double.compare(this.priority, other.priority);
        if (byPriority != 0) {
            return byPriority;
        }
        return Integer.compare(this.arenaIndex, other.arenaIndex);
    }
}
