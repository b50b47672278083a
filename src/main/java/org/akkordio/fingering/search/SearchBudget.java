package org.akkordio.fingering.search;

import java.time.Duration;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Per-solve bounds on search work, frontier width and wall-clock time.
 *
 * <p>Non-positive bounds mean unbounded. Exceeding the expansion or time bound stops the
 * search and the best path found so far is returned; exceeding the beam width trims the
 * open set to its best entries and marks the result non-optimal.</p>
 */
public final class SearchBudget {
    public static final int UNBOUNDED = Integer.MAX_VALUE;
    public static final long NO_TIMEOUT = Long.MAX_VALUE;

    static final String PROP_MAX_EXPANDED = "akkordio.fingering.maxExpandedNodes";
    static final String PROP_BEAM_WIDTH = "akkordio.fingering.beamWidth";
    static final String PROP_TIMEOUT_MILLIS = "akkordio.fingering.timeoutMillis";

    private final int maxExpandedNodes;
    private final int beamWidth;
    private final long timeoutNanos;
    private final LongSupplier nanoClock;

    private SearchBudget(int maxExpandedNodes, int beamWidth, long timeoutNanos, LongSupplier nanoClock) {
        this.maxExpandedNodes = normalizeBound(maxExpandedNodes);
        this.beamWidth = normalizeBound(beamWidth);
        this.timeoutNanos = timeoutNanos <= 0L ? NO_TIMEOUT : timeoutNanos;
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    }

    /**
     * Creates a budget with explicit bounds and the system monotonic clock.
     *
     * @param timeout wall-clock limit, {@code null} or non-positive for none.
     */
    public static SearchBudget of(int maxExpandedNodes, int beamWidth, Duration timeout) {
        return of(maxExpandedNodes, beamWidth, timeout, System::nanoTime);
    }

    /**
     * Creates a budget with an explicit monotonic nanosecond clock.
     */
    public static SearchBudget of(int maxExpandedNodes, int beamWidth, Duration timeout, LongSupplier nanoClock) {
        long nanos = timeout == null ? NO_TIMEOUT : saturatedNanos(timeout);
        return new SearchBudget(maxExpandedNodes, beamWidth, nanos, nanoClock);
    }

    /**
     * Budget with no bounds at all.
     */
    public static SearchBudget unbounded() {
        return new SearchBudget(UNBOUNDED, UNBOUNDED, NO_TIMEOUT, System::nanoTime);
    }

    /**
     * Loads budget values from system properties.
     */
    public static SearchBudget defaults() {
        long timeoutMillis = readLong(PROP_TIMEOUT_MILLIS);
        Duration timeout = timeoutMillis <= 0L ? null : Duration.ofMillis(timeoutMillis);
        return of((int) Math.min(Integer.MAX_VALUE, readLong(PROP_MAX_EXPANDED)),
                (int) Math.min(Integer.MAX_VALUE, readLong(PROP_BEAM_WIDTH)),
                timeout);
    }

    public int maxExpandedNodes() {
        return maxExpandedNodes;
    }

    public int beamWidth() {
        return beamWidth;
    }

    public boolean hasBeam() {
        return beamWidth != UNBOUNDED;
    }

    public boolean hasTimeout() {
        return timeoutNanos != NO_TIMEOUT;
    }

    /**
     * Returns whether the given number of expansions exhausts the budget.
     */
    boolean isExpansionExhausted(int expandedNodes) {
        return expandedNodes >= maxExpandedNodes;
    }

    /**
     * Returns the absolute deadline for a search starting now.
     */
    long deadlineFromNow() {
        if (!hasTimeout()) {
            return NO_TIMEOUT;
        }
        long now = nanoClock.getAsLong();
        return now > Long.MAX_VALUE - timeoutNanos ? NO_TIMEOUT : now + timeoutNanos;
    }

    /**
     * Returns whether a deadline obtained from {@link #deadlineFromNow()} has passed.
     */
    boolean isPastDeadline(long deadline) {
        return deadline != NO_TIMEOUT && nanoClock.getAsLong() - deadline >= 0L;
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    private static long saturatedNanos(Duration timeout) {
        if (timeout.isNegative() || timeout.isZero()) {
            return NO_TIMEOUT;
        }
        try {
            return timeout.toNanos();
        } catch (ArithmeticException ex) {
            return NO_TIMEOUT;
        }
    }

    private static long readLong(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return 0L;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            return 0L;
        }
    }

    @Override
    public String toString() {
        return "SearchBudget{maxExpandedNodes=" + (maxExpandedNodes == UNBOUNDED ? "unbounded" : maxExpandedNodes)
                + ", beamWidth=" + (beamWidth == UNBOUNDED ? "unbounded" : beamWidth)
                + ", timeoutNanos=" + (timeoutNanos == NO_TIMEOUT ? "none" : timeoutNanos) + '}';
    }
}
