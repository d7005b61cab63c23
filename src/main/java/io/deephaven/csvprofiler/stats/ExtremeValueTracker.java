package io.deephaven.csvprofiler.stats;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Keeps the {@code capacity} smallest and largest values of a column together with the line they came from. Each tail
 * is a bounded heap whose root is the least extreme kept value, so an offer costs O(log capacity).
 */
public final class ExtremeValueTracker {
    private static final Comparator<Extreme> ASCENDING =
            Comparator.comparingDouble(Extreme::value).thenComparingLong(Extreme::lineNumber);

    private final int capacity;
    /** Max-heap of the smallest values. */
    private final PriorityQueue<Extreme> lowest;
    /** Min-heap of the largest values. */
    private final PriorityQueue<Extreme> highest;

    public ExtremeValueTracker(final int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Extreme value capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.lowest = new PriorityQueue<>(capacity + 1, ASCENDING.reversed());
        this.highest = new PriorityQueue<>(capacity + 1, ASCENDING);
    }

    public void offer(final double value, final long lineNumber) {
        if (!Double.isFinite(value)) {
            return;
        }
        if (lowest.size() < capacity || value < lowest.peek().value()) {
            lowest.add(new Extreme(value, lineNumber));
            if (lowest.size() > capacity) {
                lowest.poll();
            }
        }
        if (highest.size() < capacity || value > highest.peek().value()) {
            highest.add(new Extreme(value, lineNumber));
            if (highest.size() > capacity) {
                highest.poll();
            }
        }
    }

    /** The smallest values, ascending. */
    public List<Extreme> lowest() {
        final List<Extreme> result = new ArrayList<>(lowest);
        result.sort(ASCENDING);
        return result;
    }

    /** The largest values, descending. */
    public List<Extreme> highest() {
        final List<Extreme> result = new ArrayList<>(highest);
        result.sort(ASCENDING.reversed());
        return result;
    }

    /** A value and the 1-based physical line of the record it came from. */
    public static final class Extreme {
        private final double value;
        private final long lineNumber;

        public Extreme(double value, long lineNumber) {
            this.value = value;
            this.lineNumber = lineNumber;
        }

        public double value() {
            return value;
        }

        public long lineNumber() {
            return lineNumber;
        }

        @Override
        public String toString() {
            return value + "@" + lineNumber;
        }
    }
}
