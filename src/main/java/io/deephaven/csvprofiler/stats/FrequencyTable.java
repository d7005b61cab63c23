package io.deephaven.csvprofiler.stats;

import gnu.trove.iterator.TObjectLongIterator;
import io.deephaven.csvprofiler.profile.DiversityMetrics;
import org.jetbrains.annotations.Nullable;
import gnu.trove.map.hash.TObjectLongHashMap;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Bounded value counts using the space-saving heavy-hitter algorithm. While the number of distinct values stays at or
 * below the capacity the counts are exact. Once the table is full, a new value evicts the entry with the smallest
 * count and inherits that count plus one; the inherited part is remembered as the entry's maximum overestimation.
 */
public final class FrequencyTable {
    private static final double LN_2 = Math.log(2);

    private final int capacity;
    private final TObjectLongHashMap<String> counts;
    private final TObjectLongHashMap<String> errors;
    private long total;
    private boolean exact = true;
    private boolean repeatObserved;

    public FrequencyTable(final int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Frequency table capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.counts = new TObjectLongHashMap<>(capacity * 2, 0.5f, 0);
        this.errors = new TObjectLongHashMap<>(capacity * 2, 0.5f, 0);
    }

    public void add(final String value) {
        ++total;
        if (counts.containsKey(value)) {
            counts.increment(value);
            repeatObserved = true;
            return;
        }
        if (counts.size() < capacity) {
            counts.put(value, 1);
            return;
        }
        exact = false;
        String victim = null;
        long victimCount = Long.MAX_VALUE;
        for (final TObjectLongIterator<String> it = counts.iterator(); it.hasNext();) {
            it.advance();
            if (it.value() < victimCount) {
                victim = it.key();
                victimCount = it.value();
            }
        }
        counts.remove(victim);
        errors.remove(victim);
        counts.put(value, victimCount + 1);
        errors.put(value, victimCount);
    }

    public int capacity() {
        return capacity;
    }

    /** The number of tracked values; never more than {@link #capacity()}. */
    public int size() {
        return counts.size();
    }

    /** The number of values added. */
    public long total() {
        return total;
    }

    /** Whether every count is exact, i.e. the column never had more distinct values than the capacity. */
    public boolean isExact() {
        return exact;
    }

    /** Whether some tracked value was seen more than once. */
    public boolean repeatObserved() {
        return repeatObserved;
    }

    /**
     * Whether every added value is known to be distinct. Once values have been evicted a repeat of an evicted value
     * cannot be told from a new one, so an inexact table never counts as distinct.
     */
    public boolean provablyDistinct() {
        return exact && !repeatObserved;
    }

    /**
     * The {@code limit} most frequent tracked values, by descending count then ascending value.
     */
    public List<Entry> top(final int limit) {
        final List<Entry> entries = new ArrayList<>(counts.size());
        counts.forEachEntry((key, count) -> {
            entries.add(new Entry(key, count, errors.get(key)));
            return true;
        });
        entries.sort(Comparator.comparingLong(Entry::count).reversed().thenComparing(Entry::value));
        return entries.size() <= limit ? entries : new ArrayList<>(entries.subList(0, limit));
    }

    /**
     * Shannon entropy and Gini impurity of the tracked counts, with shares taken over {@link #total()}. Null when
     * nothing was added.
     */
    @Nullable
    public DiversityMetrics diversity() {
        if (total == 0) {
            return null;
        }
        final double[] sums = new double[2];
        counts.forEachValue(count -> {
            final double share = (double) count / total;
            sums[0] -= share * Math.log(share) / LN_2;
            sums[1] += share * share;
            return true;
        });
        return new DiversityMetrics(counts.size(), sums[0], Math.max(0.0, 1.0 - sums[1]), exact);
    }

    /** A tracked value with its (possibly overestimated) count. */
    public static final class Entry {
        private final String value;
        private final long count;
        private final long error;

        Entry(String value, long count, long error) {
            this.value = value;
            this.count = count;
            this.error = error;
        }

        public String value() {
            return value;
        }

        public long count() {
            return count;
        }

        /** The most by which {@link #count()} may exceed the true count. Zero for exact entries. */
        public long error() {
            return error;
        }
    }
}
