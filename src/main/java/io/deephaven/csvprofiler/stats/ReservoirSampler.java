package io.deephaven.csvprofiler.stats;

import java.util.Arrays;
import java.util.SplittableRandom;

/**
 * A uniform fixed-capacity sample of a numeric stream (Vitter's algorithm R). After {@code n} offers every value has
 * been kept with probability {@code capacity / n}. The generator is seeded, so two runs over the same input keep the
 * same sample.
 */
public final class ReservoirSampler {
    private final double[] sample;
    private final SplittableRandom random;
    private int size;
    private long seen;

    /**
     * @param capacity The maximum number of values kept.
     * @param seed The seed of the replacement generator.
     */
    public ReservoirSampler(final int capacity, final long seed) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Reservoir capacity must be positive, got " + capacity);
        }
        this.sample = new double[capacity];
        this.random = new SplittableRandom(seed);
    }

    /**
     * Offer a value. Non-finite values are ignored.
     */
    public void offer(final double value) {
        if (!Double.isFinite(value)) {
            return;
        }
        ++seen;
        if (size < sample.length) {
            sample[size++] = value;
            return;
        }
        final long slot = random.nextLong(seen);
        if (slot < sample.length) {
            sample[(int) slot] = value;
        }
    }

    public int capacity() {
        return sample.length;
    }

    /** The number of values currently held; never more than {@link #capacity()}. */
    public int size() {
        return size;
    }

    /** The number of values offered so far. */
    public long seen() {
        return seen;
    }

    /** Whether the sample holds every value offered. */
    public boolean isComplete() {
        return seen == size;
    }

    /** A sorted copy of the sample. */
    public double[] sortedValues() {
        final double[] copy = Arrays.copyOf(sample, size);
        Arrays.sort(copy);
        return copy;
    }
}
