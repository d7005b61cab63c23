package io.deephaven.csvprofiler.inference;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * The converged type of a column: the winning {@link PrimitiveType}, the share of non-null votes behind it, and the
 * dominant {@link SemanticHint} if one cleared the reporting threshold.
 */
public final class TypeInference {
    private final PrimitiveType type;
    private final double confidence;
    @Nullable
    private final SemanticHint semanticHint;
    private final double semanticHintRatio;
    private final Map<PrimitiveType, Long> votes;
    private final long totalVotes;

    public TypeInference(PrimitiveType type, double confidence, @Nullable SemanticHint semanticHint,
            double semanticHintRatio, Map<PrimitiveType, Long> votes, long totalVotes) {
        this.type = type;
        this.confidence = confidence;
        this.semanticHint = semanticHint;
        this.semanticHintRatio = semanticHintRatio;
        final Map<PrimitiveType, Long> copy = new EnumMap<>(PrimitiveType.class);
        copy.putAll(votes);
        this.votes = Collections.unmodifiableMap(copy);
        this.totalVotes = totalVotes;
    }

    /** The result for a column without any non-null value. */
    public static TypeInference unknown() {
        return new TypeInference(PrimitiveType.UNKNOWN, 0.0, null, 0.0, new EnumMap<>(PrimitiveType.class), 0);
    }

    public PrimitiveType type() {
        return type;
    }

    /** Winning votes divided by all non-null votes, in [0, 1]. */
    public double confidence() {
        return confidence;
    }

    @Nullable
    public SemanticHint semanticHint() {
        return semanticHint;
    }

    /** Share of sampled non-null cells matching {@link #semanticHint()}; 0 when there is no hint. */
    public double semanticHintRatio() {
        return semanticHintRatio;
    }

    /** Votes per type. Types that received no vote are absent. */
    public Map<PrimitiveType, Long> votes() {
        return votes;
    }

    /** Number of non-null cells that voted. Nulls never vote. */
    public long totalVotes() {
        return totalVotes;
    }

    @Override
    public String toString() {
        return "TypeInference{" + type + ", confidence=" + confidence
                + (semanticHint == null ? "" : ", hint=" + semanticHint) + '}';
    }
}
