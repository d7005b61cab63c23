package io.deephaven.csvprofiler.inference;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Tallies per-cell type votes and semantic-hint matches for one column. Only non-null cells vote. After
 * {@code sampleLimit} votes the tally freezes, which bounds the cost of inference on very large files; the column's
 * statistics keep accumulating regardless.
 */
public final class TypeVoter {
    /** Minimum share of non-null cells that must match a semantic hint before it is reported. */
    public static final double HINT_THRESHOLD = 0.8;

    private static final SemanticHint[] HINTS = SemanticHint.values();

    private final SemanticMatcher matcher;
    private final long sampleLimit;
    private final int categoricalMaxDistinct;
    private final long[] votes = new long[PrimitiveType.values().length];
    private final long[] hintMatches = new long[HINTS.length];
    private long totalVotes;
    /** Distinct text values, bounded at {@code categoricalMaxDistinct + 1}; cleared once that bound is passed. */
    private final Set<String> distinctText = new HashSet<>();
    private boolean distinctOverflow;

    /**
     * @param matcher Semantic matcher for this column.
     * @param sampleLimit Number of non-null votes after which the tally freezes.
     * @param categoricalMaxDistinct The maximum number of distinct text values for a CATEGORICAL column.
     */
    public TypeVoter(final SemanticMatcher matcher, final long sampleLimit, final int categoricalMaxDistinct) {
        this.matcher = matcher;
        this.sampleLimit = sampleLimit;
        this.categoricalMaxDistinct = categoricalMaxDistinct;
    }

    /**
     * Record the vote of one non-null cell.
     *
     * @param kind The kind the cell classified as (BOOLEAN, INTEGER, FLOAT, DATE or TEXT).
     * @param value The cell text.
     */
    public void vote(final PrimitiveType kind, final String value) {
        if (totalVotes >= sampleLimit) {
            return;
        }
        ++totalVotes;
        ++votes[kind.ordinal()];
        if (kind == PrimitiveType.TEXT && !distinctOverflow) {
            distinctText.add(value);
            if (distinctText.size() > categoricalMaxDistinct) {
                distinctOverflow = true;
                distinctText.clear();
            }
        }
        for (final SemanticHint hint : HINTS) {
            // Dates and plain numbers are easily mistaken for phone numbers.
            if (hint == SemanticHint.PHONE && kind != PrimitiveType.TEXT) {
                continue;
            }
            if (matcher.matches(hint, value)) {
                ++hintMatches[hint.ordinal()];
            }
        }
    }

    /** Whether the tally is frozen. */
    public boolean isSettled() {
        return totalVotes >= sampleLimit;
    }

    public long totalVotes() {
        return totalVotes;
    }

    /**
     * Converge the tally into a {@link TypeInference}. May be called repeatedly (the driver peeks at the provisional
     * type at the end of the settling window).
     */
    public TypeInference result() {
        if (totalVotes == 0) {
            return TypeInference.unknown();
        }
        final long[] effective = votes.clone();
        final long textVotes = effective[PrimitiveType.TEXT.ordinal()];
        if (textVotes > 0 && !distinctOverflow && (long) distinctText.size() * 2 <= textVotes) {
            effective[PrimitiveType.CATEGORICAL.ordinal()] += textVotes;
            effective[PrimitiveType.TEXT.ordinal()] = 0;
        }

        // Strictly-greater comparison in declaration order gives ties to the more specific type.
        PrimitiveType winner = PrimitiveType.BOOLEAN;
        for (final PrimitiveType candidate : PrimitiveType.values()) {
            if (candidate != PrimitiveType.UNKNOWN && effective[candidate.ordinal()] > effective[winner.ordinal()]) {
                winner = candidate;
            }
        }
        long winningVotes = effective[winner.ordinal()];
        if (winner.isNumeric()) {
            // Every integer is also a valid float, so a mixed numeric column widens to FLOAT.
            final long intVotes = effective[PrimitiveType.INTEGER.ordinal()];
            final long floatVotes = effective[PrimitiveType.FLOAT.ordinal()];
            if (floatVotes > 0) {
                winner = PrimitiveType.FLOAT;
                winningVotes = intVotes + floatVotes;
            }
        }

        SemanticHint bestHint = null;
        long bestMatches = 0;
        for (final SemanticHint hint : HINTS) {
            if (hintMatches[hint.ordinal()] > bestMatches) {
                bestHint = hint;
                bestMatches = hintMatches[hint.ordinal()];
            }
        }
        final double hintRatio = (double) bestMatches / totalVotes;
        if (hintRatio < HINT_THRESHOLD) {
            bestHint = null;
        }

        final Map<PrimitiveType, Long> voteMap = new EnumMap<>(PrimitiveType.class);
        for (final PrimitiveType type : PrimitiveType.values()) {
            if (effective[type.ordinal()] > 0) {
                voteMap.put(type, effective[type.ordinal()]);
            }
        }
        return new TypeInference(winner, (double) winningVotes / totalVotes, bestHint,
                bestHint == null ? 0.0 : hintRatio, voteMap, totalVotes);
    }

    /**
     * Apply the name-based identifier rule: a column named like a key whose values are all distinct is an identifier,
     * unless a pattern-based hint already won.
     *
     * @param inference The result of {@link #result()}.
     * @param allDistinct Whether every non-null value of the column occurred once.
     * @return {@code inference}, possibly with an IDENTIFIER hint added.
     */
    public TypeInference applyIdentifierRule(final TypeInference inference, final boolean allDistinct) {
        if (inference.semanticHint() != null || !allDistinct || !matcher.identifierName()
                || inference.totalVotes() < 2) {
            return inference;
        }
        return new TypeInference(inference.type(), inference.confidence(), SemanticHint.IDENTIFIER, 1.0,
                inference.votes(), inference.totalVotes());
    }
}
