package io.deephaven.csvprofiler.processing;

import io.deephaven.csvprofiler.profile.ProfileWarning;
import io.deephaven.csvprofiler.profile.ProfileWarning.Severity;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects the warnings of one run in order. Row-level warnings of the same kind are capped: the first
 * {@link #MAX_PER_KIND} are kept individually and the rest are folded into one summary entry per kind.
 */
public final class WarningCollector {
    public static final int MAX_PER_KIND = 10;

    private final List<ProfileWarning> warnings = new ArrayList<>();
    private final Map<String, Long> countsByKind = new LinkedHashMap<>();

    /**
     * Record a dataset-level warning. Never capped.
     */
    public void add(final Severity severity, final String message) {
        warnings.add(new ProfileWarning(severity, message, null));
    }

    /**
     * Record a column-level warning. Never capped.
     */
    public void addForColumn(final Severity severity, final String message, final int columnIndex) {
        warnings.add(new ProfileWarning(severity, message, columnIndex));
    }

    /**
     * Record a row-level warning of {@code kind}, subject to the per-kind cap.
     *
     * @param kind A short name for the kind of problem, used in the summary entry.
     */
    public void addCapped(final String kind, final String message, @Nullable final Integer columnIndex) {
        final long seen = countsByKind.merge(kind, 1L, Long::sum);
        if (seen <= MAX_PER_KIND) {
            warnings.add(new ProfileWarning(Severity.WARNING, message, columnIndex));
        }
    }

    /**
     * @return The warnings in the order recorded, followed by one summary per capped kind.
     */
    public List<ProfileWarning> finish() {
        final List<ProfileWarning> result = new ArrayList<>(warnings);
        for (final Map.Entry<String, Long> entry : countsByKind.entrySet()) {
            final long suppressed = entry.getValue() - MAX_PER_KIND;
            if (suppressed > 0) {
                result.add(new ProfileWarning(Severity.WARNING,
                        String.format("%d more %s warnings were suppressed (%d in total)", suppressed, entry.getKey(),
                                entry.getValue()),
                        null));
            }
        }
        return result;
    }
}
