package io.deephaven.csvprofiler.detection;

import java.util.Collections;
import java.util.List;

/**
 * The detected dialect plus the ranked alternatives that were considered, best first.
 */
public final class DetectionResult {
    private final DialectProfile profile;
    private final List<EncodingGuess> encodingCandidates;
    private final List<DelimiterScore> delimiterCandidates;

    public DetectionResult(DialectProfile profile, List<EncodingGuess> encodingCandidates,
            List<DelimiterScore> delimiterCandidates) {
        this.profile = profile;
        this.encodingCandidates = Collections.unmodifiableList(encodingCandidates);
        this.delimiterCandidates = Collections.unmodifiableList(delimiterCandidates);
    }

    public DialectProfile profile() {
        return profile;
    }

    public List<EncodingGuess> encodingCandidates() {
        return encodingCandidates;
    }

    public List<DelimiterScore> delimiterCandidates() {
        return delimiterCandidates;
    }
}
