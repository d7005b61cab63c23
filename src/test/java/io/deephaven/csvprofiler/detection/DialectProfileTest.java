package io.deephaven.csvprofiler.detection;

import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

public class DialectProfileTest {
    private static DialectProfile.Builder valid() {
        return DialectProfile.builder()
                .encoding("UTF-8")
                .encodingConfidence(0.9)
                .delimiter(',')
                .delimiterConfidence(1.0)
                .quote('"')
                .quoteConfidence(0.7)
                .hasHeaderRow(true)
                .headerConfidence(0.8);
    }

    @Test
    public void overallConfidenceIsTheWeakestStep() {
        final DialectProfile profile = valid().build();
        Assertions.assertThat(profile.overallConfidence()).isEqualTo(0.7);
        Assertions.assertThat(profile.bomLength()).isZero();
        Assertions.assertThat(profile.lineEnding()).isEqualTo(LineEnding.LF);
    }

    @Test
    public void unquotedProfileIgnoresQuoteConfidence() {
        final DialectProfile profile = valid().quote(null).quoteConfidence(0.1).build();
        Assertions.assertThat(profile.overallConfidence()).isEqualTo(0.8);
    }

    @Test
    public void validatesEverythingAtOnce() {
        Assertions.assertThatThrownBy(() -> valid()
                .encoding("no-such-charset")
                .delimiterConfidence(1.5)
                .quote(',')
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("encoding 'no-such-charset' is not supported")
                .hasMessageContaining("delimiterConfidence is 1.5")
                .hasMessageContaining("quote ',' conflicts");
    }

    @Test
    public void lineBreakDelimiterIsRejected() {
        Assertions.assertThatThrownBy(() -> valid().delimiter('\n').build())
                .hasMessageContaining("delimiter cannot be a line break");
    }
}
