package io.deephaven.csvprofiler.processing;

import io.deephaven.csvprofiler.processing.StreamingSession.Adjustment;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

public class StreamingSessionTest {
    private static final long MB = 1024L * 1024L;

    private static StreamingSession session(final int initial) {
        return new StreamingSession(initial, 50, 2000, 100, 200, new CancellationToken());
    }

    @Test
    public void shrinksToTheMinimumThenSamplesAboveTheCeiling() {
        final StreamingSession session = session(500);
        final int[] expected = {300, 180, 108, 64, 50};
        for (final int size : expected) {
            Assertions.assertThat(session.afterChunk(10, 150 * MB)).isEqualTo(Adjustment.SHRUNK);
            Assertions.assertThat(session.chunkSize()).isEqualTo(size);
        }
        Assertions.assertThat(session.afterChunk(10, 150 * MB)).isEqualTo(Adjustment.NONE);
        Assertions.assertThat(session.samplingMode()).isFalse();

        Assertions.assertThat(session.afterChunk(10, 250 * MB)).isEqualTo(Adjustment.ENTERED_SAMPLING);
        Assertions.assertThat(session.samplingMode()).isTrue();
        Assertions.assertThat(session.afterChunk(10, 250 * MB)).isEqualTo(Adjustment.NONE);
        Assertions.assertThat(session.chunkSize()).isEqualTo(50);
    }

    @Test
    public void ceilingOnlyMattersAtTheMinimum() {
        final StreamingSession session = session(500);
        Assertions.assertThat(session.afterChunk(10, 900 * MB)).isEqualTo(Adjustment.SHRUNK);
        Assertions.assertThat(session.samplingMode()).isFalse();
    }

    @Test
    public void growsUnderLowMemoryUpToTheMaximum() {
        final StreamingSession session = session(500);
        Assertions.assertThat(session.afterChunk(500, 10 * MB)).isEqualTo(Adjustment.GREW);
        Assertions.assertThat(session.chunkSize()).isEqualTo(550);

        final StreamingSession near = session(1950);
        Assertions.assertThat(near.afterChunk(1950, 10 * MB)).isEqualTo(Adjustment.GREW);
        Assertions.assertThat(near.chunkSize()).isEqualTo(2000);
        Assertions.assertThat(near.afterChunk(2000, 10 * MB)).isEqualTo(Adjustment.NONE);
    }

    @Test
    public void smallChunksAlwaysGrowByAtLeastOne() {
        final StreamingSession session = new StreamingSession(2, 1, 100, 100, 200, new CancellationToken());
        session.afterChunk(2, 0);
        Assertions.assertThat(session.chunkSize()).isEqualTo(3);
    }

    @Test
    public void moderateMemoryLeavesTheChunkAlone() {
        final StreamingSession session = session(500);
        Assertions.assertThat(session.afterChunk(500, 60 * MB)).isEqualTo(Adjustment.NONE);
        Assertions.assertThat(session.chunkSize()).isEqualTo(500);
    }

    @Test
    public void countersAndPeak() {
        final CancellationToken token = new CancellationToken();
        final StreamingSession session = new StreamingSession(500, 50, 2000, 100, 200, token);
        session.rowRead();
        session.rowRead();
        session.rowRead();
        session.afterChunk(2, 40 * MB);
        session.afterChunk(1, 20 * MB);
        Assertions.assertThat(session.rowsRead()).isEqualTo(3);
        Assertions.assertThat(session.rowsAnalysed()).isEqualTo(3);
        Assertions.assertThat(session.chunksProcessed()).isEqualTo(2);
        Assertions.assertThat(session.memorySamples()).isEqualTo(2);
        Assertions.assertThat(session.peakMemoryBytes()).isEqualTo(40 * MB);
        Assertions.assertThat(session.isCancelled()).isFalse();
        token.cancel();
        Assertions.assertThat(session.isCancelled()).isTrue();
    }
}
