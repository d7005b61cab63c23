package io.deephaven.csvprofiler;

import io.deephaven.csvprofiler.detection.DetectionResult;
import io.deephaven.csvprofiler.inference.PrimitiveType;
import io.deephaven.csvprofiler.processing.CancellationToken;
import io.deephaven.csvprofiler.processing.ProgressListener;
import io.deephaven.csvprofiler.profile.ColumnProfile;
import io.deephaven.csvprofiler.profile.CorrelationEntry;
import io.deephaven.csvprofiler.profile.DatasetProfile;
import io.deephaven.csvprofiler.profile.NumericSummary;
import io.deephaven.csvprofiler.profile.ProfileWarning;
import io.deephaven.csvprofiler.testutil.ProfilerTestUtil;
import io.deephaven.csvprofiler.util.CsvProfilerException;
import io.deephaven.csvprofiler.util.CsvProfilerException.Reason;
import org.assertj.core.api.Assertions;
import org.assertj.core.data.Offset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.SplittableRandom;
import java.util.stream.Collectors;

public class CsvProfilerTest {
    private static final long MB = 1024L * 1024L;

    private static final String PEOPLE = "id,name,score\n"
            + "1,\"Smith, John\",90\n"
            + "2,Alice,85\n"
            + "3,Bob,\n"
            + "4,Carol,70\n"
            + "5,Dave,65\n"
            + "6,Eve,60,extra\n";

    /**
     * Settings whose memory readings never trigger chunk resizing or sampling.
     */
    private static CsvProfilerSpecs.Builder steady() {
        return CsvProfilerSpecs.builder().memoryMonitor(() -> 40 * MB);
    }

    /**
     * Rows whose second column is twice the first plus noise, and whose third column is categorical.
     */
    private static String numbers(final int rows) {
        final SplittableRandom random = new SplittableRandom(7);
        final StringBuilder sb = new StringBuilder("x,y,group\n");
        for (int ii = 0; ii < rows; ++ii) {
            final double x = random.nextDouble() * 100;
            sb.append(String.format(Locale.ROOT, "%.3f,%.3f,g%d\n", x, 2 * x + random.nextDouble(), ii % 4));
        }
        return sb.toString();
    }

    @Test
    public void quotedEmbeddedCommaMissingValueAndRaggedRow() throws CsvProfilerException {
        final DatasetProfile profile = ProfilerTestUtil.profile(PEOPLE);
        Assertions.assertThat(profile.dialect().delimiter()).isEqualTo(',');
        Assertions.assertThat(profile.dialect().hasHeaderRow()).isTrue();
        Assertions.assertThat(profile.rowCount()).isEqualTo(6);
        Assertions.assertThat(profile.raggedRows()).isEqualTo(1);
        Assertions.assertThat(profile.columnCount()).isEqualTo(3);

        final ColumnProfile name = profile.column("name");
        Assertions.assertThat(name.topValues()).extracting(ColumnProfile.ValueCount::value).contains("Smith, John");
        Assertions.assertThat(name.nullCount()).isZero();

        final ColumnProfile score = profile.column("score");
        Assertions.assertThat(score.nullCount()).isEqualTo(1);
        Assertions.assertThat(score.type()).isEqualTo(PrimitiveType.INTEGER);
        Assertions.assertThat(score.confidence()).isEqualTo(1.0);
        Assertions.assertThat(score.numeric().mean().value()).isCloseTo(74.0, Offset.offset(1e-9));

        Assertions.assertThat(profile.warnings()).extracting(ProfileWarning::message)
                .contains("Line 7 has 4 fields, expected 3");
    }

    @Test
    public void constantColumnHasZeroVarianceAndNoShapeMoments() throws CsvProfilerException {
        final CsvProfilerSpecs specs = CsvProfilerSpecs.builder().hasHeaderRow(true).build();
        final DatasetProfile profile = ProfilerTestUtil.profile(specs, "v\n" + "5\n".repeat(10));
        final NumericSummary summary = profile.column("v").numeric();
        Assertions.assertThat(summary.count()).isEqualTo(10);
        Assertions.assertThat(summary.variance().value()).isZero();
        Assertions.assertThat(summary.skewness().isComputed()).isFalse();
        Assertions.assertThat(summary.excessKurtosis().isComputed()).isFalse();
    }

    @Test
    public void headerOnlyInputSucceedsWithAWarning() throws CsvProfilerException {
        final CsvProfilerSpecs specs = CsvProfilerSpecs.builder().hasHeaderRow(true).build();
        final DatasetProfile profile = ProfilerTestUtil.profile(specs, "a,b,c\n");
        Assertions.assertThat(profile.rowCount()).isZero();
        Assertions.assertThat(profile.columns()).extracting(ColumnProfile::name).containsExactly("a", "b", "c");
        Assertions.assertThat(profile.columns()).extracting(ColumnProfile::type)
                .containsOnly(PrimitiveType.UNKNOWN);
        Assertions.assertThat(profile.warnings()).extracting(ProfileWarning::message)
                .contains("The input has no data rows; only the header was read");
    }

    @Test
    public void emptyInputIsFatal() {
        Assertions.assertThatThrownBy(() -> ProfilerTestUtil.profile(""))
                .isInstanceOf(CsvProfilerException.class)
                .extracting(e -> ((CsvProfilerException) e).reason())
                .isEqualTo(Reason.EMPTY_INPUT);
        Assertions.assertThatThrownBy(() -> ProfilerTestUtil.profile("\n\n\n"))
                .isInstanceOf(CsvProfilerException.class)
                .extracting(e -> ((CsvProfilerException) e).reason())
                .isEqualTo(Reason.EMPTY_INPUT);
    }

    @Test
    public void missingFileIsUnreadable(@TempDir final Path dir) {
        final Path missing = dir.resolve("missing.csv");
        Assertions.assertThatThrownBy(() -> CsvProfiler.profile(CsvProfilerSpecs.defaults(), missing))
                .isInstanceOf(CsvProfilerException.class)
                .extracting(e -> ((CsvProfilerException) e).reason())
                .isEqualTo(Reason.SOURCE_UNREADABLE);
    }

    @Test
    public void profilesAFile(@TempDir final Path dir) throws IOException, CsvProfilerException {
        final Path file = dir.resolve("people.csv");
        Files.write(file, PEOPLE.getBytes(StandardCharsets.UTF_8));
        final DatasetProfile profile = CsvProfiler.profile(CsvProfilerSpecs.defaults(), file);
        Assertions.assertThat(profile.source()).isEqualTo(file.toString());
        Assertions.assertThat(profile.rowCount()).isEqualTo(6);
        Assertions.assertThat(profile.metrics().bytesRead()).isEqualTo(Files.size(file));
    }

    @Test
    public void detectOnly() throws CsvProfilerException {
        final DetectionResult result =
                CsvProfiler.detect(CsvProfilerSpecs.defaults(), ProfilerTestUtil.source("a;b\n1;2\n3;4\n"));
        Assertions.assertThat(result.profile().delimiter()).isEqualTo(';');
    }

    @Test
    public void cancelledBeforeProfiling() {
        final CancellationToken token = new CancellationToken();
        token.cancel();
        Assertions.assertThatThrownBy(() -> CsvProfiler.profile(CsvProfilerSpecs.defaults(),
                ProfilerTestUtil.source(PEOPLE), ProgressListener.NONE, token))
                .isInstanceOf(CsvProfilerException.class)
                .extracting(e -> ((CsvProfilerException) e).reason())
                .isEqualTo(Reason.CANCELLED);
    }

    @Test
    public void cancelledBetweenChunks() {
        final CsvProfilerSpecs specs =
                CsvProfilerSpecs.builder().chunkSize(50).minChunkSize(10).maxChunkSize(100).build();
        final CancellationToken token = new CancellationToken();
        final List<Long> reports = new ArrayList<>();
        final ProgressListener listener = (stage, rows, pct, message) -> {
            if (stage.equals("profiling")) {
                reports.add(rows);
                token.cancel();
            }
        };
        Assertions.assertThatThrownBy(
                () -> CsvProfiler.profile(specs, ProfilerTestUtil.source(numbers(1000)), listener, token))
                .isInstanceOf(CsvProfilerException.class)
                .extracting(e -> ((CsvProfilerException) e).reason())
                .isEqualTo(Reason.CANCELLED);
        Assertions.assertThat(reports).containsExactly(50L);
    }

    @Test
    public void maxRowsTruncates() throws CsvProfilerException {
        final CsvProfilerSpecs specs = steady().maxRows(10).build();
        final DatasetProfile profile = ProfilerTestUtil.profile(specs, numbers(100));
        Assertions.assertThat(profile.rowCount()).isEqualTo(10);
        Assertions.assertThat(profile.truncated()).isTrue();
        Assertions.assertThat(profile.warnings()).extracting(ProfileWarning::message)
                .anyMatch(message -> message.startsWith("Stopped after 10 data rows"));

        final DatasetProfile exact = ProfilerTestUtil.profile(CsvProfilerSpecs.builder().maxRows(100).build(),
                numbers(100));
        Assertions.assertThat(exact.rowCount()).isEqualTo(100);
        Assertions.assertThat(exact.truncated()).isFalse();
    }

    @Test
    public void progressIsReportedPerChunk() throws CsvProfilerException {
        final CsvProfilerSpecs specs = steady().chunkSize(100).minChunkSize(100).maxChunkSize(100).build();
        final List<String> stages = new ArrayList<>();
        final List<Integer> percentages = new ArrayList<>();
        final ProgressListener listener = (stage, rows, pct, message) -> {
            stages.add(stage);
            percentages.add(pct);
        };
        final DatasetProfile profile = CsvProfiler.profile(specs, ProfilerTestUtil.source(numbers(450)), listener,
                new CancellationToken());
        Assertions.assertThat(stages).containsExactly("detecting", "profiling", "profiling", "profiling",
                "profiling", "profiling", "complete");
        Assertions.assertThat(percentages).isSorted();
        Assertions.assertThat(percentages.get(percentages.size() - 1)).isEqualTo(100);
        Assertions.assertThat(profile.metrics().chunksProcessed()).isEqualTo(5);
        Assertions.assertThat(profile.metrics().finalChunkSize()).isEqualTo(100);
    }

    @Test
    public void concurrentAndSequentialRunsAgree() throws CsvProfilerException {
        final String text = numbers(3000);
        final DatasetProfile sequential = ProfilerTestUtil.profile(steady().build(), text);
        final DatasetProfile concurrent = ProfilerTestUtil.profile(steady().concurrent(true).build(), text);
        for (int ii = 0; ii < sequential.columnCount(); ++ii) {
            final ColumnProfile expected = sequential.columns().get(ii);
            final ColumnProfile actual = concurrent.columns().get(ii);
            Assertions.assertThat(actual.type()).isEqualTo(expected.type());
            Assertions.assertThat(actual.nullCount()).isEqualTo(expected.nullCount());
            Assertions.assertThat(actual.topValues()).extracting(ColumnProfile.ValueCount::value)
                    .containsExactlyElementsOf(expected.topValues().stream()
                            .map(ColumnProfile.ValueCount::value)
                            .collect(Collectors.toList()));
        }
        Assertions.assertThat(concurrent.column("x").numeric().mean())
                .isEqualTo(sequential.column("x").numeric().mean());
        Assertions.assertThat(concurrent.correlations()).extracting(CorrelationEntry::coefficient)
                .containsExactlyElementsOf(sequential.correlations().stream()
                        .map(CorrelationEntry::coefficient)
                        .collect(Collectors.toList()));
    }

    @Test
    public void correlatedColumns() throws CsvProfilerException {
        final DatasetProfile profile = ProfilerTestUtil.profile(steady().build(), numbers(2000));
        Assertions.assertThat(profile.column("group").type()).isEqualTo(PrimitiveType.CATEGORICAL);
        Assertions.assertThat(profile.correlations()).hasSize(1);
        final CorrelationEntry entry = profile.correlations().get(0);
        Assertions.assertThat(entry.firstName()).isEqualTo("x");
        Assertions.assertThat(entry.secondName()).isEqualTo("y");
        Assertions.assertThat(entry.pairCount()).isEqualTo(2000);
        Assertions.assertThat(entry.coefficient().value()).isGreaterThan(0.99);
        Assertions.assertThat(entry.pValue().value()).isLessThan(1e-6);
        Assertions.assertThat(entry.isSignificant()).isTrue();
    }

    @Test
    public void memoryPressureShrinksThenSamples() throws CsvProfilerException {
        final CsvProfilerSpecs specs = CsvProfilerSpecs.builder()
                .chunkSize(100)
                .minChunkSize(50)
                .maxChunkSize(100)
                .memoryMonitor(() -> 300 * MB)
                .build();
        final DatasetProfile profile = ProfilerTestUtil.profile(specs, numbers(5000));
        Assertions.assertThat(profile.rowCount()).isEqualTo(5000);
        Assertions.assertThat(profile.metrics().samplingMode()).isTrue();
        Assertions.assertThat(profile.metrics().finalChunkSize()).isEqualTo(50);
        Assertions.assertThat(profile.metrics().peakMemoryBytes()).isEqualTo(300 * MB);
        // Chunks of 100, 60 and 50 rows are analysed in full, then roughly one row in ten.
        Assertions.assertThat(profile.rowsAnalysed()).isBetween(200L, 1200L);
        Assertions.assertThat(profile.column("x").totalCount()).isEqualTo(profile.rowsAnalysed());
        Assertions.assertThat(profile.warnings()).extracting(ProfileWarning::message)
                .anyMatch(message -> message.startsWith("Memory ceiling exceeded"));
    }

    @Test
    public void lowMemoryGrowsTheChunk() throws CsvProfilerException {
        final CsvProfilerSpecs specs = CsvProfilerSpecs.builder().memoryMonitor(() -> MB).build();
        final DatasetProfile profile = ProfilerTestUtil.profile(specs, numbers(5000));
        Assertions.assertThat(profile.metrics().finalChunkSize()).isGreaterThan(500);
        Assertions.assertThat(profile.metrics().samplingMode()).isFalse();
        Assertions.assertThat(profile.rowsAnalysed()).isEqualTo(5000);
    }

    @Test
    @Timeout(120)
    public void largeInputStreamsInBoundedMemory() throws CsvProfilerException {
        final long repeats = 100_000;
        final DatasetProfile profile = CsvProfiler.profile(steady().build(),
                ProfilerTestUtil.repeating("a,b,label\n", "1,10,x\n2,20,y\n3,30,z\n4,40,w\n", repeats),
                ProgressListener.NONE, new CancellationToken());
        Assertions.assertThat(profile.rowCount()).isEqualTo(4 * repeats);
        Assertions.assertThat(profile.truncated()).isFalse();
        final NumericSummary a = profile.column("a").numeric();
        Assertions.assertThat(a.mean().value()).isCloseTo(2.5, Offset.offset(1e-9));
        Assertions.assertThat(a.min().value()).isEqualTo(1.0);
        Assertions.assertThat(a.max().value()).isEqualTo(4.0);
        Assertions.assertThat(profile.column("label").topValues()).hasSize(4);
        Assertions.assertThat(profile.column("label").topValuesExact()).isTrue();
        Assertions.assertThat(profile.correlations().get(0).coefficient().value())
                .isCloseTo(1.0, Offset.offset(1e-9));
    }
}
