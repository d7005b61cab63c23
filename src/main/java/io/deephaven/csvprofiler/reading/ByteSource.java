package io.deephaven.csvprofiler.reading;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * A re-openable source of bytes. The profiler opens it once for detection and once more for the full parse.
 */
public interface ByteSource {
    /**
     * Open a fresh stream positioned at the first byte. The caller closes it.
     */
    InputStream open() throws IOException;

    /**
     * The total number of bytes, if known. Used only for progress reporting.
     */
    OptionalLong sizeHint();

    /**
     * A short description for messages, such as the file name.
     */
    String description();

    static ByteSource ofPath(final Path path) {
        Objects.requireNonNull(path);
        return new ByteSource() {
            @Override
            public InputStream open() throws IOException {
                return Files.newInputStream(path);
            }

            @Override
            public OptionalLong sizeHint() {
                try {
                    return OptionalLong.of(Files.size(path));
                } catch (IOException e) {
                    return OptionalLong.empty();
                }
            }

            @Override
            public String description() {
                return path.toString();
            }
        };
    }

    static ByteSource ofBytes(final byte[] bytes, final String description) {
        Objects.requireNonNull(bytes);
        return new ByteSource() {
            @Override
            public InputStream open() {
                return new ByteArrayInputStream(bytes);
            }

            @Override
            public OptionalLong sizeHint() {
                return OptionalLong.of(bytes.length);
            }

            @Override
            public String description() {
                return description;
            }
        };
    }
}
