package io.deephaven.csvprofiler.processing;

/**
 * Reports current heap usage. The default reads {@link Runtime}; tests substitute a scripted monitor.
 */
@FunctionalInterface
public interface MemoryMonitor {
    /**
     * A monitor backed by {@link Runtime#totalMemory()} minus {@link Runtime#freeMemory()}.
     */
    static MemoryMonitor runtime() {
        return RuntimeMemoryMonitor.INSTANCE;
    }

    /**
     * @return The number of heap bytes currently in use.
     */
    long usedBytes();

    enum RuntimeMemoryMonitor implements MemoryMonitor {
        INSTANCE;

        @Override
        public long usedBytes() {
            final Runtime runtime = Runtime.getRuntime();
            return runtime.totalMemory() - runtime.freeMemory();
        }
    }
}
