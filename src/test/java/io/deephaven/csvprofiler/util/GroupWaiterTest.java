package io.deephaven.csvprofiler.util;

import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

public class GroupWaiterTest {
    @Test
    @Timeout(10)
    public void waitsForEveryTask() throws Exception {
        final ExecutorService exec = Executors.newFixedThreadPool(4);
        try {
            final AtomicInteger done = new AtomicInteger();
            final GroupWaiter waiter = new GroupWaiter(exec);
            for (int ii = 0; ii < 20; ++ii) {
                waiter.submit(() -> {
                    Thread.sleep(5);
                    return done.incrementAndGet();
                });
            }
            waiter.waitAll();
            Assertions.assertThat(done.get()).isEqualTo(20);
        } finally {
            exec.shutdown();
        }
    }

    @Test
    public void directExecutorAndNoTasks() throws Exception {
        final AtomicInteger done = new AtomicInteger();
        final GroupWaiter waiter = new GroupWaiter(Runnable::run);
        waiter.waitAll();
        waiter.submit(done::incrementAndGet);
        waiter.waitAll();
        Assertions.assertThat(done.get()).isEqualTo(1);
    }

    @Test
    @Timeout(10)
    public void firstFailureIsRethrown() {
        final ExecutorService exec = Executors.newFixedThreadPool(2);
        try {
            final GroupWaiter waiter = new GroupWaiter(exec);
            waiter.submit(() -> {
                throw new IllegalStateException("column 3 exploded");
            });
            Assertions.assertThatThrownBy(waiter::waitAll)
                    .isInstanceOf(CsvProfilerException.class)
                    .hasMessageContaining("column 3 exploded")
                    .hasCauseInstanceOf(IllegalStateException.class);
        } finally {
            exec.shutdown();
        }
    }
}
