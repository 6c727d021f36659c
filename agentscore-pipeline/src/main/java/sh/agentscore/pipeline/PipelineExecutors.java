// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.pipeline;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools used by the pipeline loops.
 *
 * <p>Threads are platform daemon threads named {@code agentscore-<role>-N}, so a stuck
 * loop is easy to spot in a thread dump and never keeps the JVM alive on its own.
 */
public final class PipelineExecutors {

    private PipelineExecutors() {
        // Utility class
    }

    /**
     * Fixed-size pool for blocking work such as RPC calls and JDBC writes.
     *
     * @param role    thread name component
     * @param threads pool size
     * @return the pool
     * @throws IllegalArgumentException if threads is less than 1
     */
    public static ExecutorService newBlockingExecutor(final String role, final int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got: " + threads);
        }
        return Executors.newFixedThreadPool(threads, threadFactory(role));
    }

    /** Factory for daemon threads named {@code agentscore-<role>-N}. */
    public static ThreadFactory threadFactory(final String role) {
        final AtomicInteger ids = new AtomicInteger(0);
        return r -> {
            // Mask off sign bit to ensure non-negative thread IDs even after integer overflow
            final int id = ids.getAndIncrement() & 0x7FFFFFFF;
            final Thread t = new Thread(r, "agentscore-" + role + "-" + id);
            t.setDaemon(true);
            return t;
        };
    }
}
