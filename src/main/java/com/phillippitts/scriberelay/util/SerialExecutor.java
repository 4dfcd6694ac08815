package com.phillippitts.scriberelay.util;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs submitted tasks one at a time, in submission order, on a shared backing executor.
 *
 * <p>Each WebSocket session owns one instance. Tasks of one session never overlap while
 * different sessions still share the same bounded pool.
 *
 * <p>At most one drain loop per instance is handed to the backing executor. The loop runs
 * queued tasks iteratively without holding the monitor, so a backing executor that runs work
 * on the caller's thread (caller-runs rejection) drains the backlog in a flat loop.
 */
public final class SerialExecutor implements Executor {

    private static final Logger LOG = LogManager.getLogger(SerialExecutor.class);

    private final Queue<Runnable> tasks = new ArrayDeque<>();
    private final Executor backing;
    private boolean draining;

    public SerialExecutor(Executor backing) {
        this.backing = Objects.requireNonNull(backing, "backing executor must not be null");
    }

    /**
     * Queues {@code task}. Throws {@link RejectedExecutionException} when the backing executor
     * refuses the drain loop; the task stays queued and runs with the next accepted submission.
     */
    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task must not be null");
        synchronized (this) {
            tasks.add(task);
            if (draining) {
                return;
            }
            draining = true;
        }
        try {
            backing.execute(this::drain);
        } catch (RejectedExecutionException e) {
            synchronized (this) {
                draining = false;
            }
            LOG.warn("Session task loop rejected by backing executor: {}", e.getMessage());
            throw e;
        }
    }

    private void drain() {
        while (true) {
            Runnable next;
            synchronized (this) {
                next = tasks.poll();
                if (next == null) {
                    draining = false;
                    return;
                }
            }
            try {
                next.run();
            } catch (RuntimeException e) {
                LOG.error("Session task failed", e);
            }
        }
    }
}
