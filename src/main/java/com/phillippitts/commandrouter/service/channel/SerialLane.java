package com.phillippitts.commandrouter.service.channel;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs tasks one at a time, in submission order, on a shared executor.
 *
 * <p>At most one drain task per lane is on the executor at any time, so lanes of different
 * connections run concurrently while each lane stays strictly sequential.
 */
final class SerialLane {

    private static final Logger LOG = LogManager.getLogger(SerialLane.class);

    private final Executor executor;
    private final Lock lock = new ReentrantLock();
    private final Deque<Runnable> queue = new ArrayDeque<>();
    private boolean draining;

    SerialLane(Executor executor) {
        this.executor = executor;
    }

    /**
     * Queues a task behind any earlier ones.
     *
     * @throws RejectedExecutionException if the shared executor is saturated; the task is not queued
     */
    void submit(Runnable task) {
        lock.lock();
        try {
            queue.addLast(task);
            if (draining) {
                return;
            }
            draining = true;
        } finally {
            lock.unlock();
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            lock.lock();
            try {
                queue.remove(task);
                draining = false;
            } finally {
                lock.unlock();
            }
            throw e;
        }
    }

    int pending() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    private void drain() {
        boolean emptied = false;
        try {
            while (true) {
                Runnable next;
                lock.lock();
                try {
                    next = queue.pollFirst();
                    if (next == null) {
                        draining = false;
                        emptied = true;
                        return;
                    }
                } finally {
                    lock.unlock();
                }
                try {
                    next.run();
                } catch (RuntimeException e) {
                    // Keep the lane alive for later commands
                    LOG.error("Lane task failed", e);
                }
            }
        } finally {
            if (!emptied) {
                resume();
            }
        }
    }

    /**
     * Called when a drain ends abnormally (a task threw an {@link Error}): hands the remaining
     * tasks to a fresh drain, or clears the flag so the next submit starts one.
     */
    private void resume() {
        boolean hasWork;
        lock.lock();
        try {
            hasWork = !queue.isEmpty();
            draining = hasWork;
        } finally {
            lock.unlock();
        }
        if (!hasWork) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            lock.lock();
            try {
                draining = false;
            } finally {
                lock.unlock();
            }
            LOG.error("Lane could not resume; {} queued tasks wait for the next submit", pending());
        }
    }
}
