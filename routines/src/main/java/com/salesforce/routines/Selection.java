/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.routines;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.LockSupport;

/**
 * One blocking episode of a strand: a single send, receive, lock, or the whole of one select. Every waiter the
 * episode registers points back here, and a counterpart must win {@link #tryClaim(int)} before serving any of
 * them, so exactly one registration commits. The strand is the calling task when running in a
 * {@link Scheduler}, otherwise the calling thread.
 *
 * @author hal.hildebrand
 */
final class Selection {
    static final int CANCELLED = -2;

    private static final int PENDING = -1;

    static Object currentStrand() {
        final var task = Scheduler.currentTask();
        return task != null ? task : Thread.currentThread();
    }

    private boolean             closed;
    private volatile boolean    completed;
    private Object              item;
    private final Task          task;
    private final Thread        thread;
    private final AtomicInteger winner = new AtomicInteger(PENDING);

    Selection() {
        task = Scheduler.currentTask();
        thread = Thread.currentThread();
    }

    /**
     * Park until a counterpart completes this selection, the timeout expires or the scheduler gives up on the
     * task. Unless the answer is {@link Wakeup#COMPLETED} the selection has been cancelled, and the caller must
     * withdraw its waiters.
     *
     * @param nanos - the timeout, negative to wait indefinitely
     */
    Wakeup await(long nanos) {
        var wakeup = task != null ? task.getScheduler().park(task, this, nanos) : parkThread(nanos);
        if (wakeup == Wakeup.COMPLETED) {
            return wakeup;
        }
        final boolean interrupted = wakeup == Wakeup.INTERRUPTED;
        if (tryClaim(CANCELLED)) {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
            return wakeup;
        }
        // Lost the race to a counterpart, which completes us while holding its channel lock
        while (!completed) {
            if (task != null) {
                task.getScheduler().park(task, this, -1);
            } else {
                LockSupport.park(this);
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return Wakeup.COMPLETED;
    }

    void complete(Object item, boolean closed) {
        this.item = item;
        this.closed = closed;
        completed = true;
        if (task != null) {
            task.getScheduler().wake(task);
        } else {
            LockSupport.unpark(thread);
        }
    }

    boolean isClaimed() {
        return winner.get() != PENDING;
    }

    boolean isClosed() {
        return closed;
    }

    boolean isCompleted() {
        return completed;
    }

    Object item() {
        return item;
    }

    /**
     * Throw the failure matching an unsuccessful wakeup. Returns normally for a timeout.
     */
    void raise(Wakeup wakeup) {
        switch (wakeup) {
        case DEADLOCKED -> throw task.getScheduler().deadlockOf(task);
        case INTERRUPTED -> throw new CancellationException("Interrupted while blocked");
        default -> {
        }
        }
    }

    Object strand() {
        return task != null ? task : thread;
    }

    boolean tryClaim(int index) {
        return winner.compareAndSet(PENDING, index);
    }

    int winner() {
        return winner.get();
    }

    private Wakeup parkThread(long nanos) {
        final long deadline = nanos < 0 ? 0L : System.nanoTime() + nanos;
        while (!completed) {
            if (Thread.interrupted()) {
                return Wakeup.INTERRUPTED;
            }
            if (nanos < 0) {
                LockSupport.park(this);
            } else {
                final long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return Wakeup.TIMED_OUT;
                }
                LockSupport.parkNanos(this, remaining);
            }
        }
        return Wakeup.COMPLETED;
    }
}
