/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.routines;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.Condition;

/**
 * A scheduler's record of one spawned body. The state and wakeup reason are guarded by the scheduler's lock; the
 * state is volatile so handles can be inspected without it.
 *
 * @author hal.hildebrand
 */
final class Task implements TaskHandle {
    final Runnable                        body;
    Wakeup                                reason;
    final Condition                       signal;
    volatile TaskState                    state      = TaskState.RUNNABLE;
    boolean                               timed;
    private final CompletableFuture<Void> completion = new CompletableFuture<>();
    private final long                    id;
    private final String                  name;
    private final Scheduler               scheduler;

    Task(long id, String name, Runnable body, Scheduler scheduler, Condition signal) {
        this.id = id;
        this.name = name;
        this.body = body;
        this.scheduler = scheduler;
        this.signal = signal;
    }

    @Override
    public long getId() {
        return id;
    }

    @Override
    public String getName() {
        return name;
    }

    Scheduler getScheduler() {
        return scheduler;
    }

    @Override
    public TaskState getState() {
        return state;
    }

    @Override
    public boolean isDone() {
        return state == TaskState.COMPLETED;
    }

    @Override
    public CompletableFuture<Void> onCompletion() {
        return completion;
    }

    @Override
    public String toString() {
        return "Task[" + name + ":" + state + "]";
    }
}
