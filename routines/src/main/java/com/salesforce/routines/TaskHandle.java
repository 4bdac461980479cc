/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.routines;

import java.util.concurrent.CompletableFuture;

/**
 * A spawned task, as seen from outside the scheduler.
 *
 * @author hal.hildebrand
 */
public interface TaskHandle {

    long getId();

    String getName();

    TaskState getState();

    boolean isDone();

    /**
     * @return a future completed when the task's body returns, or completed exceptionally with whatever the body
     *         threw. Blocking on it from inside a task holds that task's worker slot.
     */
    CompletableFuture<Void> onCompletion();
}
