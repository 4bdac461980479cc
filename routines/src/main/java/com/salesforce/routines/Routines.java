/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.routines;

import static com.google.common.base.Preconditions.checkState;

/**
 * Shorthand for code running inside a {@link Scheduler}'s tasks.
 *
 * @author hal.hildebrand
 */
public final class Routines {

    public static <T> Channel<T> channel(int capacity) {
        return new SimpleChannel<>(capacity);
    }

    public static <T> Channel<T> channel(int capacity, T zero) {
        return new SimpleChannel<>(null, capacity, zero);
    }

    /**
     * Spawn a task on the scheduler running the caller.
     *
     * @throws IllegalStateException if the caller is not a task
     */
    public static TaskHandle go(Runnable body) {
        final var scheduler = Scheduler.current();
        checkState(scheduler != null, "Not running in a scheduler");
        return scheduler.spawn(body);
    }

    public static Mutex mutex() {
        return new Mutex();
    }

    public static Select select() {
        return new Select();
    }

    private Routines() {
    }
}
