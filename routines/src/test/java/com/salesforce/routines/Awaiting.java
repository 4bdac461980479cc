/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.routines;

import static org.junit.jupiter.api.Assertions.fail;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * @author hal.hildebrand
 */
final class Awaiting {

    /**
     * Spin until the condition holds, failing after a few seconds.
     */
    static void until(BooleanSupplier condition, String description) {
        final var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Timed out waiting for: " + description);
            }
            try {
                Thread.sleep(1);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted waiting for: " + description);
            }
        }
    }

    static void untilState(TaskHandle task, TaskState state) {
        until(() -> task.getState() == state, task.getName() + " to be " + state);
    }

    /**
     * Run the body as the main task, and rethrow whatever it failed with, assertion errors included.
     */
    static void runMain(Scheduler scheduler, Runnable body) throws Throwable {
        final var main = scheduler.spawn("main", body);
        scheduler.run();
        try {
            main.onCompletion().get(5, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            throw e.getCause();
        }
    }

    private Awaiting() {
    }
}
