/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.routines;

/**
 * @author hal.hildebrand
 */
public enum TaskState {
    /**
     * Suspended in a channel, select or mutex operation
     */
    BLOCKED,
    /**
     * The body has returned or thrown; the task is no longer in the scheduler
     */
    COMPLETED,
    /**
     * Ready to run, waiting for a worker slot
     */
    RUNNABLE,
    /**
     * Holding a worker slot
     */
    RUNNING;
}
