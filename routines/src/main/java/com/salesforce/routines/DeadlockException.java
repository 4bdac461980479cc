/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.routines;

/**
 * Every live task of a {@link Scheduler} is blocked and none can become runnable again. Raised from the
 * pending operation of each blocked task, and from {@link Scheduler#run()} once those tasks have unwound.
 *
 * @author hal.hildebrand
 */
public class DeadlockException extends RoutineException {
    private static final long serialVersionUID = 1L;

    public DeadlockException(String message) {
        super(message);
    }

    public DeadlockException(String message, Throwable cause) {
        super(message, cause);
    }
}
