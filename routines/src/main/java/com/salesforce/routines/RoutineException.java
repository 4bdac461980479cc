/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.routines;

/**
 * Base of the failures raised by channels, mutexes and the scheduler. All of them are programmer errors or
 * fatal conditions, so they are unchecked.
 *
 * @author hal.hildebrand
 */
public class RoutineException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public RoutineException(String message) {
        super(message);
    }

    public RoutineException(String message, Throwable cause) {
        super(message, cause);
    }
}
