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
public class DoubleCloseException extends RoutineException {
    private static final long serialVersionUID = 1L;

    public DoubleCloseException(String label) {
        super("Channel already closed: " + label);
    }
}
