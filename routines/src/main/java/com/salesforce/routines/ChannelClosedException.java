/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.routines;

/**
 * Thrown when sending on a closed channel, or when a blocked sender's channel is closed underneath it. The
 * value was not delivered and remains with the caller.
 *
 * @author hal.hildebrand
 */
public class ChannelClosedException extends RoutineException {
    private static final long serialVersionUID = 1L;

    public ChannelClosedException(String label) {
        super("Send on closed channel: " + label);
    }
}
