/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.routines;

/**
 * A shared int incremented without any synchronization. Concurrent increments lose updates; this is the
 * counterpart {@link SafeCounter} is measured against, and must stay unsynchronized.
 *
 * @author hal.hildebrand
 */
public class RacyCounter {
    private int value;

    public int get() {
        return value;
    }

    public void increment() {
        value++;
    }
}
