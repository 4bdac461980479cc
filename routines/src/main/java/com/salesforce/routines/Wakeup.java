/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.routines;

/**
 * Why a parked strand resumed.
 *
 * @author hal.hildebrand
 */
enum Wakeup {
    COMPLETED, DEADLOCKED, INTERRUPTED, TIMED_OUT;
}
