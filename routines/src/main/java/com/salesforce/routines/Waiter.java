/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.routines;

/**
 * A blocked sender or receiver queued on a channel. Senders carry the value they are offering. Identity
 * equality, so a select can withdraw exactly the waiters it queued.
 *
 * @author hal.hildebrand
 */
final class Waiter<T> {
    final int       index;
    final Selection selection;
    final T         value;

    Waiter(Selection selection, int index, T value) {
        this.selection = selection;
        this.index = index;
        this.value = value;
    }
}
