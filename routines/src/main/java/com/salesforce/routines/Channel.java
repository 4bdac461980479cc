/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.routines;

/**
 * A typed, capacity bounded conduit. Capacity 0 makes every send rendezvous with a receive. Typing a channel as
 * {@link SendChannel} or {@link ReceiveChannel} hands out only one direction.
 *
 * @author hal.hildebrand
 *
 * @param <T>
 */
public interface Channel<T> extends SendChannel<T>, ReceiveChannel<T> {
}
