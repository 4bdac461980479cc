/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.routines;

import java.util.concurrent.TimeUnit;

/**
 * The receiving side of a channel. Iteration drains the channel until it is closed and empty; every call to
 * {@link #iterator()} starts a new drain of whatever is left.
 *
 * @author hal.hildebrand
 */
public interface ReceiveChannel<T> extends Iterable<T> {

    int capacity();

    boolean isClosed();

    /**
     * Receive without blocking.
     *
     * @return the received value, or null if the receive would have blocked
     */
    Received<T> poll();

    /**
     * Receive, blocking no longer than the timeout.
     *
     * @return the received value, or null if the timeout expired
     */
    Received<T> poll(long timeout, TimeUnit unit);

    /**
     * Receive, blocking while the channel is empty and open. Once the channel is closed and drained, answers the
     * zero value with {@code open == false} immediately, on every call.
     */
    Received<T> receive();

    int size();
}
