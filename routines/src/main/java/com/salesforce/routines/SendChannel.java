/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.routines;

import java.util.concurrent.TimeUnit;

/**
 * The sending side of a channel.
 *
 * @author hal.hildebrand
 */
public interface SendChannel<T> {

    int capacity();

    /**
     * Close the channel. Buffered values can still be received; blocked receivers observe the closed signal and
     * blocked senders fail with {@link ChannelClosedException}.
     *
     * @throws DoubleCloseException if the channel is already closed
     */
    void close();

    boolean isClosed();

    /**
     * Send without blocking.
     *
     * @return true if a receiver took the value or it was buffered, false if the send would have blocked
     * @throws ChannelClosedException if the channel is closed
     */
    boolean offer(T value);

    /**
     * Send, blocking no longer than the timeout.
     *
     * @return false if the timeout expired before the value was taken or buffered
     * @throws ChannelClosedException if the channel is or becomes closed
     */
    boolean offer(T value, long timeout, TimeUnit unit);

    /**
     * Send, blocking until a receiver takes the value or buffer space frees.
     *
     * @throws ChannelClosedException if the channel is or becomes closed
     */
    void send(T value);

    int size();
}
