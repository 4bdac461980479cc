/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.routines;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A channel owning its bounded buffer and its queues of blocked senders and receivers, all guarded by one lock.
 * Blocked receivers only exist while the buffer is empty, and blocked senders only while it is full, so a send
 * serves a waiting receiver directly and a receive from a full buffer refills it from a waiting sender.
 *
 * @author hal.hildebrand
 */
public class SimpleChannel<T> implements Channel<T> {
    private static final AtomicLong SEQUENCE = new AtomicLong();
    private static final Logger     log      = LoggerFactory.getLogger(SimpleChannel.class);

    final long                      id       = SEQUENCE.incrementAndGet();
    final ReentrantLock             lock     = new ReentrantLock();
    private final Deque<T>          buffer;
    private final int               capacity;
    private boolean                 closed;
    private final String            label;
    private final Deque<Waiter<T>>  receivers = new ArrayDeque<>();
    private final Deque<Waiter<T>>  senders   = new ArrayDeque<>();
    private final T                 zero;

    public SimpleChannel(int capacity) {
        this(null, capacity, null);
    }

    public SimpleChannel(String label, int capacity) {
        this(label, capacity, null);
    }

    /**
     * @param label    - used in log and error messages, may be null
     * @param capacity - 0 for an unbuffered channel
     * @param zero     - the value received once the channel is closed and drained
     */
    public SimpleChannel(String label, int capacity, T zero) {
        checkArgument(capacity >= 0, "capacity must be >= 0: %s", capacity);
        this.label = label == null ? "channel-" + id : label;
        this.capacity = capacity;
        this.zero = zero;
        buffer = new ArrayDeque<>(Math.max(1, capacity));
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                throw new DoubleCloseException(label);
            }
            closed = true;
            var failed = 0;
            for (var waiter : receivers) {
                if (waiter.selection.tryClaim(waiter.index)) {
                    waiter.selection.complete(null, true);
                }
            }
            for (var waiter : senders) {
                if (waiter.selection.tryClaim(waiter.index)) {
                    waiter.selection.complete(null, true);
                    failed++;
                }
            }
            receivers.clear();
            senders.clear();
            log.debug("Closed: {} buffered: {} failed senders: {}", label, buffer.size(), failed);
        } finally {
            lock.unlock();
        }
    }

    public String getLabel() {
        return label;
    }

    @Override
    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Iterator<T> iterator() {
        return new Iterator<T>() {
            private Received<T> next;

            @Override
            public boolean hasNext() {
                if (next == null) {
                    next = receive();
                }
                return next.open();
            }

            @Override
            public T next() {
                if (!hasNext()) {
                    throw new NoSuchElementException(label + " is closed");
                }
                final var value = next.value();
                next = null;
                return value;
            }
        };
    }

    @Override
    public boolean offer(T value) {
        return send(value, 0);
    }

    @Override
    public boolean offer(T value, long timeout, TimeUnit unit) {
        return send(value, Math.max(0, unit.toNanos(timeout)));
    }

    @Override
    public Received<T> poll() {
        return receive(0);
    }

    @Override
    public Received<T> poll(long timeout, TimeUnit unit) {
        return receive(Math.max(0, unit.toNanos(timeout)));
    }

    @Override
    public Received<T> receive() {
        return receive(-1);
    }

    @Override
    public void send(T value) {
        send(value, -1);
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "Channel[" + label + "]";
    }

    void enqueue(Waiter<T> waiter, Direction direction) {
        (direction == Direction.SEND ? senders : receivers).add(waiter);
    }

    /**
     * @return the value delivered to a completed receive selection
     */
    @SuppressWarnings("unchecked")
    Received<T> receivedBy(Selection selection) {
        return selection.isClosed() ? Received.closed(zero) : Received.of((T) selection.item());
    }

    /**
     * Take a value if one is available. The lock must be held.
     *
     * @return the received value, or null if the receive would block
     */
    Received<T> receiveLocked() {
        if (!buffer.isEmpty()) {
            final var value = buffer.poll();
            Waiter<T> sender;
            while ((sender = senders.poll()) != null) {
                if (sender.selection.tryClaim(sender.index)) {
                    buffer.add(sender.value);
                    sender.selection.complete(null, false);
                    break;
                }
            }
            return Received.of(value);
        }
        Waiter<T> sender;
        while ((sender = senders.poll()) != null) {
            if (sender.selection.tryClaim(sender.index)) {
                sender.selection.complete(null, false);
                return Received.of(sender.value);
            }
        }
        return closed ? Received.closed(zero) : null;
    }

    /**
     * Hand the value to a waiting receiver or buffer it. The lock must be held.
     *
     * @return false if the send would block
     * @throws ChannelClosedException if the channel is closed
     */
    boolean sendLocked(T value) {
        if (closed) {
            throw new ChannelClosedException(label);
        }
        Waiter<T> receiver;
        while ((receiver = receivers.poll()) != null) {
            if (receiver.selection.tryClaim(receiver.index)) {
                receiver.selection.complete(value, false);
                return true;
            }
        }
        if (buffer.size() < capacity) {
            buffer.add(value);
            return true;
        }
        return false;
    }

    int waiting() {
        lock.lock();
        try {
            return senders.size() + receivers.size();
        } finally {
            lock.unlock();
        }
    }

    void withdrawLocked(Waiter<T> waiter) {
        senders.remove(waiter);
        receivers.remove(waiter);
    }

    private Received<T> receive(long nanos) {
        final Selection selection;
        final Waiter<T> waiter;
        lock.lock();
        try {
            final var received = receiveLocked();
            if (received != null || nanos == 0) {
                return received;
            }
            selection = new Selection();
            waiter = new Waiter<>(selection, 0, null);
            receivers.add(waiter);
        } finally {
            lock.unlock();
        }
        final var wakeup = selection.await(nanos);
        if (wakeup != Wakeup.COMPLETED) {
            withdraw(waiter);
            selection.raise(wakeup);
            return null;
        }
        return receivedBy(selection);
    }

    private boolean send(T value, long nanos) {
        checkNotNull(value, "value");
        final Selection selection;
        final Waiter<T> waiter;
        lock.lock();
        try {
            if (sendLocked(value)) {
                return true;
            }
            if (nanos == 0) {
                return false;
            }
            selection = new Selection();
            waiter = new Waiter<>(selection, 0, value);
            senders.add(waiter);
        } finally {
            lock.unlock();
        }
        final var wakeup = selection.await(nanos);
        if (wakeup != Wakeup.COMPLETED) {
            withdraw(waiter);
            selection.raise(wakeup);
            return false;
        }
        if (selection.isClosed()) {
            throw new ChannelClosedException(label);
        }
        return true;
    }

    private void withdraw(Waiter<T> waiter) {
        lock.lock();
        try {
            withdrawLocked(waiter);
        } finally {
            lock.unlock();
        }
    }
}
