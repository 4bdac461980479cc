/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.routines;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Waits on several channel operations and commits to exactly one of them.
 * <p>
 * All cases are checked for readiness in a random order, so when several are ready each is equally likely to be
 * chosen. If none is ready the default branch runs, or without one the caller blocks until a counterpart commits
 * one of the cases. A select holds the locks of all of its channels, in channel id order, while it evaluates and
 * while it registers or withdraws its waiters, and withdraws every waiter before returning. A select can therefore
 * be re-entered in a loop indefinitely.
 *
 * <pre>
 * new Select().onSend(c, x, () -> advance()).onReceive(quit, r -> done = true).select();
 * </pre>
 *
 * @author hal.hildebrand
 */
public class Select {

    /**
     * One send or receive operation of a select.
     */
    public static final class Case<T> {

        public static <T> Case<T> receive(ReceiveChannel<T> channel, Consumer<? super Received<T>> action) {
            return new Case<>(Direction.RECEIVE, channel, null, action, null);
        }

        public static <T> Case<T> send(SendChannel<T> channel, T value, Runnable action) {
            checkNotNull(value, "value");
            return new Case<>(Direction.SEND, channel, value, null, action);
        }

        private final SimpleChannel<T>              channel;
        private final Direction                     direction;
        private final Consumer<? super Received<T>> onReceive;
        private final Runnable                      onSend;
        private final T                             value;

        private Case(Direction direction, Object channel, T value, Consumer<? super Received<T>> onReceive,
                     Runnable onSend) {
            this.direction = direction;
            this.channel = simple(channel);
            this.value = value;
            this.onReceive = onReceive;
            this.onSend = onSend;
        }

        public Direction getDirection() {
            return direction;
        }

        private void fire(Received<T> received) {
            if (direction == Direction.SEND) {
                if (onSend != null) {
                    onSend.run();
                }
            } else if (onReceive != null) {
                onReceive.accept(received);
            }
        }

        /**
         * @return true if committed, with the receive outcome stored in the holder
         */
        private boolean tryLocked(List<Received<?>> holder) {
            if (direction == Direction.SEND) {
                return channel.sendLocked(value);
            }
            final var received = channel.receiveLocked();
            if (received == null) {
                return false;
            }
            holder.add(received);
            return true;
        }
    }

    /**
     * Answered when the default branch ran
     */
    public static final int DEFAULT   = -1;
    /**
     * Answered when a timed select expired
     */
    public static final int TIMED_OUT = -2;

    /**
     * Commit to one of the cases, running the default branch instead if none is ready and it is present.
     *
     * @param otherwise - the default branch, may be null
     * @return the index of the committed case, or {@link #DEFAULT}
     */
    public static int select(List<Case<?>> cases, Runnable otherwise) {
        final var select = new Select();
        cases.forEach(select::on);
        select.otherwise = otherwise;
        return select.select();
    }

    @SuppressWarnings("unchecked")
    private static <T> SimpleChannel<T> simple(Object channel) {
        checkNotNull(channel, "channel");
        checkArgument(channel instanceof SimpleChannel, "Unsupported channel: %s", channel);
        return (SimpleChannel<T>) channel;
    }

    private final List<Case<?>> cases = new ArrayList<>();
    private Runnable            otherwise;

    public Select on(Case<?> c) {
        cases.add(checkNotNull(c, "case"));
        return this;
    }

    public <T> Select onReceive(ReceiveChannel<T> channel, Consumer<? super Received<T>> action) {
        return on(Case.receive(channel, action));
    }

    public <T> Select onSend(SendChannel<T> channel, T value, Runnable action) {
        return on(Case.send(channel, value, action));
    }

    /**
     * The default branch, run when no case is ready.
     */
    public Select otherwise(Runnable action) {
        otherwise = checkNotNull(action, "action");
        return this;
    }

    /**
     * @return the index of the committed case, or {@link #DEFAULT} if the default branch ran
     * @throws ChannelClosedException if the committed case sends on a closed channel
     */
    public int select() {
        return select(-1);
    }

    /**
     * As {@link #select()}, blocking no longer than the timeout.
     *
     * @return the index of the committed case, {@link #DEFAULT} or {@link #TIMED_OUT}
     */
    public int select(long timeout, TimeUnit unit) {
        return select(Math.max(0, unit.toNanos(timeout)));
    }

    @SuppressWarnings({ "unchecked", "rawtypes" })
    private int select(long nanos) {
        final var channels = channels();
        final var order = new ArrayList<Integer>(cases.size());
        for (int i = 0; i < cases.size(); i++) {
            order.add(i);
        }
        Collections.shuffle(order, ThreadLocalRandom.current());

        final var holder = new ArrayList<Received<?>>(1);
        var committed = -1;
        Selection selection = null;
        final var waiters = new ArrayList<Waiter<?>>(cases.size());
        lock(channels);
        try {
            for (int i : order) {
                if (cases.get(i).tryLocked(holder)) {
                    committed = i;
                    break;
                }
            }
            if (committed < 0 && otherwise == null && nanos != 0) {
                selection = new Selection();
                for (int i = 0; i < cases.size(); i++) {
                    final Case c = cases.get(i);
                    final var waiter = new Waiter<>(selection, i, c.value);
                    c.channel.enqueue(waiter, c.direction);
                    waiters.add(waiter);
                }
            }
        } finally {
            unlock(channels);
        }

        if (committed >= 0) {
            final Case c = cases.get(committed);
            c.fire(holder.isEmpty() ? null : holder.get(0));
            return committed;
        }
        if (selection == null) {
            if (otherwise != null) {
                otherwise.run();
                return DEFAULT;
            }
            return TIMED_OUT;
        }

        final var wakeup = selection.await(nanos);
        lock(channels);
        try {
            for (int i = 0; i < waiters.size(); i++) {
                final Case c = cases.get(i);
                c.channel.withdrawLocked(waiters.get(i));
            }
        } finally {
            unlock(channels);
        }
        if (wakeup != Wakeup.COMPLETED) {
            selection.raise(wakeup);
            return TIMED_OUT;
        }

        final var winner = selection.winner();
        final Case c = cases.get(winner);
        if (c.direction == Direction.SEND) {
            if (selection.isClosed()) {
                throw new ChannelClosedException(c.channel.getLabel());
            }
            c.fire(null);
        } else {
            c.fire(c.channel.receivedBy(selection));
        }
        return winner;
    }

    private List<SimpleChannel<?>> channels() {
        final var distinct = new IdentityHashMap<SimpleChannel<?>, Boolean>();
        cases.forEach(c -> distinct.put(c.channel, Boolean.TRUE));
        final var sorted = new ArrayList<>(distinct.keySet());
        sorted.sort(Comparator.comparingLong(ch -> ch.id));
        return sorted;
    }

    private void lock(List<SimpleChannel<?>> channels) {
        channels.forEach(ch -> ch.lock.lock());
    }

    private void unlock(List<SimpleChannel<?>> channels) {
        for (int i = channels.size() - 1; i >= 0; i--) {
            channels.get(i).lock.unlock();
        }
    }
}
