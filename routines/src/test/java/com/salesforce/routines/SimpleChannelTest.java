/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.routines;

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * @author hal.hildebrand
 */
public class SimpleChannelTest {

    private ExecutorService exec;
    private Scheduler       scheduler;

    @AfterEach
    public void after() {
        scheduler.close();
        exec.shutdownNow();
    }

    @BeforeEach
    public void before() {
        exec = Executors.newCachedThreadPool();
        scheduler = new Scheduler(Parameters.newBuilder().setParallelism(2).setLabel("channels").build());
    }

    @Test
    public void blockedReceiverSeesClose() throws Exception {
        var ch = new SimpleChannel<Integer>("closing", 0, -1);
        var pending = CompletableFuture.supplyAsync(ch::receive, exec);
        Awaiting.until(() -> ch.waiting() == 1, "receiver to block");

        ch.close();

        assertEquals(Received.closed(-1), pending.get(1, TimeUnit.SECONDS));
        assertEquals(0, ch.waiting());
    }

    @Test
    public void blockedSenderFailsOnClose() throws Exception {
        var ch = new SimpleChannel<Integer>("closing", 1);
        ch.send(1);
        var pending = CompletableFuture.runAsync(() -> ch.send(2), exec);
        Awaiting.until(() -> ch.waiting() == 1, "sender to block");

        ch.close();

        var e = assertThrows(ExecutionException.class, () -> pending.get(1, TimeUnit.SECONDS));
        assertTrue(e.getCause() instanceof ChannelClosedException);
        assertEquals(Received.of(1), ch.receive());
        assertEquals(Received.closed(null), ch.receive());
    }

    @Test
    public void bufferedIsFifo() {
        var ch = new SimpleChannel<String>("fifo", 3);
        ch.send("a");
        ch.send("b");
        ch.send("c");
        assertEquals(3, ch.size());
        assertEquals(3, ch.capacity());

        assertEquals(Received.of("a"), ch.receive());
        assertEquals(Received.of("b"), ch.receive());
        assertEquals(Received.of("c"), ch.receive());
        assertEquals(0, ch.size());
    }

    /**
     * Capacity 2: the third send blocks until a receive makes room, then lands behind the second.
     */
    @Test
    public void capacityTwoScenario() throws Throwable {
        var ch = new SimpleChannel<Integer>("scenario", 2);
        var sent = new AtomicBoolean();
        Awaiting.runMain(scheduler, () -> {
            ch.send(1);
            ch.send(2);
            assertEquals(2, ch.size());

            var sender = Routines.go(() -> {
                ch.send(3);
                sent.set(true);
            });
            Awaiting.untilState(sender, TaskState.BLOCKED);
            assertFalse(sent.get());
            assertEquals(2, ch.size());

            assertEquals(Received.of(1), ch.receive());
            sender.onCompletion().orTimeout(5, TimeUnit.SECONDS).join();
            assertTrue(sent.get());

            assertEquals(2, ch.size());
            assertEquals(Received.of(2), ch.receive());
            assertEquals(Received.of(3), ch.receive());
        });
    }

    @Test
    public void closedSentinelIsTerminal() {
        Channel<Integer> ch = Routines.channel(1, 0);
        ch.send(5);
        ch.close();

        assertTrue(ch.isClosed());
        assertEquals(Received.of(5), ch.receive());
        for (int i = 0; i < 3; i++) {
            var received = ch.receive();
            assertThat(received.value(), is(equalTo(0)));
            assertFalse(received.open());
        }
        assertEquals(Received.closed(0), ch.poll());
    }

    @Test
    public void closeReleasesEveryWaiter() throws Exception {
        var receiving = new SimpleChannel<Integer>("receiving", 0, -1);
        var sending = new SimpleChannel<Integer>("sending", 1);
        sending.send(0);
        var receivers = new ArrayList<CompletableFuture<Received<Integer>>>();
        var senders = new ArrayList<CompletableFuture<Void>>();
        for (int i = 0; i < 5; i++) {
            final var value = i + 1;
            receivers.add(CompletableFuture.supplyAsync(receiving::receive, exec));
            senders.add(CompletableFuture.runAsync(() -> sending.send(value), exec));
        }
        Awaiting.until(() -> receiving.waiting() == 5 && sending.waiting() == 5, "all waiters to block");

        receiving.close();
        sending.close();

        for (var receiver : receivers) {
            assertEquals(Received.closed(-1), receiver.get(1, TimeUnit.SECONDS));
        }
        for (var sender : senders) {
            var e = assertThrows(ExecutionException.class, () -> sender.get(1, TimeUnit.SECONDS));
            assertTrue(e.getCause() instanceof ChannelClosedException);
        }
        assertEquals(0, receiving.waiting());
        assertEquals(0, sending.waiting());
        assertEquals(Received.of(0), sending.receive());
        assertEquals(Received.closed(null), sending.receive());
    }

    @Test
    public void doubleClose() {
        var ch = new SimpleChannel<Integer>("twice", 0);
        ch.close();
        assertThrows(DoubleCloseException.class, ch::close);
    }

    @Test
    public void invalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new SimpleChannel<Integer>(-1));
        var ch = new SimpleChannel<Integer>(1);
        assertThrows(NullPointerException.class, () -> ch.send(null));
    }

    @Test
    public void nonBlockingOperations() {
        var unbuffered = new SimpleChannel<Integer>("unbuffered", 0);
        assertFalse(unbuffered.offer(1));
        assertNull(unbuffered.poll());

        var buffered = new SimpleChannel<Integer>("buffered", 1);
        assertTrue(buffered.offer(1));
        assertFalse(buffered.offer(2));
        assertEquals(Received.of(1), buffered.poll());
        assertNull(buffered.poll());
        assertEquals(0, buffered.waiting());
    }

    @Test
    public void rangeUntilClosed() throws Throwable {
        var ch = new SimpleChannel<Integer>("range", 10);
        var seen = new ArrayList<Integer>();
        Awaiting.runMain(scheduler, () -> {
            Routines.go(() -> {
                try {
                    for (int i = 0; i < 6; i++) {
                        ch.send(i);
                    }
                } finally {
                    ch.close();
                }
            });
            for (var value : ch) {
                seen.add(value);
            }
            assertFalse(ch.iterator().hasNext());
        });
        assertEquals(List.of(0, 1, 2, 3, 4, 5), seen);
    }

    @Test
    public void sendAfterClose() {
        var ch = new SimpleChannel<Integer>("closed", 2);
        ch.send(1);
        ch.close();

        assertThrows(ChannelClosedException.class, () -> ch.send(2));
        assertThrows(ChannelClosedException.class, () -> ch.offer(2));
        assertThrows(ChannelClosedException.class, () -> ch.offer(2, 1, TimeUnit.SECONDS));
        assertEquals(1, ch.size());
    }

    @Test
    public void splitSum() throws Throwable {
        var values = new int[] { 7, 2, -5, 4, 1 };
        var total = new AtomicInteger();
        Awaiting.runMain(scheduler, () -> {
            var ch = Routines.<Integer>channel(0);
            Routines.go(() -> ch.send(sum(values, 0, values.length / 2)));
            Routines.go(() -> ch.send(sum(values, values.length / 2, values.length)));
            total.set(ch.receive().value() + ch.receive().value());
        });
        assertEquals(9, total.get());
    }

    @Test
    public void timedOperationsExpire() {
        var ch = new SimpleChannel<Integer>("timed", 1);
        assertNull(ch.poll(10, TimeUnit.MILLISECONDS));
        assertTrue(ch.offer(1, 10, TimeUnit.MILLISECONDS));
        assertFalse(ch.offer(2, 10, TimeUnit.MILLISECONDS));
        assertEquals(0, ch.waiting());
        assertEquals(Received.of(1), ch.poll(10, TimeUnit.MILLISECONDS));
    }

    @Test
    public void timedReceiveInTaskIsNotADeadlock() throws Throwable {
        var ch = new SimpleChannel<Integer>("timed", 0);
        Awaiting.runMain(scheduler, () -> assertNull(ch.poll(20, TimeUnit.MILLISECONDS)));
    }

    @Test
    public void unbufferedRendezvous() throws Exception {
        var ch = new SimpleChannel<Integer>("rendezvous", 0);
        var sender = CompletableFuture.runAsync(() -> ch.send(42), exec);
        Awaiting.until(() -> ch.waiting() == 1, "sender to block");
        assertEquals(0, ch.size());

        assertEquals(Received.of(42), ch.receive());
        sender.get(1, TimeUnit.SECONDS);
        assertEquals(0, ch.waiting());
    }

    private int sum(int[] values, int from, int to) {
        var sum = 0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum;
    }
}
