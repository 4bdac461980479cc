/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.routines;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Random;

import org.junit.jupiter.api.Test;

/**
 * Randomized checks of the buffer bound and of FIFO delivery.
 *
 * @author hal.hildebrand
 */
public class ChannelPropertyTest {

    @Test
    public void bufferNeverExceedsCapacity() {
        for (int capacity = 0; capacity <= 5; capacity++) {
            for (long seed = 0; seed < 20; seed++) {
                var random = new Random(seed * 31 + capacity);
                var ch = new SimpleChannel<Integer>("bounded", capacity);
                var model = new ArrayDeque<Integer>();
                for (int op = 0; op < 500; op++) {
                    if (random.nextBoolean()) {
                        var accepted = ch.offer(op);
                        assertEquals(model.size() < capacity, accepted);
                        if (accepted) {
                            model.add(op);
                        }
                    } else {
                        var received = ch.poll();
                        if (model.isEmpty()) {
                            assertNull(received);
                        } else {
                            assertEquals(Received.of(model.poll()), received);
                        }
                    }
                    assertThat(ch.size(), lessThanOrEqualTo(capacity));
                    assertEquals(model.size(), ch.size());
                }
            }
        }
    }

    @Test
    public void singleProducerSingleConsumerIsFifo() throws Throwable {
        for (var capacity : new int[] { 0, 1, 3, 16 }) {
            var scheduler = new Scheduler(Parameters.newBuilder().setParallelism(2).build());
            try {
                var ch = new SimpleChannel<Integer>("fifo", capacity);
                var received = new ArrayList<Integer>();
                Awaiting.runMain(scheduler, () -> {
                    Routines.go(() -> {
                        for (int i = 0; i < 1000; i++) {
                            ch.send(i);
                        }
                        ch.close();
                    });
                    ch.forEach(received::add);
                });
                var expected = new ArrayList<Integer>();
                for (int i = 0; i < 1000; i++) {
                    expected.add(i);
                }
                assertEquals(expected, received, "capacity: " + capacity);
                assertTrue(scheduler.liveTasks().isEmpty());
            } finally {
                scheduler.close();
            }
        }
    }
}
