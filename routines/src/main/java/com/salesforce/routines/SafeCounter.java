/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.routines;

import java.util.HashMap;
import java.util.Map;

/**
 * Counts per key, with every read-modify-write done while holding a {@link Mutex}.
 *
 * @author hal.hildebrand
 */
public class SafeCounter<K> {
    private final Map<K, Integer> counts = new HashMap<>();
    private final Mutex           mutex  = new Mutex();

    /**
     * @return the count for the key, 0 if it was never incremented
     */
    public int get(K key) {
        mutex.lock();
        try {
            return counts.getOrDefault(key, 0);
        } finally {
            mutex.unlock();
        }
    }

    public void increment(K key) {
        mutex.lock();
        try {
            final int current = counts.getOrDefault(key, 0);
            counts.put(key, current + 1);
        } finally {
            mutex.unlock();
        }
    }
}
