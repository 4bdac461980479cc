/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.routines;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A non reentrant mutual exclusion lock owned by a task, or by a thread when used outside a {@link Scheduler}.
 * Unlocking hands ownership straight to one blocked waiter. A task locking a mutex it already holds blocks
 * itself.
 *
 * @author hal.hildebrand
 */
public class Mutex {
    private final ReentrantLock    guard   = new ReentrantLock();
    private Object                 owner;
    private final Deque<Selection> waiters = new ArrayDeque<>();

    public boolean isLocked() {
        guard.lock();
        try {
            return owner != null;
        } finally {
            guard.unlock();
        }
    }

    /**
     * Block until the mutex is free, then own it.
     */
    public void lock() {
        acquire(-1);
    }

    public boolean tryLock() {
        return acquire(0);
    }

    public boolean tryLock(long timeout, TimeUnit unit) {
        return acquire(Math.max(0, unit.toNanos(timeout)));
    }

    /**
     * Release the mutex, passing it to a blocked waiter if there is one.
     *
     * @throws NotOwnerException if the caller does not own the mutex
     */
    public void unlock() {
        final var strand = Selection.currentStrand();
        guard.lock();
        try {
            if (owner != strand) {
                throw new NotOwnerException("Unlock by: " + strand + " but owned by: " + owner);
            }
            Selection next;
            while ((next = waiters.poll()) != null) {
                if (next.tryClaim(0)) {
                    owner = next.strand();
                    next.complete(null, false);
                    return;
                }
            }
            owner = null;
        } finally {
            guard.unlock();
        }
    }

    private boolean acquire(long nanos) {
        final var strand = Selection.currentStrand();
        final Selection selection;
        guard.lock();
        try {
            if (owner == null) {
                owner = strand;
                return true;
            }
            if (nanos == 0) {
                return false;
            }
            selection = new Selection();
            waiters.add(selection);
        } finally {
            guard.unlock();
        }
        final var wakeup = selection.await(nanos);
        if (wakeup != Wakeup.COMPLETED) {
            guard.lock();
            try {
                waiters.remove(selection);
            } finally {
                guard.unlock();
            }
            selection.raise(wakeup);
            return false;
        }
        return true;
    }
}
