/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.routines;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.io.Closeable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Runs spawned tasks, at most {@link Parameters#parallelism()} of them at a time. Each task is carried by its own
 * daemon thread but executes only while it holds one of the worker slots. A task gives its slot back when it
 * blocks in a channel, select or mutex operation, and waits in the run queue for a slot again once the operation
 * can proceed.
 * <p>
 * When no task holds a slot, none is waiting for one and at least one is blocked, nothing can ever make progress.
 * The scheduler then fails every blocked operation with a {@link DeadlockException} and reports the deadlock from
 * {@link #run()}.
 *
 * @author hal.hildebrand
 */
public class Scheduler implements Closeable {

    public interface SchedulerMetrics {

        Counter completed();

        Meter deadlocks();

        Counter failed();

        Meter parks();

        Counter spawned();
    }

    private static final ThreadLocal<Task> CURRENT = new ThreadLocal<>();
    private static final Logger            log     = LoggerFactory.getLogger(Scheduler.class);

    /**
     * @return the scheduler running the calling task, or null if the caller is not a task
     */
    public static Scheduler current() {
        final var task = CURRENT.get();
        return task == null ? null : task.getScheduler();
    }

    static Task currentTask() {
        return CURRENT.get();
    }

    private int                     blocked;
    private final ExecutorService   carriers;
    private boolean                 closed;
    private DeadlockException       deadlock;
    private int                     exiting;
    private final ReentrantLock     lock      = new ReentrantLock();
    private final SchedulerMetrics  metrics;
    private long                    nextId;
    private final Parameters        parameters;
    private final Condition         quiescent = lock.newCondition();
    private final Deque<Task>       runQueue  = new ArrayDeque<>();
    private int                     running;
    private final Map<Long, Task>   tasks     = new HashMap<>();
    private int                     timed;

    public Scheduler() {
        this(Parameters.newBuilder().build());
    }

    public Scheduler(Parameters parameters) {
        this.parameters = checkNotNull(parameters, "parameters");
        this.metrics = parameters.metrics();
        carriers = Executors.newCachedThreadPool(new ThreadFactoryBuilder().setNameFormat(parameters.label() + "-%d")
                                                                           .setDaemon(true)
                                                                           .build());
    }

    /**
     * Refuse further spawns and interrupt the carriers. Operations blocked in interrupted tasks fail with a
     * CancellationException.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            log.debug("Closing: {} live tasks: {}", parameters.label(), tasks.size());
        } finally {
            lock.unlock();
        }
        carriers.shutdownNow();
    }

    public Parameters getParameters() {
        return parameters;
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return a snapshot of the tasks that have not completed
     */
    public List<TaskHandle> liveTasks() {
        lock.lock();
        try {
            return new ArrayList<>(tasks.values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Block until every task spawned on this scheduler has completed.
     *
     * @throws DeadlockException if the tasks deadlocked since the last run
     */
    public void run() throws InterruptedException {
        checkState(CURRENT.get() == null, "Cannot run a scheduler from within a task");
        lock.lock();
        try {
            while (!tasks.isEmpty() || exiting > 0) {
                quiescent.await();
            }
            final var failed = deadlock;
            deadlock = null;
            if (failed != null) {
                throw new DeadlockException(failed.getMessage(), failed);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Spawn the main task, then {@link #run()}.
     */
    public void run(Runnable main) throws InterruptedException {
        spawn("main", main);
        run();
    }

    public TaskHandle spawn(Runnable body) {
        return spawn(null, body);
    }

    /**
     * Register a new task and return without waiting for it to start.
     *
     * @param name - the task's name, or null to derive one from the scheduler's label
     */
    public TaskHandle spawn(String name, Runnable body) {
        checkNotNull(body, "body");
        final Task task;
        lock.lock();
        try {
            checkState(!closed, "Scheduler: %s is closed", parameters.label());
            final var id = ++nextId;
            task = new Task(id, name == null ? parameters.label() + ":" + id : name, body, this, lock.newCondition());
            tasks.put(id, task);
            runQueue.add(task);
            dispatch();
        } finally {
            lock.unlock();
        }
        if (metrics != null) {
            metrics.spawned().inc();
        }
        log.trace("Spawned: {} on: {}", task.getName(), parameters.label());
        try {
            carriers.execute(() -> carry(task));
        } catch (RejectedExecutionException e) {
            exit(task, e);
            throw new IllegalStateException("Scheduler: " + parameters.label() + " is closed", e);
        }
        return task;
    }

    @Override
    public String toString() {
        return "Scheduler[" + parameters.label() + "]";
    }

    DeadlockException deadlockOf(Task task) {
        lock.lock();
        try {
            final var cause = deadlock;
            return new DeadlockException("Task: " + task.getName() + " can never resume; "
            + (cause == null ? "deadlock detected" : cause.getMessage()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Suspend the calling task until the selection completes, the timeout expires, the scheduler detects a
     * deadlock or the carrier is interrupted. The slot is released while blocked and reacquired before returning.
     *
     * @param nanos - the timeout, negative to wait indefinitely
     */
    Wakeup park(Task task, Selection selection, long nanos) {
        boolean interrupted = false;
        lock.lock();
        try {
            if (selection.isCompleted()) {
                return Wakeup.COMPLETED;
            }
            task.reason = null;
            task.state = TaskState.BLOCKED;
            task.timed = nanos >= 0;
            blocked++;
            if (task.timed) {
                timed++;
            }
            running--;
            if (metrics != null) {
                metrics.parks().mark();
            }
            log.trace("Parked: {} on: {}", task.getName(), parameters.label());
            dispatch();
            detectDeadlock();

            var remaining = nanos;
            while (task.state != TaskState.RUNNING) {
                if (task.state == TaskState.BLOCKED && nanos >= 0 && remaining <= 0) {
                    resume(task, Wakeup.TIMED_OUT);
                    continue;
                }
                try {
                    if (task.state == TaskState.BLOCKED && nanos >= 0) {
                        remaining = task.signal.awaitNanos(remaining);
                    } else {
                        task.signal.await();
                    }
                } catch (InterruptedException e) {
                    interrupted = true;
                    resume(task, Wakeup.INTERRUPTED);
                }
            }
            if (interrupted && task.reason != Wakeup.INTERRUPTED) {
                Thread.currentThread().interrupt();
            }
            return task.reason;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Make a blocked task runnable. Has no effect on a task that is not blocked.
     */
    void wake(Task task) {
        lock.lock();
        try {
            resume(task, Wakeup.COMPLETED);
        } finally {
            lock.unlock();
        }
    }

    private void carry(Task task) {
        lock.lock();
        try {
            while (task.state != TaskState.RUNNING) {
                task.signal.awaitUninterruptibly();
            }
        } finally {
            lock.unlock();
        }
        CURRENT.set(task);
        Throwable failure = null;
        try {
            task.body.run();
        } catch (DeadlockException e) {
            failure = e;
            log.warn("Task: {} terminated by deadlock on: {}", task.getName(), parameters.label());
        } catch (Throwable t) {
            failure = t;
            log.error("Error in task: {} on: {}", task.getName(), parameters.label(), t);
        } finally {
            CURRENT.remove();
            exit(task, failure);
        }
    }

    private void detectDeadlock() {
        // A timed wait always resumes, and may unblock the others when it does
        if (!parameters.detectDeadlocks() || running > 0 || !runQueue.isEmpty() || blocked == 0 || timed > 0) {
            return;
        }
        final var stalled = tasks.values().stream().filter(t -> t.state == TaskState.BLOCKED).toList();
        final var names = stalled.stream().map(Task::getName).toList();
        deadlock = new DeadlockException("All tasks are blocked: " + names + " on: " + parameters.label());
        log.error("Deadlock detected, blocked: {} on: {}", names, parameters.label());
        if (metrics != null) {
            metrics.deadlocks().mark();
        }
        stalled.forEach(t -> resume(t, Wakeup.DEADLOCKED));
    }

    private void dispatch() {
        while (running < parameters.parallelism() && !runQueue.isEmpty()) {
            final var next = runQueue.poll();
            next.state = TaskState.RUNNING;
            running++;
            next.signal.signal();
        }
    }

    private void exit(Task task, Throwable failure) {
        if (metrics != null) {
            (failure == null ? metrics.completed() : metrics.failed()).inc();
        }
        lock.lock();
        try {
            switch (task.state) {
            case RUNNING -> running--;
            case RUNNABLE -> runQueue.remove(task);
            case BLOCKED -> blocked--;
            default -> {
            }
            }
            task.state = TaskState.COMPLETED;
            tasks.remove(task.getId());
            exiting++;
            dispatch();
            detectDeadlock();
        } finally {
            lock.unlock();
        }
        // Dependents of the completion see the task retired and its slot released
        try {
            if (failure == null) {
                task.onCompletion().complete(null);
            } else {
                task.onCompletion().completeExceptionally(failure);
            }
        } finally {
            lock.lock();
            try {
                exiting--;
                if (tasks.isEmpty() && exiting == 0) {
                    quiescent.signalAll();
                }
            } finally {
                lock.unlock();
            }
        }
        log.trace("Completed: {} on: {}", task.getName(), parameters.label());
    }

    private void resume(Task task, Wakeup reason) {
        if (task.state != TaskState.BLOCKED) {
            return;
        }
        task.reason = reason;
        task.state = TaskState.RUNNABLE;
        blocked--;
        if (task.timed) {
            task.timed = false;
            timed--;
        }
        runQueue.add(task);
        dispatch();
    }
}
