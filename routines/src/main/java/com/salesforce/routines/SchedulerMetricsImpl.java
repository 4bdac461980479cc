/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.routines;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.salesforce.routines.Scheduler.SchedulerMetrics;

/**
 * @author hal.hildebrand
 */
public class SchedulerMetricsImpl implements SchedulerMetrics {
    private final Counter completed;
    private final Meter   deadlocks;
    private final Counter failed;
    private final Meter   parks;
    private final Counter spawned;

    public SchedulerMetricsImpl(String prefix, MetricRegistry registry) {
        spawned = registry.counter(MetricRegistry.name(prefix, "tasks", "spawned"));
        completed = registry.counter(MetricRegistry.name(prefix, "tasks", "completed"));
        failed = registry.counter(MetricRegistry.name(prefix, "tasks", "failed"));
        parks = registry.meter(MetricRegistry.name(prefix, "tasks", "parks"));
        deadlocks = registry.meter(MetricRegistry.name(prefix, "deadlocks"));
    }

    @Override
    public Counter completed() {
        return completed;
    }

    @Override
    public Meter deadlocks() {
        return deadlocks;
    }

    @Override
    public Counter failed() {
        return failed;
    }

    @Override
    public Meter parks() {
        return parks;
    }

    @Override
    public Counter spawned() {
        return spawned;
    }
}
