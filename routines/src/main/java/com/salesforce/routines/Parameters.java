/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.routines;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.salesforce.routines.Scheduler.SchedulerMetrics;

/**
 * Configuration of a {@link Scheduler}.
 *
 * @author hal.hildebrand
 */
public record Parameters(int parallelism, String label, boolean detectDeadlocks, SchedulerMetrics metrics) {

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        /**
         * Report a global stall as a DeadlockException. Turn off when tasks are woken by threads the scheduler
         * cannot see
         */
        private boolean          detectDeadlocks = true;
        /**
         * Prefix of carrier thread names
         */
        private String           label           = "routines";
        /**
         * Optional metrics sink
         */
        private SchedulerMetrics metrics;
        /**
         * Maximum number of tasks executing at once
         */
        private int              parallelism     = Runtime.getRuntime().availableProcessors();

        public Parameters build() {
            return new Parameters(parallelism, label, detectDeadlocks, metrics);
        }

        public String getLabel() {
            return label;
        }

        public SchedulerMetrics getMetrics() {
            return metrics;
        }

        public int getParallelism() {
            return parallelism;
        }

        public boolean isDetectDeadlocks() {
            return detectDeadlocks;
        }

        public Builder setDetectDeadlocks(boolean detectDeadlocks) {
            this.detectDeadlocks = detectDeadlocks;
            return this;
        }

        public Builder setLabel(String label) {
            this.label = checkNotNull(label, "label");
            return this;
        }

        public Builder setMetrics(SchedulerMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder setParallelism(int parallelism) {
            checkArgument(parallelism > 0, "parallelism must be > 0: %s", parallelism);
            this.parallelism = parallelism;
            return this;
        }
    }
}
