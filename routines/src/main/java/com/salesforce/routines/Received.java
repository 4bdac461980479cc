/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.routines;

/**
 * The outcome of a receive. When {@code open} is false the channel was closed and drained, and {@code value}
 * is the channel's zero value.
 *
 * @author hal.hildebrand
 */
public record Received<T>(T value, boolean open) {

    public static <T> Received<T> closed(T zero) {
        return new Received<>(zero, false);
    }

    public static <T> Received<T> of(T value) {
        return new Received<>(value, true);
    }
}
