// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.pool;

/**
 * The two sides of the pool.
 */
public enum Asset {
    A,
    B;

    public Asset opposite() {
        return this == A ? B : A;
    }
}
