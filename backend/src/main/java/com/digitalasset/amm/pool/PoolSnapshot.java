// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.pool;

import java.math.BigInteger;

/**
 * Consistent read of the whole pool, taken under the read lock.
 */
public record PoolSnapshot(Reserves reserves, BigInteger totalShares, PoolPhase phase, int providerCount) {

    public BigInteger reserveA() {
        return reserves.reserveA();
    }

    public BigInteger reserveB() {
        return reserves.reserveB();
    }

    public BigInteger constantProduct() {
        return reserves.constantProduct();
    }
}
