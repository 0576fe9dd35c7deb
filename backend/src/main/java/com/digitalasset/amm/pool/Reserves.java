// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.pool;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Immutable view of both reserves and the product derived from them.
 * Instances are only built by {@link ReserveLedger#prepare}, so the product always matches.
 */
public record Reserves(BigInteger reserveA, BigInteger reserveB, BigInteger constantProduct) {

    public static final Reserves EMPTY = new Reserves(BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO);

    public Reserves {
        Objects.requireNonNull(reserveA, "reserveA");
        Objects.requireNonNull(reserveB, "reserveB");
        Objects.requireNonNull(constantProduct, "constantProduct");
    }

    public BigInteger reserveOf(final Asset asset) {
        return asset == Asset.A ? reserveA : reserveB;
    }

    /**
     * True when either side is zero, i.e. the pool cannot price anything.
     */
    public boolean isEmpty() {
        return reserveA.signum() == 0 || reserveB.signum() == 0;
    }
}
