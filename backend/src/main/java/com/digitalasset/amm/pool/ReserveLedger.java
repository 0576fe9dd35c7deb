// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.pool;

import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.common.Result;
import com.digitalasset.amm.common.errors.OverflowError;
import com.digitalasset.amm.util.AmmMath;

import java.math.BigInteger;

/**
 * Holds the two reserve balances and their product. Pure bookkeeping: callers validate transitions.
 *
 * A commit swaps one immutable {@link Reserves} reference, so a reader sees either the old
 * triple or the new one and the product is never stale relative to its reserves.
 */
public class ReserveLedger {

    private volatile Reserves current = Reserves.EMPTY;

    public Reserves snapshot() {
        return current;
    }

    public BigInteger reserveA() {
        return current.reserveA();
    }

    public BigInteger reserveB() {
        return current.reserveB();
    }

    public BigInteger constantProduct() {
        return current.constantProduct();
    }

    /**
     * Stage new reserve values, computing the product with overflow checking. Nothing is published.
     */
    public Result<Reserves, DomainError> prepare(final BigInteger newReserveA, final BigInteger newReserveB) {
        if (!AmmMath.inRange(newReserveA) || !AmmMath.inRange(newReserveB)) {
            return Result.err(new OverflowError(
                    "reserves out of uint256 range: " + newReserveA + ", " + newReserveB));
        }
        return AmmMath.mul(newReserveA, newReserveB)
                .map(product -> new Reserves(newReserveA, newReserveB, product));
    }

    /**
     * Publish a snapshot staged by {@link #prepare}.
     */
    public void commit(final Reserves staged) {
        current = staged;
    }
}
