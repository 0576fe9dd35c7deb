// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.pool;

import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.common.Result;
import com.digitalasset.amm.common.errors.PoolDrainageError;
import com.digitalasset.amm.common.errors.PoolEmptyError;
import com.digitalasset.amm.util.AmmMath;

import java.math.BigInteger;

/**
 * Constant-product pricing: output = reserveOut - k / (reserveIn + amountIn).
 *
 * k is the product committed before this swap. The division truncates by default, which can
 * price the whole opposite reserve; the drain guard then keeps one unit back. With
 * {@link SwapRounding#CEILING} the post-swap reserve is rounded up instead.
 * The ledger recomputes k from the new reserves on commit.
 */
public class SwapPricingEngine {

    private final ReserveLedger ledger;
    private final SwapRounding rounding;

    public SwapPricingEngine(final ReserveLedger ledger) {
        this(ledger, SwapRounding.FLOOR);
    }

    public SwapPricingEngine(final ReserveLedger ledger, final SwapRounding rounding) {
        this.ledger = ledger;
        this.rounding = rounding;
    }

    public Result<SwapQuote, DomainError> quoteAtoB(final BigInteger amountIn) {
        return quote(Asset.A, amountIn);
    }

    public Result<SwapQuote, DomainError> quoteBtoA(final BigInteger amountIn) {
        return quote(Asset.B, amountIn);
    }

    public Result<SwapQuote, DomainError> quote(final Asset assetIn, final BigInteger amountIn) {
        Reserves reserves = ledger.snapshot();
        if (reserves.isEmpty()) {
            return Result.err(new PoolEmptyError("pool has no liquidity to price a swap"));
        }
        Asset assetOut = assetIn.opposite();
        BigInteger reserveIn = reserves.reserveOf(assetIn);
        BigInteger reserveOut = reserves.reserveOf(assetOut);

        return AmmMath.add(reserveIn, amountIn).flatMap(reserveInAfter ->
                rounding.reserveOutAfter(reserves.constantProduct(), reserveInAfter).flatMap(reserveOutAfter ->
                        AmmMath.sub(reserveOut, reserveOutAfter).flatMap(rawOut ->
                                applyDrainGuard(rawOut, reserveOut).flatMap(amountOut ->
                                        stage(assetIn, reserveInAfter, reserveOut.subtract(amountOut)).map(after ->
                                                new SwapQuote(assetIn, amountIn, assetOut, amountOut, after))))));
    }

    /**
     * Never hand out the whole opposite reserve: an output equal to it is trimmed by one unit,
     * anything still not strictly below it is rejected.
     */
    static Result<BigInteger, DomainError> applyDrainGuard(final BigInteger amountOut, final BigInteger reserveOut) {
        BigInteger guarded = amountOut;
        if (guarded.equals(reserveOut) && guarded.signum() > 0) {
            guarded = guarded.subtract(BigInteger.ONE);
        }
        if (guarded.compareTo(reserveOut) >= 0) {
            return Result.err(new PoolDrainageError(
                    "swap output " + amountOut + " would drain the opposite reserve of " + reserveOut));
        }
        return Result.ok(guarded);
    }

    private Result<Reserves, DomainError> stage(final Asset assetIn, final BigInteger reserveInAfter,
                                                final BigInteger reserveOutAfter) {
        return assetIn == Asset.A
                ? ledger.prepare(reserveInAfter, reserveOutAfter)
                : ledger.prepare(reserveOutAfter, reserveInAfter);
    }
}
