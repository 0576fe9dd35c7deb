// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.pool;

import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.common.Result;
import com.digitalasset.amm.util.AmmMath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Constant-product swap pricing")
class SwapPricingEngineTest {

    private ReserveLedger ledger;
    private SwapPricingEngine pricing;

    @BeforeEach
    void setUp() {
        ledger = new ReserveLedger();
        pricing = new SwapPricingEngine(ledger);
    }

    @Test
    @DisplayName("Quotes A to B against (1000, 2000)")
    void testQuoteAtoB() {
        seed(1000, 2000);

        SwapQuote quote = pricing.quoteAtoB(BigInteger.valueOf(100)).getValueUnsafe();

        // 2_000_000 / 1100 = 1818
        assertThat(quote.amountOut()).isEqualTo(182);
        assertThat(quote.assetOut()).isEqualTo(Asset.B);
        assertThat(quote.reservesAfter().reserveA()).isEqualTo(1100);
        assertThat(quote.reservesAfter().reserveB()).isEqualTo(1818);
        assertThat(ledger.reserveA()).isEqualTo(1000);
    }

    @Test
    void testQuoteBtoA() {
        seed(1000, 2000);

        SwapQuote quote = pricing.quoteBtoA(BigInteger.valueOf(200)).getValueUnsafe();

        assertThat(quote.amountOut()).isEqualTo(91);
        assertThat(quote.assetIn()).isEqualTo(Asset.B);
        assertThat(quote.reservesAfter().reserveA()).isEqualTo(909);
        assertThat(quote.reservesAfter().reserveB()).isEqualTo(2200);
    }

    @Test
    @DisplayName("(1000, 1000): 100 A buys 91 B")
    void testTruncatedReserveOnEvenPool() {
        seed(1000, 1000);

        // 1_000_000 / 1100 = 909
        assertThat(pricing.quoteAtoB(BigInteger.valueOf(100)).getValueUnsafe().amountOut()).isEqualTo(91);
    }

    @Test
    @DisplayName("Output never decreases with input and stays below the opposite reserve")
    void testMonotonicity() {
        seed(1000, 2000);

        BigInteger previous = BigInteger.ZERO;
        for (long amountIn = 0; amountIn <= 100_000; amountIn += 997) {
            BigInteger out = pricing.quoteAtoB(BigInteger.valueOf(amountIn)).getValueUnsafe().amountOut();
            assertThat(out).isGreaterThanOrEqualTo(previous).isLessThan(BigInteger.valueOf(2000));
            previous = out;
        }
    }

    @Test
    @DisplayName("Truncation lowers k by less than one unit of the output reserve")
    void testProductLossIsBounded() {
        seed(1000, 1000);
        BigInteger k = ledger.constantProduct();

        for (long amountIn = 1; amountIn < 5000; amountIn += 13) {
            Reserves after = pricing.quoteAtoB(BigInteger.valueOf(amountIn)).getValueUnsafe().reservesAfter();
            BigInteger loss = k.subtract(after.constantProduct());
            assertTrue(loss.compareTo(after.reserveA()) < 0,
                    "k lost " + loss + " for amountIn=" + amountIn);
        }
    }

    @Test
    @DisplayName("Ceiling rounding keeps the constant product from decreasing")
    void testCeilingProductNeverDecreases() {
        SwapPricingEngine ceiling = new SwapPricingEngine(ledger, SwapRounding.CEILING);
        seed(1000, 1000);
        BigInteger k = ledger.constantProduct();

        assertThat(ceiling.quoteAtoB(BigInteger.valueOf(100)).getValueUnsafe().amountOut()).isEqualTo(90);
        for (long amountIn = 1; amountIn < 5000; amountIn += 13) {
            Reserves after = ceiling.quoteAtoB(BigInteger.valueOf(amountIn)).getValueUnsafe().reservesAfter();
            assertTrue(after.constantProduct().compareTo(k) >= 0,
                    "k decreased for amountIn=" + amountIn + ": " + after.constantProduct());
        }
    }

    @Test
    @DisplayName("Round trip gains at most the truncation of both legs")
    void testRoundTripGainIsBounded() {
        for (long amountIn = 1; amountIn < 3000; amountIn += 7) {
            ledger = new ReserveLedger();
            pricing = new SwapPricingEngine(ledger);
            seed(1000, 1000);

            SwapQuote there = pricing.quoteAtoB(BigInteger.valueOf(amountIn)).getValueUnsafe();
            ledger.commit(there.reservesAfter());
            SwapQuote back = pricing.quoteBtoA(there.amountOut()).getValueUnsafe();

            // under one unit of A on the way back plus one unit of B priced in A
            BigInteger bound = BigInteger.ONE.add(AmmMath.divCeil(
                    there.reservesAfter().reserveA(), there.reservesAfter().reserveB()).getValueUnsafe());
            assertThat(back.amountOut().subtract(BigInteger.valueOf(amountIn)))
                    .as("round trip of %d", amountIn)
                    .isLessThanOrEqualTo(bound);
        }
    }

    @Test
    @DisplayName("(1000, 1000): an input that prices the whole reserve is trimmed to leave one unit")
    void testHugeInputOnSmallPool() {
        seed(1000, 1000);

        assertThat(pricing.quoteAtoB(BigInteger.valueOf(1000)).getValueUnsafe().amountOut()).isEqualTo(500);
        assertThat(pricing.quoteAtoB(BigInteger.ZERO).getValueUnsafe().amountOut()).isZero();

        // 1_000_000 / 1_001_000 = 0, so the raw output is the full 1000
        SwapQuote drained = pricing.quoteAtoB(BigInteger.valueOf(1_000_000)).getValueUnsafe();
        assertThat(drained.amountOut()).isEqualTo(999);
        assertThat(drained.reservesAfter().reserveA()).isEqualTo(1_001_000);
        assertThat(drained.reservesAfter().reserveB()).isEqualTo(1);
        assertThat(pricing.quoteAtoB(BigInteger.valueOf(1_000_000_000)).getValueUnsafe().amountOut()).isEqualTo(999);
    }

    @Test
    @DisplayName("Drain guard trims an output equal to the reserve and rejects a larger one")
    void testDrainGuard() {
        BigInteger reserve = BigInteger.valueOf(1000);

        assertThat(SwapPricingEngine.applyDrainGuard(BigInteger.valueOf(1000), reserve).getValueUnsafe())
                .isEqualTo(999);
        assertThat(SwapPricingEngine.applyDrainGuard(BigInteger.valueOf(999), reserve).getValueUnsafe())
                .isEqualTo(999);

        Result<BigInteger, DomainError> tooMuch = SwapPricingEngine.applyDrainGuard(BigInteger.valueOf(1001), reserve);
        assertThat(tooMuch.getErrorUnsafe().code()).isEqualTo("POOL_DRAINAGE");
    }

    @Test
    void testEmptyPoolCannotBeQuoted() {
        assertThat(pricing.quoteAtoB(BigInteger.TEN).getErrorUnsafe().code()).isEqualTo("POOL_EMPTY");
        assertThat(pricing.quoteBtoA(BigInteger.TEN).getErrorUnsafe().code()).isEqualTo("POOL_EMPTY");
    }

    private void seed(long reserveA, long reserveB) {
        ledger.commit(ledger.prepare(BigInteger.valueOf(reserveA), BigInteger.valueOf(reserveB)).getValueUnsafe());
    }
}
