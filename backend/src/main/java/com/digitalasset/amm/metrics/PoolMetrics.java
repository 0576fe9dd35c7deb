// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.metrics;

import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.config.PoolProperties;
import com.digitalasset.amm.event.PoolEventListener;
import com.digitalasset.amm.event.SwapRecord;
import com.digitalasset.amm.pool.PoolSnapshot;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Micrometer metrics for pool operations.
 *
 * Provides:
 * - Swap counters (executed by direction, rejected by error code)
 * - Liquidity add/remove counters
 * - Reserve, constant product and total share gauges (registered once, updated on commit)
 * - Swap amount distributions
 *
 * Tags are limited to asset symbols, operation names and error codes to keep cardinality bounded.
 */
@Component
public class PoolMetrics implements PoolEventListener {

    private final MeterRegistry meterRegistry;
    private final PoolProperties properties;
    private final Counter liquidityAdded;
    private final Counter liquidityRemoved;
    private final DistributionSummary swapInputAmounts;
    private final DistributionSummary swapOutputAmounts;

    private final AtomicReference<BigInteger> reserveA = new AtomicReference<>(BigInteger.ZERO);
    private final AtomicReference<BigInteger> reserveB = new AtomicReference<>(BigInteger.ZERO);
    private final AtomicReference<BigInteger> constantProduct = new AtomicReference<>(BigInteger.ZERO);
    private final AtomicReference<BigInteger> totalShares = new AtomicReference<>(BigInteger.ZERO);

    public PoolMetrics(MeterRegistry meterRegistry, PoolProperties properties) {
        this.meterRegistry = meterRegistry;
        this.properties = properties;

        this.liquidityAdded = Counter.builder("amm.liquidity.added.total")
            .description("Deposits committed")
            .register(meterRegistry);

        this.liquidityRemoved = Counter.builder("amm.liquidity.removed.total")
            .description("Withdrawals committed")
            .register(meterRegistry);

        this.swapInputAmounts = DistributionSummary.builder("amm.swap.input.amount")
            .description("Distribution of swap input amounts")
            .baseUnit("units")
            .register(meterRegistry);

        this.swapOutputAmounts = DistributionSummary.builder("amm.swap.output.amount")
            .description("Distribution of swap output amounts")
            .baseUnit("units")
            .register(meterRegistry);

        Gauge.builder("amm.pool.reserve.amount", reserveA, r -> r.get().doubleValue())
            .tag("token", properties.getTokenASymbol())
            .description("Pool reserve amount")
            .register(meterRegistry);
        Gauge.builder("amm.pool.reserve.amount", reserveB, r -> r.get().doubleValue())
            .tag("token", properties.getTokenBSymbol())
            .description("Pool reserve amount")
            .register(meterRegistry);
        Gauge.builder("amm.pool.k_invariant", constantProduct, r -> r.get().doubleValue())
            .description("Constant product k = reserveA * reserveB")
            .register(meterRegistry);
        Gauge.builder("amm.pool.shares.total", totalShares, r -> r.get().doubleValue())
            .description("Outstanding pool shares")
            .register(meterRegistry);
    }

    @Override
    public void onSwap(SwapRecord record) {
        String input = properties.symbolOf(record.assetIn());
        String output = properties.symbolOf(record.assetOut());
        meterRegistry.counter("amm.swap.executed.total",
            "inputSymbol", input,
            "outputSymbol", output).increment();

        swapInputAmounts.record(record.amountIn().doubleValue());
        swapOutputAmounts.record(record.amountOut().doubleValue());

        reserveA.set(record.newReserveA());
        reserveB.set(record.newReserveB());
        constantProduct.set(record.newReserveA().multiply(record.newReserveB()));
    }

    @Override
    public void onLiquidityAdded(String party, BigInteger amountA, BigInteger amountB,
                                 BigInteger mintedShares, PoolSnapshot after) {
        liquidityAdded.increment();
        recordPoolState(after);
    }

    @Override
    public void onLiquidityRemoved(String party, BigInteger shares, BigInteger amountA,
                                   BigInteger amountB, PoolSnapshot after) {
        liquidityRemoved.increment();
        recordPoolState(after);
    }

    /**
     * Record a rejected operation, tagged by error code.
     */
    @Override
    public void onRejected(String operation, String party, DomainError error) {
        meterRegistry.counter("amm.operation.rejected.total",
            "operation", operation,
            "reason", error.code()).increment();
    }

    private void recordPoolState(PoolSnapshot snapshot) {
        reserveA.set(snapshot.reserveA());
        reserveB.set(snapshot.reserveB());
        constantProduct.set(snapshot.constantProduct());
        totalShares.set(snapshot.totalShares());
    }
}
