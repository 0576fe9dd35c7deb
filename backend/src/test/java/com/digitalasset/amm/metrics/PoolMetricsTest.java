// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.metrics;

import com.digitalasset.amm.common.errors.RatioMismatchError;
import com.digitalasset.amm.config.PoolProperties;
import com.digitalasset.amm.event.SwapRecord;
import com.digitalasset.amm.pool.Asset;
import com.digitalasset.amm.pool.PoolPhase;
import com.digitalasset.amm.pool.PoolSnapshot;
import com.digitalasset.amm.pool.Reserves;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class PoolMetricsTest {

    private SimpleMeterRegistry registry;
    private PoolMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new PoolMetrics(registry, new PoolProperties());
    }

    @Test
    void testSwapCountersAndGauges() {
        metrics.onSwap(new SwapRecord("alice", Asset.A, BigInteger.valueOf(100), Asset.B, BigInteger.valueOf(90),
                BigInteger.valueOf(1100), BigInteger.valueOf(910), Instant.now()));

        assertThat(registry.get("amm.swap.executed.total")
                .tag("inputSymbol", "TKA").tag("outputSymbol", "TKB").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("amm.swap.input.amount").summary().totalAmount()).isEqualTo(100.0);
        assertThat(registry.get("amm.pool.reserve.amount").tag("token", "TKB").gauge().value()).isEqualTo(910.0);
        assertThat(registry.get("amm.pool.k_invariant").gauge().value()).isEqualTo(1_001_000.0);
    }

    @Test
    void testLiquidityEventsUpdateShares() {
        PoolSnapshot after = new PoolSnapshot(new Reserves(BigInteger.valueOf(1000), BigInteger.valueOf(2000),
                BigInteger.valueOf(2_000_000)), BigInteger.valueOf(5000), PoolPhase.ACTIVE, 1);

        metrics.onLiquidityAdded("alice", BigInteger.valueOf(1000), BigInteger.valueOf(2000), BigInteger.valueOf(5000), after);

        assertThat(registry.get("amm.liquidity.added.total").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("amm.pool.shares.total").gauge().value()).isEqualTo(5000.0);
        assertThat(registry.get("amm.pool.reserve.amount").tag("token", "TKA").gauge().value()).isEqualTo(1000.0);
    }

    @Test
    void testRejectionsTaggedByCode() {
        metrics.onRejected("addLiquidity", "bob", new RatioMismatchError("off"));
        metrics.onRejected("addLiquidity", "bob", new RatioMismatchError("off again"));

        assertThat(registry.get("amm.operation.rejected.total")
                .tag("operation", "addLiquidity").tag("reason", "RATIO_MISMATCH").counter().count()).isEqualTo(2.0);
    }
}
