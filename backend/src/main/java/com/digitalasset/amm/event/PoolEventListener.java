// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.event;

import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.pool.PoolSnapshot;

import java.math.BigInteger;

/**
 * Receives pool events after the state change is committed. Called under the pool's write lock,
 * so implementations must be quick and must not call back into the pool.
 */
public interface PoolEventListener {

    void onSwap(SwapRecord record);

    default void onLiquidityAdded(String party, BigInteger amountA, BigInteger amountB,
                                  BigInteger mintedShares, PoolSnapshot after) {
    }

    default void onLiquidityRemoved(String party, BigInteger shares, BigInteger amountA,
                                    BigInteger amountB, PoolSnapshot after) {
    }

    default void onRejected(String operation, String party, DomainError error) {
    }
}
