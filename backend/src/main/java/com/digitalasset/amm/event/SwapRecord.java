// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.event;

import com.digitalasset.amm.pool.Asset;

import java.math.BigInteger;
import java.time.Instant;

/**
 * One committed swap, as handed to the logging collaborator.
 */
public record SwapRecord(String party,
                         Asset assetIn,
                         BigInteger amountIn,
                         Asset assetOut,
                         BigInteger amountOut,
                         BigInteger newReserveA,
                         BigInteger newReserveB,
                         Instant timestamp) {
}
