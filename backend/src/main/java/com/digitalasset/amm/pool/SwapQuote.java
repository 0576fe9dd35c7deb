// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.pool;

import java.math.BigInteger;

/**
 * Priced, not yet committed swap. {@code reservesAfter} is what the ledger holds if it goes through.
 */
public record SwapQuote(Asset assetIn,
                        BigInteger amountIn,
                        Asset assetOut,
                        BigInteger amountOut,
                        Reserves reservesAfter) {
}
