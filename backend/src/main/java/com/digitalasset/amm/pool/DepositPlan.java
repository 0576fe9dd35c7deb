// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.pool;

import java.math.BigInteger;

/**
 * Fully validated deposit, ready to commit once both inbound transfers succeed.
 */
public record DepositPlan(BigInteger amountA,
                          BigInteger amountB,
                          BigInteger mintedShares,
                          BigInteger newTotalShares,
                          Reserves reserves) {
}
