// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.pool;

import java.math.BigInteger;

/**
 * Fully validated withdrawal, ready to commit once both outbound transfers succeed.
 */
public record WithdrawalPlan(BigInteger shares,
                             WithdrawalAmounts amounts,
                             BigInteger newOwnedShares,
                             BigInteger newTotalShares,
                             Reserves reserves) {
}
