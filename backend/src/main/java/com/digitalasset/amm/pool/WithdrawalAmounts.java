// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.pool;

import java.math.BigInteger;

public record WithdrawalAmounts(BigInteger amountA, BigInteger amountB) {

    public BigInteger amountOf(final Asset asset) {
        return asset == Asset.A ? amountA : amountB;
    }
}
