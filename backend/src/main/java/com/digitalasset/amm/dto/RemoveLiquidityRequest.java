// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;

/**
 * RemoveLiquidityRequest - Burn pool shares for a proportional slice of both reserves
 */
public class RemoveLiquidityRequest {
    @NotNull(message = "shares is required")
    @DecimalMin(value = "1", message = "shares must be at least 1")
    public BigInteger shares;

    public RemoveLiquidityRequest() {}

    public RemoveLiquidityRequest(BigInteger shares) {
        this.shares = shares;
    }
}
