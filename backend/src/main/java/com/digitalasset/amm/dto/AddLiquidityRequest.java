// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;

/**
 * AddLiquidityRequest - Deposit both assets into the pool
 */
public class AddLiquidityRequest {
    @NotNull(message = "amountA is required")
    @DecimalMin(value = "1", message = "amountA must be at least 1")
    public BigInteger amountA;

    @NotNull(message = "amountB is required")
    @DecimalMin(value = "1", message = "amountB must be at least 1")
    public BigInteger amountB;

    // Default constructor for Jackson
    public AddLiquidityRequest() {}

    public AddLiquidityRequest(BigInteger amountA, BigInteger amountB) {
        this.amountA = amountA;
        this.amountB = amountB;
    }
}
