// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;

/**
 * SwapRequest - Exact input amount of the asset being sold
 */
public class SwapRequest {
    @NotNull(message = "amountIn is required")
    @DecimalMin(value = "1", message = "amountIn must be at least 1")
    public BigInteger amountIn;

    public SwapRequest() {}

    public SwapRequest(BigInteger amountIn) {
        this.amountIn = amountIn;
    }
}
