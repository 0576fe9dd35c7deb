// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;

/**
 * Faucet request: credit {@code amount} of {@code symbol} to the caller.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MintTokensRequest {
    @NotBlank(message = "symbol is required")
    private String symbol;

    @NotNull(message = "amount is required")
    @DecimalMin(value = "1", message = "amount must be at least 1")
    private BigInteger amount;

    public String getSymbol() {
        return symbol;
    }

    public void setSymbol(String symbol) {
        this.symbol = symbol;
    }

    public BigInteger getAmount() {
        return amount;
    }

    public void setAmount(BigInteger amount) {
        this.amount = amount;
    }
}
