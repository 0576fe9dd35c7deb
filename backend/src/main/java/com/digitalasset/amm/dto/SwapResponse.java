// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

/**
 * SwapResponse - Executed swap with the reserves it left behind
 */
public class SwapResponse {
    public final String inputSymbol;
    public final String outputSymbol;
    public final String amountIn;
    public final String amountOut;
    public final String reserveA;
    public final String reserveB;
    public final String timestamp;

    public SwapResponse(String inputSymbol, String outputSymbol, String amountIn, String amountOut,
                        String reserveA, String reserveB, String timestamp) {
        this.inputSymbol = inputSymbol;
        this.outputSymbol = outputSymbol;
        this.amountIn = amountIn;
        this.amountOut = amountOut;
        this.reserveA = reserveA;
        this.reserveB = reserveB;
        this.timestamp = timestamp;
    }
}
