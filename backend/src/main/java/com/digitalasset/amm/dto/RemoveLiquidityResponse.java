// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

public class RemoveLiquidityResponse {
    public final String sharesBurned;
    public final String amountA;
    public final String amountB;
    public final String remainingShares;

    public RemoveLiquidityResponse(String sharesBurned, String amountA, String amountB, String remainingShares) {
        this.sharesBurned = sharesBurned;
        this.amountA = amountA;
        this.amountB = amountB;
        this.remainingShares = remainingShares;
    }
}
