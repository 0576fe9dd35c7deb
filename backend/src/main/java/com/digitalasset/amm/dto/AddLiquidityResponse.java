// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

/**
 * AddLiquidityResponse - Shares minted for a deposit and the pool state after it
 */
public class AddLiquidityResponse {
    public final String sharesMinted;
    public final String totalShares;
    public final String reserveA;
    public final String reserveB;

    public AddLiquidityResponse(String sharesMinted, String totalShares, String reserveA, String reserveB) {
        this.sharesMinted = sharesMinted;
        this.totalShares = totalShares;
        this.reserveA = reserveA;
        this.reserveB = reserveB;
    }
}
