// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

/**
 * A provider's share balance and what it would redeem for right now.
 */
public record LpPositionResponse(String party, String shares, String totalShares, String redeemableA, String redeemableB) {
}
