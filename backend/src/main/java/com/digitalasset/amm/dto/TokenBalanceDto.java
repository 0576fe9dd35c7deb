// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

/**
 * Balance of one pool asset held by a party.
 */
public record TokenBalanceDto(
        String symbol,
        String amount
) {
}
