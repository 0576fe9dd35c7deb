// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

/**
 * Counterpart amount needed to deposit {@code givenAmount} of {@code givenSymbol} at the current ratio.
 */
public record DepositQuoteResponse(String givenSymbol, String givenAmount, String requiredSymbol, String requiredAmount) {
}
