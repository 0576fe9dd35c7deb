// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

public record SwapQuoteResponse(String inputSymbol, String amountIn, String outputSymbol, String amountOut) {
}
