// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

/**
 * Pool state as served by {@code GET /api/pool}.
 */
public record PoolDTO(
        String symbolA,
        String symbolB,
        String reserveA,
        String reserveB,
        String constantProduct,
        String totalShares,
        String phase,
        int providerCount,
        long ratioToleranceDivisor
) {
}
