// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

import com.digitalasset.amm.config.PoolProperties;
import com.digitalasset.amm.event.SwapRecord;

public record SwapRecordDto(
        String party,
        String inputSymbol,
        String amountIn,
        String outputSymbol,
        String amountOut,
        String reserveA,
        String reserveB,
        String timestamp
) {
    public static SwapRecordDto from(SwapRecord record, PoolProperties properties) {
        return new SwapRecordDto(
                record.party(),
                properties.symbolOf(record.assetIn()),
                record.amountIn().toString(),
                properties.symbolOf(record.assetOut()),
                record.amountOut().toString(),
                record.newReserveA().toString(),
                record.newReserveB().toString(),
                record.timestamp().toString());
    }
}
