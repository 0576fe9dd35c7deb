// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.controller;

import com.digitalasset.amm.auth.PartyValidationService;
import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.common.errors.ValidationError;
import com.digitalasset.amm.config.PoolProperties;
import com.digitalasset.amm.constants.PoolConstants;
import com.digitalasset.amm.dto.LpPositionResponse;
import com.digitalasset.amm.dto.PoolDTO;
import com.digitalasset.amm.dto.SwapRecordDto;
import com.digitalasset.amm.pool.PoolSnapshot;
import com.digitalasset.amm.pool.WithdrawalAmounts;
import com.digitalasset.amm.service.LiquidityPoolService;
import com.digitalasset.amm.service.SwapHistoryService;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.List;

/**
 * Read-only views of the pool: reserves, the caller's position and recent swaps.
 */
@RestController
@RequestMapping("/api/pool")
public class PoolController {

    private final LiquidityPoolService poolService;
    private final SwapHistoryService swapHistoryService;
    private final PartyValidationService partyValidationService;
    private final PoolProperties properties;

    public PoolController(LiquidityPoolService poolService,
                          SwapHistoryService swapHistoryService,
                          PartyValidationService partyValidationService,
                          PoolProperties properties) {
        this.poolService = poolService;
        this.swapHistoryService = swapHistoryService;
        this.partyValidationService = partyValidationService;
        this.properties = properties;
    }

    @GetMapping
    @WithSpan
    public PoolDTO getPool() {
        PoolSnapshot snapshot = poolService.getPoolDetails();
        return new PoolDTO(
                properties.getTokenASymbol(),
                properties.getTokenBSymbol(),
                snapshot.reserveA().toString(),
                snapshot.reserveB().toString(),
                snapshot.constantProduct().toString(),
                snapshot.totalShares().toString(),
                snapshot.phase().name(),
                snapshot.providerCount(),
                properties.getRatioToleranceDivisor());
    }

    /**
     * GET /api/pool/positions/me - Caller's shares and what they redeem for now
     */
    @GetMapping("/positions/me")
    @WithSpan
    public LpPositionResponse getMyPosition(
            @RequestHeader(value = PoolConstants.PARTY_HEADER, required = false) String partyHeader
    ) {
        String party = partyValidationService.validateFormat(partyHeader).orElseThrow(this::toHttpException);
        BigInteger shares = poolService.getMyHoldings(party);
        PoolSnapshot snapshot = poolService.getPoolDetails();
        WithdrawalAmounts redeemable = poolService.calculateWithdrawAmount(shares)
                .orElseThrow(this::toHttpException);
        return new LpPositionResponse(party, shares.toString(), snapshot.totalShares().toString(),
                redeemable.amountA().toString(), redeemable.amountB().toString());
    }

    /**
     * GET /api/pool/swaps?limit= - Most recent swaps, newest first
     */
    @GetMapping("/swaps")
    @WithSpan
    public List<SwapRecordDto> getRecentSwaps(@RequestParam(defaultValue = "50") int limit) {
        if (limit < 1 || limit > PoolConstants.MAX_HISTORY_PAGE) {
            throw toHttpException(new ValidationError(
                    "limit must be between 1 and " + PoolConstants.MAX_HISTORY_PAGE + ", got: " + limit));
        }
        return swapHistoryService.recent(limit).stream()
                .map(record -> SwapRecordDto.from(record, properties))
                .toList();
    }

    private RuntimeException toHttpException(final DomainError error) {
        return DomainErrorStatusMapper.toHttpException(error);
    }
}
