// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.controller;

import com.digitalasset.amm.auth.PartyValidationService;
import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.config.PoolProperties;
import com.digitalasset.amm.constants.PoolConstants;
import com.digitalasset.amm.dto.SwapQuoteResponse;
import com.digitalasset.amm.dto.SwapRequest;
import com.digitalasset.amm.dto.SwapResponse;
import com.digitalasset.amm.event.SwapRecord;
import com.digitalasset.amm.pool.Asset;
import com.digitalasset.amm.service.IdempotencyService;
import com.digitalasset.amm.service.LiquidityPoolService;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;

/**
 * SwapController - Exact-input swaps in either direction and their quotes
 */
@RestController
@RequestMapping("/api/swap")
public class SwapController {
    private static final Logger logger = LoggerFactory.getLogger(SwapController.class);

    private final LiquidityPoolService poolService;
    private final PartyValidationService partyValidationService;
    private final IdempotencyService idempotencyService;
    private final PoolProperties properties;

    public SwapController(LiquidityPoolService poolService,
                          PartyValidationService partyValidationService,
                          IdempotencyService idempotencyService,
                          PoolProperties properties) {
        this.poolService = poolService;
        this.partyValidationService = partyValidationService;
        this.idempotencyService = idempotencyService;
        this.properties = properties;
    }

    /**
     * POST /api/swap/token-a - Sell A for B
     */
    @PostMapping("/token-a")
    @WithSpan
    public SwapResponse swapTokenA(
            @RequestHeader(value = PoolConstants.PARTY_HEADER, required = false) String partyHeader,
            @RequestHeader(value = PoolConstants.IDEMPOTENCY_HEADER, required = false) String idempotencyHeader,
            @Valid @RequestBody SwapRequest req
    ) {
        return swap(partyHeader, idempotencyHeader, Asset.A, req);
    }

    /**
     * POST /api/swap/token-b - Sell B for A
     */
    @PostMapping("/token-b")
    @WithSpan
    public SwapResponse swapTokenB(
            @RequestHeader(value = PoolConstants.PARTY_HEADER, required = false) String partyHeader,
            @RequestHeader(value = PoolConstants.IDEMPOTENCY_HEADER, required = false) String idempotencyHeader,
            @Valid @RequestBody SwapRequest req
    ) {
        return swap(partyHeader, idempotencyHeader, Asset.B, req);
    }

    @GetMapping("/quote/token-a")
    @WithSpan
    public SwapQuoteResponse quoteTokenA(@RequestParam BigInteger amountA) {
        BigInteger out = poolService.calculateTokenASwap(amountA).orElseThrow(this::toHttpException);
        return new SwapQuoteResponse(properties.getTokenASymbol(), amountA.toString(),
                properties.getTokenBSymbol(), out.toString());
    }

    @GetMapping("/quote/token-b")
    @WithSpan
    public SwapQuoteResponse quoteTokenB(@RequestParam BigInteger amountB) {
        BigInteger out = poolService.calculateTokenBSwap(amountB).orElseThrow(this::toHttpException);
        return new SwapQuoteResponse(properties.getTokenBSymbol(), amountB.toString(),
                properties.getTokenASymbol(), out.toString());
    }

    private SwapResponse swap(String partyHeader, String idempotencyHeader, Asset assetIn, SwapRequest req) {
        String party = partyValidationService.resolveCaller(partyHeader).orElseThrow(this::toHttpException);
        String key = idempotencyService.validateKey(idempotencyHeader).orElseThrow(this::toHttpException).orElse(null);
        logger.info("POST /api/swap - party: {}, input: {} {}", party, req.amountIn, properties.symbolOf(assetIn));

        return idempotencyService.execute(party, "swap" + assetIn, key, SwapResponse.class, () -> {
            SwapRecord record = poolService.swap(party, assetIn, req.amountIn).orElseThrow(this::toHttpException);
            return new SwapResponse(
                    properties.symbolOf(record.assetIn()),
                    properties.symbolOf(record.assetOut()),
                    record.amountIn().toString(),
                    record.amountOut().toString(),
                    record.newReserveA().toString(),
                    record.newReserveB().toString(),
                    record.timestamp().toString());
        });
    }

    private RuntimeException toHttpException(final DomainError error) {
        return DomainErrorStatusMapper.toHttpException(error);
    }
}
