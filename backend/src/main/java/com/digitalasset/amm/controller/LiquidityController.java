// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.controller;

import com.digitalasset.amm.auth.PartyValidationService;
import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.config.PoolProperties;
import com.digitalasset.amm.constants.PoolConstants;
import com.digitalasset.amm.dto.AddLiquidityRequest;
import com.digitalasset.amm.dto.AddLiquidityResponse;
import com.digitalasset.amm.dto.DepositQuoteResponse;
import com.digitalasset.amm.dto.RemoveLiquidityRequest;
import com.digitalasset.amm.dto.RemoveLiquidityResponse;
import com.digitalasset.amm.dto.WithdrawQuoteResponse;
import com.digitalasset.amm.pool.PoolSnapshot;
import com.digitalasset.amm.pool.WithdrawalAmounts;
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
 * LiquidityController - Handles liquidity provision, removal and the deposit/withdraw quotes
 */
@RestController
@RequestMapping("/api/liquidity")
public class LiquidityController {
    private static final Logger logger = LoggerFactory.getLogger(LiquidityController.class);

    private final LiquidityPoolService poolService;
    private final PartyValidationService partyValidationService;
    private final IdempotencyService idempotencyService;
    private final PoolProperties properties;

    public LiquidityController(LiquidityPoolService poolService,
                               PartyValidationService partyValidationService,
                               IdempotencyService idempotencyService,
                               PoolProperties properties) {
        this.poolService = poolService;
        this.partyValidationService = partyValidationService;
        this.idempotencyService = idempotencyService;
        this.properties = properties;
    }

    /**
     * POST /api/liquidity/add - Deposit both assets and receive pool shares
     *
     * The first deposit sets the price; later deposits must match the reserve ratio.
     * Reserves in the response are read after the commit, so a concurrent operation may already show in them.
     */
    @PostMapping("/add")
    @WithSpan
    public AddLiquidityResponse addLiquidity(
            @RequestHeader(value = PoolConstants.PARTY_HEADER, required = false) String partyHeader,
            @RequestHeader(value = PoolConstants.IDEMPOTENCY_HEADER, required = false) String idempotencyHeader,
            @Valid @RequestBody AddLiquidityRequest req
    ) {
        String party = partyValidationService.resolveCaller(partyHeader).orElseThrow(this::toHttpException);
        String key = idempotencyService.validateKey(idempotencyHeader).orElseThrow(this::toHttpException).orElse(null);
        logger.info("POST /api/liquidity/add - party: {}, amountA: {}, amountB: {}", party, req.amountA, req.amountB);

        return idempotencyService.execute(party, "addLiquidity", key, AddLiquidityResponse.class, () -> {
            BigInteger minted = poolService.addLiquidity(party, req.amountA, req.amountB)
                    .orElseThrow(this::toHttpException);
            PoolSnapshot pool = poolService.getPoolDetails();
            return new AddLiquidityResponse(minted.toString(), pool.totalShares().toString(),
                    pool.reserveA().toString(), pool.reserveB().toString());
        });
    }

    /**
     * POST /api/liquidity/remove - Burn shares for a proportional slice of both reserves
     */
    @PostMapping("/remove")
    @WithSpan
    public RemoveLiquidityResponse removeLiquidity(
            @RequestHeader(value = PoolConstants.PARTY_HEADER, required = false) String partyHeader,
            @RequestHeader(value = PoolConstants.IDEMPOTENCY_HEADER, required = false) String idempotencyHeader,
            @Valid @RequestBody RemoveLiquidityRequest req
    ) {
        String party = partyValidationService.resolveCaller(partyHeader).orElseThrow(this::toHttpException);
        String key = idempotencyService.validateKey(idempotencyHeader).orElseThrow(this::toHttpException).orElse(null);
        logger.info("POST /api/liquidity/remove - party: {}, shares: {}", party, req.shares);

        return idempotencyService.execute(party, "removeLiquidity", key, RemoveLiquidityResponse.class, () -> {
            WithdrawalAmounts amounts = poolService.removeLiquidity(party, req.shares)
                    .orElseThrow(this::toHttpException);
            return new RemoveLiquidityResponse(req.shares.toString(), amounts.amountA().toString(),
                    amounts.amountB().toString(), poolService.getMyHoldings(party).toString());
        });
    }

    /**
     * GET /api/liquidity/quote/token-b?amountA= - Amount of B to pair with amountA
     */
    @GetMapping("/quote/token-b")
    @WithSpan
    public DepositQuoteResponse quoteTokenB(@RequestParam BigInteger amountA) {
        BigInteger amountB = poolService.calculateTokenBDeposit(amountA).orElseThrow(this::toHttpException);
        return new DepositQuoteResponse(properties.getTokenASymbol(), amountA.toString(),
                properties.getTokenBSymbol(), amountB.toString());
    }

    /**
     * GET /api/liquidity/quote/token-a?amountB= - Amount of A to pair with amountB
     */
    @GetMapping("/quote/token-a")
    @WithSpan
    public DepositQuoteResponse quoteTokenA(@RequestParam BigInteger amountB) {
        BigInteger amountA = poolService.calculateTokenADeposit(amountB).orElseThrow(this::toHttpException);
        return new DepositQuoteResponse(properties.getTokenBSymbol(), amountB.toString(),
                properties.getTokenASymbol(), amountA.toString());
    }

    @GetMapping("/quote/withdraw")
    @WithSpan
    public WithdrawQuoteResponse quoteWithdraw(@RequestParam BigInteger shares) {
        WithdrawalAmounts amounts = poolService.calculateWithdrawAmount(shares).orElseThrow(this::toHttpException);
        return new WithdrawQuoteResponse(shares.toString(), amounts.amountA().toString(), amounts.amountB().toString());
    }

    private RuntimeException toHttpException(final DomainError error) {
        return DomainErrorStatusMapper.toHttpException(error);
    }
}
