// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.controller;

import com.digitalasset.amm.auth.PartyValidationService;
import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.common.errors.ValidationError;
import com.digitalasset.amm.config.PoolProperties;
import com.digitalasset.amm.constants.PoolConstants;
import com.digitalasset.amm.dto.MintTokensRequest;
import com.digitalasset.amm.dto.MintTokensResponse;
import com.digitalasset.amm.dto.TokenBalanceDto;
import com.digitalasset.amm.pool.Asset;
import com.digitalasset.amm.service.IdempotencyService;
import com.digitalasset.amm.service.TokenFaucetService;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Faucet and balances for the two pool assets.
 */
@RestController
@RequestMapping("/api/tokens")
public class TokenController {
    private static final Logger logger = LoggerFactory.getLogger(TokenController.class);

    private final TokenFaucetService faucetService;
    private final PartyValidationService partyValidationService;
    private final IdempotencyService idempotencyService;
    private final PoolProperties properties;

    public TokenController(TokenFaucetService faucetService,
                           PartyValidationService partyValidationService,
                           IdempotencyService idempotencyService,
                           PoolProperties properties) {
        this.faucetService = faucetService;
        this.partyValidationService = partyValidationService;
        this.idempotencyService = idempotencyService;
        this.properties = properties;
    }

    @PostMapping("/mint")
    @WithSpan
    public MintTokensResponse mint(
            @RequestHeader(value = PoolConstants.PARTY_HEADER, required = false) String partyHeader,
            @RequestHeader(value = PoolConstants.IDEMPOTENCY_HEADER, required = false) String idempotencyHeader,
            @Valid @RequestBody MintTokensRequest req
    ) {
        String party = partyValidationService.resolveCaller(partyHeader).orElseThrow(this::toHttpException);
        String key = idempotencyService.validateKey(idempotencyHeader).orElseThrow(this::toHttpException).orElse(null);
        Asset asset = properties.assetOf(req.getSymbol())
                .orElseThrow(() -> toHttpException(new ValidationError("Unknown token symbol: " + req.getSymbol())));
        logger.info("POST /api/tokens/mint - party: {}, symbol: {}, amount: {}", party, req.getSymbol(), req.getAmount());

        return idempotencyService.execute(party, "mint" + asset, key, MintTokensResponse.class, () -> {
            BigInteger balance = faucetService.mint(party, asset, req.getAmount()).orElseThrow(this::toHttpException);
            return new MintTokensResponse(party, properties.symbolOf(asset), req.getAmount().toString(), balance.toString());
        });
    }

    @GetMapping("/balances")
    @WithSpan
    public List<TokenBalanceDto> balances(
            @RequestHeader(value = PoolConstants.PARTY_HEADER, required = false) String partyHeader
    ) {
        String party = partyValidationService.validateFormat(partyHeader).orElseThrow(this::toHttpException);
        Map<Asset, BigInteger> balances = faucetService.balances(party);
        return balances.entrySet().stream()
                .map(entry -> new TokenBalanceDto(properties.symbolOf(entry.getKey()), entry.getValue().toString()))
                .toList();
    }

    private RuntimeException toHttpException(final DomainError error) {
        return DomainErrorStatusMapper.toHttpException(error);
    }
}
