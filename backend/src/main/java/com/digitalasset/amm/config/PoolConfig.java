// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.config;

import com.digitalasset.amm.pool.Asset;
import com.digitalasset.amm.service.TokenFaucetService;
import com.digitalasset.amm.transfer.AssetTransfers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the pool's collaborators. An {@link AssetTransfers} bean defined elsewhere replaces the
 * in-memory token ledgers.
 */
@Configuration
@EnableConfigurationProperties({PoolProperties.class, IdempotencyProperties.class})
public class PoolConfig {

    private static final Logger logger = LoggerFactory.getLogger(PoolConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public AssetTransfers assetTransfers(PoolProperties properties, TokenFaucetService faucet) {
        if (properties.getRatioToleranceDivisor() < 1) {
            throw new IllegalStateException("amm.pool.ratio-tolerance-divisor must be >= 1, got: "
                    + properties.getRatioToleranceDivisor());
        }
        if (properties.getTokenASymbol().equals(properties.getTokenBSymbol())) {
            throw new IllegalStateException("amm.pool token symbols must differ, both are: "
                    + properties.getTokenASymbol());
        }
        logger.info("Using in-memory token ledgers for {}/{} with pool account {}",
                properties.getTokenASymbol(), properties.getTokenBSymbol(), properties.getPoolParty());
        return new AssetTransfers(properties.getPoolParty(), faucet.ledger(Asset.A), faucet.ledger(Asset.B));
    }
}
