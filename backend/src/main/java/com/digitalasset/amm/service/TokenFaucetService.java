// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.service;

import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.common.Result;
import com.digitalasset.amm.common.errors.ValidationError;
import com.digitalasset.amm.config.PoolProperties;
import com.digitalasset.amm.pool.Asset;
import com.digitalasset.amm.transfer.InMemoryTokenLedger;
import com.digitalasset.amm.util.AmmMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.EnumMap;
import java.util.Map;

/**
 * Owns the in-memory balance books of both pool assets and credits parties on request.
 */
@Service
public class TokenFaucetService {

    private static final Logger logger = LoggerFactory.getLogger(TokenFaucetService.class);

    private final PoolProperties properties;
    private final Map<Asset, InMemoryTokenLedger> ledgers = new EnumMap<>(Asset.class);

    public TokenFaucetService(PoolProperties properties) {
        this.properties = properties;
        ledgers.put(Asset.A, new InMemoryTokenLedger(properties.getTokenASymbol(), properties.getPoolParty()));
        ledgers.put(Asset.B, new InMemoryTokenLedger(properties.getTokenBSymbol(), properties.getPoolParty()));
    }

    public InMemoryTokenLedger ledger(Asset asset) {
        return ledgers.get(asset);
    }

    /**
     * Credit {@code amount} of {@code asset} to {@code party}.
     *
     * @return the party's new balance
     */
    public Result<BigInteger, DomainError> mint(String party, Asset asset, BigInteger amount) {
        if (!properties.isFaucetEnabled()) {
            return Result.err(new ValidationError("faucet is disabled"));
        }
        if (amount == null || amount.signum() <= 0 || !AmmMath.inRange(amount)) {
            return Result.err(new ValidationError("mint amount must be a positive uint256, got: " + amount));
        }
        if (party.equals(properties.getPoolParty())) {
            return Result.err(new ValidationError("cannot mint to the pool account"));
        }
        InMemoryTokenLedger ledger = ledgers.get(asset);
        return AmmMath.add(ledger.balanceOf(party), amount).map(expected -> {
            BigInteger balance = ledger.mint(party, amount);
            logger.info("Faucet credited {} {} to {}", amount, ledger.symbol(), party);
            return balance;
        });
    }

    public Map<Asset, BigInteger> balances(String party) {
        Map<Asset, BigInteger> out = new EnumMap<>(Asset.class);
        ledgers.forEach((asset, ledger) -> out.put(asset, ledger.balanceOf(party)));
        return out;
    }
}
