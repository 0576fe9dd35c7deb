// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.transfer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Balance book for one asset, kept in memory. Used when no external token service is wired in.
 */
public class InMemoryTokenLedger implements TokenTransfer {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryTokenLedger.class);

    private final String symbol;
    private final String poolAccount;
    private final Map<String, BigInteger> balances = new HashMap<>();

    public InMemoryTokenLedger(final String symbol, final String poolAccount) {
        this.symbol = symbol;
        this.poolAccount = poolAccount;
    }

    @Override
    public synchronized boolean transferFrom(final String from, final String to, final BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            logger.warn("[{}] rejected transfer of invalid amount {} from {} to {}", symbol, amount, from, to);
            return false;
        }
        BigInteger available = balanceOf(from);
        if (available.compareTo(amount) < 0) {
            logger.warn("[{}] insufficient balance: {} holds {}, needs {}", symbol, from, available, amount);
            return false;
        }
        debit(from, amount);
        balances.merge(to, amount, BigInteger::add);
        logger.debug("[{}] {} -> {}: {}", symbol, from, to, amount);
        return true;
    }

    @Override
    public boolean transfer(final String to, final BigInteger amount) {
        return transferFrom(poolAccount, to, amount);
    }

    /**
     * Credit {@code party} with freshly created units.
     */
    public synchronized BigInteger mint(final String party, final BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("mint amount must be positive, got: " + amount);
        }
        BigInteger balance = balances.merge(party, amount, BigInteger::add);
        logger.info("[{}] minted {} to {} (balance {})", symbol, amount, party, balance);
        return balance;
    }

    public synchronized BigInteger balanceOf(final String party) {
        return balances.getOrDefault(party, BigInteger.ZERO);
    }

    public String symbol() {
        return symbol;
    }

    public String poolAccount() {
        return poolAccount;
    }

    private void debit(final String party, final BigInteger amount) {
        BigInteger remaining = balanceOf(party).subtract(amount);
        if (remaining.signum() == 0) {
            balances.remove(party);
        } else {
            balances.put(party, remaining);
        }
    }
}
