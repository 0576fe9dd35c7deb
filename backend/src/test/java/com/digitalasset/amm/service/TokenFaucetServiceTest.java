// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.service;

import com.digitalasset.amm.config.PoolProperties;
import com.digitalasset.amm.constants.PoolConstants;
import com.digitalasset.amm.pool.Asset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

class TokenFaucetServiceTest {

    private PoolProperties properties;
    private TokenFaucetService faucet;

    @BeforeEach
    void setUp() {
        properties = new PoolProperties();
        faucet = new TokenFaucetService(properties);
    }

    @Test
    void testMintCreditsBalance() {
        assertThat(faucet.mint("alice", Asset.A, BigInteger.valueOf(500)).getValueUnsafe()).isEqualTo(500);
        assertThat(faucet.mint("alice", Asset.A, BigInteger.valueOf(250)).getValueUnsafe()).isEqualTo(750);

        assertThat(faucet.balances("alice"))
                .containsEntry(Asset.A, BigInteger.valueOf(750))
                .containsEntry(Asset.B, BigInteger.ZERO);
        assertThat(faucet.ledger(Asset.A).symbol()).isEqualTo("TKA");
    }

    @Test
    void testRejectsInvalidMints() {
        assertThat(faucet.mint("alice", Asset.A, BigInteger.ZERO).getErrorUnsafe().code()).isEqualTo("VALIDATION_ERROR");
        assertThat(faucet.mint("amm-pool", Asset.A, BigInteger.TEN).isErr()).isTrue();

        faucet.mint("alice", Asset.B, PoolConstants.UINT256_MAX);
        assertThat(faucet.mint("alice", Asset.B, BigInteger.ONE).getErrorUnsafe().code())
                .isEqualTo("ARITHMETIC_OVERFLOW");
    }

    @Test
    void testDisabledFaucet() {
        properties.setFaucetEnabled(false);

        assertThat(faucet.mint("alice", Asset.A, BigInteger.TEN).isErr()).isTrue();
        assertThat(faucet.balances("alice")).containsEntry(Asset.A, BigInteger.ZERO);
    }
}
