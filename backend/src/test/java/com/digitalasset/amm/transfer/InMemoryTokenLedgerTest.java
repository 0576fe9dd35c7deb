// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.transfer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryTokenLedgerTest {

    private InMemoryTokenLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryTokenLedger("TKA", "amm-pool");
        ledger.mint("alice", BigInteger.valueOf(500));
    }

    @Test
    void testTransferFromMovesBalance() {
        assertThat(ledger.transferFrom("alice", "amm-pool", BigInteger.valueOf(200))).isTrue();

        assertThat(ledger.balanceOf("alice")).isEqualTo(300);
        assertThat(ledger.balanceOf("amm-pool")).isEqualTo(200);
    }

    @Test
    void testTransferPaysOutOfPoolAccount() {
        ledger.transferFrom("alice", "amm-pool", BigInteger.valueOf(200));

        assertThat(ledger.transfer("bob", BigInteger.valueOf(50))).isTrue();

        assertThat(ledger.balanceOf("bob")).isEqualTo(50);
        assertThat(ledger.balanceOf("amm-pool")).isEqualTo(150);
    }

    @Test
    void testInsufficientBalanceIsRefused() {
        assertThat(ledger.transferFrom("alice", "amm-pool", BigInteger.valueOf(501))).isFalse();
        assertThat(ledger.transfer("bob", BigInteger.ONE)).isFalse();

        assertThat(ledger.balanceOf("alice")).isEqualTo(500);
        assertThat(ledger.balanceOf("amm-pool")).isZero();
    }

    @Test
    void testNegativeAmountIsRefused() {
        assertThat(ledger.transferFrom("alice", "bob", BigInteger.valueOf(-1))).isFalse();
        assertThat(ledger.balanceOf("bob")).isZero();
    }

    @Test
    void testMintRequiresPositiveAmount() {
        assertThatThrownBy(() -> ledger.mint("alice", BigInteger.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThat(ledger.mint("alice", BigInteger.TEN)).isEqualTo(510);
    }
}
