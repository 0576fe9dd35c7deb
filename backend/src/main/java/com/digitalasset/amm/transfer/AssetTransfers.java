// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.transfer;

import com.digitalasset.amm.pool.Asset;

import java.util.Objects;

/**
 * The transfer collaborator for each side of the pool, plus the pool's own account name.
 */
public class AssetTransfers {

    private final String poolAccount;
    private final TokenTransfer tokenA;
    private final TokenTransfer tokenB;

    public AssetTransfers(final String poolAccount, final TokenTransfer tokenA, final TokenTransfer tokenB) {
        this.poolAccount = Objects.requireNonNull(poolAccount, "poolAccount");
        this.tokenA = Objects.requireNonNull(tokenA, "tokenA");
        this.tokenB = Objects.requireNonNull(tokenB, "tokenB");
    }

    public TokenTransfer forAsset(final Asset asset) {
        return asset == Asset.A ? tokenA : tokenB;
    }

    public String poolAccount() {
        return poolAccount;
    }

    /**
     * Fresh journal for one pool operation.
     */
    public TransferJournal journal() {
        return new TransferJournal(this);
    }
}
