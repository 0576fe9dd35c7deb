// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.config;

import com.digitalasset.amm.constants.PoolConstants;
import com.digitalasset.amm.pool.Asset;
import com.digitalasset.amm.pool.SwapRounding;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Optional;

/**
 * Pool settings bound from {@code amm.pool.*}.
 */
@ConfigurationProperties(prefix = "amm.pool")
public class PoolProperties {

    private String tokenASymbol = "TKA";
    private String tokenBSymbol = "TKB";

    /**
     * Account that holds the pool's reserves in the token ledgers.
     */
    private String poolParty = "amm-pool";

    /**
     * Both share figures of a deposit are divided by this before they must agree.
     * A larger value loosens the ratio check.
     */
    private long ratioToleranceDivisor = PoolConstants.DEFAULT_RATIO_TOLERANCE_DIVISOR;

    /**
     * Whether a pool whose shares were all redeemed accepts a new seed deposit.
     */
    private boolean reseedOnDrain = true;

    /**
     * Rounding of the post-swap reserve. CEILING keeps round trips from gaining.
     */
    private SwapRounding swapRounding = SwapRounding.FLOOR;

    private int swapHistorySize = 1000;

    private boolean faucetEnabled = true;

    public String getTokenASymbol() {
        return tokenASymbol;
    }

    public void setTokenASymbol(String tokenASymbol) {
        this.tokenASymbol = tokenASymbol;
    }

    public String getTokenBSymbol() {
        return tokenBSymbol;
    }

    public void setTokenBSymbol(String tokenBSymbol) {
        this.tokenBSymbol = tokenBSymbol;
    }

    public String getPoolParty() {
        return poolParty;
    }

    public void setPoolParty(String poolParty) {
        this.poolParty = poolParty;
    }

    public long getRatioToleranceDivisor() {
        return ratioToleranceDivisor;
    }

    public void setRatioToleranceDivisor(long ratioToleranceDivisor) {
        this.ratioToleranceDivisor = ratioToleranceDivisor;
    }

    public boolean isReseedOnDrain() {
        return reseedOnDrain;
    }

    public void setReseedOnDrain(boolean reseedOnDrain) {
        this.reseedOnDrain = reseedOnDrain;
    }

    public SwapRounding getSwapRounding() {
        return swapRounding;
    }

    public void setSwapRounding(SwapRounding swapRounding) {
        this.swapRounding = swapRounding;
    }

    public int getSwapHistorySize() {
        return swapHistorySize;
    }

    public void setSwapHistorySize(int swapHistorySize) {
        this.swapHistorySize = swapHistorySize;
    }

    public boolean isFaucetEnabled() {
        return faucetEnabled;
    }

    public void setFaucetEnabled(boolean faucetEnabled) {
        this.faucetEnabled = faucetEnabled;
    }

    public String symbolOf(Asset asset) {
        return asset == Asset.A ? tokenASymbol : tokenBSymbol;
    }

    /**
     * Case-insensitive symbol lookup.
     */
    public Optional<Asset> assetOf(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        if (symbol.equalsIgnoreCase(tokenASymbol)) {
            return Optional.of(Asset.A);
        }
        if (symbol.equalsIgnoreCase(tokenBSymbol)) {
            return Optional.of(Asset.B);
        }
        return Optional.empty();
    }
}
