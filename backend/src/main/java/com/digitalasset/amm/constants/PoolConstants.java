// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.constants;

import java.math.BigInteger;

/**
 * Centralized constants for pool arithmetic and the HTTP surface.
 */
public final class PoolConstants {

    private PoolConstants() {
        // Prevent instantiation
    }

    // ========================================
    // SHARE ARITHMETIC
    // ========================================

    /**
     * Fixed-point scale of pool shares (10^18).
     */
    public static final BigInteger PRECISION = BigInteger.TEN.pow(18);

    /**
     * Shares minted by the first deposit into an empty pool (100 * PRECISION).
     */
    public static final BigInteger SEED_SHARES = BigInteger.valueOf(100).multiply(PRECISION);

    /**
     * Default divisor applied to both share figures before comparing them on deposit.
     */
    public static final long DEFAULT_RATIO_TOLERANCE_DIVISOR = 1000;

    // ========================================
    // UNSIGNED INTEGER DOMAIN
    // ========================================

    /**
     * Largest representable amount, reserve, share count or product (2^256 - 1).
     */
    public static final BigInteger UINT256_MAX = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    // ========================================
    // HTTP
    // ========================================

    /**
     * Header carrying the caller's party identifier.
     */
    public static final String PARTY_HEADER = "X-Party-Id";

    /**
     * Header name for idempotency key.
     */
    public static final String IDEMPOTENCY_HEADER = "X-Idempotency-Key";

    /**
     * Default cache duration for idempotency keys (24 hours in seconds).
     */
    public static final long DEFAULT_IDEMPOTENCY_TTL_SECONDS = 86400;

    /**
     * Upper bound on swap records returned by one history query.
     */
    public static final int MAX_HISTORY_PAGE = 500;
}
