// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.pool;

import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.common.Result;
import com.digitalasset.amm.util.AmmMath;

import java.math.BigInteger;

/**
 * How the post-swap reserve {@code k / reserveInAfter} is rounded.
 */
public enum SwapRounding {
    /** Truncating division. The output can exceed the exact curve by less than one unit. */
    FLOOR {
        @Override
        Result<BigInteger, DomainError> reserveOutAfter(final BigInteger k, final BigInteger reserveInAfter) {
            return AmmMath.div(k, reserveInAfter);
        }
    },
    /** Rounds the reserve up, so k never decreases and an immediate round trip never gains. */
    CEILING {
        @Override
        Result<BigInteger, DomainError> reserveOutAfter(final BigInteger k, final BigInteger reserveInAfter) {
            return AmmMath.divCeil(k, reserveInAfter);
        }
    };

    abstract Result<BigInteger, DomainError> reserveOutAfter(BigInteger k, BigInteger reserveInAfter);
}
