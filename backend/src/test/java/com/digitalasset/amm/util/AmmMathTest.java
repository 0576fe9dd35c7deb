// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.util;

import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.common.Result;
import com.digitalasset.amm.constants.PoolConstants;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("uint256 checked arithmetic")
class AmmMathTest {

    private static final BigInteger MAX = PoolConstants.UINT256_MAX;

    @Test
    @DisplayName("Operations inside the range succeed")
    void testInRange() {
        assertThat(AmmMath.add(BigInteger.valueOf(2), BigInteger.valueOf(3)).getValueUnsafe()).isEqualTo(5);
        assertThat(AmmMath.sub(BigInteger.valueOf(5), BigInteger.valueOf(5)).getValueUnsafe()).isZero();
        assertThat(AmmMath.mul(MAX, BigInteger.ONE).getValueUnsafe()).isEqualTo(MAX);
        assertThat(AmmMath.add(MAX.subtract(BigInteger.ONE), BigInteger.ONE).getValueUnsafe()).isEqualTo(MAX);
    }

    @Test
    @DisplayName("Leaving the range in either direction is an overflow error")
    void testOverflowAndUnderflow() {
        assertOverflow(AmmMath.add(MAX, BigInteger.ONE));
        assertOverflow(AmmMath.sub(BigInteger.ONE, BigInteger.TWO));
        assertOverflow(AmmMath.mul(BigInteger.ONE.shiftLeft(128), BigInteger.ONE.shiftLeft(128)));
    }

    @Test
    @DisplayName("Division floors, ceiling division rounds up, zero divisor fails")
    void testDivision() {
        assertThat(AmmMath.div(BigInteger.valueOf(7), BigInteger.TWO).getValueUnsafe()).isEqualTo(3);
        assertThat(AmmMath.divCeil(BigInteger.valueOf(7), BigInteger.TWO).getValueUnsafe()).isEqualTo(4);
        assertThat(AmmMath.divCeil(BigInteger.valueOf(6), BigInteger.TWO).getValueUnsafe()).isEqualTo(3);
        assertThat(AmmMath.divCeil(BigInteger.ZERO, BigInteger.valueOf(5)).getValueUnsafe()).isZero();
        assertOverflow(AmmMath.div(BigInteger.TEN, BigInteger.ZERO));
        assertOverflow(AmmMath.divCeil(BigInteger.TEN, BigInteger.ZERO));
    }

    @Test
    @DisplayName("mulDiv floors and rejects an out-of-range intermediate product")
    void testMulDiv() {
        assertThat(AmmMath.mulDiv(BigInteger.TEN, BigInteger.valueOf(3), BigInteger.valueOf(4)).getValueUnsafe())
                .isEqualTo(7);
        // the quotient would fit, the product does not
        assertOverflow(AmmMath.mulDiv(MAX, BigInteger.TWO, BigInteger.TWO));
    }

    @Test
    void testInRangePredicate() {
        assertThat(AmmMath.inRange(BigInteger.ZERO)).isTrue();
        assertThat(AmmMath.inRange(MAX)).isTrue();
        assertThat(AmmMath.inRange(MAX.add(BigInteger.ONE))).isFalse();
        assertThat(AmmMath.inRange(BigInteger.valueOf(-1))).isFalse();
        assertThat(AmmMath.inRange(null)).isFalse();
    }

    private static void assertOverflow(Result<BigInteger, DomainError> result) {
        assertThat(result.isErr()).isTrue();
        assertThat(result.getErrorUnsafe().code()).isEqualTo("ARITHMETIC_OVERFLOW");
    }
}
