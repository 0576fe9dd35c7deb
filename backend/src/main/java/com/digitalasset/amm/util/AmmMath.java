// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.util;

import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.common.Result;
import com.digitalasset.amm.common.errors.OverflowError;
import com.digitalasset.amm.constants.PoolConstants;

import java.math.BigInteger;

/**
 * Checked unsigned 256-bit arithmetic shared by the ledger, accounting and pricing.
 *
 * Every operation returns {@link OverflowError} instead of leaving the range [0, 2^256 - 1].
 * {@link #div} truncates toward zero, which for non-negative operands is floor division.
 */
public final class AmmMath {

    private AmmMath() {
        // Utility class
    }

    public static boolean inRange(final BigInteger value) {
        return value != null && value.signum() >= 0 && value.compareTo(PoolConstants.UINT256_MAX) <= 0;
    }

    public static Result<BigInteger, DomainError> add(final BigInteger a, final BigInteger b) {
        return bounded(a.add(b), "addition", a, b);
    }

    public static Result<BigInteger, DomainError> sub(final BigInteger a, final BigInteger b) {
        return bounded(a.subtract(b), "subtraction", a, b);
    }

    public static Result<BigInteger, DomainError> mul(final BigInteger a, final BigInteger b) {
        return bounded(a.multiply(b), "multiplication", a, b);
    }

    /**
     * Floor of {@code a / b}. A zero divisor is reported as an overflow, as it has no representable result.
     */
    public static Result<BigInteger, DomainError> div(final BigInteger a, final BigInteger b) {
        if (b.signum() == 0) {
            return Result.err(new OverflowError("division by zero: " + a + " / 0"));
        }
        return bounded(a.divide(b), "division", a, b);
    }

    /**
     * Ceiling of {@code a / b}.
     */
    public static Result<BigInteger, DomainError> divCeil(final BigInteger a, final BigInteger b) {
        if (b.signum() == 0) {
            return Result.err(new OverflowError("division by zero: " + a + " / 0"));
        }
        BigInteger[] qr = a.divideAndRemainder(b);
        BigInteger quotient = qr[1].signum() == 0 ? qr[0] : qr[0].add(BigInteger.ONE);
        return bounded(quotient, "division", a, b);
    }

    /**
     * Floor of {@code a * b / c}, failing if the intermediate product leaves the unsigned range.
     */
    public static Result<BigInteger, DomainError> mulDiv(final BigInteger a, final BigInteger b, final BigInteger c) {
        return mul(a, b).flatMap(product -> div(product, c));
    }

    private static Result<BigInteger, DomainError> bounded(final BigInteger result, final String op,
                                                           final BigInteger a, final BigInteger b) {
        if (inRange(result)) {
            return Result.ok(result);
        }
        String direction = result.signum() < 0 ? "underflow" : "overflow";
        return Result.err(new OverflowError("uint256 " + op + " " + direction + ": " + a + ", " + b));
    }
}
