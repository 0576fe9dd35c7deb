// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.pool;

import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.common.Result;
import com.digitalasset.amm.common.errors.InsufficientOwnedSharesError;
import com.digitalasset.amm.common.errors.InsufficientPoolSharesError;
import com.digitalasset.amm.common.errors.PoolEmptyError;
import com.digitalasset.amm.common.errors.RatioMismatchError;
import com.digitalasset.amm.constants.PoolConstants;
import com.digitalasset.amm.util.AmmMath;

import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Share issuance on deposit and proportional redemption on withdrawal.
 *
 * Mutable state (total shares, positions, phase) is only touched through {@link #commitDeposit}
 * and {@link #commitWithdrawal}; the owning pool serializes those calls.
 */
public class LiquidityAccounting {

    private final ReserveLedger ledger;
    private final BigInteger toleranceDivisor;
    private final boolean reseedOnDrain;

    private final Map<String, BigInteger> positions = new HashMap<>();
    private BigInteger totalShares = BigInteger.ZERO;
    private PoolPhase phase = PoolPhase.UNINITIALIZED;

    /**
     * @param toleranceDivisor both share figures are divided by this before comparison on deposit;
     *                         a loose check against integer-division noise, not a proportionality proof
     * @param reseedOnDrain    whether a pool drained back to zero shares mints the seed issuance again
     */
    public LiquidityAccounting(final ReserveLedger ledger, final long toleranceDivisor, final boolean reseedOnDrain) {
        if (toleranceDivisor < 1) {
            throw new IllegalArgumentException("toleranceDivisor must be >= 1, got: " + toleranceDivisor);
        }
        this.ledger = ledger;
        this.toleranceDivisor = BigInteger.valueOf(toleranceDivisor);
        this.reseedOnDrain = reseedOnDrain;
    }

    /**
     * Shares minted for a deposit of {@code amountA} and {@code amountB} against the current reserves.
     * An empty pool mints the fixed seed issuance whatever the amounts; otherwise the A-derived figure
     * is returned once it agrees with the B-derived one at the configured granularity.
     */
    public Result<BigInteger, DomainError> sharesForDeposit(final BigInteger amountA, final BigInteger amountB) {
        if (totalShares.signum() == 0) {
            if (phase == PoolPhase.ACTIVE && !reseedOnDrain) {
                return Result.err(new PoolEmptyError("pool was drained to zero shares and re-seeding is disabled"));
            }
            return Result.ok(PoolConstants.SEED_SHARES);
        }
        Reserves reserves = ledger.snapshot();
        Result<BigInteger, DomainError> sharesA = AmmMath.mulDiv(totalShares, amountA, reserves.reserveA());
        Result<BigInteger, DomainError> sharesB = AmmMath.mulDiv(totalShares, amountB, reserves.reserveB());
        if (sharesA.isErr()) {
            return sharesA;
        }
        if (sharesB.isErr()) {
            return sharesB;
        }
        BigInteger a = sharesA.getValueUnsafe();
        BigInteger b = sharesB.getValueUnsafe();
        if (!a.divide(toleranceDivisor).equals(b.divide(toleranceDivisor))) {
            return Result.err(new RatioMismatchError(
                    "deposit " + amountA + "/" + amountB + " does not match reserve ratio "
                            + reserves.reserveA() + "/" + reserves.reserveB()
                            + " (shares " + a + " vs " + b + ")"));
        }
        return Result.ok(a);
    }

    /**
     * Validate and stage a deposit: minted shares, new share total and new reserves.
     */
    public Result<DepositPlan, DomainError> planDeposit(final BigInteger amountA, final BigInteger amountB) {
        Reserves reserves = ledger.snapshot();
        return sharesForDeposit(amountA, amountB).flatMap(minted ->
                AmmMath.add(totalShares, minted).flatMap(newTotal ->
                        AmmMath.add(reserves.reserveA(), amountA).flatMap(newA ->
                                AmmMath.add(reserves.reserveB(), amountB).flatMap(newB ->
                                        ledger.prepare(newA, newB).map(staged ->
                                                new DepositPlan(amountA, amountB, minted, newTotal, staged))))));
    }

    /**
     * Proportional slice of both reserves for {@code shares}, floor-divided so residual dust stays in the pool.
     */
    public Result<WithdrawalAmounts, DomainError> amountsForWithdraw(final BigInteger shares) {
        if (shares.compareTo(totalShares) > 0) {
            return Result.err(new InsufficientPoolSharesError(
                    "requested " + shares + " shares but only " + totalShares + " are outstanding"));
        }
        if (totalShares.signum() == 0) {
            // zero shares of an empty pool
            return Result.ok(new WithdrawalAmounts(BigInteger.ZERO, BigInteger.ZERO));
        }
        Reserves reserves = ledger.snapshot();
        return AmmMath.mulDiv(shares, reserves.reserveA(), totalShares).flatMap(amountA ->
                AmmMath.mulDiv(shares, reserves.reserveB(), totalShares).map(amountB ->
                        new WithdrawalAmounts(amountA, amountB)));
    }

    /**
     * Validate and stage a withdrawal of {@code shares} owned by {@code party}.
     */
    public Result<WithdrawalPlan, DomainError> planWithdrawal(final String party, final BigInteger shares) {
        BigInteger owned = sharesOf(party);
        if (shares.compareTo(owned) > 0) {
            return Result.err(new InsufficientOwnedSharesError(
                    party + " owns " + owned + " shares, cannot redeem " + shares));
        }
        Reserves reserves = ledger.snapshot();
        return amountsForWithdraw(shares).flatMap(amounts ->
                AmmMath.sub(reserves.reserveA(), amounts.amountA()).flatMap(newA ->
                        AmmMath.sub(reserves.reserveB(), amounts.amountB()).flatMap(newB ->
                                AmmMath.sub(totalShares, shares).flatMap(newTotal ->
                                        ledger.prepare(newA, newB).map(staged ->
                                                new WithdrawalPlan(shares, amounts, owned.subtract(shares),
                                                        newTotal, staged))))));
    }

    public void commitDeposit(final String party, final DepositPlan plan) {
        ledger.commit(plan.reserves());
        totalShares = plan.newTotalShares();
        positions.merge(party, plan.mintedShares(), BigInteger::add);
        phase = PoolPhase.ACTIVE;
    }

    public void commitWithdrawal(final String party, final WithdrawalPlan plan) {
        ledger.commit(plan.reserves());
        totalShares = plan.newTotalShares();
        if (plan.newOwnedShares().signum() == 0) {
            positions.remove(party);
        } else {
            positions.put(party, plan.newOwnedShares());
        }
    }

    public BigInteger totalShares() {
        return totalShares;
    }

    public BigInteger sharesOf(final String party) {
        return positions.getOrDefault(party, BigInteger.ZERO);
    }

    public Map<String, BigInteger> positions() {
        return Collections.unmodifiableMap(new HashMap<>(positions));
    }

    public PoolPhase phase() {
        return phase;
    }

    public long toleranceDivisor() {
        return toleranceDivisor.longValueExact();
    }
}
