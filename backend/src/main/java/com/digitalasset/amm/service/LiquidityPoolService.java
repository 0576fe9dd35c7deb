// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.service;

import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.common.Result;
import com.digitalasset.amm.common.errors.PoolEmptyError;
import com.digitalasset.amm.common.errors.TransferFailedError;
import com.digitalasset.amm.common.errors.ValidationError;
import com.digitalasset.amm.config.PoolProperties;
import com.digitalasset.amm.event.PoolEventListener;
import com.digitalasset.amm.event.SwapRecord;
import com.digitalasset.amm.pool.Asset;
import com.digitalasset.amm.pool.DepositPlan;
import com.digitalasset.amm.pool.LiquidityAccounting;
import com.digitalasset.amm.pool.PoolSnapshot;
import com.digitalasset.amm.pool.ReserveLedger;
import com.digitalasset.amm.pool.Reserves;
import com.digitalasset.amm.pool.SwapPricingEngine;
import com.digitalasset.amm.pool.SwapQuote;
import com.digitalasset.amm.pool.WithdrawalAmounts;
import com.digitalasset.amm.pool.WithdrawalPlan;
import com.digitalasset.amm.transfer.AssetTransfers;
import com.digitalasset.amm.transfer.TransferJournal;
import com.digitalasset.amm.util.AmmMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Pool operation coordinator: deposit, swap and withdraw, plus the read-only quotes.
 *
 * Every mutating operation runs under the pool's write lock for its whole duration, collaborator
 * transfers included. It validates and stages first, moves assets second and commits last; a failed
 * transfer unwinds the transfers already made and leaves the pool untouched. Queries take the read
 * lock, so they never see a half-committed operation.
 */
@Service
public class LiquidityPoolService {

    private static final Logger logger = LoggerFactory.getLogger(LiquidityPoolService.class);

    private final ReserveLedger ledger;
    private final LiquidityAccounting accounting;
    private final SwapPricingEngine pricing;
    private final AssetTransfers transfers;
    private final List<PoolEventListener> listeners;
    private final Clock clock;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public LiquidityPoolService(final PoolProperties properties,
                                final AssetTransfers transfers,
                                final List<PoolEventListener> listeners,
                                final Clock clock) {
        this.ledger = new ReserveLedger();
        this.accounting = new LiquidityAccounting(ledger, properties.getRatioToleranceDivisor(),
                properties.isReseedOnDrain());
        this.pricing = new SwapPricingEngine(ledger, properties.getSwapRounding());
        this.transfers = transfers;
        this.listeners = List.copyOf(listeners);
        this.clock = clock;
        logger.info("Liquidity pool ready: poolAccount={}, ratioToleranceDivisor={}, reseedOnDrain={}, "
                        + "swapRounding={}, listeners={}",
                transfers.poolAccount(), properties.getRatioToleranceDivisor(), properties.isReseedOnDrain(),
                properties.getSwapRounding(), this.listeners.size());
    }

    // ========================================
    // MUTATING OPERATIONS
    // ========================================

    /**
     * Deposit both assets and mint shares to {@code party}.
     *
     * @return shares minted
     */
    public Result<BigInteger, DomainError> addLiquidity(final String party, final BigInteger amountA,
                                                        final BigInteger amountB) {
        return withWriteLock(() -> requirePositive("amountA", amountA)
                .flatMap(ok -> requirePositive("amountB", amountB))
                .flatMap(ok -> accounting.planDeposit(amountA, amountB))
                .flatMap(plan -> executeDeposit(party, plan))
                .peekError(error -> rejected("addLiquidity", party, error)));
    }

    public Result<BigInteger, DomainError> swapTokenA(final String party, final BigInteger amountA) {
        return swap(party, Asset.A, amountA).map(SwapRecord::amountOut);
    }

    public Result<BigInteger, DomainError> swapTokenB(final String party, final BigInteger amountB) {
        return swap(party, Asset.B, amountB).map(SwapRecord::amountOut);
    }

    /**
     * Swap {@code amountIn} of {@code assetIn} for the opposite asset.
     *
     * @return the committed swap, as emitted to listeners
     */
    public Result<SwapRecord, DomainError> swap(final String party, final Asset assetIn, final BigInteger amountIn) {
        return withWriteLock(() -> requirePositive("amountIn", amountIn)
                .flatMap(ok -> pricing.quote(assetIn, amountIn))
                .flatMap(quote -> executeSwap(party, quote))
                .peekError(error -> rejected("swap" + assetIn, party, error)));
    }

    /**
     * Redeem {@code shares} owned by {@code party} for a proportional slice of both reserves.
     */
    public Result<WithdrawalAmounts, DomainError> removeLiquidity(final String party, final BigInteger shares) {
        return withWriteLock(() -> requirePositive("shares", shares)
                .flatMap(ok -> accounting.planWithdrawal(party, shares))
                .flatMap(plan -> executeWithdrawal(party, plan))
                .peekError(error -> rejected("removeLiquidity", party, error)));
    }

    // ========================================
    // QUERIES
    // ========================================

    /**
     * Amount of B matching {@code amountA} at the current reserve ratio.
     */
    public Result<BigInteger, DomainError> calculateTokenBDeposit(final BigInteger amountA) {
        return withReadLock(() -> depositCounterpart(amountA, Asset.A));
    }

    /**
     * Amount of A matching {@code amountB} at the current reserve ratio.
     */
    public Result<BigInteger, DomainError> calculateTokenADeposit(final BigInteger amountB) {
        return withReadLock(() -> depositCounterpart(amountB, Asset.B));
    }

    public Result<BigInteger, DomainError> calculateTokenASwap(final BigInteger amountA) {
        return withReadLock(() -> requireNonNegative("amountA", amountA)
                .flatMap(ok -> pricing.quoteAtoB(amountA))
                .map(SwapQuote::amountOut));
    }

    public Result<BigInteger, DomainError> calculateTokenBSwap(final BigInteger amountB) {
        return withReadLock(() -> requireNonNegative("amountB", amountB)
                .flatMap(ok -> pricing.quoteBtoA(amountB))
                .map(SwapQuote::amountOut));
    }

    public Result<WithdrawalAmounts, DomainError> calculateWithdrawAmount(final BigInteger shares) {
        return withReadLock(() -> requireNonNegative("shares", shares)
                .flatMap(ok -> accounting.amountsForWithdraw(shares)));
    }

    public PoolSnapshot getPoolDetails() {
        return withReadLock(this::snapshot);
    }

    public BigInteger getMyHoldings(final String party) {
        return withReadLock(() -> accounting.sharesOf(party));
    }

    /**
     * Sum of every position; equals total shares whenever no operation is in flight.
     */
    public BigInteger sumOfPositions() {
        return withReadLock(() -> accounting.positions().values().stream()
                .reduce(BigInteger.ZERO, BigInteger::add));
    }

    // ========================================
    // EXECUTION (write lock held)
    // ========================================

    private Result<BigInteger, DomainError> executeDeposit(final String party, final DepositPlan plan) {
        TransferJournal journal = transfers.journal();
        if (!journal.pullFromParty(Asset.A, party, plan.amountA())
                || !journal.pullFromParty(Asset.B, party, plan.amountB())) {
            return Result.err(transferFailed(journal, "deposit from " + party));
        }
        accounting.commitDeposit(party, plan);
        PoolSnapshot after = snapshot();
        logger.info("Liquidity added by {}: amountA={}, amountB={}, minted={}, reserves={}/{}, totalShares={}",
                party, plan.amountA(), plan.amountB(), plan.mintedShares(),
                after.reserveA(), after.reserveB(), after.totalShares());
        notifyListeners(listener -> listener.onLiquidityAdded(party, plan.amountA(), plan.amountB(),
                plan.mintedShares(), after));
        return Result.ok(plan.mintedShares());
    }

    private Result<SwapRecord, DomainError> executeSwap(final String party, final SwapQuote quote) {
        TransferJournal journal = transfers.journal();
        if (!journal.pullFromParty(quote.assetIn(), party, quote.amountIn())
                || !journal.pushToParty(quote.assetOut(), party, quote.amountOut())) {
            return Result.err(transferFailed(journal, "swap for " + party));
        }
        ledger.commit(quote.reservesAfter());
        Reserves after = quote.reservesAfter();
        SwapRecord record = new SwapRecord(party, quote.assetIn(), quote.amountIn(), quote.assetOut(),
                quote.amountOut(), after.reserveA(), after.reserveB(), Instant.now(clock));
        logger.info("Swap by {}: {} {} -> {} {}, reserves={}/{}",
                party, quote.amountIn(), quote.assetIn(), quote.amountOut(), quote.assetOut(),
                after.reserveA(), after.reserveB());
        notifyListeners(listener -> listener.onSwap(record));
        return Result.ok(record);
    }

    private Result<WithdrawalAmounts, DomainError> executeWithdrawal(final String party, final WithdrawalPlan plan) {
        TransferJournal journal = transfers.journal();
        WithdrawalAmounts amounts = plan.amounts();
        if (!journal.pushToParty(Asset.A, party, amounts.amountA())
                || !journal.pushToParty(Asset.B, party, amounts.amountB())) {
            return Result.err(transferFailed(journal, "withdrawal to " + party));
        }
        accounting.commitWithdrawal(party, plan);
        PoolSnapshot after = snapshot();
        logger.info("Liquidity removed by {}: shares={}, amountA={}, amountB={}, reserves={}/{}, totalShares={}",
                party, plan.shares(), amounts.amountA(), amounts.amountB(),
                after.reserveA(), after.reserveB(), after.totalShares());
        notifyListeners(listener -> listener.onLiquidityRemoved(party, plan.shares(), amounts.amountA(),
                amounts.amountB(), after));
        return Result.ok(amounts);
    }

    // ========================================
    // HELPERS
    // ========================================

    private Result<BigInteger, DomainError> depositCounterpart(final BigInteger amount, final Asset given) {
        Result<Boolean, DomainError> valid = requireNonNegative("amount" + given, amount);
        if (valid.isErr()) {
            return Result.err(valid.getErrorUnsafe());
        }
        Reserves reserves = ledger.snapshot();
        if (reserves.isEmpty()) {
            return Result.err(new PoolEmptyError("pool has no liquidity; any ratio is accepted for the first deposit"));
        }
        return AmmMath.mulDiv(reserves.reserveOf(given.opposite()), amount, reserves.reserveOf(given));
    }

    private TransferFailedError transferFailed(final TransferJournal journal, final String what) {
        int completed = journal.size();
        boolean clean = journal.unwind();
        if (!clean) {
            logger.error("Transfer failed during {} and {} completed transfer(s) could not all be reversed",
                    what, completed);
            return new TransferFailedError("asset transfer failed during " + what
                    + "; reversing earlier transfers also failed", false);
        }
        return new TransferFailedError("asset transfer failed during " + what
                + (completed > 0 ? "; " + completed + " earlier transfer(s) reversed" : ""));
    }

    private PoolSnapshot snapshot() {
        return new PoolSnapshot(ledger.snapshot(), accounting.totalShares(), accounting.phase(),
                accounting.positions().size());
    }

    private void rejected(final String operation, final String party, final DomainError error) {
        logger.warn("{} rejected for {}: {}", operation, party, error);
        notifyListeners(listener -> listener.onRejected(operation, party, error));
    }

    private void notifyListeners(final Consumer<PoolEventListener> event) {
        for (PoolEventListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException ex) {
                logger.error("Pool event listener {} failed", listener.getClass().getSimpleName(), ex);
            }
        }
    }

    private static Result<Boolean, DomainError> requirePositive(final String field, final BigInteger value) {
        if (value == null) {
            return Result.err(new ValidationError(field + " is required"));
        }
        if (value.signum() <= 0) {
            return Result.err(new ValidationError(field + " must be positive, got: " + value));
        }
        if (!AmmMath.inRange(value)) {
            return Result.err(new ValidationError(field + " exceeds uint256 range"));
        }
        return Result.ok(Boolean.TRUE);
    }

    private static Result<Boolean, DomainError> requireNonNegative(final String field, final BigInteger value) {
        if (value == null) {
            return Result.err(new ValidationError(field + " is required"));
        }
        if (!AmmMath.inRange(value)) {
            return Result.err(new ValidationError(field + " must be within [0, 2^256 - 1], got: " + value));
        }
        return Result.ok(Boolean.TRUE);
    }

    private <T> Result<T, DomainError> withWriteLock(final Supplier<Result<T, DomainError>> operation) {
        Lock write = lock.writeLock();
        write.lock();
        try {
            return operation.get();
        } finally {
            write.unlock();
        }
    }

    private <T> T withReadLock(final Supplier<T> query) {
        Lock read = lock.readLock();
        read.lock();
        try {
            return query.get();
        } finally {
            read.unlock();
        }
    }
}
