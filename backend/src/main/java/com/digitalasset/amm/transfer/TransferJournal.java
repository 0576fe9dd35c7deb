// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.transfer;

import com.digitalasset.amm.pool.Asset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.BooleanSupplier;

/**
 * Transfers performed by one pool operation, so they can be reversed if a later step fails.
 *
 * A collaborator that throws is treated the same as one that returns false.
 * Not thread-safe; one journal belongs to one operation.
 */
public class TransferJournal {

    private static final Logger logger = LoggerFactory.getLogger(TransferJournal.class);

    private enum Direction {
        INTO_POOL,
        OUT_OF_POOL
    }

    private record Entry(Asset asset, Direction direction, String party, BigInteger amount) {
    }

    private final AssetTransfers transfers;
    private final Deque<Entry> completed = new ArrayDeque<>();

    TransferJournal(final AssetTransfers transfers) {
        this.transfers = transfers;
    }

    /**
     * Move {@code amount} of {@code asset} from {@code party} into the pool.
     */
    public boolean pullFromParty(final Asset asset, final String party, final BigInteger amount) {
        boolean moved = safely(asset, "transferFrom " + party + " -> pool",
                () -> transfers.forAsset(asset).transferFrom(party, transfers.poolAccount(), amount));
        if (moved) {
            completed.push(new Entry(asset, Direction.INTO_POOL, party, amount));
        }
        return moved;
    }

    /**
     * Move {@code amount} of {@code asset} from the pool to {@code party}.
     */
    public boolean pushToParty(final Asset asset, final String party, final BigInteger amount) {
        boolean moved = safely(asset, "transfer pool -> " + party,
                () -> transfers.forAsset(asset).transfer(party, amount));
        if (moved) {
            completed.push(new Entry(asset, Direction.OUT_OF_POOL, party, amount));
        }
        return moved;
    }

    /**
     * Reverse every recorded transfer, newest first.
     *
     * @return false if at least one reversal failed; balances then differ from before the operation
     */
    public boolean unwind() {
        boolean clean = true;
        while (!completed.isEmpty()) {
            Entry entry = completed.pop();
            boolean reversed = entry.direction() == Direction.INTO_POOL
                    ? safely(entry.asset(), "refund pool -> " + entry.party(),
                        () -> transfers.forAsset(entry.asset()).transfer(entry.party(), entry.amount()))
                    : safely(entry.asset(), "clawback " + entry.party() + " -> pool",
                        () -> transfers.forAsset(entry.asset()).transferFrom(entry.party(), transfers.poolAccount(), entry.amount()));
            if (!reversed) {
                logger.error("Failed to reverse {} of {} {} for {}; manual reconciliation required",
                        entry.direction(), entry.amount(), entry.asset(), entry.party());
                clean = false;
            }
        }
        return clean;
    }

    public int size() {
        return completed.size();
    }

    private boolean safely(final Asset asset, final String description, final BooleanSupplier call) {
        try {
            boolean ok = call.getAsBoolean();
            if (!ok) {
                logger.warn("Asset {} {} reported failure", asset, description);
            }
            return ok;
        } catch (RuntimeException ex) {
            logger.warn("Asset {} {} threw: {}", asset, description, ex.getMessage(), ex);
            return false;
        }
    }
}
