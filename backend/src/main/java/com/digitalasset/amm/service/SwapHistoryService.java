// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.service;

import com.digitalasset.amm.config.PoolProperties;
import com.digitalasset.amm.event.PoolEventListener;
import com.digitalasset.amm.event.SwapRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Keeps the most recent swap records in memory, newest first.
 */
@Service
public class SwapHistoryService implements PoolEventListener {

    private static final Logger LOG = LoggerFactory.getLogger(SwapHistoryService.class);

    private final int maxRecords;
    private final Deque<SwapRecord> history = new ArrayDeque<>();

    public SwapHistoryService(PoolProperties properties) {
        this.maxRecords = Math.max(1, properties.getSwapHistorySize());
    }

    @Override
    public synchronized void onSwap(SwapRecord record) {
        history.addFirst(record);
        while (history.size() > maxRecords) {
            history.removeLast();
        }
        LOG.info("SWAP party={} in={} {} out={} {} reserves={}/{} at {}",
                record.party(), record.amountIn(), record.assetIn(), record.amountOut(), record.assetOut(),
                record.newReserveA(), record.newReserveB(), record.timestamp());
    }

    public synchronized List<SwapRecord> recent(int limit) {
        List<SwapRecord> out = new ArrayList<>(Math.min(limit, history.size()));
        Iterator<SwapRecord> it = history.iterator();
        while (it.hasNext() && out.size() < limit) {
            out.add(it.next());
        }
        return out;
    }

    public synchronized int size() {
        return history.size();
    }
}
