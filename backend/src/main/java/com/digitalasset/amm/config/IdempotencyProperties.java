// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.config;

import com.digitalasset.amm.constants.PoolConstants;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "amm.idempotency")
public class IdempotencyProperties {

    /**
     * How long a successful response is replayed for the same key.
     */
    private long ttlSeconds = PoolConstants.DEFAULT_IDEMPOTENCY_TTL_SECONDS;

    /**
     * Delay between sweeps of expired keys.
     */
    private long cleanupIntervalMs = 60_000;

    public long getTtlSeconds() {
        return ttlSeconds;
    }

    public void setTtlSeconds(long ttlSeconds) {
        this.ttlSeconds = ttlSeconds;
    }

    public long getCleanupIntervalMs() {
        return cleanupIntervalMs;
    }

    public void setCleanupIntervalMs(long cleanupIntervalMs) {
        this.cleanupIntervalMs = cleanupIntervalMs;
    }
}
