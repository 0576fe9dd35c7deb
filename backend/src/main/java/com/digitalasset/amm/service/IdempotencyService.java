// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.service;

import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.common.Result;
import com.digitalasset.amm.common.errors.ValidationError;
import com.digitalasset.amm.config.IdempotencyProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Idempotency service to prevent duplicate deposits, swaps and withdrawals.
 *
 * Keys are scoped by party and operation, so two parties can use the same key.
 * Only successful responses are cached; a rejected operation can be retried with the same key.
 */
@Service
public class IdempotencyService {

    private static final Logger logger = LoggerFactory.getLogger(IdempotencyService.class);
    private static final Pattern KEY_PATTERN = Pattern.compile("^[a-zA-Z0-9\\-_]+$");
    private static final int MAX_KEY_LENGTH = 255;

    /**
     * Cache entry for idempotency tracking.
     */
    private record IdempotencyEntry(Object response, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return now.isAfter(expiresAt);
        }
    }

    // scope "party|operation|key" -> entry
    private final Map<String, IdempotencyEntry> cache = new ConcurrentHashMap<>();
    private final Clock clock;
    private final long ttlSeconds;

    public IdempotencyService(IdempotencyProperties properties, Clock clock) {
        this.clock = clock;
        this.ttlSeconds = properties.getTtlSeconds();
    }

    /**
     * Validate key format. A null key means the caller opted out.
     */
    public Result<Optional<String>, DomainError> validateKey(String idempotencyKey) {
        if (idempotencyKey == null) {
            return Result.ok(Optional.empty());
        }
        if (idempotencyKey.trim().isEmpty()) {
            return Result.err(new ValidationError("Idempotency key cannot be empty"));
        }
        if (idempotencyKey.length() > MAX_KEY_LENGTH) {
            return Result.err(new ValidationError("Idempotency key too long (max " + MAX_KEY_LENGTH + " characters)"));
        }
        if (!KEY_PATTERN.matcher(idempotencyKey).matches()) {
            return Result.err(new ValidationError(
                    "Idempotency key contains invalid characters (only alphanumeric, -, _ allowed)"));
        }
        return Result.ok(Optional.of(idempotencyKey));
    }

    /**
     * @return the cached response for this key, if a live one exists
     */
    public <T> Optional<T> lookup(String party, String operation, String idempotencyKey, Class<T> type) {
        if (idempotencyKey == null) {
            return Optional.empty();
        }
        String scope = scope(party, operation, idempotencyKey);
        IdempotencyEntry entry = cache.get(scope);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            cache.remove(scope);
            logger.debug("Idempotency key expired and removed: {}", scope);
            return Optional.empty();
        }
        if (!type.isInstance(entry.response())) {
            return Optional.empty();
        }
        logger.info("Idempotent request detected - returning cached response for key: {}", scope);
        return Optional.of(type.cast(entry.response()));
    }

    /**
     * Register a successful operation under its key.
     */
    public void registerSuccess(String party, String operation, String idempotencyKey, Object response) {
        if (idempotencyKey == null) {
            return;
        }
        String scope = scope(party, operation, idempotencyKey);
        cache.put(scope, new IdempotencyEntry(response, clock.instant().plusSeconds(ttlSeconds)));
        logger.info("Registered idempotency key: {}", scope);
    }

    /**
     * Run {@code action} once per key: a live cached response is returned instead of re-running it.
     * An action that throws registers nothing, so the caller may retry with the same key.
     */
    public <T> T execute(String party, String operation, String idempotencyKey, Class<T> type, Supplier<T> action) {
        Optional<T> cached = lookup(party, operation, idempotencyKey, type);
        if (cached.isPresent()) {
            return cached.get();
        }
        T response = action.get();
        registerSuccess(party, operation, idempotencyKey, response);
        return response;
    }

    /**
     * Clear expired entries from cache (cleanup task).
     */
    @Scheduled(fixedDelayString = "${amm.idempotency.cleanup-interval-ms:60000}")
    public void cleanupExpired() {
        Instant now = clock.instant();
        int before = cache.size();
        cache.entrySet().removeIf(entry -> entry.getValue().isExpired(now));
        int removed = before - cache.size();
        if (removed > 0) {
            logger.info("Cleaned up {} expired idempotency entries", removed);
        }
    }

    public int getCacheSize() {
        return cache.size();
    }

    private static String scope(String party, String operation, String key) {
        return party + "|" + operation + "|" + key;
    }
}
