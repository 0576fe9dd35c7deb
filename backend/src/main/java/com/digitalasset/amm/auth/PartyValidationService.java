// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.auth;

import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.common.Result;
import com.digitalasset.amm.common.errors.ValidationError;
import com.digitalasset.amm.config.PoolProperties;
import java.util.regex.Pattern;
import org.springframework.stereotype.Service;

/**
 * Resolves the calling party from the {@code X-Party-Id} header.
 */
@Service
public class PartyValidationService {

    private static final Pattern PARTY_PATTERN = Pattern.compile("^[A-Za-z0-9:_\\-.]+$");
    private static final int MAX_PARTY_LENGTH = 255;

    private final String poolParty;

    public PartyValidationService(final PoolProperties properties) {
        this.poolParty = properties.getPoolParty();
    }

    public Result<String, DomainError> validateFormat(final String partyId) {
        if (partyId == null) {
            return Result.err(new ValidationError("party is required", ValidationError.Type.IDENTITY));
        }
        String trimmed = partyId.trim();
        if (trimmed.isEmpty()) {
            return Result.err(new ValidationError("party is required", ValidationError.Type.IDENTITY));
        }
        if (trimmed.length() > MAX_PARTY_LENGTH || !PARTY_PATTERN.matcher(trimmed).matches()) {
            return Result.err(new ValidationError("Invalid party format", ValidationError.Type.REQUEST));
        }
        return Result.ok(trimmed);
    }

    /**
     * Like {@link #validateFormat} but also refuses the pool's own account as a caller.
     */
    public Result<String, DomainError> resolveCaller(final String partyId) {
        return validateFormat(partyId).flatMap(party -> party.equals(poolParty)
                ? Result.err(new ValidationError("The pool account cannot act as a caller", ValidationError.Type.REQUEST))
                : Result.ok(party));
    }
}
