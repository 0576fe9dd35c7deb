// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.common.errors;

import com.digitalasset.amm.common.DomainError;

public final class InsufficientPoolSharesError extends DomainError {

    public InsufficientPoolSharesError(final String details) {
        super("INSUFFICIENT_POOL_SHARES", details, 422);
    }
}
