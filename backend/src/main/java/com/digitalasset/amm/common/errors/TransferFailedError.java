// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.common.errors;

import com.digitalasset.amm.common.DomainError;

public final class TransferFailedError extends DomainError {

    private final boolean compensated;

    public TransferFailedError(final String details) {
        this(details, true);
    }

    /**
     * @param compensated false when an already-completed transfer of the same operation could not be unwound
     */
    public TransferFailedError(final String details, final boolean compensated) {
        super("TRANSFER_FAILED", details, 422);
        this.compensated = compensated;
    }

    public boolean isCompensated() {
        return compensated;
    }
}
