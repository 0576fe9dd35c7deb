// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.common.errors;

import com.digitalasset.amm.common.DomainError;

public final class OverflowError extends DomainError {

    public OverflowError(final String details) {
        super("ARITHMETIC_OVERFLOW", details, 422);
    }
}
