// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.common.errors;

import com.digitalasset.amm.common.DomainError;

public final class ValidationError extends DomainError {

    public enum Type {
        REQUEST,
        IDENTITY
    }

    private final Type type;

    public ValidationError(final String details) {
        this(details, Type.REQUEST);
    }

    public ValidationError(final String details, final Type type) {
        super("VALIDATION_ERROR", details, type == Type.IDENTITY ? 401 : 400);
        this.type = type;
    }

    public Type type() {
        return type;
    }
}
