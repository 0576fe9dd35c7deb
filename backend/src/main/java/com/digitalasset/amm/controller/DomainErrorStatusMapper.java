// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.controller;

import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.common.errors.TransferFailedError;
import com.digitalasset.amm.common.errors.ValidationError;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Centralizes DomainError -> HttpStatus mapping so all controllers respond consistently.
 *
 * The exception reason is always {@code "CODE: message"}; the exception handler reads the code back from it.
 */
final class DomainErrorStatusMapper {

    private DomainErrorStatusMapper() {
    }

    static HttpStatus map(final DomainError error) {
        if (error instanceof ValidationError validationError) {
            return validationError.type() == ValidationError.Type.IDENTITY
                    ? HttpStatus.UNAUTHORIZED
                    : HttpStatus.BAD_REQUEST;
        }
        // balances could not be restored; this needs an operator, not a client retry
        if (error instanceof TransferFailedError transferFailed && !transferFailed.isCompensated()) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        HttpStatus derived = HttpStatus.resolve(error.httpStatus());
        return derived != null ? derived : HttpStatus.INTERNAL_SERVER_ERROR;
    }

    static ResponseStatusException toHttpException(final DomainError error) {
        return new ResponseStatusException(map(error), error.code() + ": " + error.message());
    }
}
