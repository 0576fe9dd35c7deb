// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.transfer;

import java.math.BigInteger;

/**
 * Moves units of one asset. The pool only needs to know whether a move happened.
 */
public interface TokenTransfer {

    /**
     * Move {@code amount} from {@code from} to {@code to}.
     *
     * @return false if the move did not happen
     */
    boolean transferFrom(String from, String to, BigInteger amount);

    /**
     * Move {@code amount} out of the pool's own account to {@code to}.
     *
     * @return false if the move did not happen
     */
    boolean transfer(String to, BigInteger amount);
}
