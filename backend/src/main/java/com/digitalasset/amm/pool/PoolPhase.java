// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.pool;

public enum PoolPhase {
    /** No deposit has ever succeeded. */
    UNINITIALIZED,
    /** Seeded at least once; never goes back. */
    ACTIVE
}
