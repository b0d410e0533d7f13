// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.state;

import java.math.BigInteger;
import java.util.NavigableSet;
import java.util.Optional;

/**
 * Read-only view of a pool's tick registry and bitmap.
 */
public interface TickReader {

    Optional<TickInfo> getTick(int tick);

    boolean isInitialized(int tick);

    /**
     * Raw 256-bit bitmap word for the given word index; zero when no bit is set.
     */
    BigInteger getBitmapWord(int wordPos);

    NavigableSet<Integer> initializedTicks();
}
