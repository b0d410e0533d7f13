// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.fees;

import com.digitalasset.clmm.common.errors.ValidationError;
import com.digitalasset.clmm.model.Address;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Protocol fees withheld from swaps, per currency, awaiting collection.
 */
public class ProtocolFeesAccrued {

    private final Map<Address, BigInteger> accrued = new ConcurrentHashMap<>();

    public void accrue(Address currency, BigInteger amount) {
        if (amount.signum() <= 0) {
            return;
        }
        accrued.merge(currency, amount, BigInteger::add);
    }

    public BigInteger get(Address currency) {
        return accrued.getOrDefault(currency, BigInteger.ZERO);
    }

    /**
     * Withdraws accrued fees; an amount of zero withdraws everything.
     *
     * @return the amount withdrawn
     */
    public BigInteger collect(Address currency, BigInteger amount) {
        BigInteger[] collected = new BigInteger[1];
        accrued.compute(currency, (c, current) -> {
            BigInteger available = current == null ? BigInteger.ZERO : current;
            BigInteger take = amount.signum() == 0 ? available : amount;
            if (take.signum() < 0 || take.compareTo(available) > 0) {
                throw ValidationError.raise(ValidationError.Kind.REQUEST,
                    "cannot collect " + take + " of " + c + ", accrued " + available);
            }
            collected[0] = take;
            BigInteger remaining = available.subtract(take);
            return remaining.signum() == 0 ? null : remaining;
        });
        return collected[0];
    }
}
