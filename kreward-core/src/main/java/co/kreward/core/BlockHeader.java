/*
 * This file is part of Kreward
 * Copyright (C) 2023 Kreward contributors.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with this program. If not, see <http://www.gnu.org/licenses/>.
 */

package co.kreward.core;

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * The subset of a block header consumed by reward calculation.
 * The base fee is only present once the base-fee-aware fork is active.
 */
public class BlockHeader {

    private final long number;
    private final long gasUsed;
    private final Coin baseFee;
    private final Address rewardbase;

    public BlockHeader(long number, long gasUsed, @Nullable Coin baseFee, Address rewardbase) {
        if (number < 0) {
            throw new IllegalArgumentException("Block number cannot be negative: " + number);
        }
        if (gasUsed < 0) {
            throw new IllegalArgumentException("Gas used cannot be negative: " + gasUsed);
        }
        this.number = number;
        this.gasUsed = gasUsed;
        this.baseFee = baseFee;
        this.rewardbase = Objects.requireNonNull(rewardbase);
    }

    public long getNumber() {
        return number;
    }

    public long getGasUsed() {
        return gasUsed;
    }

    @Nullable
    public Coin getBaseFee() {
        return baseFee;
    }

    /**
     * @return the address credited with the proposer's reward.
     */
    public Address getRewardbase() {
        return rewardbase;
    }

    public String getPrintableNumber() {
        return "#" + number;
    }

    @Override
    public String toString() {
        return "BlockHeader{" +
                "number=" + number +
                ", gasUsed=" + gasUsed +
                ", baseFee=" + baseFee +
                ", rewardbase=" + rewardbase +
                '}';
    }
}
