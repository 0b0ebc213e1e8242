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

package co.kreward.reward;

import co.kreward.core.Coin;

import java.util.Objects;

/**
 * Reward pools produced by splitting the minted amount and the rewardable fee.
 * {@code remaining} is what the truncating divisions left unassigned.
 */
public final class RewardSplit {

    private final Coin proposer;
    private final Coin stakers;
    private final Coin kgf;
    private final Coin kir;
    private final Coin remaining;

    public RewardSplit(Coin proposer, Coin stakers, Coin kgf, Coin kir, Coin remaining) {
        this.proposer = Objects.requireNonNull(proposer);
        this.stakers = Objects.requireNonNull(stakers);
        this.kgf = Objects.requireNonNull(kgf);
        this.kir = Objects.requireNonNull(kir);
        this.remaining = Objects.requireNonNull(remaining);
    }

    public Coin getProposer() {
        return proposer;
    }

    public Coin getStakers() {
        return stakers;
    }

    public Coin getKgf() {
        return kgf;
    }

    public Coin getKir() {
        return kir;
    }

    public Coin getRemaining() {
        return remaining;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RewardSplit that = (RewardSplit) o;
        return proposer.equals(that.proposer)
                && stakers.equals(that.stakers)
                && kgf.equals(that.kgf)
                && kir.equals(that.kir)
                && remaining.equals(that.remaining);
    }

    @Override
    public int hashCode() {
        return Objects.hash(proposer, stakers, kgf, kir, remaining);
    }

    @Override
    public String toString() {
        return "RewardSplit{" +
                "proposer=" + proposer +
                ", stakers=" + stakers +
                ", kgf=" + kgf +
                ", kir=" + kir +
                ", remaining=" + remaining +
                '}';
    }
}
