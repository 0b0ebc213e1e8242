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

import co.kreward.core.Address;
import co.kreward.core.Coin;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The reward paid for a block: the pool totals and the amount credited to each recipient.
 * Proposer + stakers + KGF + KIR always equals minted + fee - burnt, and so does the sum of the rewards.
 */
public final class RewardSpec {

    private final Coin minted;
    private final Coin fee;
    private final Coin burnt;
    private final Coin proposer;
    private final Coin stakers;
    private final Coin kgf;
    private final Coin kir;
    private final Map<Address, Coin> rewards;

    public RewardSpec(
            Coin minted,
            Coin fee,
            Coin burnt,
            Coin proposer,
            Coin stakers,
            Coin kgf,
            Coin kir,
            Map<Address, Coin> rewards) {
        this.minted = Objects.requireNonNull(minted);
        this.fee = Objects.requireNonNull(fee);
        this.burnt = Objects.requireNonNull(burnt);
        this.proposer = Objects.requireNonNull(proposer);
        this.stakers = Objects.requireNonNull(stakers);
        this.kgf = Objects.requireNonNull(kgf);
        this.kir = Objects.requireNonNull(kir);
        this.rewards = Collections.unmodifiableMap(new LinkedHashMap<>(rewards));
    }

    /**
     * @return the amount newly minted
     */
    public Coin getMinted() {
        return minted;
    }

    /**
     * @return the total transaction fee, before burning
     */
    public Coin getFee() {
        return fee;
    }

    public Coin getBurnt() {
        return burnt;
    }

    public Coin getProposer() {
        return proposer;
    }

    /**
     * @return the amount actually paid to stakers
     */
    public Coin getStakers() {
        return stakers;
    }

    /**
     * @return the amount paid to the growth fund
     */
    public Coin getKgf() {
        return kgf;
    }

    /**
     * @return the amount paid to the incentive reserve
     */
    public Coin getKir() {
        return kir;
    }

    public Map<Address, Coin> getRewards() {
        return rewards;
    }

    public Coin getTotalRewards() {
        return rewards.values().stream().reduce(Coin.ZERO, Coin::add);
    }

    /**
     * @return a copy of this spec where a fee paid outside of the deferred calculation is
     * accounted to the block fee and credited to the proposer
     */
    public RewardSpec withProposerFee(Address rewardbase, Coin blockFee) {
        // the fee is counted in fee as well as proposer, otherwise the pools would exceed minted + fee - burnt
        Map<Address, Coin> newRewards = new LinkedHashMap<>(rewards);
        newRewards.merge(rewardbase, blockFee, Coin::add);
        return new RewardSpec(minted, fee.add(blockFee), burnt, proposer.add(blockFee), stakers, kgf, kir, newRewards);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RewardSpec that = (RewardSpec) o;
        return minted.equals(that.minted)
                && fee.equals(that.fee)
                && burnt.equals(that.burnt)
                && proposer.equals(that.proposer)
                && stakers.equals(that.stakers)
                && kgf.equals(that.kgf)
                && kir.equals(that.kir)
                && rewards.equals(that.rewards);
    }

    @Override
    public int hashCode() {
        return Objects.hash(minted, fee, burnt, proposer, stakers, kgf, kir, rewards);
    }

    @Override
    public String toString() {
        return "RewardSpec{" +
                "minted=" + minted +
                ", fee=" + fee +
                ", burnt=" + burnt +
                ", proposer=" + proposer +
                ", stakers=" + stakers +
                ", kgf=" + kgf +
                ", kir=" + kir +
                ", rewards=" + rewards +
                '}';
    }
}
