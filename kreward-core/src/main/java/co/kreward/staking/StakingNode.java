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

package co.kreward.staking;

import co.kreward.core.Address;

import java.util.Objects;

/**
 * A council node's stake, in whole coins, and the address its staking rewards are paid to.
 */
public class StakingNode {
    private final Address nodeAddress;
    private final Address rewardAddress;
    private final long stakingAmount;

    public StakingNode(Address nodeAddress, Address rewardAddress, long stakingAmount) {
        if (stakingAmount < 0) {
            throw new IllegalArgumentException("Staking amount cannot be negative: " + stakingAmount);
        }
        this.nodeAddress = Objects.requireNonNull(nodeAddress);
        this.rewardAddress = Objects.requireNonNull(rewardAddress);
        this.stakingAmount = stakingAmount;
    }

    public Address getNodeAddress() {
        return nodeAddress;
    }

    public Address getRewardAddress() {
        return rewardAddress;
    }

    public long getStakingAmount() {
        return stakingAmount;
    }

    @Override
    public String toString() {
        return "StakingNode{" +
                "nodeAddress=" + nodeAddress +
                ", rewardAddress=" + rewardAddress +
                ", stakingAmount=" + stakingAmount +
                '}';
    }
}
