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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Staking snapshot taken at a block: the council nodes with their stakes, plus the
 * addresses of the two treasury funds (KGF, the growth fund, and KIR, the incentive reserve).
 * Either treasury address may be unset, in which case it is the null address.
 */
public class StakingInfo {
    private final long blockNumber;
    private final List<StakingNode> nodes;
    private final Address kgfAddress;
    private final Address kirAddress;

    public StakingInfo(long blockNumber, List<StakingNode> nodes, Address kgfAddress, Address kirAddress) {
        this.blockNumber = blockNumber;
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.kgfAddress = kgfAddress == null ? Address.nullAddress() : kgfAddress;
        this.kirAddress = kirAddress == null ? Address.nullAddress() : kirAddress;
    }

    public long getBlockNumber() {
        return blockNumber;
    }

    public List<StakingNode> getNodes() {
        return nodes;
    }

    public Address getKgfAddress() {
        return kgfAddress;
    }

    public Address getKirAddress() {
        return kirAddress;
    }

    /**
     * Merges the nodes that share a reward address into a single entry whose stake is the sum
     * of theirs. Entries keep the order in which each reward address first appears.
     */
    public List<StakingNode> getConsolidatedNodes() {
        Map<Address, StakingNode> consolidated = new LinkedHashMap<>();
        for (StakingNode node : nodes) {
            consolidated.merge(node.getRewardAddress(), node, (first, other) -> new StakingNode(
                    first.getNodeAddress(),
                    first.getRewardAddress(),
                    Math.addExact(first.getStakingAmount(), other.getStakingAmount())));
        }

        return new ArrayList<>(consolidated.values());
    }

    @Override
    public String toString() {
        return "StakingInfo{" +
                "blockNumber=" + blockNumber +
                ", nodes=" + nodes +
                ", kgfAddress=" + kgfAddress +
                ", kirAddress=" + kirAddress +
                '}';
    }
}
