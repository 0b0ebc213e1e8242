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
import co.kreward.core.BlockHeader;
import co.kreward.core.Coin;
import co.kreward.staking.StakingInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Merges the pools and the staking shares into the final {@link RewardSpec} of a block.
 *
 * <p>The order of the steps is part of consensus:
 * <ol>
 *     <li>the split remainder goes to KGF;</li>
 *     <li>the staking remainder goes to the proposer;</li>
 *     <li>a fund without an address gives its whole pool to the proposer.</li>
 * </ol>
 */
public class RewardAggregator {
    private static final Logger logger = LoggerFactory.getLogger("reward");

    public RewardSpec aggregate(
            BlockHeader header,
            Coin minted,
            FeeSplit fee,
            RewardSplit split,
            StakingShares shares,
            @Nullable StakingInfo stakingInfo) {
        Coin kgf = split.getKgf().add(split.getRemaining());
        Coin kir = split.getKir();
        Coin proposer = split.getProposer().add(shares.getRemaining());
        Coin stakers = split.getStakers().subtract(shares.getRemaining());

        Address kgfAddress = stakingInfo == null ? Address.nullAddress() : stakingInfo.getKgfAddress();
        Address kirAddress = stakingInfo == null ? Address.nullAddress() : stakingInfo.getKirAddress();

        if (Address.isEmpty(kgfAddress)) {
            logger.debug("KGF empty, proposer gets its portion: kgf={}", kgf);
            proposer = proposer.add(kgf);
            kgf = Coin.ZERO;
        }
        if (Address.isEmpty(kirAddress)) {
            logger.debug("KIR empty, proposer gets its portion: kir={}", kir);
            proposer = proposer.add(kir);
            kir = Coin.ZERO;
        }

        Map<Address, Coin> rewards = new LinkedHashMap<>();
        increment(rewards, header.getRewardbase(), proposer);
        if (!Address.isEmpty(kgfAddress)) {
            increment(rewards, kgfAddress, kgf);
        }
        if (!Address.isEmpty(kirAddress)) {
            increment(rewards, kirAddress, kir);
        }
        shares.getShares().forEach((rewardAddress, share) -> increment(rewards, rewardAddress, share));

        RewardSpec spec = new RewardSpec(minted, fee.getTotal(), fee.getBurnt(), proposer, stakers, kgf, kir, rewards);
        logger.debug("Reward of block {}: {}", header.getPrintableNumber(), spec);
        return spec;
    }

    private static void increment(Map<Address, Coin> rewards, Address address, Coin amount) {
        rewards.merge(address, amount, Coin::add);
    }
}
