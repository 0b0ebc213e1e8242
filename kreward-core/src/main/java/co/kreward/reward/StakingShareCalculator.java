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
import co.kreward.staking.StakingInfo;
import co.kreward.staking.StakingNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Divides the stakers pool among council nodes in proportion to the stake they hold above the
 * minimum stake. Nodes at or below the minimum get nothing.
 */
public class StakingShareCalculator {
    private static final Logger logger = LoggerFactory.getLogger("reward");

    public StakingShares calculateShares(RewardConfig config, @Nullable StakingInfo stakingInfo, Coin stakersReward) {
        if (stakingInfo == null) {
            return StakingShares.none(stakersReward);
        }

        long minimumStake = config.getMinimumStake();
        List<StakingNode> nodes = stakingInfo.getConsolidatedNodes();

        BigInteger totalStakes = BigInteger.ZERO;
        for (StakingNode node : nodes) {
            if (node.getStakingAmount() > minimumStake) {
                totalStakes = totalStakes.add(effectiveStake(node, minimumStake));
            }
        }

        Map<Address, Coin> shares = new LinkedHashMap<>();
        Coin remaining = stakersReward;
        for (StakingNode node : nodes) {
            if (node.getStakingAmount() <= minimumStake) {
                continue;
            }

            // stakes are in whole coins but the unit cancels out
            Coin share = stakersReward.multiply(effectiveStake(node, minimumStake)).divide(totalStakes);
            remaining = remaining.subtract(share);
            if (share.isPositive()) {
                shares.merge(node.getRewardAddress(), share, Coin::add);
            }
        }

        logger.debug("Staking shares: minimumStake={}, stakersReward={}, remaining={}, shares={}",
                minimumStake, stakersReward, remaining, shares);
        return new StakingShares(shares, remaining);
    }

    private static BigInteger effectiveStake(StakingNode node, long minimumStake) {
        return BigInteger.valueOf(node.getStakingAmount()).subtract(BigInteger.valueOf(minimumStake));
    }
}
