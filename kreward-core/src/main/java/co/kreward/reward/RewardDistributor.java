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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Credits computed block rewards at the end of block processing.
 */
public class RewardDistributor {
    private static final Logger logger = LoggerFactory.getLogger("reward");

    public void distributeBlockReward(BalanceAdder balanceAdder, Map<Address, Coin> rewards) {
        for (Map.Entry<Address, Coin> entry : rewards.entrySet()) {
            balanceAdder.addBalance(entry.getKey(), entry.getValue());
        }
        logger.trace("Distributed rewards to {} addresses", rewards.size());
    }
}
