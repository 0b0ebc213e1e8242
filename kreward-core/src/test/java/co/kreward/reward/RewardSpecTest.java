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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static co.kreward.reward.RewardTestUtils.KGF;
import static co.kreward.reward.RewardTestUtils.REWARDBASE;

class RewardSpecTest {

    @Test
    void proposerFeeIsCountedInFeeAndPaidToRewardbase() {
        Map<Address, Coin> rewards = new LinkedHashMap<>();
        rewards.put(REWARDBASE, Coin.valueOf(500));
        rewards.put(KGF, Coin.valueOf(500));
        RewardSpec spec = new RewardSpec(Coin.valueOf(1000), Coin.ZERO, Coin.ZERO,
                Coin.valueOf(500), Coin.ZERO, Coin.valueOf(500), Coin.ZERO, rewards);

        RewardSpec compensated = spec.withProposerFee(REWARDBASE, Coin.valueOf(100));

        Assertions.assertEquals(Coin.valueOf(100), compensated.getFee());
        Assertions.assertEquals(Coin.valueOf(600), compensated.getProposer());
        Assertions.assertEquals(Coin.valueOf(600), compensated.getRewards().get(REWARDBASE));
        Assertions.assertEquals(Coin.valueOf(500), compensated.getRewards().get(KGF));

        Coin expected = compensated.getMinted().add(compensated.getFee()).subtract(compensated.getBurnt());
        Coin pools = compensated.getProposer().add(compensated.getStakers())
                .add(compensated.getKgf()).add(compensated.getKir());
        Assertions.assertEquals(expected, pools);
        Assertions.assertEquals(expected, compensated.getTotalRewards());
    }

    @Test
    void compensationLeavesSourceUnchanged() {
        RewardSpec spec = new RewardSpec(Coin.valueOf(1000), Coin.ZERO, Coin.ZERO,
                Coin.valueOf(1000), Coin.ZERO, Coin.ZERO, Coin.ZERO,
                Collections.singletonMap(REWARDBASE, Coin.valueOf(1000)));

        spec.withProposerFee(REWARDBASE, Coin.valueOf(100));

        Assertions.assertEquals(Coin.ZERO, spec.getFee());
        Assertions.assertEquals(Coin.valueOf(1000), spec.getRewards().get(REWARDBASE));
    }
}
