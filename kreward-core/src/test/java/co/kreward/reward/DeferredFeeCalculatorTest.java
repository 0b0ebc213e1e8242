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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static co.kreward.reward.RewardTestUtils.header;
import static co.kreward.reward.RewardTestUtils.regime;
import static co.kreward.reward.RewardTestUtils.rewardConfig;

class DeferredFeeCalculatorTest {

    private DeferredFeeCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new DeferredFeeCalculator(new RewardSplitter());
    }

    @Test
    void totalFeeUsesUnitPriceBeforeMagma() {
        Coin totalFee = calculator.getTotalFee(header(1000, 7L), Coin.valueOf(25), regime(false, false));

        Assertions.assertEquals(Coin.valueOf(25000), totalFee);
    }

    @Test
    void totalFeeUsesBaseFeeAfterMagma() {
        Coin totalFee = calculator.getTotalFee(header(1000, 7L), Coin.valueOf(25), regime(true, false));

        Assertions.assertEquals(Coin.valueOf(7000), totalFee);
    }

    @Test
    void missingBaseFeeAfterMagmaFails() {
        Assertions.assertThrows(RewardException.class,
                () -> calculator.getTotalFee(header(1000, null), Coin.valueOf(25), regime(true, false)));
    }

    @Test
    void nothingToSplitWhenFeesAreNotDeferred() {
        RewardConfig config = rewardConfig(1000, "50/25/25", "80/20", 0, false, 25);

        FeeSplit fee = calculator.getDeferredFee(header(1000, 7L), config, regime(true, true));

        Assertions.assertEquals(FeeSplit.NONE, fee);
    }

    @Test
    void wholeFeeIsRewardedBeforeForks() {
        RewardConfig config = rewardConfig(1000, "50/25/25", null, 0, true, 25);

        FeeSplit fee = calculator.getDeferredFee(header(1000, null), config, regime(false, false));

        Assertions.assertEquals(new FeeSplit(Coin.valueOf(25000), Coin.valueOf(25000), Coin.ZERO), fee);
    }

    @Test
    void magmaBurnsTruncatedHalf() {
        RewardConfig config = rewardConfig(1000, "50/25/25", null);

        FeeSplit fee = calculator.getDeferredFee(header(1001, 3L), config, regime(true, false));

        Assertions.assertEquals(Coin.valueOf(3003), fee.getTotal());
        Assertions.assertEquals(Coin.valueOf(1501), fee.getBurnt());
        Assertions.assertEquals(Coin.valueOf(1502), fee.getReward());
    }

    @Test
    void koreBurnsWholeFeeBelowProposerShare() {
        // proposer share of minting: 1000 * 50% * 80% = 400
        RewardConfig config = rewardConfig(1000, "50/25/25", "80/20", 0, true, 25);

        FeeSplit fee = calculator.getDeferredFee(header(10, null), config, regime(false, true));

        Assertions.assertEquals(new FeeSplit(Coin.valueOf(250), Coin.ZERO, Coin.valueOf(250)), fee);
    }

    @Test
    void koreBurnsUpToProposerShare() {
        RewardConfig config = rewardConfig(1000, "50/25/25", "80/20", 0, true, 25);

        FeeSplit fee = calculator.getDeferredFee(header(40, null), config, regime(false, true));

        Assertions.assertEquals(new FeeSplit(Coin.valueOf(1000), Coin.valueOf(600), Coin.valueOf(400)), fee);
    }

    @Test
    void proposerCapAppliesToFeeLeftAfterHalfBurn() {
        RewardConfig config = rewardConfig(1000, "50/25/25", "80/20");

        FeeSplit fee = calculator.getDeferredFee(header(100, 10L), config, regime(true, true));

        // 1000 - 500 (half) - 400 (cap)
        Assertions.assertEquals(new FeeSplit(Coin.valueOf(1000), Coin.valueOf(100), Coin.valueOf(900)), fee);
    }

    @Test
    void proposerCapCannotBurnMoreThanWhatIsLeft() {
        RewardConfig config = rewardConfig(1000, "50/25/25", "80/20");

        FeeSplit fee = calculator.getDeferredFee(header(60, 10L), config, regime(true, true));

        // half burn leaves 300, under the 400 cap
        Assertions.assertEquals(new FeeSplit(Coin.valueOf(600), Coin.ZERO, Coin.valueOf(600)), fee);
    }

    @Test
    void simpleFeeRewardsEverythingBeforeMagma() {
        FeeSplit fee = calculator.getSimpleFee(header(10, null), Coin.valueOf(25), regime(false, true));

        Assertions.assertEquals(new FeeSplit(Coin.valueOf(250), Coin.valueOf(250), Coin.ZERO), fee);
    }

    @Test
    void simpleFeePaysOddUnitToProposer() {
        FeeSplit fee = calculator.getSimpleFee(header(3, 1L), Coin.valueOf(25), regime(true, false));

        Assertions.assertEquals(Coin.valueOf(1), fee.getBurnt());
        Assertions.assertEquals(Coin.valueOf(2), fee.getReward());
        Assertions.assertEquals(fee.getTotal(), fee.getReward().add(fee.getBurnt()));
    }

    @Test
    void simpleFeeBurnsHalfWithoutProposerCap() {
        FeeSplit fee = calculator.getSimpleFee(header(1001, 1L), Coin.valueOf(25), regime(true, true));

        Assertions.assertEquals(new FeeSplit(Coin.valueOf(1001), Coin.valueOf(501), Coin.valueOf(500)), fee);
    }
}
