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

import static co.kreward.reward.RewardTestUtils.regime;
import static co.kreward.reward.RewardTestUtils.rewardConfig;

class RewardSplitterTest {

    private RewardSplitter splitter;

    @BeforeEach
    void setUp() {
        splitter = new RewardSplitter();
    }

    @Test
    void legacySplitGivesCnShareToProposer() {
        RewardConfig config = rewardConfig(1000, "50/25/25", null);

        RewardSplit split = splitter.split(config, regime(false, false), Coin.valueOf(1000), Coin.ZERO);

        Assertions.assertEquals(
                new RewardSplit(Coin.valueOf(500), Coin.ZERO, Coin.valueOf(250), Coin.valueOf(250), Coin.ZERO),
                split);
    }

    @Test
    void legacySplitSharesFeesWithFunds() {
        RewardConfig config = rewardConfig(1000, "34/54/12", null);

        RewardSplit split = splitter.split(config, regime(true, false), Coin.valueOf(1000), Coin.valueOf(1));

        Assertions.assertEquals(Coin.valueOf(340), split.getProposer());
        Assertions.assertEquals(Coin.ZERO, split.getStakers());
        Assertions.assertEquals(Coin.valueOf(540), split.getKgf());
        Assertions.assertEquals(Coin.valueOf(120), split.getKir());
        Assertions.assertEquals(Coin.valueOf(1), split.getRemaining());
    }

    @Test
    void koreSplitGivesWholeFeeToProposer() {
        RewardConfig config = rewardConfig(1000, "50/25/25", "80/20");

        RewardSplit split = splitter.split(config, regime(false, true), Coin.valueOf(1000), Coin.valueOf(100));

        Assertions.assertEquals(
                new RewardSplit(Coin.valueOf(500), Coin.valueOf(100), Coin.valueOf(250), Coin.valueOf(250), Coin.ZERO),
                split);
    }

    @Test
    void koreSplitTracksTruncationOfBothStages() {
        RewardConfig config = rewardConfig(1001, "34/54/12", "20/80");

        RewardSplit split = splitter.split(config, regime(true, true), Coin.valueOf(1001), Coin.valueOf(7));

        // cn = 340, proposer = 68 + 7, stakers = 272
        Assertions.assertEquals(Coin.valueOf(75), split.getProposer());
        Assertions.assertEquals(Coin.valueOf(272), split.getStakers());
        Assertions.assertEquals(Coin.valueOf(540), split.getKgf());
        Assertions.assertEquals(Coin.valueOf(120), split.getKir());
        Assertions.assertEquals(Coin.valueOf(1), split.getRemaining());
    }

    @Test
    void poolsAndRemainingAddUpToSource() {
        RewardConfig config = rewardConfig(999_999, "33/33/33", "33/66");

        for (RewardRegime regime : new RewardRegime[]{regime(false, false), regime(false, true)}) {
            RewardSplit split = splitter.split(config, regime, Coin.valueOf(999_999), Coin.valueOf(12_345));

            Coin sum = split.getProposer()
                    .add(split.getStakers())
                    .add(split.getKgf())
                    .add(split.getKir())
                    .add(split.getRemaining());
            Assertions.assertEquals(Coin.valueOf(999_999 + 12_345), sum);
            Assertions.assertFalse(split.getRemaining().compareTo(Coin.ZERO) < 0);
        }
    }

    @Test
    void proposerMintedShareIgnoresFees() {
        RewardConfig config = rewardConfig(1000, "50/25/25", "80/20");

        Assertions.assertEquals(Coin.valueOf(400), splitter.getProposerMintedShare(config));
    }

    @Test
    void koreSplitNeedsProposerStakersRatio() {
        RewardConfig config = rewardConfig(1000, "50/25/25", null);

        Assertions.assertThrows(IllegalStateException.class,
                () -> splitter.split(config, regime(false, true), Coin.valueOf(1000), Coin.ZERO));
    }

    @Test
    void zeroRatioTotalFails() {
        RewardConfig config = rewardConfig(1000, "0/0/0", null);

        Assertions.assertThrows(ArithmeticException.class,
                () -> splitter.split(config, regime(false, false), Coin.valueOf(1000), Coin.ZERO));
    }
}
