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

import co.kreward.config.upgrades.ActivationConfig;
import co.kreward.config.upgrades.ForkRule;
import co.kreward.core.Address;
import co.kreward.core.Coin;
import co.kreward.core.BlockHeader;

import java.util.EnumMap;
import java.util.Map;

final class RewardTestUtils {
    static final Address REWARDBASE = address(0xaa);
    static final Address KGF = address(0xb1);
    static final Address KIR = address(0xb2);

    private RewardTestUtils() {
    }

    static Address address(int lastByte) {
        byte[] bytes = new byte[Address.LENGTH_IN_BYTES];
        bytes[0] = 0x11;
        bytes[Address.LENGTH_IN_BYTES - 1] = (byte) lastByte;
        return new Address(bytes);
    }

    static ActivationConfig activations(boolean magma, boolean kore) {
        Map<ForkRule, Long> heights = new EnumMap<>(ForkRule.class);
        heights.put(ForkRule.MAGMA, magma ? 0L : -1L);
        heights.put(ForkRule.KORE, kore ? 0L : -1L);
        return new ActivationConfig(heights);
    }

    static RewardRegime regime(boolean magma, boolean kore) {
        return RewardRegime.forBlock(activations(magma, kore).forBlock(1));
    }

    static RewardConfig rewardConfig(long minted, String ratio, String kip82Ratio) {
        return rewardConfig(minted, ratio, kip82Ratio, 0, true, 1);
    }

    static RewardConfig rewardConfig(
            long minted,
            String ratio,
            String kip82Ratio,
            long minimumStake,
            boolean deferredTxFee,
            long unitPrice) {
        return new RewardConfig(
                Coin.valueOf(minted),
                RewardRatio.parse(ratio, RewardRatio.RATIO_PARTS),
                kip82Ratio == null ? null : RewardRatio.parse(kip82Ratio, RewardRatio.KIP82_RATIO_PARTS),
                minimumStake,
                deferredTxFee,
                Coin.valueOf(unitPrice));
    }

    static BlockHeader header(long gasUsed, Long baseFee) {
        return new BlockHeader(1, gasUsed, baseFee == null ? null : Coin.valueOf(baseFee), REWARDBASE);
    }
}
