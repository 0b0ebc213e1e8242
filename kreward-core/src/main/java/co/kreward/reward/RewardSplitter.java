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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Splits minted coins and the rewardable fee into the proposer, stakers, KGF and KIR pools.
 * The sum of the pools plus the remaining amount always equals minted + fee.
 */
public class RewardSplitter {
    private static final Logger logger = LoggerFactory.getLogger("reward");

    private static final int CN = 0;
    private static final int KGF = 1;
    private static final int KIR = 2;
    private static final int PROPOSER = 0;
    private static final int STAKERS = 1;

    @FunctionalInterface
    private interface SplitFunction {
        RewardSplit split(RewardConfig config, Coin minted, Coin fee);
    }

    private final Map<SplitAlgorithm, SplitFunction> algorithms = new EnumMap<>(SplitAlgorithm.class);

    public RewardSplitter() {
        algorithms.put(SplitAlgorithm.LEGACY, this::splitLegacy);
        algorithms.put(SplitAlgorithm.KORE, this::splitKore);
    }

    public RewardSplit split(RewardConfig config, RewardRegime regime, Coin minted, Coin fee) {
        return algorithms.get(regime.getSplitAlgorithm()).split(config, minted, fee);
    }

    /**
     * @return the proposer's part of the minting amount alone, ignoring fees.
     */
    public Coin getProposerMintedShare(RewardConfig config) {
        Coin cn = config.getRatio().split(config.getMintingAmount())[CN];
        return config.getKip82Ratio().split(cn)[PROPOSER];
    }

    RewardSplit splitLegacy(RewardConfig config, Coin minted, Coin fee) {
        Coin source = minted.add(fee);
        Coin[] parts = config.getRatio().split(source);
        Coin cn = parts[CN];
        Coin kgf = parts[KGF];
        Coin kir = parts[KIR];

        Coin remaining = source
                .subtract(kgf)
                .subtract(kir)
                .subtract(cn);

        logger.debug("Legacy split: cn={}, kgf={}, kir={}, remaining={}", cn, kgf, kir, remaining);
        return new RewardSplit(cn, Coin.ZERO, kgf, kir, remaining);
    }

    RewardSplit splitKore(RewardConfig config, Coin minted, Coin fee) {
        Coin[] parts = config.getRatio().split(minted);
        Coin kgf = parts[KGF];
        Coin kir = parts[KIR];
        Coin[] cnParts = config.getKip82Ratio().split(parts[CN]);
        // fees are never shared with stakers or funds
        Coin proposer = cnParts[PROPOSER].add(fee);
        Coin stakers = cnParts[STAKERS];

        Coin remaining = minted.add(fee)
                .subtract(kgf)
                .subtract(kir)
                .subtract(proposer)
                .subtract(stakers);

        logger.debug("Kore split: proposer={}, stakers={}, kgf={}, kir={}, remaining={}",
                proposer, stakers, kgf, kir, remaining);
        return new RewardSplit(proposer, stakers, kgf, kir, remaining);
    }
}
