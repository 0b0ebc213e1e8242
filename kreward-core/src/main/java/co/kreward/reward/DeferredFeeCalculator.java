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

import co.kreward.core.BlockHeader;
import co.kreward.core.Coin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Computes a block's transaction fee and how much of it is burnt before rewards are paid.
 */
public class DeferredFeeCalculator {
    private static final Logger logger = LoggerFactory.getLogger("reward");

    private static final BigInteger TWO = BigInteger.valueOf(2);

    @FunctionalInterface
    private interface BurnFunction {
        Coin burnAmount(RewardConfig config, Coin rewardFee);
    }

    private final RewardSplitter splitter;
    private final Map<FeeBurnRule, BurnFunction> burns = new EnumMap<>(FeeBurnRule.class);

    public DeferredFeeCalculator(RewardSplitter splitter) {
        this.splitter = Objects.requireNonNull(splitter);
        burns.put(FeeBurnRule.HALF_BURN, (config, rewardFee) -> halfOf(rewardFee));
        burns.put(FeeBurnRule.PROPOSER_CAP_BURN, this::proposerCapBurn);
    }

    /**
     * @return gas used times the base fee, or times the fixed unit price before base fees exist.
     */
    public Coin getTotalFee(BlockHeader header, Coin unitPrice, RewardRegime regime) {
        BigInteger gasUsed = BigInteger.valueOf(header.getGasUsed());
        if (!regime.isBaseFeePricing()) {
            return unitPrice.multiply(gasUsed);
        }

        Coin baseFee = header.getBaseFee();
        if (baseFee == null) {
            throw new RewardException("Block " + header.getPrintableNumber() + " has no base fee");
        }
        return baseFee.multiply(gasUsed);
    }

    /**
     * Splits the block fee into total, reward and burnt amounts. When fees are not deferred they
     * were already paid to the proposer during transaction execution, so there is nothing to split.
     */
    public FeeSplit getDeferredFee(BlockHeader header, RewardConfig config, RewardRegime regime) {
        if (!config.isDeferredTxFee()) {
            return FeeSplit.NONE;
        }

        Coin totalFee = getTotalFee(header, config.getUnitPrice(), regime);
        Coin rewardFee = totalFee;
        Coin burntFee = Coin.ZERO;

        // each burn sees the fee left by the previous ones
        for (FeeBurnRule rule : regime.getBurnRules()) {
            Coin burnt = burns.get(rule).burnAmount(config, rewardFee);
            rewardFee = rewardFee.subtract(burnt);
            burntFee = burntFee.add(burnt);
        }

        logger.debug("Deferred fee of block {}: total={}, reward={}, burnt={}",
                header.getPrintableNumber(), totalFee, rewardFee, burntFee);
        return new FeeSplit(totalFee, rewardFee, burntFee);
    }

    /**
     * The fee split used when the whole reward goes to the proposer: half of the fee is burnt once
     * base fees are active, and neither deferral nor the proposer cap applies.
     */
    public FeeSplit getSimpleFee(BlockHeader header, Coin unitPrice, RewardRegime regime) {
        Coin totalFee = getTotalFee(header, unitPrice, regime);
        if (!regime.burnsHalfOfFees()) {
            return new FeeSplit(totalFee, totalFee, Coin.ZERO);
        }

        // the odd unit of an odd fee is paid to the proposer, not dropped, so that
        // reward + burnt == total and the block's pools add up to minted + fee - burnt
        Coin burntFee = halfOf(totalFee);
        return new FeeSplit(totalFee, totalFee.subtract(burntFee), burntFee);
    }

    private Coin proposerCapBurn(RewardConfig config, Coin rewardFee) {
        Coin proposerShare = splitter.getProposerMintedShare(config);
        logger.debug("Proposer cap burn: fee={}, proposer={}", rewardFee, proposerShare);
        return rewardFee.min(proposerShare);
    }

    private static Coin halfOf(Coin fee) {
        return fee.divide(TWO);
    }
}
