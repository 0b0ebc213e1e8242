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

package co.kreward.governance;

import co.kreward.core.Coin;
import com.typesafe.config.Config;

import java.util.Objects;

/**
 * Governance-controlled reward parameters in effect at a block.
 * Ratio strings are kept verbatim; they are parsed when a reward config is built.
 */
public class RewardParameters {
    private static final String PROPERTY_MINTING_AMOUNT = "mintingAmount";
    private static final String PROPERTY_RATIO = "ratio";
    private static final String PROPERTY_KIP82_RATIO = "kip82Ratio";
    private static final String PROPERTY_MINIMUM_STAKE = "minimumStake";
    private static final String PROPERTY_DEFERRED_TX_FEE = "deferredTxFee";

    private final Coin mintingAmount;
    // "cn/treasuryA/treasuryB"
    private final String ratio;
    // "proposer/stakers", applied to the cn share
    private final String kip82Ratio;
    // compared against staking amounts, which are expressed in whole coins
    private final long minimumStake;
    private final boolean deferredTxFee;
    private final Coin unitPrice;

    public RewardParameters(
            Coin mintingAmount,
            String ratio,
            String kip82Ratio,
            long minimumStake,
            boolean deferredTxFee,
            Coin unitPrice) {
        this.mintingAmount = Objects.requireNonNull(mintingAmount);
        this.ratio = Objects.requireNonNull(ratio);
        this.kip82Ratio = Objects.requireNonNull(kip82Ratio);
        this.minimumStake = minimumStake;
        this.deferredTxFee = deferredTxFee;
        this.unitPrice = Objects.requireNonNull(unitPrice);
    }

    public Coin getMintingAmount() {
        return mintingAmount;
    }

    public String getRatio() {
        return ratio;
    }

    public String getKip82Ratio() {
        return kip82Ratio;
    }

    public long getMinimumStake() {
        return minimumStake;
    }

    public boolean isDeferredTxFee() {
        return deferredTxFee;
    }

    public Coin getUnitPrice() {
        return unitPrice;
    }

    public static RewardParameters read(Config rewardConfig, String unitPrice) {
        return new RewardParameters(
                Coin.valueOf(rewardConfig.getString(PROPERTY_MINTING_AMOUNT)),
                rewardConfig.getString(PROPERTY_RATIO),
                rewardConfig.getString(PROPERTY_KIP82_RATIO),
                rewardConfig.getLong(PROPERTY_MINIMUM_STAKE),
                rewardConfig.getBoolean(PROPERTY_DEFERRED_TX_FEE),
                Coin.valueOf(unitPrice));
    }

    @Override
    public String toString() {
        return "RewardParameters{" +
                "mintingAmount=" + mintingAmount +
                ", ratio='" + ratio + '\'' +
                ", kip82Ratio='" + kip82Ratio + '\'' +
                ", minimumStake=" + minimumStake +
                ", deferredTxFee=" + deferredTxFee +
                ", unitPrice=" + unitPrice +
                '}';
    }
}
