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
import co.kreward.governance.RewardParameters;

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Reward parameters of a block with their ratios parsed.
 * The proposer/stakers ratio is only parsed, and only available, when the regime splits the
 * minted amount with stakers.
 */
public final class RewardConfig {

    private final Coin mintingAmount;
    private final RewardRatio ratio;
    private final RewardRatio kip82Ratio;
    private final long minimumStake;
    private final boolean deferredTxFee;
    private final Coin unitPrice;

    RewardConfig(
            Coin mintingAmount,
            RewardRatio ratio,
            @Nullable RewardRatio kip82Ratio,
            long minimumStake,
            boolean deferredTxFee,
            Coin unitPrice) {
        this.mintingAmount = Objects.requireNonNull(mintingAmount);
        this.ratio = Objects.requireNonNull(ratio);
        this.kip82Ratio = kip82Ratio;
        this.minimumStake = minimumStake;
        this.deferredTxFee = deferredTxFee;
        this.unitPrice = Objects.requireNonNull(unitPrice);
    }

    /**
     * @throws MalformedRatioException if a needed ratio has the wrong number of terms
     * @throws InvalidRatioValueException if a needed ratio has a non integer term
     */
    public static RewardConfig fromParameters(RewardParameters parameters, RewardRegime regime) {
        RewardRatio ratio = RewardRatio.parse(parameters.getRatio(), RewardRatio.RATIO_PARTS);
        RewardRatio kip82Ratio = regime.getSplitAlgorithm() == SplitAlgorithm.KORE
                ? RewardRatio.parse(parameters.getKip82Ratio(), RewardRatio.KIP82_RATIO_PARTS)
                : null;

        return new RewardConfig(
                parameters.getMintingAmount(),
                ratio,
                kip82Ratio,
                parameters.getMinimumStake(),
                parameters.isDeferredTxFee(),
                parameters.getUnitPrice());
    }

    public Coin getMintingAmount() {
        return mintingAmount;
    }

    /**
     * @return the proposer (cn) / KGF / KIR ratio
     */
    public RewardRatio getRatio() {
        return ratio;
    }

    /**
     * @return the proposer / stakers ratio applied to the cn share
     */
    public RewardRatio getKip82Ratio() {
        if (kip82Ratio == null) {
            throw new IllegalStateException("Proposer/stakers ratio is not in effect");
        }
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

    @Override
    public String toString() {
        return "RewardConfig{" +
                "mintingAmount=" + mintingAmount +
                ", ratio=" + ratio +
                ", kip82Ratio=" + kip82Ratio +
                ", minimumStake=" + minimumStake +
                ", deferredTxFee=" + deferredTxFee +
                ", unitPrice=" + unitPrice +
                '}';
    }
}
