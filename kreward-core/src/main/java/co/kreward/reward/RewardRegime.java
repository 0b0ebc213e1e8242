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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The reward algorithms in effect at a block, resolved once from the fork activations.
 */
public final class RewardRegime {

    private final boolean baseFeePricing;
    private final List<FeeBurnRule> burnRules;
    private final SplitAlgorithm splitAlgorithm;

    public RewardRegime(boolean baseFeePricing, List<FeeBurnRule> burnRules, SplitAlgorithm splitAlgorithm) {
        this.baseFeePricing = baseFeePricing;
        this.burnRules = Collections.unmodifiableList(new ArrayList<>(burnRules));
        this.splitAlgorithm = Objects.requireNonNull(splitAlgorithm);
    }

    public static RewardRegime forBlock(ActivationConfig.ForBlock activations) {
        boolean magma = activations.isActive(ForkRule.MAGMA);
        boolean kore = activations.isActive(ForkRule.KORE);

        List<FeeBurnRule> burnRules = new ArrayList<>();
        if (magma) {
            burnRules.add(FeeBurnRule.HALF_BURN);
        }
        if (kore) {
            burnRules.add(FeeBurnRule.PROPOSER_CAP_BURN);
        }

        return new RewardRegime(magma, burnRules, kore ? SplitAlgorithm.KORE : SplitAlgorithm.LEGACY);
    }

    /**
     * @return true if gas is priced at the header's base fee rather than the fixed unit price.
     */
    public boolean isBaseFeePricing() {
        return baseFeePricing;
    }

    /**
     * @return the burns to apply to the deferred fee, in application order.
     */
    public List<FeeBurnRule> getBurnRules() {
        return burnRules;
    }

    public boolean burnsHalfOfFees() {
        return burnRules.contains(FeeBurnRule.HALF_BURN);
    }

    public SplitAlgorithm getSplitAlgorithm() {
        return splitAlgorithm;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RewardRegime that = (RewardRegime) o;
        return baseFeePricing == that.baseFeePricing
                && burnRules.equals(that.burnRules)
                && splitAlgorithm == that.splitAlgorithm;
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseFeePricing, burnRules, splitAlgorithm);
    }

    @Override
    public String toString() {
        return "RewardRegime{" +
                "baseFeePricing=" + baseFeePricing +
                ", burnRules=" + burnRules +
                ", splitAlgorithm=" + splitAlgorithm +
                '}';
    }
}
