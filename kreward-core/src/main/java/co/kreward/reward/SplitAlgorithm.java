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

/**
 * How minted coins and rewardable fees are split into reward pools.
 */
public enum SplitAlgorithm {
    /**
     * Minted plus fee is split by ratio into proposer, KGF and KIR. Stakers get nothing.
     */
    LEGACY,
    /**
     * Only the minted amount is split by ratio, the proposer part is split again with stakers,
     * and the whole fee goes to the proposer.
     */
    KORE,
}
