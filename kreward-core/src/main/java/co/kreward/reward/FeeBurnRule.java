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
 * Burns applied to the deferred fee, in declaration order.
 */
public enum FeeBurnRule {
    /**
     * Burns half of the rewardable fee, truncated.
     */
    HALF_BURN,
    /**
     * Burns the rewardable fee up to the proposer's share of the minted amount.
     */
    PROPOSER_CAP_BURN,
}
