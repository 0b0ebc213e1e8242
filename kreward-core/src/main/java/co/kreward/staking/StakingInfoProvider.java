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

package co.kreward.staking;

import javax.annotation.Nullable;

/**
 * Read access to staking snapshots. Declared here, rather than depending on the staking manager
 * itself, so reward calculation does not depend on the module that tracks staking contracts.
 */
public interface StakingInfoProvider {

    /**
     * @return the staking snapshot in effect at the given block, or null if staking is not active yet.
     */
    @Nullable
    StakingInfo getStakingInfo(long blockNumber);
}
