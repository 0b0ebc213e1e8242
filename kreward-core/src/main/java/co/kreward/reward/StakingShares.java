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

import co.kreward.core.Address;
import co.kreward.core.Coin;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The stakers pool divided among reward addresses, plus the part no staker received.
 */
public final class StakingShares {

    private final Map<Address, Coin> shares;
    private final Coin remaining;

    public StakingShares(Map<Address, Coin> shares, Coin remaining) {
        this.shares = Collections.unmodifiableMap(new LinkedHashMap<>(shares));
        this.remaining = Objects.requireNonNull(remaining);
    }

    public static StakingShares none(Coin stakersReward) {
        return new StakingShares(Collections.emptyMap(), stakersReward);
    }

    public Map<Address, Coin> getShares() {
        return shares;
    }

    public Coin getRemaining() {
        return remaining;
    }

    @Override
    public String toString() {
        return "StakingShares{shares=" + shares + ", remaining=" + remaining + '}';
    }
}
