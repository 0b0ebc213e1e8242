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

import java.util.Objects;

/**
 * A block's transaction fee divided into the part paid out as reward and the part burnt.
 */
public final class FeeSplit {
    public static final FeeSplit NONE = new FeeSplit(Coin.ZERO, Coin.ZERO, Coin.ZERO);

    private final Coin total;
    private final Coin reward;
    private final Coin burnt;

    public FeeSplit(Coin total, Coin reward, Coin burnt) {
        this.total = Objects.requireNonNull(total);
        this.reward = Objects.requireNonNull(reward);
        this.burnt = Objects.requireNonNull(burnt);
    }

    public Coin getTotal() {
        return total;
    }

    public Coin getReward() {
        return reward;
    }

    public Coin getBurnt() {
        return burnt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FeeSplit feeSplit = (FeeSplit) o;
        return total.equals(feeSplit.total) && reward.equals(feeSplit.reward) && burnt.equals(feeSplit.burnt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(total, reward, burnt);
    }

    @Override
    public String toString() {
        return "FeeSplit{total=" + total + ", reward=" + reward + ", burnt=" + burnt + '}';
    }
}
