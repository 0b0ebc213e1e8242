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

package co.kreward.core;

import javax.annotation.Nonnull;
import java.math.BigInteger;

/**
 * Native coin amount, denominated in the smallest unit (peb).
 * All reward pools and credited amounts are expressed as coins.
 */
public class Coin implements Comparable<Coin> {
    public static final Coin ZERO = new Coin(BigInteger.ZERO);

    private final BigInteger value;

    public Coin(BigInteger value) {
        this.value = value;
    }

    public BigInteger asBigInteger() {
        return value;
    }

    public Coin add(Coin val) {
        return new Coin(value.add(val.value));
    }

    public Coin subtract(Coin val) {
        return new Coin(value.subtract(val.value));
    }

    public Coin multiply(BigInteger val) {
        return new Coin(value.multiply(val));
    }

    public Coin divide(BigInteger val) {
        return new Coin(value.divide(val));
    }

    /**
     * @return the smaller of this and the given coin.
     */
    public Coin min(Coin other) {
        return compareTo(other) <= 0 ? this : other;
    }

    public boolean isPositive() {
        return value.signum() > 0;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }

        if (other == null || this.getClass() != other.getClass()) {
            return false;
        }

        Coin otherCoin = (Coin) other;
        return value.equals(otherCoin.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public int compareTo(@Nonnull Coin other) {
        return value.compareTo(other.value);
    }

    /**
     * @return a DEBUG representation of the value, mainly used for logging.
     */
    @Override
    public String toString() {
        return value.toString();
    }

    public static Coin valueOf(long val) {
        return new Coin(BigInteger.valueOf(val));
    }

    /**
     * @param val a base-10 amount, as found in configuration files
     */
    public static Coin valueOf(String val) {
        return new Coin(new BigInteger(val));
    }
}
