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

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Integer weights parsed from a '/' delimited ratio such as "34/54/12".
 * The total is not validated: a zero total fails later, when an amount is split.
 */
public final class RewardRatio {
    public static final int RATIO_PARTS = 3;
    public static final int KIP82_RATIO_PARTS = 2;

    private static final String SEPARATOR = "/";

    private final long[] weights;
    private final long total;

    private RewardRatio(long[] weights) {
        this.weights = weights;
        this.total = Arrays.stream(weights).reduce(0L, Math::addExact);
    }

    public static RewardRatio parse(String ratio, int expectedParts) {
        // a negative limit keeps trailing empty terms, so "1/2/" has three terms
        String[] parts = ratio.split(SEPARATOR, -1);
        if (parts.length != expectedParts) {
            throw new MalformedRatioException(String.format(
                    "Ratio '%s' has %d terms, expected %d", ratio, parts.length, expectedParts));
        }

        long[] weights = new long[expectedParts];
        for (int i = 0; i < parts.length; i++) {
            try {
                weights[i] = Long.parseLong(parts[i]);
            } catch (NumberFormatException e) {
                throw new InvalidRatioValueException(String.format(
                        "Ratio '%s' has a non integer term '%s'", ratio, parts[i]), e);
            }
        }

        return new RewardRatio(weights);
    }

    public int size() {
        return weights.length;
    }

    public long getWeight(int index) {
        return weights[index];
    }

    public long getTotal() {
        return total;
    }

    /**
     * Splits the source by weight. Each part is truncated on its own, so the parts may add up to
     * less than the source; the difference is left for the caller to assign.
     *
     * @throws ArithmeticException if the weights add up to zero
     */
    public Coin[] split(Coin source) {
        BigInteger totalWeight = BigInteger.valueOf(total);
        Coin[] parts = new Coin[weights.length];
        for (int i = 0; i < weights.length; i++) {
            parts[i] = source.multiply(BigInteger.valueOf(weights[i])).divide(totalWeight);
        }
        return parts;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < weights.length; i++) {
            if (i > 0) {
                sb.append(SEPARATOR);
            }
            sb.append(weights[i]);
        }
        return sb.toString();
    }
}
