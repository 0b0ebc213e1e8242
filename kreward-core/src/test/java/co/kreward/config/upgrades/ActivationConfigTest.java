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

package co.kreward.config.upgrades;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

class ActivationConfigTest {
    private static final String BASE_CONFIG = String.join("\n",
            "hardforkActivationHeights: {",
            "    magma: 100",
            "    kore: -1",
            "}"
    );

    @Test
    void readBaseConfig() {
        ActivationConfig config = ActivationConfig.read(ConfigFactory.parseString(BASE_CONFIG));

        Assertions.assertEquals(100, config.getActivationHeight(ForkRule.MAGMA));
        Assertions.assertEquals(-1, config.getActivationHeight(ForkRule.KORE));
    }

    @Test
    void activeFromTheActivationHeight() {
        ActivationConfig config = ActivationConfig.read(ConfigFactory.parseString(BASE_CONFIG));

        Assertions.assertFalse(config.forBlock(99).isActive(ForkRule.MAGMA));
        Assertions.assertTrue(config.forBlock(100).isActive(ForkRule.MAGMA));
        Assertions.assertTrue(config.forBlock(Long.MAX_VALUE).isActive(ForkRule.MAGMA));
    }

    @Test
    void negativeHeightIsNeverActive() {
        ActivationConfig config = ActivationConfig.read(ConfigFactory.parseString(BASE_CONFIG));

        Assertions.assertFalse(config.forBlock(0).isActive(ForkRule.KORE));
        Assertions.assertFalse(config.forBlock(Long.MAX_VALUE).isActive(ForkRule.KORE));
    }

    @Test
    void failsReadingWithMissingRule() {
        String config = String.join("\n",
                "hardforkActivationHeights: {",
                "    magma: 0",
                "}"
        );

        Assertions.assertThrows(IllegalArgumentException.class,
                () -> ActivationConfig.read(ConfigFactory.parseString(config)));
    }

    @Test
    void failsReadingWithUnknownRule() {
        String config = String.join("\n",
                "hardforkActivationHeights: {",
                "    magma: 0",
                "    kore: 0",
                "    shanghai: 0",
                "}"
        );

        Assertions.assertThrows(IllegalArgumentException.class,
                () -> ActivationConfig.read(ConfigFactory.parseString(config)));
    }

    @Test
    void forBlockKeepsTheBlockNumber() {
        Map<ForkRule, Long> heights = new EnumMap<>(ForkRule.class);
        heights.put(ForkRule.MAGMA, 0L);
        heights.put(ForkRule.KORE, 0L);

        Assertions.assertEquals(42, new ActivationConfig(heights).forBlock(42).getBlockNumber());
    }
}
