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

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import java.util.EnumMap;
import java.util.Map;

/**
 * Activation heights of the reward-relevant fork rules.
 * A height of -1 means the rule is never activated.
 */
public class ActivationConfig {
    public static final String PROPERTY_ACTIVATION_HEIGHTS = "hardforkActivationHeights";

    private final Map<ForkRule, Long> activationHeights;

    public ActivationConfig(Map<ForkRule, Long> activationHeights) {
        if (activationHeights.size() != ForkRule.values().length) {
            throw new IllegalArgumentException(String.format(
                    "The activation height for every fork rule is required, got %s", activationHeights.keySet()));
        }

        this.activationHeights = new EnumMap<>(activationHeights);
    }

    public boolean isActive(ForkRule forkRule, long blockNumber) {
        long activationHeight = activationHeights.get(forkRule);
        return 0 <= activationHeight && activationHeight <= blockNumber;
    }

    public long getActivationHeight(ForkRule forkRule) {
        return activationHeights.get(forkRule);
    }

    public ForBlock forBlock(long blockNumber) {
        return new ForBlock(blockNumber);
    }

    /**
     * Reads the {@value #PROPERTY_ACTIVATION_HEIGHTS} section from the given blockchain config.
     */
    public static ActivationConfig read(Config config) {
        Config heights = config.getConfig(PROPERTY_ACTIVATION_HEIGHTS);
        Map<ForkRule, Long> activationHeights = new EnumMap<>(ForkRule.class);
        for (Map.Entry<String, ConfigValue> entry : heights.root().entrySet()) {
            ForkRule rule = ForkRule.fromConfigKey(entry.getKey());
            activationHeights.put(rule, heights.getLong(entry.getKey()));
        }

        return new ActivationConfig(activationHeights);
    }

    /**
     * Fork rule activations resolved for a single block number.
     */
    public class ForBlock {
        private final long blockNumber;

        private ForBlock(long blockNumber) {
            this.blockNumber = blockNumber;
        }

        public long getBlockNumber() {
            return blockNumber;
        }

        public boolean isActive(ForkRule forkRule) {
            return ActivationConfig.this.isActive(forkRule, blockNumber);
        }
    }
}
