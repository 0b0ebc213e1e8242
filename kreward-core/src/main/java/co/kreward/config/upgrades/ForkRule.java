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

/**
 * Protocol upgrades that change how block rewards are computed.
 */
public enum ForkRule {
    /**
     * Gas is priced at the header's base fee and half of the deferred fee is burnt.
     */
    MAGMA("magma"),
    /**
     * Minted amount is split three ways with a proposer/stakers sub-split, and fees up to
     * the proposer's minted share are burnt.
     */
    KORE("kore"),
    ;

    private final String configKey;

    ForkRule(String configKey) {
        this.configKey = configKey;
    }

    public String getConfigKey() {
        return configKey;
    }

    public static ForkRule fromConfigKey(String configKey) {
        for (ForkRule rule : ForkRule.values()) {
            if (rule.configKey.equals(configKey)) {
                return rule;
            }
        }

        throw new IllegalArgumentException(String.format("Unknown fork rule %s", configKey));
    }
}
