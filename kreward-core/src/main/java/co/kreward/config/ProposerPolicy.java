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

package co.kreward.config;

/**
 * Proposer selection policies of the Istanbul consensus engine.
 */
public enum ProposerPolicy {
    ROUND_ROBIN("roundrobin"),
    STICKY("sticky"),
    WEIGHTED_RANDOM("weightedrandom"),
    ;

    private final String configName;

    ProposerPolicy(String configName) {
        this.configName = configName;
    }

    /**
     * Policies under which the whole block reward goes to the proposer, with no staking pool.
     */
    public boolean paysProposerOnly() {
        return this == ROUND_ROBIN || this == STICKY;
    }

    public static ProposerPolicy fromConfigName(String configName) {
        for (ProposerPolicy policy : values()) {
            if (policy.configName.equalsIgnoreCase(configName)) {
                return policy;
            }
        }

        throw new IllegalArgumentException(String.format("%s is not a valid proposer policy", configName));
    }
}
