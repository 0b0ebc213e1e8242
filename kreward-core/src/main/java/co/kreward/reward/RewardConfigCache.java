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

import co.kreward.config.upgrades.ActivationConfig;
import co.kreward.governance.GovernanceParametersProvider;
import co.kreward.governance.RewardParameters;
import co.kreward.util.MaxSizeHashMap;

import java.util.Map;
import java.util.Objects;

/**
 * Keeps the parsed reward config of recently evaluated blocks.
 * Lookups and parse failures are not cached; they are raised again on the next call.
 */
public class RewardConfigCache {

    private final GovernanceParametersProvider governanceParametersProvider;
    private final ActivationConfig activationConfig;
    private final Map<Long, RewardConfig> configs;

    public RewardConfigCache(
            GovernanceParametersProvider governanceParametersProvider,
            ActivationConfig activationConfig,
            int maxSize) {
        this.governanceParametersProvider = Objects.requireNonNull(governanceParametersProvider);
        this.activationConfig = Objects.requireNonNull(activationConfig);
        this.configs = new MaxSizeHashMap<>(maxSize, true);
    }

    public RewardConfig get(long blockNumber) {
        synchronized (configs) {
            RewardConfig cached = configs.get(blockNumber);
            if (cached != null) {
                return cached;
            }
        }

        RewardParameters parameters = getParameters(blockNumber);
        RewardRegime regime = RewardRegime.forBlock(activationConfig.forBlock(blockNumber));
        RewardConfig config = RewardConfig.fromParameters(parameters, regime);

        synchronized (configs) {
            configs.put(blockNumber, config);
        }
        return config;
    }

    public int size() {
        synchronized (configs) {
            return configs.size();
        }
    }

    /**
     * @return the governance parameters at the given block, read through on every call
     * @throws CollaboratorFailureException if the lookup fails
     */
    public RewardParameters getParameters(long blockNumber) {
        RewardParameters parameters;
        try {
            parameters = governanceParametersProvider.getParametersAt(blockNumber);
        } catch (RuntimeException e) {
            throw new CollaboratorFailureException("Failed to get governance parameters at block #" + blockNumber, e);
        }

        if (parameters == null) {
            throw new CollaboratorFailureException(
                    "No governance parameters at block #" + blockNumber,
                    new IllegalStateException("null parameters"));
        }
        return parameters;
    }
}
