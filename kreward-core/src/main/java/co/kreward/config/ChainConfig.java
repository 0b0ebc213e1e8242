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

import co.kreward.config.upgrades.ActivationConfig;
import co.kreward.governance.RewardParameters;
import com.typesafe.config.Config;

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Immutable chain configuration consumed by reward calculation.
 */
public class ChainConfig {
    public static final String PROPERTY_BC_CONFIG = "blockchain.config";
    public static final String PROPERTY_BC_CONFIG_NAME = "blockchain.config.name";
    public static final String PROPERTY_ISTANBUL = "consensus.istanbul";
    public static final String PROPERTY_UNIT_PRICE = "chain.unitPrice";
    public static final String PROPERTY_REWARD = "reward";
    public static final String PROPERTY_REWARD_CACHE_SIZE = "reward.configCacheSize";

    private final String networkName;
    private final ActivationConfig activationConfig;
    private final ConsensusConfig consensusConfig;
    private final RewardParameters rewardParameters;
    private final int rewardConfigCacheSize;

    public ChainConfig(
            String networkName,
            ActivationConfig activationConfig,
            @Nullable ConsensusConfig consensusConfig,
            RewardParameters rewardParameters,
            int rewardConfigCacheSize) {
        this.networkName = Objects.requireNonNull(networkName);
        this.activationConfig = Objects.requireNonNull(activationConfig);
        this.consensusConfig = consensusConfig;
        this.rewardParameters = Objects.requireNonNull(rewardParameters);
        this.rewardConfigCacheSize = rewardConfigCacheSize;
    }

    public String getNetworkName() {
        return networkName;
    }

    public ActivationConfig getActivationConfig() {
        return activationConfig;
    }

    public ActivationConfig.ForBlock getActivationsForBlock(long blockNumber) {
        return activationConfig.forBlock(blockNumber);
    }

    /**
     * @return the Istanbul consensus settings, or null when the chain does not configure them.
     */
    @Nullable
    public ConsensusConfig getConsensusConfig() {
        return consensusConfig;
    }

    /**
     * @return the reward parameters the chain starts with, before any governance change.
     */
    public RewardParameters getRewardParameters() {
        return rewardParameters;
    }

    public int getRewardConfigCacheSize() {
        return rewardConfigCacheSize;
    }

    public static ChainConfig read(Config config) {
        ActivationConfig activationConfig = ActivationConfig.read(config.getConfig(PROPERTY_BC_CONFIG));
        ConsensusConfig consensusConfig = config.hasPath(PROPERTY_ISTANBUL)
                ? ConsensusConfig.read(config.getConfig(PROPERTY_ISTANBUL))
                : null;
        RewardParameters rewardParameters = RewardParameters.read(
                config.getConfig(PROPERTY_REWARD),
                config.getString(PROPERTY_UNIT_PRICE));

        return new ChainConfig(
                config.getString(PROPERTY_BC_CONFIG_NAME),
                activationConfig,
                consensusConfig,
                rewardParameters,
                config.getInt(PROPERTY_REWARD_CACHE_SIZE));
    }
}
