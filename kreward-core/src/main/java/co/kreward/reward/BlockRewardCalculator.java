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

import co.kreward.config.ChainConfig;
import co.kreward.config.ConsensusConfig;
import co.kreward.core.BlockHeader;
import co.kreward.core.Coin;
import co.kreward.governance.GovernanceParametersProvider;
import co.kreward.governance.RewardParameters;
import co.kreward.governance.StaticGovernanceParametersProvider;
import co.kreward.metrics.profilers.Metric;
import co.kreward.metrics.profilers.MetricKind;
import co.kreward.metrics.profilers.Profiler;
import co.kreward.metrics.profilers.impl.DisabledProfiler;
import co.kreward.staking.StakingInfo;
import co.kreward.staking.StakingInfoProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Objects;

/**
 * Entry point of reward calculation. Computes the reward of a block from its header, the chain
 * config and the governance and staking snapshots at that block.
 *
 * Instances hold no per-block state and can be shared between threads.
 */
public class BlockRewardCalculator {
    private static final Logger logger = LoggerFactory.getLogger("reward");

    private final ChainConfig chainConfig;
    private final StakingInfoProvider stakingInfoProvider;
    private final RewardConfigCache rewardConfigCache;
    private final Profiler profiler;

    private final DeferredFeeCalculator feeCalculator;
    private final RewardSplitter splitter;
    private final StakingShareCalculator shareCalculator;
    private final RewardAggregator aggregator;

    /**
     * Calculator for a chain whose reward parameters never change, with profiling disabled.
     */
    public BlockRewardCalculator(ChainConfig chainConfig, StakingInfoProvider stakingInfoProvider) {
        this(
                chainConfig,
                new StaticGovernanceParametersProvider(chainConfig.getRewardParameters()),
                stakingInfoProvider,
                DisabledProfiler.INSTANCE);
    }

    public BlockRewardCalculator(
            ChainConfig chainConfig,
            GovernanceParametersProvider governanceParametersProvider,
            StakingInfoProvider stakingInfoProvider,
            Profiler profiler) {
        this.chainConfig = Objects.requireNonNull(chainConfig);
        this.stakingInfoProvider = Objects.requireNonNull(stakingInfoProvider);
        this.profiler = Objects.requireNonNull(profiler);
        this.rewardConfigCache = new RewardConfigCache(
                governanceParametersProvider,
                chainConfig.getActivationConfig(),
                chainConfig.getRewardConfigCacheSize());

        this.splitter = new RewardSplitter();
        this.feeCalculator = new DeferredFeeCalculator(splitter);
        this.shareCalculator = new StakingShareCalculator();
        this.aggregator = new RewardAggregator();
    }

    /**
     * Returns the reward actually paid in the given block.
     * Under round robin and sticky proposer policies everything goes to the proposer; otherwise the
     * deferred reward is computed and, when fees are not deferred, the fee the proposer already
     * received during transaction execution is added back.
     *
     * @throws MissingConsensusConfigException if the chain has no consensus config
     * @throws RewardException if the reward config of the block is invalid or a lookup fails
     */
    public RewardSpec getBlockReward(BlockHeader header) {
        Metric metric = profiler.start(MetricKind.BLOCK_REWARD_CALCULATION);
        try {
            ConsensusConfig consensusConfig = chainConfig.getConsensusConfig();
            if (consensusConfig == null) {
                throw new MissingConsensusConfigException("No consensus config for block " + header.getPrintableNumber());
            }

            if (consensusConfig.getProposerPolicy().paysProposerOnly()) {
                return calculateDeferredRewardSimple(header);
            }

            RewardSpec spec = calculateDeferredReward(header);
            RewardConfig config = rewardConfigCache.get(header.getNumber());
            if (!config.isDeferredTxFee()) {
                RewardRegime regime = resolveRegime(header);
                Coin blockFee = feeCalculator.getTotalFee(header, config.getUnitPrice(), regime);
                spec = spec.withProposerFee(header.getRewardbase(), blockFee);
            }
            return spec;
        } finally {
            profiler.stop(metric);
        }
    }

    /**
     * Pays the minted amount plus the rewardable fee to the proposer, with no stakers nor funds.
     * Ratios are not used, so they are not parsed.
     */
    public RewardSpec calculateDeferredRewardSimple(BlockHeader header) {
        RewardParameters parameters = rewardConfigCache.getParameters(header.getNumber());
        RewardRegime regime = resolveRegime(header);

        Coin minted = parameters.getMintingAmount();
        FeeSplit fee = feeCalculator.getSimpleFee(header, parameters.getUnitPrice(), regime);
        Coin proposer = minted.add(fee.getReward());

        return new RewardSpec(
                minted,
                fee.getTotal(),
                fee.getBurnt(),
                proposer,
                Coin.ZERO,
                Coin.ZERO,
                Coin.ZERO,
                Collections.singletonMap(header.getRewardbase(), proposer));
    }

    /**
     * Calculates the reward determined at the end of block processing: the fee is burnt and split
     * with the minted amount, and the stakers pool is shared by stake.
     */
    public RewardSpec calculateDeferredReward(BlockHeader header) {
        Metric metric = profiler.start(MetricKind.DEFERRED_REWARD_CALCULATION);
        try {
            RewardConfig config = rewardConfigCache.get(header.getNumber());
            RewardRegime regime = resolveRegime(header);
            StakingInfo stakingInfo = fetchStakingInfo(header.getNumber());

            Coin minted = config.getMintingAmount();
            FeeSplit fee = feeCalculator.getDeferredFee(header, config, regime);
            RewardSplit split = splitter.split(config, regime, minted, fee.getReward());
            StakingShares shares = shareCalculator.calculateShares(config, stakingInfo, split.getStakers());

            return aggregator.aggregate(header, minted, fee, split, shares, stakingInfo);
        } finally {
            profiler.stop(metric);
        }
    }

    private RewardRegime resolveRegime(BlockHeader header) {
        RewardRegime regime = RewardRegime.forBlock(chainConfig.getActivationsForBlock(header.getNumber()));
        logger.trace("Block {} uses {}", header.getPrintableNumber(), regime);
        return regime;
    }

    private StakingInfo fetchStakingInfo(long blockNumber) {
        try {
            return stakingInfoProvider.getStakingInfo(blockNumber);
        } catch (RuntimeException e) {
            throw new CollaboratorFailureException("Failed to get staking info at block #" + blockNumber, e);
        }
    }
}
