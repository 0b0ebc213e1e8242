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

import com.typesafe.config.Config;

import java.util.Objects;

/**
 * Istanbul consensus settings of a chain.
 */
public class ConsensusConfig {
    private static final String PROPERTY_PROPOSER_POLICY = "proposerPolicy";

    private final ProposerPolicy proposerPolicy;

    public ConsensusConfig(ProposerPolicy proposerPolicy) {
        this.proposerPolicy = Objects.requireNonNull(proposerPolicy);
    }

    public ProposerPolicy getProposerPolicy() {
        return proposerPolicy;
    }

    public static ConsensusConfig read(Config config) {
        return new ConsensusConfig(ProposerPolicy.fromConfigName(config.getString(PROPERTY_PROPOSER_POLICY)));
    }

    @Override
    public String toString() {
        return "ConsensusConfig{proposerPolicy=" + proposerPolicy + '}';
    }
}
