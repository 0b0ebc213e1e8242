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

package co.kreward.staking;

import co.kreward.core.Address;
import co.kreward.core.exception.InvalidAddressException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bouncycastle.util.encoders.DecoderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Serves staking snapshots read from a JSON classpath resource. A block uses the latest
 * snapshot taken at or below its number; blocks before the first snapshot have none.
 *
 * <pre>
 * { "snapshots": [ { "blockNumber": 0, "kgfAddress": "0x..", "kirAddress": "0x..",
 *                    "nodes": [ { "nodeAddress": "0x..", "rewardAddress": "0x..", "stakingAmount": 5000000 } ] } ] }
 * </pre>
 */
public class JsonStakingInfoProvider implements StakingInfoProvider {
    private static final Logger logger = LoggerFactory.getLogger("staking");

    private final NavigableMap<Long, StakingInfo> snapshots = new TreeMap<>();

    public JsonStakingInfoProvider(String stakingFile) {
        ObjectMapper mapper = new ObjectMapper();
        logger.info("Loading staking snapshots from {}", stakingFile);

        try (InputStream is = JsonStakingInfoProvider.class.getClassLoader().getResourceAsStream(stakingFile)) {
            if (is == null) {
                throw new StakingInfoException("Staking file not found [" + stakingFile + "]");
            }

            JsonNode root = mapper.readTree(is);
            JsonNode snapshotsNode = root == null ? null : root.get("snapshots");
            if (snapshotsNode == null || !snapshotsNode.isArray()) {
                throw new StakingInfoException("Missing snapshots array in [" + stakingFile + "]");
            }

            for (JsonNode snapshotNode : snapshotsNode) {
                StakingInfo stakingInfo = parseSnapshot(snapshotNode);
                snapshots.put(stakingInfo.getBlockNumber(), stakingInfo);
            }
        } catch (IOException ex) {
            throw new StakingInfoException("Error reading staking file [" + stakingFile + "]", ex);
        }

        logger.info("Loaded {} staking snapshots", snapshots.size());
    }

    @Nullable
    @Override
    public StakingInfo getStakingInfo(long blockNumber) {
        Map.Entry<Long, StakingInfo> entry = snapshots.floorEntry(blockNumber);
        return entry == null ? null : entry.getValue();
    }

    private static StakingInfo parseSnapshot(JsonNode snapshotNode) {
        long blockNumber = requiredLong(snapshotNode, "blockNumber");

        List<StakingNode> nodes = new ArrayList<>();
        JsonNode nodesNode = snapshotNode.get("nodes");
        if (nodesNode != null) {
            for (JsonNode node : nodesNode) {
                nodes.add(parseNode(node));
            }
        }

        return new StakingInfo(
                blockNumber,
                nodes,
                optionalAddress(snapshotNode, "kgfAddress"),
                optionalAddress(snapshotNode, "kirAddress"));
    }

    private static StakingNode parseNode(JsonNode node) {
        Address nodeAddress = toAddress(requiredField(node, "nodeAddress"), "nodeAddress");
        Address rewardAddress = toAddress(requiredField(node, "rewardAddress"), "rewardAddress");
        long stakingAmount = requiredLong(node, "stakingAmount");
        try {
            return new StakingNode(nodeAddress, rewardAddress, stakingAmount);
        } catch (IllegalArgumentException e) {
            throw new StakingInfoException("Invalid staking node " + node, e);
        }
    }

    private static JsonNode requiredField(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new StakingInfoException("Missing staking field [" + field + "] in " + node);
        }
        return value;
    }

    /**
     * Stakes and block numbers must be JSON integers within the long range. Strings, fractions
     * and out of range numbers are rejected rather than coerced.
     */
    private static long requiredLong(JsonNode node, String field) {
        JsonNode value = requiredField(node, field);
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw new StakingInfoException("Staking field [" + field + "] is not a valid integer: " + value);
        }
        return value.longValue();
    }

    private static Address optionalAddress(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isEmpty()) {
            return Address.nullAddress();
        }
        return toAddress(value, field);
    }

    private static Address toAddress(JsonNode value, String field) {
        if (!value.isTextual()) {
            throw new StakingInfoException("Staking field [" + field + "] is not a hex string: " + value);
        }

        try {
            return new Address(value.textValue());
        } catch (DecoderException | InvalidAddressException e) {
            throw new StakingInfoException("Staking field [" + field + "] is not a valid address: " + value, e);
        }
    }
}
