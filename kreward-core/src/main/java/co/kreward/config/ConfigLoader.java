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
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Class that encapsulates config loading strategy.
 */
public class ConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger("config");

    public static final String USER_CONFIG_FILE_PROPERTY = "kreward.conf.file";

    private static final String MAINNET_RESOURCE_PATH = "config/main";
    private static final String DEVNET_RESOURCE_PATH = "config/devnet";
    private static final String MAINNET = "main";
    private static final String DEVNET = "devnet";
    private static final String YES = "yes";
    private static final String NO = "no";

    /**
     * Loads configurations from different sources with the following precedence:
     * 1. System properties
     * 2. User configuration file, from -Dkreward.conf.file
     * 3. Default settings per network in resources/config/[network].conf
     * 4. Default settings for all networks in resources/reference.conf
     */
    public Config getConfig() {
        Config systemPropsConfig = ConfigFactory.systemProperties();
        Config userConfig = systemPropsConfig.withFallback(getUserCustomConfig());
        Config networkBaseConfig = getNetworkDefaultConfig(userConfig);

        return userConfig.withFallback(networkBaseConfig).resolve();
    }

    public ChainConfig getChainConfig() {
        return ChainConfig.read(getConfig());
    }

    private Config getUserCustomConfig() {
        String file = System.getProperty(USER_CONFIG_FILE_PROPERTY);
        Config cmdLineConfigFile = file != null ? ConfigFactory.parseFile(new File(file)) : ConfigFactory.empty();
        logger.info(
                "Config ( {} ): user properties from -D{} file '{}'",
                cmdLineConfigFile.entrySet().isEmpty() ? NO : YES,
                USER_CONFIG_FILE_PROPERTY,
                file
        );
        return cmdLineConfigFile;
    }

    /**
     * @return the network-specific configuration based on the user config, or mainnet if no configuration is specified.
     */
    private Config getNetworkDefaultConfig(Config userConfig) {
        if (userConfig.hasPath(ChainConfig.PROPERTY_BC_CONFIG_NAME)) {
            String network = userConfig.getString(ChainConfig.PROPERTY_BC_CONFIG_NAME);
            if (DEVNET.equals(network)) {
                return ConfigFactory.load(DEVNET_RESOURCE_PATH);
            } else if (MAINNET.equals(network)) {
                return ConfigFactory.load(MAINNET_RESOURCE_PATH);
            } else {
                String exceptionMessage = String.format(
                        "%s is not a valid network name (%s property)",
                        network,
                        ChainConfig.PROPERTY_BC_CONFIG_NAME
                );
                logger.warn(exceptionMessage);
                throw new IllegalArgumentException(exceptionMessage);
            }
        }

        logger.info("Network not set, using mainnet by default");
        return ConfigFactory.load(MAINNET_RESOURCE_PATH);
    }
}
