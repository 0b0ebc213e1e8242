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

package co.kreward.util;

import org.bouncycastle.util.encoders.Hex;

/**
 * Hex utils
 */
public class HexUtils {

    private static final String HEX_PREFIX = "0x";

    private static final String ZERO_STR = "0";

    private HexUtils() {
        throw new IllegalAccessError("Utility class");
    }

    /**
     * Convert hex encoded string to decoded byte array
     */
    public static byte[] stringHexToByteArray(final String param) {

        String result = removeHexPrefix(param);

        if (result.length() % 2 != 0) { //NOSONAR
            result = ZERO_STR + result;
        }
        return Hex.decode(result);
    }

    /**
     * if the parameter has the hex prefix
     */
    public static boolean hasHexPrefix(final String data) {
        return data != null && data.startsWith(HEX_PREFIX);
    }

    /**
     * remove Hex Prefix from string
     */
    public static String removeHexPrefix(final String data) {
        String result = data;
        if (hasHexPrefix(result)) {
            result = data.substring(2);
        }
        return result;
    }
}
