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

package co.kreward.core;

import co.kreward.core.exception.InvalidAddressException;
import co.kreward.util.HexUtils;
import org.bouncycastle.util.encoders.Hex;

import java.util.Arrays;

/**
 * Immutable representation of an account address.
 * It is a simple wrapper on the raw byte[].
 */
public class Address {

    /**
     * This is the size of an address in bytes.
     */
    public static final int LENGTH_IN_BYTES = 20;

    private static final Address NULL_ADDRESS = new Address();

    private final byte[] bytes;

    /**
     * @param address the hex-encoded 20 bytes long address, with or without 0x prefix.
     */
    public Address(String address) {
        this(HexUtils.stringHexToByteArray(address));
    }

    /**
     * @param bytes the 20 bytes long raw address bytes.
     */
    public Address(byte[] bytes) {
        if (bytes.length != LENGTH_IN_BYTES) {
            throw new InvalidAddressException(String.format("An address must be %d bytes long", LENGTH_IN_BYTES));
        }

        this.bytes = Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * This instantiates the unset address.
     */
    private Address() {
        this.bytes = new byte[0];
    }

    /**
     * @return the null address, used wherever an address is not configured.
     */
    public static Address nullAddress() {
        return NULL_ADDRESS;
    }

    /**
     * Null-safe check for an unset address. The null address and the all-zero address are both empty.
     */
    public static boolean isEmpty(Address address) {
        return address == null || address.isEmpty();
    }

    public boolean isEmpty() {
        for (byte b : bytes) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    public String toHexString() {
        return Hex.toHexString(bytes);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }

        if (other == null || this.getClass() != other.getClass()) {
            return false;
        }

        Address otherAddress = (Address) other;
        return Arrays.equals(bytes, otherAddress.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    /**
     * @return a DEBUG representation of the address, mainly used for logging.
     */
    @Override
    public String toString() {
        return toHexString();
    }
}
