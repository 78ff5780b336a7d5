// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.core.types;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Base58-encoded Cellframe wallet address.
 * <p>
 * The value is serialized verbatim into {@code "addr"} fields, so it is restricted
 * to the Base58 alphabet (no {@code 0}, {@code O}, {@code I}, {@code l}).
 *
 * @since 0.1.0
 */
public record Address(@JsonValue String value) {
    private static final String BASE58_ALPHABET =
            "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz";

    public Address {
        Objects.requireNonNull(value, "address");
        if (value.isEmpty()) {
            throw new IllegalArgumentException("Address cannot be empty");
        }
        for (int i = 0; i < value.length(); i++) {
            if (BASE58_ALPHABET.indexOf(value.charAt(i)) < 0) {
                throw new IllegalArgumentException("Invalid Base58 address: " + value);
            }
        }
    }

    public static Address of(final String value) {
        return new Address(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
