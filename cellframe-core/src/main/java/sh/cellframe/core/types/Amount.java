// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.core.types;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A token amount kept as a decimal string from input to wire.
 * <p>
 * The ledger takes values as strings such as {@code "1.0"}, {@code "0.001"} or a
 * plain datoshi integer. The text is validated but never converted to a floating
 * point type, so values beyond double precision pass through untouched.
 * <p>
 * <strong>Common Conversions:</strong>
 * <ul>
 * <li>1 CELL = 10^18 datoshi</li>
 * </ul>
 *
 * @since 0.1.0
 */
public record Amount(@JsonValue String value) {
    /** Fractional digits of one coin. */
    public static final int DECIMALS = 18;

    private static final BigInteger DATOSHI_PER_COIN = BigInteger.TEN.pow(DECIMALS);
    private static final Pattern DECIMAL = Pattern.compile("^[0-9]+(\\.[0-9]+)?$");

    public Amount {
        Objects.requireNonNull(value, "amount");
        if (!DECIMAL.matcher(value).matches()) {
            throw new IllegalArgumentException("Amount must be a decimal string: " + value);
        }
    }

    public static Amount of(final String value) {
        return new Amount(value);
    }

    /**
     * Renders an integer datoshi quantity as a coin amount, e.g. {@code 1500000000000000000}
     * becomes {@code "1.5"}.
     *
     * @param datoshi non-negative datoshi quantity
     * @return the coin amount without trailing fractional zeros
     */
    public static Amount ofDatoshi(final BigInteger datoshi) {
        Objects.requireNonNull(datoshi, "datoshi");
        if (datoshi.signum() < 0) {
            throw new IllegalArgumentException("datoshi must be non-negative");
        }
        final BigDecimal coins = new BigDecimal(datoshi, DECIMALS).stripTrailingZeros();
        return new Amount(coins.signum() == 0 ? "0" : coins.toPlainString());
    }

    /**
     * Converts the amount to datoshi. Fractional digits beyond the 18th are dropped.
     *
     * @return the integer datoshi quantity
     */
    public BigInteger toDatoshi() {
        final int dot = value.indexOf('.');
        if (dot < 0) {
            return new BigInteger(value).multiply(DATOSHI_PER_COIN);
        }
        final BigInteger whole = new BigInteger(value.substring(0, dot));
        String fraction = value.substring(dot + 1);
        if (fraction.length() > DECIMALS) {
            fraction = fraction.substring(0, DECIMALS);
        }
        final StringBuilder padded = new StringBuilder(fraction);
        while (padded.length() < DECIMALS) {
            padded.append('0');
        }
        return whole.multiply(DATOSHI_PER_COIN).add(new BigInteger(padded.toString()));
    }

    public boolean isZero() {
        return toDatoshi().signum() == 0;
    }

    @Override
    public String toString() {
        return value;
    }
}
