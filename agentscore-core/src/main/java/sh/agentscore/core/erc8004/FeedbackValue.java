// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.agentscore.core.erc8004;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Signed fixed-point feedback value, the on-chain {@code (int128 value, uint8 valueDecimals)}
 * pair. {@code value=9977, decimals=2} is 99.77; {@code value=-32, decimals=1} is -3.2.
 *
 * @param value    the raw value (int128 range)
 * @param decimals decimal places, the full {@code uint8} range 0 to 255
 */
public record FeedbackValue(BigInteger value, int decimals) {
    private static final int INT128_BITS = 127;

    /** Largest {@code uint8} decimals value. */
    public static final int MAX_DECIMALS = 255;

    public FeedbackValue {
        Objects.requireNonNull(value, "value");
        if (decimals < 0 || decimals > MAX_DECIMALS) {
            throw new IllegalArgumentException("decimals must be 0-" + MAX_DECIMALS + ", got " + decimals);
        }
        if (value.bitLength() > INT128_BITS) {
            throw new IllegalArgumentException("value exceeds int128: " + value);
        }
    }

    public static FeedbackValue of(long value, int decimals) {
        return new FeedbackValue(BigInteger.valueOf(value), decimals);
    }

    public BigDecimal toBigDecimal() {
        return new BigDecimal(value, decimals);
    }

    public boolean isPositive() {
        return value.signum() > 0;
    }

    public boolean isNegative() {
        return value.signum() < 0;
    }
}
