package com.nosota.mescrow.escrow;

import java.math.BigInteger;

/**
 * Fixed-point arithmetic on {@code long} values scaled by {@link #SCALE}.
 */
public final class FixedPoint {

    /**
     * One whole unit: 100% of the voting power, or a milestone share of the full grant.
     */
    public static final long SCALE = 1_000_000_000_000_000_000L;

    private FixedPoint() {
    }

    /**
     * Computes {@code floor(a * b / c)} with a 128-bit intermediate product.
     *
     * @throws ArithmeticException if {@code c} is zero or the result does not fit in a long
     */
    public static long mulDiv(long a, long b, long c) {
        if (c == 0) {
            throw new ArithmeticException("Division by zero");
        }
        return BigInteger.valueOf(a)
                .multiply(BigInteger.valueOf(b))
                .divide(BigInteger.valueOf(c))
                .longValueExact();
    }

    /**
     * Returns {@code percent}% of one whole unit, e.g. {@code percent(40)} is 0.40.
     */
    public static long percent(long percent) {
        return mulDiv(SCALE, percent, 100);
    }
}
