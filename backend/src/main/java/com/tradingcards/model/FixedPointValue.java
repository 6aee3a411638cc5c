package com.tradingcards.model;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Fixed-point number {@code mantissa * 10^exponent}, as published by price oracles.
 * Arithmetic between values aligns them on the finer exponent by scaling the coarser mantissa up,
 * so no digit is ever dropped.
 */
public record FixedPointValue(BigInteger mantissa, int exponent) implements Comparable<FixedPointValue> {

    public FixedPointValue {
        Objects.requireNonNull(mantissa, "mantissa is required");
    }

    public static FixedPointValue of(long mantissa, int exponent) {
        return new FixedPointValue(BigInteger.valueOf(mantissa), exponent);
    }

    public FixedPointValue multiply(long factor) {
        return new FixedPointValue(mantissa.multiply(BigInteger.valueOf(factor)), exponent);
    }

    public FixedPointValue subtract(FixedPointValue other) {
        int scale = Math.min(exponent, other.exponent);
        return new FixedPointValue(rescaledMantissa(scale).subtract(other.rescaledMantissa(scale)), scale);
    }

    public int signum() {
        return mantissa.signum();
    }

    @Override
    public int compareTo(FixedPointValue other) {
        int scale = Math.min(exponent, other.exponent);
        return rescaledMantissa(scale).compareTo(other.rescaledMantissa(scale));
    }

    private BigInteger rescaledMantissa(int targetExponent) {
        int shift = exponent - targetExponent;
        if (shift < 0) {
            throw new IllegalArgumentException("Cannot rescale to a coarser exponent without truncation");
        }
        return shift == 0 ? mantissa : mantissa.multiply(BigInteger.TEN.pow(shift));
    }

    @Override
    public String toString() {
        return mantissa + "e" + exponent;
    }
}
