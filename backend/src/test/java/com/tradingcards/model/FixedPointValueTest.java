package com.tradingcards.model;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FixedPointValueTest {

    @Test
    void compareAlignsExponentsWithoutLosingDigits() {
        FixedPointValue a = FixedPointValue.of(123_456_789, -8);
        FixedPointValue b = FixedPointValue.of(123_456_790, -8);
        FixedPointValue whole = FixedPointValue.of(1, 0);

        assertEquals(-1, a.compareTo(b));
        assertEquals(1, a.compareTo(whole));
        assertEquals(0, FixedPointValue.of(100, -2).compareTo(whole));
    }

    @Test
    void subtractUsesFinerExponent() {
        FixedPointValue difference = FixedPointValue.of(2, 0).subtract(FixedPointValue.of(150, -2));

        assertEquals(new FixedPointValue(BigInteger.valueOf(50), -2), difference);
        assertEquals(1, difference.signum());
        assertEquals(-1, FixedPointValue.of(1, 0).subtract(FixedPointValue.of(2, 0)).signum());
    }

    @Test
    void multiplyHandlesValuesBeyondLongRange() {
        FixedPointValue large = FixedPointValue.of(Long.MAX_VALUE, -8).multiply(10_000);

        assertEquals(BigInteger.valueOf(Long.MAX_VALUE).multiply(BigInteger.valueOf(10_000)), large.mantissa());
    }

    @Test
    void mantissaIsRequired() {
        assertThrows(NullPointerException.class, () -> new FixedPointValue(null, 0));
    }
}
