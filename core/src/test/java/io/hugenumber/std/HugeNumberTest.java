/*******************************************************************************
 *     ___                  _   ____  ____
 *    / _ \ _   _  ___  ___| |_|  _ \| __ )
 *   | | | | | | |/ _ \/ __| __| | | |  _ \
 *   | |_| | |_| |  __/\__ \ |_| |_| | |_) |
 *    \__\_\\__,_|\___||___/\__|____/|____/
 *
 *  Copyright (c) 2014-2019 Appsicle
 *  Copyright (c) 2019-2026 QuestDB
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *  http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 *
 ******************************************************************************/

package io.hugenumber.std;

import org.junit.Assert;
import org.junit.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;

public class HugeNumberTest {

    @Test
    public void testAccessorsOfSpecialValues() {
        Assert.assertEquals(0, HugeNumber.NaN.getMantissa());
        Assert.assertEquals(0, HugeNumber.NaN.getDenominator());
        Assert.assertEquals(0, HugeNumber.NaN.getExponent());

        Assert.assertEquals(1, HugeNumber.POSITIVE_INFINITY.getMantissa());
        Assert.assertEquals(0, HugeNumber.POSITIVE_INFINITY.getDenominator());
        Assert.assertEquals(0, HugeNumber.POSITIVE_INFINITY.getExponent());

        Assert.assertEquals(-1, HugeNumber.NEGATIVE_INFINITY.getMantissa());
        Assert.assertEquals(0, HugeNumber.NEGATIVE_INFINITY.getDenominator());

        Assert.assertEquals(0, HugeNumber.NEGATIVE_ZERO.getMantissa());
        Assert.assertEquals(1, HugeNumber.NEGATIVE_ZERO.getDenominator());
        Assert.assertEquals(-1, HugeNumber.NEGATIVE_ZERO.getExponent());

        Assert.assertEquals(HugeNumber.Kind.NAN, HugeNumber.NaN.getKind());
        Assert.assertEquals(HugeNumber.Kind.FINITE, HugeNumber.NEGATIVE_ZERO.getKind());
    }

    @Test
    public void testCeilingFloorTruncate() {
        HugeNumber value = HugeNumber.of(-15, -1);
        Assert.assertEquals(HugeNumber.of(-2), value.floor());
        Assert.assertEquals(HugeNumber.of(-1), value.ceiling());
        Assert.assertEquals(HugeNumber.of(-1), value.truncate());
        Assert.assertEquals(HugeNumber.of(2), HugeNumber.of(15, -1).ceiling());
        Assert.assertEquals(HugeNumber.of(2), HugeNumber.ofRational(7, 3).truncate());
    }

    @Test
    public void testDecimalEqualsAndHashCode() {
        HugeNumber a = HugeNumber.of(1230, -3);
        HugeNumber b = HugeNumber.of(123, -2);
        Assert.assertEquals(a, b);
        Assert.assertEquals(a.hashCode(), b.hashCode());
        Assert.assertNotEquals(HugeNumber.of(123, -2), HugeNumber.of(123, -3));
        Assert.assertNotEquals(HugeNumber.ZERO, HugeNumber.NEGATIVE_ZERO);
        Assert.assertNotEquals(HugeNumber.NaN, HugeNumber.NaN);
        Assert.assertEquals(HugeNumber.POSITIVE_INFINITY, HugeNumber.of(1, 40000));
        Assert.assertNotEquals(HugeNumber.of(5), "5");
    }

    @Test
    public void testDoubleValue() {
        Assert.assertEquals(1.5, HugeNumber.of(15, -1).doubleValue(), 0.0);
        Assert.assertEquals(2e42, HugeNumber.of(2, 42).doubleValue(), 1e27);
        Assert.assertTrue(Double.isNaN(HugeNumber.NaN.doubleValue()));
        Assert.assertEquals(Double.POSITIVE_INFINITY, HugeNumber.POSITIVE_INFINITY.doubleValue(), 0.0);
        Assert.assertEquals(Double.POSITIVE_INFINITY, HugeNumber.of(1, 400).doubleValue(), 0.0);
        Assert.assertTrue(Double.doubleToRawLongBits(HugeNumber.NEGATIVE_ZERO.doubleValue()) < 0);
        Assert.assertEquals(1f / 3, HugeNumber.ofRational(1, 3).floatValue(), 1e-7f);
    }

    @Test
    public void testExponentOverflowGivesInfinity() {
        Assert.assertTrue(HugeNumber.of(1, 40000).isPositiveInfinity());
        Assert.assertTrue(HugeNumber.of(-1, 40000).isNegativeInfinity());
        Assert.assertTrue(HugeNumber.of(1, HugeNumber.MAX_EXPONENT + HugeNumber.MAX_MANTISSA_DIGITS).isPositiveInfinity());
        Assert.assertTrue(HugeNumber.of(10, HugeNumber.MAX_EXPONENT).isFinite());
    }

    @Test
    public void testExponentUnderflowGivesSignedZero() {
        HugeNumber positive = HugeNumber.of(1, -40000);
        Assert.assertTrue(positive.isZero());
        Assert.assertFalse(positive.isNegativeZero());
        Assert.assertTrue(HugeNumber.of(-1, -40000).isNegativeZero());

        // digits that fall below the smallest exponent are dropped
        HugeNumber shed = HugeNumber.of(12345, HugeNumber.MIN_EXPONENT - 2);
        Assert.assertEquals(123, shed.getMantissa());
        Assert.assertEquals(HugeNumber.MIN_EXPONENT, shed.getExponent());
    }

    @Test
    public void testFactoriesFromBoxes() {
        Assert.assertEquals(HugeNumber.of(1, -1), HugeNumber.of(0.1));
        Assert.assertTrue(HugeNumber.of(Double.NaN).isNaN());
        Assert.assertTrue(HugeNumber.of(Double.NEGATIVE_INFINITY).isNegativeInfinity());
        Assert.assertTrue(HugeNumber.of(-0.0).isNegativeZero());
        Assert.assertEquals(HugeNumber.of(42), HugeNumber.of((Number) 42));
        Assert.assertEquals(HugeNumber.of(25, -1), HugeNumber.of((Number) 2.5f));
        Assert.assertEquals(
                HugeNumber.of(123456789012345679L, -8),
                HugeNumber.of(new BigDecimal("1234567890.12345678901234"))
        );
        Assert.assertEquals(HugeNumber.of(1, 30), HugeNumber.of(BigDecimal.ONE.scaleByPowerOfTen(30).toBigInteger()));
    }

    @Test(expected = NumericException.class)
    public void testFactoryRejectsNull() {
        HugeNumber.of((BigDecimal) null);
    }

    @Test
    public void testGetEpsilon() {
        Assert.assertEquals(HugeNumber.of(1, -2), HugeNumber.of(123, -2).getEpsilon());
        Assert.assertEquals(HugeNumber.EPSILON, HugeNumber.ZERO.getEpsilon());
        Assert.assertTrue(HugeNumber.POSITIVE_INFINITY.getEpsilon().isNaN());
    }

    @Test
    public void testIntegerPredicates() {
        Assert.assertTrue(HugeNumber.of(10).isInteger());
        Assert.assertTrue(HugeNumber.of(2, 42).isInteger());
        Assert.assertTrue(HugeNumber.of(-7).isInteger());
        Assert.assertTrue(HugeNumber.ZERO.isInteger());
        Assert.assertFalse(HugeNumber.of(15, -1).isInteger());
        Assert.assertFalse(HugeNumber.ofRational(1, 3).isInteger());
        Assert.assertFalse(HugeNumber.NaN.isInteger());
        Assert.assertFalse(HugeNumber.POSITIVE_INFINITY.isInteger());

        Assert.assertTrue(HugeNumber.of(4).isEvenInteger());
        Assert.assertTrue(HugeNumber.of(2, 42).isEvenInteger());
        Assert.assertTrue(HugeNumber.ZERO.isEvenInteger());
        Assert.assertTrue(HugeNumber.of(7).isOddInteger());
        Assert.assertTrue(HugeNumber.of(-7).isOddInteger());
        Assert.assertFalse(HugeNumber.of(7).isEvenInteger());
        Assert.assertFalse(HugeNumber.of(15, -1).isOddInteger());
    }

    @Test
    public void testLongValueSaturates() {
        Assert.assertEquals(123, HugeNumber.of(123456, -3).longValue());
        Assert.assertEquals(-123, HugeNumber.of(-123456, -3).longValue());
        Assert.assertEquals(Long.MAX_VALUE, HugeNumber.of(1, 30).longValue());
        Assert.assertEquals(Long.MIN_VALUE, HugeNumber.of(-1, 30).longValue());
        Assert.assertEquals(0, HugeNumber.NaN.longValue());
        Assert.assertEquals(Long.MAX_VALUE, HugeNumber.POSITIVE_INFINITY.longValue());
        Assert.assertEquals(Integer.MAX_VALUE, HugeNumber.of(1, 12).intValue());
        Assert.assertEquals(3, HugeNumber.ofRational(10, 3).intValue());
    }

    @Test
    public void testLongValueOfRationalWithPositiveExponent() {
        final HugeNumber quotient = HugeNumber.of(123456789012345678L, 2).divide(HugeNumber.of(65521));
        Assert.assertTrue(quotient.isRational());
        Assert.assertEquals(188423236843677L, quotient.longValue());
        Assert.assertEquals(-188423236843677L, quotient.negate().longValue());
        Assert.assertEquals(188423236843677L, quotient.toLongExact());
        Assert.assertEquals(1884232368436771L, HugeNumber.of(123456789012345678L, 3).divide(HugeNumber.of(65521)).longValue());

        final HugeNumber wide = HugeNumber.ofRational(100000000000000001L, 7, 2);
        Assert.assertTrue(wide.isRational());
        Assert.assertEquals(1428571428571428585L, wide.longValue());
        Assert.assertEquals(1428571428571428585L, wide.toLongExact());
        Assert.assertEquals(Long.MAX_VALUE, HugeNumber.ofRational(100000000000000001L, 7, 3).longValue());
        Assert.assertEquals(Long.MIN_VALUE, HugeNumber.ofRational(-100000000000000001L, 7, 3).longValue());
    }

    @Test
    public void testMantissaIsTruncatedToEighteenDigits() {
        HugeNumber value = HugeNumber.of(1234567890123456789L);
        Assert.assertEquals(123456789012345678L, value.getMantissa());
        Assert.assertEquals(1, value.getExponent());
        Assert.assertEquals(18, value.getMantissaDigits());
        Assert.assertEquals(18, value.getAdjustedExponent());
    }

    @Test
    public void testNegate() {
        Assert.assertEquals(HugeNumber.of(-5), HugeNumber.of(5).negate());
        Assert.assertTrue(HugeNumber.ZERO.negate().isNegativeZero());
        Assert.assertEquals(HugeNumber.ZERO, HugeNumber.NEGATIVE_ZERO.negate());
        Assert.assertTrue(HugeNumber.NaN.negate().isNaN());
        Assert.assertTrue(HugeNumber.POSITIVE_INFINITY.negate().isNegativeInfinity());
        Assert.assertEquals(HugeNumber.ofRational(-1, 3), HugeNumber.ofRational(1, 3).negate());
        Assert.assertEquals(HugeNumber.of(5), HugeNumber.of(-5).abs());
    }

    @Test
    public void testNormalizesTrailingZeros() {
        HugeNumber value = HugeNumber.of(1230, -3);
        Assert.assertEquals(123, value.getMantissa());
        Assert.assertEquals(-2, value.getExponent());

        // positive exponents are folded into the mantissa while it has room
        HugeNumber large = HugeNumber.of(2, 42);
        Assert.assertEquals(200_000_000_000_000_000L, large.getMantissa());
        Assert.assertEquals(25, large.getExponent());
        Assert.assertEquals(42, large.getAdjustedExponent());

        HugeNumber fifty = HugeNumber.of(5, 1);
        Assert.assertEquals(50, fifty.getMantissa());
        Assert.assertEquals(0, fifty.getExponent());
        Assert.assertEquals(HugeNumber.ZERO, HugeNumber.of(0, 100));
    }

    @Test
    public void testRationalEqualsAndHashCode() {
        HugeNumber a = HugeNumber.ofRational(1, 3);
        HugeNumber b = HugeNumber.ofRational(2, 6);
        Assert.assertEquals(a, b);
        Assert.assertEquals(a.hashCode(), b.hashCode());
        Assert.assertNotEquals(a, HugeNumber.ofRational(1, 3).toDecimal());
    }

    @Test
    public void testRationalFactory() {
        HugeNumber third = HugeNumber.ofRational(1, 3);
        Assert.assertEquals(1, third.getMantissa());
        Assert.assertEquals(3, third.getDenominator());
        Assert.assertEquals(0, third.getExponent());
        Assert.assertTrue(third.isRational());

        HugeNumber twoThirds = HugeNumber.ofRational(6, 9);
        Assert.assertEquals(2, twoThirds.getMantissa());
        Assert.assertEquals(3, twoThirds.getDenominator());

        // positive exponents are pulled into the numerator
        HugeNumber pulled = HugeNumber.ofRational(1, 3, 2);
        Assert.assertEquals(100, pulled.getMantissa());
        Assert.assertEquals(3, pulled.getDenominator());
        Assert.assertEquals(0, pulled.getExponent());
    }

    @Test
    public void testRationalWithDecimalFormBecomesDecimal() {
        HugeNumber half = HugeNumber.ofRational(2, 4);
        Assert.assertEquals(1, half.getDenominator());
        Assert.assertEquals(5, half.getMantissa());
        Assert.assertEquals(-1, half.getExponent());
        Assert.assertFalse(half.isRational());

        Assert.assertEquals(HugeNumber.of(-5, -1), HugeNumber.ofRational(-3, 6));
        Assert.assertEquals(HugeNumber.of(4), HugeNumber.ofRational(12, 3));
        Assert.assertEquals(HugeNumber.of(125, -3), HugeNumber.ofRational(1, 8));
    }

    @Test
    public void testRationalRejectsDenominator() {
        assertRejected(0);
        assertRejected(-3);
        assertRejected(HugeNumber.MAX_DENOMINATOR + 1);
        Assert.assertEquals(HugeNumber.MAX_DENOMINATOR, HugeNumber.ofRational(1, HugeNumber.MAX_DENOMINATOR).getDenominator());
    }

    @Test
    public void testRound() {
        Assert.assertEquals(HugeNumber.of(12, -1), HugeNumber.of(125, -2).round(1));
        Assert.assertEquals(HugeNumber.of(14, -1), HugeNumber.of(135, -2).round(1));
        Assert.assertEquals(HugeNumber.of(13, -1), HugeNumber.of(125, -2).round(1, RoundingMode.HALF_UP));
        Assert.assertEquals(HugeNumber.of(2), HugeNumber.of(25, -1).round());
        Assert.assertEquals(HugeNumber.of(333, -3), HugeNumber.ofRational(1, 3).round(3));
        Assert.assertEquals(HugeNumber.of(42), HugeNumber.of(42).round(5));
        Assert.assertTrue(HugeNumber.of(-4, -1).round().isNegativeZero());
        Assert.assertTrue(HugeNumber.NaN.round(2).isNaN());
    }

    @Test
    public void testRoundRejectsDigits() {
        try {
            HugeNumber.of(1).round(-1);
            Assert.fail();
        } catch (NumericException e) {
            Assert.assertTrue(e.getMessage().contains("digits"));
        }
        try {
            HugeNumber.of(1).round(19);
            Assert.fail();
        } catch (NumericException e) {
            Assert.assertTrue(e.getMessage().contains("digits"));
        }
        try {
            HugeNumber.of(15, -1).round(0, RoundingMode.UNNECESSARY);
            Assert.fail();
        } catch (NumericException e) {
            Assert.assertTrue(e.getMessage().contains("rounding is necessary"));
        }
    }

    @Test
    public void testSignPredicates() {
        Assert.assertEquals(0, HugeNumber.NaN.sign());
        Assert.assertEquals(0, HugeNumber.NEGATIVE_ZERO.sign());
        Assert.assertEquals(0, HugeNumber.ZERO.sign());
        Assert.assertEquals(-1, HugeNumber.NEGATIVE_INFINITY.sign());
        Assert.assertEquals(1, HugeNumber.POSITIVE_INFINITY.sign());
        Assert.assertEquals(-1, HugeNumber.of(-3).sign());
        Assert.assertEquals(-1, HugeNumber.ofRational(-1, 3).sign());

        Assert.assertTrue(HugeNumber.NEGATIVE_ZERO.isNegative());
        Assert.assertTrue(HugeNumber.NEGATIVE_INFINITY.isNegative());
        Assert.assertFalse(HugeNumber.ZERO.isNegative());
        Assert.assertFalse(HugeNumber.ZERO.isPositive());
        Assert.assertFalse(HugeNumber.NaN.isPositive());
        Assert.assertFalse(HugeNumber.NaN.isNegative());
        Assert.assertTrue(HugeNumber.POSITIVE_INFINITY.isPositive());

        Assert.assertTrue(HugeNumber.NEGATIVE_ZERO.isZero());
        Assert.assertFalse(HugeNumber.NaN.isZero());
        Assert.assertTrue(HugeNumber.POSITIVE_INFINITY.isInfinity());
        Assert.assertFalse(HugeNumber.POSITIVE_INFINITY.isFinite());
        Assert.assertFalse(HugeNumber.NaN.isFinite());
    }

    @Test
    public void testNotRational() {
        Assert.assertTrue(HugeNumber.NaN.isNotRational());
        Assert.assertTrue(HugeNumber.POSITIVE_INFINITY.isNotRational());
        Assert.assertTrue(HugeNumber.of(15, -1).isNotRational());
        Assert.assertFalse(HugeNumber.of(5).isNotRational());
        Assert.assertFalse(HugeNumber.ofRational(1, 3).isNotRational());
    }

    @Test
    public void testToBigDecimal() {
        Assert.assertEquals(0, new BigDecimal("12.3").compareTo(HugeNumber.of(123, -1).toBigDecimal()));
        Assert.assertEquals(0, new BigDecimal("0.3333333333333333333333333333333333").compareTo(HugeNumber.ofRational(1, 3).toBigDecimal()));
        try {
            HugeNumber.NaN.toBigDecimal();
            Assert.fail();
        } catch (NumericException e) {
            Assert.assertEquals("cannot convert NaN to BigDecimal", e.getMessage());
        }
    }

    @Test
    public void testToDecimal() {
        HugeNumber third = HugeNumber.ofRational(1, 3).toDecimal();
        Assert.assertEquals(333333333333333333L, third.getMantissa());
        Assert.assertEquals(-18, third.getExponent());
        Assert.assertEquals(1, third.getDenominator());

        HugeNumber twoThirds = HugeNumber.ofRational(2, 3).toDecimal();
        Assert.assertEquals(666666666666666667L, twoThirds.getMantissa());
        Assert.assertSame(HugeNumber.NaN, HugeNumber.NaN.toDecimal());
    }

    @Test
    public void testToLongExact() {
        Assert.assertEquals(123, HugeNumber.of(123456, -3).toLongExact());
        Assert.assertEquals(999_999_999_999_999_999L, HugeNumber.of(999_999_999_999_999_999L).toLongExact());
        Assert.assertEquals(42, HugeNumber.of(42).toIntExact());
        try {
            HugeNumber.of(1, 30).toLongExact();
            Assert.fail();
        } catch (NumericException e) {
            Assert.assertTrue(e.getMessage().startsWith("value is out of long range"));
        }
        try {
            HugeNumber.ofRational(100000000000000001L, 7, 3).toLongExact();
            Assert.fail();
        } catch (NumericException e) {
            Assert.assertTrue(e.getMessage().startsWith("value is out of long range"));
        }
        try {
            HugeNumber.of(1, 12).toIntExact();
            Assert.fail();
        } catch (NumericException e) {
            Assert.assertTrue(e.getMessage().startsWith("value is out of int range"));
        }
        try {
            HugeNumber.POSITIVE_INFINITY.toLongExact();
            Assert.fail();
        } catch (NumericException e) {
            Assert.assertEquals("cannot convert Infinity to long", e.getMessage());
        }
    }

    private static void assertRejected(int denominator) {
        try {
            HugeNumber.ofRational(1, denominator);
            Assert.fail();
        } catch (NumericException e) {
            Assert.assertTrue(e.getMessage().startsWith("denominator is out of range"));
        }
    }
}
