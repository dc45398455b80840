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

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Exact fraction arithmetic behind {@link HugeNumber}. A fraction is
 * {@code numerator / denominator * 10^exponent}, reduced by the greatest common factor.
 */
final class Rationals {
    // widest exponent gap for which fraction sums are computed exactly
    private static final int MAX_EXACT_EXPONENT_GAP = 36;
    private static final BigInteger MAX_DENOMINATOR = BigInteger.valueOf(HugeNumber.MAX_DENOMINATOR);
    private static final BigInteger MAX_MANTISSA = BigInteger.valueOf(HugeNumber.MAX_MANTISSA);

    private Rationals() {
    }

    /**
     * Sum of two finite, nonzero numbers of which at least one is a fraction.
     */
    static HugeNumber add(HugeNumber left, HugeNumber right) {
        final int exponent = Math.min(left.getExponent(), right.getExponent());
        if (Math.max(left.getExponent(), right.getExponent()) - exponent > MAX_EXACT_EXPONENT_GAP) {
            return HugeNumber.add(left.toDecimal(), right.toDecimal());
        }
        final BigInteger leftDenominator = BigInteger.valueOf(left.getDenominator());
        final BigInteger rightDenominator = BigInteger.valueOf(right.getDenominator());
        final BigInteger numerator = BigInteger.valueOf(left.getMantissa())
                .multiply(BigInteger.TEN.pow(left.getExponent() - exponent))
                .multiply(rightDenominator)
                .add(BigInteger.valueOf(right.getMantissa())
                        .multiply(BigInteger.TEN.pow(right.getExponent() - exponent))
                        .multiply(leftDenominator));
        return exact(numerator, leftDenominator.multiply(rightDenominator), exponent);
    }

    /**
     * Canonical form of a fraction with a 64-bit numerator and a positive denominator. Fractions that
     * reduce to a denominator of one, or to a denominator made of twos and fives whose decimal form fits
     * in 18 digits, become decimals. Fractions that do not fit the mantissa or denominator bounds are
     * divided out to the nearest decimal.
     */
    static HugeNumber canonical(long numerator, long denominator, long exponent) {
        if (numerator == 0) {
            return HugeNumber.ZERO;
        }
        final long gcd = Numbers.gcd(numerator, denominator);
        if (gcd > 1) {
            numerator /= gcd;
            denominator /= gcd;
        }
        if (denominator == 1) {
            return HugeNumber.decimal(numerator, exponent);
        }

        final int decimalPlaces = decimalPlacesOf(denominator);
        if (decimalPlaces > -1) {
            final long multiplier = Numbers.TEN_POWERS_TABLE[decimalPlaces] / denominator;
            if (Math.abs(numerator) <= HugeNumber.MAX_MANTISSA / multiplier) {
                return HugeNumber.decimal(numerator * multiplier, exponent - decimalPlaces);
            }
        }

        if (denominator > HugeNumber.MAX_DENOMINATOR || Math.abs(numerator) > HugeNumber.MAX_MANTISSA) {
            return divideOut(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator), exponent);
        }

        // pull a positive exponent into the numerator while it has room
        while (exponent > 0 && Math.abs(numerator) <= Numbers.MAX_SAFE_MULTIPLY[1]) {
            numerator *= 10;
            exponent--;
            final long factor = Numbers.gcd(numerator, denominator);
            if (factor > 1) {
                numerator /= factor;
                denominator /= factor;
            }
        }
        while (exponent < 0 && numerator % 10 == 0) {
            numerator /= 10;
            exponent++;
        }

        if (exponent > HugeNumber.MAX_EXPONENT) {
            return HugeNumber.infinity(numerator < 0);
        }
        if (exponent < HugeNumber.MIN_EXPONENT) {
            return divideOut(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator), exponent);
        }
        return HugeNumber.rational(numerator, (int) denominator, (int) exponent);
    }

    /**
     * Canonical form of an arbitrarily large fraction.
     */
    static HugeNumber exact(BigInteger numerator, BigInteger denominator, long exponent) {
        if (numerator.signum() == 0) {
            return HugeNumber.ZERO;
        }
        final BigInteger gcd = numerator.gcd(denominator);
        if (!BigInteger.ONE.equals(gcd)) {
            numerator = numerator.divide(gcd);
            denominator = denominator.divide(gcd);
        }
        while (numerator.abs().compareTo(MAX_MANTISSA) > 0) {
            final BigInteger[] qr = numerator.divideAndRemainder(BigInteger.TEN);
            if (qr[1].signum() != 0) {
                break;
            }
            numerator = qr[0];
            exponent++;
        }
        if (denominator.compareTo(MAX_DENOMINATOR) <= 0 && numerator.abs().compareTo(MAX_MANTISSA) <= 0) {
            return canonical(numerator.longValue(), denominator.longValue(), exponent);
        }
        return divideOut(numerator, denominator, exponent);
    }

    /**
     * Remainder of two finite numbers, dividend nonzero and divisor nonzero. The truncated remainder has
     * the sign of the dividend; with {@code roundHalfEven} the quotient is rounded to the nearest integer
     * instead, ties to even, as IEEE 754 prescribes.
     */
    static HugeNumber remainder(HugeNumber dividend, HugeNumber divisor, boolean roundHalfEven) {
        final int exponent = Math.min(dividend.getExponent(), divisor.getExponent());
        final BigInteger dividendDenominator = BigInteger.valueOf(dividend.getDenominator());
        final BigInteger divisorDenominator = BigInteger.valueOf(divisor.getDenominator());
        final BigInteger x = BigInteger.valueOf(dividend.getMantissa())
                .multiply(divisorDenominator)
                .multiply(BigInteger.TEN.pow(dividend.getExponent() - exponent));
        final BigInteger y = BigInteger.valueOf(divisor.getMantissa())
                .multiply(dividendDenominator)
                .multiply(BigInteger.TEN.pow(divisor.getExponent() - exponent));
        final BigInteger[] qr = x.divideAndRemainder(y);
        BigInteger remainder = qr[1];
        if (roundHalfEven && remainder.signum() != 0) {
            final int half = remainder.abs().shiftLeft(1).compareTo(y.abs());
            if (half > 0 || (half == 0 && qr[0].testBit(0))) {
                remainder = x.signum() < 0 ? remainder.add(y.abs()) : remainder.subtract(y.abs());
            }
        }
        return exact(remainder, dividendDenominator.multiply(divisorDenominator), exponent);
    }

    /**
     * Number of decimal places of 1/denominator when the denominator only has the prime factors
     * two and five, -1 otherwise or when there are more than 18 places.
     */
    private static int decimalPlacesOf(long denominator) {
        int twos = 0;
        while ((denominator & 1) == 0) {
            denominator >>= 1;
            twos++;
        }
        int fives = 0;
        while (denominator % 5 == 0) {
            denominator /= 5;
            fives++;
        }
        if (denominator != 1) {
            return -1;
        }
        final int places = Math.max(twos, fives);
        return places <= HugeNumber.MAX_MANTISSA_DIGITS ? places : -1;
    }

    private static HugeNumber divideOut(BigInteger numerator, BigInteger denominator, long exponent) {
        return HugeNumber.decimal(
                new BigDecimal(numerator).divide(new BigDecimal(denominator), HugeNumber.WIDE_CONTEXT),
                exponent
        );
    }
}
