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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Iterator;
import java.util.NoSuchElementException;

import static io.hugenumber.std.HugeNumber.*;

/**
 * Logarithms, powers, exponentials, roots, circular and hyperbolic functions of {@link HugeNumber}, along with
 * interpolation and aggregates over collections.
 * <p>
 * Like the arithmetic operators, these functions never throw: arguments outside of the domain give NaN.
 * Note that {@code log(0)} is positive infinity, not negative infinity. The exceptions are
 * {@link #average(Iterable)}, {@link #max(Iterable)} and {@link #min(Iterable)}, which reject empty collections.
 */
public final class HugeMath {
    /**
     * Upper bound on the number of terms evaluated by each series.
     */
    public static final int MAX_SERIES_ITERATIONS = 10_000;
    private static final Logger LOG = LoggerFactory.getLogger(HugeMath.class);
    // beyond these arguments exp() over- or underflows the exponent range
    private static final HugeNumber MAX_EXP_ARGUMENT = HugeNumber.of(75500);
    private static final HugeNumber MIN_EXP_ARGUMENT = HugeNumber.of(-75500);
    // integer powers up to this magnitude are computed by repeated squaring
    private static final HugeNumber MAX_SQUARING_POWER = HugeNumber.of(1L << 31);
    private static final MathContext SERIES_CONTEXT = new MathContext(40, RoundingMode.HALF_EVEN);
    private static final BigDecimal PI_DIGITS = new BigDecimal(
            "3.1415926535897932384626433832795028841971693993751058209749445923078164062862089986280348253421170679"
                    + "8214808651328230664709384460955058223172535940812848111745028410270193852110555964462294895493038196"
    );
    private static final BigDecimal SERIES_PI = PI_DIGITS.round(SERIES_CONTEXT);
    private static final BigDecimal SERIES_HALF_PI = PI_DIGITS.divide(BigDecimal.valueOf(2), SERIES_CONTEXT);
    private static final BigDecimal ATAN_SERIES_LIMIT = new BigDecimal("0.1");
    // the reduction of sin, cos and tan arguments keeps 40 digits below the decimal point
    private static final HugeNumber MAX_REDUCIBLE_ARGUMENT = HugeNumber.of(1, 151);
    private static final MathContext REDUCTION_CONTEXT = new MathContext(PI_DIGITS.precision(), RoundingMode.HALF_EVEN);
    // above this asinh(x) and acosh(x) are log(2x) to 18 digits
    private static final HugeNumber LOG_ASYMPTOTE = HugeNumber.of(1, 9);
    private static final HugeNumber TANH_SATURATION = HugeNumber.of(25);
    private static final int SIN = 0;
    private static final int COS = 1;
    private static final int TAN = 2;

    private HugeMath() {
    }

    /**
     * Arc cosine in [0, pi]. Arguments outside of [-1, 1] give NaN.
     */
    public static HugeNumber acos(HugeNumber value) {
        if (value.isNaN() || value.abs().compareTo(ONE) > 0) {
            return NaN;
        }
        if (value.compareTo(ONE) == 0) {
            return ZERO;
        }
        if (value.compareTo(NEGATIVE_ONE) == 0) {
            return HugeNumberConstants.PI;
        }
        if (value.isZero()) {
            return HugeNumberConstants.HALF_PI;
        }
        return HugeNumber.of(arccos(toBigDecimal(value)));
    }

    /**
     * Inverse hyperbolic cosine. Arguments below one give NaN.
     */
    public static HugeNumber acosh(HugeNumber value) {
        if (value.isNaN() || value.compareTo(ONE) < 0) {
            return NaN;
        }
        if (value.isPositiveInfinity()) {
            return value;
        }
        if (value.compareTo(ONE) == 0) {
            return ZERO;
        }
        if (value.compareTo(LOG_ASYMPTOTE) > 0) {
            return add(log(value), HugeNumberConstants.LN2);
        }
        // acosh(x) = asinh(sqrt(x^2 - 1)), with x^2 - 1 taken exactly
        final BigDecimal x = toBigDecimal(value);
        return asinh(HugeNumber.of(x.multiply(x).subtract(BigDecimal.ONE).sqrt(SERIES_CONTEXT)));
    }

    /**
     * {@code acos(value) / pi}, in [0, 1]. Exact for -1, 0 and 1.
     */
    public static HugeNumber acosPi(HugeNumber value) {
        if (value.isNaN() || value.abs().compareTo(ONE) > 0) {
            return NaN;
        }
        if (value.compareTo(ONE) == 0) {
            return ZERO;
        }
        if (value.compareTo(NEGATIVE_ONE) == 0) {
            return ONE;
        }
        if (value.isZero()) {
            return HugeNumberConstants.HALF;
        }
        return HugeNumber.of(arccos(toBigDecimal(value)).divide(SERIES_PI, SERIES_CONTEXT));
    }

    /**
     * Arc sine in [-pi/2, pi/2]. Arguments outside of [-1, 1] give NaN.
     */
    public static HugeNumber asin(HugeNumber value) {
        if (value.isNaN() || value.isZero()) {
            return value;
        }
        final int magnitude = value.abs().compareTo(ONE);
        if (magnitude > 0) {
            return NaN;
        }
        if (magnitude == 0) {
            return negateIf(HugeNumberConstants.HALF_PI, value.isNegative());
        }
        return HugeNumber.of(arcsin(toBigDecimal(value)));
    }

    /**
     * Inverse hyperbolic sine.
     */
    public static HugeNumber asinh(HugeNumber value) {
        if (value.isNaN() || value.isInfinity() || value.isZero()) {
            return value;
        }
        final HugeNumber magnitude = value.abs();
        final HugeNumber result;
        if (magnitude.compareTo(HugeNumberConstants.HALF) < 0) {
            result = HugeNumber.of(asinhSeries(toBigDecimal(magnitude)));
        } else if (magnitude.compareTo(LOG_ASYMPTOTE) > 0) {
            result = add(log(magnitude), HugeNumberConstants.LN2);
        } else {
            result = log(add(magnitude, sqrt(add(square(magnitude), ONE))));
        }
        return negateIf(result, value.isNegative());
    }

    /**
     * {@code asin(value) / pi}, in [-1/2, 1/2]. Exact for -1, 0 and 1.
     */
    public static HugeNumber asinPi(HugeNumber value) {
        if (value.isNaN() || value.isZero()) {
            return value;
        }
        final int magnitude = value.abs().compareTo(ONE);
        if (magnitude > 0) {
            return NaN;
        }
        if (magnitude == 0) {
            return negateIf(HugeNumberConstants.HALF, value.isNegative());
        }
        return HugeNumber.of(arcsin(toBigDecimal(value)).divide(SERIES_PI, SERIES_CONTEXT));
    }

    /**
     * Arc tangent in [-pi/2, pi/2].
     */
    public static HugeNumber atan(HugeNumber value) {
        if (value.isNaN() || value.isZero()) {
            return value;
        }
        if (value.isInfinity()) {
            return negateIf(HugeNumberConstants.HALF_PI, value.isNegative());
        }
        return HugeNumber.of(arctan(toBigDecimal(value)));
    }

    /**
     * Angle of the point {@code (x, y)} in [-pi, pi]. Zeros and infinities follow {@link Math#atan2(double, double)}:
     * <ul>
     * <li>a zero {@code y} keeps its sign for a positive {@code x} or positive zero, and gives ±pi for a
     * negative {@code x} or negative zero</li>
     * <li>an infinite {@code y} gives ±pi/4 or ±3pi/4 against an infinite {@code x}, ±pi/2 otherwise</li>
     * <li>a finite {@code y} gives ±pi/2 against a zero {@code x}, ±0 against positive infinity and ±pi against
     * negative infinity</li>
     * </ul>
     */
    public static HugeNumber atan2(HugeNumber y, HugeNumber x) {
        if (y.isNaN() || x.isNaN()) {
            return NaN;
        }
        final boolean negative = y.isNegative();
        if (y.isZero()) {
            return x.isNegative() ? negateIf(HugeNumberConstants.PI, negative) : y;
        }
        if (y.isInfinity()) {
            if (x.isPositiveInfinity()) {
                return negateIf(HugeNumberConstants.QUARTER_PI, negative);
            }
            if (x.isNegativeInfinity()) {
                return negateIf(HugeNumberConstants.THREE_QUARTERS_PI, negative);
            }
            return negateIf(HugeNumberConstants.HALF_PI, negative);
        }
        if (x.isZero()) {
            return negateIf(HugeNumberConstants.HALF_PI, negative);
        }
        if (x.isPositiveInfinity()) {
            return zero(negative);
        }
        if (x.isNegativeInfinity()) {
            return negateIf(HugeNumberConstants.PI, negative);
        }
        final BigDecimal ratio = toBigDecimal(y.abs()).divide(toBigDecimal(x.abs()), SERIES_CONTEXT);
        BigDecimal angle = arctan(ratio);
        if (x.isNegative()) {
            angle = SERIES_PI.subtract(angle, SERIES_CONTEXT);
        }
        return negateIf(HugeNumber.of(angle), negative);
    }

    /**
     * Inverse hyperbolic tangent. ±1 give the infinities, arguments beyond them NaN.
     */
    public static HugeNumber atanh(HugeNumber value) {
        if (value.isNaN() || value.isZero()) {
            return value;
        }
        final HugeNumber magnitude = value.abs();
        final int comparison = magnitude.compareTo(ONE);
        if (comparison > 0) {
            return NaN;
        }
        if (comparison == 0) {
            return infinity(value.isNegative());
        }
        final HugeNumber result;
        if (magnitude.compareTo(HugeNumberConstants.HALF) < 0) {
            result = HugeNumber.of(oddPowerSeries(toBigDecimal(magnitude), false));
        } else {
            result = multiply(log(divide(add(ONE, magnitude), subtract(ONE, magnitude))), HugeNumberConstants.HALF);
        }
        return negateIf(result, value.isNegative());
    }

    /**
     * {@code atan(value) / pi}, in [-1/2, 1/2]. Exact for the infinities and ±1.
     */
    public static HugeNumber atanPi(HugeNumber value) {
        if (value.isNaN() || value.isZero()) {
            return value;
        }
        if (value.isInfinity()) {
            return negateIf(HugeNumberConstants.HALF, value.isNegative());
        }
        if (value.abs().compareTo(ONE) == 0) {
            return negateIf(HugeNumberConstants.FOURTH, value.isNegative());
        }
        return HugeNumber.of(arctan(toBigDecimal(value)).divide(SERIES_PI, SERIES_CONTEXT));
    }

    /**
     * Arithmetic mean of the values.
     *
     * @throws NoSuchElementException when there are no values
     */
    public static HugeNumber average(@NotNull Iterable<HugeNumber> values) {
        HugeNumber sum = ZERO;
        long count = 0;
        for (HugeNumber value : values) {
            sum = add(sum, value);
            count++;
        }
        if (count == 0) {
            throw new NoSuchElementException("cannot average an empty collection");
        }
        return divide(sum, HugeNumber.of(count));
    }

    public static HugeNumber cbrt(HugeNumber value) {
        return rootN(value, 3);
    }

    /**
     * Cosine of an angle in radians. NaN and the infinities give NaN, as do arguments of magnitude
     * {@code 10^151} and beyond, whose phase cannot be resolved.
     */
    public static HugeNumber cos(HugeNumber value) {
        if (value.isNaN() || value.isInfinity()) {
            return NaN;
        }
        if (value.isZero()) {
            return ONE;
        }
        final BigDecimal radians = radians(value);
        return radians == null ? NaN : circular(radians, COS);
    }

    public static HugeNumber cosh(HugeNumber value) {
        if (value.isNaN()) {
            return NaN;
        }
        if (value.isInfinity()) {
            return POSITIVE_INFINITY;
        }
        if (value.isZero()) {
            return ONE;
        }
        if (value.abs().compareTo(ONE) < 0) {
            return HugeNumber.of(taylor(toBigDecimal(value), 0, false));
        }
        final HugeNumber exponential = exp(value);
        return multiply(add(exponential, divide(ONE, exponential)), HugeNumberConstants.HALF);
    }

    /**
     * {@code cos(value * pi)}, exact at multiples of one half.
     */
    public static HugeNumber cosPi(HugeNumber value) {
        if (value.isNaN() || value.isInfinity()) {
            return NaN;
        }
        final HugeNumber turn = mod(value.abs(), TWO);
        if (turn.isZero()) {
            return ONE;
        }
        if (turn.compareTo(ONE) == 0) {
            return NEGATIVE_ONE;
        }
        if (turn.compareTo(HugeNumberConstants.HALF) == 0
                || turn.compareTo(HugeNumberConstants.THREE_HALVES) == 0) {
            return ZERO;
        }
        return circular(timesPi(turn), COS);
    }

    /**
     * e raised to {@code value}. The argument is split into its integral part, raised by repeated squaring
     * of e, and a fractional part evaluated by the Taylor series.
     */
    public static HugeNumber exp(HugeNumber value) {
        if (value.isNaN() || value.isPositiveInfinity()) {
            return value;
        }
        if (value.isNegativeInfinity()) {
            return ZERO;
        }
        if (value.isZero()) {
            return ONE;
        }
        if (value.equals(ONE)) {
            return HugeNumberConstants.E;
        }
        if (value.compareTo(MAX_EXP_ARGUMENT) > 0) {
            return POSITIVE_INFINITY;
        }
        if (value.compareTo(MIN_EXP_ARGUMENT) < 0) {
            return ZERO;
        }
        if (value.isNegative()) {
            return divide(ONE, exp(value.negate()));
        }

        final HugeNumber integral = value.truncate();
        final HugeNumber fraction = subtract(value, integral).toDecimal();
        HugeNumber result = ONE;
        if (!fraction.isZero()) {
            HugeNumber term = ONE;
            int k = 1;
            for (; k <= MAX_SERIES_ITERATIONS; k++) {
                term = divide(multiply(term, fraction), HugeNumber.of(k)).toDecimal();
                final HugeNumber next = add(result, term);
                if (next.equals(result)) {
                    break;
                }
                result = next;
            }
            if (k > MAX_SERIES_ITERATIONS) {
                LOG.debug("exp series did not converge [value={}, iterations={}]", value, MAX_SERIES_ITERATIONS);
            }
        }
        if (integral.isZero()) {
            return result;
        }
        return multiply(powInteger(HugeNumberConstants.E, integral.longValue()), result);
    }

    /**
     * 2 raised to {@code value}.
     */
    public static HugeNumber exp2(HugeNumber value) {
        return pow(TWO, value);
    }

    /**
     * 10 raised to {@code value}, exact for integers.
     */
    public static HugeNumber exp10(HugeNumber value) {
        if (value.isInteger()) {
            final long exponent = value.longValue();
            if (exponent > MAX_EXPONENT + MAX_MANTISSA_DIGITS) {
                return POSITIVE_INFINITY;
            }
            if (exponent < MIN_EXPONENT - MAX_MANTISSA_DIGITS) {
                return ZERO;
            }
            return HugeNumber.of(1, (int) exponent);
        }
        return pow(TEN, value);
    }

    /**
     * {@code sqrt(x * x + y * y)}.
     */
    public static HugeNumber hypot(HugeNumber x, HugeNumber y) {
        if (x.isInfinity() || y.isInfinity()) {
            return POSITIVE_INFINITY;
        }
        return sqrt(add(square(x), square(y)));
    }

    /**
     * Position of {@code value} between {@code first} and {@code second}, the inverse of
     * {@link #lerp(HugeNumber, HugeNumber, HugeNumber)}. When both ends coincide the result is one half for
     * {@code value} equal to them and NaN otherwise.
     */
    public static HugeNumber inverseLerp(HugeNumber first, HugeNumber second, HugeNumber value) {
        final HugeNumber offset = subtract(value, first);
        final HugeNumber difference = subtract(second, first);
        if (difference.isZero()) {
            return offset.isZero() ? HugeNumberConstants.HALF : NaN;
        }
        return divide(offset, difference);
    }

    /**
     * Linear interpolation {@code first + (second - first) * amount}.
     */
    public static HugeNumber lerp(HugeNumber first, HugeNumber second, HugeNumber amount) {
        return add(first, multiply(subtract(second, first), amount));
    }

    /**
     * Natural logarithm.
     * <table>
     * <caption>Special values</caption>
     * <tr><th>value</th><th>result</th></tr>
     * <tr><td>NaN, negative, negative infinity</td><td>NaN</td></tr>
     * <tr><td>zero, negative zero</td><td>positive infinity</td></tr>
     * <tr><td>positive infinity</td><td>positive infinity</td></tr>
     * <tr><td>one</td><td>zero</td></tr>
     * </table>
     * The mantissa is brought into [1, 10) and {@code ln(z) = 2 * sum((z-1)/(z+1))^(2k+1) / (2k+1)} is summed
     * until the partial sums stop changing, then {@code exponent * ln(10)} is added.
     */
    public static HugeNumber log(HugeNumber value) {
        if (value.isNaN() || value.sign() < 0) {
            return NaN;
        }
        if (value.isZero() || value.isPositiveInfinity()) {
            return POSITIVE_INFINITY;
        }
        if (value.equals(ONE)) {
            return ZERO;
        }

        double z = (double) value.getMantissa() / value.getDenominator();
        long exponent = value.getExponent();
        while (z >= 10) {
            z /= 10;
            exponent++;
        }
        while (z < 1) {
            z *= 10;
            exponent--;
        }

        final double y = (z - 1) / (z + 1);
        final double ySquared = y * y;
        double power = y;
        double sum = 0;
        int k = 0;
        for (; k < MAX_SERIES_ITERATIONS; k++) {
            final double next = sum + power / (2 * k + 1);
            if (next == sum) {
                break;
            }
            sum = next;
            power *= ySquared;
        }
        if (k == MAX_SERIES_ITERATIONS) {
            LOG.debug("log series did not converge [value={}, iterations={}]", value, MAX_SERIES_ITERATIONS);
        }

        final HugeNumber mantissaLog = HugeNumber.of(2 * sum);
        if (exponent == 0) {
            return mantissaLog;
        }
        return add(mantissaLog, multiply(HugeNumber.of(exponent), HugeNumberConstants.LN10));
    }

    /**
     * Logarithm of {@code value} in {@code base}.
     * <table>
     * <caption>Special values</caption>
     * <tr><th>value</th><th>base</th><th>result</th></tr>
     * <tr><td>NaN or negative</td><td>any</td><td>NaN</td></tr>
     * <tr><td>any</td><td>NaN or one</td><td>NaN</td></tr>
     * <tr><td>not one</td><td>zero or an infinity</td><td>NaN</td></tr>
     * <tr><td>one</td><td>zero or an infinity</td><td>zero</td></tr>
     * <tr><td>zero or positive infinity</td><td>any other</td><td>positive infinity</td></tr>
     * </table>
     */
    public static HugeNumber log(HugeNumber value, HugeNumber base) {
        if (value.isNaN()
                || base.isNaN()
                || base.equals(ONE)
                || value.sign() < 0
                || (!value.equals(ONE) && (base.isZero() || base.isInfinity()))) {
            return NaN;
        }
        if (value.equals(ONE)) {
            return ZERO;
        }
        if (value.isZero() || value.isPositiveInfinity()) {
            return POSITIVE_INFINITY;
        }
        return divide(log(value), log(base));
    }

    /**
     * Base 10 logarithm, exact for powers of ten.
     */
    public static HugeNumber log10(HugeNumber value) {
        if (value.isFinite()
                && value.getDenominator() == 1
                && value.getMantissa() > 0
                && Numbers.isPowerOfTen(value.getMantissa())) {
            return HugeNumber.of(value.getAdjustedExponent());
        }
        final HugeNumber log = log(value);
        return log.isFinite() ? divide(log, HugeNumberConstants.LN10) : log;
    }

    /**
     * {@code log10(value + 1)}.
     */
    public static HugeNumber log10P1(HugeNumber value) {
        return log10(add(value, ONE));
    }

    public static HugeNumber log2(HugeNumber value) {
        final HugeNumber log = log(value);
        return log.isFinite() ? divide(log, HugeNumberConstants.LN2) : log;
    }

    /**
     * {@code log2(value + 1)}.
     */
    public static HugeNumber log2P1(HugeNumber value) {
        return log2(add(value, ONE));
    }

    /**
     * {@code log(value + 1)}.
     */
    public static HugeNumber logP1(HugeNumber value) {
        return log(add(value, ONE));
    }

    /**
     * Largest of the values, NaN when any of them is NaN.
     *
     * @throws NoSuchElementException when there are no values
     */
    public static HugeNumber max(@NotNull Iterable<HugeNumber> values) {
        final Iterator<HugeNumber> iterator = values.iterator();
        if (!iterator.hasNext()) {
            throw new NoSuchElementException("cannot take the maximum of an empty collection");
        }
        HugeNumber max = iterator.next();
        while (iterator.hasNext()) {
            max = HugeNumber.max(max, iterator.next());
        }
        return max;
    }

    /**
     * Smallest of the values, NaN when any of them is NaN.
     *
     * @throws NoSuchElementException when there are no values
     */
    public static HugeNumber min(@NotNull Iterable<HugeNumber> values) {
        final Iterator<HugeNumber> iterator = values.iterator();
        if (!iterator.hasNext()) {
            throw new NoSuchElementException("cannot take the minimum of an empty collection");
        }
        HugeNumber min = iterator.next();
        while (iterator.hasNext()) {
            min = HugeNumber.min(min, iterator.next());
        }
        return min;
    }

    /**
     * {@code value} raised to {@code exponent}, resolved through a cascade of identities:
     * <ul>
     * <li>NaN operands give NaN, a zero exponent gives one</li>
     * <li>a zero base gives zero, or positive infinity for negative exponents</li>
     * <li>infinite bases and exponents follow IEEE 754 {@code pow}</li>
     * <li>a negative base gives NaN for non-integral exponents and {@code ±pow(|value|, exponent)} by parity
     * otherwise</li>
     * <li>negative exponents give {@code 1 / pow(value, -exponent)}</li>
     * <li>integral exponents are raised by repeated squaring, the square and cube through
     * {@link HugeNumber#square(HugeNumber)} and {@link HugeNumber#cube(HugeNumber)}</li>
     * <li>everything else is {@code exp(exponent * log(value))}</li>
     * </ul>
     */
    public static HugeNumber pow(HugeNumber value, HugeNumber exponent) {
        if (value.isNaN() || exponent.isNaN()) {
            return NaN;
        }
        if (exponent.isZero()) {
            return ONE;
        }
        if (value.isZero()) {
            return exponent.isNegative() ? POSITIVE_INFINITY : ZERO;
        }
        if (value.equals(ONE)) {
            return ONE;
        }
        if (exponent.equals(ONE)) {
            return value;
        }
        if (exponent.isInfinity()) {
            final int magnitude = value.abs().compareTo(ONE);
            if (magnitude == 0) {
                return ONE;
            }
            if (exponent.isPositiveInfinity()) {
                return magnitude > 0 ? POSITIVE_INFINITY : ZERO;
            }
            return magnitude > 0 ? ZERO : POSITIVE_INFINITY;
        }
        if (value.isPositiveInfinity()) {
            return exponent.isNegative() ? ZERO : POSITIVE_INFINITY;
        }
        if (value.isNegativeInfinity()) {
            final boolean odd = exponent.isOddInteger();
            if (exponent.isNegative()) {
                return odd ? NEGATIVE_ZERO : ZERO;
            }
            return odd ? NEGATIVE_INFINITY : POSITIVE_INFINITY;
        }
        if (value.isNegative()) {
            if (!exponent.isInteger()) {
                return NaN;
            }
            final HugeNumber result = pow(value.negate(), exponent);
            return exponent.isOddInteger() ? result.negate() : result;
        }
        if (exponent.isNegative()) {
            return divide(ONE, pow(value, exponent.negate()));
        }
        if (exponent.isInteger() && exponent.compareTo(MAX_SQUARING_POWER) <= 0) {
            return powInteger(value, exponent.longValue());
        }
        return exp(multiply(exponent, log(value)));
    }

    /**
     * The {@code n}th root. Even roots of negative numbers are NaN, odd roots keep the sign.
     */
    public static HugeNumber rootN(HugeNumber value, int n) {
        if (n < 1) {
            return NaN;
        }
        if (n == 1 || value.isNaN() || value.isZero()) {
            return value;
        }
        if (value.isNegative()) {
            return (n & 1) == 0 ? NaN : rootN(value.negate(), n).negate();
        }
        if (value.isInfinity()) {
            return value;
        }
        // the estimate from exp/log is refined by Newton's method in 34 digits
        final HugeNumber estimate = exp(divide(log(value), HugeNumber.of(n)));
        if (!estimate.isFinite() || estimate.isZero()) {
            return estimate;
        }
        final BigDecimal x = value.toWideDecimal();
        final BigDecimal order = BigDecimal.valueOf(n);
        final BigDecimal orderLessOne = BigDecimal.valueOf(n - 1);
        BigDecimal y = estimate.toWideDecimal();
        for (int i = 0; i < 4; i++) {
            final BigDecimal power = y.pow(n - 1, WIDE_CONTEXT);
            y = orderLessOne.multiply(y).add(x.divide(power, WIDE_CONTEXT)).divide(order, WIDE_CONTEXT);
        }
        return HugeNumber.of(y);
    }

    /**
     * Sine of an angle in radians. NaN and the infinities give NaN, as do arguments of magnitude
     * {@code 10^151} and beyond, whose phase cannot be resolved. The argument is reduced by the nearest
     * multiple of pi/2, using as many digits of pi as its integral part needs, and the remainder goes
     * through the Taylor series in 40 digits.
     */
    public static HugeNumber sin(HugeNumber value) {
        if (value.isNaN() || value.isInfinity()) {
            return NaN;
        }
        if (value.isZero()) {
            return value;
        }
        final BigDecimal radians = radians(value);
        return radians == null ? NaN : circular(radians, SIN);
    }

    public static HugeNumber sinh(HugeNumber value) {
        if (value.isNaN() || value.isInfinity() || value.isZero()) {
            return value;
        }
        if (value.abs().compareTo(ONE) < 0) {
            return HugeNumber.of(taylor(toBigDecimal(value), 1, false));
        }
        final HugeNumber exponential = exp(value);
        return multiply(subtract(exponential, divide(ONE, exponential)), HugeNumberConstants.HALF);
    }

    /**
     * {@code sin(value * pi)}, exact at multiples of one half. Integers give a zero with the sign of
     * {@code value}.
     */
    public static HugeNumber sinPi(HugeNumber value) {
        if (value.isNaN() || value.isInfinity()) {
            return NaN;
        }
        if (value.isZero() || value.isInteger()) {
            return zero(value.isNegative());
        }
        final HugeNumber turn = mod(value.abs(), TWO);
        final HugeNumber result;
        if (turn.compareTo(HugeNumberConstants.HALF) == 0) {
            result = ONE;
        } else if (turn.compareTo(HugeNumberConstants.THREE_HALVES) == 0) {
            result = NEGATIVE_ONE;
        } else {
            result = circular(timesPi(turn), SIN);
        }
        return negateIf(result, value.isNegative());
    }

    /**
     * Square root. Negative numbers give NaN, negative zero gives negative zero.
     */
    public static HugeNumber sqrt(HugeNumber value) {
        if (value.isNaN() || value.isZero() || value.isPositiveInfinity()) {
            return value;
        }
        if (value.isNegative()) {
            return NaN;
        }
        return HugeNumber.of(value.toWideDecimal().sqrt(WIDE_CONTEXT));
    }

    /**
     * Sum of the values, zero when there are none.
     */
    public static HugeNumber sum(@NotNull Iterable<HugeNumber> values) {
        HugeNumber sum = ZERO;
        for (HugeNumber value : values) {
            sum = add(sum, value);
        }
        return sum;
    }

    /**
     * Tangent of an angle in radians, with the same domain as {@link #sin(HugeNumber)}.
     */
    public static HugeNumber tan(HugeNumber value) {
        if (value.isNaN() || value.isInfinity()) {
            return NaN;
        }
        if (value.isZero()) {
            return value;
        }
        final BigDecimal radians = radians(value);
        return radians == null ? NaN : circular(radians, TAN);
    }

    public static HugeNumber tanh(HugeNumber value) {
        if (value.isNaN() || value.isZero()) {
            return value;
        }
        final HugeNumber magnitude = value.abs();
        if (value.isInfinity() || magnitude.compareTo(TANH_SATURATION) > 0) {
            return negateIf(ONE, value.isNegative());
        }
        if (magnitude.compareTo(ONE) < 0) {
            final BigDecimal x = toBigDecimal(value);
            return HugeNumber.of(taylor(x, 1, false).divide(taylor(x, 0, false), SERIES_CONTEXT));
        }
        final HugeNumber exponential = exp(value);
        final HugeNumber inverse = divide(ONE, exponential);
        return divide(subtract(exponential, inverse), add(exponential, inverse));
    }

    /**
     * {@code tan(value * pi)}. Integers give signed zeros and odd multiples of one half give infinities.
     */
    public static HugeNumber tanPi(HugeNumber value) {
        if (value.isNaN() || value.isInfinity()) {
            return NaN;
        }
        return divide(sinPi(value), cosPi(value));
    }

    public static HugeNumber toDegrees(HugeNumber radians) {
        return multiply(radians, HugeNumberConstants.ONE_EIGHTY_OVER_PI);
    }

    public static HugeNumber toRadians(HugeNumber degrees) {
        return multiply(degrees, HugeNumberConstants.PI_OVER_180);
    }

    /**
     * {@code value} raised to a non-negative integral power.
     */
    static HugeNumber powInteger(HugeNumber value, long power) {
        if (power == 0) {
            return ONE;
        }
        if (power == 1) {
            return value;
        }
        if (power == 2) {
            return square(value);
        }
        if (power == 3) {
            return cube(value);
        }
        HugeNumber result = ONE;
        HugeNumber base = value;
        while (power > 0) {
            if ((power & 1) != 0) {
                result = multiply(result, base);
            }
            power >>= 1;
            if (power > 0) {
                base = square(base);
            }
            if (result.isInfinity() || result.isZero()) {
                break;
            }
        }
        return result;
    }

    // atan(x) = 2 atan(x / (1 + sqrt(1 + x^2))) is applied until x drops below the limit
    private static BigDecimal arctan(BigDecimal x) {
        if (x.signum() < 0) {
            return arctan(x.negate()).negate();
        }
        if (x.compareTo(BigDecimal.ONE) > 0) {
            return SERIES_HALF_PI.subtract(arctan(BigDecimal.ONE.divide(x, SERIES_CONTEXT)), SERIES_CONTEXT);
        }
        int halvings = 0;
        while (x.compareTo(ATAN_SERIES_LIMIT) > 0) {
            x = x.divide(BigDecimal.ONE.add(BigDecimal.ONE.add(x.multiply(x)).sqrt(SERIES_CONTEXT)), SERIES_CONTEXT);
            halvings++;
        }
        return oddPowerSeries(x, true).multiply(BigDecimal.valueOf(1L << halvings), SERIES_CONTEXT);
    }

    // |x| < 1
    private static BigDecimal arccos(BigDecimal x) {
        final BigDecimal ratio = BigDecimal.ONE.subtract(x).divide(BigDecimal.ONE.add(x), SERIES_CONTEXT);
        return arctan(ratio.sqrt(SERIES_CONTEXT)).multiply(BigDecimal.valueOf(2), SERIES_CONTEXT);
    }

    // |x| < 1
    private static BigDecimal arcsin(BigDecimal x) {
        final BigDecimal cosine = BigDecimal.ONE.subtract(x.multiply(x)).sqrt(SERIES_CONTEXT);
        return arctan(x.divide(cosine, SERIES_CONTEXT));
    }

    // sum of (-1)^n (2n)! / (4^n (n!)^2 (2n + 1)) x^(2n + 1), for |x| < 1/2
    private static BigDecimal asinhSeries(BigDecimal x) {
        final BigDecimal square = x.multiply(x, SERIES_CONTEXT);
        BigDecimal coefficient = BigDecimal.ONE;
        BigDecimal power = x;
        BigDecimal sum = x;
        for (long n = 1; n < MAX_SERIES_ITERATIONS; n++) {
            coefficient = coefficient.multiply(BigDecimal.valueOf(1 - 2 * n)).divide(BigDecimal.valueOf(2 * n), SERIES_CONTEXT);
            power = power.multiply(square, SERIES_CONTEXT);
            final BigDecimal next = sum.add(
                    coefficient.multiply(power).divide(BigDecimal.valueOf(2 * n + 1), SERIES_CONTEXT),
                    SERIES_CONTEXT
            );
            if (next.compareTo(sum) == 0) {
                return sum;
            }
            sum = next;
        }
        LOG.debug("asinh series did not converge [value={}, iterations={}]", x, MAX_SERIES_ITERATIONS);
        return sum;
    }

    /**
     * Sine, cosine or tangent of {@code x}. The argument is reduced by the nearest multiple {@code k} of pi/2
     * with enough digits of pi to keep 40 significant digits of the remainder, and the quadrant {@code k mod 4}
     * picks the series and sign.
     */
    private static HugeNumber circular(BigDecimal x, int function) {
        final MathContext mc = new MathContext(
                Math.max(x.precision() - x.scale(), 0) + SERIES_CONTEXT.getPrecision() + 2,
                RoundingMode.HALF_EVEN
        );
        final BigDecimal halfPi = PI_DIGITS.divide(BigDecimal.valueOf(2), mc);
        final BigDecimal multiple = x.divide(halfPi, mc).setScale(0, RoundingMode.HALF_EVEN);
        final BigDecimal remainder = x.subtract(multiple.multiply(halfPi, mc), mc).round(SERIES_CONTEXT);
        final int quadrant = multiple.remainder(BigDecimal.valueOf(4)).intValue() & 3;

        final BigDecimal sin = taylor(remainder, 1, true);
        final BigDecimal cos = taylor(remainder, 0, true);
        switch (function) {
            case SIN:
                return HugeNumber.of(quadrant == 0 ? sin : quadrant == 1 ? cos : quadrant == 2 ? sin.negate() : cos.negate());
            case COS:
                return HugeNumber.of(quadrant == 0 ? cos : quadrant == 1 ? sin.negate() : quadrant == 2 ? cos.negate() : sin);
            default:
                final BigDecimal dividend = (quadrant & 1) == 0 ? sin : cos.negate();
                final BigDecimal divisor = (quadrant & 1) == 0 ? cos : sin;
                if (divisor.signum() == 0) {
                    return infinity(dividend.signum() < 0);
                }
                return HugeNumber.of(dividend.divide(divisor, SERIES_CONTEXT));
        }
    }

    private static HugeNumber negateIf(HugeNumber value, boolean negate) {
        return negate ? value.negate() : value;
    }

    // sum of (+-1)^n x^(2n + 1) / (2n + 1), for |x| < 1
    private static BigDecimal oddPowerSeries(BigDecimal x, boolean alternating) {
        final BigDecimal square = x.multiply(x, SERIES_CONTEXT);
        BigDecimal power = x;
        BigDecimal sum = x;
        for (long n = 3; n < 2L * MAX_SERIES_ITERATIONS; n += 2) {
            power = power.multiply(square, SERIES_CONTEXT);
            if (alternating) {
                power = power.negate();
            }
            final BigDecimal next = sum.add(power.divide(BigDecimal.valueOf(n), SERIES_CONTEXT), SERIES_CONTEXT);
            if (next.compareTo(sum) == 0) {
                return sum;
            }
            sum = next;
        }
        LOG.debug("power series did not converge [value={}, iterations={}]", x, MAX_SERIES_ITERATIONS);
        return sum;
    }

    @Nullable
    private static BigDecimal radians(HugeNumber value) {
        if (value.abs().compareTo(MAX_REDUCIBLE_ARGUMENT) >= 0) {
            LOG.debug("cannot reduce trigonometric argument [value={}]", value);
            return null;
        }
        return toBigDecimal(value, REDUCTION_CONTEXT);
    }

    // sum of (+-1)^n x^(2n + first) / (2n + first)!, first being 1 for sine and 0 for cosine
    private static BigDecimal taylor(BigDecimal x, int first, boolean alternating) {
        final BigDecimal square = x.multiply(x, SERIES_CONTEXT);
        BigDecimal term = first == 0 ? BigDecimal.ONE : x;
        BigDecimal sum = term;
        for (long k = first + 1; k < MAX_SERIES_ITERATIONS; k += 2) {
            term = term.multiply(square, SERIES_CONTEXT).divide(BigDecimal.valueOf(k * (k + 1)), SERIES_CONTEXT);
            if (alternating) {
                term = term.negate();
            }
            final BigDecimal next = sum.add(term, SERIES_CONTEXT);
            if (next.compareTo(sum) == 0) {
                return sum;
            }
            sum = next;
        }
        LOG.debug("taylor series did not converge [value={}, iterations={}]", x, MAX_SERIES_ITERATIONS);
        return sum;
    }

    private static BigDecimal timesPi(HugeNumber turn) {
        return toBigDecimal(turn).multiply(PI_DIGITS, SERIES_CONTEXT);
    }

    private static BigDecimal toBigDecimal(HugeNumber value) {
        return toBigDecimal(value, SERIES_CONTEXT);
    }

    // exact for decimals, rounded to the context for fractions
    private static BigDecimal toBigDecimal(HugeNumber value, MathContext mc) {
        if (value.isRational()) {
            return value.exactNumerator().divide(BigDecimal.valueOf(value.getDenominator()), mc);
        }
        return value.exactNumerator();
    }
}
