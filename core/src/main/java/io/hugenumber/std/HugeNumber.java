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

import io.hugenumber.std.fmt.HugeNumberFormat;
import io.hugenumber.std.fmt.HugeNumberFormatter;
import io.hugenumber.std.fmt.HugeNumberParser;
import io.hugenumber.std.fmt.NumberStyles;
import io.hugenumber.std.str.CharSink;
import io.hugenumber.std.str.Sinkable;
import io.hugenumber.std.str.StringSink;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Immutable decimal number with an 18 digit mantissa, a 16-bit power-of-ten exponent and an optional
 * 16-bit denominator for exact fractions.
 * <p>
 * A finite value is {@code mantissa / denominator * 10^exponent}. Plain decimals have denominator 1.
 * Results of multiplication and division that can be expressed exactly as a fraction with a denominator
 * of at most {@value #MAX_DENOMINATOR} keep that form, so that {@code 1/3 * 3} is exactly one.
 * NaN and the two infinities are tagged by {@link Kind}; they report a denominator of 0.
 * <p>
 * Every instance is kept in canonical form: among the (mantissa, exponent) pairs denoting the same value
 * the one with the exponent closest to zero is stored, with at most 18 mantissa digits. Trailing zeros of
 * the mantissa are only kept to bring a positive exponent closer to zero, e.g. 1e50 is stored as
 * mantissa 100000000000000000 and exponent 33. Zero is stored with exponent 0, except for negative zero,
 * which has exponent -1.
 * <p>
 * Arithmetic never throws on domain or range errors. Division by zero, overflow and invalid arguments
 * produce NaN or a signed infinity, and NaN propagates through every operation.
 */
public final class HugeNumber extends Number implements Comparable<HugeNumber>, Sinkable {
    public static final int MAX_DENOMINATOR = 0xFFFF;
    public static final int MAX_EXPONENT = Short.MAX_VALUE;
    public static final long MAX_MANTISSA = 999_999_999_999_999_999L;
    public static final int MAX_MANTISSA_DIGITS = 18;
    public static final int MIN_EXPONENT = Short.MIN_VALUE;
    public static final HugeNumber NaN = new HugeNumber(Kind.NAN, 0, 0, 0);
    public static final HugeNumber NEGATIVE_INFINITY = new HugeNumber(Kind.NEGATIVE_INFINITY, -1, 0, 0);
    public static final HugeNumber NEGATIVE_ONE = new HugeNumber(Kind.FINITE, -1, 1, 0);
    public static final HugeNumber NEGATIVE_ZERO = new HugeNumber(Kind.FINITE, 0, 1, -1);
    public static final HugeNumber ONE = new HugeNumber(Kind.FINITE, 1, 1, 0);
    public static final HugeNumber POSITIVE_INFINITY = new HugeNumber(Kind.POSITIVE_INFINITY, 1, 0, 0);
    public static final HugeNumber TEN = new HugeNumber(Kind.FINITE, 10, 1, 0);
    public static final HugeNumber TWO = new HugeNumber(Kind.FINITE, 2, 1, 0);
    public static final HugeNumber ZERO = new HugeNumber(Kind.FINITE, 0, 1, 0);
    /**
     * Smallest positive value.
     */
    public static final HugeNumber EPSILON = new HugeNumber(Kind.FINITE, 1, 1, MIN_EXPONENT);
    public static final HugeNumber MAX_VALUE = new HugeNumber(Kind.FINITE, MAX_MANTISSA, 1, MAX_EXPONENT);
    public static final HugeNumber MIN_VALUE = new HugeNumber(Kind.FINITE, -MAX_MANTISSA, 1, MAX_EXPONENT);
    // precision of the decimal fallback path
    static final MathContext WIDE_CONTEXT = new MathContext(34, RoundingMode.HALF_EVEN);
    static final MathContext NARROW_CONTEXT = new MathContext(MAX_MANTISSA_DIGITS, RoundingMode.HALF_EVEN);
    private static final long serialVersionUID = 1L;
    private final int denominator;
    private final short exponent;
    private final Kind kind;
    private final long mantissa;
    private final byte mantissaDigits;

    private HugeNumber(Kind kind, long mantissa, int denominator, int exponent) {
        this.kind = kind;
        this.mantissa = mantissa;
        this.denominator = denominator;
        this.exponent = (short) exponent;
        this.mantissaDigits = (byte) Numbers.digitCount(mantissa);
    }

    /**
     * Adds two numbers. Infinities of opposite sign give NaN, {@code x + (-x)} gives positive zero.
     */
    public static HugeNumber add(HugeNumber left, HugeNumber right) {
        if (left.isNaN() || right.isNaN()) {
            return NaN;
        }
        if (left.isInfinity() || right.isInfinity()) {
            if (left.isInfinity() && right.isInfinity() && left.kind != right.kind) {
                return NaN;
            }
            return left.isInfinity() ? left : right;
        }
        if (left.mantissa == 0) {
            if (right.mantissa == 0) {
                return left.isNegativeZero() && right.isNegativeZero() ? NEGATIVE_ZERO : ZERO;
            }
            return right;
        }
        if (right.mantissa == 0) {
            return left;
        }
        if (left.denominator != 1 || right.denominator != 1) {
            return Rationals.add(left, right);
        }
        return addDecimal(left.mantissa, left.exponent, right.mantissa, right.exponent);
    }

    public static HugeNumber clamp(HugeNumber value, HugeNumber min, HugeNumber max) {
        if (min.compareTo(max) > 0) {
            throw NumericException.instance().put("min [").put(min).put("] is greater than max [").put(max).put(']');
        }
        if (value.isNaN()) {
            return NaN;
        }
        if (value.compareTo(min) < 0) {
            return min;
        }
        return value.compareTo(max) > 0 ? max : value;
    }

    /**
     * Returns {@code value} with the sign of {@code sign}. NaN stays NaN.
     */
    public static HugeNumber copySign(HugeNumber value, HugeNumber sign) {
        if (value.isNaN() || value.isNegative() == sign.isNegative()) {
            return value;
        }
        return value.negate();
    }

    /**
     * Raises {@code value} to the power of three. NaN, the infinities and both zeros are returned as they are.
     */
    public static HugeNumber cube(HugeNumber value) {
        if (!value.isFinite() || value.mantissa == 0) {
            return value;
        }
        return multiply(multiply(value, value), value);
    }

    /**
     * Quotient rounded towards negative infinity, and the matching remainder
     * {@code dividend - divisor * quotient}.
     */
    public static DivRem divRem(HugeNumber dividend, HugeNumber divisor) {
        final HugeNumber quotient = divide(dividend, divisor).floor();
        return new DivRem(quotient, subtract(dividend, multiply(divisor, quotient)));
    }

    /**
     * Divides two numbers.
     * <ul>
     * <li>NaN operand, 0/0 and infinity/infinity give NaN</li>
     * <li>a nonzero number divided by zero gives the infinity with the sign of the dividend</li>
     * <li>an infinity divided by a finite number gives an infinity, a finite number divided by an infinity
     * gives zero, both signed by the XOR of the operand signs</li>
     * </ul>
     * The quotient is exact when it can be written as a fraction within the mantissa and denominator
     * bounds, otherwise it is computed by long division to 34 digits and rounded to 18.
     */
    public static HugeNumber divide(HugeNumber dividend, HugeNumber divisor) {
        if (dividend.isNaN() || divisor.isNaN()) {
            return NaN;
        }
        if (divisor.isZero()) {
            return dividend.isZero() ? NaN : infinity(dividend.isNegative());
        }
        final boolean negative = dividend.isNegative() != divisor.isNegative();
        if (dividend.isInfinity()) {
            return divisor.isInfinity() ? NaN : infinity(negative);
        }
        if (divisor.isInfinity() || dividend.isZero()) {
            return zero(negative);
        }

        final long dividendMantissa = Math.abs(dividend.mantissa);
        final long divisorMantissa = Math.abs(divisor.mantissa);
        if (dividendMantissa <= Long.MAX_VALUE / divisor.denominator
                && divisorMantissa <= Long.MAX_VALUE / dividend.denominator) {
            long numerator = dividendMantissa * divisor.denominator;
            long denominator = dividend.denominator * divisorMantissa;
            final long gcd = Numbers.gcd(numerator, denominator);
            if (gcd > 1) {
                numerator /= gcd;
                denominator /= gcd;
            }
            if (denominator <= MAX_DENOMINATOR && numerator <= MAX_MANTISSA) {
                return Rationals.canonical(
                        negative ? -numerator : numerator,
                        denominator,
                        (long) dividend.exponent - divisor.exponent
                );
            }
        }
        return decimal(dividend.toWideDecimal().divide(divisor.toWideDecimal(), WIDE_CONTEXT), 0);
    }

    /**
     * Computes {@code left * right + addend} with a single rounding of the finite result.
     */
    public static HugeNumber fusedMultiplyAdd(HugeNumber left, HugeNumber right, HugeNumber addend) {
        if (!left.isFinite() || !right.isFinite() || !addend.isFinite()) {
            return add(multiply(left, right), addend);
        }
        final BigDecimal product = left.toWideDecimal().multiply(right.toWideDecimal());
        return decimal(product.add(addend.toWideDecimal(), WIDE_CONTEXT), 0);
    }

    /**
     * IEEE 754 remainder: {@code dividend - divisor * q} where q is the quotient rounded half to even.
     * An exactly zero remainder carries the sign of the dividend. NaN operands, a zero divisor and an
     * infinite dividend give NaN; an infinite divisor returns the dividend.
     */
    public static HugeNumber ieeeRemainder(HugeNumber dividend, HugeNumber divisor) {
        if (dividend.isNaN() || divisor.isNaN() || divisor.isZero() || dividend.isInfinity()) {
            return NaN;
        }
        if (divisor.isInfinity()) {
            return dividend;
        }
        final HugeNumber remainder = dividend.mantissa == 0 ? ZERO : Rationals.remainder(dividend, divisor, true);
        if (remainder.mantissa == 0) {
            return zero(dividend.isNegative());
        }
        return remainder;
    }

    public static HugeNumber max(HugeNumber left, HugeNumber right) {
        if (left.isNaN() || right.isNaN()) {
            return NaN;
        }
        return left.compareTo(right) >= 0 ? left : right;
    }

    public static HugeNumber min(HugeNumber left, HugeNumber right) {
        if (left.isNaN() || right.isNaN()) {
            return NaN;
        }
        return left.compareTo(right) <= 0 ? left : right;
    }

    /**
     * Truncating remainder with the sign of the dividend, computed exactly.
     * NaN operands and {@code 0 mod 0} give NaN, a zero divisor or an infinite operand gives zero.
     */
    public static HugeNumber mod(HugeNumber dividend, HugeNumber divisor) {
        if (dividend.isNaN() || divisor.isNaN()) {
            return NaN;
        }
        if (divisor.isZero()) {
            return dividend.isZero() ? NaN : ZERO;
        }
        if (dividend.isInfinity() || divisor.isInfinity()) {
            return ZERO;
        }
        if (dividend.mantissa == 0 || compareMagnitude(dividend, divisor) < 0) {
            return dividend;
        }
        return Rationals.remainder(dividend, divisor, false);
    }

    /**
     * Multiplies two numbers.
     * <ul>
     * <li>a NaN operand, or zero times an infinity, gives NaN</li>
     * <li>zero times a finite number gives zero, negative when exactly one operand is negative</li>
     * <li>an infinite operand or an exponent overflow gives the infinity signed by the XOR of the operand signs</li>
     * </ul>
     * Small operands are multiplied exactly as fractions. When the product would not fit, both operands
     * are rounded to 18-digit decimals, digits are shed from an operand with trailing zeros first, then
     * from the longer operand (from both when equally long) until the product fits 34 digits, and the
     * product is rounded back to 18 digits.
     */
    public static HugeNumber multiply(HugeNumber left, HugeNumber right) {
        if (left.isNaN() || right.isNaN()) {
            return NaN;
        }
        final boolean negative = left.isNegative() != right.isNegative();
        if (left.isInfinity() || right.isInfinity()) {
            return left.isZero() || right.isZero() ? NaN : infinity(negative);
        }
        if (left.mantissa == 0 || right.mantissa == 0) {
            return zero(negative);
        }

        if (Math.abs(left.mantissa) <= Long.MAX_VALUE / Math.abs(right.mantissa)) {
            long numerator = left.mantissa * right.mantissa;
            long denominator = (long) left.denominator * right.denominator;
            final long gcd = Numbers.gcd(numerator, denominator);
            if (gcd > 1) {
                numerator /= gcd;
                denominator /= gcd;
            }
            if (denominator <= MAX_DENOMINATOR && Math.abs(numerator) <= MAX_MANTISSA) {
                return Rationals.canonical(numerator, denominator, (long) left.exponent + right.exponent);
            }
        }

        BigDecimal l = left.toWideDecimal().round(NARROW_CONTEXT);
        BigDecimal r = right.toWideDecimal().round(NARROW_CONTEXT);
        while (l.precision() + r.precision() > WIDE_CONTEXT.getPrecision()) {
            if (hasTrailingZero(l)) {
                l = shedDigit(l);
            } else if (hasTrailingZero(r)) {
                r = shedDigit(r);
            } else if (l.precision() > r.precision()) {
                l = shedDigit(l);
            } else if (r.precision() > l.precision()) {
                r = shedDigit(r);
            } else {
                l = shedDigit(l);
                r = shedDigit(r);
            }
        }
        return decimal(l.multiply(r), 0);
    }

    public static HugeNumber of(long value) {
        return decimal(value, 0);
    }

    /**
     * Creates {@code mantissa * 10^exponent} in canonical form. Mantissas longer than 18 digits lose their
     * lowest digits, exponents beyond the representable range give a signed infinity, or a signed zero
     * when the value is too small to represent.
     */
    public static HugeNumber of(long mantissa, int exponent) {
        return decimal(mantissa, exponent);
    }

    /**
     * Creates a number from the shortest decimal representation of a double, so that
     * {@code of(0.1)} is exactly one tenth. NaN and the infinities map to their counterparts.
     */
    public static HugeNumber of(double value) {
        if (Double.isNaN(value)) {
            return NaN;
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? POSITIVE_INFINITY : NEGATIVE_INFINITY;
        }
        if (value == 0) {
            return Double.doubleToRawLongBits(value) < 0 ? NEGATIVE_ZERO : ZERO;
        }
        return decimal(BigDecimal.valueOf(value), 0);
    }

    /**
     * Creates a number from a BigDecimal, rounding half to even to 18 significant digits.
     */
    public static HugeNumber of(BigDecimal value) {
        if (value == null) {
            throw NumericException.instance().put("BigDecimal cannot be null");
        }
        return decimal(value, 0);
    }

    public static HugeNumber of(BigInteger value) {
        if (value == null) {
            throw NumericException.instance().put("BigInteger cannot be null");
        }
        return decimal(new BigDecimal(value), 0);
    }

    /**
     * Converts any {@link Number} to a HugeNumber. Integral boxes convert exactly, floating point boxes
     * through their shortest decimal representation.
     */
    public static HugeNumber of(Number value) {
        if (value == null) {
            throw NumericException.instance().put("Number cannot be null");
        }
        if (value instanceof HugeNumber) {
            return (HugeNumber) value;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return of(value.longValue());
        }
        if (value instanceof BigDecimal) {
            return of((BigDecimal) value);
        }
        if (value instanceof BigInteger) {
            return of((BigInteger) value);
        }
        if (value instanceof Float) {
            return of(Double.parseDouble(value.toString()));
        }
        return of(value.doubleValue());
    }

    public static HugeNumber ofRational(long numerator, int denominator) {
        return ofRational(numerator, denominator, 0);
    }

    /**
     * Creates the exact fraction {@code numerator / denominator * 10^exponent}. The fraction is reduced
     * by its greatest common factor; fractions that have an exact decimal form are stored as decimals.
     *
     * @throws NumericException if the denominator is not within [1, 65535]
     */
    public static HugeNumber ofRational(long numerator, int denominator, int exponent) {
        if (denominator < 1 || denominator > MAX_DENOMINATOR) {
            throw NumericException.instance().put("denominator is out of range [1, 65535]: ").put(denominator);
        }
        if (numerator == Long.MIN_VALUE) {
            return decimal(BigDecimal.valueOf(numerator).divide(BigDecimal.valueOf(denominator), WIDE_CONTEXT), exponent);
        }
        return Rationals.canonical(numerator, denominator, exponent);
    }

    /**
     * Parses text with {@link NumberStyles#ANY} and the invariant format. Malformed or empty text gives NaN.
     */
    public static HugeNumber parse(@Nullable CharSequence text) {
        return parse(text, NumberStyles.ANY, HugeNumberFormat.INVARIANT);
    }

    public static HugeNumber parse(@Nullable CharSequence text, int styles, @NotNull HugeNumberFormat format) {
        final HugeNumber result = HugeNumberParser.tryParse(text, styles, format);
        return result != null ? result : NaN;
    }

    /**
     * Squares a number. NaN stays NaN, both zeros give zero and both infinities give positive infinity.
     */
    public static HugeNumber square(HugeNumber value) {
        if (value.isNaN()) {
            return NaN;
        }
        if (value.isZero()) {
            return ZERO;
        }
        if (value.isInfinity()) {
            return POSITIVE_INFINITY;
        }
        return multiply(value, value);
    }

    public static HugeNumber subtract(HugeNumber left, HugeNumber right) {
        return add(left, right.negate());
    }

    /**
     * Parses text with {@link NumberStyles#ANY} and the invariant format.
     *
     * @return the parsed number, or null when the text is empty or malformed
     */
    @Nullable
    public static HugeNumber tryParse(@Nullable CharSequence text) {
        return HugeNumberParser.tryParse(text, NumberStyles.ANY, HugeNumberFormat.INVARIANT);
    }

    @Nullable
    public static HugeNumber tryParse(@Nullable CharSequence text, int styles, @NotNull HugeNumberFormat format) {
        return HugeNumberParser.tryParse(text, styles, format);
    }

    public HugeNumber abs() {
        return isNegative() ? negate() : this;
    }

    public HugeNumber add(HugeNumber other) {
        return add(this, other);
    }

    public HugeNumber ceiling() {
        return round(0, RoundingMode.CEILING);
    }

    /**
     * Total order: NaN is below every other value and equal to itself, the infinities bound the finite
     * values, negative zero sorts just below zero, and finite values compare by value, exactly for fractions.
     */
    @Override
    public int compareTo(@NotNull HugeNumber other) {
        if (isNaN()) {
            return other.isNaN() ? 0 : -1;
        }
        if (other.isNaN()) {
            return 1;
        }
        if (kind == other.kind && kind != Kind.FINITE) {
            return 0;
        }
        if (kind == Kind.NEGATIVE_INFINITY || other.kind == Kind.POSITIVE_INFINITY) {
            return -1;
        }
        if (kind == Kind.POSITIVE_INFINITY || other.kind == Kind.NEGATIVE_INFINITY) {
            return 1;
        }
        if (mantissa == 0 || other.mantissa == 0) {
            if (mantissa == 0 && other.mantissa == 0) {
                return Integer.compare(exponent, other.exponent);
            }
            if (mantissa == 0) {
                return other.mantissa > 0 ? -1 : 1;
            }
            return mantissa > 0 ? 1 : -1;
        }
        if ((mantissa < 0) != (other.mantissa < 0)) {
            return mantissa < 0 ? -1 : 1;
        }
        final int magnitude = compareMagnitude(this, other);
        return mantissa < 0 ? -magnitude : magnitude;
    }

    public int compareTo(@NotNull Number other) {
        return compareTo(of(other));
    }

    public HugeNumber decrement() {
        return subtract(this, ONE);
    }

    public HugeNumber divide(HugeNumber divisor) {
        return divide(this, divisor);
    }

    public DivRem divRem(HugeNumber divisor) {
        return divRem(this, divisor);
    }

    @Override
    public double doubleValue() {
        switch (kind) {
            case NAN:
                return Double.NaN;
            case POSITIVE_INFINITY:
                return Double.POSITIVE_INFINITY;
            case NEGATIVE_INFINITY:
                return Double.NEGATIVE_INFINITY;
            default:
                if (mantissa == 0) {
                    return exponent < 0 ? -0.0 : 0.0;
                }
                return toWideDecimal().doubleValue();
        }
    }

    /**
     * Field equality of two canonical numbers, which is numeric equality for everything but NaN:
     * NaN is not equal to anything, itself included, and negative zero is not equal to zero.
     * Note that this makes {@code equals} deliberately non-reflexive for NaN, while
     * {@link #compareTo(HugeNumber)} orders NaN equal to NaN.
     */
    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof HugeNumber)) {
            return false;
        }
        final HugeNumber other = (HugeNumber) obj;
        if (isNaN() || other.isNaN() || kind != other.kind) {
            return false;
        }
        if (kind != Kind.FINITE) {
            return true;
        }
        if (denominator != 1 || other.denominator != 1) {
            return denominator != 1 && other.denominator != 1 && compareTo(other) == 0;
        }
        return mantissa == other.mantissa && exponent == other.exponent;
    }

    @Override
    public float floatValue() {
        switch (kind) {
            case NAN:
                return Float.NaN;
            case POSITIVE_INFINITY:
                return Float.POSITIVE_INFINITY;
            case NEGATIVE_INFINITY:
                return Float.NEGATIVE_INFINITY;
            default:
                if (mantissa == 0) {
                    return exponent < 0 ? -0.0f : 0.0f;
                }
                return toWideDecimal().floatValue();
        }
    }

    public HugeNumber floor() {
        return round(0, RoundingMode.FLOOR);
    }

    /**
     * Exponent of the leading digit: {@code exponent + mantissaDigits - 1}.
     */
    public int getAdjustedExponent() {
        return exponent + mantissaDigits - 1;
    }

    /**
     * @return 1 for decimals, the fraction's denominator for rationals, 0 for NaN and the infinities
     */
    public int getDenominator() {
        return denominator;
    }

    /**
     * Step of one unit in the last mantissa digit, {@code 10^exponent}. {@link #EPSILON} for zero and
     * NaN for NaN and the infinities.
     */
    public HugeNumber getEpsilon() {
        if (!isFinite()) {
            return NaN;
        }
        return mantissa == 0 ? EPSILON : new HugeNumber(Kind.FINITE, 1, 1, exponent);
    }

    public int getExponent() {
        return exponent;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the signed mantissa, or the numerator of a rational; 1 and -1 for the infinities, 0 for NaN
     */
    public long getMantissa() {
        return mantissa;
    }

    public int getMantissaDigits() {
        return mantissaDigits;
    }

    @Override
    public int hashCode() {
        if (denominator > 1) {
            return 31 * toDecimal().hashCode() + 1;
        }
        int result = kind.hashCode();
        result = 31 * result + Long.hashCode(mantissa);
        result = 31 * result + exponent;
        return result;
    }

    public HugeNumber increment() {
        return add(this, ONE);
    }

    @Override
    public int intValue() {
        final long value = longValue();
        if (value > Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        return value < Integer.MIN_VALUE ? Integer.MIN_VALUE : (int) value;
    }

    public boolean isEvenInteger() {
        return isInteger() && !isOddInteger();
    }

    public boolean isFinite() {
        return kind == Kind.FINITE;
    }

    public boolean isGreaterThan(HugeNumber other) {
        return !isNaN() && !other.isNaN() && compareTo(other) > 0;
    }

    public boolean isGreaterThanOrEqualTo(HugeNumber other) {
        return !isNaN() && !other.isNaN() && compareTo(other) >= 0;
    }

    public boolean isInfinity() {
        return kind == Kind.POSITIVE_INFINITY || kind == Kind.NEGATIVE_INFINITY;
    }

    /**
     * @return true for finite numbers without a fractional part, zero included
     */
    public boolean isInteger() {
        return kind == Kind.FINITE && denominator == 1 && exponent >= 0;
    }

    public boolean isLessThan(HugeNumber other) {
        return !isNaN() && !other.isNaN() && compareTo(other) < 0;
    }

    public boolean isLessThanOrEqualTo(HugeNumber other) {
        return !isNaN() && !other.isNaN() && compareTo(other) <= 0;
    }

    public boolean isNaN() {
        return kind == Kind.NAN;
    }

    /**
     * @return true when both numbers are within {@code tolerance} of each other, or are the same infinity
     */
    public boolean isNearlyEqualTo(HugeNumber other, HugeNumber tolerance) {
        if (isNaN() || other.isNaN() || tolerance.isNaN()) {
            return false;
        }
        if (isInfinity() || other.isInfinity()) {
            return kind == other.kind;
        }
        return subtract(this, other).abs().compareTo(tolerance.abs()) <= 0;
    }

    /**
     * @return true for negative numbers, negative infinity and negative zero
     */
    public boolean isNegative() {
        return mantissa < 0 || (mantissa == 0 && exponent < 0 && kind == Kind.FINITE);
    }

    public boolean isNegativeInfinity() {
        return kind == Kind.NEGATIVE_INFINITY;
    }

    public boolean isNegativeZero() {
        return kind == Kind.FINITE && mantissa == 0 && exponent < 0;
    }

    /**
     * Flags values whose representation may already have lost precision: NaN, the infinities and
     * decimals with a nonzero exponent.
     */
    public boolean isNotRational() {
        return kind != Kind.FINITE || (denominator == 1 && exponent != 0);
    }

    public boolean isOddInteger() {
        return isInteger() && exponent == 0 && (mantissa & 1) != 0;
    }

    public boolean isPositive() {
        return mantissa > 0;
    }

    public boolean isPositiveInfinity() {
        return kind == Kind.POSITIVE_INFINITY;
    }

    /**
     * @return true for exact fractions, i.e. a denominator greater than one
     */
    public boolean isRational() {
        return denominator > 1;
    }

    /**
     * @return true for both zeros
     */
    public boolean isZero() {
        return kind == Kind.FINITE && mantissa == 0;
    }

    /**
     * Truncates towards zero and saturates at the bounds of long. NaN converts to 0.
     */
    @Override
    public long longValue() {
        switch (kind) {
            case NAN:
                return 0;
            case POSITIVE_INFINITY:
                return Long.MAX_VALUE;
            case NEGATIVE_INFINITY:
                return Long.MIN_VALUE;
            default:
                if (getMagnitudeOrder() > 19) {
                    return mantissa > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
                }
                final BigInteger integral = toWideDecimal().toBigInteger();
                if (integral.bitLength() > 63) {
                    return integral.signum() > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
                }
                return integral.longValue();
        }
    }

    public HugeNumber mod(HugeNumber divisor) {
        return mod(this, divisor);
    }

    public HugeNumber multiply(HugeNumber other) {
        return multiply(this, other);
    }

    /**
     * Flips the sign. Zero and negative zero swap, NaN stays NaN.
     */
    public HugeNumber negate() {
        switch (kind) {
            case NAN:
                return NaN;
            case POSITIVE_INFINITY:
                return NEGATIVE_INFINITY;
            case NEGATIVE_INFINITY:
                return POSITIVE_INFINITY;
            default:
                if (mantissa == 0) {
                    return exponent < 0 ? ZERO : NEGATIVE_ZERO;
                }
                return new HugeNumber(Kind.FINITE, -mantissa, denominator, exponent);
        }
    }

    /**
     * @return {@code 1 / this}
     */
    public HugeNumber reciprocal() {
        return divide(ONE, this);
    }

    public HugeNumber round() {
        return round(0, RoundingMode.HALF_EVEN);
    }

    public HugeNumber round(int digits) {
        return round(digits, RoundingMode.HALF_EVEN);
    }

    /**
     * Rounds to {@code digits} decimal places. Fractions are rounded from their exact value.
     * Negative numbers that round to zero give negative zero.
     *
     * @param digits number of decimal places, within [0, 18]
     * @param mode   rounding mode
     * @throws NumericException if digits is out of range, or mode is {@link RoundingMode#UNNECESSARY}
     *                          and rounding is needed
     */
    public HugeNumber round(int digits, RoundingMode mode) {
        if (digits < 0 || digits > MAX_MANTISSA_DIGITS) {
            throw NumericException.instance().put("digits must be within [0, 18]: ").put(digits);
        }
        if (kind != Kind.FINITE || mantissa == 0 || (denominator == 1 && exponent >= -digits)) {
            return this;
        }
        final BigDecimal rounded;
        try {
            rounded = exactNumerator().divide(BigDecimal.valueOf(denominator), digits, mode);
        } catch (ArithmeticException e) {
            throw NumericException.instance().put("rounding is necessary for ").put(this);
        }
        final HugeNumber result = decimal(rounded, 0);
        return result.mantissa == 0 && mantissa < 0 ? NEGATIVE_ZERO : result;
    }

    /**
     * @return -1, 0 or 1; 0 for both zeros and for NaN
     */
    public int sign() {
        return Long.signum(mantissa);
    }

    public HugeNumber square() {
        return square(this);
    }

    public HugeNumber subtract(HugeNumber other) {
        return subtract(this, other);
    }

    /**
     * Exact value of a finite number, fractions divided out to 34 significant digits.
     *
     * @throws NumericException for NaN and the infinities
     */
    public BigDecimal toBigDecimal() {
        if (kind != Kind.FINITE) {
            throw NumericException.instance().put("cannot convert ").put(this).put(" to BigDecimal");
        }
        return toWideDecimal();
    }

    /**
     * Nearest 18 digit decimal of a fraction. Decimals and non-finite values are returned as they are.
     */
    public HugeNumber toDecimal() {
        if (denominator <= 1) {
            return this;
        }
        return decimal(BigDecimal.valueOf(mantissa).divide(BigDecimal.valueOf(denominator), NARROW_CONTEXT), exponent);
    }

    public int toIntExact() {
        final long value = toLongExact();
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw NumericException.instance().put("value is out of int range: ").put(this);
        }
        return (int) value;
    }

    /**
     * Integral part of a finite number.
     *
     * @throws NumericException for NaN, the infinities and values outside the range of long
     */
    public long toLongExact() {
        if (kind != Kind.FINITE) {
            throw NumericException.instance().put("cannot convert ").put(this).put(" to long");
        }
        if (getMagnitudeOrder() <= 19) {
            final BigInteger integral = toWideDecimal().toBigInteger();
            if (integral.bitLength() <= 63) {
                return integral.longValue();
            }
        }
        throw NumericException.instance().put("value is out of long range: ").put(this);
    }

    @Override
    public void toSink(@NotNull CharSink sink) {
        HugeNumberFormatter.format(sink, this, HugeNumberFormatter.GENERAL, HugeNumberFormat.INVARIANT);
    }

    @Override
    public String toString() {
        return toString(HugeNumberFormatter.GENERAL, HugeNumberFormat.INVARIANT);
    }

    /**
     * Formats with one of the patterns understood by {@link HugeNumberFormatter}, e.g. "G", "E3", "F2", "N".
     */
    public String toString(@Nullable CharSequence pattern) {
        return toString(pattern, HugeNumberFormat.INVARIANT);
    }

    public String toString(@Nullable CharSequence pattern, @NotNull HugeNumberFormat format) {
        final StringSink sink = new StringSink();
        HugeNumberFormatter.format(sink, this, pattern, format);
        return sink.toString();
    }

    public HugeNumber truncate() {
        return round(0, RoundingMode.DOWN);
    }

    private static HugeNumber addDecimal(long leftMantissa, int leftExponent, long rightMantissa, int rightExponent) {
        if (leftExponent < rightExponent) {
            return addDecimal(rightMantissa, rightExponent, leftMantissa, leftExponent);
        }
        int diff = leftExponent - rightExponent;
        // bring the larger exponent down while the mantissa has room, the rest is rounded off the other operand
        final int shift = Math.min(diff, MAX_MANTISSA_DIGITS - Numbers.digitCount(leftMantissa));
        if (shift > 0) {
            leftMantissa *= Numbers.TEN_POWERS_TABLE[shift];
            leftExponent -= shift;
            diff -= shift;
        }
        if (diff > MAX_MANTISSA_DIGITS) {
            rightMantissa = 0;
        } else if (diff > 0) {
            rightMantissa = Numbers.roundHalfEvenDivide(rightMantissa, diff);
        }
        long sum = leftMantissa + rightMantissa;
        if (sum == 0) {
            return ZERO;
        }
        long exponent = leftExponent;
        if (sum > MAX_MANTISSA || sum < -MAX_MANTISSA) {
            sum = Numbers.roundHalfEvenDivide(sum, 1);
            exponent++;
        }
        return decimal(sum, exponent);
    }

    private static boolean hasTrailingZero(BigDecimal value) {
        return value.unscaledValue().mod(BigInteger.TEN).signum() == 0;
    }

    private static BigDecimal shedDigit(BigDecimal value) {
        return new BigDecimal(value.unscaledValue().divide(BigInteger.TEN), value.scale() - 1);
    }

    /**
     * A finite value lies strictly between {@code 10^(order - 1)} and {@code 10^(order + 1)}; for decimals
     * the order equals the adjusted exponent.
     */
    private int getMagnitudeOrder() {
        return exponent + mantissaDigits - Numbers.digitCount(denominator);
    }

    /**
     * Compares absolute values of two finite, nonzero numbers.
     */
    static int compareMagnitude(HugeNumber left, HugeNumber right) {
        if (left.denominator == 1 && right.denominator == 1) {
            final int leftAdjusted = left.getAdjustedExponent();
            final int rightAdjusted = right.getAdjustedExponent();
            if (leftAdjusted != rightAdjusted) {
                return leftAdjusted < rightAdjusted ? -1 : 1;
            }
            final long l = Math.abs(left.mantissa) * Numbers.TEN_POWERS_TABLE[MAX_MANTISSA_DIGITS - left.mantissaDigits];
            final long r = Math.abs(right.mantissa) * Numbers.TEN_POWERS_TABLE[MAX_MANTISSA_DIGITS - right.mantissaDigits];
            return Long.compare(l, r);
        }
        final int leftOrder = left.getMagnitudeOrder();
        final int rightOrder = right.getMagnitudeOrder();
        if (leftOrder - rightOrder >= 2) {
            return 1;
        }
        if (rightOrder - leftOrder >= 2) {
            return -1;
        }
        final int exponent = Math.min(left.exponent, right.exponent);
        final BigInteger l = BigInteger.valueOf(Math.abs(left.mantissa))
                .multiply(BigInteger.valueOf(right.denominator))
                .multiply(BigInteger.TEN.pow(left.exponent - exponent));
        final BigInteger r = BigInteger.valueOf(Math.abs(right.mantissa))
                .multiply(BigInteger.valueOf(left.denominator))
                .multiply(BigInteger.TEN.pow(right.exponent - exponent));
        return l.compareTo(r);
    }

    /**
     * Canonical decimal {@code mantissa * 10^exponent}.
     */
    static HugeNumber decimal(long mantissa, long exponent) {
        if (mantissa == 0) {
            return ZERO;
        }
        if (mantissa == Long.MIN_VALUE) {
            mantissa /= 10;
            exponent++;
        }
        final boolean negative = mantissa < 0;
        int digits = Numbers.digitCount(mantissa);
        while (digits < MAX_MANTISSA_DIGITS && exponent > 0) {
            mantissa *= 10;
            exponent--;
            digits++;
        }
        while (digits < MAX_MANTISSA_DIGITS && exponent < 0 && mantissa % 10 == 0) {
            mantissa /= 10;
            exponent++;
            digits--;
        }
        while ((mantissa > MAX_MANTISSA || mantissa < -MAX_MANTISSA) && exponent < MAX_EXPONENT) {
            mantissa /= 10;
            exponent++;
            digits--;
        }
        if (exponent > MAX_EXPONENT || mantissa > MAX_MANTISSA || mantissa < -MAX_MANTISSA) {
            return infinity(negative);
        }
        if (exponent < MIN_EXPONENT) {
            // underflow, the lowest digits are lost
            if (exponent < MIN_EXPONENT - MAX_MANTISSA_DIGITS) {
                return zero(negative);
            }
            while (exponent < MIN_EXPONENT) {
                mantissa /= 10;
                exponent++;
            }
            if (mantissa == 0) {
                return zero(negative);
            }
        }
        while (exponent < 0 && mantissa % 10 == 0) {
            mantissa /= 10;
            exponent++;
        }
        return new HugeNumber(Kind.FINITE, mantissa, 1, (int) exponent);
    }

    /**
     * Canonical decimal {@code value * 10^exponent}, rounded half to even to 18 significant digits.
     */
    static HugeNumber decimal(BigDecimal value, long exponent) {
        if (value.signum() == 0) {
            return ZERO;
        }
        final BigDecimal rounded = value.round(NARROW_CONTEXT);
        return decimal(rounded.unscaledValue().longValueExact(), exponent - rounded.scale());
    }

    static HugeNumber infinity(boolean negative) {
        return negative ? NEGATIVE_INFINITY : POSITIVE_INFINITY;
    }

    /**
     * A fraction already in canonical form.
     */
    static HugeNumber rational(long numerator, int denominator, int exponent) {
        return new HugeNumber(Kind.FINITE, numerator, denominator, exponent);
    }

    static HugeNumber zero(boolean negative) {
        return negative ? NEGATIVE_ZERO : ZERO;
    }

    /**
     * Exact {@code mantissa * 10^exponent} of a finite number, i.e. the value times its denominator.
     */
    BigDecimal exactNumerator() {
        return new BigDecimal(BigInteger.valueOf(mantissa), -exponent);
    }

    /**
     * Value of a finite number as a BigDecimal: exact for decimals, 34 significant digits for fractions.
     */
    BigDecimal toWideDecimal() {
        if (denominator == 1) {
            return BigDecimal.valueOf(mantissa, -exponent);
        }
        return BigDecimal.valueOf(mantissa)
                .divide(BigDecimal.valueOf(denominator), WIDE_CONTEXT)
                .scaleByPowerOfTen(exponent);
    }

    public enum Kind {
        FINITE,
        POSITIVE_INFINITY,
        NEGATIVE_INFINITY,
        NAN
    }
}
