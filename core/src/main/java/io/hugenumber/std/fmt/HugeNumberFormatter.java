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

package io.hugenumber.std.fmt;

import io.hugenumber.std.HugeNumber;
import io.hugenumber.std.NumericException;
import io.hugenumber.std.str.CharSink;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Writes {@link HugeNumber} values as text. A pattern is a letter optionally followed by a precision of
 * up to two digits:
 * <pre>
 * G[p] general: shortest form, fractions as "numerator/denominator", p significant digits
 * R    round-trip: same as G
 * E[p] exponential: d.ddd followed by the exponent, p fraction digits
 * F[p] fixed point, p fraction digits, 2 by default
 * N[p] fixed point with group separators
 * P[p] percent: the value times 100 with group separators, followed by " %"
 * C[p] currency: the currency symbol followed by the N form
 * D[p] integer, zero padded to at least p digits
 * </pre>
 * The case of the letter selects the case of the exponent symbol. Values whose exponent does not fit a
 * fixed point rendering use the exponential form regardless of the pattern. Output of G and R parses back to
 * the same value with {@link HugeNumberParser}.
 */
public final class HugeNumberFormatter {
    public static final String GENERAL = "g";
    private static final int DEFAULT_FIXED_PRECISION = 2;
    // leading zeros, counting the one before the decimal separator, and trailing zeros that switch G to exponential form
    private static final int MAX_GENERAL_LEADING_ZEROS = 2;
    private static final int MAX_GENERAL_TRAILING_ZEROS = 3;

    private HugeNumberFormatter() {
    }

    /**
     * Writes a number to a sink.
     *
     * @param sink    destination
     * @param value   number to write
     * @param pattern one of the patterns above; null or empty means {@link #GENERAL}
     * @param format  symbols to use
     * @throws NumericException if the pattern is not recognized
     */
    public static void format(
            @NotNull CharSink sink,
            @NotNull HugeNumber value,
            @Nullable CharSequence pattern,
            @NotNull HugeNumberFormat format
    ) throws NumericException {
        if (pattern == null || pattern.length() == 0) {
            pattern = GENERAL;
        }
        final char letter = pattern.charAt(0);
        final int precision = parsePrecision(pattern);
        final String exponentSymbol = Character.isLowerCase(letter)
                ? format.getExponentSymbol().toLowerCase(Locale.ROOT)
                : format.getExponentSymbol();

        switch (value.getKind()) {
            case NAN:
                sink.put(format.getNaNSymbol());
                return;
            case POSITIVE_INFINITY:
                sink.put(format.getPositiveInfinitySymbol());
                return;
            case NEGATIVE_INFINITY:
                sink.put(format.getNegativeInfinitySymbol());
                return;
            default:
                break;
        }

        switch (Character.toUpperCase(letter)) {
            case 'G':
            case 'R':
                formatGeneral(sink, value, precision, format, exponentSymbol);
                break;
            case 'E':
                formatExponential(sink, value.toDecimal(), precision, format, exponentSymbol);
                break;
            case 'F':
                formatFixed(sink, value.toDecimal(), precisionOr(precision), false, format, exponentSymbol);
                break;
            case 'N':
                formatFixed(sink, value.toDecimal(), precisionOr(precision), true, format, exponentSymbol);
                break;
            case 'P':
                formatFixed(sink, value.toDecimal().multiply(HugeNumber.of(100)), precisionOr(precision), true, format, exponentSymbol);
                sink.put(' ').put(format.getPercentSymbol());
                break;
            case 'C':
                formatCurrency(sink, value.toDecimal(), precisionOr(precision), format, exponentSymbol);
                break;
            case 'D':
                formatInteger(sink, value.toDecimal(), precision, format, exponentSymbol);
                break;
            default:
                throw NumericException.instance().position(0).put("invalid format pattern [pattern=").put(pattern).put(']');
        }
    }

    private static boolean fitsFixed(HugeNumber value) {
        return value.getExponent() <= 0 && value.getExponent() >= -HugeNumber.MAX_MANTISSA_DIGITS;
    }

    private static void formatCurrency(CharSink sink, HugeNumber value, int precision, HugeNumberFormat format, String exponentSymbol) {
        if (!fitsFixed(value)) {
            if (value.isNegative()) {
                sink.put(format.getNegativeSign());
            }
            sink.put(format.getCurrencySymbol());
            writeExponential(sink, BigInteger.valueOf(Math.abs(value.getMantissa())), value.getExponent(), precision, format, exponentSymbol);
            return;
        }
        final String fixed = value.toBigDecimal().abs().setScale(precision, RoundingMode.HALF_UP).toPlainString();
        if (value.isNegative() && !isAllZeros(fixed)) {
            sink.put(format.getNegativeSign());
        }
        sink.put(format.getCurrencySymbol());
        writeFixed(sink, fixed, true, format);
    }

    private static void formatExponential(CharSink sink, HugeNumber value, int precision, HugeNumberFormat format, String exponentSymbol) {
        if (value.isNegative()) {
            sink.put(format.getNegativeSign());
        }
        writeExponential(sink, BigInteger.valueOf(Math.abs(value.getMantissa())), value.getExponent(), precision, format, exponentSymbol);
    }

    private static void formatFixed(
            CharSink sink,
            HugeNumber value,
            int precision,
            boolean grouped,
            HugeNumberFormat format,
            String exponentSymbol
    ) {
        if (!fitsFixed(value)) {
            formatExponential(sink, value, precision, format, exponentSymbol);
            return;
        }
        final String fixed = value.toBigDecimal().abs().setScale(precision, RoundingMode.HALF_UP).toPlainString();
        if (value.isNegative() && !isAllZeros(fixed)) {
            sink.put(format.getNegativeSign());
        }
        writeFixed(sink, fixed, grouped, format);
    }

    private static void formatGeneral(CharSink sink, HugeNumber value, int precision, HugeNumberFormat format, String exponentSymbol) {
        if (precision > 0) {
            if (!value.isZero()) {
                value = HugeNumber.of(value.toBigDecimal().round(new MathContext(precision, RoundingMode.HALF_UP)));
            }
        }
        if (value.isZero()) {
            if (value.isNegativeZero()) {
                sink.put(format.getNegativeSign());
            }
            sink.put('0');
            return;
        }
        if (value.isNegative()) {
            sink.put(format.getNegativeSign());
        }
        writeGeneral(sink, Long.toString(Math.abs(value.getMantissa())), value.getExponent(), format, exponentSymbol);
        if (value.isRational()) {
            sink.put('/').put(value.getDenominator());
        }
    }

    private static void formatInteger(CharSink sink, HugeNumber value, int precision, HugeNumberFormat format, String exponentSymbol) {
        if (!fitsFixed(value)) {
            formatExponential(sink, value, 0, format, exponentSymbol);
            return;
        }
        final String digits = value.toBigDecimal().abs().setScale(0, RoundingMode.HALF_UP).toPlainString();
        if (value.isNegative() && !isAllZeros(digits)) {
            sink.put(format.getNegativeSign());
        }
        if (precision > digits.length()) {
            sink.repeat('0', precision - digits.length());
        }
        sink.put(digits);
    }

    private static boolean isAllZeros(String digits) {
        for (int i = 0, n = digits.length(); i < n; i++) {
            final char c = digits.charAt(i);
            if (c != '0' && c != '.') {
                return false;
            }
        }
        return true;
    }

    private static int parsePrecision(CharSequence pattern) {
        final int len = pattern.length();
        if (len == 1) {
            return -1;
        }
        if (len > 3) {
            throw NumericException.instance().position(3).put("invalid format pattern [pattern=").put(pattern).put(']');
        }
        int precision = 0;
        for (int i = 1; i < len; i++) {
            final char c = pattern.charAt(i);
            if (c < '0' || c > '9') {
                throw NumericException.instance().position(i).put("invalid format pattern [pattern=").put(pattern).put(']');
            }
            precision = precision * 10 + (c - '0');
        }
        return precision;
    }

    private static int precisionOr(int precision) {
        return precision < 0 ? DEFAULT_FIXED_PRECISION : precision;
    }

    private static int trailingZeros(String digits) {
        int count = 0;
        for (int i = digits.length() - 1; i > 0 && digits.charAt(i) == '0'; i--) {
            count++;
        }
        return count;
    }

    private static void writeExponent(CharSink sink, long exponent, HugeNumberFormat format, String exponentSymbol) {
        sink.put(exponentSymbol);
        if (exponent < 0) {
            sink.put(format.getNegativeSign()).put(-exponent);
        } else {
            sink.put(exponent);
        }
    }

    /**
     * Writes {@code digits * 10^exponent} as d.ddd followed by the exponent. A negative precision writes
     * every significant digit.
     */
    private static void writeExponential(
            CharSink sink,
            BigInteger digits,
            int exponent,
            int precision,
            HugeNumberFormat format,
            String exponentSymbol
    ) {
        if (digits.signum() == 0) {
            sink.put('0');
            if (precision > 0) {
                sink.put(format.getDecimalSeparator()).repeat('0', precision);
            }
            writeExponent(sink, 0, format, exponentSymbol);
            return;
        }
        final String text = digits.toString();
        long scientificExponent = (long) exponent + text.length() - 1;
        if (precision < 0) {
            final int significant = text.length() - trailingZeros(text);
            sink.put(text.charAt(0));
            if (significant > 1) {
                sink.put(format.getDecimalSeparator()).put(text, 1, significant);
            }
            writeExponent(sink, scientificExponent, format, exponentSymbol);
            return;
        }

        BigDecimal scaled = new BigDecimal(digits, text.length() - 1).setScale(precision, RoundingMode.HALF_UP);
        if (scaled.compareTo(BigDecimal.TEN) >= 0) {
            scaled = scaled.movePointLeft(1).setScale(precision, RoundingMode.HALF_UP);
            scientificExponent++;
        }
        final String plain = scaled.toPlainString();
        final int dot = plain.indexOf('.');
        if (dot < 0) {
            sink.put(plain);
        } else {
            sink.put(plain, 0, dot).put(format.getDecimalSeparator()).put(plain, dot + 1, plain.length());
        }
        writeExponent(sink, scientificExponent, format, exponentSymbol);
    }

    private static void writeFixed(CharSink sink, String plain, boolean grouped, HugeNumberFormat format) {
        final int dot = plain.indexOf('.');
        final int integralDigits = dot < 0 ? plain.length() : dot;
        if (grouped) {
            final int groupSize = format.getGroupSize();
            for (int i = 0; i < integralDigits; i++) {
                if (i > 0 && (integralDigits - i) % groupSize == 0) {
                    sink.put(format.getGroupSeparator());
                }
                sink.put(plain.charAt(i));
            }
        } else {
            sink.put(plain, 0, integralDigits);
        }
        if (dot > -1) {
            sink.put(format.getDecimalSeparator()).put(plain, dot + 1, plain.length());
        }
    }

    private static void writeGeneral(CharSink sink, String digits, int exponent, HugeNumberFormat format, String exponentSymbol) {
        final int length = digits.length();
        if (exponent == 0) {
            if (trailingZeros(digits) > MAX_GENERAL_TRAILING_ZEROS) {
                writeExponential(sink, new BigInteger(digits), exponent, -1, format, exponentSymbol);
            } else {
                sink.put(digits);
            }
            return;
        }
        if (exponent > 0 || exponent < -HugeNumber.MAX_MANTISSA_DIGITS) {
            writeExponential(sink, new BigInteger(digits), exponent, -1, format, exponentSymbol);
            return;
        }

        final int integralDigits = length + exponent;
        if (integralDigits > 0) {
            sink.put(digits, 0, integralDigits).put(format.getDecimalSeparator()).put(digits, integralDigits, length);
            return;
        }
        // "0." followed by -integralDigits zeros
        if (1 - integralDigits > MAX_GENERAL_LEADING_ZEROS) {
            writeExponential(sink, new BigInteger(digits), exponent, -1, format, exponentSymbol);
            return;
        }
        sink.put('0').put(format.getDecimalSeparator()).repeat('0', -integralDigits).put(digits);
    }
}
