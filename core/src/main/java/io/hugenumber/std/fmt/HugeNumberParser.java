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
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parser for converting text into {@link HugeNumber}.
 * <p>
 * This parser supports:
 * <ul>
 * <li>Decimal notation: "123.45", "-0.001"</li>
 * <li>Scientific notation: "1.23e5", "4.56E-3"</li>
 * <li>Exact fractions: "1/3", "2e-5/7"</li>
 * <li>The NaN and infinity symbols of the format</li>
 * <li>Leading/trailing whitespace and signs, parentheses, group separators and the currency symbol,
 * each enabled by a {@link NumberStyles} flag</li>
 * </ul>
 * Digits beyond the 18th significant one are rounded half up into the last kept digit.
 */
public final class HugeNumberParser {
    private static final Logger LOG = LoggerFactory.getLogger(HugeNumberParser.class);
    // exponents are accumulated up to this magnitude, anything larger over- or underflows anyway
    private static final long MAX_PARSED_EXPONENT = 10_000_000L;

    private HugeNumberParser() {
    }

    /**
     * Parses {@code cs[lo, hi)}.
     *
     * @param cs     the text to parse
     * @param lo     start index, inclusive
     * @param hi     end index, exclusive
     * @param styles {@link NumberStyles} flags
     * @param format symbols to recognize
     * @return the parsed number
     * @throws NumericException if the text is empty or not a number under the given styles; the position
     *                          of the exception points at the offending character
     */
    public static HugeNumber parse(
            @NotNull CharSequence cs,
            int lo,
            int hi,
            int styles,
            @NotNull HugeNumberFormat format
    ) throws NumericException {
        while (lo < hi && Character.isWhitespace(cs.charAt(lo))) {
            if (!NumberStyles.isSet(styles, NumberStyles.ALLOW_LEADING_WHITE)) {
                throw NumericException.instance().position(lo).put("leading whitespace is not allowed");
            }
            lo++;
        }
        while (hi > lo && Character.isWhitespace(cs.charAt(hi - 1))) {
            if (!NumberStyles.isSet(styles, NumberStyles.ALLOW_TRAILING_WHITE)) {
                throw NumericException.instance().position(hi - 1).put("trailing whitespace is not allowed");
            }
            hi--;
        }
        if (lo == hi) {
            throw NumericException.instance().position(lo).put("empty number");
        }

        if (regionEquals(cs, lo, hi, format.getNaNSymbol())) {
            return HugeNumber.NaN;
        }
        if (regionEquals(cs, lo, hi, format.getNegativeInfinitySymbol())) {
            return HugeNumber.NEGATIVE_INFINITY;
        }

        boolean negative = false;
        boolean signed = false;
        if (cs.charAt(lo) == '(') {
            if (!NumberStyles.isSet(styles, NumberStyles.ALLOW_PARENTHESES)) {
                throw NumericException.instance().position(lo).put("parentheses are not allowed");
            }
            if (cs.charAt(hi - 1) != ')') {
                throw NumericException.instance().position(hi - 1).put("unbalanced parentheses");
            }
            negative = true;
            signed = true;
            lo++;
            hi--;
        }

        boolean currency = false;
        // sign and currency symbol may come in either order
        for (int i = 0; i < 2 && lo < hi; i++) {
            if (!signed && NumberStyles.isSet(styles, NumberStyles.ALLOW_LEADING_SIGN)) {
                if (regionStartsWith(cs, lo, hi, format.getNegativeSign())) {
                    negative = true;
                    signed = true;
                    lo += format.getNegativeSign().length();
                    continue;
                }
                if (regionStartsWith(cs, lo, hi, format.getPositiveSign())) {
                    signed = true;
                    lo += format.getPositiveSign().length();
                    continue;
                }
            }
            if (!currency && isCurrencyAllowed(styles, format) && regionStartsWith(cs, lo, hi, format.getCurrencySymbol())) {
                currency = true;
                lo += format.getCurrencySymbol().length();
            }
        }
        for (int i = 0; i < 2 && lo < hi; i++) {
            if (!signed && NumberStyles.isSet(styles, NumberStyles.ALLOW_TRAILING_SIGN)) {
                if (regionEndsWith(cs, lo, hi, format.getNegativeSign())) {
                    negative = true;
                    signed = true;
                    hi -= format.getNegativeSign().length();
                    continue;
                }
                if (regionEndsWith(cs, lo, hi, format.getPositiveSign())) {
                    signed = true;
                    hi -= format.getPositiveSign().length();
                    continue;
                }
            }
            if (!currency && isCurrencyAllowed(styles, format) && regionEndsWith(cs, lo, hi, format.getCurrencySymbol())) {
                currency = true;
                hi -= format.getCurrencySymbol().length();
            }
        }
        if (lo == hi) {
            throw NumericException.instance().position(lo).put("number has no digits");
        }

        if (regionEquals(cs, lo, hi, format.getPositiveInfinitySymbol())) {
            return negative ? HugeNumber.NEGATIVE_INFINITY : HugeNumber.POSITIVE_INFINITY;
        }
        if (regionEquals(cs, lo, hi, format.getNaNSymbol())) {
            return HugeNumber.NaN;
        }

        final int slash = indexOf(cs, lo, hi, '/');
        if (slash > -1) {
            final HugeNumber numerator = parseDecimal(cs, lo, slash, styles, format, negative);
            final int denominator = parseDenominator(cs, slash + 1, hi);
            if (!numerator.isFinite()) {
                return numerator;
            }
            if (numerator.isZero()) {
                return numerator;
            }
            return HugeNumber.ofRational(numerator.getMantissa(), denominator, numerator.getExponent());
        }
        return parseDecimal(cs, lo, hi, styles, format, negative);
    }

    /**
     * Parses the whole of {@code cs}, returning null instead of throwing when it is not a number.
     */
    @Nullable
    public static HugeNumber tryParse(@Nullable CharSequence cs, int styles, @NotNull HugeNumberFormat format) {
        if (cs == null || cs.length() == 0) {
            return null;
        }
        try {
            return parse(cs, 0, cs.length(), styles, format);
        } catch (NumericException e) {
            LOG.debug("not a number [text={}, position={}, error={}]", cs, e.getPosition(), e.getFlyweightMessage());
            return null;
        }
    }

    private static int indexOf(CharSequence cs, int lo, int hi, char c) {
        for (int i = lo; i < hi; i++) {
            if (cs.charAt(i) == c) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isCurrencyAllowed(int styles, HugeNumberFormat format) {
        return NumberStyles.isSet(styles, NumberStyles.ALLOW_CURRENCY_SYMBOL) && !format.getCurrencySymbol().isEmpty();
    }

    private static boolean isExponentMarker(CharSequence cs, int pos, int hi, String exponentSymbol) {
        final char c = cs.charAt(pos);
        if (c == 'e' || c == 'E') {
            return true;
        }
        if (pos + exponentSymbol.length() > hi) {
            return false;
        }
        for (int i = 0, n = exponentSymbol.length(); i < n; i++) {
            if (Character.toLowerCase(cs.charAt(pos + i)) != Character.toLowerCase(exponentSymbol.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static HugeNumber parseDecimal(
            CharSequence cs,
            int lo,
            int hi,
            int styles,
            HugeNumberFormat format,
            boolean negative
    ) {
        final boolean allowThousands = NumberStyles.isSet(styles, NumberStyles.ALLOW_THOUSANDS);
        final boolean allowDecimalPoint = NumberStyles.isSet(styles, NumberStyles.ALLOW_DECIMAL_POINT);
        final String exponentSymbol = format.getExponentSymbol();

        long mantissa = 0;
        int significantDigits = 0;
        long exponent = 0;
        int firstDroppedDigit = -1;
        boolean digits = false;
        boolean fraction = false;
        int i = lo;
        for (; i < hi; i++) {
            final char c = cs.charAt(i);
            if (c >= '0' && c <= '9') {
                digits = true;
                final int digit = c - '0';
                if (mantissa == 0 && digit == 0) {
                    if (fraction) {
                        exponent--;
                    }
                    continue;
                }
                if (significantDigits < HugeNumber.MAX_MANTISSA_DIGITS) {
                    mantissa = mantissa * 10 + digit;
                    significantDigits++;
                    if (fraction) {
                        exponent--;
                    }
                } else {
                    if (firstDroppedDigit == -1) {
                        firstDroppedDigit = digit;
                    }
                    if (!fraction) {
                        exponent++;
                    }
                }
            } else if (c == format.getDecimalSeparator()) {
                if (!allowDecimalPoint || fraction) {
                    throw NumericException.instance().position(i).put("unexpected decimal separator");
                }
                fraction = true;
            } else if (c == format.getGroupSeparator()) {
                if (!allowThousands || fraction || !digits) {
                    throw NumericException.instance().position(i).put("unexpected group separator");
                }
            } else if (isExponentMarker(cs, i, hi, exponentSymbol)) {
                break;
            } else {
                throw NumericException.instance().position(i).put("unexpected character [").put(c).put(']');
            }
        }
        if (!digits) {
            throw NumericException.instance().position(i).put("number has no digits");
        }

        if (i < hi) {
            if (!NumberStyles.isSet(styles, NumberStyles.ALLOW_EXPONENT)) {
                throw NumericException.instance().position(i).put("exponent is not allowed");
            }
            final char marker = cs.charAt(i);
            i += (marker == 'e' || marker == 'E') ? 1 : exponentSymbol.length();
            boolean negativeExponent = false;
            if (i < hi && cs.charAt(i) == '+') {
                i++;
            } else if (i < hi && cs.charAt(i) == '-') {
                negativeExponent = true;
                i++;
            } else if (regionStartsWith(cs, i, hi, format.getNegativeSign())) {
                negativeExponent = true;
                i += format.getNegativeSign().length();
            } else if (regionStartsWith(cs, i, hi, format.getPositiveSign())) {
                i += format.getPositiveSign().length();
            }
            if (i == hi) {
                throw NumericException.instance().position(i).put("exponent has no digits");
            }
            long exponentValue = 0;
            for (; i < hi; i++) {
                final char c = cs.charAt(i);
                if (c < '0' || c > '9') {
                    throw NumericException.instance().position(i).put("unexpected character in exponent [").put(c).put(']');
                }
                if (exponentValue < MAX_PARSED_EXPONENT) {
                    exponentValue = exponentValue * 10 + (c - '0');
                }
            }
            exponent += negativeExponent ? -exponentValue : exponentValue;
        }

        if (firstDroppedDigit >= 5) {
            mantissa++;
        }
        if (mantissa == 0) {
            return negative ? HugeNumber.NEGATIVE_ZERO : HugeNumber.ZERO;
        }
        exponent = Math.max(-MAX_PARSED_EXPONENT, Math.min(MAX_PARSED_EXPONENT, exponent));
        return HugeNumber.of(negative ? -mantissa : mantissa, (int) exponent);
    }

    private static int parseDenominator(CharSequence cs, int lo, int hi) {
        if (lo == hi) {
            throw NumericException.instance().position(lo).put("denominator has no digits");
        }
        int denominator = 0;
        for (int i = lo; i < hi; i++) {
            final char c = cs.charAt(i);
            if (c < '0' || c > '9') {
                throw NumericException.instance().position(i).put("unexpected character in denominator [").put(c).put(']');
            }
            denominator = denominator * 10 + (c - '0');
            if (denominator > HugeNumber.MAX_DENOMINATOR) {
                throw NumericException.instance().position(i).put("denominator is greater than ").put(HugeNumber.MAX_DENOMINATOR);
            }
        }
        if (denominator == 0) {
            throw NumericException.instance().position(lo).put("denominator is zero");
        }
        return denominator;
    }

    private static boolean regionEndsWith(CharSequence cs, int lo, int hi, String s) {
        final int len = s.length();
        return len > 0 && hi - lo >= len && regionEquals(cs, hi - len, hi, s);
    }

    private static boolean regionEquals(CharSequence cs, int lo, int hi, String s) {
        if (hi - lo != s.length()) {
            return false;
        }
        for (int i = lo; i < hi; i++) {
            if (cs.charAt(i) != s.charAt(i - lo)) {
                return false;
            }
        }
        return true;
    }

    private static boolean regionStartsWith(CharSequence cs, int lo, int hi, String s) {
        final int len = s.length();
        return len > 0 && hi - lo >= len && regionEquals(cs, lo, lo + len, s);
    }
}
