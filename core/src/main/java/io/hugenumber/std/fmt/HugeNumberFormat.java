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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Symbols used to parse and format numbers: signs, separators, currency and percent symbols, and the
 * text of NaN and the infinities. Instances are immutable.
 */
public final class HugeNumberFormat {
    /**
     * Culture-independent symbols: "-", "+", ".", ",", groups of three, "¤", "%", "NaN",
     * "Infinity", "-Infinity" and "E".
     */
    public static final HugeNumberFormat INVARIANT = new HugeNumberFormat(
            "-", "+", '.', ',', 3, "¤", "%", "NaN", "Infinity", "-Infinity", "E"
    );
    private static final Logger LOG = LoggerFactory.getLogger(HugeNumberFormat.class);
    private final String currencySymbol;
    private final char decimalSeparator;
    private final String exponentSymbol;
    private final char groupSeparator;
    private final int groupSize;
    private final String nanSymbol;
    private final String negativeInfinitySymbol;
    private final String negativeSign;
    private final String percentSymbol;
    private final String positiveInfinitySymbol;
    private final String positiveSign;

    public HugeNumberFormat(
            @NotNull String negativeSign,
            @NotNull String positiveSign,
            char decimalSeparator,
            char groupSeparator,
            int groupSize,
            @NotNull String currencySymbol,
            @NotNull String percentSymbol,
            @NotNull String nanSymbol,
            @NotNull String positiveInfinitySymbol,
            @NotNull String negativeInfinitySymbol,
            @NotNull String exponentSymbol
    ) {
        if (negativeSign.isEmpty() || positiveSign.isEmpty() || nanSymbol.isEmpty()
                || positiveInfinitySymbol.isEmpty() || negativeInfinitySymbol.isEmpty() || exponentSymbol.isEmpty()) {
            throw new FormatConfigurationException("signs, exponent, NaN and infinity symbols must not be empty");
        }
        if (decimalSeparator == groupSeparator) {
            throw new FormatConfigurationException("decimal and group separators must differ [separator=" + decimalSeparator + ']');
        }
        if (groupSize < 1) {
            throw new FormatConfigurationException("group size must be positive [groupSize=" + groupSize + ']');
        }
        this.negativeSign = negativeSign;
        this.positiveSign = positiveSign;
        this.decimalSeparator = decimalSeparator;
        this.groupSeparator = groupSeparator;
        this.groupSize = groupSize;
        this.currencySymbol = currencySymbol;
        this.percentSymbol = percentSymbol;
        this.nanSymbol = nanSymbol;
        this.positiveInfinitySymbol = positiveInfinitySymbol;
        this.negativeInfinitySymbol = negativeInfinitySymbol;
        this.exponentSymbol = exponentSymbol;
    }

    public static HugeNumberFormat fromProperties(@NotNull Properties properties) {
        return fromProperties(properties, null);
    }

    /**
     * Builds a format from {@link FormatPropertyKey} properties; environment variables take precedence
     * and missing keys fall back to {@link #INVARIANT}.
     *
     * @throws FormatConfigurationException if a value is not valid
     */
    public static HugeNumberFormat fromProperties(@NotNull Properties properties, @Nullable Map<String, String> env) {
        return new HugeNumberFormat(
                getString(properties, env, FormatPropertyKey.NEGATIVE_SIGN, INVARIANT.negativeSign),
                getString(properties, env, FormatPropertyKey.POSITIVE_SIGN, INVARIANT.positiveSign),
                getChar(properties, env, FormatPropertyKey.DECIMAL_SEPARATOR, INVARIANT.decimalSeparator),
                getChar(properties, env, FormatPropertyKey.GROUP_SEPARATOR, INVARIANT.groupSeparator),
                getInt(properties, env, FormatPropertyKey.GROUP_SIZE, INVARIANT.groupSize),
                getString(properties, env, FormatPropertyKey.CURRENCY_SYMBOL, INVARIANT.currencySymbol),
                getString(properties, env, FormatPropertyKey.PERCENT_SYMBOL, INVARIANT.percentSymbol),
                getString(properties, env, FormatPropertyKey.NAN_SYMBOL, INVARIANT.nanSymbol),
                getString(properties, env, FormatPropertyKey.POSITIVE_INFINITY_SYMBOL, INVARIANT.positiveInfinitySymbol),
                getString(properties, env, FormatPropertyKey.NEGATIVE_INFINITY_SYMBOL, INVARIANT.negativeInfinitySymbol),
                getString(properties, env, FormatPropertyKey.EXPONENT_SYMBOL, INVARIANT.exponentSymbol)
        );
    }

    /**
     * Loads a properties resource from the classpath and builds a format from it.
     *
     * @throws FormatConfigurationException if the resource is missing or cannot be read
     */
    public static HugeNumberFormat load(@NotNull String resource) {
        try (InputStream is = HugeNumberFormat.class.getResourceAsStream(resource)) {
            if (is == null) {
                throw new FormatConfigurationException("format resource not found [resource=" + resource + ']');
            }
            final Properties properties = new Properties();
            properties.load(is);
            LOG.debug("loaded format [resource={}, keys={}]", resource, properties.size());
            return fromProperties(properties, null);
        } catch (IOException e) {
            throw new FormatConfigurationException("could not read format resource [resource=" + resource + ']', e);
        }
    }

    /**
     * Symbols of a locale, taken from {@link DecimalFormatSymbols}.
     */
    public static HugeNumberFormat of(@NotNull Locale locale) {
        final DecimalFormatSymbols symbols = DecimalFormatSymbols.getInstance(locale);
        final String negativeSign = String.valueOf(symbols.getMinusSign());
        return new HugeNumberFormat(
                negativeSign,
                "+",
                symbols.getDecimalSeparator(),
                symbols.getGroupingSeparator(),
                3,
                symbols.getCurrencySymbol(),
                String.valueOf(symbols.getPercent()),
                symbols.getNaN(),
                symbols.getInfinity(),
                negativeSign + symbols.getInfinity(),
                symbols.getExponentSeparator()
        );
    }

    public String getCurrencySymbol() {
        return currencySymbol;
    }

    public char getDecimalSeparator() {
        return decimalSeparator;
    }

    public String getExponentSymbol() {
        return exponentSymbol;
    }

    public char getGroupSeparator() {
        return groupSeparator;
    }

    public int getGroupSize() {
        return groupSize;
    }

    public String getNaNSymbol() {
        return nanSymbol;
    }

    public String getNegativeInfinitySymbol() {
        return negativeInfinitySymbol;
    }

    public String getNegativeSign() {
        return negativeSign;
    }

    public String getPercentSymbol() {
        return percentSymbol;
    }

    public String getPositiveInfinitySymbol() {
        return positiveInfinitySymbol;
    }

    public String getPositiveSign() {
        return positiveSign;
    }

    private static char getChar(Properties properties, @Nullable Map<String, String> env, FormatPropertyKey key, char defaultValue) {
        final String value = getString(properties, env, key, String.valueOf(defaultValue));
        if (value.length() != 1) {
            throw FormatConfigurationException.forInvalidKey(key.getPropertyPath(), value);
        }
        return value.charAt(0);
    }

    private static int getInt(Properties properties, @Nullable Map<String, String> env, FormatPropertyKey key, int defaultValue) {
        final String value = getString(properties, env, key, Integer.toString(defaultValue));
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw FormatConfigurationException.forInvalidKey(key.getPropertyPath(), value);
        }
    }

    private static String getString(Properties properties, @Nullable Map<String, String> env, FormatPropertyKey key, String defaultValue) {
        String result = env != null ? env.get(key.getEnvVarName()) : null;
        if (result != null) {
            LOG.debug("env config [key={}]", key.getEnvVarName());
            return result;
        }
        result = properties.getProperty(key.getPropertyPath());
        return result != null ? result : defaultValue;
    }
}
