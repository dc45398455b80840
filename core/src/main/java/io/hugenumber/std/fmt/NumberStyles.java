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

/**
 * Bit flags selecting what {@link HugeNumberParser} accepts around and inside the digits.
 */
public final class NumberStyles {
    public static final int NONE = 0;
    public static final int ALLOW_LEADING_WHITE = 1;
    public static final int ALLOW_TRAILING_WHITE = 1 << 1;
    public static final int ALLOW_LEADING_SIGN = 1 << 2;
    public static final int ALLOW_TRAILING_SIGN = 1 << 3;
    public static final int ALLOW_PARENTHESES = 1 << 4;
    public static final int ALLOW_DECIMAL_POINT = 1 << 5;
    public static final int ALLOW_THOUSANDS = 1 << 6;
    public static final int ALLOW_EXPONENT = 1 << 7;
    public static final int ALLOW_CURRENCY_SYMBOL = 1 << 8;
    public static final int INTEGER = ALLOW_LEADING_WHITE | ALLOW_TRAILING_WHITE | ALLOW_LEADING_SIGN;
    public static final int FLOAT = INTEGER | ALLOW_DECIMAL_POINT | ALLOW_EXPONENT;
    public static final int NUMBER = INTEGER | ALLOW_TRAILING_SIGN | ALLOW_DECIMAL_POINT | ALLOW_THOUSANDS;
    public static final int CURRENCY = NUMBER | ALLOW_PARENTHESES | ALLOW_CURRENCY_SYMBOL;
    public static final int ANY = CURRENCY | ALLOW_EXPONENT;

    private NumberStyles() {
    }

    public static boolean isSet(int styles, int flag) {
        return (styles & flag) == flag;
    }
}
