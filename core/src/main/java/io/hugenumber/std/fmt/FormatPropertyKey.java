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

import java.util.Locale;

/**
 * Keys understood by {@link HugeNumberFormat#fromProperties}. Each key can be overridden by an
 * environment variable, e.g. {@code hugenumber.format.decimal.separator} by
 * {@code HUGENUMBER_FORMAT_DECIMAL_SEPARATOR}.
 */
public enum FormatPropertyKey {
    NEGATIVE_SIGN("hugenumber.format.negative.sign"),
    POSITIVE_SIGN("hugenumber.format.positive.sign"),
    DECIMAL_SEPARATOR("hugenumber.format.decimal.separator"),
    GROUP_SEPARATOR("hugenumber.format.group.separator"),
    GROUP_SIZE("hugenumber.format.group.size"),
    CURRENCY_SYMBOL("hugenumber.format.currency.symbol"),
    PERCENT_SYMBOL("hugenumber.format.percent.symbol"),
    NAN_SYMBOL("hugenumber.format.nan.symbol"),
    POSITIVE_INFINITY_SYMBOL("hugenumber.format.positive.infinity.symbol"),
    NEGATIVE_INFINITY_SYMBOL("hugenumber.format.negative.infinity.symbol"),
    EXPONENT_SYMBOL("hugenumber.format.exponent.symbol");

    private final String envVarName;
    private final String propertyPath;

    FormatPropertyKey(String propertyPath) {
        this.propertyPath = propertyPath;
        this.envVarName = propertyPath.replace('.', '_').toUpperCase(Locale.ROOT);
    }

    public String getEnvVarName() {
        return envVarName;
    }

    public String getPropertyPath() {
        return propertyPath;
    }
}
