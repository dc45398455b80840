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

/**
 * Result of {@link HugeNumber#divRem(HugeNumber, HugeNumber)}.
 */
public final class DivRem {
    private final HugeNumber quotient;
    private final HugeNumber remainder;

    public DivRem(@NotNull HugeNumber quotient, @NotNull HugeNumber remainder) {
        this.quotient = quotient;
        this.remainder = remainder;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof DivRem)) {
            return false;
        }
        DivRem that = (DivRem) obj;
        return quotient.equals(that.quotient) && remainder.equals(that.remainder);
    }

    public HugeNumber getQuotient() {
        return quotient;
    }

    public HugeNumber getRemainder() {
        return remainder;
    }

    @Override
    public int hashCode() {
        return 31 * quotient.hashCode() + remainder.hashCode();
    }

    @Override
    public String toString() {
        return "(" + quotient + ", " + remainder + ')';
    }
}
