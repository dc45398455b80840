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

/**
 * Integer helpers shared by the arithmetic code: powers of ten, digit counts and common factors.
 */
public final class Numbers {
    // Maximum values that 10^n can multiply without exceeding 18 digits
    public static final long[] MAX_SAFE_MULTIPLY = {
            999999999999999999L,
            99999999999999999L,
            9999999999999999L,
            999999999999999L,
            99999999999999L,
            9999999999999L,
            999999999999L,
            99999999999L,
            9999999999L,
            999999999L,
            99999999L,
            9999999L,
            999999L,
            99999L,
            9999L,
            999L,
            99L,
            9L,
            0L
    };
    // Power of 10 lookup table for 64-bit arithmetic (10^0 to 10^18)
    public static final long[] TEN_POWERS_TABLE = {
            1L,                     // 10^0
            10L,                    // 10^1
            100L,                   // 10^2
            1000L,                  // 10^3
            10000L,                 // 10^4
            100000L,                // 10^5
            1000000L,               // 10^6
            10000000L,              // 10^7
            100000000L,             // 10^8
            1000000000L,            // 10^9
            10000000000L,           // 10^10
            100000000000L,          // 10^11
            1000000000000L,         // 10^12
            10000000000000L,        // 10^13
            100000000000000L,       // 10^14
            1000000000000000L,      // 10^15
            10000000000000000L,     // 10^16
            100000000000000000L,    // 10^17
            1000000000000000000L,   // 10^18
    };

    private Numbers() {
    }

    /**
     * Number of decimal digits of {@code value}, ignoring the sign; 0 for zero.
     */
    public static int digitCount(long value) {
        if (value == Long.MIN_VALUE) {
            return 19;
        }
        if (value < 0) {
            value = -value;
        }
        if (value == 0) {
            return 0;
        }
        for (int i = 1; i < TEN_POWERS_TABLE.length; i++) {
            if (value < TEN_POWERS_TABLE[i]) {
                return i;
            }
        }
        return 19;
    }

    /**
     * Greatest common factor of the magnitudes of two values, Euclid's algorithm.
     * Returns the other value when one of them is zero.
     */
    public static long gcd(long a, long b) {
        a = Math.abs(a);
        b = Math.abs(b);
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        return a;
    }

    /**
     * @return true when the magnitude of {@code value} is 10^n for some n in [0, 18]
     */
    public static boolean isPowerOfTen(long value) {
        value = Math.abs(value);
        for (int i = 0; i < TEN_POWERS_TABLE.length; i++) {
            if (value == TEN_POWERS_TABLE[i]) {
                return true;
            }
        }
        return false;
    }

    /**
     * Divides by 10^pow rounding half to even, pow in [0, 18].
     */
    public static long roundHalfEvenDivide(long value, int pow) {
        if (pow == 0) {
            return value;
        }
        final long divisor = TEN_POWERS_TABLE[pow];
        long quotient = value / divisor;
        long remainder = Math.abs(value % divisor);
        long half = divisor / 2;
        if (remainder > half || (remainder == half && (quotient & 1) != 0)) {
            quotient += value < 0 ? -1 : 1;
        }
        return quotient;
    }
}
