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
 * Xorshift128+ pseudo-random generator. Two instances reset to the same seeds produce the same
 * sequence, which keeps randomized tests and benchmarks reproducible.
 */
public class Rnd {
    private long s0;
    private long s1;

    public Rnd(long s0, long s1) {
        reset(s0, s1);
    }

    public Rnd() {
        reset();
    }

    public boolean nextBoolean() {
        return nextLong() >>> (64 - 1) != 0;
    }

    /**
     * Random finite number: a mix of small integers, full 18 digit mantissas with moderate exponents,
     * exact fractions and values near the ends of the exponent range.
     */
    public HugeNumber nextHugeNumber() {
        switch (nextInt(4)) {
            case 0: // small integers (-1000 to 1000)
                return HugeNumber.of(nextLong() % 1001);
            case 1: // full mantissas, exponents within [-40, 40]
                return HugeNumber.of(nextLong() % (HugeNumber.MAX_MANTISSA + 1), nextInt(81) - 40);
            case 2: // fractions with small numerators and denominators
                return HugeNumber.ofRational(nextLong() % 100_000, nextInt(HugeNumber.MAX_DENOMINATOR) + 1, nextInt(21) - 10);
            default: // extreme exponents
                final int exponent = nextBoolean()
                        ? HugeNumber.MAX_EXPONENT - nextInt(100)
                        : HugeNumber.MIN_EXPONENT + nextInt(100);
                return HugeNumber.of(nextLong() % (HugeNumber.MAX_MANTISSA + 1), exponent);
        }
    }

    /**
     * Random finite, nonzero number with a mantissa of up to 18 digits and an exponent within
     * {@code [-exponentRange, exponentRange]}.
     */
    public HugeNumber nextHugeNumber(int exponentRange) {
        long mantissa;
        do {
            mantissa = nextLong() % (HugeNumber.MAX_MANTISSA + 1);
        } while (mantissa == 0);
        return HugeNumber.of(mantissa, nextInt(2 * exponentRange + 1) - exponentRange);
    }

    public int nextInt(int boundary) {
        return nextPositiveInt() % boundary;
    }

    public long nextLong(long boundary) {
        return nextPositiveLong() % boundary;
    }

    public long nextLong() {
        long l1 = s0;
        long l0 = s1;
        s0 = l0;
        l1 ^= l1 << 23;
        return (s1 = l1 ^ l0 ^ (l1 >> 17) ^ (l0 >> 26)) + l0;
    }

    public int nextPositiveInt() {
        int n = (int) nextLong();
        return n > 0 ? n : (n == Integer.MIN_VALUE ? Integer.MAX_VALUE : -n);
    }

    public long nextPositiveLong() {
        long l = nextLong();
        return l > 0 ? l : (l == Long.MIN_VALUE ? Long.MAX_VALUE : -l);
    }

    public final void reset(long s0, long s1) {
        this.s0 = s0;
        this.s1 = s1;
    }

    public final void reset() {
        reset(0xdeadbeef, 0xdee4c0ed);
    }
}
