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

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class HugeMathTest {
    private Rnd rnd;

    @Before
    public void setUp() {
        rnd = new Rnd();
    }

    @Test
    public void testExp() {
        Assert.assertEquals(HugeNumber.ONE, HugeMath.exp(HugeNumber.ZERO));
        Assert.assertEquals(HugeNumberConstants.E, HugeMath.exp(HugeNumber.ONE));
        assertClose(7.38905609893065, HugeMath.exp(HugeNumber.TWO), 1e-13);
        assertClose(1.6487212707001282, HugeMath.exp(HugeNumber.of(5, -1)), 1e-15);
        assertClose(0.36787944117144233, HugeMath.exp(HugeNumber.NEGATIVE_ONE), 1e-15);
        assertClose(22026.465794806718, HugeMath.exp(HugeNumber.TEN), 1e-9);
    }

    @Test
    public void testExpOfLargeArguments() {
        // e^1000 = 1.97007111401704699e434
        HugeNumber value = HugeMath.exp(HugeNumber.of(1000));
        Assert.assertEquals(434, value.getAdjustedExponent());
        Assert.assertTrue(value.toString(), value.isNearlyEqualTo(HugeNumber.of(197007111401704699L, 417), HugeNumber.of(1, 421)));
        Assert.assertTrue(HugeMath.exp(HugeNumber.of(75501)).isPositiveInfinity());
        Assert.assertSame(HugeNumber.ZERO, HugeMath.exp(HugeNumber.of(-75501)));
    }

    @Test
    public void testExpSpecialValues() {
        Assert.assertTrue(HugeMath.exp(HugeNumber.NaN).isNaN());
        Assert.assertTrue(HugeMath.exp(HugeNumber.POSITIVE_INFINITY).isPositiveInfinity());
        Assert.assertSame(HugeNumber.ZERO, HugeMath.exp(HugeNumber.NEGATIVE_INFINITY));
        Assert.assertEquals(HugeNumber.ONE, HugeMath.exp(HugeNumber.NEGATIVE_ZERO));
    }

    @Test
    public void testExp2AndExp10() {
        Assert.assertEquals(HugeNumber.of(1024), HugeMath.exp2(HugeNumber.TEN));
        Assert.assertEquals(HugeNumber.of(1, 5), HugeMath.exp10(HugeNumber.of(5)));
        Assert.assertEquals(HugeNumber.of(1, -5), HugeMath.exp10(HugeNumber.of(-5)));
        Assert.assertTrue(HugeMath.exp10(HugeNumber.of(40000)).isPositiveInfinity());
        Assert.assertSame(HugeNumber.ZERO, HugeMath.exp10(HugeNumber.of(-40000)));
        assertClose(3.1622776601683795, HugeMath.exp10(HugeNumber.of(5, -1)), 1e-14);
    }

    @Test
    public void testExpOfLogIsIdentity() {
        for (int i = 0; i < 100; i++) {
            HugeNumber value = rnd.nextHugeNumber(10).abs();
            HugeNumber roundTrip = HugeMath.exp(HugeMath.log(value));
            HugeNumber tolerance = HugeNumber.multiply(value, HugeNumber.of(1, -12));
            Assert.assertTrue(value + " -> " + roundTrip, roundTrip.isNearlyEqualTo(value, tolerance));
        }
    }

    @Test
    public void testHypot() {
        Assert.assertEquals(HugeNumber.of(5), HugeMath.hypot(HugeNumber.of(3), HugeNumber.of(4)));
        Assert.assertTrue(HugeMath.hypot(HugeNumber.NEGATIVE_INFINITY, HugeNumber.NaN).isPositiveInfinity());
        Assert.assertTrue(HugeMath.hypot(HugeNumber.ONE, HugeNumber.NaN).isNaN());
    }

    @Test
    public void testLog() {
        assertClose(1.791759469228, HugeMath.log(HugeNumber.of(6)), 1e-12);
        assertClose(-0.6931471805599453, HugeMath.log(HugeNumber.of(5, -1)), 1e-15);
        assertClose(2.302585092994046, HugeMath.log(HugeNumber.TEN), 1e-15);
        Assert.assertSame(HugeNumber.ZERO, HugeMath.log(HugeNumber.ONE));
        assertClose(-1.0986122886681098, HugeMath.log(HugeNumber.ofRational(1, 3)), 1e-15);
    }

    @Test
    public void testLogOfHugeValues() {
        Assert.assertEquals(HugeNumber.of(230258509299404568L, -13), HugeMath.log(HugeNumber.of(1, 10000)));
        assertClose(-75451.108327228889, HugeMath.log(HugeNumber.EPSILON), 1e-9);
        assertClose(75490.252273809788, HugeMath.log(HugeNumber.MAX_VALUE), 1e-9);
    }

    @Test
    public void testLogSpecialValues() {
        Assert.assertTrue(HugeMath.log(HugeNumber.NaN).isNaN());
        Assert.assertTrue(HugeMath.log(HugeNumber.of(-1)).isNaN());
        Assert.assertTrue(HugeMath.log(HugeNumber.NEGATIVE_INFINITY).isNaN());
        Assert.assertTrue(HugeMath.log(HugeNumber.ZERO).isPositiveInfinity());
        Assert.assertTrue(HugeMath.log(HugeNumber.NEGATIVE_ZERO).isPositiveInfinity());
        Assert.assertTrue(HugeMath.log(HugeNumber.POSITIVE_INFINITY).isPositiveInfinity());
    }

    @Test
    public void testLogWithBase() {
        assertClose(3, HugeMath.log(HugeNumber.of(8), HugeNumber.TWO), 1e-14);
        assertClose(-2, HugeMath.log(HugeNumber.of(1, -2), HugeNumber.TEN), 1e-15);
        Assert.assertTrue(HugeMath.log(HugeNumber.of(5), HugeNumber.ONE).isNaN());
        Assert.assertTrue(HugeMath.log(HugeNumber.ONE, HugeNumber.ONE).isNaN());
        Assert.assertTrue(HugeMath.log(HugeNumber.of(5), HugeNumber.ZERO).isNaN());
        Assert.assertTrue(HugeMath.log(HugeNumber.of(5), HugeNumber.POSITIVE_INFINITY).isNaN());
        Assert.assertTrue(HugeMath.log(HugeNumber.of(5), HugeNumber.NaN).isNaN());
        Assert.assertTrue(HugeMath.log(HugeNumber.of(-5), HugeNumber.TWO).isNaN());
        Assert.assertSame(HugeNumber.ZERO, HugeMath.log(HugeNumber.ONE, HugeNumber.ZERO));
        Assert.assertSame(HugeNumber.ZERO, HugeMath.log(HugeNumber.ONE, HugeNumber.POSITIVE_INFINITY));
        Assert.assertTrue(HugeMath.log(HugeNumber.ZERO, HugeNumber.TWO).isPositiveInfinity());
        Assert.assertTrue(HugeMath.log(HugeNumber.POSITIVE_INFINITY, HugeNumber.TWO).isPositiveInfinity());
    }

    @Test
    public void testLog10AndLog2() {
        Assert.assertEquals(HugeNumber.of(42), HugeMath.log10(HugeNumber.of(1, 42)));
        Assert.assertEquals(HugeNumber.of(-5), HugeMath.log10(HugeNumber.of(1, -5)));
        Assert.assertEquals(HugeNumber.ZERO, HugeMath.log10(HugeNumber.ONE));
        assertClose(0.3010299956639812, HugeMath.log10(HugeNumber.TWO), 1e-15);
        Assert.assertTrue(HugeMath.log10(HugeNumber.of(-10)).isNaN());
        Assert.assertTrue(HugeMath.log10(HugeNumber.ZERO).isPositiveInfinity());

        assertClose(3, HugeMath.log2(HugeNumber.of(8)), 1e-14);
        assertClose(-1, HugeMath.log2(HugeNumber.of(5, -1)), 1e-15);
        Assert.assertTrue(HugeMath.log2(HugeNumber.NaN).isNaN());
    }

    @Test
    public void testLogPlusOne() {
        assertClose(0.6931471805599453, HugeMath.logP1(HugeNumber.ONE), 1e-15);
        assertClose(1, HugeMath.log2P1(HugeNumber.ONE), 1e-14);
        assertClose(2, HugeMath.log10P1(HugeNumber.of(99)), 1e-15);
        Assert.assertTrue(HugeMath.logP1(HugeNumber.of(-2)).isNaN());
    }

    @Test
    public void testPow() {
        Assert.assertEquals(HugeNumber.of(1024), HugeMath.pow(HugeNumber.TWO, HugeNumber.TEN));
        Assert.assertEquals(HugeNumber.of(-8), HugeMath.pow(HugeNumber.of(-2), HugeNumber.of(3)));
        Assert.assertEquals(HugeNumber.of(16), HugeMath.pow(HugeNumber.of(-2), HugeNumber.of(4)));
        Assert.assertEquals(HugeNumber.of(25, -2), HugeMath.pow(HugeNumber.TWO, HugeNumber.of(-2)));
        Assert.assertEquals(HugeNumber.ofRational(1, 27), HugeMath.pow(HugeNumber.ofRational(1, 3), HugeNumber.of(3)));
        Assert.assertEquals(HugeNumber.of(1, 300), HugeMath.pow(HugeNumber.TEN, HugeNumber.of(300)));
        assertClose(2, HugeMath.pow(HugeNumber.of(4), HugeNumber.of(5, -1)), 1e-14);
        assertClose(1.4142135623730951, HugeMath.pow(HugeNumber.TWO, HugeNumber.of(5, -1)), 1e-14);
        Assert.assertTrue(HugeMath.pow(HugeNumber.TEN, HugeNumber.of(40000)).isPositiveInfinity());
    }

    @Test
    public void testPowOfSquareAndCubeMatchesMultiplication() {
        for (int i = 0; i < 100; i++) {
            HugeNumber value = rnd.nextHugeNumber(20);
            Assert.assertEquals(HugeNumber.square(value), HugeMath.pow(value, HugeNumber.TWO));
            Assert.assertEquals(HugeNumber.cube(value), HugeMath.pow(value, HugeNumber.of(3)));
        }
    }

    @Test
    public void testPowSpecialValues() {
        Assert.assertTrue(HugeMath.pow(HugeNumber.NaN, HugeNumber.ONE).isNaN());
        Assert.assertTrue(HugeMath.pow(HugeNumber.ONE, HugeNumber.NaN).isNaN());
        Assert.assertSame(HugeNumber.ONE, HugeMath.pow(HugeNumber.of(123), HugeNumber.ZERO));
        Assert.assertSame(HugeNumber.ONE, HugeMath.pow(HugeNumber.POSITIVE_INFINITY, HugeNumber.ZERO));
        Assert.assertTrue(HugeMath.pow(HugeNumber.ZERO, HugeNumber.of(-1)).isPositiveInfinity());
        Assert.assertSame(HugeNumber.ZERO, HugeMath.pow(HugeNumber.ZERO, HugeNumber.of(3)));
        Assert.assertTrue(HugeMath.pow(HugeNumber.of(-2), HugeNumber.of(5, -1)).isNaN());

        Assert.assertSame(HugeNumber.ONE, HugeMath.pow(HugeNumber.NEGATIVE_ONE, HugeNumber.POSITIVE_INFINITY));
        Assert.assertSame(HugeNumber.ZERO, HugeMath.pow(HugeNumber.of(5, -1), HugeNumber.POSITIVE_INFINITY));
        Assert.assertTrue(HugeMath.pow(HugeNumber.TWO, HugeNumber.POSITIVE_INFINITY).isPositiveInfinity());
        Assert.assertSame(HugeNumber.ZERO, HugeMath.pow(HugeNumber.TWO, HugeNumber.NEGATIVE_INFINITY));
        Assert.assertTrue(HugeMath.pow(HugeNumber.of(5, -1), HugeNumber.NEGATIVE_INFINITY).isPositiveInfinity());

        Assert.assertTrue(HugeMath.pow(HugeNumber.POSITIVE_INFINITY, HugeNumber.TWO).isPositiveInfinity());
        Assert.assertSame(HugeNumber.ZERO, HugeMath.pow(HugeNumber.POSITIVE_INFINITY, HugeNumber.of(-2)));
        Assert.assertTrue(HugeMath.pow(HugeNumber.NEGATIVE_INFINITY, HugeNumber.of(3)).isNegativeInfinity());
        Assert.assertTrue(HugeMath.pow(HugeNumber.NEGATIVE_INFINITY, HugeNumber.TWO).isPositiveInfinity());
        Assert.assertTrue(HugeMath.pow(HugeNumber.NEGATIVE_INFINITY, HugeNumber.of(-3)).isNegativeZero());
        Assert.assertSame(HugeNumber.ZERO, HugeMath.pow(HugeNumber.NEGATIVE_INFINITY, HugeNumber.of(-2)));
    }

    @Test
    public void testRoots() {
        Assert.assertEquals(HugeNumber.of(4), HugeMath.sqrt(HugeNumber.of(16)));
        Assert.assertEquals(HugeNumber.of(3, 100), HugeMath.sqrt(HugeNumber.of(9, 200)));
        Assert.assertEquals(HugeNumberConstants.ROOT2, HugeMath.sqrt(HugeNumber.TWO));
        Assert.assertTrue(HugeMath.sqrt(HugeNumber.of(-1)).isNaN());
        Assert.assertTrue(HugeMath.sqrt(HugeNumber.NEGATIVE_ZERO).isNegativeZero());
        Assert.assertTrue(HugeMath.sqrt(HugeNumber.POSITIVE_INFINITY).isPositiveInfinity());
        Assert.assertTrue(HugeMath.sqrt(HugeNumber.NEGATIVE_INFINITY).isNaN());

        Assert.assertEquals(HugeNumber.of(-3), HugeMath.cbrt(HugeNumber.of(-27)));
        Assert.assertEquals(HugeNumber.TWO, HugeMath.rootN(HugeNumber.of(16), 4));
        Assert.assertTrue(HugeMath.rootN(HugeNumber.of(-16), 4).isNaN());
        Assert.assertTrue(HugeMath.rootN(HugeNumber.of(16), 0).isNaN());
        Assert.assertEquals(HugeNumber.of(16), HugeMath.rootN(HugeNumber.of(16), 1));
        assertClose(1.2599210498948732, HugeMath.cbrt(HugeNumber.TWO), 1e-15);
    }

    private static void assertClose(double expected, HugeNumber actual, double tolerance) {
        Assert.assertEquals(actual.toString(), expected, actual.doubleValue(), tolerance);
    }
}
