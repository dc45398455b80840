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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class HugeNumberComparisonTest {
    private Rnd rnd;

    @Before
    public void setUp() {
        rnd = new Rnd();
    }

    @Test
    public void testClamp() {
        Assert.assertEquals(HugeNumber.of(5), HugeNumber.clamp(HugeNumber.of(7), HugeNumber.ONE, HugeNumber.of(5)));
        Assert.assertEquals(HugeNumber.ONE, HugeNumber.clamp(HugeNumber.NEGATIVE_INFINITY, HugeNumber.ONE, HugeNumber.of(5)));
        Assert.assertEquals(HugeNumber.of(3), HugeNumber.clamp(HugeNumber.of(3), HugeNumber.ONE, HugeNumber.of(5)));
        Assert.assertTrue(HugeNumber.clamp(HugeNumber.NaN, HugeNumber.ONE, HugeNumber.of(5)).isNaN());
        try {
            HugeNumber.clamp(HugeNumber.ONE, HugeNumber.of(5), HugeNumber.ONE);
            Assert.fail();
        } catch (NumericException e) {
            Assert.assertEquals("min [5] is greater than max [1]", e.getMessage());
        }
    }

    @Test
    public void testCompareAcrossExponents() {
        HugeNumber million = HugeNumber.of(10000000000000000L, -10);
        Assert.assertTrue(million.isGreaterThan(HugeNumber.of(2500)));
        Assert.assertTrue(million.isLessThanOrEqualTo(HugeNumber.of(10000000)));
        Assert.assertTrue(million.isGreaterThanOrEqualTo(HugeNumber.of(1, 6)));
        Assert.assertEquals(0, million.compareTo(HugeNumber.of(1, 6)));
        Assert.assertTrue(HugeNumber.of(-2, 42).isLessThan(HugeNumber.of(-1, 42)));
        Assert.assertTrue(HugeNumber.of(1, -300).isLessThan(HugeNumber.of(1, -299)));
        Assert.assertTrue(HugeNumber.of(-1, -300).isGreaterThan(HugeNumber.of(-1, -299)));
    }

    @Test
    public void testCompareFractions() {
        HugeNumber third = HugeNumber.ofRational(1, 3);
        Assert.assertTrue(third.isLessThan(HugeNumber.of(333333333333333334L, -18)));
        Assert.assertTrue(third.isGreaterThan(HugeNumber.of(333333333333333333L, -18)));
        Assert.assertTrue(third.isLessThan(HugeNumber.ofRational(1, 2)));
        Assert.assertTrue(HugeNumber.ofRational(-1, 3).isGreaterThan(HugeNumber.ofRational(-1, 2)));
        Assert.assertEquals(0, HugeNumber.ofRational(2, 3).compareTo(HugeNumber.ofRational(4, 6)));
        Assert.assertTrue(HugeNumber.ofRational(1, 7, 20).isGreaterThan(HugeNumber.of(1, 19)));
    }

    @Test
    public void testCompareToNumber() {
        Assert.assertEquals(0, HugeNumber.of(5).compareTo(5.0));
        Assert.assertEquals(0, HugeNumber.of(5).compareTo(5L));
        Assert.assertTrue(HugeNumber.of(5).compareTo(new BigDecimal("5.00000000000000001")) < 0);
        Assert.assertTrue(HugeNumber.NaN.compareTo(Double.NaN) == 0);
    }

    @Test
    public void testCompareWithRandomValuesAgreesWithBigDecimal() {
        for (int i = 0; i < 1000; i++) {
            HugeNumber a = rnd.nextHugeNumber(30);
            HugeNumber b = rnd.nextHugeNumber(30);
            Assert.assertEquals(
                    a + " vs " + b,
                    a.toBigDecimal().compareTo(b.toBigDecimal()),
                    a.compareTo(b)
            );
            Assert.assertEquals(-a.compareTo(b), b.compareTo(a));
        }
    }

    @Test
    public void testIsNearlyEqualTo() {
        HugeNumber tolerance = HugeNumber.of(1, -10);
        Assert.assertTrue(HugeNumber.ofRational(1, 3).isNearlyEqualTo(HugeNumber.of(3333333333L, -10), tolerance));
        Assert.assertFalse(HugeNumber.ofRational(1, 3).isNearlyEqualTo(HugeNumber.of(3333, -4), tolerance));
        Assert.assertTrue(HugeNumber.POSITIVE_INFINITY.isNearlyEqualTo(HugeNumber.POSITIVE_INFINITY, tolerance));
        Assert.assertFalse(HugeNumber.POSITIVE_INFINITY.isNearlyEqualTo(HugeNumber.NEGATIVE_INFINITY, tolerance));
        Assert.assertFalse(HugeNumber.NaN.isNearlyEqualTo(HugeNumber.NaN, tolerance));
    }

    @Test
    public void testMinMax() {
        Assert.assertEquals(HugeNumber.of(5), HugeNumber.max(HugeNumber.of(5), HugeNumber.of(-5)));
        Assert.assertEquals(HugeNumber.of(-5), HugeNumber.min(HugeNumber.of(5), HugeNumber.of(-5)));
        Assert.assertTrue(HugeNumber.max(HugeNumber.of(5), HugeNumber.NaN).isNaN());
        Assert.assertTrue(HugeNumber.min(HugeNumber.NaN, HugeNumber.of(5)).isNaN());
        Assert.assertTrue(HugeNumber.min(HugeNumber.ZERO, HugeNumber.NEGATIVE_ZERO).isNegativeZero());
        Assert.assertSame(HugeNumber.POSITIVE_INFINITY, HugeNumber.max(HugeNumber.MAX_VALUE, HugeNumber.POSITIVE_INFINITY));
    }

    @Test
    public void testNaNIsUnordered() {
        Assert.assertEquals(0, HugeNumber.NaN.compareTo(HugeNumber.NaN));
        Assert.assertTrue(HugeNumber.NaN.compareTo(HugeNumber.NEGATIVE_INFINITY) < 0);
        Assert.assertFalse(HugeNumber.NaN.isLessThan(HugeNumber.ONE));
        Assert.assertFalse(HugeNumber.ONE.isLessThan(HugeNumber.NaN));
        Assert.assertFalse(HugeNumber.NaN.isGreaterThanOrEqualTo(HugeNumber.NaN));
        Assert.assertFalse(HugeNumber.ONE.isGreaterThan(HugeNumber.NaN));
    }

    @Test
    public void testSortOrder() {
        List<HugeNumber> values = new ArrayList<>(Arrays.asList(
                HugeNumber.of(3),
                HugeNumber.NaN,
                HugeNumber.POSITIVE_INFINITY,
                HugeNumber.ofRational(1, 3),
                HugeNumber.NEGATIVE_INFINITY,
                HugeNumber.ZERO,
                HugeNumber.MIN_VALUE,
                HugeNumber.NEGATIVE_ZERO,
                HugeNumber.MAX_VALUE
        ));
        Collections.sort(values);
        Assert.assertSame(HugeNumber.NaN, values.get(0));
        Assert.assertSame(HugeNumber.NEGATIVE_INFINITY, values.get(1));
        Assert.assertSame(HugeNumber.MIN_VALUE, values.get(2));
        Assert.assertSame(HugeNumber.NEGATIVE_ZERO, values.get(3));
        Assert.assertSame(HugeNumber.ZERO, values.get(4));
        Assert.assertTrue(values.get(5).isRational());
        Assert.assertEquals(HugeNumber.of(3), values.get(6));
        Assert.assertSame(HugeNumber.MAX_VALUE, values.get(7));
        Assert.assertSame(HugeNumber.POSITIVE_INFINITY, values.get(8));
    }
}
