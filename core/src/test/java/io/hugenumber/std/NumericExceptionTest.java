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
import org.junit.Test;

public class NumericExceptionTest {

    @Test
    public void testMessageAndPosition() {
        NumericException e = NumericException.instance().position(7).put("bad digit [").put('x').put("] at ").put(7L);
        Assert.assertEquals("bad digit [x] at 7", e.getMessage());
        Assert.assertEquals("bad digit [x] at 7", e.getFlyweightMessage().toString());
        Assert.assertEquals(7, e.getPosition());
    }

    @Test
    public void testInstanceIsCleared() {
        NumericException.instance().position(3).put("stale");
        NumericException e = NumericException.instance();
        Assert.assertEquals("", e.getMessage());
        Assert.assertEquals(0, e.getPosition());
    }

    @Test
    public void testPutSinkable() {
        NumericException e = NumericException.instance().put("value is out of long range: ").put(HugeNumber.of(1, 40));
        Assert.assertEquals("value is out of long range: 1e40", e.getMessage());
    }

    @Test
    public void testThrownByConversions() {
        try {
            HugeNumber.NaN.toLongExact();
            Assert.fail();
        } catch (NumericException e) {
            Assert.assertFalse(e.getMessage().isEmpty());
        }
    }
}
