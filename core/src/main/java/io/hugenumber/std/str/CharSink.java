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

package io.hugenumber.std.str;

import org.jetbrains.annotations.Nullable;

/**
 * Append-only character destination. Implementations return themselves from every
 * {@code put} so that calls can be chained.
 */
public interface CharSink {

    CharSink put(@Nullable CharSequence cs);

    CharSink put(char c);

    default CharSink put(CharSequence cs, int lo, int hi) {
        for (int i = lo; i < hi; i++) {
            put(cs.charAt(i));
        }
        return this;
    }

    default CharSink put(int value) {
        return put(Integer.toString(value));
    }

    default CharSink put(long value) {
        return put(Long.toString(value));
    }

    default CharSink put(boolean value) {
        return put(value ? "true" : "false");
    }

    default CharSink put(@Nullable Sinkable sinkable) {
        if (sinkable != null) {
            sinkable.toSink(this);
        }
        return this;
    }

    default CharSink repeat(char c, int n) {
        for (int i = 0; i < n; i++) {
            put(c);
        }
        return this;
    }
}
