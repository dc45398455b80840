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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;

/**
 * Growable, reusable character buffer. Unlike {@link StringBuilder} it is a {@link CharSink},
 * so formatting code can write into it without knowing the destination.
 */
public class StringSink implements CharSink, CharSequence {
    private char[] buffer;
    private int pos;

    public StringSink() {
        this(16);
    }

    public StringSink(int initialCapacity) {
        buffer = new char[Math.max(initialCapacity, 1)];
    }

    @Override
    public char charAt(int index) {
        if (index < 0 || index >= pos) {
            throw new IndexOutOfBoundsException("index " + index + ", length " + pos);
        }
        return buffer[index];
    }

    public void clear() {
        pos = 0;
    }

    @Override
    public int length() {
        return pos;
    }

    @Override
    public StringSink put(@Nullable CharSequence cs) {
        if (cs != null) {
            final int len = cs.length();
            ensureCapacity(len);
            for (int i = 0; i < len; i++) {
                buffer[pos++] = cs.charAt(i);
            }
        }
        return this;
    }

    @Override
    public StringSink put(char c) {
        ensureCapacity(1);
        buffer[pos++] = c;
        return this;
    }

    @NotNull
    @Override
    public CharSequence subSequence(int start, int end) {
        if (start < 0 || end > pos || start > end) {
            throw new IndexOutOfBoundsException("start " + start + ", end " + end + ", length " + pos);
        }
        return new String(buffer, start, end - start);
    }

    @NotNull
    @Override
    public String toString() {
        return new String(buffer, 0, pos);
    }

    private void ensureCapacity(int extra) {
        if (pos + extra > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(buffer.length * 2, pos + extra));
        }
    }
}
