/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 *
 *
 */

package org.irkit.ir;

import com.google.common.collect.ImmutableMap;

import javax.annotation.Nullable;
import java.util.Map;

/** Opaque attributes attached to functions and calls.
 * The traversal framework never looks inside; rewrites carry
 * the same attribute object to the rebuilt node. */
public final class IRAttributes {
    public static final IRAttributes EMPTY = new IRAttributes(ImmutableMap.of());

    private final ImmutableMap<String, Object> values;

    private IRAttributes(ImmutableMap<String, Object> values) {
        this.values = values;
    }

    public static IRAttributes of(Map<String, ?> values) {
        if (values.isEmpty())
            return EMPTY;
        return new IRAttributes(ImmutableMap.copyOf(values));
    }

    @Nullable
    public Object get(String key) {
        return this.values.get(key);
    }

    public boolean isEmpty() {
        return this.values.isEmpty();
    }

    public int size() {
        return this.values.size();
    }

    @Override
    public String toString() {
        return this.values.toString();
    }
}
