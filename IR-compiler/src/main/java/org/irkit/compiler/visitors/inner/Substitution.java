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

package org.irkit.compiler.visitors.inner;

import org.irkit.ir.expression.IRExpression;
import org.irkit.ir.expression.IRVariable;
import org.irkit.util.Utilities;

import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.Map;

/** Maps variables to the expressions that replace them.
 * Variables are compared by reference, so two distinct variables
 * with the same name are independent keys. */
public class Substitution {
    private final Map<IRVariable, IRExpression> replacements;

    public Substitution() {
        this.replacements = new LinkedHashMap<>();
    }

    public Substitution substitute(IRVariable variable, IRExpression value) {
        this.replacements.put(variable, value);
        return this;
    }

    /** Add a substitution for a variable which must not already have one. */
    public Substitution substituteNew(IRVariable variable, IRExpression value) {
        Utilities.putNew(this.replacements, variable, value);
        return this;
    }

    @Nullable
    public IRExpression get(IRVariable variable) {
        return this.replacements.get(variable);
    }

    public boolean contains(IRVariable variable) {
        return this.replacements.containsKey(variable);
    }

    public boolean isEmpty() {
        return this.replacements.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append("[");
        for (Map.Entry<IRVariable, IRExpression> entry: this.replacements.entrySet()) {
            builder.append(entry.getKey())
                    .append("->")
                    .append(entry.getValue())
                    .append(",");
        }
        builder.append("]");
        return builder.toString();
    }
}
