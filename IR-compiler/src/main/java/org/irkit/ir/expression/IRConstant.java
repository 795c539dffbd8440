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

package org.irkit.ir.expression;

import org.irkit.compiler.visitors.inner.ExprFunctor;
import org.irkit.compiler.visitors.inner.ExprVisitor;
import org.irkit.util.IIndentStream;

import java.util.Objects;

/** A constant.  The value is opaque to all traversals. */
public final class IRConstant extends IRExpression {
    public final Object value;

    public IRConstant(Object value) {
        this.value = Objects.requireNonNull(value);
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.CONSTANT;
    }

    @Override
    public <R> R accept(ExprFunctor<R> functor) {
        return functor.visit(this);
    }

    @Override
    public void accept(ExprVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.value.toString());
    }
}
