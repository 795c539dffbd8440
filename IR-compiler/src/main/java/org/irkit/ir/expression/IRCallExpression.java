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

import com.google.common.collect.ImmutableList;
import org.irkit.compiler.visitors.inner.ExprFunctor;
import org.irkit.compiler.visitors.inner.ExprVisitor;
import org.irkit.ir.IRAttributes;
import org.irkit.ir.type.IRType;
import org.irkit.util.IIndentStream;

import java.util.List;
import java.util.Objects;

/** Invocation of an operator, global, or function value. */
public final class IRCallExpression extends IRExpression {
    public final IRExpression callee;
    public final ImmutableList<IRExpression> arguments;
    public final IRAttributes attributes;
    public final ImmutableList<IRType> typeArguments;

    public IRCallExpression(IRExpression callee, List<IRExpression> arguments,
                            IRAttributes attributes, List<IRType> typeArguments) {
        this.callee = Objects.requireNonNull(callee);
        this.arguments = ImmutableList.copyOf(arguments);
        this.attributes = Objects.requireNonNull(attributes);
        this.typeArguments = ImmutableList.copyOf(typeArguments);
    }

    public IRCallExpression(IRExpression callee, List<IRExpression> arguments) {
        this(callee, arguments, IRAttributes.EMPTY, ImmutableList.of());
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.CALL;
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
        builder.append(this.callee);
        if (!this.typeArguments.isEmpty())
            builder.append("<").joinI(", ", this.typeArguments).append(">");
        return builder.append("(")
                .joinI(", ", this.arguments)
                .append(")");
    }
}
