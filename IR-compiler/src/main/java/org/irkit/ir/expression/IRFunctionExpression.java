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
import org.irkit.ir.type.IRTypeVariable;
import org.irkit.util.IIndentStream;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/** A function (closure) with value parameters, type parameters and a body. */
public final class IRFunctionExpression extends IRExpression {
    public final ImmutableList<IRVariable> parameters;
    public final IRExpression body;
    /** Declared return type; null if not known. */
    @Nullable
    public final IRType returnType;
    public final ImmutableList<IRTypeVariable> typeParameters;
    public final IRAttributes attributes;

    public IRFunctionExpression(List<IRVariable> parameters, IRExpression body,
                                @Nullable IRType returnType, List<IRTypeVariable> typeParameters,
                                IRAttributes attributes) {
        this.parameters = ImmutableList.copyOf(parameters);
        this.body = Objects.requireNonNull(body);
        this.returnType = returnType;
        this.typeParameters = ImmutableList.copyOf(typeParameters);
        this.attributes = Objects.requireNonNull(attributes);
    }

    public IRFunctionExpression(List<IRVariable> parameters, IRExpression body) {
        this(parameters, body, null, ImmutableList.of(), IRAttributes.EMPTY);
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.FUNCTION;
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
        builder.append("fn");
        if (!this.typeParameters.isEmpty())
            builder.append("<").joinI(", ", this.typeParameters).append(">");
        builder.append("(")
                .joinI(", ", this.parameters)
                .append(")");
        if (this.returnType != null)
            builder.append(" -> ").append(this.returnType);
        return builder.append(" {")
                .increase()
                .append(this.body)
                .decrease()
                .newline()
                .append("}");
    }
}
