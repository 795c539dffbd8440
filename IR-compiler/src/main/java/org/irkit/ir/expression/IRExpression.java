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
import org.irkit.ir.IRAttributes;
import org.irkit.ir.IRNode;
import org.irkit.ir.type.IRType;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.List;

/** Base class for all expressions.  Expressions form a DAG: a node
 * may be referenced from many parents. */
public abstract class IRExpression extends IRNode {
    protected IRExpression() {
        super();
    }

    /** The kind of this expression. */
    public abstract ExprKind getKind();

    /** Dispatch to the handler of a functor which corresponds to the kind of this node. */
    public abstract <R> R accept(ExprFunctor<R> functor);

    /** Dispatch to the handler of a visitor which corresponds to the kind of this node. */
    public abstract void accept(ExprVisitor visitor);

    /** The exact same expression, using reference equality */
    public static boolean same(@Nullable IRExpression left, @Nullable IRExpression right) {
        return left == right;
    }

    public IRTupleGetItemExpression getItem(int index) {
        return new IRTupleGetItemExpression(this, index);
    }

    public IRCallExpression call(IRExpression... arguments) {
        return new IRCallExpression(this, Arrays.asList(arguments));
    }

    public IRCallExpression call(List<IRExpression> arguments, IRAttributes attributes, List<IRType> typeArguments) {
        return new IRCallExpression(this, arguments, attributes, typeArguments);
    }
}
