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

import java.util.function.Consumer;

/** Invokes an action on every distinct node of a DAG exactly once,
 * after the action has been invoked on all the node's children. */
public class PostOrderVisitor extends ExprVisitor {
    final Consumer<IRExpression> action;

    public PostOrderVisitor(Consumer<IRExpression> action) {
        this.action = action;
    }

    @Override
    public void visitExpr(IRExpression expression) {
        boolean first = this.visitCount(expression) == 0;
        super.visitExpr(expression);
        if (first)
            this.action.accept(expression);
    }

    /** Invoke 'action' in post-order on all nodes reachable from 'expression'. */
    public static void visit(IRExpression expression, Consumer<IRExpression> action) {
        new PostOrderVisitor(action).apply(expression);
    }
}
