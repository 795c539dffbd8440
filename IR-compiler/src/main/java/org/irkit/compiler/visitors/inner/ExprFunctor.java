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

import org.irkit.compiler.errors.InternalCompilerError;
import org.irkit.ir.expression.IRCallExpression;
import org.irkit.ir.expression.IRConstant;
import org.irkit.ir.expression.IRExpression;
import org.irkit.ir.expression.IRFunctionExpression;
import org.irkit.ir.expression.IRGlobalVariable;
import org.irkit.ir.expression.IRIfExpression;
import org.irkit.ir.expression.IRLetExpression;
import org.irkit.ir.expression.IROp;
import org.irkit.ir.expression.IRTupleExpression;
import org.irkit.ir.expression.IRTupleGetItemExpression;
import org.irkit.ir.expression.IRVariable;
import org.irkit.util.IHasId;
import org.irkit.util.IWritesLogs;

/**
 * A function over expressions which dispatches on the kind of its argument.
 * Each kind has its own handler; handlers which are not overridden
 * fall back to {@link #visitDefault}, which fails.
 *
 * <p>A functor does no bookkeeping: calling {@link #visitExpr} twice on the
 * same node runs the handler twice.  See {@link ExprMutator} for the
 * memoized version.
 *
 * @param <R> Result produced for each expression. */
@SuppressWarnings("unused")
public abstract class ExprFunctor<R> implements IWritesLogs, IHasId {
    final long id;
    static long crtId = 0;

    protected ExprFunctor() {
        this.id = crtId++;
    }

    @Override
    public long getId() {
        return this.id;
    }

    /** Invoke the handler corresponding to the kind of the expression. */
    public R visitExpr(IRExpression expression) {
        return expression.accept(this);
    }

    /** Called for every kind which does not have an overridden handler. */
    public R visitDefault(IRExpression expression) {
        throw new InternalCompilerError(this + " does not have a handler for " +
                expression.getKind() + " " + expression, expression);
    }

    public R visit(IRVariable expression) {
        return this.visitDefault(expression);
    }

    public R visit(IRConstant expression) {
        return this.visitDefault(expression);
    }

    public R visit(IRGlobalVariable expression) {
        return this.visitDefault(expression);
    }

    public R visit(IROp expression) {
        return this.visitDefault(expression);
    }

    public R visit(IRTupleExpression expression) {
        return this.visitDefault(expression);
    }

    public R visit(IRFunctionExpression expression) {
        return this.visitDefault(expression);
    }

    public R visit(IRCallExpression expression) {
        return this.visitDefault(expression);
    }

    public R visit(IRLetExpression expression) {
        return this.visitDefault(expression);
    }

    public R visit(IRIfExpression expression) {
        return this.visitDefault(expression);
    }

    public R visit(IRTupleGetItemExpression expression) {
        return this.visitDefault(expression);
    }

    @Override
    public String toString() {
        return this.id + " " + this.getClass().getSimpleName();
    }
}
