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
import org.irkit.ir.type.IRType;
import org.irkit.util.IHasId;
import org.irkit.util.IWritesLogs;
import org.irkit.util.Logger;
import org.irkit.util.Utilities;

import java.util.HashMap;
import java.util.Map;

/**
 * Read-only depth-first traversal of an expression DAG.
 *
 * <p>Every distinct node (compared by reference) is processed exactly once,
 * no matter how many parents reference it.  The visitor counts how many
 * times each node was reached; only the first time runs the handler.
 *
 * <p>Subclasses override the per-kind {@code visit} methods; an override
 * which wants the default traversal of the children calls {@code super.visit}.
 * Children must always be visited through {@link #visitExpr}, never by
 * calling a {@code visit} overload directly, or the deduplication is lost.
 *
 * <p>An instance keeps its state for its whole lifetime; use a fresh
 * instance for each pass.
 */
@SuppressWarnings("unused")
public abstract class ExprVisitor implements IRTransform, IWritesLogs, IHasId {
    final long id;
    static long crtId = 0;
    /** Maps the id of each node reached to the number of times it was reached. */
    private final Map<Long, Integer> visitCounter;

    protected ExprVisitor() {
        this.id = crtId++;
        this.visitCounter = new HashMap<>();
    }

    @Override
    public long getId() {
        return this.id;
    }

    /** Override to initialize before visiting any node. */
    public void startVisit(IRExpression expression) {
        Logger.INSTANCE.belowLevel(this, 4)
                .append("Starting ")
                .appendSupplier(this::toString)
                .append(" at ")
                .appendSupplier(expression::toString)
                .newline();
    }

    /** Override to finish after visiting all nodes. */
    public void endVisit() {
        Logger.INSTANCE.belowLevel(this, 2)
                .appendSupplier(this::toString)
                .append(" visited ")
                .append(this.visitCounter.size())
                .append(" distinct nodes")
                .newline();
    }

    /** Traverse the DAG rooted at the expression.
     * @return The expression itself. */
    @Override
    public IRExpression apply(IRExpression expression) {
        this.startVisit(expression);
        this.visitExpr(expression);
        this.endVisit();
        return expression;
    }

    /** Visit an expression; does nothing but count if the expression was already visited. */
    public void visitExpr(IRExpression expression) {
        Integer count = this.visitCounter.get(expression.getId());
        if (count != null) {
            this.visitCounter.put(expression.getId(), count + 1);
            return;
        }
        expression.accept(this);
        Utilities.putNew(this.visitCounter, expression.getId(), 1);
    }

    /** Number of times the expression was reached during this visitor's traversals;
     * 0 if it was never reached. */
    public int visitCount(IRExpression expression) {
        return this.visitCounter.getOrDefault(expression.getId(), 0);
    }

    /** Number of distinct expressions processed. */
    public int distinctVisited() {
        return this.visitCounter.size();
    }

    /** Hook for types appearing in expressions.  Does nothing by default. */
    public void visitType(IRType type) {}

    public void visit(IRVariable expression) {
        if (expression.typeAnnotation != null)
            this.visitType(expression.typeAnnotation);
    }

    public void visit(IRConstant expression) {}

    public void visit(IRGlobalVariable expression) {}

    public void visit(IROp expression) {}

    public void visit(IRTupleExpression expression) {
        for (IRExpression field: expression.fields)
            this.visitExpr(field);
    }

    /** Type parameters and return type are not visited. */
    public void visit(IRFunctionExpression expression) {
        for (IRVariable param: expression.parameters)
            this.visitExpr(param);
        this.visitExpr(expression.body);
    }

    public void visit(IRCallExpression expression) {
        this.visitExpr(expression.callee);
        for (IRType typeArg: expression.typeArguments)
            this.visitType(typeArg);
        for (IRExpression arg: expression.arguments)
            this.visitExpr(arg);
    }

    /** The value is visited before the variable. */
    public void visit(IRLetExpression expression) {
        this.visitExpr(expression.value);
        this.visitExpr(expression.variable);
        this.visitExpr(expression.body);
    }

    public void visit(IRIfExpression expression) {
        this.visitExpr(expression.condition);
        this.visitExpr(expression.trueBranch);
        this.visitExpr(expression.falseBranch);
    }

    public void visit(IRTupleGetItemExpression expression) {
        this.visitExpr(expression.tuple);
    }

    @Override
    public String toString() {
        return this.id + " " + this.getClass().getSimpleName();
    }
}
