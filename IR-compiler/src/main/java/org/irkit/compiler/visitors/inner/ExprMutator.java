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

import com.google.common.collect.ImmutableList;
import org.irkit.compiler.errors.InternalCompilerError;
import org.irkit.ir.IRNode;
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
import org.irkit.ir.type.IRTypeVariable;
import org.irkit.util.Linq;
import org.irkit.util.Logger;
import org.irkit.util.Utilities;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Functional rewriting of an expression DAG.
 *
 * <p>The result of rewriting each node is memoized, keyed by the node's identity:
 * a node reachable from many parents is rewritten once, and all parents
 * see the same replacement.  In particular a variable is rewritten once,
 * so a binder and all its uses keep referring to the same variable.
 *
 * <p>A node is rebuilt only if one of its children was replaced;
 * otherwise the original node is returned, so callers can use
 * reference equality to detect that nothing changed.
 * Opaque data (attributes, tuple indexes, constant values) is copied
 * to rebuilt nodes unchanged.
 *
 * <p>Subclasses override the per-kind {@code visit} methods and
 * recurse on children with {@link #mutate}.
 */
public abstract class ExprMutator extends ExprFunctor<IRExpression> implements IRTransform {
    /** If true every node which has children is rebuilt, even if no child has changed. */
    protected final boolean force;
    /** Maps the id of an original node to its replacement. */
    private final Map<Long, IRExpression> memo;

    protected ExprMutator(boolean force) {
        super();
        this.force = force;
        this.memo = new HashMap<>();
    }

    protected ExprMutator() {
        this(false);
    }

    /** Override to initialize before rewriting any node. */
    public void startVisit(IRExpression expression) {
        Logger.INSTANCE.belowLevel(this, 4)
                .append("Starting ")
                .appendSupplier(this::toString)
                .append(" at ")
                .appendSupplier(expression::toString)
                .newline();
    }

    /** Override to finish after rewriting all nodes. */
    public void endVisit() {
        Logger.INSTANCE.belowLevel(this, 2)
                .appendSupplier(this::toString)
                .append(" rewrote ")
                .append(this.memo.size())
                .append(" distinct nodes")
                .newline();
    }

    /** Rewrite the DAG rooted at the expression. */
    @Override
    public IRExpression apply(IRExpression expression) {
        this.startVisit(expression);
        IRExpression result = this.mutate(expression);
        this.endVisit();
        return result;
    }

    /** Rewrite an expression.  Each distinct expression is rewritten at most
     * once; later calls return the memoized result. */
    public IRExpression mutate(IRExpression expression) {
        IRExpression result = this.memo.get(expression.getId());
        if (result != null)
            return result;
        result = expression.accept(this);
        Utilities.putNew(this.memo, expression.getId(), result);
        return result;
    }

    /** Same as {@link #mutate}; dispatching always goes through the memo table. */
    @Override
    public final IRExpression visitExpr(IRExpression expression) {
        return this.mutate(expression);
    }

    /** The memoized rewrite of an expression, or null if the expression
     * has not been rewritten by this mutator. */
    @Nullable
    public IRExpression getMemoized(IRExpression expression) {
        return this.memo.get(expression.getId());
    }

    /** Number of distinct expressions rewritten. */
    public int memoSize() {
        return this.memo.size();
    }

    /** Hook for types appearing in expressions.  Returns the type unchanged by default. */
    public IRType visitType(IRType type) {
        return type;
    }

    /** Record that 'old' has been rebuilt as 'result'. */
    protected <T extends IRExpression> T map(IRExpression old, T result) {
        Logger.INSTANCE.belowLevel(this, 1)
                .appendSupplier(this::toString)
                .append(":")
                .appendSupplier(old::toString)
                .append(" -> ")
                .appendSupplier(result::toString)
                .newline();
        return result;
    }

    /** True if a node whose children are all unchanged can be returned as is. */
    protected boolean keep(boolean unchanged) {
        return unchanged && !this.force;
    }

    /** Check that rewriting 'source' produced a node of the expected class. */
    protected <T> T downcast(IRNode result, Class<T> clazz, IRNode source, String role) {
        T cast = result.as(clazz);
        if (cast == null)
            throw new InternalCompilerError("Rewriting " + role + " " + source + " produced " +
                    result.getClass().getSimpleName() + " " + result +
                    "; expected " + clazz.getSimpleName(), source);
        return cast;
    }

    protected ImmutableList<IRExpression> mutateAll(List<IRExpression> expressions) {
        return Linq.immutableMap(expressions, e -> this.mutate(e));
    }

    @Override
    public IRExpression visit(IRVariable expression) {
        if (expression.typeAnnotation != null) {
            IRType type = this.visitType(expression.typeAnnotation);
            if (!this.keep(type == expression.typeAnnotation))
                return this.map(expression, new IRVariable(expression.nameHint, type));
        } else if (this.force) {
            return this.map(expression, new IRVariable(expression.nameHint));
        }
        return expression;
    }

    @Override
    public IRExpression visit(IRConstant expression) {
        return expression;
    }

    @Override
    public IRExpression visit(IRGlobalVariable expression) {
        return expression;
    }

    @Override
    public IRExpression visit(IROp expression) {
        return expression;
    }

    @Override
    public IRExpression visit(IRTupleExpression expression) {
        ImmutableList<IRExpression> fields = this.mutateAll(expression.fields);
        if (this.keep(Linq.same(fields, expression.fields)))
            return expression;
        return this.map(expression, new IRTupleExpression(fields));
    }

    @Override
    public IRExpression visit(IRFunctionExpression expression) {
        ImmutableList<IRTypeVariable> typeParameters = Linq.immutableMap(
                expression.typeParameters,
                p -> this.downcast(this.visitType(p), IRTypeVariable.class, p, "type parameter"));
        ImmutableList<IRVariable> parameters = Linq.immutableMap(
                expression.parameters,
                p -> this.downcast(this.mutate(p), IRVariable.class, p, "function parameter"));
        IRType returnType = expression.returnType != null ? this.visitType(expression.returnType) : null;
        IRExpression body = this.mutate(expression.body);
        boolean unchanged = Linq.same(typeParameters, expression.typeParameters) &&
                Linq.same(parameters, expression.parameters) &&
                returnType == expression.returnType &&
                body == expression.body;
        if (this.keep(unchanged))
            return expression;
        return this.map(expression, new IRFunctionExpression(
                parameters, body, returnType, typeParameters, expression.attributes));
    }

    @Override
    public IRExpression visit(IRCallExpression expression) {
        IRExpression callee = this.mutate(expression.callee);
        ImmutableList<IRType> typeArguments = Linq.immutableMap(expression.typeArguments, this::visitType);
        ImmutableList<IRExpression> arguments = this.mutateAll(expression.arguments);
        boolean unchanged = callee == expression.callee &&
                Linq.same(typeArguments, expression.typeArguments) &&
                Linq.same(arguments, expression.arguments);
        if (this.keep(unchanged))
            return expression;
        return this.map(expression, new IRCallExpression(
                callee, arguments, expression.attributes, typeArguments));
    }

    /** The variable is rewritten before the value. */
    @Override
    public IRExpression visit(IRLetExpression expression) {
        IRVariable variable = this.downcast(
                this.mutate(expression.variable), IRVariable.class, expression.variable, "let variable");
        IRExpression value = this.mutate(expression.value);
        IRExpression body = this.mutate(expression.body);
        boolean unchanged = variable == expression.variable &&
                value == expression.value &&
                body == expression.body;
        if (this.keep(unchanged))
            return expression;
        return this.map(expression, new IRLetExpression(variable, value, body));
    }

    @Override
    public IRExpression visit(IRIfExpression expression) {
        IRExpression condition = this.mutate(expression.condition);
        IRExpression trueBranch = this.mutate(expression.trueBranch);
        IRExpression falseBranch = this.mutate(expression.falseBranch);
        boolean unchanged = condition == expression.condition &&
                trueBranch == expression.trueBranch &&
                falseBranch == expression.falseBranch;
        if (this.keep(unchanged))
            return expression;
        return this.map(expression, new IRIfExpression(condition, trueBranch, falseBranch));
    }

    @Override
    public IRExpression visit(IRTupleGetItemExpression expression) {
        IRExpression tuple = this.mutate(expression.tuple);
        if (this.keep(tuple == expression.tuple))
            return expression;
        return this.map(expression, new IRTupleGetItemExpression(tuple, expression.index));
    }
}
