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
import org.irkit.ir.expression.IRExpression;
import org.irkit.ir.expression.IRFunctionExpression;
import org.irkit.ir.expression.IRLetExpression;
import org.irkit.ir.expression.IRVariable;
import org.irkit.util.Linq;

import java.util.List;

/**
 * Replaces variables with expressions.
 * Only free variables can be bound: binding a variable that is
 * introduced by a let or by a function parameter inside the expression
 * is an error.  Use {@link #bind} to also bind the parameters of
 * a function.
 */
public class BindVariables extends ExprMutator {
    final Substitution substitution;

    public BindVariables(Substitution substitution) {
        this.substitution = substitution;
    }

    @Override
    public IRExpression visit(IRVariable expression) {
        IRExpression replacement = this.substitution.get(expression);
        if (replacement != null)
            return replacement;
        return super.visit(expression);
    }

    @Override
    public IRExpression visit(IRLetExpression expression) {
        if (this.substitution.contains(expression.variable))
            throw new InternalCompilerError("Cannot bind variable " + expression.variable +
                    " introduced by let", expression);
        return super.visit(expression);
    }

    @Override
    public IRExpression visit(IRFunctionExpression expression) {
        for (IRVariable param: expression.parameters) {
            if (this.substitution.contains(param))
                throw new InternalCompilerError("Cannot bind parameter " + param +
                        " of an inner function", expression);
        }
        return super.visit(expression);
    }

    /**
     * Bind variables in an expression.
     * If the expression is a function, the bound parameters are removed
     * from its parameter list and substituted in its body.
     * @param expression    Expression to bind.
     * @param substitution  Values for variables.
     * @return The original expression if no bound variable occurs in it. */
    public static IRExpression bind(IRExpression expression, Substitution substitution) {
        IRFunctionExpression function = expression.as(IRFunctionExpression.class);
        if (function == null)
            return new BindVariables(substitution).apply(expression);

        IRExpression body = new BindVariables(substitution).apply(function.body);
        List<IRVariable> parameters = Linq.where(function.parameters, p -> !substitution.contains(p));
        if (body == function.body && parameters.size() == function.parameters.size())
            return function;
        return new IRFunctionExpression(parameters, body, function.returnType,
                function.typeParameters, function.attributes);
    }
}
