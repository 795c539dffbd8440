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
import org.irkit.ir.expression.IRFunctionExpression;
import org.irkit.ir.expression.IRLetExpression;
import org.irkit.ir.expression.IRVariable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Discovers the variables which are used in an expression but
 * not bound by a let or a function parameter within it. */
public class FreeVariables extends ExprVisitor {
    /** All variables reached, in the order they were first reached. */
    final Set<IRVariable> used;
    final Set<IRVariable> bound;

    public FreeVariables() {
        this.used = new LinkedHashSet<>();
        this.bound = new HashSet<>();
    }

    @Override
    public void visit(IRVariable expression) {
        this.used.add(expression);
        super.visit(expression);
    }

    @Override
    public void visit(IRLetExpression expression) {
        this.bound.add(expression.variable);
        super.visit(expression);
    }

    @Override
    public void visit(IRFunctionExpression expression) {
        this.bound.addAll(expression.parameters);
        super.visit(expression);
    }

    /** Free variables, in the order they were first reached. */
    public List<IRVariable> getFreeVariables() {
        List<IRVariable> result = new ArrayList<>();
        for (IRVariable var: this.used)
            if (!this.bound.contains(var))
                result.add(var);
        return result;
    }

    public Set<IRVariable> getBoundVariables() {
        return this.bound;
    }

    public static List<IRVariable> of(IRExpression expression) {
        FreeVariables visitor = new FreeVariables();
        visitor.apply(expression);
        return visitor.getFreeVariables();
    }
}
