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

import org.irkit.compiler.errors.CompilationError;
import org.irkit.compiler.visitors.inner.ExprFunctor;
import org.irkit.compiler.visitors.inner.ExprVisitor;
import org.irkit.util.IIndentStream;
import org.irkit.util.Utilities;

import java.util.HashMap;
import java.util.Map;

/** A primitive operator.  Operators are interned: there is
 * a single IROp object for each registered name. */
public final class IROp extends IRExpression {
    public final String name;
    /** Number of inputs expected by the operator. */
    public final int numInputs;

    static final Map<String, IROp> registry = new HashMap<>();

    static {
        register("add", 2);
        register("subtract", 2);
        register("multiply", 2);
        register("divide", 2);
        register("negative", 1);
        register("equal", 2);
        register("less", 2);
        register("greater", 2);
        register("logical_not", 1);
    }

    private IROp(String name, int numInputs) {
        this.name = name;
        this.numInputs = numInputs;
    }

    /** Register a new operator.
     * @param name       Operator name; must not already be registered.
     * @param numInputs  Number of inputs. */
    public static synchronized IROp register(String name, int numInputs) {
        Utilities.enforce(numInputs >= 0, "Negative number of inputs for operator " + name);
        return Utilities.putNew(registry, name, new IROp(name, numInputs));
    }

    /** The operator with the specified name. */
    public static synchronized IROp get(String name) {
        IROp result = registry.get(name);
        if (result == null)
            throw new CompilationError("Operator " + name + " is not registered");
        return result;
    }

    public static synchronized boolean isRegistered(String name) {
        return registry.containsKey(name);
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.OP;
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
        return builder.append(this.name);
    }
}
