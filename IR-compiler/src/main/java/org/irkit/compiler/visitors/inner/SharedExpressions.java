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
import org.irkit.util.Logger;

import java.util.ArrayList;
import java.util.List;

/** Finds the expressions which are reachable from more than one parent. */
public class SharedExpressions extends ExprVisitor {
    private final List<IRExpression> shared;

    public SharedExpressions() {
        this.shared = new ArrayList<>();
    }

    @Override
    public void visitExpr(IRExpression expression) {
        super.visitExpr(expression);
        if (this.visitCount(expression) == 2)
            this.shared.add(expression);
    }

    @Override
    public void endVisit() {
        for (IRExpression expression: this.shared) {
            Logger.INSTANCE.belowLevel(this, 1)
                    .append(expression.getKind().toString())
                    .append(" ")
                    .append(expression.getId())
                    .append(" reached ")
                    .append(this.visitCount(expression))
                    .append(" times")
                    .newline();
        }
        super.endVisit();
    }

    /** Shared expressions, in the order in which they were found to be shared. */
    public List<IRExpression> getShared() {
        return this.shared;
    }

    public static List<IRExpression> of(IRExpression expression) {
        SharedExpressions visitor = new SharedExpressions();
        visitor.apply(expression);
        return visitor.getShared();
    }
}
