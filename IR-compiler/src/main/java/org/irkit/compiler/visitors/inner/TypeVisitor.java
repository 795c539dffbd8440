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

import org.irkit.ir.type.IRFunctionType;
import org.irkit.ir.type.IRTensorType;
import org.irkit.ir.type.IRTupleType;
import org.irkit.ir.type.IRType;
import org.irkit.ir.type.IRTypeVariable;
import org.irkit.util.IWritesLogs;

import java.util.HashSet;
import java.util.Set;

/** Read-only traversal of type expressions; each distinct type node
 * is processed once.  Expression visitors use it from their
 * {@link ExprVisitor#visitType} hook. */
public abstract class TypeVisitor implements IWritesLogs {
    private final Set<Long> visited;

    protected TypeVisitor() {
        this.visited = new HashSet<>();
    }

    public void visitType(IRType type) {
        if (!this.visited.add(type.getId()))
            return;
        type.accept(this);
    }

    public void visit(IRTypeVariable type) {}

    public void visit(IRTensorType type) {}

    public void visit(IRTupleType type) {
        for (IRType field: type.fields)
            this.visitType(field);
    }

    public void visit(IRFunctionType type) {
        for (IRTypeVariable param: type.typeParameters)
            this.visitType(param);
        for (IRType arg: type.argumentTypes)
            this.visitType(arg);
        this.visitType(type.returnType);
    }
}
