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
import org.irkit.ir.type.IRFunctionType;
import org.irkit.ir.type.IRTensorType;
import org.irkit.ir.type.IRTupleType;
import org.irkit.ir.type.IRType;
import org.irkit.ir.type.IRTypeVariable;
import org.irkit.util.IWritesLogs;

/** A function over types which dispatches on the class of its argument.
 * Handlers which are not overridden fail.
 * @param <R> Result produced for each type. */
public abstract class TypeFunctor<R> implements IWritesLogs {
    public R visitType(IRType type) {
        return type.accept(this);
    }

    public R visitDefault(IRType type) {
        throw new InternalCompilerError(this.getClass().getSimpleName() +
                " does not have a handler for " + type.getClass().getSimpleName() + " " + type, type);
    }

    public R visit(IRTypeVariable type) {
        return this.visitDefault(type);
    }

    public R visit(IRTensorType type) {
        return this.visitDefault(type);
    }

    public R visit(IRTupleType type) {
        return this.visitDefault(type);
    }

    public R visit(IRFunctionType type) {
        return this.visitDefault(type);
    }
}
