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
import org.irkit.ir.type.IRFunctionType;
import org.irkit.ir.type.IRTensorType;
import org.irkit.ir.type.IRTupleType;
import org.irkit.ir.type.IRType;
import org.irkit.ir.type.IRTypeVariable;
import org.irkit.util.Linq;
import org.irkit.util.Logger;
import org.irkit.util.Utilities;

import java.util.HashMap;
import java.util.Map;

/** Memoized rewriting of type expressions, with the same rules as
 * {@link ExprMutator}: each distinct type is rewritten once, and a type
 * is rebuilt only if one of its components changed.
 * Expression mutators use it from their {@link ExprMutator#visitType} hook. */
public abstract class TypeMutator extends TypeFunctor<IRType> {
    private final Map<Long, IRType> memo;

    protected TypeMutator() {
        this.memo = new HashMap<>();
    }

    public IRType mutate(IRType type) {
        IRType result = this.memo.get(type.getId());
        if (result != null)
            return result;
        result = type.accept(this);
        Utilities.putNew(this.memo, type.getId(), result);
        return result;
    }

    @Override
    public final IRType visitType(IRType type) {
        return this.mutate(type);
    }

    protected IRType map(IRType old, IRType result) {
        Logger.INSTANCE.belowLevel(this, 1)
                .append(this.getClass().getSimpleName())
                .append(":")
                .appendSupplier(old::toString)
                .append(" -> ")
                .appendSupplier(result::toString)
                .newline();
        return result;
    }

    IRTypeVariable mutateTypeParameter(IRTypeVariable parameter) {
        IRType result = this.mutate(parameter);
        IRTypeVariable var = result.as(IRTypeVariable.class);
        if (var == null)
            throw new InternalCompilerError("Rewriting type parameter " + parameter +
                    " produced " + result + "; expected a type variable", parameter);
        return var;
    }

    @Override
    public IRType visit(IRTypeVariable type) {
        return type;
    }

    @Override
    public IRType visit(IRTensorType type) {
        return type;
    }

    @Override
    public IRType visit(IRTupleType type) {
        ImmutableList<IRType> fields = Linq.immutableMap(type.fields, this::mutate);
        if (Linq.same(fields, type.fields))
            return type;
        return this.map(type, new IRTupleType(fields));
    }

    @Override
    public IRType visit(IRFunctionType type) {
        ImmutableList<IRTypeVariable> typeParameters =
                Linq.immutableMap(type.typeParameters, this::mutateTypeParameter);
        ImmutableList<IRType> arguments = Linq.immutableMap(type.argumentTypes, this::mutate);
        IRType returnType = this.mutate(type.returnType);
        if (Linq.same(typeParameters, type.typeParameters) &&
                Linq.same(arguments, type.argumentTypes) &&
                returnType == type.returnType)
            return type;
        return this.map(type, new IRFunctionType(arguments, returnType, typeParameters));
    }
}
