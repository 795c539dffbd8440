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
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

public class TypeMutatorTests {
    /** Changes the element type of every tensor. */
    static class ChangeDtype extends TypeMutator {
        final String from;
        final String to;
        int tensors = 0;

        ChangeDtype(String from, String to) {
            this.from = from;
            this.to = to;
        }

        @Override
        public IRType visit(IRTensorType type) {
            this.tensors++;
            if (!type.dtype.equals(this.from))
                return type;
            return this.map(type, new IRTensorType(type.shape, this.to));
        }
    }

    @Test
    public void testNestedRewrite() {
        IRTensorType matrix = new IRTensorType(ImmutableList.of(2, 3), "float32");
        IRTensorType index = IRTensorType.scalar("int64");
        IRTupleType tuple = IRTupleType.of(matrix, index, matrix);

        ChangeDtype mutator = new ChangeDtype("float32", "float16");
        IRTupleType result = mutator.visitType(tuple).to(IRTupleType.class);
        Assert.assertNotSame(tuple, result);
        Assert.assertEquals(2, mutator.tensors);
        Assert.assertSame(index, result.fields.get(1));
        Assert.assertSame(result.fields.get(0), result.fields.get(2));
        Assert.assertEquals("(Tensor[(2, 3), float16], Tensor[(), int64], Tensor[(2, 3), float16])",
                result.toString());
    }

    @Test
    public void testUnchangedTypeReturnedAsIs() {
        IRTypeVariable t = new IRTypeVariable("T");
        IRFunctionType function = new IRFunctionType(
                ImmutableList.of(IRTensorType.scalar("int32"), t), t, ImmutableList.of(t));
        Assert.assertSame(function, new ChangeDtype("float32", "float16").visitType(function));
    }

    @Test
    public void testTypeParameterMustStayVariable() {
        IRTypeVariable t = new IRTypeVariable("T");
        IRFunctionType function = new IRFunctionType(ImmutableList.of(t), t, ImmutableList.of(t));
        TypeMutator mutator = new TypeMutator() {
            @Override
            public IRType visit(IRTypeVariable type) {
                return IRTensorType.scalar("int8");
            }
        };
        Assert.assertThrows(InternalCompilerError.class, () -> mutator.visitType(function));
    }

    @Test
    public void testMissingHandlerIsFatal() {
        TypeFunctor<String> functor = new TypeFunctor<>() {
            @Override
            public String visit(IRTensorType type) {
                return type.dtype;
            }
        };
        Assert.assertEquals("int8", functor.visitType(IRTensorType.scalar("int8")));
        Assert.assertThrows(InternalCompilerError.class,
                () -> functor.visitType(new IRTypeVariable("T")));
    }

    @Test
    public void testTypeVisitorVisitsSharedTypesOnce() {
        IRTypeVariable t = new IRTypeVariable("T");
        IRTensorType scalar = IRTensorType.scalar("float32");
        IRFunctionType function = new IRFunctionType(
                ImmutableList.of(scalar, IRTupleType.of(scalar, t)), t, ImmutableList.of(t));
        List<IRType> reached = new ArrayList<>();
        TypeVisitor visitor = new TypeVisitor() {
            @Override
            public void visit(IRTensorType type) {
                reached.add(type);
            }

            @Override
            public void visit(IRTypeVariable type) {
                reached.add(type);
            }
        };
        visitor.visitType(function);
        Assert.assertEquals(2, reached.size());
        Assert.assertSame(t, reached.get(0));
        Assert.assertSame(scalar, reached.get(1));
    }
}
