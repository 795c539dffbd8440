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

package org.irkit.ir.type;

import com.google.common.collect.ImmutableList;
import org.irkit.compiler.visitors.inner.TypeFunctor;
import org.irkit.compiler.visitors.inner.TypeVisitor;
import org.irkit.util.IIndentStream;

import java.util.List;
import java.util.Objects;

/** Type of a tensor with a static shape and an element type. */
public final class IRTensorType extends IRType {
    public final ImmutableList<Integer> shape;
    public final String dtype;

    public IRTensorType(List<Integer> shape, String dtype) {
        this.shape = ImmutableList.copyOf(shape);
        this.dtype = Objects.requireNonNull(dtype);
    }

    /** A scalar (rank 0) tensor type. */
    public static IRTensorType scalar(String dtype) {
        return new IRTensorType(ImmutableList.of(), dtype);
    }

    @Override
    public <R> R accept(TypeFunctor<R> functor) {
        return functor.visit(this);
    }

    @Override
    public void accept(TypeVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("Tensor[(")
                .join(", ", this.shape, Object::toString)
                .append("), ")
                .append(this.dtype)
                .append("]");
    }
}
