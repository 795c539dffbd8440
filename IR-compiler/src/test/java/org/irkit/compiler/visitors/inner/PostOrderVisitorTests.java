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
import org.irkit.ir.IRTestUtil;
import org.irkit.ir.expression.IRConstant;
import org.irkit.ir.expression.IRExpression;
import org.irkit.ir.expression.IRLetExpression;
import org.irkit.ir.expression.IRTupleExpression;
import org.irkit.ir.expression.IRTupleGetItemExpression;
import org.irkit.ir.expression.IRVariable;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

public class PostOrderVisitorTests {
    @Test
    public void testChildrenBeforeParents() {
        IRConstant shared = IRTestUtil.constant(1);
        IRTupleGetItemExpression a = shared.getItem(0);
        IRTupleGetItemExpression b = shared.getItem(1);
        IRTupleExpression root = IRTupleExpression.of(a, b);

        List<IRExpression> order = new ArrayList<>();
        PostOrderVisitor.visit(root, order::add);
        Assert.assertEquals(ImmutableList.of(shared, a, b, root), order);
    }

    @Test
    public void testLet() {
        IRVariable x = new IRVariable("x");
        IRConstant value = IRTestUtil.constant(1);
        IRTupleExpression body = IRTupleExpression.of(x, x);
        IRLetExpression let = new IRLetExpression(x, value, body);

        List<IRExpression> order = new ArrayList<>();
        PostOrderVisitor.visit(let, order::add);
        Assert.assertEquals(ImmutableList.of(value, x, body, let), order);
    }

    @Test
    public void testEveryNodeOnce() {
        List<IRExpression> order = new ArrayList<>();
        PostOrderVisitor visitor = new PostOrderVisitor(order::add);
        visitor.apply(IRTestUtil.allKinds());
        Assert.assertEquals(visitor.distinctVisited(), order.size());
        Assert.assertEquals(order.size(), order.stream().distinct().count());
    }
}
