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
import org.irkit.ir.expression.IRExpression;
import org.irkit.ir.expression.IRFunctionExpression;
import org.irkit.ir.expression.IRLetExpression;
import org.irkit.ir.expression.IRVariable;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class FreeVariablesTests {
    @Test
    public void testLet() {
        IRVariable x = new IRVariable("x");
        IRVariable y = new IRVariable("y");
        IRVariable z = new IRVariable("z");
        IRExpression let = new IRLetExpression(x, y, IRTestUtil.add(x, z));
        FreeVariables visitor = new FreeVariables();
        visitor.apply(let);
        Assert.assertEquals(ImmutableList.of(y, z), visitor.getFreeVariables());
        Assert.assertTrue(visitor.getBoundVariables().contains(x));
        Assert.assertEquals(1, visitor.getBoundVariables().size());
    }

    @Test
    public void testFunction() {
        IRVariable x = new IRVariable("x");
        IRVariable y = new IRVariable("y");
        IRExpression function = new IRFunctionExpression(ImmutableList.of(x), IRTestUtil.add(x, y));
        Assert.assertEquals(ImmutableList.of(y), FreeVariables.of(function));
        // the body alone does not bind x
        IRExpression body = function.to(IRFunctionExpression.class).body;
        Assert.assertEquals(ImmutableList.of(x, y), FreeVariables.of(body));
    }

    @Test
    public void testSameNameDifferentVariables() {
        IRVariable inner = new IRVariable("x");
        IRVariable outer = new IRVariable("x");
        IRExpression let = new IRLetExpression(inner, IRTestUtil.constant(1), IRTestUtil.add(inner, outer));
        List<IRVariable> free = FreeVariables.of(let);
        Assert.assertEquals(1, free.size());
        Assert.assertSame(outer, free.get(0));
    }

    @Test
    public void testClosed() {
        Assert.assertTrue(FreeVariables.of(IRTestUtil.allKinds()).isEmpty());
    }
}
