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

package org.irkit.util;

import org.irkit.compiler.errors.CompilationError;
import org.irkit.compiler.visitors.inner.DeepCopy;
import org.irkit.compiler.visitors.inner.ExprMutator;
import org.irkit.compiler.visitors.inner.ExprVisitor;
import org.irkit.compiler.visitors.inner.SharedExpressions;
import org.irkit.ir.IRTestUtil;
import org.irkit.ir.expression.IRConstant;
import org.irkit.ir.expression.IRExpression;
import org.irkit.ir.expression.IRTupleExpression;
import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

public class LoggerTests {
    @After
    public void restore() {
        Logger.INSTANCE.reset();
        Logger.INSTANCE.setDebugStream(System.err);
    }

    static class Increment extends ExprMutator {
        @Override
        public IRExpression visit(IRConstant expression) {
            return new IRConstant((Integer) expression.value + 1);
        }
    }

    @Test
    public void testRewritesLogged() {
        StringBuilder builder = new StringBuilder();
        Logger.INSTANCE.setDebugStream(builder);
        Logger.INSTANCE.setLoggingLevel(ExprMutator.class, 1);

        Increment mutator = new Increment();
        Assert.assertEquals(1, mutator.getDebugLevel());
        mutator.apply(IRTupleExpression.of(IRTestUtil.constant(1)));
        String log = builder.toString();
        Assert.assertTrue(log.contains("Increment:(1,) -> (2,)"));
        // level 2 messages are not emitted
        Assert.assertFalse(log.contains("distinct nodes"));
    }

    @Test
    public void testLevelsApplyToSubclasses() {
        StringBuilder builder = new StringBuilder();
        Logger.INSTANCE.setDebugStream(builder);
        Assert.assertEquals(0, Logger.INSTANCE.setLoggingLevel(ExprVisitor.class, 2));
        Assert.assertEquals(2, Logger.INSTANCE.getLoggingLevel(SharedExpressions.class));
        Assert.assertEquals(0, Logger.INSTANCE.getLoggingLevel(DeepCopy.class));

        IRConstant c = IRTestUtil.constant(1);
        SharedExpressions.of(IRTupleExpression.of(c, c));
        String log = builder.toString();
        Assert.assertTrue(log.contains("CONSTANT " + c.getId() + " reached 2 times"));
        Assert.assertTrue(log.contains("SharedExpressions visited 2 distinct nodes"));
    }

    @Test
    public void testNothingLoggedByDefault() {
        StringBuilder builder = new StringBuilder();
        Logger.INSTANCE.setDebugStream(builder);
        new Increment().apply(IRTupleExpression.of(IRTestUtil.constant(1)));
        Assert.assertEquals("", builder.toString());
    }

    @Test
    public void testLevelByClassName() {
        Assert.assertEquals(0, Logger.INSTANCE.setLoggingLevel("DeepCopy", 3));
        Assert.assertEquals(3, Logger.INSTANCE.getLoggingLevel(DeepCopy.class));
        Assert.assertThrows(CompilationError.class, () -> Logger.INSTANCE.setLoggingLevel("NoSuchPass", 1));
    }
}
