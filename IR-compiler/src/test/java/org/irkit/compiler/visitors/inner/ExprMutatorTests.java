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
import com.google.common.collect.ImmutableMap;
import org.irkit.compiler.errors.InternalCompilerError;
import org.irkit.ir.IRAttributes;
import org.irkit.ir.IRTestUtil;
import org.irkit.ir.expression.IRCallExpression;
import org.irkit.ir.expression.IRConstant;
import org.irkit.ir.expression.IRExpression;
import org.irkit.ir.expression.IRFunctionExpression;
import org.irkit.ir.expression.IRGlobalVariable;
import org.irkit.ir.expression.IRIfExpression;
import org.irkit.ir.expression.IRLetExpression;
import org.irkit.ir.expression.IRTupleExpression;
import org.irkit.ir.expression.IRTupleGetItemExpression;
import org.irkit.ir.expression.IRVariable;
import org.irkit.ir.type.IRTensorType;
import org.irkit.ir.type.IRType;
import org.irkit.ir.type.IRTypeVariable;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

public class ExprMutatorTests {
    static class Identity extends ExprMutator {}

    static class CountConstants extends ExprMutator {
        int count = 0;

        @Override
        public IRExpression visit(IRConstant expression) {
            this.count++;
            return super.visit(expression);
        }
    }

    /** Replaces one specific expression with another one. */
    static class Replace extends ExprMutator {
        final IRExpression from;
        final IRExpression to;

        Replace(IRExpression from, IRExpression to) {
            this.from = from;
            this.to = to;
        }

        @Override
        public IRExpression visit(IRConstant expression) {
            return expression == this.from ? this.to : expression;
        }

        @Override
        public IRExpression visit(IRGlobalVariable expression) {
            return expression == this.from ? this.to : expression;
        }

        @Override
        public IRExpression visit(IRVariable expression) {
            return expression == this.from ? this.to : super.visit(expression);
        }
    }

    /** Replaces every float32 tensor type with a float16 tensor type. */
    static class Narrow extends ExprMutator {
        static final IRType FLOAT16 = IRTensorType.scalar("float16");
        int typesSeen = 0;

        @Override
        public IRType visitType(IRType type) {
            this.typesSeen++;
            return type == IRTestUtil.FLOAT32 ? FLOAT16 : type;
        }
    }

    @Test
    public void testIdentityReturnsSameRoot() {
        IRFunctionExpression function = IRTestUtil.allKinds();
        Identity mutator = new Identity();
        IRExpression result = mutator.apply(function);
        Assert.assertSame(function, result);

        RecordNodes visitor = new RecordNodes();
        visitor.apply(function);
        Assert.assertEquals(visitor.distinctVisited(), mutator.memoSize());
        for (IRExpression node: visitor.nodes)
            Assert.assertSame(node, mutator.getMemoized(node));
    }

    static class RecordNodes extends PostOrderVisitor {
        final List<IRExpression> nodes;

        RecordNodes() {
            this(new ArrayList<>());
        }

        private RecordNodes(List<IRExpression> nodes) {
            super(nodes::add);
            this.nodes = nodes;
        }
    }

    @Test
    public void testSharingPreserved() {
        IRConstant c = IRTestUtil.constant(2);
        IRTupleExpression tuple = IRTupleExpression.of(c, c);
        CountConstants mutator = new CountConstants();
        IRExpression result = mutator.apply(tuple);
        Assert.assertSame(tuple, result);
        Assert.assertEquals(1, mutator.count);
        Assert.assertSame(c, mutator.getMemoized(c));
        Assert.assertEquals(2, mutator.memoSize());
    }

    @Test
    public void testSharedNodeRewrittenOnce() {
        IRConstant shared = IRTestUtil.constant(1);
        IRExpression root = IRTupleExpression.of(shared.getItem(0), shared.getItem(0));
        IRConstant replacement = IRTestUtil.constant(10);
        Replace mutator = new Replace(shared, replacement);
        IRTupleExpression result = mutator.apply(root).to(IRTupleExpression.class);
        Assert.assertNotSame(root, result);
        IRTupleGetItemExpression first = result.fields.get(0).to(IRTupleGetItemExpression.class);
        IRTupleGetItemExpression second = result.fields.get(1).to(IRTupleGetItemExpression.class);
        Assert.assertSame(replacement, first.tuple);
        Assert.assertSame(replacement, second.tuple);
        Assert.assertEquals(0, first.index);
    }

    @Test
    public void testOnlyAncestorsRebuilt() {
        IRVariable x = new IRVariable("x");
        IRConstant one = IRTestUtil.constant(1);
        IRConstant two = IRTestUtil.constant(2);
        IRTupleExpression body = IRTupleExpression.of(x, two);
        IRLetExpression let = new IRLetExpression(x, one, body);

        IRConstant replacement = IRTestUtil.constant(42);
        IRLetExpression result = new Replace(one, replacement).apply(let).to(IRLetExpression.class);
        Assert.assertNotSame(let, result);
        Assert.assertSame(x, result.variable);
        Assert.assertSame(replacement, result.value);
        Assert.assertSame(body, result.body);
    }

    @Test
    public void testIfRebuiltOnlyWhenBranchChanges() {
        IRVariable c = new IRVariable("c");
        IRConstant t = IRTestUtil.constant(1);
        IRConstant f = IRTestUtil.constant(0);
        IRIfExpression cond = new IRIfExpression(c, t, f);

        IRConstant replacement = IRTestUtil.constant(-1);
        IRIfExpression result = new Replace(f, replacement).apply(cond).to(IRIfExpression.class);
        Assert.assertSame(c, result.condition);
        Assert.assertSame(t, result.trueBranch);
        Assert.assertSame(replacement, result.falseBranch);

        Assert.assertSame(cond, new Replace(IRTestUtil.constant(0), replacement).apply(cond));
    }

    @Test
    public void testCallRebuildCarriesAttributes() {
        IRTypeVariable t = new IRTypeVariable("T");
        IRGlobalVariable f = new IRGlobalVariable("f");
        IRConstant one = IRTestUtil.constant(1);
        IRAttributes attributes = IRAttributes.of(ImmutableMap.of("axis", 1));
        IRCallExpression call = f.call(ImmutableList.of(one), attributes, ImmutableList.of(t));

        IRGlobalVariable g = new IRGlobalVariable("g");
        IRCallExpression result = new Replace(f, g).apply(call).to(IRCallExpression.class);
        Assert.assertSame(g, result.callee);
        Assert.assertSame(attributes, result.attributes);
        Assert.assertEquals(1, result.typeArguments.size());
        Assert.assertSame(t, result.typeArguments.get(0));
        Assert.assertSame(one, result.arguments.get(0));
        Assert.assertEquals("@g<T>(1)", result.toString());
    }

    @Test
    public void testFunctionRebuildCarriesAttributes() {
        IRFunctionExpression function = IRTestUtil.allKinds();
        IRLetExpression let = function.body.to(IRLetExpression.class);
        IRCallExpression add = let.value.to(IRCallExpression.class);
        IRExpression x = add.arguments.get(0);
        IRConstant replacement = IRTestUtil.constant(3);

        IRFunctionExpression result = new Replace(IRTestUtil.constant(0), replacement)
                .apply(function).to(IRFunctionExpression.class);
        Assert.assertSame(function, result);

        IRExpression y = add.arguments.get(1);
        IRExpression fresh = IRTestUtil.constant(7);
        IRGlobalVariable g = function.body.to(IRLetExpression.class).body
                .to(IRIfExpression.class).trueBranch
                .to(IRCallExpression.class).callee
                .to(IRGlobalVariable.class);
        IRFunctionExpression rewritten = new Replace(g, fresh).apply(function).to(IRFunctionExpression.class);
        Assert.assertNotSame(function, rewritten);
        Assert.assertSame(function.attributes, rewritten.attributes);
        Assert.assertSame(function.returnType, rewritten.returnType);
        Assert.assertEquals(function.typeParameters, rewritten.typeParameters);
        Assert.assertEquals(function.parameters, rewritten.parameters);
        IRLetExpression newLet = rewritten.body.to(IRLetExpression.class);
        Assert.assertSame(let.variable, newLet.variable);
        Assert.assertSame(let.value, newLet.value);
        Assert.assertSame(x, newLet.value.to(IRCallExpression.class).arguments.get(0));
        Assert.assertSame(y, newLet.value.to(IRCallExpression.class).arguments.get(1));
        IRCallExpression newCall = newLet.body.to(IRIfExpression.class).trueBranch.to(IRCallExpression.class);
        Assert.assertSame(fresh, newCall.callee);
    }

    @Test
    public void testRewritingParameterToNonVariableFails() {
        IRVariable x = new IRVariable("x");
        IRFunctionExpression function = new IRFunctionExpression(ImmutableList.of(x), x);
        Replace mutator = new Replace(x, IRTestUtil.constant(0));
        InternalCompilerError error = Assert.assertThrows(
                InternalCompilerError.class, () -> mutator.apply(function));
        Assert.assertTrue(error.getMessage().contains("function parameter"));
        Assert.assertSame(x, error.irNode);
    }

    @Test
    public void testRewritingLetVariableToNonVariableFails() {
        IRVariable x = new IRVariable("x");
        IRLetExpression let = new IRLetExpression(x, IRTestUtil.constant(1), x);
        Replace mutator = new Replace(x, new IRGlobalVariable("x"));
        InternalCompilerError error = Assert.assertThrows(
                InternalCompilerError.class, () -> mutator.apply(let));
        Assert.assertTrue(error.getMessage().contains("let variable"));
    }

    @Test
    public void testRewritingTypeParameterToNonVariableFails() {
        IRTypeVariable t = new IRTypeVariable("T");
        IRVariable x = new IRVariable("x", t);
        IRFunctionExpression function = new IRFunctionExpression(
                ImmutableList.of(x), x, t, ImmutableList.of(t), IRAttributes.EMPTY);
        ExprMutator mutator = new ExprMutator() {
            @Override
            public IRType visitType(IRType type) {
                return type == t ? IRTestUtil.FLOAT32 : type;
            }
        };
        InternalCompilerError error = Assert.assertThrows(
                InternalCompilerError.class, () -> mutator.apply(function));
        Assert.assertTrue(error.getMessage().contains("type parameter"));
    }

    @Test
    public void testRenamingParameterKeepsUsesConsistent() {
        IRVariable x = new IRVariable("x", IRTestUtil.FLOAT32);
        IRFunctionExpression function = new IRFunctionExpression(
                ImmutableList.of(x), IRTestUtil.add(x, x));

        Narrow mutator = new Narrow();
        IRFunctionExpression result = mutator.apply(function).to(IRFunctionExpression.class);
        Assert.assertNotSame(function, result);
        Assert.assertEquals(1, mutator.typesSeen);
        IRVariable newX = result.parameters.get(0);
        Assert.assertNotSame(x, newX);
        Assert.assertEquals("x", newX.nameHint);
        Assert.assertSame(Narrow.FLOAT16, newX.typeAnnotation);
        IRCallExpression body = result.body.to(IRCallExpression.class);
        Assert.assertSame(newX, body.arguments.get(0));
        Assert.assertSame(newX, body.arguments.get(1));
        Assert.assertSame(newX, mutator.getMemoized(x));
    }

    @Test
    public void testReturnTypeRewritten() {
        IRVariable x = new IRVariable("x");
        IRFunctionExpression function = new IRFunctionExpression(
                ImmutableList.of(x), x, IRTestUtil.FLOAT32, ImmutableList.of(), IRAttributes.EMPTY);
        IRFunctionExpression result = new Narrow().apply(function).to(IRFunctionExpression.class);
        Assert.assertNotSame(function, result);
        Assert.assertSame(Narrow.FLOAT16, result.returnType);
        Assert.assertSame(x, result.parameters.get(0));
        Assert.assertSame(x, result.body);
    }

    @Test
    public void testTypeArgumentsRewritten() {
        IRConstant one = IRTestUtil.constant(1);
        IRCallExpression call = new IRGlobalVariable("f").call(
                ImmutableList.of(one), IRAttributes.EMPTY, ImmutableList.of(IRTestUtil.FLOAT32));
        IRCallExpression result = new Narrow().apply(call).to(IRCallExpression.class);
        Assert.assertNotSame(call, result);
        Assert.assertSame(call.callee, result.callee);
        Assert.assertSame(Narrow.FLOAT16, result.typeArguments.get(0));
        Assert.assertSame(one, result.arguments.get(0));
    }

    @Test
    public void testMemoizedAcrossPasses() {
        IRConstant one = IRTestUtil.constant(1);
        IRExpression root = IRTupleExpression.of(one);
        IRConstant replacement = IRTestUtil.constant(2);
        Replace mutator = new Replace(one, replacement);
        IRExpression first = mutator.apply(root);
        IRExpression second = mutator.apply(root);
        Assert.assertNotSame(root, first);
        Assert.assertSame(first, second);
        Assert.assertSame(first, mutator.visitExpr(root));
    }

    @Test
    public void testForceRebuildsInnerNodes() {
        IRVariable x = new IRVariable("x");
        IRConstant one = IRTestUtil.constant(1);
        IRExpression root = IRTupleExpression.of(x, one).getItem(1);
        ExprMutator mutator = new ExprMutator(true) {};
        IRTupleGetItemExpression result = mutator.apply(root).to(IRTupleGetItemExpression.class);
        Assert.assertNotSame(root, result);
        Assert.assertEquals(1, result.index);
        IRTupleExpression tuple = result.tuple.to(IRTupleExpression.class);
        Assert.assertNotSame(x, tuple.fields.get(0));
        Assert.assertSame(one, tuple.fields.get(1));
    }
}
