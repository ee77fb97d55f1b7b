/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package cloak.ast;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import cloak.ast.decl.VariableDeclaration;
import cloak.ast.expr.IdentifierExpr;
import cloak.ast.expr.NumberLiteralExpr;
import cloak.ast.stmt.Block;
import cloak.ast.stmt.BreakStatement;
import cloak.ast.stmt.ContinueStatement;
import cloak.ast.stmt.ExpressionStatement;
import cloak.ast.stmt.Statement;
import cloak.common.exceptions.CompilerError;
import cloak.common.lang.AnnotatedTypeName;

public class NodeTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static Block block(Statement ... stmts) {
    return new Block(new ArrayList<Statement>(Arrays.asList(stmts)));
  }

  @Test
  public void testLinkParents() {
    IdentifierExpr e = new IdentifierExpr("x");
    ExpressionStatement stmt = new ExpressionStatement(e);
    Block b = block(stmt);
    b.linkParents();

    assertSame(b, stmt.parent());
    assertSame(stmt, e.parent());
    assertSame(stmt, e.statement());
    assertSame(stmt, e.relatedStatement());
    assertTrue(b.isParentOf(e));
    assertFalse(stmt.isParentOf(b));
    assertEquals(Collections.<Node>singletonList(stmt), b.children());

    // Linking again is harmless
    b.linkParents();
    assertSame(b, stmt.parent());
  }

  @Test
  public void testSecondParentRejected() {
    ExpressionStatement stmt = new ExpressionStatement(new IdentifierExpr("x"));
    block(stmt).linkParents();

    exception.expect(CompilerError.class);
    exception.expectMessage("already linked");
    block(stmt).linkParents();
  }

  @Test
  public void testDetachAllowsMove() {
    ExpressionStatement stmt = new ExpressionStatement(new IdentifierExpr("x"));
    block(stmt).linkParents();
    stmt.detach();
    assertNull(stmt.parent());

    Block other = block(stmt);
    other.linkParents();
    assertSame(other, stmt.parent());
  }

  @Test
  public void testCycleRejected() {
    ExpressionStatement stmt = new ExpressionStatement(new IdentifierExpr("x"));
    Block b = block(stmt);
    b.linkParents();

    exception.expect(CompilerError.class);
    exception.expectMessage("own descendant");
    b.setParent(stmt);
  }

  @Test
  public void testRewriteChild() {
    ExpressionStatement stmt = new ExpressionStatement(new IdentifierExpr("x"));
    stmt.linkParents();
    final NumberLiteralExpr replacement = new NumberLiteralExpr(1);
    stmt.processChildren(new TreeRewriter() {
      @Override
      public Node rewrite(Node child) {
        return replacement;
      }
    });
    assertSame(replacement, stmt.expr());
    assertSame(stmt, replacement.parent());
  }

  @Test
  public void testRewriteChildWrongSlotType() {
    ExpressionStatement stmt = new ExpressionStatement(new IdentifierExpr("x"));
    exception.expect(CompilerError.class);
    exception.expectMessage("slot for Expression");
    stmt.processChildren(new TreeRewriter() {
      @Override
      public Node rewrite(Node child) {
        return new BreakStatement();
      }
    });
  }

  @Test
  public void testStatementSplice() {
    final Statement first = new ExpressionStatement(new IdentifierExpr("a"));
    final Statement dropped = new ContinueStatement();
    final Statement kept = new BreakStatement();
    Block b = block(first, dropped, kept);
    b.linkParents();

    final Statement extra1 = new ExpressionStatement(new IdentifierExpr("b"));
    final Statement extra2 = new ExpressionStatement(new IdentifierExpr("c"));
    b.processChildren(new TreeRewriter() {
      @Override
      public Node rewrite(Node child) {
        return child;
      }

      @Override
      public List<Statement> rewriteStatement(Statement stmt) {
        if (stmt == first) {
          return Arrays.asList(first, extra1, extra2);
        } else if (stmt == dropped) {
          return Collections.emptyList();
        }
        return super.rewriteStatement(stmt);
      }
    });

    assertEquals(Arrays.asList(first, extra1, extra2, kept), b.statements());
    assertSame(b, extra1.parent());
    assertSame(b, extra2.parent());
    assertSame(b, kept.parent());
  }

  @Test
  public void testStatementReplacedByExpression() {
    Block b = block(new BreakStatement());
    exception.expect(CompilerError.class);
    exception.expectMessage("replaced a statement");
    b.processChildren(new TreeRewriter() {
      @Override
      public Node rewrite(Node child) {
        return new IdentifierExpr("x");
      }
    });
  }

  @Test
  public void testResetDecorations() {
    VariableDeclaration x = new VariableDeclaration(new ArrayList<String>(),
        AnnotatedTypeName.uintAll(), new Identifier("x"));
    IdentifierExpr ref = new IdentifierExpr("x");
    ref.setTarget(x);
    ExpressionStatement stmt = new ExpressionStatement(ref);
    Block b = block(stmt);
    b.linkParents();

    InstanceTarget t = new InstanceTarget(ref);
    ref.readValues().add(t);
    stmt.readValues().add(t);
    b.modifiedValues().add(t);

    b.resetDecorations();
    assertTrue(ref.readValues().isEmpty());
    assertTrue(stmt.readValues().isEmpty());
    assertTrue(b.modifiedValues().isEmpty());
  }

  @Test
  public void testQualifiedName() {
    Identifier c = new Identifier("C");
    Identifier f = new Identifier("f");
    VariableDeclaration x = new VariableDeclaration(new ArrayList<String>(),
        AnnotatedTypeName.uintAll(), new Identifier("x"));
    assertEquals(Collections.singletonList(x.idf()), x.qualifiedName());

    x.setNamespace(Arrays.asList(c, f));
    assertEquals(Arrays.asList(c, f, x.idf()), x.qualifiedName());
    assertTrue(new BreakStatement().qualifiedName().isEmpty());
  }
}
