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
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Set;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import cloak.ast.decl.VariableDeclaration;
import cloak.ast.expr.IdentifierExpr;
import cloak.ast.expr.IndexExpr;
import cloak.ast.expr.MemberAccessExpr;
import cloak.ast.expr.NumberLiteralExpr;
import cloak.common.exceptions.CompilerError;
import cloak.common.lang.AnnotatedTypeName;

public class InstanceTargetTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private VariableDeclaration x;

  @Before
  public void setUp() {
    x = new VariableDeclaration(new ArrayList<String>(),
              AnnotatedTypeName.uintAll(), new Identifier("x"));
  }

  private IdentifierExpr ref(VariableDeclaration decl) {
    IdentifierExpr e = new IdentifierExpr(decl.idf().name());
    e.setTarget(decl);
    return e;
  }

  @Test
  public void testIdentifierMatchesDeclaration() {
    InstanceTarget fromDecl = new InstanceTarget(x);
    InstanceTarget fromRef = new InstanceTarget(ref(x));
    assertSame(x, fromRef.target());
    assertTrue(fromRef.isWholeVariable());
    assertEquals(fromDecl, fromRef);
    assertEquals(fromDecl.hashCode(), fromRef.hashCode());
    assertEquals("x", fromRef.toString());
  }

  @Test
  public void testSameNameOtherDeclaration() {
    VariableDeclaration shadow = new VariableDeclaration(
        new ArrayList<String>(), AnnotatedTypeName.uintAll(),
        new Identifier("x"));
    assertFalse(new InstanceTarget(x).equals(new InstanceTarget(shadow)));
  }

  @Test
  public void testMemberAccess() {
    InstanceTarget a = new InstanceTarget(
        new MemberAccessExpr(ref(x), new Identifier("m")));
    InstanceTarget b = new InstanceTarget(
        new MemberAccessExpr(ref(x), new Identifier("m")));
    InstanceTarget other = new InstanceTarget(
        new MemberAccessExpr(ref(x), new Identifier("n")));

    assertFalse(a.isWholeVariable());
    assertEquals(a, b);
    assertFalse(a.equals(other));
    assertFalse(a.equals(new InstanceTarget(x)));
    assertEquals("x.m", a.toString());

    Set<InstanceTarget> set = new HashSet<InstanceTarget>();
    set.add(a);
    set.add(b);
    assertEquals(1, set.size());
  }

  @Test
  public void testIndex() {
    IndexExpr idx = new IndexExpr(ref(x), new NumberLiteralExpr(1));
    InstanceTarget t = new InstanceTarget(idx);
    assertSame(x, t.target());
    assertSame(idx, t.indexExpr());
    assertSame(idx.key(), t.key());
    assertEquals(t, new InstanceTarget(idx));
    assertEquals("x[1]", t.toString());

    // A different index expression is a different location
    InstanceTarget t2 = new InstanceTarget(
        new IndexExpr(ref(x), new NumberLiteralExpr(1)));
    assertFalse(t.equals(t2));
  }

  @Test
  public void testUnsupportedNode() {
    exception.expect(CompilerError.class);
    exception.expectMessage("not a supported location");
    new InstanceTarget(new NumberLiteralExpr(3));
  }

  @Test
  public void testUnresolvedIdentifier() {
    exception.expect(CompilerError.class);
    exception.expectMessage("refers to nothing");
    new InstanceTarget(new IdentifierExpr("y"));
  }
}
