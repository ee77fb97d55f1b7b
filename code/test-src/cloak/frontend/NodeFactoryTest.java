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
package cloak.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import cloak.ast.Identifier;
import cloak.ast.Node;
import cloak.ast.decl.ConstructorOrFunctionDefinition;
import cloak.ast.decl.ContractDefinition;
import cloak.ast.decl.SourceUnit;
import cloak.ast.expr.Expression;
import cloak.ast.expr.IdentifierExpr;
import cloak.ast.stmt.AssignmentStatement;
import cloak.ast.stmt.Block;
import cloak.ast.stmt.Statement;
import cloak.common.exceptions.CompilerError;
import cloak.common.exceptions.UserException;

public class NodeFactoryTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Test
  public void testNumberLiterals() {
    assertEquals(BigInteger.valueOf(255), NodeFactory.parseNumber("0xff"));
    assertEquals(BigInteger.valueOf(255), NodeFactory.parseNumber("0XFF"));
    assertEquals(BigInteger.valueOf(1000000),
                 NodeFactory.parseNumber("1_000_000"));
    assertEquals(BigInteger.valueOf(2000), NodeFactory.parseNumber("2e3"));
    assertEquals(BigInteger.valueOf(25), NodeFactory.parseNumber("2.5e1"));
    assertEquals(BigInteger.TEN.pow(30), NodeFactory.parseNumber("1e30"));
  }

  @Test
  public void testFractionalNumberRejected() {
    exception.expect(CompilerError.class);
    exception.expectMessage("not an integer");
    NodeFactory.parseNumber("1.5");
  }

  @Test
  public void testPositionAndChildren() throws UserException {
    Identifier x = NodeFactory.build(Identifier.class, Production.IDENTIFIER,
                                     1, 1, "x");
    IdentifierExpr e = NodeFactory.build(IdentifierExpr.class,
        Production.IDENTIFIER_EXPR, 3, 7, x);
    assertEquals(3, e.line());
    assertEquals(7, e.column());
    assertSame(e, x.parent());
  }

  @Test
  public void testWrongArgumentType() throws UserException {
    exception.expect(CompilerError.class);
    exception.expectMessage("should be String");
    NodeFactory.build(Production.IDENTIFIER, 1, 1, 42);
  }

  @Test
  public void testMissingArgument() throws UserException {
    exception.expect(CompilerError.class);
    exception.expectMessage("expected argument 0");
    NodeFactory.build(Production.IDENTIFIER, 1, 1);
  }

  @Test
  public void testWrongListElement() throws UserException {
    List<Object> stmts = new ArrayList<Object>();
    stmts.add(new Identifier("x"));
    exception.expect(CompilerError.class);
    exception.expectMessage("should only contain Statement");
    NodeFactory.build(Production.BLOCK, 1, 1, stmts, false);
  }

  @Test
  public void testUnexpectedNodeClass() throws UserException {
    exception.expect(CompilerError.class);
    exception.expectMessage("not a Statement");
    NodeFactory.build(Statement.class, Production.IDENTIFIER, 1, 1, "x");
  }

  @Test
  public void testReservedNames() throws UserException {
    assertTrue(NameChecker.isReserved("zk__x"));
    assertTrue(NameChecker.isReserved("_zk__x"));
    assertTrue(NameChecker.isReserved("x_zalt"));
    assertFalse(NameChecker.isReserved("zk_x"));
    assertFalse(NameChecker.isReserved("x_zalt_"));

    exception.expect(UserException.class);
    exception.expectMessage("At line: 2;5: ");
    NodeFactory.build(Production.IDENTIFIER, 2, 5, "zk__tmp");
  }

  @Test
  public void testReservedNameInSource() throws UserException {
    exception.expect(UserException.class);
    exception.expectMessage("reserved prefix");
    new FragmentParser().parse("uint zk__x = 1;");
  }

  @Test
  public void testSourceUnitLinkedThroughout() throws UserException {
    SourceUnit unit = (SourceUnit)new FragmentParser().parse(
        "pragma cloak ^0.1;\n" +
        "contract C {\n" +
        "  function f(uint a) public {\n" +
        "    x = a;\n" +
        "  }\n" +
        "}\n");
    ContractDefinition c = unit.contracts().get(0);
    ConstructorOrFunctionDefinition f = c.functionDefinitions().get(0);
    Statement stmt = f.body().get(0);
    assertTrue(stmt instanceof AssignmentStatement);
    Expression rhs = ((AssignmentStatement)stmt).rhs();

    assertSame(f, stmt.function());
    assertSame(stmt, rhs.statement());
    assertSame(c, rhs.relatedContract());
    assertSame(unit, rhs.relatedSourceUnit());
    assertEquals(4, stmt.line());
    assertEquals(5, stmt.column());
    assertEquals("    x = a;", unit.originalCode().get(3));
    assertTrue(((AssignmentStatement)stmt).lhs().isInAssignmentLhs());
    assertFalse(rhs.isInAssignmentLhs());
  }

  @Test
  public void testSingleStatementBody() throws UserException {
    Node n = new FragmentParser().parse("while (x) x--;");
    Block body = (Block)n.children().get(1);
    assertTrue(body.wasSingleStatement());
    assertEquals(1, body.size());
    assertNull(body.function());
    assertSame(n, body.parent());
  }
}
