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
package cloak.codegen;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import cloak.ast.Identifier;
import cloak.ast.Node;
import cloak.ast.expr.IdentifierExpr;
import cloak.ast.expr.NumberLiteralExpr;
import cloak.ast.expr.PrivacyLabelExpr;
import cloak.ast.expr.SliceExpr;
import cloak.ast.stmt.AssignmentStatement;
import cloak.ast.stmt.Block;
import cloak.ast.stmt.ExpressionStatement;
import cloak.ast.stmt.Statement;
import cloak.common.Settings;
import cloak.common.exceptions.CompilerError;
import cloak.common.exceptions.UserException;
import cloak.common.lang.AnnotatedTypeName;
import cloak.common.lang.Types;
import cloak.frontend.FragmentParser;

public class CodeGeneratorTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @After
  public void restoreSettings() {
    Settings.set(Settings.CODEGEN_INDENTATION, "4");
    Settings.set(Settings.CODEGEN_SOLC_VERSION, "^0.8.0");
  }

  private static Node parse(String code) throws UserException {
    return new FragmentParser().parse(code);
  }

  /**
   * Check that code prints back as written
   */
  private static void checkRoundTrip(String code) throws UserException {
    assertEquals(code, parse(code).code());
  }

  @Test
  public void testExpressions() throws UserException {
    checkRoundTrip("1 + 2 * x");
    checkRoundTrip("(1 + 2) * x");
    checkRoundTrip("a ? b : c");
    checkRoundTrip("!flag && -x < 3");
    checkRoundTrip("2 ** 3 ** 2");
    checkRoundTrip("m[k].f(1, 'abc')");
    checkRoundTrip("a[1:]");
    checkRoundTrip("[1, 2, 3]");
    checkRoundTrip("(a, b)");
    checkRoundTrip("uint8(x)");
    checkRoundTrip("type(C)");
    checkRoundTrip("x = new C;");
    checkRoundTrip("1 ether");
    checkRoundTrip("0x1f");
    checkRoundTrip("f{value: 1}(x)");
  }

  @Test
  public void testPrefixIncrement() throws UserException {
    Node stmt = parse("++i;");
    assertTrue(stmt instanceof AssignmentStatement);
    assertTrue(((AssignmentStatement)stmt).isPreOp());
    assertEquals("++i;", stmt.code());

    checkRoundTrip("--a[k];");
    checkRoundTrip("if (x) {\n    --i;\n}");
  }

  @Test
  public void testSimpleStatements() throws UserException {
    checkRoundTrip("uint x = 1 + 2;");
    checkRoundTrip("uint@me x;");
    checkRoundTrip("x = y;");
    checkRoundTrip("x += 1;");
    checkRoundTrip("i++;");
    checkRoundTrip("--i;");
    checkRoundTrip("f(x);");
    checkRoundTrip("return x;");
    checkRoundTrip("return;");
    checkRoundTrip("require(x > 0, 'too small');");
    checkRoundTrip("emit Transfer(a, b);");
    checkRoundTrip("break;");
  }

  @Test
  public void testControlFlow() throws UserException {
    checkRoundTrip("if (x) y = 1; else y = 2;");
    checkRoundTrip("if (x) {\n    y = 1;\n} else {\n    y = 2;\n}");
    checkRoundTrip("while (i < 10) i++;");
    checkRoundTrip("do {\n    i--;\n} while (i > 0);");
    checkRoundTrip("for (uint i = 0; i < 10; i++) {\n    s += i;\n}");
    checkRoundTrip("for (;;) {\n}");
  }

  @Test
  public void testElseJoinsClosingLine() throws UserException {
    Node stmt = parse("if (a) {\n} else if (b) x = 1; else {\n}");
    assertEquals("if (a) {\n} else if (b) x = 1; else {\n}", stmt.code());
    assertEquals(stmt.code(), parse(stmt.code()).code());
  }

  @Test
  public void testNestedIndentation() throws UserException {
    checkRoundTrip("{\n    if (a) {\n        b = 1;\n    }\n}");
  }

  @Test
  public void testIndentationSetting() throws UserException {
    Settings.set(Settings.CODEGEN_INDENTATION, "2");
    assertEquals("{\n  x = 1;\n}", parse("{ x = 1; }").code());
  }

  @Test
  public void testDefinitions() throws UserException {
    checkRoundTrip("contract C {\n}");
    checkRoundTrip("struct S {\n    uint a;\n    bool b;\n}");
    checkRoundTrip("enum E {\n    A, B\n}");
    checkRoundTrip("event Ev(uint indexed a, address);");
    checkRoundTrip("function f(uint@me x) public returns (uint) {\n" +
                   "    return x;\n}");
    checkRoundTrip("constructor() {\n}");
    checkRoundTrip("modifier onlyOwner() {\n    _;\n}");
    checkRoundTrip("contract C {\n" +
                   "    mapping(address!x => uint@x) balances;\n" +
                   "    uint constant N = 10;\n" +
                   "    function get() public view returns (uint) {\n" +
                   "        return N;\n" +
                   "    }\n" +
                   "}");
  }

  @Test
  public void testSourceUnit() throws UserException {
    checkRoundTrip("pragma cloak ^0.8.0;\n\ncontract A {\n}\n\ncontract B {\n}");
  }

  @Test
  public void testBackendOutput() throws UserException {
    Node unit = parse("pragma cloak ^0.1;\n\ncontract C {\n" +
        "    mapping(address!x => uint@x) balances;\n" +
        "    function f(uint@me v) public {\n" +
        "        balances[me] = reveal(v, all);\n" +
        "    }\n" +
        "}");
    Settings.set(Settings.CODEGEN_SOLC_VERSION, "^0.8.10");
    assertEquals("pragma solidity ^0.8.10;\n\ncontract C {\n" +
        "    mapping(address => uint) balances;\n" +
        "    function f(uint v) public {\n" +
        "        balances[msg.sender] = v;\n" +
        "    }\n" +
        "}", unit.code(true));
  }

  @Test
  public void testFinalKeyword() throws UserException {
    Node decl = parse("final uint@me x = 1;");
    assertEquals("final uint@me x = 1;", decl.code());
    assertEquals("uint@me x = 1;",
                 new CodeGenerator(false, false).generate(decl));
    assertEquals("uint x = 1;", decl.code(true));
  }

  @Test
  public void testPrivateCompoundAssignmentPrintsInFull()
      throws UserException {
    AnnotatedTypeName secret = new AnnotatedTypeName(Types.uintType(),
                                                     PrivacyLabelExpr.me());
    AssignmentStatement s = AssignmentStatement.compound(
        new IdentifierExpr(new Identifier("x"), secret),
        new IdentifierExpr("x"), "+", new NumberLiteralExpr(1));
    assertEquals("x = x + 1;", s.code());

    AssignmentStatement pub = AssignmentStatement.compound(
        new IdentifierExpr("y"), new IdentifierExpr("y"), "*",
        new NumberLiteralExpr(2));
    assertEquals("y *= 2;", pub.code());
  }

  @Test
  public void testPreStatements() throws UserException {
    Statement s = (Statement)parse("x = 1;");
    s.preStatements().add(new ExpressionStatement(new IdentifierExpr("a")));
    assertEquals("a;\nx = 1;", s.code());
  }

  @Test
  public void testSliceAssignmentExpands() {
    SliceExpr lhs = new IdentifierExpr("a").slice(2, 3, null);
    SliceExpr rhs = new IdentifierExpr("b").slice(0, 3, null);
    AssignmentStatement s = new AssignmentStatement(lhs, rhs, "");
    assertEquals("a[2] = b[0];\na[3] = b[1];\na[4] = b[2];", s.code());
  }

  @Test
  public void testSliceWithBase() {
    SliceExpr lhs = new IdentifierExpr("a").slice(0, 2,
                                                  new IdentifierExpr("i"));
    SliceExpr rhs = new IdentifierExpr("b").slice(1, 2, null);
    AssignmentStatement s = new AssignmentStatement(lhs, rhs, "");
    assertEquals("a[i + 0] = b[1];\na[i + 1] = b[2];", s.code());
  }

  @Test
  public void testSliceSizeMismatch() {
    SliceExpr lhs = new IdentifierExpr("a").slice(0, 2, null);
    SliceExpr rhs = new IdentifierExpr("b").slice(0, 3, null);
    AssignmentStatement s = new AssignmentStatement(lhs, rhs, "");
    exception.expect(CompilerError.class);
    exception.expectMessage("don't have the same size");
    s.code();
  }

  @Test
  public void testCompoundWithoutOperatorCall() {
    AssignmentStatement s = new AssignmentStatement(new IdentifierExpr("x"),
        new NumberLiteralExpr(1), "+");
    exception.expect(CompilerError.class);
    s.code();
  }

  @Test
  public void testEmptyStatementList() {
    assertEquals("{\n}", new Block(
        new ArrayList<Statement>()).code());
  }
}
