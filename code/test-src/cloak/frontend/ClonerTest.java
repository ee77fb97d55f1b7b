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
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import cloak.ast.InstanceTarget;
import cloak.ast.Node;
import cloak.ast.NodeCache;
import cloak.ast.decl.ContractDefinition;
import cloak.ast.decl.VariableDeclaration;
import cloak.ast.expr.IdentifierExpr;
import cloak.ast.stmt.Block;
import cloak.ast.stmt.Statement;
import cloak.common.exceptions.CompilerError;
import cloak.common.exceptions.UserException;

public class ClonerTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private final FragmentParser parser = new FragmentParser();

  @Test
  public void testCopyPrintsTheSame() throws UserException {
    ContractDefinition c = (ContractDefinition)parser.parse(
        "contract C {\n" +
        "  uint@me total;\n" +
        "  function add(uint@me v) public {\n" +
        "    total += v;\n" +
        "  }\n" +
        "}");
    ContractDefinition copy = new Cloner(parser).clone(c);

    assertNotSame(c, copy);
    assertEquals(c.code(), copy.code());
    assertNull(copy.parent());
    assertNotSame(c.units().get(0), copy.units().get(0));
    assertEquals("C", copy.name());
  }

  @Test
  public void testCopyDropsDecorations() throws UserException {
    VariableDeclaration x = (VariableDeclaration)((Statement)parser.parse(
        "uint x;")).children().get(0);
    Statement stmt = (Statement)parser.parse("x = 1;");
    IdentifierExpr lhs = (IdentifierExpr)stmt.children().get(0);
    lhs.setTarget(x);
    stmt.modifiedValues().add(new InstanceTarget(lhs));

    Statement copy = new Cloner(parser).clone(stmt);
    assertEquals("x = 1;", copy.code());
    assertTrue(copy.modifiedValues().isEmpty());
    assertNull(((IdentifierExpr)copy.children().get(0)).target());
  }

  @Test
  public void testCachesInvalidated() throws UserException {
    Node stmt = parser.parse("x = 1;");
    NodeCache<String> cache = new NodeCache<String>("test-cache");
    cache.put(stmt, "value");

    Cloner cloner = new Cloner(parser);
    cloner.register(cache);
    assertEquals("value", cache.get(stmt));

    Node copy = cloner.clone(stmt);
    assertTrue(cache.isEmpty());
    assertFalse(cache.containsKey(copy));
  }

  @Test
  public void testCacheKeyedByIdentity() throws UserException {
    Node a = parser.parse("x = 1;");
    Node b = parser.parse("x = 1;");
    NodeCache<Integer> cache = new NodeCache<Integer>("identity");
    cache.put(a, 1);
    assertEquals(Integer.valueOf(1), cache.get(a));
    assertNull(cache.get(b));
  }

  @Test
  public void testShapeChangeDetected() throws UserException {
    // A one-statement body prints as its statement alone
    Block body = (Block)parser.parse("while (x) y = 1;").children().get(1);
    body.detach();
    exception.expect(CompilerError.class);
    exception.expectMessage("Reparsing a Block");
    new Cloner(parser).clone(body);
  }

  @Test
  public void testEmptyBlock() throws UserException {
    Block b = new Block(new ArrayList<Statement>());
    Block copy = new Cloner(parser).clone(b);
    assertEquals(0, copy.size());
  }
}
