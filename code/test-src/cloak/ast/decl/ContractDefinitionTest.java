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
package cloak.ast.decl;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import cloak.common.exceptions.AstException;
import cloak.common.exceptions.UserException;
import cloak.common.lang.Types;
import cloak.frontend.FragmentParser;

public class ContractDefinitionTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static ContractDefinition parse(String code) throws UserException {
    return (ContractDefinition)new FragmentParser().parse(code);
  }

  @Test
  public void testMembers() throws UserException {
    ContractDefinition c = parse("contract Token {\n" +
        "  uint@me balance;\n" +
        "  bool open;\n" +
        "  constructor() {}\n" +
        "  function f() public {}\n" +
        "  function g() internal view {}\n" +
        "}");
    assertEquals(2, c.stateVariableDeclarations().size());
    assertEquals(Arrays.asList("balance", "open"),
                 new ArrayList<String>(c.stateTypes().keySet()));
    assertEquals(Types.boolType(), c.stateTypes().get("open"));
    assertEquals(1, c.constructorDefinitions().size());
    assertEquals(2, c.functionDefinitions().size());

    ConstructorOrFunctionDefinition g = c.functionDefinitions().get(1);
    assertEquals("g", g.name());
    assertSame(c, g.relatedContract());
    assertFalse(g.hasSideEffects());
    assertFalse(g.canBeExternal());
  }

  @Test
  public void testDeclaredConstructor() throws AstException, UserException {
    ContractDefinition c = parse("contract C { constructor() {} }");
    assertSame(c.constructorDefinitions().get(0),
               c.lookup(ConstructorOrFunctionDefinition.CONSTRUCTOR_NAME));
  }

  @Test
  public void testImplicitConstructor() throws AstException, UserException {
    ContractDefinition c = parse("contract C { function f() public {} }");
    ConstructorOrFunctionDefinition ctor = (ConstructorOrFunctionDefinition)
        c.lookup(ConstructorOrFunctionDefinition.CONSTRUCTOR_NAME);
    assertTrue(ctor.isConstructor());
    assertSame(c, ctor.parent());
    assertEquals(0, ctor.body().size());
    // Not added to the members
    assertTrue(c.constructorDefinitions().isEmpty());
  }

  @Test
  public void testMultipleConstructors() throws AstException, UserException {
    ContractDefinition c = parse("contract C {\n" +
        "  constructor() {}\n" +
        "  constructor() {}\n" +
        "}");
    exception.expect(AstException.class);
    exception.expectMessage("Multiple constructors exist");
    c.lookup(ConstructorOrFunctionDefinition.CONSTRUCTOR_NAME);
  }

  @Test
  public void testLookupByName() throws AstException, UserException {
    ContractDefinition c = parse("contract C { uint x; }");
    assertNull(c.lookup("x"));
    StateVariableDeclaration x = c.stateVariableDeclarations().get(0);
    c.scopeNames().put("x", x.idf());
    assertSame(x, c.lookup("x"));
  }

  @Test
  public void testEmptyContractPrints() throws UserException {
    assertEquals("contract C {\n}", parse("contract C {}").code());
  }
}
