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
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import cloak.ast.Identifier;
import cloak.ast.decl.ConstructorOrFunctionDefinition.PrivacyType;
import cloak.common.exceptions.UserException;
import cloak.common.lang.AnnotatedTypeName;
import cloak.common.lang.Types;
import cloak.frontend.FragmentParser;

public class FunctionDefinitionTest {

  private static ConstructorOrFunctionDefinition parse(String code)
      throws UserException {
    return (ConstructorOrFunctionDefinition)new FragmentParser().parse(code);
  }

  private static List<String> names(List<VariableDeclaration> decls) {
    List<String> result = new ArrayList<String>();
    for (VariableDeclaration d: decls) {
      result.add(d.idf().name());
    }
    return result;
  }

  @Test
  public void testReturnBindingsFollowPrivacyType() throws UserException {
    ConstructorOrFunctionDefinition f = parse(
        "function f() public returns (uint, bool@me) {}");
    assertTrue(f.isPub());
    assertEquals("[tee__ret_0, tee__ret_1]",
                 names(f.returnVarDecls()).toString());
    assertSame(f.returnParameters().get(1).annotatedType(),
               f.returnVarDecls().get(1).annotatedType());

    List<VariableDeclaration> before = f.returnVarDecls();
    f.setRequiresVerification(false);
    assertSame(before, f.returnVarDecls());

    f.setRequiresVerification(true);
    assertTrue(f.isZkp());
    assertTrue(f.requiresVerification());
    assertEquals("[zk__ret_0, zk__ret_1]",
                 names(f.returnVarDecls()).toString());

    f.setPrivacyType(PrivacyType.TEE);
    assertTrue(f.isTee());
    assertEquals("[tee__ret_0, tee__ret_1]",
                 names(f.returnVarDecls()).toString());
  }

  @Test
  public void testModifiers() throws UserException {
    ConstructorOrFunctionDefinition f = parse(
        "function f(uint a) external payable onlyOwner(a) override {}");
    assertEquals("[external, payable]", f.modifierKeywords().toString());
    assertEquals(4, f.modifiers().size());
    assertTrue(f.isExternal());
    assertTrue(f.isPayable());
    assertTrue(f.hasSideEffects());
    assertTrue(f.canBeExternal());
    assertEquals("function f(uint a) external payable onlyOwner(a) override {\n}",
                 f.code());
  }

  @Test
  public void testFunctionType() throws UserException {
    ConstructorOrFunctionDefinition f = parse(
        "function f(uint a, bool@me b) public pure returns (uint) {}");
    assertEquals(2, f.parameterTypes().size());
    assertEquals(1, f.returnType().size());
    assertFalse(f.hasSideEffects());
    assertTrue(f.annotatedType().isPublic());
  }

  @Test
  public void testAddParam() throws UserException {
    ConstructorOrFunctionDefinition f = parse("function f() public {}");
    Parameter p = f.addParam(Types.uintType(), "n");
    Parameter arr = f.addParam(new AnnotatedTypeName(Types.dynUintArray()),
                               new Identifier("xs"), "calldata");
    assertSame(f, p.parent());
    assertEquals("", p.storageLocation());
    assertEquals("calldata", arr.storageLocation());
    assertEquals(2, f.parameterTypes().size());
    assertEquals("function f(uint n, uint[] calldata xs) public {\n}",
                 f.code());
  }

  @Test
  public void testParameterCopy() {
    Parameter p = new Parameter(new ArrayList<String>(),
        AnnotatedTypeName.uintAll(), new Identifier("a"), "memory");
    Parameter copy = p.copy();
    assertNotSame(p, copy);
    assertSame(p.annotatedType(), copy.annotatedType());
    assertSame(p.idf(), copy.idf());

    assertSame(copy, copy.withChangedStorage("memory", "calldata"));
    assertEquals("calldata", copy.storageLocation());
    assertEquals("memory", p.storageLocation());
    copy.withChangedStorage("storage", "memory");
    assertEquals("calldata", copy.storageLocation());
  }

  @Test
  public void testConstructorName() throws UserException {
    ConstructorOrFunctionDefinition c = parse("constructor() {}");
    assertTrue(c.isConstructor());
    assertEquals(ConstructorOrFunctionDefinition.CONSTRUCTOR_NAME, c.name());
  }
}
