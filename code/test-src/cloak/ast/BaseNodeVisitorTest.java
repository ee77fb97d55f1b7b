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

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import cloak.ast.stmt.BreakStatement;
import cloak.common.exceptions.CompilerError;
import cloak.common.lang.Types;
import cloak.common.lang.Types.ElementaryTypeName;
import cloak.common.lang.Types.NumberTypeName;

public class BaseNodeVisitorTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  /**
   * Names numeric types, everything else elementary gets a generic name
   */
  private static class TypeKind extends BaseNodeVisitor<String> {
    @Override
    public String visitElementaryTypeName(ElementaryTypeName node) {
      return "elementary";
    }

    @Override
    public String visitNumberTypeName(NumberTypeName node) {
      return "number";
    }
  }

  @Test
  public void testFallBackToSuperclass() {
    TypeKind v = new TypeKind();
    assertEquals("number", Types.uintType().accept(v));
    assertEquals("number", Types.elementaryType("int8").accept(v));
    assertEquals("elementary", Types.boolType().accept(v));
    assertEquals("elementary", Types.elementaryType("string").accept(v));
  }

  @Test
  public void testUnhandledVariant() {
    exception.expect(CompilerError.class);
    exception.expectMessage("No rule for BreakStatement in TypeKind");
    new BreakStatement().accept(new TypeKind());
  }
}
