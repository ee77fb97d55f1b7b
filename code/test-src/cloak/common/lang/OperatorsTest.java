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
package cloak.common.lang;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import cloak.common.exceptions.UnknownOperatorException;
import cloak.common.lang.Operators.BuiltinOp;
import cloak.common.lang.Operators.OpCategory;

public class OperatorsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static BigInteger i(long v) {
    return BigInteger.valueOf(v);
  }

  private static Object eval(BuiltinOp op, Object ... args) {
    return OpEvaluator.eval(op, Arrays.asList(args));
  }

  @Test
  public void testSymbols() throws UnknownOperatorException {
    assertEquals(BuiltinOp.MINUS, Operators.fromSymbol("-"));
    assertEquals(BuiltinOp.SIGN_MINUS, Operators.fromSymbol("sign-"));
    assertEquals(BuiltinOp.ITE, Operators.fromSymbol("ite"));
    assertTrue(Operators.isBuiltin("**"));
    assertFalse(Operators.isBuiltin("+++"));
  }

  @Test
  public void testUnknownSymbol() throws UnknownOperatorException {
    exception.expect(UnknownOperatorException.class);
    Operators.fromSymbol("<>");
  }

  @Test
  public void testArityFollowsTemplate() {
    assertEquals(2, BuiltinOp.MOD.arity());
    assertEquals(1, BuiltinOp.NOT.arity());
    assertEquals(1, BuiltinOp.PARENTHESIS.arity());
    assertEquals(3, BuiltinOp.ITE.arity());
  }

  @Test
  public void testFormat() {
    assertEquals("a % b", BuiltinOp.MOD.format(Arrays.asList("a", "b")));
    assertEquals("c ? x : y",
                 BuiltinOp.ITE.format(Arrays.asList("c", "x", "y")));
    assertEquals("-x", BuiltinOp.SIGN_MINUS.format(Arrays.asList("x")));
    assertEquals("(x + 1)",
                 BuiltinOp.PARENTHESIS.format(Arrays.asList("x + 1")));
  }

  @Test
  public void testCategories() {
    List<BuiltinOp> shifts = Operators.inCategory(OpCategory.SHIFT);
    assertEquals(Arrays.asList(BuiltinOp.SHL, BuiltinOp.SHR), shifts);
    assertTrue(BuiltinOp.EQ.isEquality());
    assertTrue(BuiltinOp.LT.isComparison());
    assertTrue(BuiltinOp.SIGN_MINUS.isNegSign());
    assertTrue(BuiltinOp.AND.hasShortCircuiting());
    assertFalse(BuiltinOp.PLUS.hasShortCircuiting());
  }

  @Test
  public void testIntegerArithmetic() {
    assertEquals(i(7), eval(BuiltinOp.PLUS, i(3), i(4)));
    assertEquals(i(-1), eval(BuiltinOp.MINUS, i(3), i(4)));
    assertEquals(i(1024), eval(BuiltinOp.POW, i(2), i(10)));
    assertEquals(i(6), eval(BuiltinOp.SHL, i(3), i(1)));
    assertEquals(i(-5), eval(BuiltinOp.SIGN_MINUS, i(5)));
    assertEquals(true, eval(BuiltinOp.LT, i(3), i(4)));
    assertEquals(false, eval(BuiltinOp.EQ, i(3), i(4)));
  }

  @Test
  public void testDivisionByZeroLeftToRuntime() {
    assertNull(eval(BuiltinOp.DIV, i(1), i(0)));
    assertNull(eval(BuiltinOp.MOD, i(1), i(0)));
  }

  @Test
  public void testOversizedResultsLeftToRuntime() {
    assertNull(eval(BuiltinOp.SHL, i(1), i(2000000000)));
    assertNull(eval(BuiltinOp.SHL, i(1), i(256)));
    assertEquals(i(2).pow(255), eval(BuiltinOp.SHL, i(1), i(255)));
    assertNull(eval(BuiltinOp.POW, i(10), i(100)));
    assertNull(eval(BuiltinOp.POW, i(2), i(3000000000L)));
    assertEquals(i(10).pow(77), eval(BuiltinOp.POW, i(10), i(77)));

    // Small bases and right shifts never overflow
    assertEquals(i(1), eval(BuiltinOp.POW, i(1), i(3000000000L)));
    assertEquals(i(-1), eval(BuiltinOp.POW, i(-1), i(3000000001L)));
    assertEquals(i(0), eval(BuiltinOp.SHR, i(5), i(2000000000)));
    assertEquals(i(-1), eval(BuiltinOp.SHR, i(-5), i(2000000000)));
    assertNull(eval(BuiltinOp.SHL, i(1), i(-1)));
  }

  @Test
  public void testBooleans() {
    assertEquals(false, eval(BuiltinOp.NOT, true));
    assertEquals(true, eval(BuiltinOp.NEQ, true, false));
  }

  @Test
  public void testShortCircuit() {
    // One known operand decides the result
    assertEquals(false, eval(BuiltinOp.AND, false, null));
    assertEquals(true, eval(BuiltinOp.OR, true, null));
    assertNull(eval(BuiltinOp.AND, true, null));
    assertEquals(i(1), eval(BuiltinOp.ITE, true, i(1), null));
    assertNull(eval(BuiltinOp.ITE, null, i(1), i(2)));
  }

  @Test
  public void testUnknownOperandGivesNoValue() {
    assertNull(eval(BuiltinOp.PLUS, i(1), null));
    assertNull(eval(BuiltinOp.PLUS, i(1), true));
    assertNull(eval(BuiltinOp.PLUS, i(1)));
  }
}
