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
import static org.junit.Assert.assertTrue;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;

import org.junit.Test;

import cloak.ast.Identifier;
import cloak.ast.Node;
import cloak.ast.decl.ContractDefinition;
import cloak.ast.expr.NumberLiteralExpr;
import cloak.common.lang.Types.AddressPayableTypeName;
import cloak.common.lang.Types.AddressTypeName;
import cloak.common.lang.Types.ArrayTypeName;
import cloak.common.lang.Types.BoolTypeName;
import cloak.common.lang.Types.BooleanLiteralType;
import cloak.common.lang.Types.ContractTypeName;
import cloak.common.lang.Types.IntTypeName;
import cloak.common.lang.Types.Mapping;
import cloak.common.lang.Types.MappingSplit;
import cloak.common.lang.Types.NumberLiteralType;
import cloak.common.lang.Types.NumberTypeName;
import cloak.common.lang.Types.StructTypeName;
import cloak.common.lang.Types.TupleType;
import cloak.common.lang.Types.TypeName;
import cloak.common.lang.Types.UintTypeName;
import cloak.common.lang.Types.UserDefinedTypeName;

public class TypesTest {

  private static final UintTypeName UINT8 = new UintTypeName("uint8");
  private static final UintTypeName UINT16 = new UintTypeName("uint16");
  private static final IntTypeName INT8 = new IntTypeName("int8");
  private static final IntTypeName INT16 = new IntTypeName("int16");

  @Test
  public void testWideningConversions() {
    assertTrue(UINT8.implicitlyConvertibleTo(UINT16));
    assertFalse(UINT16.implicitlyConvertibleTo(UINT8));
    assertTrue(INT8.implicitlyConvertibleTo(INT16));
    assertTrue(UINT8.implicitlyConvertibleTo(UINT8));
    assertTrue(UINT8.implicitlyConvertibleTo(Types.uintType()));
  }

  @Test
  public void testNoConversionBetweenSignedness() {
    assertFalse(INT8.implicitlyConvertibleTo(UINT8));
    assertFalse(UINT8.implicitlyConvertibleTo(INT16));
    assertFalse(UINT8.compatibleWith(INT8));
  }

  @Test
  public void testEveryNumberConvertsToAnyNumber() {
    NumberTypeName any = Types.numberType();
    assertTrue(UINT8.implicitlyConvertibleTo(any));
    assertTrue(INT16.implicitlyConvertibleTo(any));
    assertTrue(new NumberLiteralType(-5).implicitlyConvertibleTo(any));
  }

  @Test
  public void testUnqualifiedNameIs256Bits() {
    assertEquals(256, Types.uintType().elemBitwidth());
    assertEquals(256, new IntTypeName().elemBitwidth());
    assertEquals(8, UINT8.elemBitwidth());
    assertEquals(1, Types.boolType().elemBitwidth());
    assertEquals(160, Types.addressType().elemBitwidth());
  }

  @Test
  public void testLiteralBitwidth() {
    assertEquals(8, NumberLiteralType.literalBitwidth(BigInteger.ZERO));
    assertEquals(8, NumberLiteralType.literalBitwidth(BigInteger.valueOf(127)));
    assertEquals(8, NumberLiteralType.literalBitwidth(BigInteger.valueOf(255)));
    assertEquals(16, NumberLiteralType.literalBitwidth(BigInteger.valueOf(256)));
    assertEquals(8, NumberLiteralType.literalBitwidth(BigInteger.valueOf(-128)));
    assertEquals(16, NumberLiteralType.literalBitwidth(BigInteger.valueOf(-129)));
    assertEquals(256, NumberLiteralType.literalBitwidth(
                                        BigInteger.ONE.shiftLeft(300)));
  }

  @Test
  public void testLiteralFitsSignedType() {
    assertTrue(new NumberLiteralType(127).implicitlyConvertibleTo(INT8));
    assertFalse(new NumberLiteralType(128).implicitlyConvertibleTo(INT8));
    assertTrue(new NumberLiteralType(-128).implicitlyConvertibleTo(INT8));
    assertFalse(new NumberLiteralType(-129).implicitlyConvertibleTo(INT8));
  }

  @Test
  public void testLiteralFitsUnsignedType() {
    assertTrue(new NumberLiteralType(255).implicitlyConvertibleTo(UINT8));
    assertFalse(new NumberLiteralType(256).implicitlyConvertibleTo(UINT8));
    assertFalse(new NumberLiteralType(-1).implicitlyConvertibleTo(UINT8));
    assertTrue(new NumberLiteralType(0).implicitlyConvertibleTo(UINT8));
  }

  @Test
  public void testAddressSizedLiteralConvertsToAddress() {
    NumberLiteralType addr = new NumberLiteralType(
                                        BigInteger.ONE.shiftLeft(159));
    assertEquals(160, addr.elemBitwidth());
    assertTrue(addr.implicitlyConvertibleTo(Types.addressType()));
    assertFalse(new NumberLiteralType(1).implicitlyConvertibleTo(
                                        Types.addressType()));
  }

  @Test
  public void testLiteralAbstractType() {
    assertEquals(new UintTypeName("uint16"),
                 new NumberLiteralType(300).toAbstractType());
    assertEquals(new IntTypeName("int8"),
                 new NumberLiteralType(-1).toAbstractType());
    assertEquals(Types.boolType(), new BooleanLiteralType(true).toAbstractType());
  }

  @Test
  public void testCombineLiterals() {
    NumberLiteralType five = new NumberLiteralType(5);
    NumberLiteralType big = new NumberLiteralType(300);

    assertTrue(five.combinedType(big, false).isStillLiteral());

    TypeCombination c = five.combinedType(big, true);
    assertTrue(c.isCombined());
    assertEquals(UINT16, c.type());

    TypeCombination withVar = five.combinedType(new UintTypeName("uint32"),
                                                true);
    assertEquals(new UintTypeName("uint32"), withVar.type());
  }

  @Test
  public void testCombineIncompatible() {
    assertTrue(UINT8.combinedType(INT8, true).isNone());
    assertTrue(Types.boolType().combinedType(UINT8, true).isNone());
  }

  @Test
  public void testCombineBooleanLiterals() {
    BooleanLiteralType t = new BooleanLiteralType(true);
    BooleanLiteralType f = new BooleanLiteralType(false);
    assertTrue(t.combinedType(f, false).isStillLiteral());
    assertTrue(t.combinedType(f, true).type() instanceof BoolTypeName);
    assertTrue(t.implicitlyConvertibleTo(Types.boolType()));
  }

  @Test
  public void testAddressPayable() {
    assertTrue(Types.addressPayableType().implicitlyConvertibleTo(
                                            Types.addressType()));
    assertFalse(Types.addressType().implicitlyConvertibleTo(
                                            Types.addressPayableType()));
    assertTrue(Types.elementaryType("address payable")
               instanceof AddressPayableTypeName);
  }

  @Test
  public void testMappingKeyLabelIgnoredInEquality() {
    Mapping labelled = new Mapping(Types.addressType(), new Identifier("x"),
                                   AnnotatedTypeName.uintAll());
    Mapping plain = new Mapping(Types.addressType(), null,
                                AnnotatedTypeName.uintAll());
    assertEquals(labelled, plain);
    assertEquals(labelled.hashCode(), plain.hashCode());
    assertFalse(labelled.equals(new Mapping(Types.uintType(), null,
                                            AnnotatedTypeName.uintAll())));
  }

  @Test
  public void testMappingSplit() {
    Mapping inner = new Mapping(Types.uintType(), null,
                                AnnotatedTypeName.boolAll());
    Mapping outer = new Mapping(Types.addressType(), null,
                                new AnnotatedTypeName(inner));
    assertEquals(2, outer.mapDepth());

    MappingSplit split = outer.split();
    assertEquals(2, split.depth);
    assertEquals(Arrays.<TypeName>asList(Types.addressType(),
                                         Types.uintType()), split.keyTypes);
    assertEquals(AnnotatedTypeName.boolAll(), split.valueType);
  }

  @Test
  public void testArrayEquality() {
    ArrayTypeName three = new ArrayTypeName(AnnotatedTypeName.uintAll(),
                                            new NumberLiteralExpr(3));
    assertEquals(three, new ArrayTypeName(AnnotatedTypeName.uintAll(),
                                          new NumberLiteralExpr(3)));
    assertFalse(three.equals(new ArrayTypeName(AnnotatedTypeName.uintAll(),
                                               new NumberLiteralExpr(4))));
    assertFalse(three.equals(Types.dynUintArray()));
    assertEquals(Types.dynUintArray(), Types.dynUintArray());
    assertEquals(3, three.sizeInUints());
    assertEquals(ArrayTypeName.UNKNOWN_SIZE,
                 Types.dynUintArray().sizeInUints());
  }

  @Test
  public void testTupleConversionIsElementwise() {
    TupleType literals = new TupleType(Arrays.asList(
        new AnnotatedTypeName(new NumberLiteralType(1)),
        new AnnotatedTypeName(new BooleanLiteralType(false))));
    TupleType target = new TupleType(Arrays.asList(
        new AnnotatedTypeName(UINT8), AnnotatedTypeName.boolAll()));
    assertTrue(literals.implicitlyConvertibleTo(target));
    assertFalse(target.implicitlyConvertibleTo(literals));
    assertTrue(literals.compatibleWith(target));
    assertFalse(literals.implicitlyConvertibleTo(TupleType.empty()));

    TypeCombination c = literals.combinedType(target, true);
    assertEquals(target, c.type());
  }

  @Test
  public void testElementaryTypeKeywords() {
    assertEquals(UINT8, Types.elementaryType("uint8"));
    assertEquals(INT16, Types.elementaryType("int16"));
    assertTrue(Types.elementaryType("bool") instanceof BoolTypeName);
    assertEquals(32, ((Types.BytesTypeName)Types.elementaryType("bytes32"))
                                                     .length());
    assertEquals(-1, ((Types.BytesTypeName)Types.elementaryType("bytes"))
                                                     .length());
  }

  @Test
  public void testUnresolvedTypeEqualsResolvedType() {
    ContractDefinition bank = new ContractDefinition(new Identifier("Bank"),
                                                     new ArrayList<Node>());
    UserDefinedTypeName unresolved = new UserDefinedTypeName(
                                  Arrays.asList(new Identifier("Bank")));
    ContractTypeName resolved = new ContractTypeName(
                                  Arrays.asList(new Identifier("Bank")), bank);

    assertTrue(unresolved.equals(resolved));
    assertTrue(resolved.equals(unresolved));
    assertEquals(unresolved.hashCode(), resolved.hashCode());
    assertTrue(unresolved.implicitlyConvertibleTo(resolved));
    assertTrue(resolved.implicitlyConvertibleTo(unresolved));

    StructTypeName account = new StructTypeName(
                                  Arrays.asList(new Identifier("Account")), null);
    assertFalse(account.equals(unresolved));
    assertFalse(unresolved.equals(account));
  }

  @Test
  public void testAddressTypesStayDistinct() {
    assertTrue(new AddressTypeName().equals(Types.addressType()));
    assertFalse(new AddressTypeName().equals(new AddressPayableTypeName()));
    assertFalse(new AddressPayableTypeName().equals(new AddressTypeName()));
    assertTrue(new AddressPayableTypeName().implicitlyConvertibleTo(
                                                    Types.addressType()));
  }
}
