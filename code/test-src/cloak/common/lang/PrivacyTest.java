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
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;

import org.junit.Test;

import cloak.ast.Identifier;
import cloak.ast.decl.VariableDeclaration;
import cloak.ast.expr.Expression;
import cloak.ast.expr.Expression.Conformance;
import cloak.ast.expr.IdentifierExpr;
import cloak.ast.expr.NumberLiteralExpr;
import cloak.ast.expr.PrivacyLabelExpr;
import cloak.common.lang.Types.TupleType;

public class PrivacyTest {

  private static AnnotatedTypeName uint(Expression label) {
    return new AnnotatedTypeName(Types.uintType(), label);
  }

  /**
   * Owner label referring to a declared address variable
   */
  private static IdentifierExpr owner(VariableDeclaration decl) {
    IdentifierExpr e = new IdentifierExpr(decl.idf().name());
    e.setTarget(decl);
    return e;
  }

  private static VariableDeclaration address(String name) {
    return new VariableDeclaration(new ArrayList<String>(),
        AnnotatedTypeName.addressAll(), new Identifier(name));
  }

  @Test
  public void testDefaultLabelIsPublic() {
    AnnotatedTypeName t = new AnnotatedTypeName(Types.uintType());
    assertTrue(t.isPublic());
    assertFalse(t.hadPrivacyAnnotation());
    assertTrue(t.privacyAnnotation().isAllExpr());

    AnnotatedTypeName explicit = uint(PrivacyLabelExpr.all());
    assertTrue(explicit.hadPrivacyAnnotation());
    assertEquals(t, explicit);
  }

  @Test
  public void testLabelEquality() {
    assertEquals(uint(PrivacyLabelExpr.me()), uint(PrivacyLabelExpr.me()));
    assertFalse(uint(PrivacyLabelExpr.me()).equals(
                uint(PrivacyLabelExpr.all())));
    assertFalse(uint(PrivacyLabelExpr.me()).equals(
                uint(PrivacyLabelExpr.tee())));
    assertTrue(uint(PrivacyLabelExpr.tee()).isPrivate());
  }

  @Test
  public void testOwnerLabelsCompareByDeclaration() {
    VariableDeclaration alice = address("alice");
    assertEquals(uint(owner(alice)), uint(owner(alice)));
    assertFalse(uint(owner(alice)).equals(uint(owner(address("alice")))));
  }

  @Test
  public void testCombineSameLabel() {
    AnnotatedTypeName mine = uint(PrivacyLabelExpr.me());
    PrivacyMatch m = mine.combinedPrivacy(null, uint(PrivacyLabelExpr.me()));
    assertTrue(m.isComplete());
    assertSame(mine.privacyAnnotation(), m.label());
  }

  @Test
  public void testPublicTakesExpectedLabel() {
    AnnotatedTypeName expected = uint(PrivacyLabelExpr.me());
    PrivacyMatch m = AnnotatedTypeName.uintAll().combinedPrivacy(null,
                                                                 expected);
    assertSame(expected.privacyAnnotation(), m.label());
  }

  @Test
  public void testPrivateDoesNotBecomePublic() {
    PrivacyMatch m = uint(PrivacyLabelExpr.me()).combinedPrivacy(null,
                                         AnnotatedTypeName.uintAll());
    assertTrue(m.isNoMatch());
    assertFalse(m.isComplete());
  }

  @Test
  public void testCoOwnedLabelsMatch() {
    VariableDeclaration alice = address("alice");
    VariableDeclaration bob = address("bob");
    AnnotatedTypeName actual = uint(owner(alice));
    AnnotatedTypeName expected = uint(owner(bob));

    assertTrue(actual.combinedPrivacy(null, expected).isNoMatch());

    PartitionState<PrivacyLabel> analysis = PartitionState.create();
    analysis.merge(PrivacyLabel.owner(alice.idf()),
                   PrivacyLabel.owner(bob.idf()));
    PrivacyMatch m = actual.combinedPrivacy(analysis, expected);
    assertSame(actual.privacyAnnotation(), m.label());
  }

  @Test
  public void testTupleCombinesComponentwise() {
    AnnotatedTypeName actual = new AnnotatedTypeName(new TupleType(
        Arrays.asList(uint(PrivacyLabelExpr.me()),
                      AnnotatedTypeName.uintAll())));
    AnnotatedTypeName expected = new AnnotatedTypeName(new TupleType(
        Arrays.asList(uint(PrivacyLabelExpr.me()),
                      uint(PrivacyLabelExpr.me()))));
    PrivacyMatch m = actual.combinedPrivacy(null, expected);
    assertTrue(m.isTuple());
    assertEquals(2, m.components().size());
    assertTrue(m.isComplete());

    PrivacyMatch wrongArity = actual.combinedPrivacy(null,
        new AnnotatedTypeName(TupleType.empty()));
    assertTrue(wrongArity.isNoMatch());
  }

  @Test
  public void testExpressionConformance() {
    NumberLiteralExpr five = new NumberLiteralExpr(5);
    assertEquals(Conformance.YES, five.instanceOf(AnnotatedTypeName.uintAll()));
    assertEquals(Conformance.MAKE_PRIVATE,
                 five.instanceOf(uint(PrivacyLabelExpr.me())));
    assertEquals(Conformance.NO,
                 five.instanceOf(AnnotatedTypeName.boolAll()));

    IdentifierExpr secret = new IdentifierExpr(new Identifier("s"),
                                               uint(PrivacyLabelExpr.me()));
    assertEquals(Conformance.NO,
                 secret.instanceOf(AnnotatedTypeName.uintAll()));
    assertEquals(Conformance.YES,
                 secret.instanceOf(uint(PrivacyLabelExpr.me())));
  }
}
