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

import java.util.Arrays;
import java.util.HashSet;

import org.junit.Test;

import cloak.ast.Identifier;

public class PartitionStateTest {

  private final PrivacyLabel alice = PrivacyLabel.owner(new Identifier("alice"));
  private final PrivacyLabel bob = PrivacyLabel.owner(new Identifier("bob"));

  @Test
  public void testLabelsStartSeparate() {
    PartitionState<PrivacyLabel> state = PartitionState.create();
    assertTrue(state.samePartition(alice, alice));
    assertFalse(state.samePartition(alice, bob));
    assertFalse(state.samePartition(PrivacyLabel.CALLER, alice));
    assertEquals(Arrays.asList(bob), state.partitionOf(bob));
  }

  @Test
  public void testMerge() {
    PartitionState<PrivacyLabel> state = PartitionState.create();
    state.merge(PrivacyLabel.CALLER, alice);
    assertTrue(state.samePartition(alice, PrivacyLabel.CALLER));
    assertEquals(new HashSet<PrivacyLabel>(Arrays.asList(alice,
                                                  PrivacyLabel.CALLER)),
                 new HashSet<PrivacyLabel>(state.partitionOf(alice)));
  }

  @Test
  public void testScopes() {
    PartitionState<PrivacyLabel> outer = PartitionState.create();
    outer.merge(PrivacyLabel.CALLER, alice);

    PartitionState<PrivacyLabel> inner = outer.newScope();
    assertTrue(inner.samePartition(PrivacyLabel.CALLER, alice));

    inner.merge(alice, bob);
    assertTrue(inner.samePartition(PrivacyLabel.CALLER, bob));
    assertFalse(outer.samePartition(PrivacyLabel.CALLER, bob));
  }

  @Test
  public void testOuterMergeVisibleAfterInnerMerge() {
    PartitionState<PrivacyLabel> outer = PartitionState.create();
    PartitionState<PrivacyLabel> inner = outer.newScope();
    inner.merge(bob, alice);
    outer.merge(alice, bob);

    assertTrue(outer.samePartition(alice, bob));
    assertTrue(inner.samePartition(alice, bob));
    assertTrue(inner.samePartition(bob, alice));
  }

  @Test
  public void testOwnerLabelsCompareByDeclaration() {
    Identifier x = new Identifier("x");
    assertEquals(PrivacyLabel.owner(x), PrivacyLabel.owner(x));
    assertFalse(PrivacyLabel.owner(x).equals(
                PrivacyLabel.owner(new Identifier("x"))));
  }
}
