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
package cloak.common.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

public class ScopedUnionFindTest {

  /**
   * Owners merged at the top level: alice is canonical for alice, bob,
   * carol and dave, with later merges changing the canonical member
   */
  private ScopedUnionFind<String> owners;

  @Before
  public void setUp() {
    owners = ScopedUnionFind.createRoot();
    owners.merge("bob", "carol");
    owners.merge("carol", "dave");
    owners.merge("alice", "bob");
  }

  @Test
  public void testUnmergedIsOwnCanonical() {
    assertEquals("erin", owners.lookup("erin"));
    assertFalse(owners.sameSet("erin", "alice"));
  }

  @Test
  public void testMergeFollowsCanonical() {
    ScopedUnionFind<String> uf = ScopedUnionFind.createRoot();
    uf.merge("bob", "carol");
    assertEquals("bob", uf.lookup("carol"));

    // Merging into a non-canonical member joins its set
    uf.merge("carol", "dave");
    assertEquals("bob", uf.lookup("dave"));

    uf.merge("alice", "bob");
    for (String s: Arrays.asList("alice", "bob", "carol", "dave")) {
      assertEquals(s, "alice", uf.lookup(s));
    }
  }

  @Test
  public void testScopeSeesParent() {
    ScopedUnionFind<String> scope = owners.newScope();
    assertEquals("alice", scope.lookup("dave"));

    scope.merge("erin", "carol");
    assertEquals("erin", scope.lookup("alice"));
    assertEquals("erin", scope.lookup("dave"));
    assertEquals("alice", owners.lookup("dave"));
  }

  @Test
  public void testParentMergeReachesScope() {
    ScopedUnionFind<String> scope = owners.newScope();
    scope.merge("erin", "alice");

    owners.merge("frank", "erin");
    owners.merge("frank", "alice");

    assertEquals("frank", owners.lookup("dave"));
    assertEquals("frank", scope.lookup("dave"));
    assertEquals("frank", scope.lookup("erin"));
  }

  @Test
  public void testMembers() {
    ScopedUnionFind<String> uf = ScopedUnionFind.createRoot();
    uf.merge("a", "b");
    uf.merge("c", "d");

    assertEquals(Arrays.asList("z"), uf.members("z"));

    List<String> ab = uf.members("b");
    assertEquals("a", ab.get(0));
    assertEquals(new HashSet<String>(Arrays.asList("a", "b")),
                 new HashSet<String>(ab));

    Collection<String> changed = uf.merge("a", "d");
    assertEquals(new HashSet<String>(Arrays.asList("c", "d")),
                 new HashSet<String>(changed));
    assertEquals(4, uf.members("c").size());
    assertTrue(uf.sameSet("b", "c"));
  }

  @Test
  public void testMergeSameSetIsNoop() {
    ScopedUnionFind<String> uf = ScopedUnionFind.createRoot();
    uf.merge("a", "b");
    assertTrue(uf.merge("b", "a").isEmpty());
    assertEquals("a", uf.lookup("b"));
  }

  @Test
  public void testChildMergeHiddenFromParent() {
    ScopedUnionFind<String> uf = ScopedUnionFind.createRoot();
    ScopedUnionFind<String> child = uf.newScope();
    child.merge("x", "y");
    assertTrue(child.sameSet("x", "y"));
    assertFalse(uf.sameSet("x", "y"));
  }

  @Test
  public void testOuterMergeAfterReverseInnerMerge() {
    ScopedUnionFind<String> outer = ScopedUnionFind.createRoot();
    ScopedUnionFind<String> inner = outer.newScope();
    inner.merge("bob", "alice");
    outer.merge("alice", "bob");

    assertTrue(outer.sameSet("alice", "bob"));
    assertTrue(inner.sameSet("alice", "bob"));
    assertEquals(2, inner.members("alice").size());

    // Both scopes still agree after a further merge from outside
    outer.merge("carol", "bob");
    assertTrue(inner.sameSet("carol", "alice"));
    assertEquals(inner.lookup("bob"), inner.lookup("carol"));
    assertEquals(3, inner.members("carol").size());
  }

  @Test
  public void testOuterMergeReachesNestedScopes() {
    ScopedUnionFind<String> outer = ScopedUnionFind.createRoot();
    ScopedUnionFind<String> middle = outer.newScope();
    ScopedUnionFind<String> innermost = middle.newScope();
    middle.merge("alice", "bob");

    outer.merge("carol", "dave");
    assertTrue(innermost.sameSet("carol", "dave"));
    assertTrue(innermost.sameSet("alice", "bob"));
    assertFalse(outer.sameSet("alice", "bob"));
  }
}
