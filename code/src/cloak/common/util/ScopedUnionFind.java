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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;

import cloak.common.Logging;

/**
 * Union-find structure with nested scopes.  Merges made in a child scope
 * are not visible in the parent, but merges made in the parent later on
 * are replayed in every child scope.
 *
 * Each scope holds a complete partition: a new scope starts from a copy
 * of its parent's.  A scope's partition is therefore always at least as
 * coarse as its parent's, though the canonical member chosen for a set
 * may differ between the two.
 */
public class ScopedUnionFind<T> {

  private static final Logger logger = Logging.getCloakLogger();

  /** Member to canonical member, absent for canonical members */
  private final Map<T, T> representative;

  /** Canonical member to the other members of its set, in merge order */
  private final SetMultimap<T, T> membersOf;

  /** Scopes created from this one */
  private final List<ScopedUnionFind<T>> inner =
                                  new ArrayList<ScopedUnionFind<T>>();

  private ScopedUnionFind(Map<T, T> representative,
                          SetMultimap<T, T> membersOf) {
    this.representative = representative;
    this.membersOf = membersOf;
  }

  public static <T1> ScopedUnionFind<T1> createRoot() {
    return new ScopedUnionFind<T1>(new HashMap<T1, T1>(),
                                   LinkedHashMultimap.<T1, T1>create());
  }

  public ScopedUnionFind<T> newScope() {
    ScopedUnionFind<T> scope = new ScopedUnionFind<T>(
                          new HashMap<T, T>(representative),
                          LinkedHashMultimap.create(membersOf));
    inner.add(scope);
    return scope;
  }

  /**
   * @return canonical member of the set containing x, x itself if it was
   *         never merged
   */
  public T lookup(T x) {
    T rep = representative.get(x);
    return rep == null ? x : rep;
  }

  public boolean sameSet(T x, T y) {
    return lookup(x).equals(lookup(y));
  }

  /**
   * Join the set of loser into the set of winner.  The canonical member
   * of winner's set stays canonical.  Nothing changes if both are
   * already in the same set.
   *
   * @return members whose canonical member changed, unmodifiable
   */
  public Collection<T> merge(T winner, T loser) {
    T keep = lookup(winner);
    T drop = lookup(loser);

    // Inner partitions are coarser, so nothing changes there either
    if (keep.equals(drop)) {
      return Collections.emptyList();
    }

    List<T> moved = members(drop);
    for (T member: moved) {
      representative.put(member, keep);
      membersOf.put(keep, member);
    }
    membersOf.removeAll(drop);

    for (ScopedUnionFind<T> scope: inner) {
      Collection<T> changed = scope.merge(winner, loser);
      if (logger.isTraceEnabled() && !changed.isEmpty()) {
        logger.trace("Merge of " + loser + " into " + winner +
                     " moved " + changed + " in inner scope");
      }
    }
    return moved;
  }

  /**
   * @return all members of the set containing x, canonical member first
   */
  public List<T> members(T x) {
    T rep = lookup(x);
    List<T> result = new ArrayList<T>();
    result.add(rep);
    result.addAll(membersOf.get(rep));
    return Collections.unmodifiableList(result);
  }

  @Override
  public String toString() {
    return membersOf.toString();
  }
}
