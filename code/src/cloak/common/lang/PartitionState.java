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

import java.util.List;

import cloak.common.util.ScopedUnionFind;

/**
 * Partition of privacy labels into groups that are known to be owned by
 * the same party.  Scopes follow the control flow: merges made in a
 * nested scope are not visible in the parent.
 */
public class PartitionState<T> {

  private final ScopedUnionFind<T> sets;

  private PartitionState(ScopedUnionFind<T> sets) {
    this.sets = sets;
  }

  public static <T1> PartitionState<T1> create() {
    return new PartitionState<T1>(ScopedUnionFind.<T1>createRoot());
  }

  /**
   * @return child state that sees all merges made so far in this state
   */
  public PartitionState<T> newScope() {
    return new PartitionState<T>(sets.newScope());
  }

  /**
   * Record that two labels are co-owned
   */
  public void merge(T x, T y) {
    sets.merge(x, y);
  }

  public boolean samePartition(T x, T y) {
    return sets.sameSet(x, y);
  }

  public List<T> partitionOf(T x) {
    return sets.members(x);
  }

  @Override
  public String toString() {
    return sets.toString();
  }
}
