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

import java.util.Map;

import com.google.common.collect.ForwardingMap;
import com.google.common.collect.Maps;

/**
 * Side table keyed by node identity.
 *
 * Clones of a node are never the same object, so entries do not carry
 * over to clones.  Register caches with the cloner so they are dropped
 * whenever a clone is made.
 */
public class NodeCache<V> extends ForwardingMap<Node, V> {
  private final String name;
  private final Map<Node, V> entries = Maps.newIdentityHashMap();

  public NodeCache(String name) {
    this.name = name;
  }

  public String name() {
    return name;
  }

  @Override
  protected Map<Node, V> delegate() {
    return entries;
  }

  /**
   * Drop all entries, called after a clone
   */
  public void invalidate() {
    entries.clear();
  }
}
