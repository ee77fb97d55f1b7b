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
package cloak.frontend;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import cloak.ast.Node;
import cloak.ast.NodeCache;
import cloak.common.Logging;
import cloak.common.exceptions.CompilerError;
import cloak.common.exceptions.UserException;

/**
 * Copies subtrees by printing them and parsing the text again.
 *
 * The copy has the same structure and prints the same, but shares no
 * nodes with the original and carries none of its decorations.
 * Registered caches are cleared on every copy.
 */
public class Cloner {
  private static final Logger logger = Logging.getCloakLogger();

  private final FrontEnd frontEnd;
  private final List<NodeCache<?>> caches = new ArrayList<NodeCache<?>>();

  public Cloner(FrontEnd frontEnd) {
    this.frontEnd = frontEnd;
  }

  public void register(NodeCache<?> cache) {
    caches.add(cache);
  }

  public <T extends Node> T clone(T node) throws UserException {
    String code = node.code();
    Node copy = frontEnd.parse(code);
    if (copy.getClass() != node.getClass()) {
      throw new CompilerError("Reparsing a " + node.getClass().getSimpleName()
          + " gave a " + copy.getClass().getSimpleName() + ": " + code);
    }
    for (NodeCache<?> cache: caches) {
      if (logger.isTraceEnabled()) {
        logger.trace("clone: invalidating cache " + cache.name());
      }
      cache.invalidate();
    }
    @SuppressWarnings("unchecked")
    Class<T> cls = (Class<T>)node.getClass();
    return cls.cast(copy);
  }
}
