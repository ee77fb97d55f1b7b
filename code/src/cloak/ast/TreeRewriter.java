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

import java.util.Collections;
import java.util.List;

import cloak.ast.stmt.Statement;
import cloak.common.exceptions.CompilerError;

/**
 * Transform applied to the children of a node by
 * {@link Node#processChildren(TreeRewriter)}.
 */
public abstract class TreeRewriter {

  /**
   * @param child current occupant of a child slot, never null
   * @return node to put in the slot (possibly the same), or null to clear it
   */
  public abstract Node rewrite(Node child);

  /**
   * Rewrite a member of a statement sequence.  Override to lower one
   * statement into several: the result is spliced inline, an empty
   * result drops the statement.
   */
  public List<Statement> rewriteStatement(Statement stmt) {
    Node result = rewrite(stmt);
    if (result == null) {
      return Collections.emptyList();
    }
    if (!(result instanceof Statement)) {
      throw new CompilerError("Rewrite replaced a statement with a "
                              + result.getClass().getSimpleName());
    }
    return Collections.singletonList((Statement)result);
  }
}
