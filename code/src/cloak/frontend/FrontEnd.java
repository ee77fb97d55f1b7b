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

import cloak.ast.Node;
import cloak.common.exceptions.UserException;

/**
 * Turns source text into a tree.  Parsers build nodes through
 * {@link NodeFactory}.
 */
public interface FrontEnd {

  /**
   * Parse a fragment of source text: a whole source unit, or a single
   * definition, statement, expression or type.
   * @return the root node of the fragment, with parents linked
   * @throws UserException if the text does not parse
   */
  public Node parse(String code) throws UserException;
}
