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
package cloak.common.exceptions;

import cloak.ast.Node;
import cloak.frontend.Diagnostics;

/**
 * Error in the input program that can be located in the tree.
 * The message is prefixed with a source excerpt around the node.
 */
public class AstException extends UserException {

  private final transient Node node;

  public AstException(Node node, String message) {
    super(Diagnostics.astExceptionMessage(node, message));
    this.node = node;
  }

  public Node getNode() {
    return node;
  }

  private static final long serialVersionUID = 1L;
}
