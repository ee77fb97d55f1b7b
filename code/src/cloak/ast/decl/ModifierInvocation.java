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
package cloak.ast.decl;

import java.util.List;

import cloak.ast.Node;
import cloak.ast.NodeVisitor;
import cloak.ast.TreeRewriter;
import cloak.ast.expr.CallArgumentList;

/**
 * Use of a modifier in a function header, {@code onlyOwner} or
 * {@code base.check(x)}
 */
public class ModifierInvocation extends Node {
  private final List<String> path;
  /** null if written without parentheses */
  private CallArgumentList args;

  public ModifierInvocation(List<String> path, CallArgumentList args) {
    this.path = path;
    this.args = args;
  }

  public List<String> path() {
    return path;
  }

  public CallArgumentList args() {
    return args;
  }

  @Override
  public void processChildren(TreeRewriter rewriter) {
    args = rewriteChild(rewriter, args, CallArgumentList.class);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitModifierInvocation(this);
  }
}
