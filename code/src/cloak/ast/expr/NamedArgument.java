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
package cloak.ast.expr;

import cloak.ast.Node;
import cloak.ast.NodeVisitor;
import cloak.ast.TreeRewriter;

public class NamedArgument extends Node {
  private final String key;
  private Expression value;

  public NamedArgument(String key, Expression value) {
    this.key = key;
    this.value = value;
  }

  public String key() {
    return key;
  }

  public Expression value() {
    return value;
  }

  @Override
  public void processChildren(TreeRewriter rewriter) {
    value = rewriteChild(rewriter, value, Expression.class);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitNamedArgument(this);
  }
}
