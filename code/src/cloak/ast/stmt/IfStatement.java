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
package cloak.ast.stmt;

import cloak.ast.NodeVisitor;
import cloak.ast.TreeRewriter;
import cloak.ast.expr.Expression;

public class IfStatement extends Statement {
  private Expression condition;
  private Block thenBranch;
  /** null if there is no else branch */
  private Block elseBranch;

  public IfStatement(Expression condition, Block thenBranch,
                     Block elseBranch) {
    this.condition = condition;
    this.thenBranch = thenBranch;
    this.elseBranch = elseBranch;
  }

  public Expression condition() {
    return condition;
  }

  public Block thenBranch() {
    return thenBranch;
  }

  public Block elseBranch() {
    return elseBranch;
  }

  @Override
  public void processChildren(TreeRewriter rewriter) {
    condition = rewriteChild(rewriter, condition, Expression.class);
    thenBranch = rewriteChild(rewriter, thenBranch, Block.class);
    elseBranch = rewriteChild(rewriter, elseBranch, Block.class);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitIfStatement(this);
  }
}
