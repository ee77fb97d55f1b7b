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

/**
 * {@code for (init; condition; update) body}; header parts may be null
 */
public class ForStatement extends Statement {
  private SimpleStatement init;
  private Expression condition;
  private SimpleStatement update;
  private Block body;

  public ForStatement(SimpleStatement init, Expression condition,
                      SimpleStatement update, Block body) {
    this.init = init;
    this.condition = condition;
    this.update = update;
    this.body = body;
  }

  public SimpleStatement init() {
    return init;
  }

  public Expression condition() {
    return condition;
  }

  public SimpleStatement update() {
    return update;
  }

  public Block body() {
    return body;
  }

  @Override
  public void processChildren(TreeRewriter rewriter) {
    init = rewriteChild(rewriter, init, SimpleStatement.class);
    condition = rewriteChild(rewriter, condition, Expression.class);
    update = rewriteChild(rewriter, update, SimpleStatement.class);
    body = rewriteChild(rewriter, body, Block.class);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitForStatement(this);
  }
}
