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
import cloak.ast.decl.VariableDeclaration;
import cloak.ast.expr.Expression;

public class VariableDeclarationStatement extends SimpleStatement {
  private VariableDeclaration variableDeclaration;
  /** Initializer, may be null */
  private Expression expr;

  public VariableDeclarationStatement(VariableDeclaration variableDeclaration,
                                      Expression expr) {
    this.variableDeclaration = variableDeclaration;
    this.expr = expr;
  }

  public VariableDeclaration variableDeclaration() {
    return variableDeclaration;
  }

  public Expression expr() {
    return expr;
  }

  @Override
  public void processChildren(TreeRewriter rewriter) {
    variableDeclaration = rewriteChild(rewriter, variableDeclaration,
                                       VariableDeclaration.class);
    expr = rewriteChild(rewriter, expr, Expression.class);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitVariableDeclarationStatement(this);
  }
}
