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

import java.util.List;

import cloak.ast.NodeVisitor;
import cloak.ast.TreeRewriter;
import cloak.ast.decl.VariableDeclaration;
import cloak.ast.expr.Expression;

/**
 * {@code (uint a, , bool c) = f();}
 */
public class TupleVariableDeclarationStatement extends SimpleStatement {
  /** null entries for skipped components */
  private final List<VariableDeclaration> vs;
  private Expression expr;

  public TupleVariableDeclarationStatement(List<VariableDeclaration> vs,
                                           Expression expr) {
    this.vs = vs;
    this.expr = expr;
  }

  public List<VariableDeclaration> vs() {
    return vs;
  }

  public Expression expr() {
    return expr;
  }

  @Override
  public void processChildren(TreeRewriter rewriter) {
    rewriteChildren(rewriter, vs, VariableDeclaration.class);
    expr = rewriteChild(rewriter, expr, Expression.class);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitTupleVariableDeclarationStatement(this);
  }
}
