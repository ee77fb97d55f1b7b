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
import cloak.ast.decl.Parameter;
import cloak.ast.expr.Expression;

public class TryStatement extends Statement {
  private Expression expr;
  private final List<Parameter> returnParameters;
  private Block body;
  private final List<CatchClause> catchClauses;

  public TryStatement(Expression expr, List<Parameter> returnParameters,
                      Block body, List<CatchClause> catchClauses) {
    this.expr = expr;
    this.returnParameters = returnParameters;
    this.body = body;
    this.catchClauses = catchClauses;
  }

  public Expression expr() {
    return expr;
  }

  public List<Parameter> returnParameters() {
    return returnParameters;
  }

  public Block body() {
    return body;
  }

  public List<CatchClause> catchClauses() {
    return catchClauses;
  }

  @Override
  public void processChildren(TreeRewriter rewriter) {
    expr = rewriteChild(rewriter, expr, Expression.class);
    rewriteChildren(rewriter, returnParameters, Parameter.class);
    body = rewriteChild(rewriter, body, Block.class);
    rewriteChildren(rewriter, catchClauses, CatchClause.class);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitTryStatement(this);
  }
}
