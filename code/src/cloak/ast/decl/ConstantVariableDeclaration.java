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

import java.util.ArrayList;

import cloak.ast.Identifier;
import cloak.ast.NodeVisitor;
import cloak.ast.TreeRewriter;
import cloak.ast.expr.Expression;
import cloak.common.lang.AnnotatedTypeName;

/**
 * File-level {@code T constant NAME = expr;}
 */
public class ConstantVariableDeclaration extends IdentifierDeclaration {
  private Expression expr;

  public ConstantVariableDeclaration(AnnotatedTypeName annotatedType,
                                     Identifier idf, Expression expr) {
    super(new ArrayList<String>(), annotatedType, idf, null);
    this.expr = expr;
  }

  public Expression expr() {
    return expr;
  }

  @Override
  public boolean isConstant() {
    return true;
  }

  @Override
  public void processChildren(TreeRewriter rewriter) {
    super.processChildren(rewriter);
    expr = rewriteChild(rewriter, expr, Expression.class);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitConstantVariableDeclaration(this);
  }
}
