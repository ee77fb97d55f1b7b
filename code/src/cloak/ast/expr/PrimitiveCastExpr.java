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

import cloak.ast.NodeVisitor;
import cloak.ast.TreeRewriter;
import cloak.common.lang.Types.TypeName;

/**
 * Conversion to an elementary type.  Implicit casts are inserted by the
 * type checker and are not printed.
 */
public class PrimitiveCastExpr extends Expression {
  private TypeName elemType;
  private Expression expr;
  private final boolean isImplicit;

  public PrimitiveCastExpr(TypeName elemType, Expression expr,
                           boolean isImplicit) {
    this.elemType = elemType;
    this.expr = expr;
    this.isImplicit = isImplicit;
  }

  public PrimitiveCastExpr(TypeName elemType, Expression expr) {
    this(elemType, expr, false);
  }

  public TypeName elemType() {
    return elemType;
  }

  public Expression expr() {
    return expr;
  }

  public boolean isImplicit() {
    return isImplicit;
  }

  @Override
  public void processChildren(TreeRewriter rewriter) {
    elemType = rewriteChild(rewriter, elemType, TypeName.class);
    expr = rewriteChild(rewriter, expr, Expression.class);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitPrimitiveCastExpr(this);
  }
}
