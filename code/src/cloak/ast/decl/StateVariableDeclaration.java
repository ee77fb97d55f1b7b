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

import cloak.ast.Identifier;
import cloak.ast.NodeVisitor;
import cloak.ast.TreeRewriter;
import cloak.ast.expr.Expression;
import cloak.common.lang.AnnotatedTypeName;

public class StateVariableDeclaration extends IdentifierDeclaration {
  /** Initializer, may be null */
  private Expression expr;
  private OverrideSpecifier overrideSpecifier;

  public StateVariableDeclaration(AnnotatedTypeName annotatedType,
      List<String> keywords, Identifier idf, Expression expr,
      OverrideSpecifier overrideSpecifier) {
    super(keywords, annotatedType, idf, null);
    this.expr = expr;
    this.overrideSpecifier = overrideSpecifier;
  }

  public StateVariableDeclaration(AnnotatedTypeName annotatedType,
      List<String> keywords, Identifier idf, Expression expr) {
    this(annotatedType, keywords, idf, expr, null);
  }

  public Expression expr() {
    return expr;
  }

  public OverrideSpecifier overrideSpecifier() {
    return overrideSpecifier;
  }

  @Override
  public void processChildren(TreeRewriter rewriter) {
    super.processChildren(rewriter);
    overrideSpecifier = rewriteChild(rewriter, overrideSpecifier,
                                     OverrideSpecifier.class);
    expr = rewriteChild(rewriter, expr, Expression.class);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitStateVariableDeclaration(this);
  }
}
