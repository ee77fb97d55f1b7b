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

import cloak.ast.Identifier;
import cloak.ast.Node;
import cloak.ast.NodeVisitor;
import cloak.ast.TreeRewriter;
import cloak.ast.decl.IdentifierDeclaration;
import cloak.common.lang.AnnotatedTypeName;
import cloak.common.lang.PrivacyLabel;
import cloak.common.lang.Types.Mapping;

public class IdentifierExpr extends LocationExpr {
  private Identifier idf;

  public IdentifierExpr(Identifier idf, AnnotatedTypeName annotatedType) {
    this.idf = idf;
    setAnnotatedType(annotatedType);
  }

  public IdentifierExpr(Identifier idf) {
    this(idf, null);
  }

  public IdentifierExpr(String name) {
    this(new Identifier(name));
  }

  @Override
  public Identifier idf() {
    return idf;
  }

  /**
   * @return declared type of the target
   */
  public AnnotatedTypeName targetAnnotatedType() {
    Node t = target();
    if (t instanceof IdentifierDeclaration) {
      return ((IdentifierDeclaration)t).annotatedType();
    }
    return null;
  }

  @Override
  public PrivacyLabel privacyAnnotationLabel() {
    Node t = target();
    if (t instanceof Mapping) {
      Expression key = ((Mapping)t).instantiatedKey();
      return key == null ? null : key.privacyAnnotationLabel();
    } else if (t == null || t.idf() == null) {
      return null;
    }
    return PrivacyLabel.owner(t.idf());
  }

  public SliceExpr slice(int offset, int size, Expression base) {
    return new SliceExpr(this, base, offset, size);
  }

  @Override
  public void processChildren(TreeRewriter rewriter) {
    idf = rewriteChild(rewriter, idf, Identifier.class);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitIdentifierExpr(this);
  }
}
