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
package cloak.common.lang;

import java.util.ArrayList;
import java.util.List;

import cloak.ast.Node;
import cloak.ast.NodeVisitor;
import cloak.ast.TreeRewriter;
import cloak.ast.expr.Expression;
import cloak.ast.expr.PrivacyLabelExpr;
import cloak.common.lang.Types.TupleType;
import cloak.common.lang.Types.TypeName;

/**
 * Type together with the privacy label of the values it describes.
 */
public class AnnotatedTypeName extends Node {

  private TypeName typeName;
  private Expression privacyAnnotation;
  private final boolean hadPrivacyAnnotation;

  /**
   * @param privacyAnnotation label written in the source, or null for
   *                          the implicit public label
   */
  public AnnotatedTypeName(TypeName typeName, Expression privacyAnnotation) {
    this.typeName = typeName;
    this.hadPrivacyAnnotation = privacyAnnotation != null;
    if (hadPrivacyAnnotation) {
      this.privacyAnnotation = privacyAnnotation;
    } else {
      this.privacyAnnotation = PrivacyLabelExpr.all();
    }
  }

  public AnnotatedTypeName(TypeName typeName) {
    this(typeName, null);
  }

  public TypeName typeName() {
    return typeName;
  }

  public Expression privacyAnnotation() {
    return privacyAnnotation;
  }

  /**
   * @return true if the label was written explicitly, even if it is "all"
   */
  public boolean hadPrivacyAnnotation() {
    return hadPrivacyAnnotation;
  }

  public boolean isPublic() {
    return privacyAnnotation.isAllExpr();
  }

  public boolean isPrivate() {
    return !isPublic();
  }

  public boolean isAddress() {
    return typeName.isAddress();
  }

  /**
   * Combine the label of this type with the label expected by the context.
   * Equal or co-owned labels keep this side's label; a public value takes
   * the label of the context.
   * @param analysis co-ownership facts at this point, may be null
   */
  public PrivacyMatch combinedPrivacy(PartitionState<PrivacyLabel> analysis,
                                      AnnotatedTypeName other) {
    if (typeName instanceof TupleType) {
      if (!(other.typeName instanceof TupleType)) {
        return PrivacyMatch.noMatch();
      }
      TupleType mine = (TupleType)typeName;
      TupleType theirs = (TupleType)other.typeName;
      if (mine.size() != theirs.size()) {
        return PrivacyMatch.noMatch();
      }
      List<PrivacyMatch> components = new ArrayList<PrivacyMatch>();
      for (int i = 0; i < mine.size(); i++) {
        components.add(mine.get(i).combinedPrivacy(analysis, theirs.get(i)));
      }
      return PrivacyMatch.components(components);
    }

    PrivacyLabel expected = other.privacyAnnotation.privacyAnnotationLabel();
    PrivacyLabel actual = privacyAnnotation.privacyAnnotationLabel();
    if (expected == null || actual == null) {
      return PrivacyMatch.noMatch();
    }
    if (expected.equals(actual) ||
        (analysis != null && analysis.samePartition(expected, actual))) {
      return PrivacyMatch.label(privacyAnnotation);
    } else if (isPublic()) {
      return PrivacyMatch.label(other.privacyAnnotation);
    }
    return PrivacyMatch.noMatch();
  }

  /**
   * @return true if both label expressions denote the same label
   */
  public static boolean sameLabel(Expression a, Expression b) {
    PrivacyLabel la = a.privacyAnnotationLabel();
    PrivacyLabel lb = b.privacyAnnotationLabel();
    if (la != null && lb != null) {
      return la.equals(lb);
    }
    return a == b;
  }

  public AnnotatedTypeName withPrivacy(Expression privacyAnnotation) {
    return new AnnotatedTypeName(typeName, privacyAnnotation);
  }

  public static AnnotatedTypeName uintAll() {
    return new AnnotatedTypeName(Types.uintType());
  }

  public static AnnotatedTypeName boolAll() {
    return new AnnotatedTypeName(Types.boolType());
  }

  public static AnnotatedTypeName addressAll() {
    return new AnnotatedTypeName(Types.addressType());
  }

  @Override
  public void processChildren(TreeRewriter rewriter) {
    typeName = rewriteChild(rewriter, typeName, TypeName.class);
    privacyAnnotation = rewriteChild(rewriter, privacyAnnotation,
                                     Expression.class);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof AnnotatedTypeName)) {
      return false;
    }
    AnnotatedTypeName other = (AnnotatedTypeName)obj;
    return typeName.equals(other.typeName) &&
           sameLabel(privacyAnnotation, other.privacyAnnotation);
  }

  @Override
  public int hashCode() {
    PrivacyLabel label = privacyAnnotation.privacyAnnotationLabel();
    return typeName.hashCode() * 31 + (label == null ? 0 : label.hashCode());
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitAnnotatedTypeName(this);
  }
}
