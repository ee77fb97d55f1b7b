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
import cloak.common.exceptions.CompilerError;
import cloak.common.lang.PrivacyLabel;

/**
 * One of the context-free labels {@code all}, {@code me} and {@code tee}.
 * Carries nothing but the label.
 */
public class PrivacyLabelExpr extends Expression {
  private final PrivacyLabel label;

  private PrivacyLabelExpr(PrivacyLabel label) {
    if (label.kind() == PrivacyLabel.Kind.OWNER) {
      throw new CompilerError("Owner labels are written as identifiers");
    }
    this.label = label;
  }

  public static PrivacyLabelExpr all() {
    return new PrivacyLabelExpr(PrivacyLabel.PUBLIC);
  }

  public static PrivacyLabelExpr me() {
    return new PrivacyLabelExpr(PrivacyLabel.CALLER);
  }

  public static PrivacyLabelExpr tee() {
    return new PrivacyLabelExpr(PrivacyLabel.TEE);
  }

  public PrivacyLabel label() {
    return label;
  }

  /**
   * The labels name fixed parties, so never change
   */
  public boolean isImmutable() {
    return true;
  }

  @Override
  public boolean isAllExpr() {
    return label == PrivacyLabel.PUBLIC;
  }

  @Override
  public boolean isMeExpr() {
    return label == PrivacyLabel.CALLER;
  }

  @Override
  public boolean isTeeExpr() {
    return label == PrivacyLabel.TEE;
  }

  @Override
  public PrivacyLabel privacyAnnotationLabel() {
    return label;
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitPrivacyLabelExpr(this);
  }
}
