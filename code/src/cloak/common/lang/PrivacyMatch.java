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

import java.util.Collections;
import java.util.List;

import cloak.ast.expr.Expression;
import cloak.common.exceptions.CompilerError;

/**
 * Result of combining the privacy labels of two annotated types.
 * Scalars yield the chosen label expression, tuples yield one result per
 * component, and incompatible labels yield no match.
 */
public class PrivacyMatch {

  private static final PrivacyMatch NO_MATCH = new PrivacyMatch(null, null);

  private final Expression label;
  private final List<PrivacyMatch> components;

  private PrivacyMatch(Expression label, List<PrivacyMatch> components) {
    this.label = label;
    this.components = components;
  }

  public static PrivacyMatch label(Expression label) {
    return new PrivacyMatch(label, null);
  }

  public static PrivacyMatch components(List<PrivacyMatch> components) {
    return new PrivacyMatch(null, Collections.unmodifiableList(components));
  }

  public static PrivacyMatch noMatch() {
    return NO_MATCH;
  }

  public boolean isNoMatch() {
    return this == NO_MATCH;
  }

  public boolean isTuple() {
    return components != null;
  }

  public Expression label() {
    if (label == null) {
      throw new CompilerError("Privacy match has no scalar label: " + this);
    }
    return label;
  }

  public List<PrivacyMatch> components() {
    if (components == null) {
      throw new CompilerError("Privacy match is not component-wise: " + this);
    }
    return components;
  }

  /**
   * @return true if this match and every component match succeeded
   */
  public boolean isComplete() {
    if (isNoMatch()) {
      return false;
    }
    if (isTuple()) {
      for (PrivacyMatch c: components) {
        if (!c.isComplete()) {
          return false;
        }
      }
    }
    return true;
  }

  @Override
  public String toString() {
    if (isNoMatch()) {
      return "<no match>";
    } else if (isTuple()) {
      return components.toString();
    } else {
      return label.code();
    }
  }
}
