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
import cloak.common.lang.AnnotatedTypeName;
import cloak.common.lang.Types.StringTypeName;

public class StringLiteralExpr extends LiteralExpr {
  private final String value;

  public StringLiteralExpr(String value) {
    this.value = value;
    setAnnotatedType(intrinsicType());
  }

  public String value() {
    return value;
  }

  @Override
  protected AnnotatedTypeName intrinsicType() {
    return new AnnotatedTypeName(new StringTypeName());
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitStringLiteralExpr(this);
  }
}
