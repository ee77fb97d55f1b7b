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

import java.math.BigInteger;

import cloak.ast.NodeVisitor;
import cloak.common.lang.AnnotatedTypeName;
import cloak.common.lang.Types.NumberLiteralType;

public class NumberLiteralExpr extends LiteralExpr {
  private final BigInteger value;
  private final boolean wasHex;
  /** Text as written, null for generated literals */
  private final String sourceText;
  /** Unit suffix such as "ether", or null */
  private final String unit;

  public NumberLiteralExpr(BigInteger value, boolean wasHex,
                           String sourceText, String unit) {
    this.value = value;
    this.wasHex = wasHex;
    this.sourceText = sourceText;
    this.unit = unit;
    setAnnotatedType(intrinsicType());
  }

  public NumberLiteralExpr(BigInteger value) {
    this(value, false, null, null);
  }

  public NumberLiteralExpr(long value) {
    this(BigInteger.valueOf(value));
  }

  public BigInteger value() {
    return value;
  }

  public boolean wasHex() {
    return wasHex;
  }

  public String sourceText() {
    return sourceText;
  }

  public String unit() {
    return unit;
  }

  @Override
  protected AnnotatedTypeName intrinsicType() {
    return new AnnotatedTypeName(new NumberLiteralType(value));
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitNumberLiteralExpr(this);
  }
}
