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

import cloak.common.exceptions.CompilerError;
import cloak.common.lang.Types.TypeName;

/**
 * Outcome of combining two types: either a common type, a note that both
 * sides are still literals that were not widened, or no common type.
 */
public class TypeCombination {

  public static enum Kind {
    COMBINED,
    STILL_LITERAL,
    NONE,
  }

  private static final TypeCombination STILL_LITERAL =
                        new TypeCombination(Kind.STILL_LITERAL, null);
  private static final TypeCombination NONE =
                        new TypeCombination(Kind.NONE, null);

  private final Kind kind;
  private final TypeName type;

  private TypeCombination(Kind kind, TypeName type) {
    this.kind = kind;
    this.type = type;
  }

  public static TypeCombination of(TypeName type) {
    if (type == null) {
      throw new CompilerError("Combined type must not be null");
    }
    return new TypeCombination(Kind.COMBINED, type);
  }

  public static TypeCombination stillLiteral() {
    return STILL_LITERAL;
  }

  public static TypeCombination none() {
    return NONE;
  }

  public Kind kind() {
    return kind;
  }

  public boolean isCombined() {
    return kind == Kind.COMBINED;
  }

  public boolean isStillLiteral() {
    return kind == Kind.STILL_LITERAL;
  }

  public boolean isNone() {
    return kind == Kind.NONE;
  }

  /**
   * @return the common type, or null if there is none
   */
  public TypeName type() {
    return type;
  }

  @Override
  public String toString() {
    if (kind == Kind.COMBINED) {
      return type.code();
    }
    return kind.toString();
  }
}
