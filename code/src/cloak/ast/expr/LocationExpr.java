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

import java.util.List;

import cloak.ast.Identifier;
import cloak.ast.Node;
import cloak.common.exceptions.CompilerError;
import cloak.common.lang.Types.ArrayTypeName;
import cloak.common.lang.Types.Mapping;
import cloak.common.lang.Types.TypeName;

/**
 * Expression that denotes a storage location
 */
public abstract class LocationExpr extends TupleOrLocationExpr {

  /**
   * Declaration or definition this refers to, set by symbol resolution.
   * For key labels of mappings, the mapping type itself.
   */
  private Node target = null;

  public Node target() {
    return target;
  }

  public void setTarget(Node target) {
    this.target = target;
  }

  public FunctionCallExpr call(String member, List<? extends Expression> args) {
    if (member == null) {
      return new FunctionCallExpr(this, args);
    }
    return new FunctionCallExpr(dot(member), args);
  }

  public MemberAccessExpr dot(String member) {
    return new MemberAccessExpr(this, new Identifier(member));
  }

  /**
   * Index into an array or mapping typed expression.  The result has the
   * value type of the container.
   */
  public IndexExpr index(Expression item) {
    TypeName t = annotatedType() == null ? null : annotatedType().typeName();
    IndexExpr result = new IndexExpr(this, item);
    if (t instanceof ArrayTypeName) {
      result.setAnnotatedType(((ArrayTypeName)t).valueType());
    } else if (t instanceof Mapping) {
      result.setAnnotatedType(((Mapping)t).valueType());
    } else {
      throw new CompilerError("Cannot index " + this + " of type " + t);
    }
    return result;
  }

  public IndexExpr index(long item) {
    return index(new NumberLiteralExpr(item));
  }

  /**
   * Index without type information
   */
  public IndexExpr rawIndex(Expression item) {
    return new IndexExpr(this, item);
  }

  public IndexExpr rawIndex(long item) {
    return rawIndex(new NumberLiteralExpr(item));
  }
}
