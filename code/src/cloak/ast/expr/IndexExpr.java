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
import cloak.common.exceptions.CompilerError;

public class IndexExpr extends LocationExpr {
  private LocationExpr arr;
  /** May be null, e.g. in {@code abi.decode(b, (uint[]))} */
  private Expression key;

  public IndexExpr(LocationExpr arr, Expression key) {
    this.arr = arr;
    this.key = key;
  }

  public LocationExpr arr() {
    return arr;
  }

  public Expression key() {
    return key;
  }

  /**
   * @return base identifier of nested index expressions
   */
  public IdentifierExpr leftmostIdentifier() {
    LocationExpr var = arr;
    while (var instanceof IndexExpr) {
      var = ((IndexExpr)var).arr;
    }
    if (!(var instanceof IdentifierExpr)) {
      throw new CompilerError("The leftmost expression of " + this +
                              " is not an identifier expression");
    }
    return (IdentifierExpr)var;
  }

  @Override
  public void processChildren(TreeRewriter rewriter) {
    arr = rewriteChild(rewriter, arr, LocationExpr.class);
    key = rewriteChild(rewriter, key, Expression.class);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitIndexExpr(this);
  }
}
