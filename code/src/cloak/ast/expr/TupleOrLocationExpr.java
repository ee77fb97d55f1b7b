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

import cloak.ast.Node;
import cloak.ast.stmt.AssignmentStatement;

/**
 * Expression that may be assigned to
 */
public abstract class TupleOrLocationExpr extends Expression {

  /**
   * @return true if this expression is written to: it is the left side of
   *         an assignment, or nested in one as indexed base, member base
   *         or tuple element
   */
  public boolean isLvalue() {
    Node p = parent();
    if (p instanceof AssignmentStatement) {
      return this == ((AssignmentStatement)p).lhs();
    } else if (p instanceof IndexExpr && this == ((IndexExpr)p).arr()) {
      return ((IndexExpr)p).isLvalue();
    } else if (p instanceof MemberAccessExpr &&
               this == ((MemberAccessExpr)p).expr()) {
      return ((MemberAccessExpr)p).isLvalue();
    } else if (p instanceof TupleExpr) {
      return ((TupleExpr)p).isLvalue();
    }
    return false;
  }

  public boolean isRvalue() {
    return !isLvalue();
  }

  public AssignmentStatement assign(Expression value) {
    return new AssignmentStatement(this, value);
  }
}
