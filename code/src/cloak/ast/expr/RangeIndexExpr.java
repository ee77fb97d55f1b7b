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

/**
 * {@code a[start:end]}, either bound may be omitted
 */
public class RangeIndexExpr extends LocationExpr {
  private LocationExpr arr;
  private Expression start;
  private Expression end;

  public RangeIndexExpr(LocationExpr arr, Expression start, Expression end) {
    this.arr = arr;
    this.start = start;
    this.end = end;
  }

  public LocationExpr arr() {
    return arr;
  }

  public Expression start() {
    return start;
  }

  public Expression end() {
    return end;
  }

  @Override
  public void processChildren(TreeRewriter rewriter) {
    arr = rewriteChild(rewriter, arr, LocationExpr.class);
    start = rewriteChild(rewriter, start, Expression.class);
    end = rewriteChild(rewriter, end, Expression.class);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitRangeIndexExpr(this);
  }
}
