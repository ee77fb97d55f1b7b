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
 * Fixed-size range of an array, starting at base + startOffset.
 * Produced by lowering passes, never written in source.
 */
public class SliceExpr extends LocationExpr {
  private LocationExpr arr;
  private Expression base;
  private final int startOffset;
  private final int size;

  public SliceExpr(LocationExpr arr, Expression base, int startOffset,
                   int size) {
    this.arr = arr;
    this.base = base;
    this.startOffset = startOffset;
    this.size = size;
  }

  public LocationExpr arr() {
    return arr;
  }

  public Expression base() {
    return base;
  }

  public int startOffset() {
    return startOffset;
  }

  public int size() {
    return size;
  }

  @Override
  public void processChildren(TreeRewriter rewriter) {
    arr = rewriteChild(rewriter, arr, LocationExpr.class);
    base = rewriteChild(rewriter, base, Expression.class);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitSliceExpr(this);
  }
}
