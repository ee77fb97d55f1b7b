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
import cloak.common.lang.Types.TypeName;

public class NewExpr extends Expression {
  private TypeName targetType;

  public NewExpr(TypeName targetType) {
    this.targetType = targetType;
  }

  public TypeName targetType() {
    return targetType;
  }

  @Override
  public void processChildren(TreeRewriter rewriter) {
    targetType = rewriteChild(rewriter, targetType, TypeName.class);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitNewExpr(this);
  }
}
