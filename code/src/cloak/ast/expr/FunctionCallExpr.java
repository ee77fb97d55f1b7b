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

import cloak.ast.NodeVisitor;
import cloak.ast.TreeRewriter;
import cloak.ast.decl.ContractDefinition;
import cloak.ast.decl.EnumDefinition;
import cloak.common.lang.Types.ArrayTypeName;

/**
 * Call of a function, operator or cast.  With call options, the named
 * arguments are written in braces: {@code f{value: 1}}.
 */
public class FunctionCallExpr extends Expression {
  private Expression func;
  private CallArgumentList args;
  private final boolean callOptions;

  public FunctionCallExpr(Expression func, CallArgumentList args,
                          boolean callOptions) {
    this.func = func;
    this.args = args;
    this.callOptions = callOptions;
  }

  public FunctionCallExpr(Expression func, List<? extends Expression> args) {
    this(func, CallArgumentList.positional(args), false);
  }

  public Expression func() {
    return func;
  }

  public CallArgumentList args() {
    return args;
  }

  /**
   * @return i-th positional argument
   */
  public Expression arg(int i) {
    return (Expression)args.get(i);
  }

  public boolean callOptions() {
    return callOptions;
  }

  /**
   * @return true if the callee is a contract, enum or array type, i.e.
   *         this is a conversion rather than a call
   */
  public boolean isCast() {
    if (!(func instanceof LocationExpr)) {
      return false;
    }
    Object target = ((LocationExpr)func).target();
    return target instanceof ContractDefinition ||
           target instanceof EnumDefinition ||
           target instanceof ArrayTypeName;
  }

  @Override
  public void processChildren(TreeRewriter rewriter) {
    func = rewriteChild(rewriter, func, Expression.class);
    args = rewriteChild(rewriter, args, CallArgumentList.class);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitFunctionCallExpr(this);
  }
}
