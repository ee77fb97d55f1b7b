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
package cloak.ast.stmt;

import java.util.ArrayList;
import java.util.List;

import cloak.ast.NodeVisitor;
import cloak.ast.TreeRewriter;
import cloak.ast.expr.BuiltinFunction;
import cloak.ast.expr.Expression;
import cloak.ast.expr.FunctionCallExpr;
import cloak.ast.expr.NumberLiteralExpr;
import cloak.ast.expr.TupleOrLocationExpr;
import cloak.common.exceptions.UnknownOperatorException;
import cloak.common.lang.Operators;
import cloak.common.lang.Operators.BuiltinOp;

/**
 * Plain assignment.  Compound assignments and increments are stored
 * desugared, {@code x += e} as {@code x = x + e}, with the operator kept
 * in {@link #op()} so the short form can be printed again.
 */
public class AssignmentStatement extends SimpleStatement {
  public static final String PRE_PREFIX = "pre";
  public static final String POST_PREFIX = "post";

  private TupleOrLocationExpr lhs;
  private Expression rhs;
  /**
   * Empty for plain assignment, the operator symbol for compound
   * assignment, or pre/post followed by ++ or -- for increments
   */
  private String op;

  public AssignmentStatement(TupleOrLocationExpr lhs, Expression rhs,
                             String op) {
    this.lhs = lhs;
    this.rhs = rhs;
    this.op = op == null ? "" : op;
  }

  public AssignmentStatement(TupleOrLocationExpr lhs, Expression rhs) {
    this(lhs, rhs, "");
  }

  /**
   * Build {@code lhs op= rhs}.  The left side appears twice in the result,
   * so the caller supplies two separately built copies of it.
   */
  public static AssignmentStatement compound(TupleOrLocationExpr lhs,
      TupleOrLocationExpr lhsCopy, String opSymbol, Expression rhs)
          throws UnknownOperatorException {
    BuiltinOp op = Operators.fromSymbol(opSymbol);
    List<Expression> args = new ArrayList<Expression>(2);
    args.add(lhsCopy);
    args.add(rhs);
    return new AssignmentStatement(lhs,
        new FunctionCallExpr(new BuiltinFunction(op), args), opSymbol);
  }

  /**
   * Build {@code ++x}, {@code x++}, {@code --x} or {@code x--}
   * @param incDec "++" or "--"
   */
  public static AssignmentStatement incDec(TupleOrLocationExpr lhs,
      TupleOrLocationExpr lhsCopy, String incDec, boolean prefix)
          throws UnknownOperatorException {
    BuiltinOp op;
    if (incDec.equals("++")) {
      op = BuiltinOp.PLUS;
    } else if (incDec.equals("--")) {
      op = BuiltinOp.MINUS;
    } else {
      throw new UnknownOperatorException(incDec);
    }
    List<Expression> args = new ArrayList<Expression>(2);
    args.add(lhsCopy);
    args.add(new NumberLiteralExpr(1));
    return new AssignmentStatement(lhs,
        new FunctionCallExpr(new BuiltinFunction(op), args),
        (prefix ? PRE_PREFIX : POST_PREFIX) + incDec);
  }

  public TupleOrLocationExpr lhs() {
    return lhs;
  }

  public Expression rhs() {
    return rhs;
  }

  public String op() {
    return op;
  }

  public boolean isPreOp() {
    return op.startsWith(PRE_PREFIX);
  }

  public boolean isPostOp() {
    return op.startsWith(POST_PREFIX);
  }

  @Override
  public void processChildren(TreeRewriter rewriter) {
    lhs = rewriteChild(rewriter, lhs, TupleOrLocationExpr.class);
    rhs = rewriteChild(rewriter, rhs, Expression.class);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitAssignmentStatement(this);
  }
}
