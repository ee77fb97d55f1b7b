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
import cloak.common.exceptions.UnknownOperatorException;
import cloak.common.lang.OpEvaluator;
import cloak.common.lang.Operators;
import cloak.common.lang.Operators.BuiltinOp;

/**
 * Callee of an operator application
 */
public class BuiltinFunction extends Expression {

  private final BuiltinOp op;

  /** Set by type checker */
  private boolean isPrivate = false;

  public BuiltinFunction(BuiltinOp op) {
    this.op = op;
  }

  public BuiltinFunction(String symbol) throws UnknownOperatorException {
    this(Operators.fromSymbol(symbol));
  }

  public BuiltinOp op() {
    return op;
  }

  public boolean isPrivate() {
    return isPrivate;
  }

  public void setPrivate(boolean isPrivate) {
    this.isPrivate = isPrivate;
  }

  public int arity() {
    return op.arity();
  }

  public boolean canBePrivate() {
    return op.canBePrivate();
  }

  public boolean hasShortCircuiting() {
    return op.hasShortCircuiting();
  }

  /**
   * @param args constant operand values, null where unknown
   * @return folded value or null
   */
  public Object evaluate(List<?> args) {
    return OpEvaluator.eval(op, args);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitBuiltinFunction(this);
  }
}
