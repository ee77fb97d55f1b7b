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

import java.util.ArrayList;
import java.util.List;

import cloak.ast.Node;
import cloak.ast.stmt.Statement;
import cloak.common.exceptions.CompilerError;
import cloak.common.lang.AnnotatedTypeName;
import cloak.common.lang.Operators.BuiltinOp;
import cloak.common.lang.PartitionState;
import cloak.common.lang.PrivacyLabel;
import cloak.common.lang.PrivacyMatch;
import cloak.common.lang.Types.TupleType;
import cloak.common.lang.Types.TypeName;

public abstract class Expression extends Node {

  /**
   * Result of checking an expression against an expected annotated type
   */
  public static enum Conformance {
    YES,
    NO,
    /** Data type fits, but the value must be reclassified to the
     *  expected label first */
    MAKE_PRIVATE,
  }

  /** Set by type checker, or at construction for literals */
  private AnnotatedTypeName annotatedType = null;

  /** Enclosing statement, set when parents are linked */
  private Statement statement = null;

  private boolean evaluatePrivately = false;

  /**
   * @return type known at construction, e.g. for literals
   */
  protected AnnotatedTypeName intrinsicType() {
    return null;
  }

  public AnnotatedTypeName annotatedType() {
    return annotatedType;
  }

  public void setAnnotatedType(AnnotatedTypeName annotatedType) {
    this.annotatedType = annotatedType;
  }

  public Statement statement() {
    return statement;
  }

  public void setStatement(Statement statement) {
    this.statement = statement;
  }

  public boolean evaluatePrivately() {
    return evaluatePrivately;
  }

  public void setEvaluatePrivately(boolean evaluatePrivately) {
    this.evaluatePrivately = evaluatePrivately;
  }

  public boolean isAllExpr() {
    return false;
  }

  public boolean isMeExpr() {
    return false;
  }

  public boolean isTeeExpr() {
    return false;
  }

  /**
   * @return canonical label this expression denotes when used as a
   *         privacy annotation, or null if it does not denote one
   */
  public PrivacyLabel privacyAnnotationLabel() {
    return null;
  }

  /**
   * @return co-ownership facts before the enclosing statement, if known
   */
  public PartitionState<PrivacyLabel> analysis() {
    if (statement == null) {
      return null;
    }
    return statement.beforeAnalysis();
  }

  public boolean instanceOfDataType(TypeName expected) {
    return checkTyped().typeName().implicitlyConvertibleTo(expected);
  }

  /**
   * Check whether this expression can be used where a value of the
   * expected type and label is required.
   */
  public Conformance instanceOf(AnnotatedTypeName expected) {
    AnnotatedTypeName actual = checkTyped();
    if (!instanceOfDataType(expected.typeName())) {
      return Conformance.NO;
    }

    PrivacyMatch combined = actual.combinedPrivacy(analysis(), expected);
    if (combined.isNoMatch()) {
      return Conformance.NO;
    } else if (combined.isTuple()) {
      TupleType tuple = (TupleType)actual.typeName();
      List<PrivacyMatch> components = combined.components();
      for (int i = 0; i < components.size(); i++) {
        PrivacyMatch c = components.get(i);
        if (c.isNoMatch() || c.isTuple() || !AnnotatedTypeName.sameLabel(
                    c.label(), tuple.get(i).privacyAnnotation())) {
          return Conformance.NO;
        }
      }
      return Conformance.YES;
    } else if (AnnotatedTypeName.sameLabel(combined.label(),
                                           actual.privacyAnnotation())) {
      return Conformance.YES;
    }
    return Conformance.MAKE_PRIVATE;
  }

  private AnnotatedTypeName checkTyped() {
    if (annotatedType == null) {
      throw new CompilerError("Expression " + this + " has not been typed");
    }
    return annotatedType;
  }

  public FunctionCallExpr unop(BuiltinOp op) {
    List<Expression> args = new ArrayList<Expression>(1);
    args.add(this);
    return new FunctionCallExpr(new BuiltinFunction(op), args);
  }

  public FunctionCallExpr binop(BuiltinOp op, Expression rhs) {
    List<Expression> args = new ArrayList<Expression>(2);
    args.add(this);
    args.add(rhs);
    return new FunctionCallExpr(new BuiltinFunction(op), args);
  }

  public FunctionCallExpr ite(Expression eTrue, Expression eFalse) {
    BuiltinFunction ite = new BuiltinFunction(BuiltinOp.ITE);
    ite.setPrivate(annotatedType != null && annotatedType.isPrivate());
    List<Expression> args = new ArrayList<Expression>(3);
    args.add(this);
    args.add(eTrue);
    args.add(eFalse);
    return new FunctionCallExpr(ite, args);
  }

  public Expression asType(AnnotatedTypeName t) {
    this.annotatedType = t;
    return this;
  }

  public Expression asType(TypeName t) {
    return asType(new AnnotatedTypeName(t));
  }

  @Override
  protected void clearDecorations() {
    annotatedType = intrinsicType();
    evaluatePrivately = false;
  }
}
