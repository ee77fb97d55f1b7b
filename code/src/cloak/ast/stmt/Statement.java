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

import cloak.ast.Node;
import cloak.ast.decl.ConstructorOrFunctionDefinition;
import cloak.common.lang.PartitionState;
import cloak.common.lang.PrivacyLabel;

public abstract class Statement extends Node {

  /** Set by alias analysis */
  private PartitionState<PrivacyLabel> beforeAnalysis = null;
  private PartitionState<PrivacyLabel> afterAnalysis = null;

  /** Enclosing function, set when parents are linked */
  private ConstructorOrFunctionDefinition function = null;

  /**
   * Statements a lowering pass needs executed right before this one.
   * Printed in order before the statement.
   */
  private final List<Statement> preStatements = new ArrayList<Statement>();

  public PartitionState<PrivacyLabel> beforeAnalysis() {
    return beforeAnalysis;
  }

  public void setBeforeAnalysis(PartitionState<PrivacyLabel> beforeAnalysis) {
    this.beforeAnalysis = beforeAnalysis;
  }

  public PartitionState<PrivacyLabel> afterAnalysis() {
    return afterAnalysis;
  }

  public void setAfterAnalysis(PartitionState<PrivacyLabel> afterAnalysis) {
    this.afterAnalysis = afterAnalysis;
  }

  public ConstructorOrFunctionDefinition function() {
    return function;
  }

  public void setFunction(ConstructorOrFunctionDefinition function) {
    this.function = function;
  }

  public List<Statement> preStatements() {
    return preStatements;
  }

  @Override
  protected void clearDecorations() {
    beforeAnalysis = null;
    afterAnalysis = null;
    preStatements.clear();
  }
}
