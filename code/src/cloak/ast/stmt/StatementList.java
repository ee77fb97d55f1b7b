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

import java.util.List;

import cloak.ast.NodeVisitor;
import cloak.ast.TreeRewriter;

/**
 * Sequence of statements printed without braces or indentation
 */
public class StatementList extends Statement {
  private final List<Statement> statements;
  private final boolean excludedFromSimulation;

  public StatementList(List<Statement> statements,
                       boolean excludedFromSimulation) {
    this.statements = statements;
    this.excludedFromSimulation = excludedFromSimulation;
  }

  public StatementList(List<Statement> statements) {
    this(statements, false);
  }

  public List<Statement> statements() {
    return statements;
  }

  public Statement get(int i) {
    return statements.get(i);
  }

  public int size() {
    return statements.size();
  }

  public boolean excludedFromSimulation() {
    return excludedFromSimulation;
  }

  /**
   * @return true if stmt is in this list or in a directly nested list
   */
  public boolean contains(Statement stmt) {
    for (Statement s: statements) {
      if (s == stmt) {
        return true;
      }
    }
    for (Statement s: statements) {
      if (s instanceof StatementList && ((StatementList)s).contains(stmt)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public void processChildren(TreeRewriter rewriter) {
    rewriteStatements(rewriter, statements);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitStatementList(this);
  }
}
