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

/**
 * Braced statement list.  A block created for an unbraced single
 * statement, as in {@code if (c) x = 1;}, is printed without braces.
 */
public class Block extends StatementList {
  private final boolean wasSingleStatement;

  public Block(List<Statement> statements, boolean wasSingleStatement) {
    super(statements);
    this.wasSingleStatement = wasSingleStatement;
  }

  public Block(List<Statement> statements) {
    this(statements, false);
  }

  public boolean wasSingleStatement() {
    return wasSingleStatement;
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitBlock(this);
  }
}
