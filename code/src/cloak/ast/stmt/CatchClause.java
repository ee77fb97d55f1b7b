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

import cloak.ast.Identifier;
import cloak.ast.Node;
import cloak.ast.NodeVisitor;
import cloak.ast.TreeRewriter;
import cloak.ast.decl.Parameter;

/**
 * {@code catch [Error](params) body}; name and parameters are optional
 */
public class CatchClause extends Node {
  private Identifier errorName;
  private final List<Parameter> parameters;
  private Block body;

  public CatchClause(Identifier errorName, List<Parameter> parameters,
                     Block body) {
    this.errorName = errorName;
    this.parameters = parameters;
    this.body = body;
  }

  public Identifier errorName() {
    return errorName;
  }

  public List<Parameter> parameters() {
    return parameters;
  }

  public Block body() {
    return body;
  }

  @Override
  public void processChildren(TreeRewriter rewriter) {
    errorName = rewriteChild(rewriter, errorName, Identifier.class);
    rewriteChildren(rewriter, parameters, Parameter.class);
    body = rewriteChild(rewriter, body, Block.class);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitCatchClause(this);
  }
}
