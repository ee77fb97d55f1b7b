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
package cloak.ast.decl;

import java.util.List;

import cloak.ast.Identifier;
import cloak.ast.NodeVisitor;
import cloak.ast.TreeRewriter;
import cloak.ast.stmt.Block;

public class ModifierDefinition extends NamespaceDefinition {
  private final List<Parameter> parameters;
  private final boolean virtual;
  private final List<OverrideSpecifier> overrideSpecifiers;
  /** null for a declaration without body */
  private Block body;

  public ModifierDefinition(Identifier idf, List<Parameter> parameters,
      boolean virtual, List<OverrideSpecifier> overrideSpecifiers,
      Block body) {
    super(idf);
    this.parameters = parameters;
    this.virtual = virtual;
    this.overrideSpecifiers = overrideSpecifiers;
    this.body = body;
  }

  public List<Parameter> parameters() {
    return parameters;
  }

  public boolean isVirtual() {
    return virtual;
  }

  public List<OverrideSpecifier> overrideSpecifiers() {
    return overrideSpecifiers;
  }

  public Block body() {
    return body;
  }

  @Override
  public void processChildren(TreeRewriter rewriter) {
    super.processChildren(rewriter);
    rewriteChildren(rewriter, parameters, Parameter.class);
    rewriteChildren(rewriter, overrideSpecifiers, OverrideSpecifier.class);
    body = rewriteChild(rewriter, body, Block.class);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitModifierDefinition(this);
  }
}
