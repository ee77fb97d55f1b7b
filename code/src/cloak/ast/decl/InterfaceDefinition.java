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
import cloak.ast.Node;
import cloak.ast.NodeVisitor;
import cloak.ast.TreeRewriter;

public class InterfaceDefinition extends NamespaceDefinition {
  private final List<InheritanceSpecifier> inheritanceSpecifiers;
  private final List<Node> units;

  public InterfaceDefinition(Identifier idf,
      List<InheritanceSpecifier> inheritanceSpecifiers, List<Node> units) {
    super(idf);
    this.inheritanceSpecifiers = inheritanceSpecifiers;
    this.units = units;
  }

  public List<InheritanceSpecifier> inheritanceSpecifiers() {
    return inheritanceSpecifiers;
  }

  public List<Node> units() {
    return units;
  }

  @Override
  public void processChildren(TreeRewriter rewriter) {
    super.processChildren(rewriter);
    rewriteChildren(rewriter, inheritanceSpecifiers,
                    InheritanceSpecifier.class);
    rewriteChildren(rewriter, units, Node.class);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitInterfaceDefinition(this);
  }
}
