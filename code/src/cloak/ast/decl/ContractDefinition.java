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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;

import cloak.ast.Identifier;
import cloak.ast.Node;
import cloak.ast.NodeVisitor;
import cloak.ast.TreeRewriter;
import cloak.common.exceptions.AstException;
import cloak.common.lang.Types.TypeName;

/**
 * Contract with its members.  Lowering passes can add declarations
 * before and after the original members through the head and tail parts.
 */
public class ContractDefinition extends NamespaceDefinition {
  private final List<Node> units;
  private final List<Node> extraHeadParts = new ArrayList<Node>();
  private final List<Node> extraTailParts = new ArrayList<Node>();

  public ContractDefinition(Identifier idf, List<Node> units) {
    super(idf);
    this.units = units;
  }

  public List<Node> units() {
    return units;
  }

  public List<Node> extraHeadParts() {
    return extraHeadParts;
  }

  public List<Node> extraTailParts() {
    return extraTailParts;
  }

  public List<ConstructorOrFunctionDefinition> functionDefinitions() {
    ImmutableList.Builder<ConstructorOrFunctionDefinition> result =
                          ImmutableList.builder();
    for (Node u: units) {
      if (u instanceof ConstructorOrFunctionDefinition &&
          ((ConstructorOrFunctionDefinition)u).isFunction()) {
        result.add((ConstructorOrFunctionDefinition)u);
      }
    }
    return result.build();
  }

  public List<ConstructorOrFunctionDefinition> constructorDefinitions() {
    ImmutableList.Builder<ConstructorOrFunctionDefinition> result =
                          ImmutableList.builder();
    for (Node u: units) {
      if (u instanceof ConstructorOrFunctionDefinition &&
          ((ConstructorOrFunctionDefinition)u).isConstructor()) {
        result.add((ConstructorOrFunctionDefinition)u);
      }
    }
    return result.build();
  }

  public List<StateVariableDeclaration> stateVariableDeclarations() {
    ImmutableList.Builder<StateVariableDeclaration> result =
                          ImmutableList.builder();
    for (Node u: units) {
      if (u instanceof StateVariableDeclaration) {
        result.add((StateVariableDeclaration)u);
      }
    }
    return result.build();
  }

  /**
   * @return state variable names mapped to their types, in declaration
   *         order
   */
  public Map<String, TypeName> stateTypes() {
    Map<String, TypeName> result = new LinkedHashMap<String, TypeName>();
    for (StateVariableDeclaration v: stateVariableDeclarations()) {
      result.put(v.idf().name(), v.annotatedType().typeName());
    }
    return result;
  }

  /**
   * Find a member by name.  "constructor" finds the constructor; if none
   * is declared an empty one is made up, linked to this contract but not
   * added to its members.
   * @return the member, or null if symbol resolution has not seen the name
   * @throws AstException if several constructors are declared
   */
  public Node lookup(String name) throws AstException {
    if (name.equals(ConstructorOrFunctionDefinition.CONSTRUCTOR_NAME)) {
      List<ConstructorOrFunctionDefinition> constructors =
                                            constructorDefinitions();
      if (constructors.isEmpty()) {
        ConstructorOrFunctionDefinition c =
                ConstructorOrFunctionDefinition.emptyConstructor();
        c.setParent(this);
        return c;
      } else if (constructors.size() == 1) {
        return constructors.get(0);
      } else {
        throw new AstException(constructors.get(1),
                               "Multiple constructors exist");
      }
    }
    Identifier idf = scopeNames().get(name);
    return idf == null ? null : idf.parent();
  }

  @Override
  public void processChildren(TreeRewriter rewriter) {
    super.processChildren(rewriter);
    rewriteChildren(rewriter, extraHeadParts, Node.class);
    rewriteChildren(rewriter, units, Node.class);
    rewriteChildren(rewriter, extraTailParts, Node.class);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitContractDefinition(this);
  }
}
