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
import java.util.List;

import com.google.common.collect.ImmutableList;

import cloak.ast.Identifier;
import cloak.ast.Node;
import cloak.ast.NodeVisitor;
import cloak.ast.TreeRewriter;

/**
 * Root of a parsed file
 */
public class SourceUnit extends Node {
  private final List<Node> units;
  private final List<Node> extraHeadParts = new ArrayList<Node>();
  /** Source text split into lines, for diagnostics */
  private final List<String> originalCode = new ArrayList<String>();

  public SourceUnit(List<Node> units) {
    this.units = units;
  }

  public List<Node> units() {
    return units;
  }

  public List<Node> extraHeadParts() {
    return extraHeadParts;
  }

  public List<String> originalCode() {
    return originalCode;
  }

  public void setOriginalCode(String code) {
    originalCode.clear();
    for (String line: code.split("\n", -1)) {
      originalCode.add(line);
    }
  }

  public List<ContractDefinition> contracts() {
    ImmutableList.Builder<ContractDefinition> result = ImmutableList.builder();
    for (Node u: units) {
      if (u instanceof ContractDefinition) {
        result.add((ContractDefinition)u);
      }
    }
    return result.build();
  }

  /**
   * @return the contract of that name, or null if there is none or
   *         names have not been resolved
   */
  public ContractDefinition lookupContract(String name) {
    Identifier idf = scopeNames().get(name);
    if (idf == null || !(idf.parent() instanceof ContractDefinition)) {
      return null;
    }
    return (ContractDefinition)idf.parent();
  }

  @Override
  public void processChildren(TreeRewriter rewriter) {
    rewriteChildren(rewriter, extraHeadParts, Node.class);
    rewriteChildren(rewriter, units, Node.class);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitSourceUnit(this);
  }
}
