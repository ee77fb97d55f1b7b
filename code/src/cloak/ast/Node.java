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
package cloak.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import cloak.ast.decl.ConstructorOrFunctionDefinition;
import cloak.ast.decl.ContractDefinition;
import cloak.ast.decl.SourceUnit;
import cloak.ast.expr.Expression;
import cloak.ast.stmt.AssignmentStatement;
import cloak.ast.stmt.Statement;
import cloak.codegen.CodeGenerator;
import cloak.common.exceptions.CompilerError;

/**
 * Base class of every tree element.
 *
 * A node owns exactly the children declared by its concrete class and
 * holds a single link to its parent.  Later passes decorate nodes in
 * place: scope maps, dataflow sets, types and analysis results.
 * {@link #resetDecorations()} clears these so a pass can be re-run.
 */
public abstract class Node {

  private Node parent = null;

  private int line = -1;
  private int column = -1;

  /**
   * Names accessible by nodes below this node, not including names
   * already listed by parents.  Filled in by symbol resolution.
   */
  private final Map<String, Identifier> names = new HashMap<String, Identifier>();

  /** Qualified path of the enclosing namespace, set by symbol resolution */
  private List<Identifier> namespace = null;

  /** Insertion order is significant */
  private final Set<InstanceTarget> modifiedValues =
                                  new LinkedHashSet<InstanceTarget>();
  private final Set<InstanceTarget> readValues = new HashSet<InstanceTarget>();

  public Node parent() {
    return parent;
  }

  /**
   * Link this node to its parent.  The link is set once: linking again to
   * the same parent is a no-op, linking to another parent is an error.
   * Rewrites that move a node go through {@link #relink(Node)}.
   */
  public void setParent(Node newParent) {
    if (parent != null && parent != newParent) {
      throw new CompilerError("Node " + getClass().getSimpleName() +
          " at " + line + ":" + column + " is already linked to a " +
          parent.getClass().getSimpleName());
    }
    checkAcyclic(newParent);
    this.parent = newParent;
  }

  /**
   * Give this node a new owner after a rewrite rebound it.
   */
  protected void relink(Node newParent) {
    checkAcyclic(newParent);
    this.parent = newParent;
  }

  /**
   * Drop the parent link, so the node can be attached elsewhere.
   */
  public void detach() {
    this.parent = null;
  }

  private void checkAcyclic(Node newParent) {
    if (newParent != null && (newParent == this || this.isParentOf(newParent))) {
      throw new CompilerError("Linking " + getClass().getSimpleName() +
                              " under its own descendant");
    }
  }

  public int line() {
    return line;
  }

  public int column() {
    return column;
  }

  public void setPosition(int line, int column) {
    this.line = line;
    this.column = column;
  }

  public Map<String, Identifier> scopeNames() {
    return names;
  }

  public List<Identifier> namespace() {
    return namespace;
  }

  public void setNamespace(List<Identifier> namespace) {
    this.namespace = namespace;
  }

  /**
   * @return name of this node if it introduces one, otherwise null
   */
  public Identifier idf() {
    return null;
  }

  public List<Identifier> qualifiedName() {
    Identifier idf = idf();
    if (idf == null) {
      return Collections.emptyList();
    }
    if (namespace == null || namespace.isEmpty()) {
      return Collections.singletonList(idf);
    }
    if (namespace.get(namespace.size() - 1) == idf) {
      return namespace;
    }
    List<Identifier> result = new ArrayList<Identifier>(namespace);
    result.add(idf);
    return result;
  }

  public Set<InstanceTarget> modifiedValues() {
    return modifiedValues;
  }

  public Set<InstanceTarget> readValues() {
    return readValues;
  }

  /**
   * Apply the rewriter to every child slot of this node, rebinding each
   * slot to the result.  Nodes without children do nothing.
   */
  public void processChildren(TreeRewriter rewriter) {
    // no children by default
  }

  public abstract <R> R accept(NodeVisitor<R> visitor);

  /**
   * @return direct children, in declaration order
   */
  public List<Node> children() {
    final List<Node> result = new ArrayList<Node>();
    processChildren(new TreeRewriter() {
      @Override
      public Node rewrite(Node child) {
        result.add(child);
        return child;
      }
    });
    return result;
  }

  public boolean isParentOf(Node child) {
    Node e = child;
    while (e != this && e.parent != null) {
      e = e.parent;
    }
    return e == this;
  }

  /**
   * Link the whole subtree: every child to its parent, every statement
   * to its enclosing function and every expression to its enclosing
   * statement.
   */
  public void linkParents() {
    for (Node child: children()) {
      child.setParent(this);
      if (child instanceof Statement) {
        ((Statement)child).setFunction(child.relatedFunction());
      } else if (child instanceof Expression) {
        ((Expression)child).setStatement(child.relatedStatement());
      }
      child.linkParents();
    }
  }

  /**
   * Clear decorations set by analysis passes in this subtree
   */
  public void resetDecorations() {
    List<Node> stack = new ArrayList<Node>();
    stack.add(this);

    while (!stack.isEmpty()) {
      Node node = stack.remove(stack.size() - 1);
      node.modifiedValues.clear();
      node.readValues.clear();
      node.clearDecorations();
      stack.addAll(node.children());
    }
  }

  /**
   * Hook for subclasses with their own decorations
   */
  protected void clearDecorations() {
    // nothing extra by default
  }

  public ConstructorOrFunctionDefinition relatedFunction() {
    Node iter = this;
    while (iter != null && !(iter instanceof ContractDefinition)) {
      if (iter instanceof ConstructorOrFunctionDefinition) {
        return (ConstructorOrFunctionDefinition)iter;
      }
      iter = iter.parent;
    }
    return null;
  }

  public ContractDefinition relatedContract() {
    Node iter = this;
    while (iter != null && !(iter instanceof SourceUnit)) {
      if (iter instanceof ContractDefinition) {
        return (ContractDefinition)iter;
      }
      iter = iter.parent;
    }
    return null;
  }

  public SourceUnit relatedSourceUnit() {
    Node iter = this;
    while (iter != null && !(iter instanceof SourceUnit)) {
      iter = iter.parent;
    }
    return (SourceUnit)iter;
  }

  public Statement relatedStatement() {
    Node iter = this.parent;
    while (iter != null && !(iter instanceof Statement)) {
      iter = iter.parent;
    }
    return (Statement)iter;
  }

  /**
   * @return true if this node is within the left-hand side of the
   *         nearest enclosing assignment
   */
  public boolean isInAssignmentLhs() {
    Node iter = this;
    Node child = this;
    while (iter != null && !(iter instanceof SourceUnit)) {
      if (iter instanceof AssignmentStatement) {
        return child == ((AssignmentStatement)iter).lhs();
      }
      child = iter;
      iter = iter.parent;
    }
    return false;
  }

  /**
   * Rebind a single child slot.
   * @return the new child, null if the rewriter cleared the slot
   */
  protected <T extends Node> T rewriteChild(TreeRewriter rewriter, T child,
                                            Class<T> slotType) {
    if (child == null) {
      return null;
    }
    Node result = rewriter.rewrite(child);
    if (result == null) {
      return null;
    }
    T typed = checkSlotType(result, slotType);
    if (typed != child) {
      typed.relink(this);
    }
    return typed;
  }

  /**
   * Rebind every element of a child list in place.  Null elements are
   * left alone; elements the rewriter clears are removed.
   */
  protected <T extends Node> void rewriteChildren(TreeRewriter rewriter,
                                  List<T> children, Class<T> slotType) {
    List<T> result = new ArrayList<T>(children.size());
    for (T child: children) {
      if (child == null) {
        result.add(null);
        continue;
      }
      T rewritten = rewriteChild(rewriter, child, slotType);
      if (rewritten != null) {
        result.add(rewritten);
      }
    }
    children.clear();
    children.addAll(result);
  }

  /**
   * Rebind a statement sequence: each statement may be replaced by any
   * number of statements, spliced in at its position.
   */
  protected void rewriteStatements(TreeRewriter rewriter,
                                   List<Statement> statements) {
    List<Statement> result = new ArrayList<Statement>(statements.size());
    for (Statement stmt: statements) {
      for (Statement replacement: rewriter.rewriteStatement(stmt)) {
        if (replacement != stmt) {
          replacement.relink(this);
        }
        result.add(replacement);
      }
    }
    statements.clear();
    statements.addAll(result);
  }

  private <T extends Node> T checkSlotType(Node node, Class<T> slotType) {
    if (!slotType.isInstance(node)) {
      throw new CompilerError("Rewrite put a " + node.getClass().getSimpleName()
          + " into a slot for " + slotType.getSimpleName() + " in "
          + getClass().getSimpleName());
    }
    return slotType.cast(node);
  }

  /**
   * @return source text for this node
   */
  public String code() {
    return code(false);
  }

  /**
   * @param forBackend render for the backend compiler, i.e. without
   *                   privacy annotations
   */
  public String code(boolean forBackend) {
    return new CodeGenerator(true, forBackend).generate(this);
  }

  @Override
  public String toString() {
    return code();
  }
}
