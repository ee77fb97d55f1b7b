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

import cloak.ast.decl.IdentifierDeclaration;
import cloak.ast.decl.Parameter;
import cloak.ast.decl.StateVariableDeclaration;
import cloak.ast.decl.VariableDeclaration;
import cloak.ast.expr.IdentifierExpr;
import cloak.ast.expr.IndexExpr;
import cloak.ast.expr.MemberAccessExpr;
import cloak.common.exceptions.CompilerError;

/**
 * Canonical name of the storage location an expression refers to,
 * used to key dataflow facts.
 *
 * Made of the declaration of the variable, the member name or index key
 * if only part of it is meant, and the indexing expression itself.
 * Different expressions for the same location give equal targets.
 */
public class InstanceTarget {
  private final IdentifierDeclaration target;
  /** {@link Identifier} for a member, index key expression, or null */
  private final Node key;
  /** Indexing expression, or null */
  private final IndexExpr indexExpr;

  /**
   * @param location a variable, parameter or state variable declaration,
   *    or an identifier, member access or index expression
   * @throws CompilerError for any other node, or if the location does not
   *    resolve to a variable
   */
  public InstanceTarget(Node location) {
    Node decl;
    Node key = null;
    IndexExpr indexExpr = null;
    if (location instanceof VariableDeclaration ||
        location instanceof Parameter ||
        location instanceof StateVariableDeclaration) {
      decl = location;
    } else if (location instanceof IdentifierExpr) {
      decl = ((IdentifierExpr)location).target();
    } else if (location instanceof MemberAccessExpr &&
        ((MemberAccessExpr)location).expr() instanceof IdentifierExpr) {
      MemberAccessExpr ma = (MemberAccessExpr)location;
      decl = ((IdentifierExpr)ma.expr()).target();
      key = ma.member();
    } else if (location instanceof IndexExpr) {
      indexExpr = (IndexExpr)location;
      IdentifierExpr leftmost = indexExpr.leftmostIdentifier();
      decl = leftmost == null ? null : leftmost.target();
      key = indexExpr.key();
    } else {
      throw new CompilerError(describe(location) +
                              " is not a supported location");
    }

    if (!(decl instanceof VariableDeclaration ||
          decl instanceof Parameter ||
          decl instanceof StateVariableDeclaration)) {
      throw new CompilerError(describe(location) +
          " is not a supported location: it refers to " + describe(decl));
    }
    this.target = (IdentifierDeclaration)decl;
    this.key = key;
    this.indexExpr = indexExpr;
  }

  private static String describe(Node node) {
    return node == null ? "nothing" : node.getClass().getSimpleName();
  }

  public IdentifierDeclaration target() {
    return target;
  }

  public Node key() {
    return key;
  }

  public IndexExpr indexExpr() {
    return indexExpr;
  }

  /**
   * @return true if this is a whole variable rather than part of one
   */
  public boolean isWholeVariable() {
    return key == null;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof InstanceTarget)) {
      return false;
    }
    InstanceTarget other = (InstanceTarget)obj;
    return target == other.target && sameKey(key, other.key) &&
           indexExpr == other.indexExpr;
  }

  private static boolean sameKey(Node a, Node b) {
    if (a instanceof Identifier && b instanceof Identifier) {
      return ((Identifier)a).name().equals(((Identifier)b).name());
    }
    return a == b;
  }

  @Override
  public int hashCode() {
    int h = System.identityHashCode(target);
    if (key instanceof Identifier) {
      h = h * 31 + ((Identifier)key).name().hashCode();
    } else {
      h = h * 31 + System.identityHashCode(key);
    }
    return h * 31 + System.identityHashCode(indexExpr);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(target.idf() == null ? "?" : target.idf().name());
    if (key instanceof Identifier) {
      sb.append('.').append(((Identifier)key).name());
    } else if (key != null) {
      sb.append('[').append(key.code()).append(']');
    }
    return sb.toString();
  }
}
