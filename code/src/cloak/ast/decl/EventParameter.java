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

import cloak.ast.Identifier;
import cloak.ast.Node;
import cloak.ast.NodeVisitor;
import cloak.ast.TreeRewriter;
import cloak.common.lang.AnnotatedTypeName;

public class EventParameter extends Node {
  private AnnotatedTypeName annotatedType;
  private final boolean indexed;
  /** null if unnamed */
  private Identifier name;

  public EventParameter(AnnotatedTypeName annotatedType, boolean indexed,
                        Identifier name) {
    this.annotatedType = annotatedType;
    this.indexed = indexed;
    this.name = name;
  }

  public AnnotatedTypeName annotatedType() {
    return annotatedType;
  }

  public boolean isIndexed() {
    return indexed;
  }

  public Identifier name() {
    return name;
  }

  @Override
  public void processChildren(TreeRewriter rewriter) {
    annotatedType = rewriteChild(rewriter, annotatedType,
                                 AnnotatedTypeName.class);
    name = rewriteChild(rewriter, name, Identifier.class);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitEventParameter(this);
  }
}
