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
import cloak.common.lang.AnnotatedTypeName;

public class EnumDefinition extends NamespaceDefinition {
  private final List<EnumValue> values;
  /** Set by the type checker */
  private AnnotatedTypeName annotatedType = null;

  public EnumDefinition(Identifier idf, List<EnumValue> values) {
    super(idf);
    this.values = values;
  }

  public List<EnumValue> values() {
    return values;
  }

  public AnnotatedTypeName annotatedType() {
    return annotatedType;
  }

  public void setAnnotatedType(AnnotatedTypeName annotatedType) {
    this.annotatedType = annotatedType;
  }

  @Override
  public void processChildren(TreeRewriter rewriter) {
    super.processChildren(rewriter);
    rewriteChildren(rewriter, values, EnumValue.class);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitEnumDefinition(this);
  }
}
