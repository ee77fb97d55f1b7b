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
import cloak.ast.TreeRewriter;
import cloak.common.lang.AnnotatedTypeName;

/**
 * Declaration of a named, typed value
 */
public abstract class IdentifierDeclaration extends Node {
  public static final String FINAL = "final";
  public static final String CONSTANT = "constant";

  private final List<String> keywords;
  private AnnotatedTypeName annotatedType;
  private Identifier idf;
  /** "memory", "storage", "calldata", empty or null */
  private String storageLocation;

  protected IdentifierDeclaration(List<String> keywords,
      AnnotatedTypeName annotatedType, Identifier idf, String storageLocation) {
    this.keywords = keywords;
    this.annotatedType = annotatedType;
    this.idf = idf;
    this.storageLocation = storageLocation;
  }

  public List<String> keywords() {
    return keywords;
  }

  public AnnotatedTypeName annotatedType() {
    return annotatedType;
  }

  @Override
  public Identifier idf() {
    return idf;
  }

  public String storageLocation() {
    return storageLocation;
  }

  protected void setStorageLocation(String storageLocation) {
    this.storageLocation = storageLocation;
  }

  public boolean isFinal() {
    return keywords.contains(FINAL);
  }

  public boolean isConstant() {
    return keywords.contains(CONSTANT);
  }

  @Override
  public void processChildren(TreeRewriter rewriter) {
    annotatedType = rewriteChild(rewriter, annotatedType,
                                 AnnotatedTypeName.class);
    idf = rewriteChild(rewriter, idf, Identifier.class);
  }
}
