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

import cloak.ast.Identifier;
import cloak.ast.NodeVisitor;
import cloak.common.lang.AnnotatedTypeName;

public class Parameter extends IdentifierDeclaration {
  public Parameter(List<String> keywords, AnnotatedTypeName annotatedType,
                   Identifier idf, String storageLocation) {
    super(keywords, annotatedType, idf, storageLocation);
  }

  public Parameter(List<String> keywords, AnnotatedTypeName annotatedType,
                   Identifier idf) {
    this(keywords, annotatedType, idf, null);
  }

  /**
   * Shallow copy: type and name nodes are shared with this parameter,
   * so only one of the two may be linked into a tree.
   */
  public Parameter copy() {
    return new Parameter(new ArrayList<String>(keywords()), annotatedType(),
                         idf(), storageLocation());
  }

  /**
   * Change the storage location in place if it is currently matchStorage
   * @return this parameter
   */
  public Parameter withChangedStorage(String matchStorage, String newStorage) {
    if (matchStorage == null ? storageLocation() == null
                             : matchStorage.equals(storageLocation())) {
      setStorageLocation(newStorage);
    }
    return this;
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitParameter(this);
  }
}
