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
import cloak.ast.TreeRewriter;
import cloak.common.exceptions.CompilerError;

/**
 * Named definition that opens a scope
 */
public abstract class NamespaceDefinition extends Node {
  private Identifier idf;

  protected NamespaceDefinition(Identifier idf) {
    this.idf = idf;
  }

  @Override
  public Identifier idf() {
    return idf;
  }

  public String name() {
    return idf.name();
  }

  @Override
  public void processChildren(TreeRewriter rewriter) {
    Identifier old = idf;
    idf = rewriteChild(rewriter, idf, Identifier.class);
    if (idf != old) {
      throw new CompilerError("Name of " + getClass().getSimpleName() +
                              " " + old.name() + " cannot be rewritten");
    }
  }
}
