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

import cloak.ast.Node;
import cloak.ast.NodeVisitor;

/**
 * {@code override} or {@code override(A, B.C)}
 */
public class OverrideSpecifier extends Node {
  private final List<List<String>> paths;

  public OverrideSpecifier(List<List<String>> paths) {
    this.paths = paths;
  }

  public List<List<String>> paths() {
    return paths;
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitOverrideSpecifier(this);
  }
}
