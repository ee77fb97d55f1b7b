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

import java.util.LinkedHashMap;
import java.util.Map;

import cloak.ast.Node;
import cloak.ast.NodeVisitor;

/**
 * One of {@code import "p";}, {@code import "p" as U;} or
 * {@code import {a as b, c} from "p";}
 */
public class ImportDirective extends Node {
  private final String path;
  /** null if the unit is not aliased */
  private final String unitAlias;
  /** Imported symbol to local name; the local name may be null */
  private final Map<String, String> aliases;

  public ImportDirective(String path, String unitAlias,
                         Map<String, String> aliases) {
    this.path = path;
    this.unitAlias = unitAlias;
    this.aliases = aliases != null ? aliases
                                   : new LinkedHashMap<String, String>();
  }

  public ImportDirective(String path) {
    this(path, null, null);
  }

  public String path() {
    return path;
  }

  public String unitAlias() {
    return unitAlias;
  }

  public Map<String, String> aliases() {
    return aliases;
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitImportDirective(this);
  }
}
