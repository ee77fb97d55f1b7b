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
import java.util.List;

import cloak.ast.stmt.IndentBlock;
import cloak.ast.stmt.Statement;

/**
 * Comment line emitted by passes that generate code.
 */
public class Comment extends Statement {

  private final String text;

  public Comment(String text) {
    this.text = text;
  }

  public Comment() {
    this("");
  }

  public String text() {
    return text;
  }

  /**
   * Prefix a block with a comment line and follow it with a blank line.
   * Empty blocks are returned as they are.
   */
  public static List<Statement> commentList(String text, List<Statement> block) {
    if (block.isEmpty()) {
      return block;
    }
    List<Statement> result = new ArrayList<Statement>(block.size() + 2);
    result.add(new Comment(text));
    result.addAll(block);
    result.add(new BlankLine());
    return result;
  }

  /**
   * Wrap a block in a commented, indented group
   */
  public static List<Statement> commentWrapBlock(String text,
                                                 List<Statement> block) {
    if (block.isEmpty()) {
      return block;
    }
    List<Statement> result = new ArrayList<Statement>(5);
    result.add(new Comment(text));
    result.add(new Comment("{"));
    result.add(new IndentBlock(new ArrayList<Statement>(block)));
    result.add(new Comment("}"));
    result.add(new BlankLine());
    return Collections.unmodifiableList(result);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitComment(this);
  }
}
