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
package cloak.ast.expr;

import java.util.ArrayList;
import java.util.List;

import cloak.ast.Node;
import cloak.ast.NodeVisitor;
import cloak.ast.TreeRewriter;

/**
 * Arguments of a call: either all positional expressions or all
 * {@link NamedArgument}s.
 */
public class CallArgumentList extends Node {
  private final List<Node> args;
  private final boolean namedArguments;

  public CallArgumentList(List<? extends Node> args, boolean namedArguments) {
    this.args = new ArrayList<Node>(args);
    this.namedArguments = namedArguments;
  }

  public static CallArgumentList positional(List<? extends Expression> args) {
    return new CallArgumentList(args, false);
  }

  public static CallArgumentList named(List<NamedArgument> args) {
    return new CallArgumentList(args, true);
  }

  public List<Node> args() {
    return args;
  }

  public Node get(int i) {
    return args.get(i);
  }

  public int size() {
    return args.size();
  }

  public boolean namedArguments() {
    return namedArguments;
  }

  @Override
  public void processChildren(TreeRewriter rewriter) {
    rewriteChildren(rewriter, args, Node.class);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitCallArgumentList(this);
  }
}
