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
package cloak.frontend;

import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import cloak.ast.Node;
import cloak.ast.decl.ConstructorOrFunctionDefinition;
import cloak.ast.decl.ContractDefinition;
import cloak.ast.decl.SourceUnit;
import cloak.ast.expr.Expression;
import cloak.ast.stmt.Statement;
import cloak.common.Logging;
import cloak.common.Settings;

/**
 * Error and warning messages that point into the source text
 */
public class Diagnostics {

  private static final String TAB_EXPANSION = "    ";

  /**
   * @return "At line: L;C: ", or nothing if the position is unknown
   */
  public static String positionPrefix(int line, int column) {
    if (line <= 0) {
      return "";
    }
    return "At line: " + line + ";" + column + ": ";
  }

  /**
   * Describe a source position: line and column, the enclosing function
   * and contract, then the source lines from the start of the enclosing
   * statement to the position, underlined up to the column.
   *
   * @param code source text split into lines
   * @param contract enclosing contract or null
   * @param function enclosing function or null
   * @param stmt enclosing statement or null
   */
  public static String codeErrorMessage(int line, int column, List<String> code,
      ContractDefinition contract, ConstructorOrFunctionDefinition function,
      Statement stmt) {
    StringBuilder msg = new StringBuilder();
    msg.append("At line: ").append(line).append(";").append(column);

    if (line <= 0 || column <= 0 || line > code.size()) {
      return msg.toString();
    }

    if (function != null && contract != null) {
      msg.append(", in function '").append(function.name())
         .append("' of contract '").append(contract.name()).append("'");
    } else if (contract != null) {
      msg.append(", in contract '").append(contract.name()).append("'");
    }
    msg.append('\n');

    int startLine = stmt == null ? line : stmt.line();
    if (startLine <= 0 || startLine > line) {
      startLine = line;
    }
    for (int l = startLine; l <= line; l++) {
      msg.append(code.get(l - 1).replace("\t", TAB_EXPANSION)).append('\n');
    }

    String affected = code.get(line - 1);
    int prefixLength = Math.min(column - 1, affected.length());
    for (int i = 0; i < prefixLength; i++) {
      msg.append(affected.charAt(i) == '\t' ?
                 StringUtils.repeat('-', TAB_EXPANSION.length()) : "-");
    }
    msg.append('/');
    return msg.toString();
  }

  /**
   * Message for a problem with a node, prefixed with its location
   */
  public static String astExceptionMessage(Node node, String message) {
    Statement stmt;
    if (node instanceof Expression) {
      stmt = ((Expression)node).statement();
    } else if (node instanceof Statement) {
      stmt = (Statement)node;
    } else {
      stmt = null;
    }

    ConstructorOrFunctionDefinition function;
    if (stmt != null) {
      function = stmt.function();
    } else if (node instanceof ConstructorOrFunctionDefinition) {
      function = (ConstructorOrFunctionDefinition)node;
    } else {
      function = null;
    }

    Node start = function == null ? node : function;
    ContractDefinition contract = start.relatedContract();
    SourceUnit root = (contract == null ? node : contract).relatedSourceUnit();
    List<String> code = root == null ? Collections.<String>emptyList()
                                     : root.originalCode();

    return codeErrorMessage(node.line(), node.column(), code, contract,
                            function, stmt) + "\n\n" + message;
  }

  /**
   * Print a warning about a node, once per distinct message, unless
   * diagnostics are suppressed
   */
  public static void issueCompilerWarning(Node node, String warningType,
                                          String message) {
    if (Settings.getBooleanUnchecked(Settings.SUPPRESS_DIAGNOSTICS)) {
      return;
    }
    Logging.uniqueWarn("WARNING: " + warningType + "\n" +
                       astExceptionMessage(node, message));
  }
}
