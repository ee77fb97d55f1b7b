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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.Test;

import cloak.ast.decl.ConstructorOrFunctionDefinition;
import cloak.ast.decl.SourceUnit;
import cloak.ast.expr.Expression;
import cloak.ast.stmt.AssignmentStatement;
import cloak.ast.stmt.Statement;
import cloak.common.CapturingAppender;
import cloak.common.Logging;
import cloak.common.Settings;
import cloak.common.exceptions.UserException;

public class DiagnosticsTest {

  private static final String SOURCE =
      "pragma cloak ^0.1;\n" +
      "contract Bank {\n" +
      "  function deposit(uint@me v) public {\n" +
      "    x = v;\n" +
      "  }\n" +
      "}";

  @After
  public void restore() {
    Settings.set(Settings.SUPPRESS_DIAGNOSTICS, "false");
    Logging.setupLogging(null, false);
  }

  private static AssignmentStatement assignment() throws UserException {
    SourceUnit unit = (SourceUnit)new FragmentParser().parse(SOURCE);
    ConstructorOrFunctionDefinition f =
        unit.contracts().get(0).functionDefinitions().get(0);
    return (AssignmentStatement)f.body().get(0);
  }

  @Test
  public void testPositionPrefix() {
    assertEquals("At line: 3;4: ", Diagnostics.positionPrefix(3, 4));
    assertEquals("", Diagnostics.positionPrefix(-1, -1));
  }

  @Test
  public void testExcerpt() {
    List<String> code = Arrays.asList("a;", "  bad();");
    assertEquals("At line: 2;3\n  bad();\n--/",
        Diagnostics.codeErrorMessage(2, 3, code, null, null, null));
  }

  @Test
  public void testTabsExpanded() {
    List<String> code = Collections.singletonList("\tx;");
    assertEquals("At line: 1;2\n    x;\n----/",
        Diagnostics.codeErrorMessage(1, 2, code, null, null, null));
  }

  @Test
  public void testUnknownPosition() {
    assertEquals("At line: 5;1", Diagnostics.codeErrorMessage(5, 1,
        Collections.<String>emptyList(), null, null, null));
  }

  @Test
  public void testStatementMessage() throws UserException {
    Statement stmt = assignment();
    assertEquals("At line: 4;5, in function 'deposit' of contract 'Bank'\n" +
                 "    x = v;\n" +
                 "----/\n\n" +
                 "not allowed",
                 Diagnostics.astExceptionMessage(stmt, "not allowed"));
  }

  @Test
  public void testExpressionMessage() throws UserException {
    Expression rhs = assignment().rhs();
    assertEquals("At line: 4;9, in function 'deposit' of contract 'Bank'\n" +
                 "    x = v;\n" +
                 "--------/\n\n" +
                 "private value",
                 Diagnostics.astExceptionMessage(rhs, "private value"));
  }

  @Test
  public void testWarningsCanBeSuppressed() throws UserException {
    Logger logger = Logging.setupLogging(null, false);
    CapturingAppender capture = new CapturingAppender();
    logger.addAppender(capture);
    Statement stmt = assignment();

    Settings.set(Settings.SUPPRESS_DIAGNOSTICS, "true");
    Diagnostics.issueCompilerWarning(stmt, "Unused value",
                                     "suppressed warning");
    assertTrue(capture.events().isEmpty());

    Settings.set(Settings.SUPPRESS_DIAGNOSTICS, "false");
    Diagnostics.issueCompilerWarning(stmt, "Unused value",
                                     "reported warning");
    Diagnostics.issueCompilerWarning(stmt, "Unused value",
                                     "reported warning");
    assertEquals(1, capture.events().size());
    String msg = capture.messages().get(0);
    assertTrue(msg, msg.startsWith("WARNING: Unused value\nAt line: 4;5"));
    assertTrue(msg, msg.endsWith("reported warning"));
  }
}
