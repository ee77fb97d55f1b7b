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
package cloak.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class LoggingTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @After
  public void resetLogging() {
    Settings.set(Settings.LOG_FILE, "");
    Settings.set(Settings.LOG_TRACE, "false");
    Logging.setupLogging(null, false);
  }

  @Test
  public void testConsoleOnly() {
    Logger logger = Logging.setupLogging("", false);
    assertEquals(Level.WARN, logger.getLevel());
    assertFalse(logger.getAdditivity());
    assertTrue(logger.getAllAppenders().hasMoreElements());
  }

  @Test
  public void testLogFileFromSettings() throws IOException {
    File log = tmp.newFile("cloak.log");
    Settings.set(Settings.LOG_FILE, log.getPath());
    Settings.set(Settings.LOG_TRACE, "true");
    Logger logger = Logging.setupLoggingFromSettings();
    assertEquals(Level.TRACE, logger.getLevel());

    logger.debug("written to file");
    String contents = new String(Files.readAllBytes(log.toPath()),
                                 StandardCharsets.UTF_8);
    assertTrue(contents, contents.contains("written to file"));
  }

  @Test
  public void testUniqueWarn() {
    Logger logger = Logging.setupLogging("", false);
    CapturingAppender capture = new CapturingAppender();
    logger.addAppender(capture);

    Logging.uniqueWarn("unique warning for LoggingTest");
    Logging.uniqueWarn("unique warning for LoggingTest");
    assertEquals(1, capture.events().size());
    assertEquals(Level.WARN, capture.events().get(0).getLevel());
  }
}
