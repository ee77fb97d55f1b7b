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

import java.io.IOException;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import com.google.common.collect.Maps;

import cloak.common.exceptions.CompilerError;

public class Logging {
  private static final String CLOAK_LOGGER_NAME = "cloak";

  private static final String LOG_PATTERN = "%-5p %c{1}: %m%n";

  /**
   * Messages already emitted.
   */
  static final Set<Map.Entry<Level, String>> emitted =
       new HashSet<Map.Entry<Level, String>>();

  public static Logger getCloakLogger() {
    return Logger.getLogger(CLOAK_LOGGER_NAME);
  }

  /**
   * Configure the compiler logger.  Warnings always go to stderr,
   * everything else goes to logfile if one was given.
   * @param logfile path of log file, or empty/null for none
   * @param trace if true, log at TRACE level to the log file
   * @return the configured logger
   */
  public static Logger setupLogging(String logfile, boolean trace) {
    Logger cloakLogger = getCloakLogger();
    cloakLogger.removeAllAppenders();
    cloakLogger.setAdditivity(false);

    ConsoleAppender console = new ConsoleAppender(new PatternLayout(LOG_PATTERN),
                                                  ConsoleAppender.SYSTEM_ERR);
    console.setThreshold(Level.WARN);
    cloakLogger.addAppender(console);

    if (logfile != null && logfile.length() > 0) {
      try {
        FileAppender file = new FileAppender(new PatternLayout(LOG_PATTERN),
                                             logfile, false);
        cloakLogger.addAppender(file);
      } catch (IOException e) {
        throw new CompilerError("Could not open log file " + logfile + ": "
                                + e.getMessage());
      }
      cloakLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else {
      cloakLogger.setLevel(Level.WARN);
    }
    return cloakLogger;
  }

  /**
   * Configure the compiler logger from the log file and trace settings
   */
  public static Logger setupLoggingFromSettings() {
    return setupLogging(Settings.get(Settings.LOG_FILE),
                        Settings.getBooleanUnchecked(Settings.LOG_TRACE));
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg) {
    return emitted.add(Maps.immutableEntry(level, msg));
  }

  public static void uniqueWarn(String msg) {
    if (addEmitted(Level.WARN, msg)) {
      getCloakLogger().warn(msg);
    } else {
      getCloakLogger().debug("Duplicate Warning: " + msg);
    }
  }
}
