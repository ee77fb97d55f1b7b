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

import cloak.common.Settings;
import cloak.common.exceptions.UserException;

/**
 * Rejects user identifiers that could clash with names the compiler
 * generates.
 */
public class NameChecker {

  /**
   * @throws UserException if name starts with the reserved prefix, with
   *          the prefix behind an underscore, or ends with the reserved
   *          suffix
   */
  public static void checkName(String name, int line, int column)
      throws UserException {
    String prefix = Settings.get(Settings.RESERVED_PREFIX);
    String suffix = Settings.get(Settings.RESERVED_SUFFIX);
    if (name.startsWith(prefix) || name.startsWith("_" + prefix)) {
      throw new UserException(Diagnostics.positionPrefix(line, column) +
          "Identifiers must not start with reserved prefix " + prefix +
          ": " + name);
    }
    if (name.endsWith(suffix)) {
      throw new UserException(Diagnostics.positionPrefix(line, column) +
          "Identifiers must not end with reserved suffix " + suffix +
          ": " + name);
    }
  }

  public static boolean isReserved(String name) {
    try {
      checkName(name, -1, -1);
      return false;
    } catch (UserException e) {
      return true;
    }
  }
}
