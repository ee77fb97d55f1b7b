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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import cloak.common.exceptions.CompilerError;
import cloak.common.exceptions.InvalidOptionException;

/**
 * General compiler settings.
 *
 * Defaults are set here and can be overridden by Java system properties
 * with the same key, see {@link #initCloakProperties()}.
 */
public class Settings
{
  /** Number of spaces per indentation level in generated code */
  public static final String CODEGEN_INDENTATION = "cloak.codegen.indentation";
  /** Version expression printed in backend pragmas */
  public static final String CODEGEN_SOLC_VERSION = "cloak.codegen.solc-version";

  public static final String RESERVED_PREFIX = "cloak.names.reserved-prefix";
  public static final String RESERVED_SUFFIX = "cloak.names.reserved-suffix";
  /* Base names of synthesized return bindings */
  public static final String ZK_RETURN_NAME = "cloak.names.zk-return";
  public static final String TEE_RETURN_NAME = "cloak.names.tee-return";

  /** Don't print compiler warnings, e.g. when running unit tests */
  public static final String SUPPRESS_DIAGNOSTICS = "cloak.diagnostics.suppress";

  public static final String LOG_FILE = "cloak.log.file";
  public static final String LOG_TRACE = "cloak.log.trace";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    defaults.setProperty(CODEGEN_INDENTATION, "4");
    defaults.setProperty(CODEGEN_SOLC_VERSION, "^0.8.0");
    defaults.setProperty(RESERVED_PREFIX, "zk__");
    defaults.setProperty(RESERVED_SUFFIX, "_zalt");
    defaults.setProperty(ZK_RETURN_NAME, "zk__ret");
    defaults.setProperty(TEE_RETURN_NAME, "tee__ret");
    defaults.setProperty(SUPPRESS_DIAGNOSTICS, "false");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
   * Apply system property overrides for every known key, then validate
   */
  public static void initCloakProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * @return all known keys, sorted
   */
  public static List<String> getKeys() {
    List<String> result = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(result);
    return result;
  }

  private static void validateProperties() throws InvalidOptionException {
    getBoolean(SUPPRESS_DIAGNOSTICS);
    getBoolean(LOG_TRACE);
    int indent = getInt(CODEGEN_INDENTATION);
    if (indent < 0) {
      throw new InvalidOptionException("Expected property "
          + CODEGEN_INDENTATION + " to be non-negative but was " + indent);
    }
    checkNonEmpty(Arrays.asList(RESERVED_PREFIX, RESERVED_SUFFIX,
                                ZK_RETURN_NAME, TEE_RETURN_NAME));
  }

  private static void checkNonEmpty(List<String> keys)
                                      throws InvalidOptionException {
    for (String key: keys) {
      if (require(key).trim().isEmpty()) {
        throw new InvalidOptionException("Option " + key + " is empty");
      }
    }
  }

  private static String require(String key) throws InvalidOptionException {
    String value = properties.getProperty(key);
    if (value == null) {
      throw new InvalidOptionException("Option " + key + " is not set");
    }
    return value;
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static int getInt(String key) throws InvalidOptionException {
    String value = require(key).trim();
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Option " + key +
          " expects a whole number, got '" + value + "'");
    }
  }

  /**
   * Accepts true and false in any case
   */
  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String value = require(key).trim();
    if (value.equalsIgnoreCase("true") || value.equalsIgnoreCase("false")) {
      return Boolean.parseBoolean(value);
    }
    throw new InvalidOptionException("Option " + key +
        " expects true or false, got '" + value + "'");
  }

  /**
   * Lookup for settings that were validated at startup: a bad value here
   * is an internal error rather than a user error.
   */
  public static boolean getBooleanUnchecked(String key) {
    try {
      return getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new CompilerError(e.getMessage());
    }
  }

  public static int getIntUnchecked(String key) {
    try {
      return getInt(key);
    } catch (InvalidOptionException e) {
      throw new CompilerError(e.getMessage());
    }
  }
}
