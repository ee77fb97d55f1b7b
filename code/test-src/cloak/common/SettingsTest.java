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

import java.util.List;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import cloak.common.exceptions.CompilerError;
import cloak.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @After
  public void restore() throws InvalidOptionException {
    System.clearProperty(Settings.CODEGEN_INDENTATION);
    System.clearProperty(Settings.ZK_RETURN_NAME);
    Settings.set(Settings.CODEGEN_INDENTATION, "4");
    Settings.set(Settings.ZK_RETURN_NAME, "zk__ret");
    Settings.set(Settings.SUPPRESS_DIAGNOSTICS, "false");
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    assertEquals(4, Settings.getInt(Settings.CODEGEN_INDENTATION));
    assertEquals("^0.8.0", Settings.get(Settings.CODEGEN_SOLC_VERSION));
    assertEquals("zk__", Settings.get(Settings.RESERVED_PREFIX));
    assertEquals("_zalt", Settings.get(Settings.RESERVED_SUFFIX));
    assertFalse(Settings.getBoolean(Settings.SUPPRESS_DIAGNOSTICS));
  }

  @Test
  public void testKeysSorted() {
    List<String> keys = Settings.getKeys();
    assertTrue(keys.contains(Settings.LOG_TRACE));
    assertTrue(keys.contains(Settings.TEE_RETURN_NAME));
    for (int i = 1; i < keys.size(); i++) {
      assertTrue(keys.get(i - 1).compareTo(keys.get(i)) < 0);
    }
  }

  @Test
  public void testSystemPropertyOverrides() throws InvalidOptionException {
    System.setProperty(Settings.CODEGEN_INDENTATION, "2");
    Settings.initCloakProperties();
    assertEquals(2, Settings.getIntUnchecked(Settings.CODEGEN_INDENTATION));
  }

  @Test
  public void testNegativeIndentationRejected()
      throws InvalidOptionException {
    System.setProperty(Settings.CODEGEN_INDENTATION, "-1");
    exception.expect(InvalidOptionException.class);
    exception.expectMessage("non-negative");
    Settings.initCloakProperties();
  }

  @Test
  public void testEmptyNameRejected() throws InvalidOptionException {
    System.setProperty(Settings.ZK_RETURN_NAME, " ");
    exception.expect(InvalidOptionException.class);
    exception.expectMessage(Settings.ZK_RETURN_NAME);
    Settings.initCloakProperties();
  }

  @Test
  public void testBadBoolean() throws InvalidOptionException {
    Settings.set(Settings.SUPPRESS_DIAGNOSTICS, "yes");
    exception.expect(InvalidOptionException.class);
    Settings.getBoolean(Settings.SUPPRESS_DIAGNOSTICS);
  }

  @Test
  public void testUncheckedLookupIsInternalError() {
    Settings.set(Settings.CODEGEN_INDENTATION, "four");
    exception.expect(CompilerError.class);
    Settings.getIntUnchecked(Settings.CODEGEN_INDENTATION);
  }
}
