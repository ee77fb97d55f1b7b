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
package cloak.codegen;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import cloak.common.Settings;
import cloak.common.util.StringUtil;

/**
 * Layout helpers for generated code: indentation and joining of parts
 */
public class CodeWriter {
  private final String indentation;

  public CodeWriter(int indentWidth) {
    this.indentation = StringUtils.repeat(' ', indentWidth);
  }

  /**
   * Use the indentation width from the settings
   */
  public CodeWriter() {
    this(Settings.getIntUnchecked(Settings.CODEGEN_INDENTATION));
  }

  public String indentation() {
    return indentation;
  }

  /**
   * Indent every non-blank line by one level
   */
  public String indent(String code) {
    return StringUtil.indent(code, indentation);
  }

  /**
   * Body between braces, indented by one level
   */
  public String braced(String body) {
    if (body.isEmpty()) {
      return "{\n}";
    }
    return "{\n" + indent(body) + "\n}";
  }

  /**
   * Join the parts that are neither null nor empty
   */
  public static String joinNonEmpty(String separator, List<String> parts) {
    List<String> nonEmpty = new ArrayList<String>(parts.size());
    for (String p: parts) {
      if (p != null && !p.isEmpty()) {
        nonEmpty.add(p);
      }
    }
    return StringUtil.concat(separator, nonEmpty);
  }
}
