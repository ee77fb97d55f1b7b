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
package cloak.common.util;

import java.util.List;

import org.apache.commons.lang3.StringUtils;

public class StringUtil {

  /**
   * Join the non-null strings with the separator
   */
  public static String concat(String separator, List<String> tokens) {
    StringBuilder sb = new StringBuilder();
    boolean first = true;
    for (String tok: tokens) {
      if (tok == null) {
        continue;
      }
      if (!first) {
        sb.append(separator);
      }
      sb.append(tok);
      first = false;
    }
    return sb.toString();
  }

  /**
   * Prefix every line that is not entirely whitespace.
   * Line terminators are kept as they are.
   */
  public static String indent(String s, String prefix) {
    StringBuilder sb = new StringBuilder(s.length() + 16);
    int start = 0;
    while (start < s.length()) {
      int nl = s.indexOf('\n', start);
      int end = (nl < 0) ? s.length() : nl + 1;
      String line = s.substring(start, end);
      if (!StringUtils.isBlank(line)) {
        sb.append(prefix);
      }
      sb.append(line);
      start = end;
    }
    return sb.toString();
  }

  public static String indent(String s, int width) {
    return indent(s, StringUtils.repeat(' ', width));
  }

  /**
   * Like String.trim(), but only at the end of the string
   */
  public static String rstrip(String s) {
    return StringUtils.stripEnd(s, null);
  }
}
