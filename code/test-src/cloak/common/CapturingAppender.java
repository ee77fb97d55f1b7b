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
import java.util.List;

import org.apache.log4j.AppenderSkeleton;
import org.apache.log4j.spi.LoggingEvent;

/**
 * Keeps logged events in memory so tests can inspect them
 */
public class CapturingAppender extends AppenderSkeleton {
  private final List<LoggingEvent> events = new ArrayList<LoggingEvent>();

  public List<LoggingEvent> events() {
    return events;
  }

  public List<String> messages() {
    List<String> result = new ArrayList<String>();
    for (LoggingEvent e: events) {
      result.add(e.getRenderedMessage());
    }
    return result;
  }

  @Override
  protected void append(LoggingEvent event) {
    events.add(event);
  }

  @Override
  public void close() {
    events.clear();
  }

  @Override
  public boolean requiresLayout() {
    return false;
  }
}
