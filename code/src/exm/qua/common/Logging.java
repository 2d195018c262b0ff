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
package exm.qua.common;

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

public class Logging
{
  private static final String QUA_LOGGER_NAME = "exm.qua";

  private static final String LOG_PATTERN = "%-5p %c{1} %m%n";

  /**
   * Messages already emitted, keyed by level and text
   */
  static final Set<String> emitted = new HashSet<String>();

  public static Logger getQuaLogger()
  {
    return Logger.getLogger(QUA_LOGGER_NAME);
  }

  /**
   * Send the QUA logger to a file.
   * @param logfile may be null or empty: then logging stays off
   * @param trace if true, log at TRACE level, otherwise DEBUG
   * @return the QUA logger
   */
  public static Logger setupLogging(String logfile, boolean trace)
  {
    Logger quaLogger = getQuaLogger();
    quaLogger.removeAllAppenders();
    quaLogger.setAdditivity(false);
    if (StringUtils.isBlank(logfile)) {
      quaLogger.setLevel(Level.WARN);
      return quaLogger;
    }

    Layout layout = new PatternLayout(LOG_PATTERN);
    try {
      FileAppender appender = new FileAppender(layout, logfile, false);
      quaLogger.addAppender(appender);
    } catch (IOException e) {
      System.err.println("Could not open log file: " + logfile + ": " +
                         e.getMessage());
      return quaLogger;
    }
    quaLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    return quaLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg)
  {
    synchronized (emitted) {
      return emitted.add(level.toString() + ":" + msg);
    }
  }

  public static void uniqueWarn(String msg)
  {
    if (addEmitted(Level.WARN, msg))
      getQuaLogger().warn(msg);
    else
      getQuaLogger().debug("Duplicate Warning: " + msg);
  }
}
