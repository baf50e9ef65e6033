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

package hep.dec.common;

import java.io.IOException;

import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import com.google.common.collect.HashMultimap;
import com.google.common.collect.SetMultimap;

import hep.dec.common.exceptions.DecFatal;
import hep.dec.ui.ExitCode;

public class Logging
{
  private static final String DEC_LOGGER_NAME = "hep.dec";

  private static final String CONSOLE_PATTERN = "%-5p %m%n";
  private static final String FILE_PATTERN = "%d{HH:mm:ss,SSS} %-5p %c{1} %m%n";

  /**
   * Messages already emitted.
   */
  static final SetMultimap<Level, String> emitted = HashMultimap.create();

  public static Logger getDecLogger()
  {
    return Logger.getLogger(DEC_LOGGER_NAME);
  }

  /**
   * Configure the decfile logger.  Warnings always go to stderr,
   * everything down to DEBUG (TRACE if requested) goes to the log file
   * if one is given.
   * @param logfile log file name, or empty/null for no log file
   * @param trace
   * @return the configured logger
   */
  public static Logger setupLogging(String logfile, boolean trace)
  {
    Logger decLogger = getDecLogger();
    decLogger.removeAllAppenders();
    decLogger.setAdditivity(false);

    ConsoleAppender console = new ConsoleAppender(
              new PatternLayout(CONSOLE_PATTERN), ConsoleAppender.SYSTEM_ERR);
    console.setThreshold(Level.WARN);
    decLogger.addAppender(console);

    if (logfile != null && logfile.length() > 0) {
      Layout layout = new PatternLayout(FILE_PATTERN);
      try {
        FileAppender appender = new FileAppender(layout, logfile, false);
        decLogger.addAppender(appender);
      } catch (IOException e) {
        System.err.println("Could not open log file: " + logfile + ": "
                           + e.getMessage());
        throw new DecFatal(ExitCode.ERROR_IO.code());
      }
      decLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else {
      // Even if logging is disabled, this must be valid:
      decLogger.setLevel(Level.WARN);
    }
    return decLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg)
  {
    return emitted.put(level, msg);
  }

  public static void uniqueWarn(String msg)
  {
    if (addEmitted(Level.WARN, msg))
      getDecLogger().warn(msg);
    else
      getDecLogger().debug("Duplicate Warning: " + msg);
  }
}
