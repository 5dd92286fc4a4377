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

package accel.asc.common;

import java.io.IOException;

import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import accel.asc.common.exceptions.ASCRuntimeError;
import accel.asc.common.exceptions.InvalidOptionException;

public class Logging
{
  private static final String ASC_LOGGER_NAME = "accel.asc";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  public static Logger getASCLogger()
  {
    return Logger.getLogger(ASC_LOGGER_NAME);
  }

  /**
   * Set up logging from the asc.log.file and asc.log.trace settings
   * @return the compiler logger
   * @throws InvalidOptionException if asc.log.trace is not a boolean
   */
  public static Logger setupLogging() throws InvalidOptionException
  {
    return setupLogging(Settings.get(Settings.LOG_FILE),
                        Settings.getBoolean(Settings.LOG_TRACE));
  }

  /**
   * Direct compiler log output to a file.
   * @param logfile path of log file, or empty/null for no log file
   * @param trace if true, log at TRACE level, otherwise DEBUG
   * @return the compiler logger
   */
  public static Logger setupLogging(String logfile, boolean trace)
  {
    Logger ascLogger = getASCLogger();
    if (logfile == null || logfile.length() == 0) {
      ascLogger.setLevel(Level.WARN);
      // Even if logging is disabled, this must be valid:
      return ascLogger;
    }

    FileAppender appender;
    try {
      appender = new FileAppender(new PatternLayout(LOG_PATTERN), logfile,
                                  false);
    } catch (IOException e) {
      throw new ASCRuntimeError("Could not open log file " + logfile, e);
    }
    ascLogger.removeAllAppenders();
    ascLogger.addAppender(appender);
    ascLogger.setAdditivity(false);
    ascLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    return ascLogger;
  }
}
