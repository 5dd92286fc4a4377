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
package accel.asc.frontend;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import accel.asc.ast.antlr.AccelScriptParser;

/**
 * Helper functions to augment log messages with contextual information,
 * mainly indentation by tree depth.
 *
 */
public class LogHelper {

  /**
   * @param tokenNum token number from AST
   * @return descriptive string containing token name, or token number if
   *        unknown token type
   */
  public static String tokName(int tokenNum) {
    if (tokenNum < 0 || tokenNum > AccelScriptParser.tokenNames.length - 1) {
      return "Invalid token number (" + tokenNum + ")";
    } else {
      return AccelScriptParser.tokenNames[tokenNum];
    }
  }

  /**
     TRACE-level with indentation for nice output
   */
  public static void trace(Logger logger, int indent, String msg) {
    log(logger, indent, Level.TRACE, msg);
  }

  public static void log(Logger logger, int indent, Level level, String msg) {
    if (logger.isEnabledFor(level)) {
      logger.log(level, logMsg(indent, msg));
    }
  }

  private static String logMsg(int indent, String msg) {
    return StringUtils.repeat(' ', indent) + msg;
  }
}
