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

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import accel.asc.common.exceptions.InvalidOptionException;

/**
 * General ASC settings.  Defaults are set here and can be overridden
 * through Java system properties of the same name.
 * */
public class Settings
{
  public static final String LOG_FILE = "asc.log.file";
  public static final String LOG_TRACE = "asc.log.trace";

  /** Dump the syntax tree at DEBUG level before building the AST */
  public static final String PRINT_TREE = "asc.debug.print-tree";

  /** Charset for reading source files */
  public static final String INPUT_ENCODING = "asc.input.encoding";

  private static final Properties defaults;
  private static final Properties properties;

  static {
    defaults = new Properties();
    // Set defaults here
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(PRINT_TREE, "false");
    defaults.setProperty(INPUT_ENCODING, "UTF-8");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initASCProperties() throws InvalidOptionException {
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
   * Drop any value set for key so that the default applies again
   */
  public static void reset(String key) {
    properties.remove(key);
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(LOG_TRACE);
    getBoolean(PRINT_TREE);

    String encoding = get(INPUT_ENCODING);
    boolean supported;
    try {
      supported = Charset.isSupported(encoding);
    } catch (IllegalCharsetNameException e) {
      supported = false;
    }
    if (!supported) {
      throw new InvalidOptionException("Unsupported charset for option " +
                INPUT_ENCODING + ": " + encoding);
    }
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.toLowerCase();
    if (lStrVal.equals("true")) {
      return true;
    } else if (lStrVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException(
          "option string for " + key + " must be true or false, but was '" +
              strVal + "'");
    }
  }
}
