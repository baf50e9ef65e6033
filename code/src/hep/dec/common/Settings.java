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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import hep.dec.common.exceptions.InvalidOptionException;

/**
 * General decfile settings.  Defaults are set here and may be
 * overridden by Java system properties of the same name.
 * */
public class Settings
{
  public static final String INPUT_FILENAME = "dec.input_filename";

  public static final String LOG_FILE = "dec.log.file";
  public static final String LOG_TRACE = "dec.log.trace";

  /** Path of particle table file, empty for the bundled table */
  public static final String PARTICLE_TABLE = "dec.particle-table";

  /** Expand CDecay statements when parsing */
  public static final String INCLUDE_CC_DECAYS = "dec.include-cc-decays";

  /** Fail instead of recursing forever on A -> B, B -> A decay files */
  public static final String DETECT_CYCLES = "dec.chain.detect-cycles";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(INPUT_FILENAME, "");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(PARTICLE_TABLE, "");
    defaults.setProperty(INCLUDE_CC_DECAYS, "true");
    defaults.setProperty(DETECT_CYCLES, "true");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initProperties() throws InvalidOptionException {
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
    getBoolean(INCLUDE_CC_DECAYS);
    getBoolean(DETECT_CYCLES);
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
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
