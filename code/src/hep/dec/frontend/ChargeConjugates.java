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
package hep.dec.frontend;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;

import hep.dec.common.Logging;
import hep.dec.common.exceptions.DecRuntimeError;
import hep.dec.common.exceptions.ParticleNotFoundException;
import hep.dec.particle.ParticleDatabase;

/**
 * Finds the charge conjugate of a particle name.  Strategies are tried in
 * order and the first match wins:
 * <ol>
 *  <li>pairs declared with "ChargeConj P CCP", in either direction</li>
 *  <li>the particle database</li>
 *  <li>a placeholder name "ChargeConj(NAME)", so that the result is
 *      always defined and unresolved names can be spotted later</li>
 * </ol>
 */
public class ChargeConjugates {

  private static final Logger logger = Logging.getDecLogger();

  public static final String PLACEHOLDER_PREFIX = "ChargeConj(";
  public static final String PLACEHOLDER_SUFFIX = ")";

  /**
   * One way of finding a conjugate name
   */
  public static interface Strategy {
    /**
     * @return the conjugate name, or null if this strategy has no match
     */
    public String match(String name);
  }

  private final ImmutableList<Strategy> strategies;

  public ChargeConjugates(List<Strategy> strategies) {
    this.strategies = ImmutableList.copyOf(strategies);
  }

  /**
   * The standard resolution order
   * @param chargeConjDefs "ChargeConj" statements, possibly empty
   * @param db particle database
   */
  public ChargeConjugates(Map<String, String> chargeConjDefs,
                          ParticleDatabase db) {
    this(standardStrategies(chargeConjDefs, db));
  }

  private static List<Strategy> standardStrategies(
          Map<String, String> chargeConjDefs, ParticleDatabase db) {
    List<Strategy> result = new ArrayList<Strategy>();
    if (!chargeConjDefs.isEmpty()) {
      result.add(new ExplicitPairs(chargeConjDefs));
    }
    result.add(new DatabaseLookup(db));
    result.add(new Placeholder());
    return result;
  }

  public String conjugate(String name) {
    for (Strategy strategy: strategies) {
      String match = strategy.match(name);
      if (match != null) {
        return match;
      }
    }
    throw new DecRuntimeError("No charge conjugate found for " + name +
                              " with strategies " + strategies);
  }

  public static String placeholderName(String name) {
    return PLACEHOLDER_PREFIX + name + PLACEHOLDER_SUFFIX;
  }

  public static boolean isPlaceholder(String name) {
    return name.startsWith(PLACEHOLDER_PREFIX) &&
           name.endsWith(PLACEHOLDER_SUFFIX);
  }

  /**
   * "ChargeConj P CCP" declares P and CCP as mutual conjugates
   */
  public static class ExplicitPairs implements Strategy {
    private final Map<String, String> pairs;

    public ExplicitPairs(Map<String, String> pairs) {
      this.pairs = new LinkedHashMap<String, String>(pairs);
    }

    @Override
    public String match(String name) {
      for (Map.Entry<String, String> e: pairs.entrySet()) {
        if (e.getValue().equals(name)) {
          return e.getKey();
        } else if (e.getKey().equals(name)) {
          return e.getValue();
        }
      }
      return null;
    }

    @Override
    public String toString() {
      return "ExplicitPairs" + pairs;
    }
  }

  public static class DatabaseLookup implements Strategy {
    private final ParticleDatabase db;

    public DatabaseLookup(ParticleDatabase db) {
      this.db = db;
    }

    @Override
    public String match(String name) {
      try {
        return db.antiparticleName(name);
      } catch (ParticleNotFoundException e) {
        logger.debug("No antiparticle for " + name + ": " + e.getMessage());
        return null;
      }
    }

    @Override
    public String toString() {
      return "DatabaseLookup";
    }
  }

  public static class Placeholder implements Strategy {
    @Override
    public String match(String name) {
      String placeholder = placeholderName(name);
      Logging.uniqueWarn("No charge conjugate known for '" + name +
                         "', using '" + placeholder + "'");
      return placeholder;
    }

    @Override
    public String toString() {
      return "Placeholder";
    }
  }
}
