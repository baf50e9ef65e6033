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
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import hep.dec.common.Logging;
import hep.dec.common.exceptions.CyclicDecayChainException;
import hep.dec.common.exceptions.DecayNotFoundException;
import hep.dec.common.lang.DecayChain;
import hep.dec.common.lang.DecayChain.Mode;
import hep.dec.common.lang.DecayChain.Product;
import hep.dec.common.lang.DecayMode;

/**
 * Expands the decays of a mother particle recursively until only stable
 * particles or particles without a decay definition are left.
 */
public class DecayChainBuilder {

  private static final Logger logger = Logging.getDecLogger();

  private final ParsedDecFile parsed;
  private final boolean detectCycles;

  public DecayChainBuilder(ParsedDecFile parsed, boolean detectCycles) {
    this.parsed = parsed;
    this.detectCycles = detectCycles;
  }

  public DecayChain build(String mother) throws DecayNotFoundException,
                                                CyclicDecayChainException {
    return build(mother, Collections.<String>emptyList());
  }

  /**
   * @param mother particle to expand, must have a decay definition
   * @param stable particles never expanded, even if they have decays
   * @throws DecayNotFoundException if the mother has no decay definition
   * @throws CyclicDecayChainException if a particle decays back into one
   *              of its ancestors and cycle detection is on
   */
  public DecayChain build(String mother, Collection<String> stable)
          throws DecayNotFoundException, CyclicDecayChainException {
    Set<String> stableSet = new HashSet<String>(stable);
    return build(mother, stableSet, new LinkedHashSet<String>());
  }

  private DecayChain build(String mother, Set<String> stable,
                           LinkedHashSet<String> inProgress)
          throws DecayNotFoundException, CyclicDecayChainException {
    List<DecayMode> decayModes = parsed.decayModes(mother);

    if (detectCycles && !inProgress.add(mother)) {
      throw new CyclicDecayChainException(mother,
                                  new ArrayList<String>(inProgress));
    }

    List<Mode> modes = new ArrayList<Mode>(decayModes.size());
    for (DecayMode dm: decayModes) {
      List<Product> products = new ArrayList<Product>();
      for (String particle: dm.finalState()) {
        products.add(expand(particle, stable, inProgress));
      }
      modes.add(new Mode(dm.branchingFraction(), products, dm.model(),
                         dm.modelParameters()));
    }

    if (detectCycles) {
      inProgress.remove(mother);
    }
    return new DecayChain(mother, modes);
  }

  private Product expand(String particle, Set<String> stable,
                         LinkedHashSet<String> inProgress)
                                   throws CyclicDecayChainException {
    if (stable.contains(particle)) {
      return Product.leaf(particle);
    }
    try {
      return Product.nested(build(particle, stable, inProgress));
    } catch (DecayNotFoundException e) {
      // No decay definition: final
      if (logger.isTraceEnabled()) {
        logger.trace("No decays for " + particle + ", treated as final");
      }
      return Product.leaf(particle);
    }
  }
}
