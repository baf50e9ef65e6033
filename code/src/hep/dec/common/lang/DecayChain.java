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
package hep.dec.common.lang;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;

/**
 * The decay chain of a mother particle: all its decay modes, where each
 * final-state particle is either a plain name or, if it decays further,
 * the decay chain of that particle.
 */
public class DecayChain {

  public static final String BF_KEY = "bf";
  public static final String FS_KEY = "fs";
  public static final String MODEL_KEY = "m";
  public static final String PARAMS_KEY = "mp";

  private final String mother;
  private final ImmutableList<Mode> modes;

  public DecayChain(String mother, List<Mode> modes) {
    this.mother = mother;
    this.modes = ImmutableList.copyOf(modes);
  }

  public String mother() {
    return mother;
  }

  public List<Mode> modes() {
    return modes;
  }

  /**
   * @return 1 if no final-state particle is expanded further
   */
  public int depth() {
    int maxNested = 0;
    for (Mode mode: modes) {
      for (Product p: mode.finalState()) {
        if (!p.isLeaf()) {
          maxNested = Math.max(maxNested, p.chain().depth());
        }
      }
    }
    return 1 + maxNested;
  }

  /**
   * Nested map representation:
   * {mother: [{bf: Double, fs: [String or Map], m: String, mp: [Double]}]}
   */
  public Map<String, Object> toMap() {
    List<Map<String, Object>> modeMaps = new ArrayList<Map<String, Object>>();
    for (Mode mode: modes) {
      modeMaps.add(mode.toMap());
    }
    Map<String, Object> result = new LinkedHashMap<String, Object>();
    result.put(mother, modeMaps);
    return result;
  }

  @Override
  public int hashCode() {
    return 31 * mother.hashCode() + modes.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    DecayChain other = (DecayChain) obj;
    return mother.equals(other.mother) && modes.equals(other.modes);
  }

  @Override
  public String toString() {
    return toMap().toString();
  }

  /**
   * One decay mode within a chain
   */
  public static class Mode {
    private final double branchingFraction;
    private final ImmutableList<Product> finalState;
    private final String model;
    private final ImmutableList<Double> modelParameters;

    public Mode(double branchingFraction, List<Product> finalState,
                String model, List<Double> modelParameters) {
      this.branchingFraction = branchingFraction;
      this.finalState = ImmutableList.copyOf(finalState);
      this.model = model;
      this.modelParameters = ImmutableList.copyOf(modelParameters);
    }

    public double branchingFraction() {
      return branchingFraction;
    }

    public List<Product> finalState() {
      return finalState;
    }

    public String model() {
      return model;
    }

    public List<Double> modelParameters() {
      return modelParameters;
    }

    public Map<String, Object> toMap() {
      List<Object> fs = new ArrayList<Object>(finalState.size());
      for (Product p: finalState) {
        fs.add(p.isLeaf() ? p.name() : p.chain().toMap());
      }
      Map<String, Object> result = new LinkedHashMap<String, Object>();
      result.put(BF_KEY, branchingFraction);
      result.put(FS_KEY, fs);
      result.put(MODEL_KEY, model);
      result.put(PARAMS_KEY, Collections.unmodifiableList(modelParameters));
      return result;
    }

    @Override
    public int hashCode() {
      final int prime = 31;
      int result = 1;
      long temp = Double.doubleToLongBits(branchingFraction);
      result = prime * result + (int) (temp ^ (temp >>> 32));
      result = prime * result + finalState.hashCode();
      result = prime * result + model.hashCode();
      result = prime * result + modelParameters.hashCode();
      return result;
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj)
        return true;
      if (obj == null || getClass() != obj.getClass())
        return false;
      Mode other = (Mode) obj;
      return Double.doubleToLongBits(branchingFraction) ==
                 Double.doubleToLongBits(other.branchingFraction) &&
             finalState.equals(other.finalState) &&
             model.equals(other.model) &&
             modelParameters.equals(other.modelParameters);
    }

    @Override
    public String toString() {
      return toMap().toString();
    }
  }

  /**
   * A final-state entry: a particle name, or the chain of a particle
   * that decays further.
   */
  public static class Product {
    private final String name;
    private final DecayChain chain;

    private Product(String name, DecayChain chain) {
      this.name = name;
      this.chain = chain;
    }

    public static Product leaf(String name) {
      return new Product(name, null);
    }

    public static Product nested(DecayChain chain) {
      return new Product(chain.mother(), chain);
    }

    public boolean isLeaf() {
      return chain == null;
    }

    /**
     * @return particle name, for nested products the chain's mother
     */
    public String name() {
      return name;
    }

    /**
     * @return the nested chain, null for a leaf
     */
    public DecayChain chain() {
      return chain;
    }

    @Override
    public int hashCode() {
      return 31 * name.hashCode() + (chain == null ? 0 : chain.hashCode());
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj)
        return true;
      if (obj == null || getClass() != obj.getClass())
        return false;
      Product other = (Product) obj;
      if (!name.equals(other.name))
        return false;
      return chain == null ? other.chain == null : chain.equals(other.chain);
    }

    @Override
    public String toString() {
      return isLeaf() ? name : chain.toString();
    }
  }
}
