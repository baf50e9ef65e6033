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

import java.util.List;
import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * One decay mode of a mother particle, i.e. one line of a
 * Decay ... Enddecay block:
 * <pre>
 *   bf  fs1 fs2 ... [PHOTOS] MODEL  p1 p2 ... ;
 * </pre>
 * The order of final-state particles matters, model parameters refer to
 * them by position.
 */
public class DecayMode {
  private final double branchingFraction;
  private final ImmutableList<String> finalState;
  private final String model;
  private final ImmutableList<Double> modelParameters;
  private final boolean photos;

  public DecayMode(double branchingFraction, List<String> finalState,
                   String model, List<Double> modelParameters) {
    this(branchingFraction, finalState, model, modelParameters, false);
  }

  public DecayMode(double branchingFraction, List<String> finalState,
                   String model, List<Double> modelParameters,
                   boolean photos) {
    this.branchingFraction = branchingFraction;
    this.finalState = ImmutableList.copyOf(finalState);
    this.model = model == null ? "" : model;
    this.modelParameters = ImmutableList.copyOf(modelParameters);
    this.photos = photos;
  }

  public double branchingFraction() {
    return branchingFraction;
  }

  public List<String> finalState() {
    return finalState;
  }

  /**
   * @return the model name, empty if none
   */
  public String model() {
    return model;
  }

  /**
   * @return the model parameters, empty if none
   */
  public List<Double> modelParameters() {
    return modelParameters;
  }

  /**
   * @return true if the line carries the PHOTOS marker
   */
  public boolean photos() {
    return photos;
  }

  /**
   * One line per mode, columns aligned for printing a whole decay
   */
  public String format() {
    return String.format(Locale.ROOT, "%12g : %50s %15s %s",
            branchingFraction, StringUtils.join(finalState, "  "),
            photos ? "PHOTOS " + model : model, modelParameters);
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
    result = prime * result + (photos ? 1231 : 1237);
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    DecayMode other = (DecayMode) obj;
    if (Double.doubleToLongBits(branchingFraction) !=
        Double.doubleToLongBits(other.branchingFraction))
      return false;
    return finalState.equals(other.finalState) &&
           model.equals(other.model) &&
           modelParameters.equals(other.modelParameters) &&
           photos == other.photos;
  }

  @Override
  public String toString() {
    return "(" + branchingFraction + ", " + finalState + ", '" + model +
           "', " + modelParameters + (photos ? ", PHOTOS" : "") + ")";
  }
}
