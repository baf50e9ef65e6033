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

import com.google.common.collect.ImmutableList;

import hep.dec.ast.DecAST;
import hep.dec.common.exceptions.DecayNotFoundException;
import hep.dec.common.lang.DecayMode;
import hep.dec.common.lang.PhotosFlag;

/**
 * Result of parsing one decay file: the syntax tree plus the list of
 * decays after duplicate removal and charge-conjugate expansion.
 * Not modified after construction.
 */
public class ParsedDecFile {

  private final String fileName;
  private final DecAST root;
  private final ImmutableList<DecAST> decays;
  private final Map<String, DecAST> decaysByMother;
  private final PhotosFlag photos;
  private final boolean includesChargeConjugates;
  private final Map<String, Double> definitions;
  private final ImmutableList<String> diagnostics;

  public ParsedDecFile(String fileName, DecAST root, List<DecAST> decays,
                       PhotosFlag photos, boolean includesChargeConjugates,
                       List<String> diagnostics) {
    this.fileName = fileName;
    this.root = root;
    this.decays = ImmutableList.copyOf(decays);
    this.photos = photos;
    this.includesChargeConjugates = includesChargeConjugates;
    this.definitions = Statements.definitions(root);
    this.diagnostics = ImmutableList.copyOf(diagnostics);

    this.decaysByMother = new LinkedHashMap<String, DecAST>();
    for (DecAST decay: decays) {
      String mother = Statements.motherName(decay);
      // Duplicates are removed beforehand, keep first anyway
      if (!decaysByMother.containsKey(mother)) {
        decaysByMother.put(mother, decay);
      }
    }
  }

  public String fileName() {
    return fileName;
  }

  /**
   * @return tree as parsed, without synthesized charge-conjugate decays
   */
  public DecAST root() {
    return root;
  }

  /**
   * @return DECAY trees, declared ones first then the synthesized ones
   */
  public List<DecAST> decays() {
    return decays;
  }

  public int numberOfDecays() {
    return decays.size();
  }

  public List<String> motherNames() {
    return new ArrayList<String>(decaysByMother.keySet());
  }

  public DecAST findDecay(String mother) throws DecayNotFoundException {
    DecAST decay = decaysByMother.get(mother);
    if (decay == null) {
      throw new DecayNotFoundException(mother);
    }
    return decay;
  }

  public List<DecayMode> decayModes(String mother)
                                    throws DecayNotFoundException {
    DecAST decay = findDecay(mother);
    List<DecayMode> modes = new ArrayList<DecayMode>();
    for (DecAST line: Statements.decayLines(decay)) {
      modes.add(Statements.decayMode(line, definitions));
    }
    return modes;
  }

  public PhotosFlag globalPhotosFlag() {
    return photos;
  }

  public boolean includesChargeConjugates() {
    return includesChargeConjugates;
  }

  public Map<String, Double> definitions() {
    return new LinkedHashMap<String, Double>(definitions);
  }

  /**
   * @return warnings issued while parsing, in order
   */
  public List<String> diagnostics() {
    return diagnostics;
  }
}
