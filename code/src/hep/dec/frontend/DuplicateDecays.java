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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.LinkedHashMultiset;
import com.google.common.collect.Multiset;

import hep.dec.ast.DecAST;

/**
 * Removes redefinitions of the same mother particle with 'Decay'.
 * Such files are buggy; the first definition wins.
 */
public class DuplicateDecays {

  /**
   * @param decays DECAY trees in file order
   * @param diag receives one warning naming all redefined particles
   * @return new list without duplicates, first occurrences in file order
   */
  public static List<DecAST> removeDuplicates(List<DecAST> decays,
                                              Diagnostics diag) {
    Multiset<String> counts = LinkedHashMultiset.create();
    for (DecAST decay: decays) {
      counts.add(Statements.motherName(decay));
    }

    List<String> duplicates = new ArrayList<String>();
    for (Multiset.Entry<String> e: counts.entrySet()) {
      if (e.getCount() > 1) {
        duplicates.add(e.getElement());
      }
    }

    if (duplicates.isEmpty()) {
      return new ArrayList<DecAST>(decays);
    }

    diag.warn("The following particle(s) is(are) redefined in the input " +
        ".dec file with 'Decay': " + StringUtils.join(duplicates, ", ") +
        "! All but the first occurrence will be discarded/removed ...");

    List<DecAST> result = new ArrayList<DecAST>(counts.elementSet().size());
    Set<String> seen = new HashSet<String>();
    for (DecAST decay: decays) {
      if (seen.add(Statements.motherName(decay))) {
        result.add(decay);
      }
    }
    return result;
  }
}
