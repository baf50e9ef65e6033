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
package hep.dec.ui;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

import hep.dec.common.exceptions.DecayNotFoundException;
import hep.dec.common.lang.DecayChain;
import hep.dec.common.lang.DecayChain.Mode;
import hep.dec.common.lang.DecayChain.Product;
import hep.dec.frontend.DecFileParser;

/**
 * Text output of the command line tool
 */
public class DecReport {

  private static final int INDENT = 2;

  /**
   * Overview of a parsed file: mothers, counts and any warnings
   */
  public static void summary(DecFileParser parser, PrintStream out) {
    out.println(parser);
    List<String> mothers = parser.listDecayMotherNames();
    out.println("Decays (" + mothers.size() + "): " +
                StringUtils.join(mothers, " "));

    List<String> cdecays = parser.listChargeConjugateDecays();
    if (!cdecays.isEmpty()) {
      out.println("CDecay statements (" + cdecays.size() + "): " +
                  StringUtils.join(cdecays, " "));
    }
    out.println("Definitions: " + parser.dictDefinitions().size() +
                ", aliases: " + parser.dictAliases().size() +
                ", charge conjugate pairs: " +
                parser.dictChargeConjugates().size());
    out.println("Global PHOTOS flag: " + parser.globalPhotosFlag());

    List<String> diagnostics = parser.diagnostics();
    if (!diagnostics.isEmpty()) {
      out.println("Warnings:");
      for (String msg: diagnostics) {
        out.println("  " + msg);
      }
    }
  }

  public static void modes(DecFileParser parser, String mother,
                           PrintStream out) throws DecayNotFoundException {
    out.println("Decay modes of " + mother + ":");
    parser.printDecayModes(mother, out);
  }

  /**
   * Print a chain as an indented tree, e.g.
   * <pre>
   * D+
   *   1.00000 : K- pi+ pi+ pi0 (PHSP)
   *     pi0
   *       0.988228 : gamma gamma (PHSP)
   * </pre>
   */
  public static void chain(DecayChain chain, PrintStream out) {
    chain(chain, out, 0);
  }

  private static void chain(DecayChain chain, PrintStream out, int indent) {
    out.println(StringUtils.repeat(' ', indent) + chain.mother());
    for (Mode mode: chain.modes()) {
      StringBuilder line = new StringBuilder();
      line.append(StringUtils.repeat(' ', indent + INDENT));
      line.append(String.format(Locale.ROOT, "%g :",
                                mode.branchingFraction()));
      for (Product p: mode.finalState()) {
        line.append(' ').append(p.name());
      }
      if (mode.model().length() > 0) {
        line.append(" (").append(mode.model());
        if (!mode.modelParameters().isEmpty()) {
          line.append(' ').append(StringUtils.join(mode.modelParameters(), ' '));
        }
        line.append(')');
      }
      out.println(line);

      for (Product p: mode.finalState()) {
        if (!p.isLeaf()) {
          chain(p.chain(), out, indent + 2 * INDENT);
        }
      }
    }
  }
}
