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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import hep.dec.ast.DecAST;
import hep.dec.ast.antlr.EvtDecParser;
import hep.dec.common.Logging;
import hep.dec.common.exceptions.MalformedTreeException;
import hep.dec.common.lang.DecayMode;
import hep.dec.common.lang.LineshapeDef;
import hep.dec.common.lang.PhotosFlag;

/**
 * Read-only queries extracting each kind of statement from a decay file
 * syntax tree.  None of these modify the tree.  A tree without the
 * expected shape raises MalformedTreeException.
 */
public class Statements {

  /**
   * "Define NAME VALUE" statements, as {NAME: VALUE}
   */
  public static Map<String, Double> definitions(DecAST root) {
    checkRoot(root);
    Map<String, Double> result = new LinkedHashMap<String, Double>();
    for (DecAST def: root.findAll(EvtDecParser.DEFINE)) {
      checkChildCount(def, 2);
      result.put(leafText(def.child(0)), number(def.child(1)));
    }
    return result;
  }

  /**
   * "Alias NAME TARGET" statements, as {NAME: TARGET}
   */
  public static Map<String, String> aliases(DecAST root) {
    return particlePairs(root, EvtDecParser.ALIAS);
  }

  /**
   * "ChargeConj PARTICLE CC_PARTICLE" statements,
   * as {PARTICLE: CC_PARTICLE}, in file order
   */
  public static Map<String, String> chargeConjugateDefs(DecAST root) {
    return particlePairs(root, EvtDecParser.CHARGECONJ);
  }

  private static Map<String, String> particlePairs(DecAST root, int tag) {
    checkRoot(root);
    Map<String, String> result = new LinkedHashMap<String, String>();
    for (DecAST stmt: root.findAll(tag)) {
      checkChildCount(stmt, 2);
      result.put(particleName(stmt.child(0)), particleName(stmt.child(1)));
    }
    return result;
  }

  /**
   * "PythiaBothParam MODULE:PARAM=VALUE" statements (and the Generic and
   * Alias variants), as {"MODULE:PARAM": VALUE} where VALUE is a Double if
   * numeric, else the label as a String.
   */
  public static Map<String, Object> pythiaDefinitions(DecAST root) {
    checkRoot(root);
    Map<String, Object> result = new LinkedHashMap<String, Object>();
    for (DecAST def: root.findAll(EvtDecParser.PYTHIA_DEF)) {
      checkChildCount(def, 3);
      String key = leafText(def.child(0)) + ":" + leafText(def.child(1));
      DecAST setting = def.child(2);
      Object value;
      if (setting.getType() == EvtDecParser.NUMBER) {
        value = parseDouble(setting);
      } else {
        value = leafText(setting);
      }
      result.put(key, value);
    }
    return result;
  }

  /**
   * "SetLineshapePW MOTHER DAUGHTER1 DAUGHTER2 VALUE" statements
   */
  public static List<LineshapeDef> lineshapeDefinitions(DecAST root) {
    checkRoot(root);
    List<LineshapeDef> result = new ArrayList<LineshapeDef>();
    for (DecAST def: root.findAll(EvtDecParser.SETLSPW)) {
      checkChildCount(def, 4);
      DecAST valueTree = def.child(3);
      checkTag(valueTree, EvtDecParser.VALUE);
      String text = leafText(valueTree.child(0));
      int value;
      try {
        value = Integer.parseInt(text);
      } catch (NumberFormatException e) {
        throw new MalformedTreeException("SetLineshapePW value '" + text +
                                         "' is not an integer", e);
      }
      result.add(new LineshapeDef(particleName(def.child(0)),
                                  particleName(def.child(1)),
                                  particleName(def.child(2)), value));
    }
    return result;
  }

  public static PhotosFlag globalPhotosFlag(DecAST root) {
    return globalPhotosFlag(root, new Diagnostics(Logging.getDecLogger()));
  }

  /**
   * PHOTOS is turned on (off) for all decays with the global flag
   * yesPhotos (noPhotos).  If the flag is set more than once the last
   * one counts.
   * @return DISABLED if no flag is set
   */
  public static PhotosFlag globalPhotosFlag(DecAST root, Diagnostics diag) {
    checkRoot(root);
    List<DecAST> flags = root.findAll(EvtDecParser.GLOBAL_PHOTOS);
    if (flags.isEmpty()) {
      return PhotosFlag.DISABLED;
    } else if (flags.size() > 1) {
      diag.warn("PHOTOS flag re-set! Using flag set in last ...");
    }

    DecAST last = flags.get(flags.size() - 1);
    checkChildCount(last, 1);
    int val = last.child(0).getType();
    if (val == EvtDecParser.YES) {
      return PhotosFlag.ENABLED;
    } else if (val == EvtDecParser.NO) {
      return PhotosFlag.DISABLED;
    } else {
      throw new MalformedTreeException("Unexpected PHOTOS flag " +
                                       DecAST.tagName(val));
    }
  }

  /**
   * All "Decay MOTHER ... Enddecay" statements, in file order, duplicates
   * included.
   */
  public static List<DecAST> decays(DecAST root) {
    checkRoot(root);
    return root.findTopmost(EvtDecParser.DECAY);
  }

  /**
   * "CDecay MOTHER" statements, as a sorted list of MOTHER names
   */
  public static List<String> chargeConjugateDecays(DecAST root) {
    checkRoot(root);
    List<String> result = new ArrayList<String>();
    for (DecAST cdecay: root.findAll(EvtDecParser.CDECAY)) {
      checkChildCount(cdecay, 1);
      result.add(particleName(cdecay.child(0)));
    }
    Collections.sort(result);
    return result;
  }

  /**
   * @param decay a DECAY tree
   * @return name of the decaying particle
   */
  public static String motherName(DecAST decay) {
    checkTag(decay, EvtDecParser.DECAY);
    if (decay.childCount() < 1) {
      throw new MalformedTreeException("Decay statement without mother");
    }
    return particleName(decay.child(0));
  }

  /**
   * @param decay a DECAY tree
   * @return the DECAYLINE trees, one per decay mode
   */
  public static List<DecAST> decayLines(DecAST decay) {
    checkTag(decay, EvtDecParser.DECAY);
    List<DecAST> lines = new ArrayList<DecAST>();
    for (DecAST child: decay.children(1)) {
      checkTag(child, EvtDecParser.DECAYLINE);
      lines.add(child);
    }
    return lines;
  }

  public static double branchingFraction(DecAST decayLine) {
    checkTag(decayLine, EvtDecParser.DECAYLINE);
    if (decayLine.childCount() < 1 ||
        decayLine.child(0).getType() != EvtDecParser.VALUE) {
      throw new MalformedTreeException("Decay line does not start with a " +
                                       "branching fraction: " + decayLine.toStringTree());
    }
    return number(decayLine.child(0));
  }

  /**
   * @return the PARTICLE trees of a decay line, in order
   */
  public static List<DecAST> finalStateParticles(DecAST decayLine) {
    checkTag(decayLine, EvtDecParser.DECAYLINE);
    List<DecAST> result = new ArrayList<DecAST>();
    for (DecAST child: decayLine.children()) {
      if (child.getType() == EvtDecParser.PARTICLE) {
        result.add(child);
      }
    }
    return result;
  }

  /**
   * E.g. ['K+', 'K-'] for
   * <pre>1.000  K+  K-  SSD_CP 20.e12 0.1 1.0 0.04 9.6 -0.8 8.4 -0.6;</pre>
   */
  public static List<String> finalStateParticleNames(DecAST decayLine) {
    List<String> result = new ArrayList<String>();
    for (DecAST particle: finalStateParticles(decayLine)) {
      result.add(particleName(particle));
    }
    return result;
  }

  /**
   * @return model name, or "" if the line has none
   */
  public static String modelName(DecAST decayLine) {
    checkTag(decayLine, EvtDecParser.DECAYLINE);
    DecAST model = childWithTag(decayLine, EvtDecParser.MODEL);
    if (model == null) {
      return "";
    }
    checkChildCount(model, 1);
    return leafText(model.child(0));
  }

  public static boolean hasPhotos(DecAST decayLine) {
    checkTag(decayLine, EvtDecParser.DECAYLINE);
    return childWithTag(decayLine, EvtDecParser.PHOTOS) != null;
  }

  /**
   * Model parameters of a decay line.  Parameters given as labels are
   * looked up in the "Define" statements.
   * @param definitions result of definitions()
   * @return parameters in order, empty if there are none
   */
  public static List<Double> modelParameters(DecAST decayLine,
                                       Map<String, Double> definitions) {
    checkTag(decayLine, EvtDecParser.DECAYLINE);
    DecAST options = childWithTag(decayLine, EvtDecParser.MODEL_OPTIONS);
    if (options == null) {
      return Collections.emptyList();
    }
    List<Double> result = new ArrayList<Double>(options.childCount());
    for (DecAST option: options.children()) {
      if (option.getType() == EvtDecParser.VALUE) {
        result.add(number(option));
      } else if (option.getType() == EvtDecParser.LABEL) {
        Double defined = definitions.get(option.getText());
        if (defined == null) {
          throw new MalformedTreeException("Model parameter '" +
              option.getText() + "' is neither a number nor a defined name");
        }
        result.add(defined);
      } else {
        throw new MalformedTreeException("Unexpected model parameter node " +
                                         DecAST.tagName(option.getType()));
      }
    }
    return result;
  }

  public static DecayMode decayMode(DecAST decayLine,
                                    Map<String, Double> definitions) {
    return new DecayMode(branchingFraction(decayLine),
                         finalStateParticleNames(decayLine),
                         modelName(decayLine),
                         modelParameters(decayLine, definitions),
                         hasPhotos(decayLine));
  }

  /**
   * @param particle a PARTICLE tree
   * @return the particle name it holds
   */
  public static String particleName(DecAST particle) {
    checkTag(particle, EvtDecParser.PARTICLE);
    checkChildCount(particle, 1);
    return leafText(particle.child(0));
  }

  private static DecAST childWithTag(DecAST tree, int tag) {
    for (DecAST child: tree.children()) {
      if (child.getType() == tag) {
        return child;
      }
    }
    return null;
  }

  /**
   * @param value a VALUE tree
   */
  private static double number(DecAST value) {
    checkTag(value, EvtDecParser.VALUE);
    checkChildCount(value, 1);
    return parseDouble(value.child(0));
  }

  private static double parseDouble(DecAST leaf) {
    String text = leafText(leaf);
    try {
      return Double.parseDouble(text);
    } catch (NumberFormatException e) {
      throw new MalformedTreeException("'" + text + "' is not a number", e);
    }
  }

  private static String leafText(DecAST leaf) {
    if (leaf.childCount() != 0 || leaf.getText() == null) {
      throw new MalformedTreeException("Expected a leaf but got " +
                                       leaf.toStringTree());
    }
    return leaf.getText();
  }

  private static void checkRoot(DecAST root) {
    if (root == null) {
      throw new MalformedTreeException("Input not an instance of a tree!");
    }
    checkTag(root, EvtDecParser.DECFILE);
  }

  private static void checkTag(DecAST tree, int tag) {
    if (tree == null) {
      throw new MalformedTreeException("Expected a " + DecAST.tagName(tag) +
                                       " tree but got nothing");
    }
    if (tree.getType() != tag) {
      throw new MalformedTreeException("Input not an instance of a '" +
          DecAST.tagName(tag) + "' tree: " + DecAST.tagName(tree.getType()));
    }
  }

  private static void checkChildCount(DecAST tree, int count) {
    if (tree.childCount() < count) {
      throw new MalformedTreeException(DecAST.tagName(tree.getType()) +
          " tree does not seem to have the usual structure: expected " +
          count + " children but got " + tree.childCount());
    }
  }
}
