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

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import hep.dec.ast.DecAST;
import hep.dec.common.Logging;
import hep.dec.common.Settings;
import hep.dec.common.exceptions.CyclicDecayChainException;
import hep.dec.common.exceptions.DecFileNotParsedException;
import hep.dec.common.exceptions.DecRuntimeError;
import hep.dec.common.exceptions.DecayNotFoundException;
import hep.dec.common.exceptions.InvalidOptionException;
import hep.dec.common.exceptions.InvalidSyntaxException;
import hep.dec.common.lang.DecayChain;
import hep.dec.common.lang.DecayMode;
import hep.dec.common.lang.LineshapeDef;
import hep.dec.common.lang.PhotosFlag;
import hep.dec.particle.ParticleDatabase;
import hep.dec.particle.ParticleTable;

/**
 * Parses a .dec decay file and answers queries about it.
 *
 * Usage:
 * <pre>
 *   DecFileParser p = DecFileParser.fromFile("my-decay-file.dec");
 *   p.parse();
 *   p.listDecayModes("pi0");
 * </pre>
 * All queries throw DecFileNotParsedException until parse() was called.
 */
public class DecFileParser {

  private static final Logger logger = Logging.getDecLogger();

  public static final String STRING_INPUT_NAME = "<string>";

  private final String fileName;

  /** Input text, if not read from fileName */
  private final String text;

  private DecSyntax syntax = null;
  private ParticleDatabase particleDb = null;

  /** Null until parsed */
  private ParsedDecFile parsed = null;

  public DecFileParser(String fileName) {
    this(fileName, null);
  }

  private DecFileParser(String fileName, String text) {
    this.fileName = fileName;
    this.text = text;
  }

  /**
   * @throws FileNotFoundException if the file does not exist
   */
  public static DecFileParser fromFile(String fileName)
                                    throws FileNotFoundException {
    if (!new File(fileName).exists()) {
      throw new FileNotFoundException("'" + fileName + "'!");
    }
    return new DecFileParser(fileName);
  }

  public static DecFileParser fromString(String text) {
    return new DecFileParser(STRING_INPUT_NAME, text);
  }

  public String fileName() {
    return fileName;
  }

  /**
   * Replace the syntax front end, by default the ANTLR grammar
   */
  public void setSyntax(DecSyntax syntax) {
    this.syntax = syntax;
  }

  public DecSyntax syntax() {
    if (syntax == null) {
      syntax = new AntlrDecSyntax();
    }
    return syntax;
  }

  public boolean syntaxLoaded() {
    return syntax != null;
  }

  /**
   * Replace the particle database, by default the table selected with
   * the dec.particle-table setting
   */
  public void setParticleDatabase(ParticleDatabase particleDb) {
    this.particleDb = particleDb;
  }

  private ParticleDatabase particleDatabase() throws IOException {
    if (particleDb == null) {
      particleDb = ParticleTable.load();
    }
    return particleDb;
  }

  /**
   * Parse, expanding "CDecay" statements unless dec.include-cc-decays is
   * false
   */
  public ParsedDecFile parse() throws IOException, InvalidSyntaxException {
    return parse(booleanSetting(Settings.INCLUDE_CC_DECAYS));
  }

  /**
   * Parse the input.  Calling this again re-parses and replaces all state.
   * @param includeChargeConjugates if false, "CDecay" statements are
   *        ignored and the decay list is incomplete
   */
  public ParsedDecFile parse(boolean includeChargeConjugates)
                            throws IOException, InvalidSyntaxException {
    Diagnostics diag = new Diagnostics(logger);
    if (parsed != null) {
      diag.warn("Input file being re-parsed ...");
    }

    String input = text;
    if (input == null) {
      input = FileUtils.readFileToString(new File(fileName), "UTF-8");
    }
    DecAST root = syntax().parse(fileName, input);

    List<DecAST> decays = DuplicateDecays.removeDuplicates(
                                      Statements.decays(root), diag);
    PhotosFlag photos = Statements.globalPhotosFlag(root, diag);

    if (includeChargeConjugates) {
      ChargeConjugates conjugates = new ChargeConjugates(
          Statements.chargeConjugateDefs(root), particleDatabase());
      decays.addAll(chargeConjugateDecays(root, decays, conjugates, diag));
    }

    parsed = new ParsedDecFile(fileName, root, decays, photos,
                               includeChargeConjugates, diag.messages());
    logger.debug("Parsed " + fileName + ": " + parsed.numberOfDecays() +
                 " decays");
    return parsed;
  }

  /**
   * Create the decays requested with "CDecay MOTHER" by cloning the
   * decay of the charge conjugate of MOTHER and conjugating every particle
   * in the clone.  Requests for particles that already have a "Decay"
   * are ignored.
   * @param root syntax tree of the file
   * @param decays declared decays, without duplicates
   * @return new DECAY trees, in request order
   */
  public static List<DecAST> chargeConjugateDecays(DecAST root,
          List<DecAST> decays, ChargeConjugates conjugates,
          Diagnostics diag) {
    Set<String> requested = new LinkedHashSet<String>(
                                  Statements.chargeConjugateDecays(root));
    if (requested.isEmpty()) {
      return Collections.emptyList();
    }

    Map<String, DecAST> declared = new LinkedHashMap<String, DecAST>();
    for (DecAST decay: decays) {
      String mother = Statements.motherName(decay);
      if (!declared.containsKey(mother)) {
        declared.put(mother, decay);
      }
    }

    List<String> collisions = new ArrayList<String>();
    for (String name: requested) {
      if (declared.containsKey(name)) {
        collisions.add(name);
      }
    }
    if (!collisions.isEmpty()) {
      diag.warn("The following particles are defined in the input .dec " +
          "file with both 'Decay' and 'CDecay': " +
          StringUtils.join(collisions, ", ") +
          "! The 'CDecay' definition(s) will be ignored ...");
      requested.removeAll(collisions);
    }

    ChargeConjugateReplacement replacement =
                          new ChargeConjugateReplacement(conjugates);
    List<DecAST> result = new ArrayList<DecAST>(requested.size());
    for (String ccName: requested) {
      String name = conjugates.conjugate(ccName);
      DecAST source = declared.get(name);
      if (source == null) {
        diag.warn("No 'Decay' of '" + name + "' found to create 'CDecay " +
                  ccName + "' from, skipping ...");
        continue;
      }

      DecAST clone = replacement.apply(source.deepCopy());
      DecAST motherLabel = clone.child(0).child(0);
      if (!motherLabel.getText().equals(ccName)) {
        diag.warn("Charge conjugate of '" + name + "' resolved to '" +
                  motherLabel.getText() + "', renamed to '" + ccName +
                  "' as requested by 'CDecay'");
        motherLabel.setText(ccName);
      }
      result.add(clone);
    }
    return result;
  }

  /**
   * @return the parse result
   * @throws DecFileNotParsedException if parse() was not called yet
   */
  public ParsedDecFile parsedFile() {
    if (parsed == null) {
      throw new DecFileNotParsedException("Hint: call 'parse()'!");
    }
    return parsed;
  }

  public int numberOfDecays() {
    return parsedFile().numberOfDecays();
  }

  public List<String> listDecayMotherNames() {
    return parsedFile().motherNames();
  }

  /**
   * @return final-state particle names of each decay mode of mother
   */
  public List<List<String>> listDecayModes(String mother)
                                       throws DecayNotFoundException {
    List<List<String>> result = new ArrayList<List<String>>();
    for (DecayMode mode: parsedFile().decayModes(mother)) {
      result.add(mode.finalState());
    }
    return result;
  }

  public List<DecayMode> decayModeDetails(String mother)
                                       throws DecayNotFoundException {
    return parsedFile().decayModes(mother);
  }

  /**
   * Print one line per decay mode of mother
   */
  public void printDecayModes(String mother, PrintStream out)
                                       throws DecayNotFoundException {
    for (DecayMode mode: parsedFile().decayModes(mother)) {
      out.println(mode.format());
    }
  }

  public DecayChain buildDecayChain(String mother)
          throws DecayNotFoundException, CyclicDecayChainException {
    return buildDecayChain(mother, Collections.<String>emptyList());
  }

  /**
   * @param stable particles not to expand further
   */
  public DecayChain buildDecayChain(String mother, Collection<String> stable)
          throws DecayNotFoundException, CyclicDecayChainException {
    DecayChainBuilder builder = new DecayChainBuilder(parsedFile(),
                                   booleanSetting(Settings.DETECT_CYCLES));
    return builder.build(mother, stable);
  }

  public Map<String, Double> dictDefinitions() {
    return Statements.definitions(parsedFile().root());
  }

  public Map<String, String> dictAliases() {
    return Statements.aliases(parsedFile().root());
  }

  public Map<String, String> dictChargeConjugates() {
    return Statements.chargeConjugateDefs(parsedFile().root());
  }

  public Map<String, Object> dictPythiaDefinitions() {
    return Statements.pythiaDefinitions(parsedFile().root());
  }

  public List<LineshapeDef> listLineshapeDefinitions() {
    return Statements.lineshapeDefinitions(parsedFile().root());
  }

  public PhotosFlag globalPhotosFlag() {
    return parsedFile().globalPhotosFlag();
  }

  public List<String> listChargeConjugateDecays() {
    return Statements.chargeConjugateDecays(parsedFile().root());
  }

  public List<String> diagnostics() {
    return parsedFile().diagnostics();
  }

  private static boolean booleanSetting(String key) {
    try {
      return Settings.getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new DecRuntimeError("Invalid setting " + key, e);
    }
  }

  @Override
  public String toString() {
    if (parsed == null) {
      return "<DecFileParser: decfile='" + fileName + "'>";
    } else {
      return "<DecFileParser: decfile='" + fileName + "', n_decays=" +
             parsed.numberOfDecays() + ">";
    }
  }
}
