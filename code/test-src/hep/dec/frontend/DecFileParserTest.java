package hep.dec.frontend;

import static hep.dec.ast.TreeFixtures.decFile;
import static hep.dec.ast.TreeFixtures.decay;
import static hep.dec.ast.TreeFixtures.decayLine;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.FileNotFoundException;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import hep.dec.ast.DecAST;
import hep.dec.common.Logging;
import hep.dec.common.exceptions.DecFileNotParsedException;
import hep.dec.common.exceptions.DecayNotFoundException;
import hep.dec.common.exceptions.InvalidSyntaxException;
import hep.dec.common.lang.DecayChain;
import hep.dec.common.lang.DecayMode;
import hep.dec.common.lang.PhotosFlag;
import hep.dec.particle.ParticleTable;

public class DecFileParserTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static final String D0_AND_CDECAY =
      "Decay D0\n" +
      "1.0   K-  pi+   PHSP;\n" +
      "Enddecay\n" +
      "CDecay anti-D0\n";

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/DecFileParserTest.dec.log", true);
  }

  private static boolean containsMessage(List<String> messages, String part) {
    for (String msg: messages) {
      if (msg.contains(part)) {
        return true;
      }
    }
    return false;
  }

  @Test
  public void testUnknownFile() throws Exception {
    exception.expect(FileNotFoundException.class);
    DecFileParser.fromFile("non-existent.dec");
  }

  @Test
  public void testNotParsed() throws Exception {
    DecFileParser p = DecFileParser.fromFile(DecFiles.path(DecFiles.DST));
    exception.expect(DecFileNotParsedException.class);
    exception.expectMessage("Hint: call 'parse()'!");
    p.listDecayMotherNames();
  }

  @Test
  public void testNonExistentDecay() throws Exception {
    DecFileParser p = DecFiles.parsed(DecFiles.DST);
    exception.expect(DecayNotFoundException.class);
    p.listDecayModes("XYZ");
  }

  @Test
  public void testStringRepresentation() throws Exception {
    String path = DecFiles.path(DecFiles.DST);
    DecFileParser p = DecFileParser.fromFile(path);
    assertEquals("<DecFileParser: decfile='" + path + "'>", p.toString());

    p.parse();
    assertEquals("<DecFileParser: decfile='" + path + "', n_decays=5>",
                 p.toString());
  }

  @Test
  public void testDefaultSyntax() throws Exception {
    DecFileParser p = DecFileParser.fromFile(DecFiles.path(DecFiles.DST));
    assertFalse(p.syntaxLoaded());
    assertTrue(p.syntax() instanceof AntlrDecSyntax);
    assertTrue(p.syntaxLoaded());
  }

  @Test
  public void testCustomSyntax() throws Exception {
    DecFileParser p = DecFileParser.fromString("ignored");
    p.setSyntax(new DecSyntax() {
      @Override
      public DecAST parse(String inputName, String text) {
        return decFile(decay("pi0", decayLine("1.0", "PHSP", "gamma", "gamma")));
      }
    });
    assertTrue(p.syntaxLoaded());
    p.parse();
    assertEquals(Arrays.asList("pi0"), p.listDecayMotherNames());
  }

  @Test
  public void testSimpleDec() throws Exception {
    DecFileParser p = DecFiles.parsed(DecFiles.DST);

    assertEquals(Arrays.asList("D*+", "D*-", "D0", "D+", "pi0"),
                 p.listDecayMotherNames());
    assertEquals(Arrays.asList(Arrays.asList("K-", "pi+")),
                 p.listDecayModes("D0"));
    assertEquals(PhotosFlag.DISABLED, p.globalPhotosFlag());
    assertTrue(p.diagnostics().isEmpty());
  }

  @Test
  public void testDecayModeDetails() throws Exception {
    DecFileParser p = DecFiles.parsed(DecFiles.DST);
    DecayMode expected = new DecayMode(1.0,
        Arrays.asList("K-", "pi+", "pi+", "pi0"), "PHSP",
        Collections.<Double>emptyList());
    assertEquals(expected, p.decayModeDetails("D+").get(0));
  }

  @Test
  public void testPrintDecayModes() throws Exception {
    DecFileParser p = DecFiles.parsed(DecFiles.DST);
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(bytes, true, "UTF-8");
    p.printDecayModes("pi0", out);

    String[] lines = bytes.toString("UTF-8").trim().split("\\r?\\n");
    assertEquals(4, lines.length);
    assertTrue(lines[1], lines[1].contains("PI0_DALITZ"));
    assertTrue(lines[1], lines[1].contains("e+  e-  gamma"));
  }

  @Test
  public void testDuplicateDecayDefinitions() throws Exception {
    DecFileParser p = DecFiles.parsed(DecFiles.DUPLICATES);

    assertEquals(2, p.numberOfDecays());
    assertEquals(Arrays.asList("Sigma(1775)0", "anti-Sigma(1775)0"),
                 p.listDecayMotherNames());
    assertEquals("First definition wins",
        Arrays.asList(Arrays.asList("Sigma0", "pi0"),
                      Arrays.asList("Lambda0", "pi0")),
        p.listDecayModes("Sigma(1775)0"));
    assertTrue(containsMessage(p.diagnostics(),
                               "redefined in the input .dec file"));
  }

  @Test
  public void testDefinitionsAndFriends() throws Exception {
    DecFileParser p = DecFiles.parsed(DecFiles.DEFS);

    assertEquals(5, p.dictDefinitions().size());
    assertEquals(5, p.dictAliases().size());
    assertEquals(2, p.dictChargeConjugates().size());
    assertEquals(4, p.dictPythiaDefinitions().size());
    assertEquals("off", p.dictPythiaDefinitions().get("ParticleDecays:mixB"));
    assertEquals(3, p.listLineshapeDefinitions().size());
    assertEquals(PhotosFlag.ENABLED, p.globalPhotosFlag());
    assertTrue(containsMessage(p.diagnostics(), "PHOTOS flag re-set!"));
  }

  @Test
  public void testChargeConjugateDecayFromAlias() throws Exception {
    DecFileParser p = DecFiles.parsed(DecFiles.DEFS);

    assertEquals(Arrays.asList("B0", "B_s0", "MyD0", "MyAnti-D0"),
                 p.listDecayMotherNames());

    List<DecayMode> modes = p.decayModeDetails("MyAnti-D0");
    assertEquals(2, modes.size());
    assertEquals(Arrays.asList("K+", "pi-"), modes.get(0).finalState());
    assertEquals(Arrays.asList("K+", "e-", "anti-nu_e"),
                 modes.get(1).finalState());
    assertEquals("ISGW2", modes.get(1).model());
    assertEquals(0.1, modes.get(1).branchingFraction(), 0.0);

    // Source decay untouched
    assertEquals(Arrays.asList("K-", "pi+"),
                 p.listDecayModes("MyD0").get(0));
  }

  @Test
  public void testPhotosMarkerPerDecayMode() throws Exception {
    DecFileParser p = DecFiles.parsed(DecFiles.DEFS);

    for (DecayMode mode: p.decayModeDetails("MyD0")) {
      assertTrue(mode.toString(), mode.photos());
    }
    assertFalse(p.decayModeDetails("B0").get(0).photos());
    // Kept on the charge conjugate copy
    assertTrue(p.decayModeDetails("MyAnti-D0").get(0).photos());
  }

  @Test
  public void testListChargeConjugateDecays() throws Exception {
    DecFileParser p = DecFiles.parsed(DecFiles.BD2DMTAUNU);
    assertEquals(Arrays.asList("MyD+", "MyTau+", "Mya_1-", "anti-B0sig"),
                 p.listChargeConjugateDecays());
  }

  @Test
  public void testChargeConjugateDecaysCreated() throws Exception {
    DecFileParser p = DecFiles.parsed(DecFiles.BD2DMTAUNU);

    assertEquals(8, p.numberOfDecays());
    assertEquals(Arrays.asList("B0sig", "MyD-", "MyTau-", "Mya_1+",
                               "MyD+", "MyTau+", "Mya_1-", "anti-B0sig"),
                 p.listDecayMotherNames());
    assertEquals(Arrays.asList(Arrays.asList("MyD+", "MyTau-", "anti-nu_tau")),
                 p.listDecayModes("anti-B0sig"));
    assertEquals(Arrays.asList(Arrays.asList("Mya_1+", "pi0"),
                               Arrays.asList("pi+", "pi+", "pi-", "pi0")),
                 p.listDecayModes("MyD+"));
    assertEquals(Arrays.asList(Arrays.asList("mu+", "nu_mu", "anti-nu_tau")),
                 p.listDecayModes("MyTau+"));
    assertEquals("Model parameters kept",
        Arrays.asList(1.0, 0.0, 0.0, 0.0, 0.0, 0.0),
        p.decayModeDetails("Mya_1-").get(0).modelParameters());
  }

  @Test
  public void testChargeConjugateDecayChain() throws Exception {
    DecFileParser p = DecFiles.parsed(DecFiles.BD2DMTAUNU);
    DecayChain chain = p.buildDecayChain("anti-B0sig",
                                         Arrays.asList("pi0"));
    // anti-B0sig -> MyD+ -> Mya_1+ -> rho0 pi+
    assertEquals(3, chain.depth());
    DecayChain myDplus = chain.modes().get(0).finalState().get(0).chain();
    assertEquals("MyD+", myDplus.mother());
    assertEquals("pi0",
                 myDplus.modes().get(0).finalState().get(1).name());
  }

  @Test
  public void testWithoutChargeConjugates() throws Exception {
    DecFileParser p = DecFileParser.fromFile(
                             DecFiles.path(DecFiles.BD2DMTAUNU));
    p.parse(false);
    assertEquals(4, p.numberOfDecays());
    assertFalse(p.parsedFile().includesChargeConjugates());

    exception.expect(DecayNotFoundException.class);
    p.listDecayModes("MyD+");
  }

  @Test
  public void testNoCDecayStatements() throws Exception {
    // anti-D0 and D- have no decays: the file is incomplete but no
    // charge conjugates are made up without CDecay
    DecFileParser p = DecFiles.parsed(DecFiles.DST);
    assertEquals(5, p.numberOfDecays());
  }

  @Test
  public void testDecayAndCDecayCollision() throws Exception {
    DecFileParser p = DecFileParser.fromString(D0_AND_CDECAY +
        "Decay anti-D0\n" +
        "0.5   K+  pi-        PHSP;\n" +
        "0.5   K+  pi-  pi0   PHSP;\n" +
        "Enddecay\n");
    p.parse();

    assertEquals(2, p.numberOfDecays());
    assertEquals("Explicit Decay kept", 2, p.listDecayModes("anti-D0").size());
    assertTrue(containsMessage(p.diagnostics(),
                   "both 'Decay' and 'CDecay': anti-D0!"));
  }

  @Test
  public void testCDecayWithoutSource() throws Exception {
    DecFileParser p = DecFileParser.fromString(D0_AND_CDECAY +
                                               "CDecay anti-B0\n");
    p.parse();

    assertEquals(Arrays.asList("D0", "anti-D0"), p.listDecayMotherNames());
    assertTrue(containsMessage(p.diagnostics(), "No 'Decay' of 'B0'"));
  }

  @Test
  public void testCustomParticleDatabase() throws Exception {
    Map<String, String> table = new HashMap<String, String>();
    table.put("D0", "anti-D0");
    table.put("anti-D0", "D0");
    table.put("K-", "K+");

    DecFileParser p = DecFileParser.fromString(D0_AND_CDECAY);
    p.setParticleDatabase(new ParticleTable(table));
    p.parse();

    assertEquals(Arrays.asList(Arrays.asList("K+", "ChargeConj(pi+)")),
                 p.listDecayModes("anti-D0"));
  }

  @Test
  public void testReparse() throws Exception {
    DecFileParser p = DecFileParser.fromString(D0_AND_CDECAY);
    ParsedDecFile first = p.parse();
    assertEquals(2, first.numberOfDecays());
    assertFalse(containsMessage(first.diagnostics(), "re-parsed"));

    ParsedDecFile second = p.parse(false);
    assertEquals(1, second.numberOfDecays());
    assertEquals(1, p.numberOfDecays());
    assertTrue(containsMessage(second.diagnostics(),
                               "Input file being re-parsed ..."));
    assertEquals("Earlier result unchanged", 2, first.numberOfDecays());
  }

  @Test
  public void testSyntaxError() throws Exception {
    DecFileParser p = DecFileParser.fromString("Decay D0\n1.0 K- pi+;\n");
    exception.expect(InvalidSyntaxException.class);
    p.parse();
  }
}
