package hep.dec.frontend;

import static hep.dec.ast.TreeFixtures.decFile;
import static hep.dec.ast.TreeFixtures.decay;
import static hep.dec.ast.TreeFixtures.decayLine;
import static hep.dec.ast.TreeFixtures.particle;
import static hep.dec.ast.TreeFixtures.value;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import hep.dec.ast.DecAST;
import hep.dec.ast.antlr.EvtDecParser;
import hep.dec.common.Logging;
import hep.dec.common.exceptions.MalformedTreeException;
import hep.dec.common.lang.DecayMode;
import hep.dec.common.lang.LineshapeDef;
import hep.dec.common.lang.PhotosFlag;

public class StatementsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static DecAST defsTree;

  @BeforeClass
  public static void setup() throws Exception {
    Logging.setupLogging("target/StatementsTest.dec.log", true);
    defsTree = new AntlrDecSyntax().parse(DecFiles.DEFS,
                                     DecFiles.read(DecFiles.DEFS));
  }

  @Test
  public void testDefinitions() {
    Map<String, Double> defs = Statements.definitions(defsTree);
    assertEquals(Arrays.asList("dm", "beta", "alpha", "Apara", "Azero"),
                 Arrays.asList(defs.keySet().toArray()));
    assertEquals(0.507e12, defs.get("dm"), 0.0);
    assertEquals(1.365, defs.get("alpha"), 0.0);
  }

  @Test
  public void testAliases() {
    Map<String, String> aliases = Statements.aliases(defsTree);
    assertEquals(5, aliases.size());
    assertEquals("anti-K*0", aliases.get("MyAnti-K*0"));
    assertEquals("J/psi", aliases.get("MyJ/psi"));
  }

  @Test
  public void testChargeConjugateDefs() {
    Map<String, String> expected = new LinkedHashMap<String, String>();
    expected.put("MyD0", "MyAnti-D0");
    expected.put("MyK*0", "MyAnti-K*0");
    Map<String, String> actual = Statements.chargeConjugateDefs(defsTree);
    assertEquals(expected, actual);
    assertEquals("Declaration order kept",
        Arrays.asList("MyD0", "MyK*0"),
        Arrays.asList(actual.keySet().toArray()));
  }

  @Test
  public void testPythiaDefinitions() {
    Map<String, Object> expected = new LinkedHashMap<String, Object>();
    expected.put("ParticleDecays:mixB", "off");
    expected.put("Init:showChangedSettings", "off");
    expected.put("Init:showChangedParticleData", "off");
    expected.put("Next:numberShowEvent", 0.0);
    assertEquals(expected, Statements.pythiaDefinitions(defsTree));
  }

  @Test
  public void testLineshapeDefinitions() {
    assertEquals(Arrays.asList(
            new LineshapeDef("D_1+", "D*+", "pi0", 2),
            new LineshapeDef("D_1+", "D*0", "pi+", 2),
            new LineshapeDef("D_10", "D*0", "pi0", 2)),
        Statements.lineshapeDefinitions(defsTree));
  }

  @Test
  public void testGlobalPhotosFlagLastWins() {
    Diagnostics diag = new Diagnostics(Logging.getDecLogger());
    assertEquals(PhotosFlag.ENABLED,
                 Statements.globalPhotosFlag(defsTree, diag));
    assertEquals(Arrays.asList("PHOTOS flag re-set! Using flag set in last ..."),
                 diag.messages());
  }

  @Test
  public void testGlobalPhotosFlagDefault() {
    DecAST root = decFile(decay("pi0", decayLine("1.0", "PHSP", "gamma", "gamma")));
    Diagnostics diag = new Diagnostics(Logging.getDecLogger());
    assertEquals(PhotosFlag.DISABLED, Statements.globalPhotosFlag(root, diag));
    assertTrue(diag.isEmpty());
  }

  @Test
  public void testDecaysAndChargeConjugateDecays() {
    List<DecAST> decays = Statements.decays(defsTree);
    assertEquals(3, decays.size());
    assertEquals("B0", Statements.motherName(decays.get(0)));
    assertEquals("MyD0", Statements.motherName(decays.get(2)));
    assertEquals(Arrays.asList("MyAnti-D0"),
                 Statements.chargeConjugateDecays(defsTree));
  }

  @Test
  public void testChargeConjugateDecaysSorted() {
    DecAST root = decFile(
        DecAST.create(EvtDecParser.CDECAY, particle("anti-B0sig")),
        DecAST.create(EvtDecParser.CDECAY, particle("MyTau+")),
        DecAST.create(EvtDecParser.CDECAY, particle("MyD+")));
    assertEquals(Arrays.asList("MyD+", "MyTau+", "anti-B0sig"),
                 Statements.chargeConjugateDecays(root));
  }

  @Test
  public void testModelParametersFromDefinitions() {
    Map<String, Double> defs = Statements.definitions(defsTree);
    List<DecAST> decays = Statements.decays(defsTree);

    DecAST b0Line = Statements.decayLines(decays.get(0)).get(0);
    assertEquals("SSD_CP", Statements.modelName(b0Line));
    assertEquals(Arrays.asList(0.507e12, 0.1, 1.0, 0.04, 9.6, -0.8, 8.4, -0.6),
                 Statements.modelParameters(b0Line, defs));

    DecAST bsLine = Statements.decayLines(decays.get(1)).get(0);
    assertEquals(Arrays.asList(0.02, 1.0, 0.490, 0.0, 0.775, 0.0, 0.5, 0.0),
                 Statements.modelParameters(bsLine, defs));
    assertTrue(Statements.hasPhotos(bsLine));
  }

  @Test
  public void testDecayMode() {
    Map<String, Double> defs = Statements.definitions(defsTree);
    DecAST d0 = Statements.decays(defsTree).get(2);
    List<DecAST> lines = Statements.decayLines(d0);
    assertEquals(2, lines.size());

    DecayMode mode = Statements.decayMode(lines.get(1), defs);
    assertEquals(0.1, mode.branchingFraction(), 0.0);
    assertEquals(Arrays.asList("K-", "e+", "nu_e"), mode.finalState());
    assertEquals("ISGW2", mode.model());
    assertEquals(Collections.<Double>emptyList(), mode.modelParameters());
  }

  @Test
  public void testHandBuiltLine() {
    DecAST line = decayLine("0.5", "PHSP", "K-", "pi+");
    assertEquals(0.5, Statements.branchingFraction(line), 0.0);
    assertEquals(Arrays.asList("K-", "pi+"),
                 Statements.finalStateParticleNames(line));
    assertFalse(Statements.hasPhotos(line));
    assertEquals(Collections.<Double>emptyList(),
        Statements.modelParameters(line, Collections.<String, Double>emptyMap()));
  }

  @Test
  public void testLineWithoutModel() {
    DecAST line = DecAST.create(EvtDecParser.DECAYLINE,
                                value("1.0"),
                                particle("gamma"));
    assertEquals("", Statements.modelName(line));
  }

  @Test
  public void testUndefinedModelParameter() {
    DecAST line = decayLine("1.0", "SSD_CP", "K+", "K-");
    line.addChild(DecAST.create(EvtDecParser.MODEL_OPTIONS,
                      DecAST.leaf(EvtDecParser.LABEL, "undefinedName")));
    exception.expect(MalformedTreeException.class);
    Statements.modelParameters(line, Collections.<String, Double>emptyMap());
  }

  @Test
  public void testDecaysNeedsRoot() {
    exception.expect(MalformedTreeException.class);
    Statements.decays(decay("D0", decayLine("1.0", "PHSP", "K-", "pi+")));
  }

  @Test
  public void testDecaysNull() {
    exception.expect(MalformedTreeException.class);
    Statements.decays(null);
  }

  @Test
  public void testMotherNameNeedsDecay() {
    exception.expect(MalformedTreeException.class);
    Statements.motherName(particle("D0"));
  }

  @Test
  public void testBranchingFractionNotANumber() {
    exception.expect(MalformedTreeException.class);
    Statements.branchingFraction(decayLine("one", "PHSP", "K-", "pi+"));
  }
}
