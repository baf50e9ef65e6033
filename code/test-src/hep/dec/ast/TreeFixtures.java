package hep.dec.ast;

import hep.dec.ast.antlr.EvtDecParser;

/**
 * Hand-built syntax trees with the shapes produced by EvtDec.g
 */
public class TreeFixtures {

  public static DecAST particle(String name) {
    return DecAST.create(EvtDecParser.PARTICLE,
                         DecAST.leaf(EvtDecParser.LABEL, name));
  }

  public static DecAST value(String number) {
    return DecAST.create(EvtDecParser.VALUE,
                         DecAST.leaf(EvtDecParser.NUMBER, number));
  }

  public static DecAST model(String name) {
    return DecAST.create(EvtDecParser.MODEL,
                         DecAST.leaf(EvtDecParser.MODEL_NAME, name));
  }

  public static DecAST decayLine(String bf, String modelName,
                                 String... particles) {
    DecAST line = DecAST.create(EvtDecParser.DECAYLINE, value(bf));
    for (String p: particles) {
      line.addChild(particle(p));
    }
    line.addChild(model(modelName));
    return line;
  }

  public static DecAST decay(String mother, DecAST... lines) {
    DecAST decay = DecAST.create(EvtDecParser.DECAY, particle(mother));
    for (DecAST line: lines) {
      decay.addChild(line);
    }
    return decay;
  }

  public static DecAST cdecay(String mother) {
    return DecAST.create(EvtDecParser.CDECAY, particle(mother));
  }

  public static DecAST chargeConj(String p, String ccp) {
    return DecAST.create(EvtDecParser.CHARGECONJ, particle(p), particle(ccp));
  }

  public static DecAST decFile(DecAST... statements) {
    return DecAST.create(EvtDecParser.DECFILE, statements);
  }
}
