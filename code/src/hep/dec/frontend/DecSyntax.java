package hep.dec.frontend;

import hep.dec.ast.DecAST;
import hep.dec.common.exceptions.InvalidSyntaxException;

/**
 * Turns decay file text into a syntax tree rooted at a DECFILE node.
 */
public interface DecSyntax {

  /**
   * @param inputName file name used in error messages
   * @param text contents of the decay file
   * @return root of the tree
   * @throws InvalidSyntaxException
   */
  public DecAST parse(String inputName, String text)
                                throws InvalidSyntaxException;
}
