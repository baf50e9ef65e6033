package hep.dec.ast;

/**
 * One error reported by the generated lexer or parser.
 */
public class SyntaxError {
  public final int line;
  /** zero-based, as reported by ANTLR */
  public final int column;
  public final String message;

  public SyntaxError(int line, int column, String message) {
    this.line = line;
    this.column = column;
    this.message = message;
  }

  @Override
  public String toString() {
    return line + ":" + (column + 1) + " " + message;
  }
}
