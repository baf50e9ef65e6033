package hep.dec.common.exceptions;

public class InvalidSyntaxException extends DecUserException {

  private final int line;
  private final int column;

  public InvalidSyntaxException(String file, int line, int col,
                                String message) {
    super(file, line, col, message);
    this.line = line;
    this.column = col;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  private static final long serialVersionUID = 1060914609057739598L;
}
