package hep.dec.common.exceptions;

/**
 * Used to signal that program should quit.
 */
public class DecFatal extends RuntimeException {
  public final int exitCode;

  public DecFatal(int exitCode) {
    super();
    this.exitCode = exitCode;
  }

  private static final long serialVersionUID = 1L;
}
