package hep.dec.common.exceptions;

/**
 * A query needing the decay statements was issued before parse().
 */
public class DecFileNotParsedException extends RuntimeException {

  public DecFileNotParsedException(String msg) {
    super(msg);
  }

  private static final long serialVersionUID = 1L;
}
