package hep.dec.common.exceptions;

/**
 * A syntax tree node does not have the shape an extractor expects.
 */
public class MalformedTreeException extends RuntimeException {

  public MalformedTreeException(String msg) {
    super(msg);
  }

  public MalformedTreeException(String msg, Throwable cause) {
    super(msg, cause);
  }

  private static final long serialVersionUID = 1L;
}
