package hep.dec.common.exceptions;

public class InvalidOptionException extends Exception {

  public InvalidOptionException(String msg) {
    super(msg);
  }

  private static final long serialVersionUID = 1L;
}
