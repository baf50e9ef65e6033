package hep.dec.common.exceptions;

/**
 * No 'Decay' statement (declared or charge-conjugate) exists for a particle.
 */
public class DecayNotFoundException extends DecUserException {

  private final String mother;

  public DecayNotFoundException(String mother) {
    super("Decays of particle '" + mother + "' not found in .dec file!");
    this.mother = mother;
  }

  public String getMother() {
    return mother;
  }

  private static final long serialVersionUID = 1L;
}
