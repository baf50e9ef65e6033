package hep.dec.common.exceptions;

public class ParticleNotFoundException extends Exception {

  private final String particle;

  public ParticleNotFoundException(String particle) {
    super("Particle '" + particle + "' not found in particle table");
    this.particle = particle;
  }

  public String getParticle() {
    return particle;
  }

  private static final long serialVersionUID = 1L;
}
