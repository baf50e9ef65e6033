package hep.dec.particle;

import hep.dec.common.exceptions.ParticleNotFoundException;

/**
 * Source of particle properties.  Only the antiparticle lookup is needed
 * to build charge-conjugate decays.
 */
public interface ParticleDatabase {

  /**
   * @param name particle name as written in decay files
   * @return name of the antiparticle, the name itself if self-conjugate
   * @throws ParticleNotFoundException if the particle is unknown
   */
  public String antiparticleName(String name) throws ParticleNotFoundException;
}
