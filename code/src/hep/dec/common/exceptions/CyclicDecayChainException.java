package hep.dec.common.exceptions;

import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * A decay chain reached a particle that is already being expanded
 * further up the same chain.
 */
public class CyclicDecayChainException extends DecUserException {

  public CyclicDecayChainException(String mother, List<String> path) {
    super("Decay chain of '" + mother + "' is cyclic: " +
          StringUtils.join(path, " -> ") + " -> " + mother);
  }

  private static final long serialVersionUID = 1L;
}
