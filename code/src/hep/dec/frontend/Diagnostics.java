package hep.dec.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

/**
 * Collects the problems found and recovered from while reading a decay
 * file.  Each one is also logged as a warning.
 */
public class Diagnostics {
  private final Logger logger;
  private final List<String> messages = new ArrayList<String>();

  public Diagnostics(Logger logger) {
    this.logger = logger;
  }

  public void warn(String msg) {
    messages.add(msg);
    logger.warn(msg);
  }

  public List<String> messages() {
    return Collections.unmodifiableList(messages);
  }

  public boolean isEmpty() {
    return messages.isEmpty();
  }
}
