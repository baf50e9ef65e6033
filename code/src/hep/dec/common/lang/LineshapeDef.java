package hep.dec.common.lang;

import java.util.Arrays;
import java.util.List;

/**
 * A "SetLineshapePW MOTHER DAUGHTER1 DAUGHTER2 VALUE" statement
 */
public class LineshapeDef {
  public final String mother;
  public final String daughter1;
  public final String daughter2;
  public final int value;

  public LineshapeDef(String mother, String daughter1, String daughter2,
                      int value) {
    this.mother = mother;
    this.daughter1 = daughter1;
    this.daughter2 = daughter2;
    this.value = value;
  }

  /**
   * @return mother followed by both daughters
   */
  public List<String> particles() {
    return Arrays.asList(mother, daughter1, daughter2);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + mother.hashCode();
    result = prime * result + daughter1.hashCode();
    result = prime * result + daughter2.hashCode();
    result = prime * result + value;
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    LineshapeDef other = (LineshapeDef) obj;
    return mother.equals(other.mother) &&
           daughter1.equals(other.daughter1) &&
           daughter2.equals(other.daughter2) &&
           value == other.value;
  }

  @Override
  public String toString() {
    return "(" + particles() + ", " + value + ")";
  }
}
