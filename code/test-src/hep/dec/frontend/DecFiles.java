package hep.dec.frontend;

import java.io.File;
import java.io.IOException;
import java.net.URL;

import org.apache.commons.io.FileUtils;

/**
 * Locates the .dec files under test-resources/decfiles
 */
public class DecFiles {

  public static final String DST = "test_example_Dst.dec";
  public static final String DUPLICATES = "duplicate-decays.dec";
  public static final String DEFS = "defs-aliases-chargeconj.dec";
  public static final String BD2DMTAUNU =
                              "test_Bd2DmTauNu_Dm23PiPi0_Tau2MuNu.dec";
  public static final String CYCLIC = "cyclic-decays.dec";

  public static String path(String name) {
    URL url = DecFiles.class.getResource("/decfiles/" + name);
    if (url == null) {
      throw new IllegalArgumentException("No test file " + name);
    }
    return FileUtils.toFile(url).getPath();
  }

  public static String read(String name) throws IOException {
    return FileUtils.readFileToString(new File(path(name)), "UTF-8");
  }

  public static DecFileParser parsed(String name) throws Exception {
    DecFileParser p = DecFileParser.fromFile(path(name));
    p.parse();
    return p;
  }
}
