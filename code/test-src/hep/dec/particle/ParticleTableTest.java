package hep.dec.particle;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.rules.TemporaryFolder;

import hep.dec.common.Settings;
import hep.dec.common.exceptions.ParticleNotFoundException;

public class ParticleTableTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private static ParticleTable read(String text) throws IOException {
    return ParticleTable.read(new ByteArrayInputStream(text.getBytes("UTF-8")),
                              "test.table");
  }

  @Test
  public void testBundled() throws ParticleNotFoundException {
    ParticleTable table = ParticleTable.bundled();
    assertTrue(table.size() > 100);
    assertEquals("K-", table.antiparticleName("K+"));
    assertEquals("K+", table.antiparticleName("K-"));
    assertEquals("anti-Sigma(1775)0", table.antiparticleName("Sigma(1775)0"));
    assertEquals("pi0", table.antiparticleName("pi0"));
    assertEquals("anti-nu_tau", table.antiparticleName("nu_tau"));
  }

  @Test
  public void testUnknownParticle() throws ParticleNotFoundException {
    try {
      ParticleTable.bundled().antiparticleName("MyD0");
      fail("Aliases are not in the table");
    } catch (ParticleNotFoundException e) {
      assertEquals("MyD0", e.getParticle());
    }
  }

  @Test
  public void testReadWithComments() throws Exception {
    ParticleTable table = read("# comment\n\nB0 anti-B0   # neutral B\n" +
                               "J/psi\n");
    assertEquals(3, table.size());
    assertEquals("B0", table.antiparticleName("anti-B0"));
    assertEquals("J/psi", table.antiparticleName("J/psi"));
    assertTrue(table.contains("anti-B0"));
    assertFalse(table.contains("B+"));
  }

  @Test
  public void testBadLine() throws Exception {
    exception.expect(IOException.class);
    exception.expectMessage("test.table:2");
    read("B0 anti-B0\nB+ B- extra\n");
  }

  @Test
  public void testLoadFromSetting() throws Exception {
    File file = tmp.newFile("my.table");
    FileUtils.writeStringToFile(file, "MyD0 MyAnti-D0\n", "UTF-8");

    String old = Settings.get(Settings.PARTICLE_TABLE);
    Settings.set(Settings.PARTICLE_TABLE, file.getPath());
    try {
      ParticleTable table = ParticleTable.load();
      assertEquals(2, table.size());
      assertEquals("MyD0", table.antiparticleName("MyAnti-D0"));
    } finally {
      Settings.set(Settings.PARTICLE_TABLE, old);
    }
  }

  @Test
  public void testLoadDefault() throws Exception {
    assertTrue(ParticleTable.load().contains("D0"));
  }
}
