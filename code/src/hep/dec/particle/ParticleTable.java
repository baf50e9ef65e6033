/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package hep.dec.particle;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import hep.dec.common.Logging;
import hep.dec.common.Settings;
import hep.dec.common.exceptions.DecRuntimeError;
import hep.dec.common.exceptions.ParticleNotFoundException;

/**
 * Particle database backed by a plain text table of
 * "name antiname" lines.  A line with a single name declares a
 * self-conjugate particle.  '#' starts a comment.
 */
public class ParticleTable implements ParticleDatabase {

  public static final String DEFAULT_TABLE = "particles.table";

  private static final Logger logger = Logging.getDecLogger();

  private final Map<String, String> antiparticles;

  public ParticleTable(Map<String, String> antiparticles) {
    this.antiparticles = new HashMap<String, String>(antiparticles);
  }

  /**
   * Load the table selected by the dec.particle-table setting, falling back
   * to the table bundled with the library.
   */
  public static ParticleTable load() throws IOException {
    String path = Settings.get(Settings.PARTICLE_TABLE);
    if (path != null && path.length() > 0) {
      return fromFile(new File(path));
    }
    return bundled();
  }

  public static ParticleTable bundled() {
    InputStream in = ParticleTable.class.getResourceAsStream(DEFAULT_TABLE);
    if (in == null) {
      throw new DecRuntimeError("Bundled particle table " + DEFAULT_TABLE +
                                " missing from class path");
    }
    try {
      return read(in, DEFAULT_TABLE);
    } catch (IOException e) {
      throw new DecRuntimeError("Could not read bundled particle table", e);
    } finally {
      IOUtils.closeQuietly(in);
    }
  }

  public static ParticleTable fromFile(File file) throws IOException {
    InputStream in = new FileInputStream(file);
    try {
      return read(in, file.getPath());
    } finally {
      in.close();
    }
  }

  static ParticleTable read(InputStream in, String source) throws IOException {
    List<String> lines = IOUtils.readLines(in, StandardCharsets.UTF_8);
    Map<String, String> antiparticles = new HashMap<String, String>();
    int lineNum = 0;
    for (String line: lines) {
      lineNum++;
      String content = StringUtils.substringBefore(line, "#").trim();
      if (content.isEmpty()) {
        continue;
      }
      String[] names = StringUtils.split(content);
      if (names.length == 1) {
        antiparticles.put(names[0], names[0]);
      } else if (names.length == 2) {
        antiparticles.put(names[0], names[1]);
        antiparticles.put(names[1], names[0]);
      } else {
        throw new IOException(source + ":" + lineNum +
            ": expected a particle name and optional antiparticle name, got: "
            + content);
      }
    }
    logger.debug("Loaded " + antiparticles.size() + " particle names from "
                 + source);
    return new ParticleTable(antiparticles);
  }

  @Override
  public String antiparticleName(String name)
                                  throws ParticleNotFoundException {
    String anti = antiparticles.get(name);
    if (anti == null) {
      throw new ParticleNotFoundException(name);
    }
    return anti;
  }

  public boolean contains(String name) {
    return antiparticles.containsKey(name);
  }

  public int size() {
    return antiparticles.size();
  }
}
