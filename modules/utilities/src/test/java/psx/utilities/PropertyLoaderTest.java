// ******************************************************************************
//
// Title:       PSX.
// Description: PSX - Protein Data Bank Structure Exchange.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2020.
//
// This file is part of PSX.
//
// PSX is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// PSX is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// PSX; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package psx.utilities;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.io.FileUtils;
import org.junit.Test;

/**
 * Test the PropertyLoader class.
 */
public class PropertyLoaderTest extends PSXTest {

  @Test
  public void testSystemPropertiesTakePrecedence() throws IOException {
    Path dir = registerTemporaryDirectory();
    File pdb = dir.resolve("1abc.pdb").toFile();
    FileUtils.writeStringToFile(pdb, "END\n", StandardCharsets.UTF_8);
    FileUtils.writeStringToFile(dir.resolve("1abc.properties").toFile(),
        "load-all-models = true\nwrite-alt-locs = A\n", StandardCharsets.UTF_8);

    System.setProperty("load-all-models", "false");
    CompositeConfiguration properties = PropertyLoader.loadProperties(pdb);
    assertFalse(properties.getBoolean("load-all-models", true));
    assertEquals("A", properties.getString("write-alt-locs", "*"));
    assertTrue(properties.containsKey("propertyFile"));
  }

  @Test
  public void testCompressedStructureUsesUncompressedBasename() throws IOException {
    Path dir = registerTemporaryDirectory();
    File pdb = dir.resolve("2xyz.pdb.gz").toFile();
    FileUtils.writeStringToFile(dir.resolve("2xyz.prop").toFile(),
        "write-alt-locs = B\n", StandardCharsets.UTF_8);

    CompositeConfiguration properties = PropertyLoader.loadProperties(pdb);
    assertEquals("B", properties.getString("write-alt-locs", "*"));
  }

  @Test
  public void testUserPropertiesFillGaps() throws IOException {
    Path home = registerTemporaryDirectory();
    FileUtils.writeStringToFile(home.resolve(".psx").resolve("psx.properties").toFile(),
        "write-alt-locs = C\nload-all-models = false\n", StandardCharsets.UTF_8);
    File pdb = home.resolve("3def.pdb").toFile();
    FileUtils.writeStringToFile(home.resolve("3def.properties").toFile(),
        "write-alt-locs = A\n", StandardCharsets.UTF_8);

    System.setProperty("user.home", home.toString());
    CompositeConfiguration properties = PropertyLoader.loadProperties(pdb);
    assertEquals("A", properties.getString("write-alt-locs", "*"));
    assertFalse(properties.getBoolean("load-all-models", true));
  }

  @Test
  public void testDefaultsWithoutStructure() {
    CompositeConfiguration properties = PropertyLoader.loadProperties(null);
    assertTrue(properties.getBoolean("psx.unset.test.key", true));
    assertFalse(properties.containsKey("propertyFile"));
  }
}
