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

import static java.lang.String.format;

import java.io.File;
import java.util.logging.Logger;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.io.FilenameUtils;

/**
 * The PropertyLoader class assembles the configuration used when reading and writing PDB files.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class PropertyLoader {

  private static final Logger logger = Logger.getLogger(PropertyLoader.class.getName());

  /** Environment variable naming a system wide property file. */
  public static final String PSX_PROPERTIES = "PSX_PROPERTIES";

  private PropertyLoader() {
    // Prevent instantiation.
  }

  /**
   * Assemble the configuration for a structure file. Earlier sources take precedence:
   *
   * <ol>
   *   <li>Java system properties (-Dkey=value).
   *   <li>Properties next to the structure file (for example 1crn.properties or 1crn.prop).
   *   <li>User properties (~/.psx/psx.properties).
   *   <li>The file named by the PSX_PROPERTIES environment variable.
   * </ol>
   *
   * @param file the structure file, or null.
   * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   */
  public static CompositeConfiguration loadProperties(File file) {
    CompositeConfiguration properties = new CompositeConfiguration();
    properties.addConfiguration(new SystemConfiguration());

    if (file != null) {
      String basename = FilenameUtils.removeExtension(file.getAbsolutePath());
      if ("gz".equalsIgnoreCase(FilenameUtils.getExtension(file.getName()))) {
        basename = FilenameUtils.removeExtension(basename);
      }
      File structureProperties = new File(basename + ".properties");
      if (!structureProperties.exists()) {
        structureProperties = new File(basename + ".prop");
      }
      if (addPropertyFile(properties, structureProperties)) {
        properties.addProperty("propertyFile", structureProperties.getAbsolutePath());
      }
    }

    String home = System.getProperty("user.home");
    addPropertyFile(properties, new File(home, ".psx" + File.separator + "psx.properties"));

    String systemWide = System.getenv(PSX_PROPERTIES);
    if (systemWide != null) {
      addPropertyFile(properties, new File(systemWide));
    }
    return properties;
  }

  /** Append a property file to the composite, returning false if it could not be read. */
  private static boolean addPropertyFile(CompositeConfiguration properties, File propertyFile) {
    if (!propertyFile.isFile() || !propertyFile.canRead()) {
      return false;
    }
    FileBasedConfigurationBuilder<PropertiesConfiguration> builder =
        new FileBasedConfigurationBuilder<>(PropertiesConfiguration.class)
            .configure(
                new Parameters()
                    .properties()
                    .setFile(propertyFile)
                    .setThrowExceptionOnMissing(true)
                    .setIncludesAllowed(false));
    try {
      properties.addConfiguration(builder.getConfiguration());
      logger.fine(format(" Loaded properties from %s.", propertyFile));
      return true;
    } catch (ConfigurationException e) {
      logger.warning(format(" Could not read properties from %s: %s", propertyFile, e));
      return false;
    }
  }
}
