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
package psx.structure.parsers;

import static java.lang.String.format;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.logging.Logger;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.io.FilenameUtils;
import psx.structure.ElementTable;
import psx.structure.Residue;
import psx.structure.Structure;
import psx.utilities.PropertyLoader;
import psx.utilities.StringUtils;

/**
 * The PDBFilter class reads and writes Protein Data Bank coordinate files.
 *
 * <p>Two properties are recognized:
 *
 * <ul>
 *   <li><code>load-all-models</code> (default true): if false, reading stops after the first
 *       model.
 *   <li><code>write-alt-locs</code> (default "*"): the alternate locations written for each atom.
 * </ul>
 *
 * Files whose name ends in .gz are read and written with gzip compression.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class PDBFilter {

  private static final Logger logger = Logger.getLogger(PDBFilter.class.getName());

  /** Property selecting whether models after the first are read. */
  public static final String LOAD_ALL_MODELS = "load-all-models";
  /** Property selecting the alternate locations written. */
  public static final String WRITE_ALT_LOCS = "write-alt-locs";

  private final File file;
  private final boolean loadAllModels;
  private final String writeAltLocs;
  private ElementTable elementTable = ElementTable.PERIODIC_TABLE;
  private DiagnosticListener listener = new LoggingDiagnosticListener();

  /**
   * Filter for a file, configured from the properties found for it.
   *
   * @param file the PDB file.
   */
  public PDBFilter(File file) {
    this(file, PropertyLoader.loadProperties(file));
  }

  /**
   * Constructor for PDBFilter.
   *
   * @param file the PDB file, or null if only streams will be read and written.
   * @param properties the configuration.
   */
  public PDBFilter(File file, CompositeConfiguration properties) {
    this.file = file;
    this.loadAllModels = properties.getBoolean(LOAD_ALL_MODELS, true);
    this.writeAltLocs = properties.getString(WRITE_ALT_LOCS, Residue.ALL_LOCATIONS);
  }

  public void setElementTable(ElementTable elementTable) {
    this.elementTable = elementTable;
  }

  public void setDiagnosticListener(DiagnosticListener listener) {
    this.listener = listener;
  }

  public File getFile() {
    return file;
  }

  public boolean isLoadAllModels() {
    return loadAllModels;
  }

  /**
   * Read the file given at construction.
   *
   * @return the Structure.
   * @throws IOException if the file cannot be read.
   * @throws StructureFormatException if a record cannot be parsed.
   */
  public Structure readFile() throws IOException {
    if (file == null) {
      throw new IOException(" No PDB file was specified.");
    }
    if (!new PDBFileFilter().accept(file)) {
      logger.warning(format(" %s does not have a PDB file extension.", file.getName()));
    }
    logger.info(format(" Reading %s", file.getName()));
    try (BufferedReader br = openReader(file)) {
      return read(br);
    }
  }

  /**
   * Read PDB records from a reader. Reading stops early if only the first model is wanted.
   *
   * @param br the source; it is not closed.
   * @return the Structure.
   * @throws IOException if reading fails.
   * @throws StructureFormatException if a record cannot be parsed.
   */
  public Structure read(BufferedReader br) throws IOException {
    StructureBuilder builder = new StructureBuilder(loadAllModels, elementTable, listener);
    String line = br.readLine();
    while (line != null) {
      if (!builder.addLine(line)) {
        break;
      }
      line = br.readLine();
    }
    return finish(builder);
  }

  /**
   * Read PDB records held in memory.
   *
   * @param lines the records, without line terminators.
   * @return the Structure.
   * @throws StructureFormatException if a record cannot be parsed.
   */
  public Structure read(List<String> lines) {
    StructureBuilder builder = new StructureBuilder(loadAllModels, elementTable, listener);
    for (String line : lines) {
      if (!builder.addLine(line)) {
        break;
      }
    }
    return finish(builder);
  }

  /**
   * Write a structure to a file, compressing it if the name ends in .gz.
   *
   * @param structure the Structure.
   * @param saveFile the destination.
   * @throws IOException if writing fails.
   */
  public void writeFile(Structure structure, File saveFile) throws IOException {
    logger.info(format(" Saving %s", saveFile.getName()));
    try (BufferedWriter bw = openWriter(saveFile)) {
      write(structure, bw);
    }
  }

  /**
   * Write a structure.
   *
   * @param structure the Structure.
   * @param writer the destination; it is flushed but not closed.
   * @throws IOException if writing fails.
   */
  public void write(Structure structure, Writer writer) throws IOException {
    new PDBWriter(writeAltLocs).write(structure, writer);
  }

  private Structure finish(StructureBuilder builder) {
    Structure structure = builder.finish();
    logger.fine(format(" Loaded %d model(s).", structure.size()));
    return structure;
  }

  private static BufferedReader openReader(File file) throws IOException {
    if (isGzip(file)) {
      return StringUtils.createGzipReader(file);
    }
    return new BufferedReader(new FileReader(file, StandardCharsets.UTF_8));
  }

  private static BufferedWriter openWriter(File file) throws IOException {
    if (isGzip(file)) {
      return StringUtils.createGzipWriter(file);
    }
    return new BufferedWriter(new FileWriter(file, StandardCharsets.UTF_8));
  }

  private static boolean isGzip(File file) {
    return "gz".equalsIgnoreCase(FilenameUtils.getExtension(file.getName()));
  }
}
