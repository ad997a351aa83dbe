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

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;
import psx.structure.Atom;
import psx.structure.Chain;
import psx.structure.Model;
import psx.structure.Residue;
import psx.structure.Structure;

/**
 * The PDBWriter writes a {@link Structure} as fixed-column PDB records.
 *
 * <p>Serial numbers are reassigned from 1 in each model, incrementing once per written location
 * and once per TER record. When a structure holds more than one model, each non-empty model is
 * wrapped in MODEL and ENDMDL records. Output always ends with an END record.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class PDBWriter {

  private static final Logger logger = Logger.getLogger(PDBWriter.class.getName());

  private final String altLocs;

  /** Write every alternate location of each atom. */
  public PDBWriter() {
    this(Residue.ALL_LOCATIONS);
  }

  /**
   * Constructor for PDBWriter.
   *
   * @param altLocs the locations written per atom: null or empty for the default location only,
   *     "*" for all locations in ascending order of indicator, otherwise the listed indicators
   *     (an atom with none of them is written at its blank indicator location, if it has one).
   */
  public PDBWriter(String altLocs) {
    this.altLocs = altLocs;
  }

  /**
   * Write a structure.
   *
   * @param structure the Structure to write.
   * @param writer the destination; it is flushed but not closed.
   * @throws IOException if writing fails.
   */
  public void write(Structure structure, Writer writer) throws IOException {
    BufferedWriter bw =
        (writer instanceof BufferedWriter) ? (BufferedWriter) writer : new BufferedWriter(writer);
    boolean wrapModels = structure.size() > 1;
    for (Model model : structure.getModels()) {
      if (wrapModels) {
        if (model.size() == 0) {
          continue;
        }
        writeLine(bw, format(Locale.US, "MODEL     %4d", model.getNumber()));
      }
      int serial = writeModel(model, 1, bw);
      if (wrapModels) {
        writeLine(bw, "ENDMDL");
      }
      logger.finer(format(" Wrote model %d (%d serial numbers).", model.getNumber(), serial - 1));
    }
    writeLine(bw, "END");
    bw.flush();
  }

  /**
   * Write the chains of one model.
   *
   * @param model the Model.
   * @param serial the first serial number to use.
   * @param bw the destination.
   * @return the next unused serial number.
   * @throws IOException if writing fails.
   */
  public int writeModel(Model model, int serial, BufferedWriter bw) throws IOException {
    for (Chain chain : model.getChains()) {
      serial = writeChain(chain, serial, bw);
    }
    return serial;
  }

  /**
   * Write one chain, followed by a TER record if the chain was terminated when read.
   *
   * @param chain the Chain.
   * @param serial the first serial number to use.
   * @param bw the destination.
   * @return the next unused serial number.
   * @throws IOException if writing fails.
   */
  public int writeChain(Chain chain, int serial, BufferedWriter bw) throws IOException {
    for (Residue residue : chain.getResidues()) {
      serial = writeResidue(residue, serial, bw);
    }
    Residue last = chain.getFinalResidue();
    if (chain.isTerminated() && last != null) {
      writeLine(
          bw,
          format(
              Locale.US,
              "TER   %5d      %3s %c%4d%c",
              serial,
              last.getNameWithSpaces(),
              chain.getChainID(),
              Math.floorMod(last.getResidueNumber(), 10000),
              last.getInsertionCode()));
      serial++;
    }
    return serial;
  }

  /**
   * Write the atoms of one residue.
   *
   * @param residue the Residue.
   * @param serial the first serial number to use.
   * @param bw the destination.
   * @return the next unused serial number.
   * @throws IOException if writing fails.
   */
  public int writeResidue(Residue residue, int serial, BufferedWriter bw) throws IOException {
    for (Atom atom : residue.getAtoms()) {
      for (Character altLoc : selectLocations(atom)) {
        writeLine(bw, atom.toPDBString(serial++, altLoc));
      }
    }
    return serial;
  }

  /** Locations of an atom that are written, in output order. */
  private List<Character> selectLocations(Atom atom) {
    if (altLocs == null || altLocs.isEmpty()) {
      return List.of(atom.getAltLoc());
    }
    if (Residue.ALL_LOCATIONS.equals(altLocs)) {
      return atom.getAltLocs();
    }
    List<Character> selected = new ArrayList<>();
    for (char c : altLocs.toCharArray()) {
      if (atom.hasLocation(c) && !selected.contains(c)) {
        selected.add(c);
      }
    }
    // A blank indicator is shared by every conformer.
    if (selected.isEmpty() && atom.hasLocation(' ')) {
      selected.add(' ');
    }
    return selected;
  }

  private static void writeLine(BufferedWriter bw, String line) throws IOException {
    bw.write(line);
    bw.newLine();
  }
}
