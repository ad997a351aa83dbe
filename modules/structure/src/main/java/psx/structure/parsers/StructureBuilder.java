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

import java.util.logging.Level;
import java.util.logging.Logger;
import psx.structure.Atom;
import psx.structure.Chain;
import psx.structure.ElementTable;
import psx.structure.Model;
import psx.structure.Residue;
import psx.structure.Structure;

/**
 * The StructureBuilder assembles a {@link Structure} from the lines of a PDB file, one line at a
 * time.
 *
 * <p>Chains and residues are opened as coordinate records arrive: a new chain when the chain
 * identifier changes or the open chain has been terminated, and a new residue when the sequence
 * number or insertion code changes. A change of residue name alone opens a new residue unless the
 * record carries an alternate location indicator, in which case it is a point mutation of the open
 * residue. MODEL, ENDMDL and END records delimit models, and TER records terminate chains.
 *
 * <pre>
 *   StructureBuilder builder = new StructureBuilder(true);
 *   for (String line : lines) {
 *     if (!builder.addLine(line)) {
 *       break;
 *     }
 *   }
 *   Structure structure = builder.finish();
 * </pre>
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class StructureBuilder {

  private static final Logger logger = Logger.getLogger(StructureBuilder.class.getName());

  private final Structure structure = new Structure();
  private final boolean loadAllModels;
  private final DiagnosticListener listener;
  private final NumberingResolver resolver;
  private final PDBRecordParser parser;

  private Model currentModel = null;
  private Chain currentChain = null;
  private Residue currentResidue = null;
  /** An ENDMDL or END was read; the next coordinate record opens a new model. */
  private boolean pendingModel = false;
  /** The first model is complete and only it was requested. */
  private boolean complete = false;
  private int lineNumber = 0;

  /**
   * Build against the periodic table, logging diagnostics.
   *
   * @param loadAllModels if false, input stops being consumed after the first model.
   */
  public StructureBuilder(boolean loadAllModels) {
    this(loadAllModels, ElementTable.PERIODIC_TABLE, new LoggingDiagnosticListener());
  }

  /**
   * Constructor for StructureBuilder.
   *
   * @param loadAllModels if false, input stops being consumed after the first model.
   * @param elementTable resolves element symbols.
   * @param diagnosticListener receives diagnostics.
   */
  public StructureBuilder(
      boolean loadAllModels, ElementTable elementTable, DiagnosticListener diagnosticListener) {
    this.loadAllModels = loadAllModels;
    // Diagnostics are tagged with the number of the line being read.
    this.listener = d -> diagnosticListener.diagnostic(d.atLine(lineNumber));
    this.resolver = new NumberingResolver(this.listener);
    this.parser = new PDBRecordParser(elementTable, this.listener);
  }

  /**
   * Consume the next line.
   *
   * @param line a line of a PDB file, without its terminator.
   * @return false once no further input is wanted (the first model is complete and only it was
   *     requested).
   * @throws StructureFormatException if a coordinate, CRYST1 or CONECT record cannot be read.
   */
  public boolean addLine(String line) {
    if (complete) {
      return false;
    }
    lineNumber++;
    try {
      switch (RecordKind.classify(line)) {
        case COORDINATE:
          addAtom(line);
          break;
        case MODEL:
          openModel(currentModel == null ? 0 : currentModel.getNumber() + 1);
          break;
        case ENDMDL:
        case END:
          closeModel();
          break;
        case TER:
          terminateChain();
          break;
        case CRYST1:
          structure.setUnitCell(parser.parseUnitCell(line));
          break;
        case CONECT:
          addConnect(line);
          break;
        default:
          break;
      }
    } catch (StructureFormatException e) {
      throw new StructureFormatException(
          e.getMessage(),
          line,
          lineNumber,
          resolver.getNextAtomNumber(),
          resolver.getNextResidueNumber(),
          e.getCause());
    }
    return !complete;
  }

  /**
   * Finalize every model and return the structure.
   *
   * @return the Structure.
   */
  public Structure finish() {
    for (Model model : structure.getModels()) {
      model.finalizeModel();
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Read %d lines into %s.", lineNumber, structure));
    }
    return structure;
  }

  public NumberingResolver getResolver() {
    return resolver;
  }

  private void addAtom(String line) {
    if (currentModel == null) {
      openModel(0);
    } else if (pendingModel) {
      openModel(currentModel.getNumber() + 1);
    }
    Atom atom = parser.parseAtom(line, resolver, currentResidue);

    if (currentChain == null
        || !currentChain.getChainID().equals(atom.getChainID())
        || currentChain.isTerminated()) {
      currentChain = new Chain(atom.getChainID());
      currentModel.addChain(currentChain);
      currentResidue = null;
    }

    if (currentResidue == null
        || currentResidue.getResidueNumber() != atom.getResidueNumber()
        || !currentResidue.getInsertionCode().equals(atom.getInsertionCode())) {
      openResidue(atom);
    } else if (!currentResidue.getNameWithSpaces().equals(atom.getResidueNameWithSpaces())) {
      if (atom.getAltLoc() == ' ') {
        listener.diagnostic(
            new ParseDiagnostic(
                ParseDiagnostic.Type.RESIDUE_NAME_CHANGE,
                format(
                    " Residue name changed from %s to %s within residue %d%c; starting a new"
                        + " residue.",
                    currentResidue.getName(),
                    atom.getResidueName(),
                    atom.getResidueNumber(),
                    atom.getInsertionCode())));
        openResidue(atom);
      }
      // Otherwise a point mutation: the alternate location joins the open residue.
    }
    currentResidue.addAtom(atom);
  }

  private void openResidue(Atom atom) {
    currentResidue =
        new Residue(
            atom.getResidueNameWithSpaces(),
            atom.getResidueNumber(),
            atom.getInsertionCode(),
            atom.getAltLoc(),
            atom.getSegID());
    currentChain.addResidue(currentResidue);
  }

  private void openModel(int number) {
    currentModel = new Model(number);
    structure.addModel(currentModel);
    currentChain = null;
    currentResidue = null;
    pendingModel = false;
    resolver.resetAtomNumbering();
    resolver.resetResidueNumbering();
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Opened model %d at line %d.", number, lineNumber));
    }
  }

  private void closeModel() {
    if (currentModel == null) {
      listener.diagnostic(
          new ParseDiagnostic(
              ParseDiagnostic.Type.ORPHAN_RECORD,
              " Ignoring an END or ENDMDL record that precedes all coordinates."));
      if (!loadAllModels) {
        complete = true;
      }
      return;
    }
    currentModel.finalizeModel();
    if (loadAllModels) {
      pendingModel = true;
    } else {
      complete = true;
    }
  }

  private void terminateChain() {
    if (currentChain == null) {
      listener.diagnostic(
          new ParseDiagnostic(
              ParseDiagnostic.Type.ORPHAN_RECORD, " Ignoring a TER record with no open chain."));
      return;
    }
    currentChain.addTerRecord();
    currentResidue = null;
    resolver.resetResidueNumbering();
  }

  private void addConnect(String line) {
    if (currentModel == null) {
      listener.diagnostic(
          new ParseDiagnostic(
              ParseDiagnostic.Type.ORPHAN_RECORD,
              " Ignoring a CONECT record that precedes all coordinates."));
      return;
    }
    currentModel.addConnect(parser.parseConnect(line, resolver));
  }
}
