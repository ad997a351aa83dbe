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
import static psx.utilities.StringUtils.padRecord;
import static psx.utilities.StringUtils.trimTrailingBlanks;

import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.lang3.StringUtils;
import psx.structure.Atom;
import psx.structure.Atom.RecordType;
import psx.structure.Element;
import psx.structure.ElementTable;
import psx.structure.Location;
import psx.structure.Residue;
import psx.structure.UnitCell;

/**
 * The PDBRecordParser reads the fixed-column fields of ATOM, HETATM, CRYST1 and CONECT records.
 *
 * <p>Records shorter than 80 columns are padded with blanks before the columns are sliced. The
 * parser itself holds no state from one record to the next; numbering state belongs to the {@link
 * NumberingResolver} passed in.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class PDBRecordParser {

  private static final Logger logger = Logger.getLogger(PDBRecordParser.class.getName());

  /** Start columns (0-based) of the serial number fields of a CONECT record. */
  private static final int[] CONECT_FIELDS = {6, 11, 16, 21, 26};

  private final ElementTable elementTable;
  private final DiagnosticListener listener;

  /** Parse against the periodic table, logging diagnostics. */
  public PDBRecordParser() {
    this(ElementTable.PERIODIC_TABLE, new LoggingDiagnosticListener());
  }

  /**
   * Constructor for PDBRecordParser.
   *
   * @param elementTable resolves element symbols.
   * @param listener receives diagnostics.
   */
  public PDBRecordParser(ElementTable elementTable, DiagnosticListener listener) {
    this.elementTable = elementTable;
    this.listener = listener;
  }

  /**
   * Parse a coordinate record on its own. Serial and residue numbers are read as decimal, with 0
   * used for anything else.
   *
   * @param line an ATOM or HETATM record.
   * @return the Atom.
   * @throws StructureFormatException if a mandatory field cannot be read.
   */
  public Atom parseAtom(String line) {
    return parseAtom(line, null, null);
  }

  /**
   * Parse a coordinate record during a load.
   *
   * @param line an ATOM or HETATM record.
   * @param resolver the numbering state of the load, or null to read numbers as plain decimal.
   * @param openResidue the residue currently being filled, or null.
   * @return the Atom.
   * @throws StructureFormatException if a mandatory field cannot be read.
   */
  public Atom parseAtom(String line, NumberingResolver resolver, Residue openResidue) {
    String record = padRecord(line);

    RecordType recordType;
    try {
      recordType = RecordType.valueOf(record.substring(0, 6).trim());
    } catch (IllegalArgumentException e) {
      throw new StructureFormatException(" Not a coordinate record.", line, e);
    }

    String serialColumn = record.substring(6, 11);
    int serial =
        (resolver == null)
            ? NumberingResolver.readDecimal(serialColumn)
            : resolver.resolveAtomNumber(serialColumn);

    String nameWithSpaces = record.substring(12, 16);
    String name = nameWithSpaces.trim();
    Character altLoc = record.charAt(16);

    String residueNameWithSpaces = record.substring(17, 20);
    char fourthCharacter = record.charAt(20);
    if (fourthCharacter != ' ') {
      // A four character residue name must fill columns 18-21.
      if (residueNameWithSpaces.trim().length() != 3) {
        throw new StructureFormatException(" Misaligned residue name.", line, null);
      }
      residueNameWithSpaces += fourthCharacter;
    }

    Character chainID = record.charAt(21);
    String residueColumn = record.substring(22, 26);
    int residueNumber =
        (resolver == null)
            ? NumberingResolver.readDecimal(residueColumn)
            : resolver.resolveResidueNumber(
                residueColumn, openResidue, nameWithSpaces, residueNameWithSpaces);
    Character insertionCode = record.charAt(26);

    double[] xyz = new double[3];
    xyz[0] = readCoordinate(record.substring(30, 38), "x", line);
    xyz[1] = readCoordinate(record.substring(38, 46), "y", line);
    xyz[2] = readCoordinate(record.substring(46, 54), "z", line);

    double occupancy =
        readOptional(record.substring(54, 60), 1.0, ParseDiagnostic.Type.DEFAULT_OCCUPANCY, name);
    double tempFactor =
        readOptional(
            record.substring(60, 66), 0.0, ParseDiagnostic.Type.DEFAULT_TEMP_FACTOR, name);

    String segID = record.substring(72, 76).trim();
    String elementSymbol = record.substring(76, 78).trim();
    Element element = resolveElement(elementSymbol, nameWithSpaces);
    Integer formalCharge = readCharge(record.substring(78, 80).trim(), name);

    Location location =
        new Location(altLoc, xyz, occupancy, tempFactor, residueNameWithSpaces);
    Atom atom =
        new Atom(
            recordType,
            serial,
            nameWithSpaces,
            residueNameWithSpaces,
            chainID,
            residueNumber,
            insertionCode,
            segID,
            elementSymbol,
            element,
            formalCharge,
            location);

    if (resolver != null) {
      resolver.advance(serial, residueNumber);
    }
    if (logger.isLoggable(Level.FINER)) {
      logger.finer(format(" Parsed %s", atom));
    }
    return atom;
  }

  /**
   * Parse the lattice parameters of a CRYST1 record.
   *
   * @param line a CRYST1 record.
   * @return the UnitCell.
   * @throws StructureFormatException if a parameter cannot be read.
   */
  public UnitCell parseUnitCell(String line) {
    String record = padRecord(line);
    try {
      double a = Double.parseDouble(record.substring(6, 15).trim());
      double b = Double.parseDouble(record.substring(15, 24).trim());
      double c = Double.parseDouble(record.substring(24, 33).trim());
      double alpha = Double.parseDouble(record.substring(33, 40).trim());
      double beta = Double.parseDouble(record.substring(40, 47).trim());
      double gamma = Double.parseDouble(record.substring(47, 54).trim());
      return new UnitCell(a, b, c, alpha, beta, gamma);
    } catch (NumberFormatException e) {
      throw new StructureFormatException(" Could not read the CRYST1 lattice parameters.", line, e);
    }
  }

  /**
   * Parse the serial numbers of a CONECT record. Only the fields present before trailing blanks
   * are read.
   *
   * @param line a CONECT record.
   * @param resolver the numbering state of the load, or null to read numbers as plain decimal.
   * @return the serial numbers; the first is the central atom.
   */
  public int[] parseConnect(String line, NumberingResolver resolver) {
    String record = trimTrailingBlanks(line);
    int last = record.length() - 5;
    int[] serials = new int[CONECT_FIELDS.length];
    int n = 0;
    for (int start : CONECT_FIELDS) {
      if (start > last) {
        break;
      }
      String column = record.substring(start, start + 5);
      serials[n++] =
          (resolver == null)
              ? NumberingResolver.readDecimal(column)
              : resolver.resolveAtomNumber(column);
    }
    return Arrays.copyOf(serials, n);
  }

  /**
   * The element field is used when it names a known element. Otherwise the element is inferred
   * from the first two columns of the atom name, with four character names beginning with H taken
   * to be hydrogen.
   */
  private Element resolveElement(String elementSymbol, String nameWithSpaces) {
    Element element = elementTable.getBySymbol(elementSymbol);
    if (element != null) {
      return element;
    }
    String name = nameWithSpaces.trim();
    if (name.length() == 4 && name.startsWith("H")) {
      return elementTable.hydrogen();
    }
    String symbol = StringUtils.stripStart(nameWithSpaces.substring(0, 2).trim(), "0123456789");
    element = elementTable.getBySymbol(symbol);
    if (element == null) {
      listener.diagnostic(
          new ParseDiagnostic(
              ParseDiagnostic.Type.UNKNOWN_ELEMENT,
              format(" No element could be determined for atom %s.", name)));
    }
    return element;
  }

  /** Signed integers are accepted with the sign leading or trailing ("2+"). */
  private Integer readCharge(String field, String name) {
    if (field.isEmpty()) {
      return null;
    }
    try {
      return Integer.parseInt(field);
    } catch (NumberFormatException e) {
      try {
        return Integer.parseInt(StringUtils.reverse(field));
      } catch (NumberFormatException e2) {
        listener.diagnostic(
            new ParseDiagnostic(
                ParseDiagnostic.Type.UNPARSABLE_CHARGE,
                format(" Could not read charge \"%s\" of atom %s.", field, name)));
        return null;
      }
    }
  }

  private static double readCoordinate(String field, String axis, String line) {
    try {
      return Double.parseDouble(field.trim());
    } catch (NumberFormatException e) {
      throw new StructureFormatException(
          format(" Could not read the %s coordinate \"%s\".", axis, field.trim()), line, e);
    }
  }

  private double readOptional(
      String field, double defaultValue, ParseDiagnostic.Type type, String name) {
    String value = field.trim();
    if (!value.isEmpty()) {
      try {
        return Double.parseDouble(value);
      } catch (NumberFormatException e) {
        logger.finest(format(" Unreadable field \"%s\": %s", value, e));
      }
    }
    listener.diagnostic(
        new ParseDiagnostic(
            type,
            format(" Using %4.2f for atom %s (field was \"%s\").", defaultValue, name, value)));
    return defaultValue;
  }
}
