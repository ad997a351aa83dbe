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

/**
 * Thrown when a record cannot be turned into part of a structure, for example when a coordinate
 * column is blank or the residue name is misaligned.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class StructureFormatException extends RuntimeException {

  private final String line;
  private final int lineNumber;
  private final int nextAtomNumber;
  private final int nextResidueNumber;

  /**
   * Constructor for StructureFormatException.
   *
   * @param message the problem.
   * @param line the offending record.
   * @param cause the underlying exception, or null.
   */
  public StructureFormatException(String message, String line, Throwable cause) {
    this(message, line, 0, 0, 0, cause);
  }

  /**
   * Constructor for StructureFormatException.
   *
   * @param message the problem.
   * @param line the offending record.
   * @param lineNumber its 1-based line number, or 0 if unknown.
   * @param nextAtomNumber the next expected atom serial number.
   * @param nextResidueNumber the next expected residue sequence number.
   * @param cause the underlying exception, or null.
   */
  public StructureFormatException(
      String message,
      String line,
      int lineNumber,
      int nextAtomNumber,
      int nextResidueNumber,
      Throwable cause) {
    super(message, cause);
    this.line = line;
    this.lineNumber = lineNumber;
    this.nextAtomNumber = nextAtomNumber;
    this.nextResidueNumber = nextResidueNumber;
  }

  public String getLine() {
    return line;
  }

  public int getLineNumber() {
    return lineNumber;
  }

  public int getNextAtomNumber() {
    return nextAtomNumber;
  }

  public int getNextResidueNumber() {
    return nextResidueNumber;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(super.toString());
    if (lineNumber > 0) {
      sb.append(format("\n Line %d: %s", lineNumber, line));
      sb.append(
          format(
              "\n Next expected atom number %d, residue number %d.",
              nextAtomNumber, nextResidueNumber));
    } else if (line != null) {
      sb.append(format("\n Record: %s", line));
    }
    return sb.toString();
  }
}
