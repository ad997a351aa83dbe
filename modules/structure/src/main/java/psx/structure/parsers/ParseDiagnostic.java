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

/**
 * A recoverable anomaly noticed while loading a PDB file.
 *
 * @param type the kind of anomaly.
 * @param message a description, beginning with a space.
 * @param lineNumber the 1-based line number, or 0 if unknown.
 * @author Michael J. Schnieders
 * @since 1.0
 */
public record ParseDiagnostic(Type type, String message, int lineNumber) {

  /**
   * Constructor for a diagnostic whose line number is not known.
   *
   * @param type the kind of anomaly.
   * @param message a description.
   */
  public ParseDiagnostic(Type type, String message) {
    this(type, message, 0);
  }

  /**
   * Copy this diagnostic with a line number.
   *
   * @param lineNumber the 1-based line number.
   * @return a new ParseDiagnostic.
   */
  public ParseDiagnostic atLine(int lineNumber) {
    return new ParseDiagnostic(type, message, lineNumber);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    if (lineNumber > 0) {
      return format("%s (line %d)", message, lineNumber);
    }
    return message;
  }

  /** Kinds of recoverable anomaly, with the level at which each is logged. */
  public enum Type {
    /** An overflowing number matched no sentinel and its numbering mode was guessed. */
    OVERFLOW_MODE_GUESS(Level.WARNING),
    /** Numbers could no longer be decoded and are now inferred from context. */
    SEQUENTIAL_FALLBACK(Level.WARNING),
    /** The residue name changed within one residue slot without an alternate location. */
    RESIDUE_NAME_CHANGE(Level.WARNING),
    /** A formal charge field could not be read. */
    UNPARSABLE_CHARGE(Level.WARNING),
    /** A TER, CONECT or END record arrived before any atom. */
    ORPHAN_RECORD(Level.WARNING),
    /** An occupancy field was blank or unreadable and 1.0 was used. */
    DEFAULT_OCCUPANCY(Level.FINE),
    /** A temperature factor field was blank or unreadable and 0.0 was used. */
    DEFAULT_TEMP_FACTOR(Level.FINE),
    /** No element could be determined for an atom. */
    UNKNOWN_ELEMENT(Level.FINE);

    private final Level level;

    Type(Level level) {
      this.level = level;
    }

    public Level getLevel() {
      return level;
    }
  }
}
