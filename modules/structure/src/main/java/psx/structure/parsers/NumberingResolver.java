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
import static psx.structure.parsers.NumberingMode.DECIMAL;
import static psx.structure.parsers.NumberingMode.HYBRID_ALPHANUMERIC;
import static psx.structure.parsers.NumberingMode.SEQUENTIAL_GUESS;

import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import psx.structure.Residue;
import psx.utilities.HybridAlphanumeric;

/**
 * The NumberingResolver turns the serial number and residue sequence number columns of coordinate
 * records into integers, following the conventions programs use once the numbers no longer fit
 * their columns.
 *
 * <p>Each sequence (atom and residue) starts in decimal. When the next expected value passes the
 * largest decimal that fits, or a token cannot be read as decimal, the token is inspected to
 * choose a numbering mode: hexadecimal, hybrid alphanumeric or sequential guessing. The mode stays
 * in force until the sequence is reset. If a locked mode cannot decode a token the resolver falls
 * back to sequential guessing, which infers numbers from the records read before.
 *
 * <p>One resolver holds the state of one load and must not be shared between concurrent loads.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class NumberingResolver {

  private static final Logger logger = Logger.getLogger(NumberingResolver.class.getName());

  private static final Pattern DECIMAL_PATTERN = Pattern.compile("[+-]?[0-9]+");

  private final DiagnosticListener listener;
  private final Counter atoms = new Counter(CounterType.ATOM);
  private final Counter residues = new Counter(CounterType.RESIDUE);

  /**
   * Constructor for NumberingResolver.
   *
   * @param listener receives overflow and fallback diagnostics.
   */
  public NumberingResolver(DiagnosticListener listener) {
    this.listener = listener;
  }

  /**
   * Read a number without overflow handling, as is done for records parsed outside a load.
   *
   * @param token the column contents.
   * @return the decimal value, or 0 if the token is not a decimal integer.
   */
  public static int readDecimal(String token) {
    String trimmed = token.trim();
    if (isDecimal(trimmed)) {
      return Integer.parseInt(trimmed);
    }
    return 0;
  }

  /**
   * Resolve an atom serial number (columns 7-11, or a CONECT field).
   *
   * @param token the column contents.
   * @return the serial number.
   */
  public int resolveAtomNumber(String token) {
    return resolve(atoms, token, null);
  }

  /**
   * Resolve a residue sequence number (columns 23-26).
   *
   * @param token the column contents.
   * @param openResidue the residue currently being filled, or null.
   * @param atomNameWithSpaces the four column atom name of the record.
   * @param residueNameWithSpaces the residue name of the record.
   * @return the residue sequence number.
   */
  public int resolveResidueNumber(
      String token, Residue openResidue, String atomNameWithSpaces, String residueNameWithSpaces) {
    ResidueContext context =
        new ResidueContext(openResidue, atomNameWithSpaces, residueNameWithSpaces);
    return resolve(residues, token, context);
  }

  /**
   * Record that an atom has been read, advancing both expected values.
   *
   * @param atomNumber the resolved serial number.
   * @param residueNumber the resolved residue sequence number.
   */
  public void advance(int atomNumber, int residueNumber) {
    atoms.next = atomNumber + 1;
    residues.next = residueNumber + 1;
  }

  /** Return atom numbering to decimal, expecting serial number 1 next. */
  public void resetAtomNumbering() {
    atoms.reset();
  }

  /** Return residue numbering to decimal, expecting sequence number 1 next. */
  public void resetResidueNumbering() {
    residues.reset();
  }

  public int getNextAtomNumber() {
    return atoms.next;
  }

  public int getNextResidueNumber() {
    return residues.next;
  }

  public NumberingMode getAtomNumberingMode() {
    return atoms.mode;
  }

  public NumberingMode getResidueNumberingMode() {
    return residues.mode;
  }

  private int resolve(Counter counter, String column, ResidueContext context) {
    String token = column.trim();
    CounterType type = counter.type;
    if (counter.mode == DECIMAL) {
      boolean overflowed = counter.next > type.getCeiling() && type.isOverflowCandidate(token);
      if (!overflowed && isDecimal(token)) {
        return Integer.parseInt(token);
      }
      NumberingMode mode = type.sentinelMode(token);
      if (mode == null && CounterType.startsWithUpperCase(token)) {
        mode = HYBRID_ALPHANUMERIC;
        listener.diagnostic(
            new ParseDiagnostic(
                ParseDiagnostic.Type.OVERFLOW_MODE_GUESS,
                format(
                    " Guessing hybrid alphanumeric %s numbering from \"%s\" (expected %d).",
                    type.name().toLowerCase(), token, counter.next)));
      }
      if (mode == null) {
        return fallBack(counter, token, context);
      }
      if (logger.isLoggable(Level.FINE)) {
        logger.fine(format(" Switching %s numbering to %s at \"%s\".", type, mode, token));
      }
      counter.mode = mode;
    }
    try {
      return decode(counter, token, context);
    } catch (NumberFormatException e) {
      return fallBack(counter, token, context);
    }
  }

  private int fallBack(Counter counter, String token, ResidueContext context) {
    counter.mode = SEQUENTIAL_GUESS;
    listener.diagnostic(
        new ParseDiagnostic(
            ParseDiagnostic.Type.SEQUENTIAL_FALLBACK,
            format(
                " Could not read %s number \"%s\"; numbers will be assigned sequentially.",
                counter.type.name().toLowerCase(), token)));
    return decode(counter, token, context);
  }

  private static int decode(Counter counter, String token, ResidueContext context) {
    switch (counter.mode) {
      case HEXADECIMAL:
        return Integer.parseInt(token, 16);
      case HYBRID_ALPHANUMERIC:
        return HybridAlphanumeric.decode(counter.type.getWidth(), token);
      case SEQUENTIAL_GUESS:
        if (context == null) {
          return counter.next;
        }
        return context.guess(counter.next);
      default:
        return Integer.parseInt(token);
    }
  }

  private static boolean isDecimal(String token) {
    return DECIMAL_PATTERN.matcher(token).matches();
  }

  /** The mode and next expected value of one numbering sequence. */
  private static class Counter {

    private final CounterType type;
    private int next = 1;
    private NumberingMode mode = DECIMAL;

    Counter(CounterType type) {
      this.type = type;
    }

    void reset() {
      next = 1;
      mode = DECIMAL;
    }
  }

  /** What is known about the residue a record belongs to, for sequential guessing. */
  private record ResidueContext(
      Residue openResidue, String atomNameWithSpaces, String residueNameWithSpaces) {

    /**
     * A record continues the open residue when the residue name matches and the atom name is not
     * yet taken; otherwise it starts the next residue.
     */
    int guess(int next) {
      if (openResidue == null
          || !openResidue.getNameWithSpaces().equals(residueNameWithSpaces)
          || openResidue.containsAtom(atomNameWithSpaces)) {
        return next;
      }
      return openResidue.getResidueNumber();
    }
  }
}
