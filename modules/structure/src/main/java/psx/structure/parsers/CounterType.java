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

import static psx.structure.parsers.NumberingMode.HEXADECIMAL;
import static psx.structure.parsers.NumberingMode.HYBRID_ALPHANUMERIC;
import static psx.structure.parsers.NumberingMode.SEQUENTIAL_GUESS;

/**
 * The two numbering sequences of a coordinate record, with the column width, largest decimal
 * value and first-overflow sentinels of each.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public enum CounterType {
  /** Atom serial numbers, columns 7-11. */
  ATOM(5, 99999, "186a0", "A0000", "*****"),
  /** Residue sequence numbers, columns 23-26. */
  RESIDUE(4, 9999, "2710", "A000", "****");

  private final int width;
  private final int ceiling;
  private final String hexadecimalSentinel;
  private final String hybridSentinel;
  private final String overflowSentinel;

  CounterType(
      int width,
      int ceiling,
      String hexadecimalSentinel,
      String hybridSentinel,
      String overflowSentinel) {
    this.width = width;
    this.ceiling = ceiling;
    this.hexadecimalSentinel = hexadecimalSentinel;
    this.hybridSentinel = hybridSentinel;
    this.overflowSentinel = overflowSentinel;
  }

  public int getWidth() {
    return width;
  }

  /**
   * The largest value that fits the column in decimal.
   *
   * @return 99999 for atoms and 9999 for residues.
   */
  public int getCeiling() {
    return ceiling;
  }

  /**
   * The numbering mode announced by the first number to overflow.
   *
   * @param token the trimmed column contents.
   * @return the mode, or null if the token is not a sentinel.
   */
  public NumberingMode sentinelMode(String token) {
    if (hexadecimalSentinel.equalsIgnoreCase(token)) {
      return HEXADECIMAL;
    } else if (hybridSentinel.equals(token)) {
      return HYBRID_ALPHANUMERIC;
    } else if (overflowSentinel.equals(token)) {
      return SEQUENTIAL_GUESS;
    }
    return null;
  }

  /**
   * Whether a token read after the counter passed its ceiling should be treated as an overflowed
   * number: it is a sentinel, or it starts with an upper case letter.
   *
   * @param token the trimmed column contents.
   * @return true if the token begins overflow numbering.
   */
  public boolean isOverflowCandidate(String token) {
    return sentinelMode(token) != null || startsWithUpperCase(token);
  }

  static boolean startsWithUpperCase(String token) {
    if (token.isEmpty()) {
      return false;
    }
    char c = token.charAt(0);
    return c >= 'A' && c <= 'Z';
  }
}
