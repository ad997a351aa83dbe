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

import static org.apache.commons.math3.util.FastMath.max;

/**
 * Encoder and decoder for the hybrid alphanumeric numbering used by several molecular graphics
 * programs once a PDB serial or residue sequence number no longer fits its decimal columns.
 *
 * <p>The first character is a single base-36 digit giving the high-order part, and the remaining
 * <code>width - 1</code> characters are a base-36 number giving the low-order part. The decoded
 * value is <code>high * 10^(width - 1) + low</code>, so that "A0000" (width 5) follows 99999 and
 * "A000" (width 4) follows 9999.
 *
 * <p>This is not the Hybrid-36 scheme of the LBL reference implementation: the two agree up to
 * the end of the "A" block but diverge for higher leading digits.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class HybridAlphanumeric {

  private static final String digitsUpper = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ";
  private static final String valueOutOfRange = "value out of range.";
  private static final String invalidNumberLiteral = "invalid number literal.";
  private static final String unsupportedWidth = "unsupported width.";

  private HybridAlphanumeric() {
    // Prevent instantiation.
  }

  /**
   * Decodes a hybrid alphanumeric literal.
   *
   * @param width must be 4 (residue sequence numbers) or 5 (atom serial numbers).
   * @param s the literal; leading and trailing blanks of the low-order part are ignored.
   * @return the decoded value.
   * @throws NumberFormatException if the literal does not have the expected shape.
   * @throws IllegalArgumentException if the width is not supported.
   */
  public static int decode(int width, String s) {
    int scale = lowOrderScale(width);
    if (s == null || s.length() < 2) {
      throw new NumberFormatException(invalidNumberLiteral);
    }
    int high = Character.digit(s.charAt(0), 36);
    if (high < 0) {
      throw new NumberFormatException(invalidNumberLiteral);
    }
    String rest = s.substring(1).trim();
    if (rest.isEmpty()) {
      throw new NumberFormatException(invalidNumberLiteral);
    }
    for (int i = 0; i < rest.length(); i++) {
      if (Character.digit(rest.charAt(i), 36) < 0) {
        throw new NumberFormatException(invalidNumberLiteral);
      }
    }
    int low = Integer.parseInt(rest, 36);
    return high * scale + low;
  }

  /**
   * Encodes a value into a literal of the given width.
   *
   * @param width must be 4 or 5.
   * @param value a value in the range [0, 36 * 10^(width - 1)).
   * @return the literal, exactly <code>width</code> characters long.
   * @throws IllegalArgumentException if the width or value is not supported.
   */
  public static String encode(int width, int value) {
    int scale = lowOrderScale(width);
    if (value < 0) {
      throw new IllegalArgumentException(valueOutOfRange);
    }
    return encode(width, value / scale, value % scale);
  }

  /**
   * Encodes separate high-order and low-order components.
   *
   * @param width must be 4 or 5.
   * @param high the leading base-36 digit, in [0, 36).
   * @param low the low-order part, in [0, 10^(width - 1)).
   * @return the literal, exactly <code>width</code> characters long.
   * @throws IllegalArgumentException if the width or either component is not supported.
   */
  public static String encode(int width, int high, int low) {
    int scale = lowOrderScale(width);
    if (high < 0 || high >= digitsUpper.length() || low < 0 || low >= scale) {
      throw new IllegalArgumentException(valueOutOfRange);
    }
    String tail = Integer.toString(low, 36).toUpperCase();
    return digitsUpper.charAt(high) + "0".repeat(max(0, width - 1 - tail.length())) + tail;
  }

  /**
   * The weight of the leading digit: 10^4 for atom serials and 10^3 for residue numbers.
   */
  private static int lowOrderScale(int width) {
    if (width == 4) {
      return 1000;
    } else if (width == 5) {
      return 10000;
    }
    throw new IllegalArgumentException(unsupportedWidth);
  }
}
