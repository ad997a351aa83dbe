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
package psx.structure;

import static java.lang.String.format;

/**
 * The UnitCell class holds the lattice parameters of a CRYST1 record.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class UnitCell {

  /** Length of the cell axes in Angstroms. */
  public final double a;
  public final double b;
  public final double c;
  /** Interaxial angles in degrees. */
  public final double alpha;
  public final double beta;
  public final double gamma;

  /**
   * The UnitCell constructor.
   *
   * @param a The a-axis length.
   * @param b The b-axis length.
   * @param c The c-axis length.
   * @param alpha The alpha angle.
   * @param beta The beta angle.
   * @param gamma The gamma angle.
   */
  public UnitCell(double a, double b, double c, double alpha, double beta, double gamma) {
    this.a = a;
    this.b = b;
    this.c = c;
    this.alpha = alpha;
    this.beta = beta;
    this.gamma = gamma;
  }

  /**
   * Getter for the cell axis lengths.
   *
   * @return a new array {a, b, c}.
   */
  public double[] getUnitCellLengths() {
    return new double[] {a, b, c};
  }

  /**
   * Getter for the cell angles.
   *
   * @return a new array {alpha, beta, gamma}.
   */
  public double[] getUnitCellAngles() {
    return new double[] {alpha, beta, gamma};
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(
        " Unit cell: %8.3f %8.3f %8.3f %8.3f %8.3f %8.3f", a, b, c, alpha, beta, gamma);
  }
}
