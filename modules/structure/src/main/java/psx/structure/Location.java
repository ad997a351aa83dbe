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

/**
 * One alternate conformation of an Atom: coordinates, occupancy and temperature factor, together
 * with the residue name recorded on the line that defined it.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Location {

  private final Character altLoc;
  private final double[] xyz;
  private final double occupancy;
  private final double tempFactor;
  private final String residueNameWithSpaces;

  /**
   * Constructor for Location.
   *
   * @param altLoc the alternate location indicator (' ' when none is given).
   * @param xyz Cartesian coordinates in Angstroms.
   * @param occupancy the occupancy.
   * @param tempFactor the temperature factor.
   * @param residueNameWithSpaces the residue name of the record, exactly as read.
   */
  public Location(
      Character altLoc,
      double[] xyz,
      double occupancy,
      double tempFactor,
      String residueNameWithSpaces) {
    this.altLoc = altLoc;
    this.xyz = new double[] {xyz[0], xyz[1], xyz[2]};
    this.occupancy = occupancy;
    this.tempFactor = tempFactor;
    this.residueNameWithSpaces = residueNameWithSpaces;
  }

  public Character getAltLoc() {
    return altLoc;
  }

  /**
   * Copy the coordinates into an array.
   *
   * @param xyz an array of length 3, or null to allocate a new one.
   * @return the coordinates.
   */
  public double[] getXYZ(double[] xyz) {
    if (xyz == null) {
      xyz = new double[3];
    }
    xyz[0] = this.xyz[0];
    xyz[1] = this.xyz[1];
    xyz[2] = this.xyz[2];
    return xyz;
  }

  public double getX() {
    return xyz[0];
  }

  public double getY() {
    return xyz[1];
  }

  public double getZ() {
    return xyz[2];
  }

  public double getOccupancy() {
    return occupancy;
  }

  public double getTempFactor() {
    return tempFactor;
  }

  public String getResidueNameWithSpaces() {
    return residueNameWithSpaces;
  }

  public String getResidueName() {
    return residueNameWithSpaces.trim();
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return String.format(
        "[%c] (%8.3f,%8.3f,%8.3f) %6.2f %6.2f %s",
        altLoc, xyz[0], xyz[1], xyz[2], occupancy, tempFactor, getResidueName());
  }
}
