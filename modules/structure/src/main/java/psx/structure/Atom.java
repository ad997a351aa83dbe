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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;
import psx.utilities.StringUtils;

/**
 * The Atom class represents one named atom of a Residue, together with each of its alternate
 * locations.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Atom {

  private final RecordType recordType;
  private final int serialNumber;
  /** Columns 13-16 of the defining record. */
  private final String nameWithSpaces;
  private final String name;
  private final String residueNameWithSpaces;
  private final int residueNumber;
  private final Character insertionCode;
  private final Character chainID;
  private final String segID;
  /** The element field exactly as read (possibly empty). */
  private final String elementSymbol;
  private final Element element;
  private final Integer formalCharge;
  private final Map<Character, Location> locations = new LinkedHashMap<>();
  private final Character defaultAltLoc;

  private boolean firstAtomInChain = false;
  private boolean finalAtomInChain = false;
  private boolean firstResidueInChain = false;
  private boolean finalResidueInChain = false;

  /**
   * Constructor for Atom.
   *
   * @param recordType ATOM or HETATM.
   * @param serialNumber the resolved serial number.
   * @param nameWithSpaces the four column atom name.
   * @param residueNameWithSpaces the residue name as read (three or four columns).
   * @param chainID the chain identifier.
   * @param residueNumber the resolved residue sequence number.
   * @param insertionCode the insertion code (' ' when none).
   * @param segID the segment identifier, trimmed.
   * @param elementSymbol the element field, trimmed.
   * @param element the resolved element, or null.
   * @param formalCharge the formal charge, or null.
   * @param location the location defined by the record.
   */
  public Atom(
      RecordType recordType,
      int serialNumber,
      String nameWithSpaces,
      String residueNameWithSpaces,
      Character chainID,
      int residueNumber,
      Character insertionCode,
      String segID,
      String elementSymbol,
      Element element,
      Integer formalCharge,
      Location location) {
    this.recordType = recordType;
    this.serialNumber = serialNumber;
    this.nameWithSpaces = nameWithSpaces;
    this.name = nameWithSpaces.trim();
    this.residueNameWithSpaces = residueNameWithSpaces;
    this.chainID = chainID;
    this.residueNumber = residueNumber;
    this.insertionCode = insertionCode;
    this.segID = segID;
    this.elementSymbol = elementSymbol;
    this.element = element;
    this.formalCharge = formalCharge;
    this.defaultAltLoc = location.getAltLoc();
    locations.put(defaultAltLoc, location);
  }

  /**
   * Merge the locations of another record of this atom. Locations whose indicator is already
   * present are ignored.
   *
   * @param atom another record of this atom.
   */
  void addLocations(Atom atom) {
    for (Location location : atom.locations.values()) {
      locations.putIfAbsent(location.getAltLoc(), location);
    }
  }

  public RecordType getRecordType() {
    return recordType;
  }

  public int getSerialNumber() {
    return serialNumber;
  }

  public String getName() {
    return name;
  }

  public String getNameWithSpaces() {
    return nameWithSpaces;
  }

  public String getResidueNameWithSpaces() {
    return residueNameWithSpaces;
  }

  public String getResidueName() {
    return residueNameWithSpaces.trim();
  }

  public int getResidueNumber() {
    return residueNumber;
  }

  public Character getInsertionCode() {
    return insertionCode;
  }

  public Character getChainID() {
    return chainID;
  }

  public String getSegID() {
    return segID;
  }

  public String getElementSymbol() {
    return elementSymbol;
  }

  /**
   * The element, if the record (or the atom name) identified one.
   *
   * @return the Element, or null.
   */
  public Element getElement() {
    return element;
  }

  /**
   * The formal charge from columns 79-80.
   *
   * @return the charge, or null if the field was blank or could not be read.
   */
  public Integer getFormalCharge() {
    return formalCharge;
  }

  /**
   * The alternate location indicator of the default location.
   *
   * @return the indicator.
   */
  public Character getAltLoc() {
    return defaultAltLoc;
  }

  /**
   * The default location, which is the location defined by the first record of this atom.
   *
   * @return the default Location.
   */
  public Location getLocation() {
    return locations.get(defaultAltLoc);
  }

  /**
   * Look up a location by its alternate location indicator.
   *
   * @param altLoc an indicator.
   * @return the Location, or null.
   */
  public Location getLocation(Character altLoc) {
    return locations.get(altLoc);
  }

  public boolean hasLocation(Character altLoc) {
    return locations.containsKey(altLoc);
  }

  /**
   * Getter for the field <code>locations</code>, in the order they were read.
   *
   * @return an unmodifiable List of Locations.
   */
  public List<Location> getLocations() {
    return Collections.unmodifiableList(new ArrayList<>(locations.values()));
  }

  /**
   * The alternate location indicators of this atom, sorted.
   *
   * @return a sorted List of indicators.
   */
  public List<Character> getAltLocs() {
    List<Character> altLocs = new ArrayList<>(locations.keySet());
    Collections.sort(altLocs);
    return altLocs;
  }

  public double[] getXYZ(double[] xyz) {
    return getLocation().getXYZ(xyz);
  }

  public double getX() {
    return getLocation().getX();
  }

  public double getY() {
    return getLocation().getY();
  }

  public double getZ() {
    return getLocation().getZ();
  }

  public double getOccupancy() {
    return getLocation().getOccupancy();
  }

  public double getTempFactor() {
    return getLocation().getTempFactor();
  }

  /**
   * Coordinates of the default location, or of every location.
   *
   * @param includeAltLocs if true, one position per location in the order read.
   * @return a Stream of coordinate triples (fresh arrays).
   */
  public Stream<double[]> positions(boolean includeAltLocs) {
    if (!includeAltLocs) {
      return Stream.of(getXYZ(null));
    }
    return locations.values().stream().map(l -> l.getXYZ(null));
  }

  public boolean isFirstAtomInChain() {
    return firstAtomInChain;
  }

  void setFirstAtomInChain(boolean firstAtomInChain) {
    this.firstAtomInChain = firstAtomInChain;
  }

  public boolean isFinalAtomInChain() {
    return finalAtomInChain;
  }

  void setFinalAtomInChain(boolean finalAtomInChain) {
    this.finalAtomInChain = finalAtomInChain;
  }

  public boolean isFirstResidueInChain() {
    return firstResidueInChain;
  }

  void setFirstResidueInChain(boolean firstResidueInChain) {
    this.firstResidueInChain = firstResidueInChain;
  }

  public boolean isFinalResidueInChain() {
    return finalResidueInChain;
  }

  void setFinalResidueInChain(boolean finalResidueInChain) {
    this.finalResidueInChain = finalResidueInChain;
  }

  /**
   * Render one location of this atom as an 80 column ATOM or HETATM record.
   *
   * @param serial the serial number to write, which may differ from the one read.
   * @param altLoc the location to write.
   * @return the record, without a line terminator.
   * @throws IllegalArgumentException if this atom has no such location.
   */
  public String toPDBString(int serial, Character altLoc) {
    Location location = locations.get(altLoc);
    if (location == null) {
      throw new IllegalArgumentException(
          format(" Atom %s has no alternate location '%c'.", name, altLoc));
    }
    StringBuilder sb = new StringBuilder(StringUtils.PDB_RECORD_WIDTH);
    sb.append(
        format(
            Locale.US,
            "%-6s%5d %4s%c%-4s%c%4d%c   ",
            recordType.name(),
            serial,
            nameWithSpaces,
            altLoc,
            location.getResidueNameWithSpaces(),
            chainID,
            residueNumber,
            insertionCode));
    sb.append(
        format(
            Locale.US,
            "%8.3f%8.3f%8.3f%6.2f%6.2f      ",
            location.getX(),
            location.getY(),
            location.getZ(),
            location.getOccupancy(),
            location.getTempFactor()));
    sb.append(format("%-4s%2s", segID, elementSymbol));
    if (formalCharge != null) {
      sb.append(format(Locale.US, "%+2d", formalCharge));
    } else {
      sb.append("  ");
    }
    return sb.toString();
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return toPDBString(serialNumber, defaultAltLoc);
  }

  /** The two coordinate record types. */
  public enum RecordType {
    ATOM,
    HETATM
  }
}
