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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The Residue class groups the atoms that share a chain, sequence number and insertion code.
 *
 * <p>A residue records a name for each alternate location indicator it has seen, so that point
 * mutations (two residue types modeled as alternate conformations) are kept together.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Residue {

  /** Selector for every alternate location of an atom. */
  public static final String ALL_LOCATIONS = "*";

  private final int residueNumber;
  private final Character insertionCode;
  private final Character primaryAltLoc;
  private final String segID;
  private final Map<Character, String> namesByAltLoc = new LinkedHashMap<>();
  private final List<Atom> atoms = new ArrayList<>();
  /** Atoms keyed by both their trimmed and their four column names. */
  private final Map<String, Atom> atomsByName = new HashMap<>();

  private boolean firstInChain = false;
  private boolean finalInChain = false;

  /**
   * Constructor for Residue.
   *
   * @param nameWithSpaces the residue name of the primary location.
   * @param residueNumber the sequence number.
   * @param insertionCode the insertion code.
   * @param primaryAltLoc the alternate location indicator of the atom that opened the residue.
   * @param segID the segment identifier.
   */
  public Residue(
      String nameWithSpaces,
      int residueNumber,
      Character insertionCode,
      Character primaryAltLoc,
      String segID) {
    this.residueNumber = residueNumber;
    this.insertionCode = insertionCode;
    this.primaryAltLoc = primaryAltLoc;
    this.segID = segID;
    namesByAltLoc.put(primaryAltLoc, nameWithSpaces);
  }

  /**
   * Add an atom to this residue.
   *
   * <p>An atom whose four column name is already present contributes its location to the existing
   * atom, unless that location indicator is also present, in which case the record is a duplicate
   * and is dropped.
   *
   * @param atom the Atom to add.
   * @return true if the atom was appended as a new member of the residue.
   * @throws IllegalArgumentException if the atom belongs to a different residue.
   */
  public boolean addAtom(Atom atom) {
    if (atom.getResidueNumber() != residueNumber
        || !Objects.equals(atom.getInsertionCode(), insertionCode)) {
      throw new IllegalArgumentException(
          format(
              " Atom %s (%d%c) does not belong to residue %d%c.",
              atom.getName(),
              atom.getResidueNumber(),
              atom.getInsertionCode(),
              residueNumber,
              insertionCode));
    }
    Character altLoc = atom.getAltLoc();
    namesByAltLoc.putIfAbsent(altLoc, atom.getResidueNameWithSpaces());

    Atom existing = atomsByName.get(atom.getNameWithSpaces());
    if (existing != null) {
      if (!existing.hasLocation(altLoc)) {
        existing.addLocations(atom);
      }
      return false;
    }

    atoms.add(atom);
    atomsByName.put(atom.getNameWithSpaces(), atom);
    atomsByName.putIfAbsent(atom.getName(), atom);
    return true;
  }

  /** Propagate the chain boundary flags to the first, last and all atoms. */
  void finalizeResidue() {
    if (atoms.isEmpty()) {
      return;
    }
    atoms.get(0).setFirstAtomInChain(firstInChain);
    atoms.get(atoms.size() - 1).setFinalAtomInChain(finalInChain);
    for (Atom atom : atoms) {
      atom.setFirstResidueInChain(firstInChain);
      atom.setFinalResidueInChain(finalInChain);
    }
  }

  /**
   * The name of the primary location, exactly as read.
   *
   * @return the residue name with spaces.
   */
  public String getNameWithSpaces() {
    return namesByAltLoc.get(primaryAltLoc);
  }

  public String getName() {
    return getNameWithSpaces().trim();
  }

  /**
   * The residue name recorded for an alternate location.
   *
   * @param altLoc an alternate location indicator.
   * @return the trimmed name, or null if the indicator was not seen in this residue.
   */
  public String getName(Character altLoc) {
    String name = namesByAltLoc.get(altLoc);
    if (name == null) {
      return null;
    }
    return name.trim();
  }

  /**
   * The residue name recorded for an alternate location, exactly as read.
   *
   * @param altLoc an alternate location indicator.
   * @return the name with spaces, or null.
   */
  public String getNameWithSpaces(Character altLoc) {
    return namesByAltLoc.get(altLoc);
  }

  public Character getPrimaryAltLoc() {
    return primaryAltLoc;
  }

  public int getResidueNumber() {
    return residueNumber;
  }

  public Character getInsertionCode() {
    return insertionCode;
  }

  public String getSegID() {
    return segID;
  }

  public boolean isFirstInChain() {
    return firstInChain;
  }

  void setFirstInChain(boolean firstInChain) {
    this.firstInChain = firstInChain;
  }

  public boolean isFinalInChain() {
    return finalInChain;
  }

  void setFinalInChain(boolean finalInChain) {
    this.finalInChain = finalInChain;
  }

  /**
   * Look up an atom by name. Both trimmed ("CA") and four column (" CA ") names are accepted.
   *
   * @param name the atom name.
   * @return the Atom, or null.
   */
  public Atom getAtom(String name) {
    return atomsByName.get(name);
  }

  public boolean containsAtom(String name) {
    return atomsByName.containsKey(name);
  }

  /**
   * Getter for the field <code>atoms</code>, in the order they were read.
   *
   * @return an unmodifiable List of Atoms.
   */
  public List<Atom> getAtoms() {
    return Collections.unmodifiableList(atoms);
  }

  /**
   * The atoms present in the selected alternate locations. A location with a blank indicator is
   * shared by every conformer.
   *
   * @param altLocs null or empty selects the atoms present at the primary location of this
   *     residue; {@link #ALL_LOCATIONS} selects every atom; otherwise each character is an
   *     indicator to select.
   * @return the selected Atoms, in the order read.
   */
  public List<Atom> getAtoms(String altLocs) {
    if (ALL_LOCATIONS.equals(altLocs)) {
      return getAtoms();
    }
    String selected =
        (altLocs == null || altLocs.isEmpty()) ? String.valueOf(primaryAltLoc) : altLocs;
    return atoms.stream()
        .filter(a -> a.hasLocation(' ') || selected.chars().anyMatch(c -> a.hasLocation((char) c)))
        .collect(Collectors.toList());
  }

  /**
   * Stream the atoms of this residue.
   *
   * @return a Stream of Atoms.
   */
  public Stream<Atom> atoms() {
    return atoms.stream();
  }

  public int size() {
    return atoms.size();
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    if (insertionCode == ' ') {
      return format("%s-%d", getName(), residueNumber);
    }
    return format("%s-%d%c", getName(), residueNumber, insertionCode);
  }
}
