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
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * A Chain is the run of residues read under one chain identifier, up to a TER record or a change
 * of identifier.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Chain {

  private final Character chainID;
  private final List<Residue> residues = new ArrayList<>();
  private final Map<String, Residue> residuesByKey = new HashMap<>();
  private final Map<Integer, Residue> residuesByNumber = new HashMap<>();
  private boolean terminated = false;

  /**
   * Constructor for Chain.
   *
   * @param chainID the chain identifier.
   */
  public Chain(Character chainID) {
    this.chainID = chainID;
  }

  /**
   * Append a residue. The first residue added with a given key remains the one returned by the
   * lookups.
   *
   * @param residue the Residue to append.
   */
  public void addResidue(Residue residue) {
    if (residues.isEmpty()) {
      residue.setFirstInChain(true);
    }
    residues.add(residue);
    residuesByKey.putIfAbsent(key(residue.getResidueNumber(), residue.getInsertionCode()), residue);
    residuesByNumber.putIfAbsent(residue.getResidueNumber(), residue);
  }

  /** Mark this chain terminated (a TER record was read) and finalize it. */
  public void addTerRecord() {
    terminated = true;
    finalizeChain();
  }

  /** Set the boundary flags of the first and final residues, and of their atoms. */
  public void finalizeChain() {
    if (residues.isEmpty()) {
      return;
    }
    residues.get(0).setFirstInChain(true);
    residues.get(residues.size() - 1).setFinalInChain(true);
    for (Residue residue : residues) {
      residue.finalizeResidue();
    }
  }

  public Character getChainID() {
    return chainID;
  }

  public boolean isTerminated() {
    return terminated;
  }

  /**
   * Look up a residue.
   *
   * @param residueNumber the sequence number.
   * @param insertionCode the insertion code.
   * @return the first Residue read with this number and insertion code, or null.
   */
  public Residue getResidue(int residueNumber, Character insertionCode) {
    return residuesByKey.get(key(residueNumber, insertionCode));
  }

  /**
   * Look up a residue by number alone.
   *
   * @param residueNumber the sequence number.
   * @return the first Residue read with this number, or null.
   */
  public Residue getResidue(int residueNumber) {
    return residuesByNumber.get(residueNumber);
  }

  public boolean containsResidue(int residueNumber, Character insertionCode) {
    return residuesByKey.containsKey(key(residueNumber, insertionCode));
  }

  public boolean containsResidue(int residueNumber) {
    return residuesByNumber.containsKey(residueNumber);
  }

  public List<Residue> getResidues() {
    return Collections.unmodifiableList(residues);
  }

  public Residue getFirstResidue() {
    return residues.isEmpty() ? null : residues.get(0);
  }

  public Residue getFinalResidue() {
    return residues.isEmpty() ? null : residues.get(residues.size() - 1);
  }

  public Stream<Residue> residues() {
    return residues.stream();
  }

  public Stream<Atom> atoms() {
    return residues.stream().flatMap(Residue::atoms);
  }

  public int size() {
    return residues.size();
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format("Chain %c (%d residues)", chainID, residues.size());
  }

  private static String key(int residueNumber, Character insertionCode) {
    return residueNumber + ":" + insertionCode;
  }
}
