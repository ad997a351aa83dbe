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
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A Model is one MODEL/ENDMDL block of a coordinate file, or the whole file when no MODEL records
 * are present.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Model {

  private final int number;
  private final List<Chain> chains = new ArrayList<>();
  private final Map<Character, Chain> chainsByID = new HashMap<>();
  private final List<int[]> connects = new ArrayList<>();

  /**
   * Constructor for Model.
   *
   * @param number the model number.
   */
  public Model(int number) {
    this.number = number;
  }

  /**
   * Append a chain. The first chain added with a given identifier remains the one returned by
   * {@link #getChain(Character)}.
   *
   * @param chain the Chain to append.
   */
  public void addChain(Chain chain) {
    chains.add(chain);
    chainsByID.putIfAbsent(chain.getChainID(), chain);
  }

  /**
   * Record the serial numbers of a CONECT record.
   *
   * @param serials the resolved serial numbers; the first is the central atom.
   */
  public void addConnect(int[] serials) {
    connects.add(serials.clone());
  }

  /** Finalize every chain. */
  public void finalizeModel() {
    for (Chain chain : chains) {
      chain.finalizeChain();
    }
  }

  public int getNumber() {
    return number;
  }

  /**
   * Look up a chain by identifier.
   *
   * @param chainID a chain identifier.
   * @return the first Chain read with this identifier, or null.
   */
  public Chain getChain(Character chainID) {
    return chainsByID.get(chainID);
  }

  public boolean containsChain(Character chainID) {
    return chainsByID.containsKey(chainID);
  }

  /**
   * The distinct chain identifiers, in the order first read.
   *
   * @return a List of identifiers.
   */
  public List<Character> getChainIDs() {
    return chains.stream().map(Chain::getChainID).distinct().collect(Collectors.toList());
  }

  public List<Chain> getChains() {
    return Collections.unmodifiableList(chains);
  }

  /**
   * The connectivity read from CONECT records, one array of serial numbers per record.
   *
   * @return an unmodifiable List.
   */
  public List<int[]> getConnects() {
    return Collections.unmodifiableList(connects);
  }

  public Stream<Chain> chains() {
    return chains.stream();
  }

  public Stream<Residue> residues() {
    return chains.stream().flatMap(Chain::residues);
  }

  public Stream<Atom> atoms() {
    return chains.stream().flatMap(Chain::atoms);
  }

  public int size() {
    return chains.size();
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format("Model %d (%d chains)", number, chains.size());
  }
}
