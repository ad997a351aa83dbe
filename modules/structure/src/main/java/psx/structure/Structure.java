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
 * The Structure class is the root of the hierarchy read from a PDB file: an ordered list of models
 * and an optional unit cell.
 *
 * <p>Each iterate method returns an {@link Iterable} whose iterators walk the hierarchy lazily;
 * every call to {@link Iterable#iterator()} starts a fresh traversal. When only the first model is
 * requested, the first model is the default model.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Structure {

  private final List<Model> models = new ArrayList<>();
  private final Map<Integer, Model> modelsByNumber = new HashMap<>();
  private UnitCell unitCell = null;

  /**
   * Append a model. The first model added with a given number remains the one returned by {@link
   * #getModel(int)}.
   *
   * @param model the Model to append.
   */
  public void addModel(Model model) {
    models.add(model);
    modelsByNumber.putIfAbsent(model.getNumber(), model);
  }

  /**
   * Getter for the field <code>unitCell</code>.
   *
   * @return the UnitCell from the CRYST1 record, or null.
   */
  public UnitCell getUnitCell() {
    return unitCell;
  }

  public void setUnitCell(UnitCell unitCell) {
    this.unitCell = unitCell;
  }

  /**
   * Look up a model by its number.
   *
   * @param number the model number.
   * @return the Model, or null.
   */
  public Model getModel(int number) {
    return modelsByNumber.get(number);
  }

  public boolean containsModel(int number) {
    return modelsByNumber.containsKey(number);
  }

  /**
   * The default model, which is the first model read.
   *
   * @return the first Model, or null if the structure is empty.
   */
  public Model getDefaultModel() {
    return models.isEmpty() ? null : models.get(0);
  }

  /**
   * The model numbers, in file order.
   *
   * @return a List of model numbers.
   */
  public List<Integer> getModelNumbers() {
    return models.stream().map(Model::getNumber).collect(Collectors.toList());
  }

  public List<Model> getModels() {
    return Collections.unmodifiableList(models);
  }

  public int size() {
    return models.size();
  }

  /**
   * Iterate over the models.
   *
   * @param allModels if false, only the first model is visited.
   * @return an Iterable over Models.
   */
  public Iterable<Model> iterateModels(boolean allModels) {
    return () -> models(allModels).iterator();
  }

  /**
   * Iterate over the chains of each visited model.
   *
   * @param allModels if false, only the first model is visited.
   * @return an Iterable over Chains.
   */
  public Iterable<Chain> iterateChains(boolean allModels) {
    return () -> models(allModels).flatMap(Model::chains).iterator();
  }

  /**
   * Iterate over the residues of each visited model.
   *
   * @param allModels if false, only the first model is visited.
   * @return an Iterable over Residues.
   */
  public Iterable<Residue> iterateResidues(boolean allModels) {
    return () -> models(allModels).flatMap(Model::residues).iterator();
  }

  /**
   * Iterate over the atoms of each visited model.
   *
   * @param allModels if false, only the first model is visited.
   * @return an Iterable over Atoms.
   */
  public Iterable<Atom> iterateAtoms(boolean allModels) {
    return () -> models(allModels).flatMap(Model::atoms).iterator();
  }

  /**
   * Iterate over atomic coordinates.
   *
   * @param allModels if false, only the first model is visited.
   * @param includeAltLocs if true, every location of each atom is visited; otherwise only its
   *     default location.
   * @return an Iterable over coordinate triples.
   */
  public Iterable<double[]> iteratePositions(boolean allModels, boolean includeAltLocs) {
    return () ->
        models(allModels)
            .flatMap(Model::atoms)
            .flatMap(a -> a.positions(includeAltLocs))
            .iterator();
  }

  private Stream<Model> models(boolean allModels) {
    if (allModels) {
      return models.stream();
    }
    return models.stream().limit(1);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format("Structure (%d models)", models.size());
  }
}
