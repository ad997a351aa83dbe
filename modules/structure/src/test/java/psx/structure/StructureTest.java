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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import psx.structure.Atom.RecordType;
import psx.utilities.PSXTest;

/**
 * Tests of Structure traversal and lookup.
 *
 * @author Michael J. Schnieders
 */
public class StructureTest extends PSXTest {

  private static final double tolerance = 1.0e-6;

  private Structure structure;

  private static Atom atom(
      int serial, String name, char altLoc, String residueName, int residueNumber, double x) {
    Location location = new Location(altLoc, new double[] {x, 0.0, 0.0}, 1.0, 0.0, residueName);
    return new Atom(
        RecordType.ATOM,
        serial,
        name,
        residueName,
        'A',
        residueNumber,
        ' ',
        "",
        "C",
        Element.C,
        null,
        location);
  }

  /** Two models, each with one chain of two residues; the first CB has two locations. */
  @Before
  public void setUp() {
    structure = new Structure();
    for (int m = 0; m < 2; m++) {
      Model model = new Model(m * 5);
      Chain chain = new Chain('A');
      model.addChain(chain);
      Residue ala = new Residue("ALA", 1, ' ', ' ', "");
      chain.addResidue(ala);
      ala.addAtom(atom(1, " CA ", ' ', "ALA", 1, 1.0 + m));
      ala.addAtom(atom(2, " CB ", 'A', "ALA", 1, 2.0 + m));
      ala.addAtom(atom(3, " CB ", 'B', "ALA", 1, 3.0 + m));
      Residue gly = new Residue("GLY", 2, ' ', ' ', "");
      chain.addResidue(gly);
      gly.addAtom(atom(4, " CA ", ' ', "GLY", 2, 4.0 + m));
      chain.addTerRecord();
      model.finalizeModel();
      structure.addModel(model);
    }
  }

  @Test
  public void testModelLookup() {
    assertEquals(2, structure.size());
    assertEquals(List.of(0, 5), structure.getModelNumbers());
    assertSame(structure.getModels().get(1), structure.getModel(5));
    assertSame(structure.getModels().get(0), structure.getDefaultModel());
    assertNull(structure.getModel(1));
    assertTrue(structure.containsModel(0));
    assertFalse(structure.containsModel(1));
    assertNull(structure.getUnitCell());
    assertNull(new Structure().getDefaultModel());
  }

  @Test
  public void testIterateModels() {
    int count = 0;
    for (Model model : structure.iterateModels(false)) {
      assertEquals(0, model.getNumber());
      count++;
    }
    assertEquals(1, count);
  }

  @Test
  public void testIterateResiduesAndChains() {
    List<String> names = new ArrayList<>();
    structure.iterateResidues(true).forEach(r -> names.add(r.toString()));
    assertEquals(List.of("ALA-1", "GLY-2", "ALA-1", "GLY-2"), names);

    int chains = 0;
    for (Chain chain : structure.iterateChains(true)) {
      assertTrue(chain.isTerminated());
      chains++;
    }
    assertEquals(2, chains);
  }

  @Test
  public void testIterateAtomsIsRestartable() {
    Iterable<Atom> atoms = structure.iterateAtoms(false);
    int first = 0;
    for (Atom atom : atoms) {
      first++;
    }
    int second = 0;
    Iterator<Atom> iterator = atoms.iterator();
    while (iterator.hasNext()) {
      iterator.next();
      second++;
    }
    assertEquals(3, first);
    assertEquals(first, second);

    int all = 0;
    for (Atom atom : structure.iterateAtoms(true)) {
      all++;
    }
    assertEquals(6, all);
  }

  @Test
  public void testIteratePositions() {
    List<double[]> primary = new ArrayList<>();
    structure.iteratePositions(false, false).forEach(primary::add);
    assertEquals(3, primary.size());
    assertArrayEquals(new double[] {2.0, 0.0, 0.0}, primary.get(1), tolerance);

    List<double[]> withAltLocs = new ArrayList<>();
    structure.iteratePositions(false, true).forEach(withAltLocs::add);
    assertEquals(4, withAltLocs.size());
    assertArrayEquals(new double[] {3.0, 0.0, 0.0}, withAltLocs.get(2), tolerance);

    List<double[]> everything = new ArrayList<>();
    structure.iteratePositions(true, true).forEach(everything::add);
    assertEquals(8, everything.size());
    assertEquals(5.0, everything.get(7)[0], tolerance);
  }

  @Test
  public void testPositionsAreCopies() {
    double[] xyz = structure.iteratePositions(false, false).iterator().next();
    xyz[0] = 100.0;
    Atom atom = structure.getDefaultModel().getChain('A').getResidue(1).getAtom("CA");
    assertEquals(1.0, atom.getX(), tolerance);
  }

  @Test
  public void testAtomLookup() {
    Residue ala = structure.getDefaultModel().getChain('A').getResidue(1, ' ');
    assertTrue(ala.containsAtom("CB"));
    assertTrue(ala.containsAtom(" CB "));
    assertFalse(ala.containsAtom("CG"));
    assertNull(ala.getAtom("CG"));
    assertNull(structure.getDefaultModel().getChain('B'));
    assertEquals(2, ala.size());
    assertEquals(2, ala.getAtom("CB").getLocations().size());
    assertEquals(0.0, ala.getAtom("CB").getTempFactor(), tolerance);
    assertEquals(1.0, ala.getAtom("CB").getOccupancy(), tolerance);
  }

  @Test
  public void testToPDBString() {
    Atom cb = structure.getDefaultModel().getChain('A').getResidue(1).getAtom("CB");
    assertEquals(
        "ATOM      2  CB AALA A   1       2.000   0.000   0.000  1.00  0.00           C  ",
        cb.toString());
    assertEquals(
        "ATOM     10  CB BALA A   1       3.000   0.000   0.000  1.00  0.00           C  ",
        cb.toPDBString(10, 'B'));
  }
}
