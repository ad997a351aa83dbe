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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.BufferedReader;
import java.io.File;
import java.io.StringReader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.io.FileUtils;
import org.junit.Test;
import psx.structure.Atom;
import psx.structure.Chain;
import psx.structure.Element;
import psx.structure.Model;
import psx.structure.Structure;
import psx.structure.UnitCell;
import psx.utilities.PSXTest;
import psx.utilities.PropertyLoader;

/**
 * Tests of reading and writing PDB files with PDBFilter.
 *
 * @author Michael J. Schnieders
 */
public class PDBFilterTest extends PSXTest {

  private static final double tolerance = 1.0e-6;

  private static File resource(String name) throws Exception {
    return new File(PDBFilterTest.class.getResource(name).toURI());
  }

  @Test
  public void testReadSample() throws Exception {
    PDBFilter filter = new PDBFilter(resource("sample.pdb"));
    Structure structure = filter.readFile();

    UnitCell unitCell = structure.getUnitCell();
    assertNotNull(unitCell);
    assertEquals(50.0, unitCell.a, tolerance);
    assertEquals(120.0, unitCell.gamma, tolerance);

    assertEquals(1, structure.size());
    Model model = structure.getDefaultModel();
    assertEquals(3, model.size());
    Chain chainA = model.getChain('A');
    assertTrue(chainA.isTerminated());
    assertEquals(2, chainA.size());
    assertEquals("SER", chainA.getResidue(2).getName());
    assertEquals(2, chainA.getResidue(2).getAtom("OG").getLocations().size());

    Chain ligands = model.getChains().get(2);
    assertEquals(Character.valueOf('B'), ligands.getChainID());
    Atom iron = ligands.getResidue(201).getAtom("FE");
    assertEquals(Element.Fe, iron.getElement());
    assertEquals(Atom.RecordType.HETATM, iron.getRecordType());

    assertEquals(1, model.getConnects().size());
    assertArrayEquals(new int[] {13, 10}, model.getConnects().get(0));

    int count = 0;
    for (Atom atom : structure.iterateAtoms(true)) {
      assertNotNull(atom.getElement());
      count++;
    }
    assertEquals(10, count);
  }

  @Test
  public void testFirstModelOnly() throws Exception {
    File nmr = resource("nmr.pdb");
    assertEquals(2, new PDBFilter(nmr).readFile().size());

    System.setProperty(PDBFilter.LOAD_ALL_MODELS, "false");
    PDBFilter filter = new PDBFilter(nmr);
    assertFalse(filter.isLoadAllModels());
    Structure structure = filter.readFile();
    assertEquals(1, structure.size());
    assertNull(structure.getModel(1));
  }

  @Test
  public void testGzipRoundTrip() throws Exception {
    Path dir = registerTemporaryDirectory();
    PDBFilter filter = new PDBFilter(resource("sample.pdb"));
    Structure structure = filter.readFile();

    File saveFile = dir.resolve("sample.pdb.gz").toFile();
    filter.writeFile(structure, saveFile);
    assertTrue(new PDBFileFilter().accept(saveFile));

    Structure copy = new PDBFilter(saveFile).readFile();
    List<double[]> expected = new ArrayList<>();
    structure.iteratePositions(true, true).forEach(expected::add);
    List<double[]> actual = new ArrayList<>();
    copy.iteratePositions(true, true).forEach(actual::add);
    assertEquals(expected.size(), actual.size());
    for (int i = 0; i < expected.size(); i++) {
      assertArrayEquals(expected.get(i), actual.get(i), tolerance);
    }
    assertEquals(
        Integer.valueOf(2),
        copy.getDefaultModel().getChains().get(2).getResidue(201).getAtom("FE").getFormalCharge());
  }

  @Test
  public void testWritePlainFile() throws Exception {
    Path dir = registerTemporaryDirectory();
    PDBFilter filter = new PDBFilter(resource("nmr.pdb"));
    File saveFile = dir.resolve("nmr.pdb").toFile();
    filter.writeFile(filter.readFile(), saveFile);
    List<String> lines = FileUtils.readLines(saveFile, "UTF-8");
    assertEquals("MODEL        0", lines.get(0));
    assertEquals("END", lines.get(lines.size() - 1));
  }

  @Test
  public void testReadFromReader() throws Exception {
    String records =
        PDBLines.atom(1, " N", ' ', "ALA", 'A', 1, 1.0, 2.0, 3.0)
            + "\n"
            + PDBLines.atom(2, " CA", ' ', "ALA", 'A', 1, 4.0, 5.0, 6.0)
            + "\nEND\n";
    PDBFilter filter = new PDBFilter(null, PropertyLoader.loadProperties(null));
    Structure structure = filter.read(new BufferedReader(new StringReader(records)));
    assertEquals(2, structure.getDefaultModel().getChain('A').getResidue(1).size());
  }

  @Test
  public void testFileFilter() {
    PDBFileFilter fileFilter = new PDBFileFilter();
    assertTrue(fileFilter.accept(new File("1crn.pdb")));
    assertTrue(fileFilter.accept(new File("1CRN.PDB")));
    assertTrue(fileFilter.accept(new File("pdb1crn.ent")));
    assertTrue(fileFilter.accept(new File("1crn.pdb.gz")));
    assertTrue(fileFilter.accept(new File("pdb1crn.ent.gz")));
    assertFalse(fileFilter.accept(new File("1crn.cif")));
    assertFalse(fileFilter.accept(new File("1crn.gz")));
    assertFalse(fileFilter.accept(new File("pdb")));
  }
}
