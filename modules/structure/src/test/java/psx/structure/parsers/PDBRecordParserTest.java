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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import psx.structure.Atom;
import psx.structure.Atom.RecordType;
import psx.structure.Element;
import psx.structure.ElementTable;
import psx.structure.UnitCell;
import psx.utilities.PSXTest;

/**
 * Tests of the column layout read by PDBRecordParser.
 *
 * @author Michael J. Schnieders
 */
public class PDBRecordParserTest extends PSXTest {

  private static final double tolerance = 1.0e-6;

  private final List<ParseDiagnostic> diagnostics = new ArrayList<>();
  private PDBRecordParser parser;

  @Before
  public void setUp() {
    diagnostics.clear();
    parser = new PDBRecordParser(ElementTable.PERIODIC_TABLE, diagnostics::add);
  }

  @Test
  public void testAtomRecord() {
    String line =
        "ATOM      5  CB ASER A   2B      5.000  -4.125  15.500  0.60 14.00      SEG1 C  ";
    Atom atom = parser.parseAtom(line);
    assertEquals(RecordType.ATOM, atom.getRecordType());
    assertEquals(5, atom.getSerialNumber());
    assertEquals(" CB ", atom.getNameWithSpaces());
    assertEquals("CB", atom.getName());
    assertEquals(Character.valueOf('A'), atom.getAltLoc());
    assertEquals("SER", atom.getResidueNameWithSpaces());
    assertEquals(Character.valueOf('A'), atom.getChainID());
    assertEquals(2, atom.getResidueNumber());
    assertEquals(Character.valueOf('B'), atom.getInsertionCode());
    assertEquals(5.0, atom.getX(), tolerance);
    assertEquals(-4.125, atom.getY(), tolerance);
    assertEquals(15.5, atom.getZ(), tolerance);
    assertEquals(0.6, atom.getOccupancy(), tolerance);
    assertEquals(14.0, atom.getTempFactor(), tolerance);
    assertEquals("SEG1", atom.getSegID());
    assertEquals("C", atom.getElementSymbol());
    assertEquals(Element.C, atom.getElement());
    assertNull(atom.getFormalCharge());
    assertTrue(diagnostics.isEmpty());
  }

  @Test
  public void testHeteroAtomWithCharge() {
    String line =
        "HETATM   13 FE   HEM B 201      10.000  10.000  10.000  1.00 30.00          FE2+";
    Atom atom = parser.parseAtom(line);
    assertEquals(RecordType.HETATM, atom.getRecordType());
    assertEquals("FE", atom.getName());
    assertEquals(Element.Fe, atom.getElement());
    assertEquals(Integer.valueOf(2), atom.getFormalCharge());
  }

  @Test
  public void testFormalCharges() {
    String base = "HETATM    1 CL   CL  A   1       0.000   0.000   0.000  1.00  0.00          CL";
    assertEquals(Integer.valueOf(-1), parser.parseAtom(base + "1-").getFormalCharge());
    assertEquals(Integer.valueOf(-1), parser.parseAtom(base + "-1").getFormalCharge());
    assertEquals(Integer.valueOf(1), parser.parseAtom(base + "+1").getFormalCharge());
    assertTrue(diagnostics.isEmpty());
    assertNull(parser.parseAtom(base + "x?").getFormalCharge());
    assertEquals(1, diagnostics.size());
    assertEquals(ParseDiagnostic.Type.UNPARSABLE_CHARGE, diagnostics.get(0).type());
  }

  @Test
  public void testElementFromAtomName() {
    // Element columns are blank in each of these records.
    String calcium = "HETATM    1 CA    CA A   1       0.000   0.000   0.000  1.00  0.00";
    assertEquals(Element.Ca, parser.parseAtom(calcium).getElement());
    String alphaCarbon = "ATOM      2  CA  ALA A   1       0.000   0.000   0.000  1.00  0.00";
    assertEquals(Element.C, parser.parseAtom(alphaCarbon).getElement());
    String hydrogen = "ATOM      3 1HB  ALA A   1       0.000   0.000   0.000  1.00  0.00";
    assertEquals(Element.H, parser.parseAtom(hydrogen).getElement());
    String longHydrogen = "ATOM      4 HD21 ASN A   2       0.000   0.000   0.000  1.00  0.00";
    assertEquals(Element.H, parser.parseAtom(longHydrogen).getElement());
    String deuterium = PDBLines.atom(5, " D1", ' ', "DOD", 'W', 1, 0.0, 0.0, 0.0);
    Atom d1 = parser.parseAtom(deuterium);
    assertEquals("D", d1.getElementSymbol());
    assertEquals(Element.H, d1.getElement());
    assertTrue(diagnostics.isEmpty());

    String unknown = "ATOM      5  XX  UNK A   3       0.000   0.000   0.000  1.00  0.00";
    assertNull(parser.parseAtom(unknown).getElement());
    assertEquals(ParseDiagnostic.Type.UNKNOWN_ELEMENT, diagnostics.get(0).type());
  }

  @Test
  public void testShortRecord() {
    // Occupancy and temperature factor columns are missing.
    Atom atom = parser.parseAtom("ATOM      1  N   GLY A   1       1.000   2.000   3.000");
    assertEquals(1.0, atom.getOccupancy(), tolerance);
    assertEquals(0.0, atom.getTempFactor(), tolerance);
    assertEquals("", atom.getSegID());
    assertEquals(Element.N, atom.getElement());
    assertEquals(2, diagnostics.size());
    assertEquals(ParseDiagnostic.Type.DEFAULT_OCCUPANCY, diagnostics.get(0).type());
    assertEquals(ParseDiagnostic.Type.DEFAULT_TEMP_FACTOR, diagnostics.get(1).type());
  }

  @Test
  public void testFourCharacterResidueName() {
    Atom atom =
        parser.parseAtom("ATOM      1  C1  LIG1A   1       1.000   2.000   3.000  1.00  0.00");
    assertEquals("LIG1", atom.getResidueNameWithSpaces());
    assertEquals(Character.valueOf('A'), atom.getChainID());
  }

  @Test
  public void testMisalignedResidueName() {
    String line = "ATOM      1  C1   LGXA   1       1.000   2.000   3.000  1.00  0.00";
    try {
      parser.parseAtom(line);
      fail(" A misaligned residue name should be fatal.");
    } catch (StructureFormatException e) {
      assertEquals(" Misaligned residue name.", e.getMessage());
      assertEquals(line, e.getLine());
    }
  }

  @Test
  public void testMissingCoordinate() {
    String line = "ATOM      1  N   GLY A   1       1.000           3.000  1.00  0.00";
    try {
      parser.parseAtom(line);
      fail(" A blank coordinate should be fatal.");
    } catch (StructureFormatException e) {
      assertTrue(e.getCause() instanceof NumberFormatException);
    }
  }

  @Test
  public void testStandaloneNumbers() {
    // Without a resolver, unreadable numbers become 0.
    Atom atom =
        parser.parseAtom("ATOM  A0000  N   GLY AA000       1.000   2.000   3.000  1.00  0.00");
    assertEquals(0, atom.getSerialNumber());
    assertEquals(0, atom.getResidueNumber());
  }

  @Test
  public void testUnitCell() {
    UnitCell unitCell =
        parser.parseUnitCell(
            "CRYST1   50.000   60.000   70.000  90.00 100.00 120.00 P 1           1");
    assertArrayEquals(new double[] {50.0, 60.0, 70.0}, unitCell.getUnitCellLengths(), tolerance);
    assertArrayEquals(new double[] {90.0, 100.0, 120.0}, unitCell.getUnitCellAngles(), tolerance);
  }

  @Test
  public void testConnect() {
    assertArrayEquals(new int[] {1, 2, 3}, parser.parseConnect("CONECT    1    2    3", null));
    assertArrayEquals(
        new int[] {4, 5, 6, 7, 8}, parser.parseConnect("CONECT    4    5    6    7    8   ", null));
    assertArrayEquals(new int[] {9}, parser.parseConnect("CONECT    9", null));
    assertArrayEquals(new int[0], parser.parseConnect("CONECT", null));
  }

  @Test
  public void testClassify() {
    assertEquals(RecordKind.COORDINATE, RecordKind.classify("ATOM      1  N"));
    assertEquals(RecordKind.COORDINATE, RecordKind.classify("HETATM    1 FE"));
    assertEquals(RecordKind.OTHER, RecordKind.classify("ATOM"));
    assertEquals(RecordKind.MODEL, RecordKind.classify("MODEL        1"));
    assertEquals(RecordKind.ENDMDL, RecordKind.classify("ENDMDL"));
    assertEquals(RecordKind.END, RecordKind.classify("END"));
    assertEquals(RecordKind.TER, RecordKind.classify("TER"));
    assertEquals(RecordKind.TER, RecordKind.classify("TER      12      GLY B   1"));
    assertEquals(RecordKind.OTHER, RecordKind.classify("TERMINAL"));
    assertEquals(RecordKind.CRYST1, RecordKind.classify("CRYST1   50.000"));
    assertEquals(RecordKind.CONECT, RecordKind.classify("CONECT    1    2"));
    assertEquals(RecordKind.OTHER, RecordKind.classify("REMARK   2 RESOLUTION."));
  }
}
