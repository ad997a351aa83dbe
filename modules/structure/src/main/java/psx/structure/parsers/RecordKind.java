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

import org.apache.commons.lang3.StringUtils;

/**
 * The kinds of PDB record that affect how a structure is built. Everything else is ignored.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public enum RecordKind {
  /** ATOM or HETATM. */
  COORDINATE,
  MODEL,
  ENDMDL,
  END,
  TER,
  CRYST1,
  CONECT,
  /** Any record that is skipped. */
  OTHER;

  /**
   * Classify a line by its leading characters. The checks are made in a fixed order, so that
   * ENDMDL is recognized before END.
   *
   * @param line a line of a PDB file, without its terminator.
   * @return the RecordKind.
   */
  public static RecordKind classify(String line) {
    if (line.startsWith("ATOM  ") || line.startsWith("HETATM")) {
      return COORDINATE;
    } else if (line.startsWith("MODEL")) {
      return MODEL;
    } else if (line.startsWith("ENDMDL")) {
      return ENDMDL;
    } else if (line.startsWith("END")) {
      return END;
    } else if (line.startsWith("TER")) {
      // Only a bare TER keyword terminates a chain.
      String[] tokens = StringUtils.split(line);
      if (tokens.length > 0 && tokens[0].equals("TER")) {
        return TER;
      }
      return OTHER;
    } else if (line.startsWith("CRYST1")) {
      return CRYST1;
    } else if (line.startsWith("CONECT")) {
      return CONECT;
    }
    return OTHER;
  }
}
