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
 * An ElementTable resolves the element symbols found in columns 77-78 of coordinate records (or
 * inferred from atom names).
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public interface ElementTable {

  /** The periodic table backed by the {@link Element} enumeration. */
  ElementTable PERIODIC_TABLE =
      new ElementTable() {
        @Override
        public Element getBySymbol(String symbol) {
          return Element.forSymbol(symbol);
        }

        @Override
        public Element hydrogen() {
          return Element.H;
        }
      };

  /**
   * Look up an element by symbol.
   *
   * @param symbol an element symbol; matching ignores case.
   * @return the element, or null if not found.
   */
  Element getBySymbol(String symbol);

  /**
   * The hydrogen element.
   *
   * @return hydrogen.
   */
  Element hydrogen();
}
