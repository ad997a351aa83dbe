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

import java.util.HashMap;
import java.util.Map;

/**
 * Element symbols for the first 109 elements, ordered by atomic number.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public enum Element {
  H, He, Li, Be, B, C, N, O, F, Ne, Na, Mg, Al, Si, P, S, Cl, Ar, K, Ca, Sc, Ti, V, Cr, Mn, Fe,
  Co, Ni, Cu, Zn, Ga, Ge, As, Se, Br, Kr, Rb, Sr, Y, Zr, Nb, Mo, Tc, Ru, Rh, Pd, Ag, Cd, In, Sn,
  Sb, Te, I, Xe, Cs, Ba, La, Ce, Pr, Nd, Pm, Sm, Eu, Gd, Tb, Dy, Ho, Er, Tm, Yb, Lu, Hf, Ta, W,
  Re, Os, Ir, Pt, Au, Hg, Tl, Pb, Bi, Po, At, Rn, Fr, Ra, Ac, Th, Pa, U, Np, Pu, Am, Cm, Bk, Cf,
  Es, Fm, Md, No, Lr, Rf, Db, Sg, Bh, Hs, Mt;

  /** Upper case symbol to element. */
  private static final Map<String, Element> symbolMap = new HashMap<>();

  static {
    for (Element element : values()) {
      symbolMap.put(element.name().toUpperCase(), element);
    }
    // Deuterium.
    symbolMap.put("D", H);
  }

  /**
   * Look up an element by its symbol, ignoring case.
   *
   * @param symbol an element symbol such as "C", "FE" or "Fe"; "D" is read as hydrogen.
   * @return the Element, or null if the symbol is not recognized.
   */
  public static Element forSymbol(String symbol) {
    if (symbol == null) {
      return null;
    }
    return symbolMap.get(symbol.trim().toUpperCase());
  }

  /**
   * Getter for the field <code>atomicNumber</code>.
   *
   * @return the atomic number.
   */
  public int getAtomicNumber() {
    return ordinal() + 1;
  }

  /**
   * The element symbol, with its conventional capitalization.
   *
   * @return the symbol.
   */
  public String getSymbol() {
    return name();
  }
}
