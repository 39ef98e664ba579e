// ******************************************************************************
//
// Title:       Lattice Correlation X.
// Description: Lattice Correlation X - Momentum-Space Correlation Analysis.
// Copyright:   Copyright (c) Lattice Correlation X Developers 2026.
//              Portions Copyright (c) Michael J. Schnieders 2001-2023.
//
// This file is part of Lattice Correlation X.
//
// Lattice Correlation X is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// Lattice Correlation X is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// Lattice Correlation X; if not, write to the Free Software Foundation, Inc., 59 Temple
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
package lcx.correlation;

import lcx.crystal.KPoint;

/**
 * The straight lines between high-symmetry points of the simple cubic Brillouin zone, as seen from
 * the irreducible wedge 0 &lt;= kz &lt;= ky &lt;= kx &lt;= N/2. Γ = (0, 0, 0), X = (N/2, 0, 0),
 * M = (N/2, N/2, 0) and R = (N/2, N/2, N/2).
 *
 * @author Lattice Correlation X Developers
 * @since 1.0
 */
public enum PathSegment {
  /** Γ to X: ky = 0 and kz = 0. */
  GAMMA_X("Γ-X") {
    @Override
    public boolean contains(KPoint k, int half) {
      return k.getKy() == 0 && k.getKz() == 0;
    }
  },
  /** X to M: kx = N/2 and kz = 0. */
  X_M("X-M") {
    @Override
    public boolean contains(KPoint k, int half) {
      return k.getKx() == half && k.getKz() == 0;
    }
  },
  /** Γ to M: kx = ky and kz = 0. */
  GAMMA_M("Γ-M") {
    @Override
    public boolean contains(KPoint k, int half) {
      return k.getKx() == k.getKy() && k.getKz() == 0;
    }
  },
  /** Γ to R: kx = ky = kz. */
  GAMMA_R("Γ-R") {
    @Override
    public boolean contains(KPoint k, int half) {
      return k.getKx() == k.getKy() && k.getKy() == k.getKz();
    }
  },
  /** X to R: kx = N/2 and kz = ky. */
  X_R("X-R") {
    @Override
    public boolean contains(KPoint k, int half) {
      return k.getKx() == half && k.getKz() == k.getKy();
    }
  },
  /** M to R: kx = N/2 and ky = N/2. */
  M_R("M-R") {
    @Override
    public boolean contains(KPoint k, int half) {
      return k.getKy() == half && k.getKx() == half;
    }
  };

  /** Label used in log messages and errors. */
  public final String label;

  PathSegment(String label) {
    this.label = label;
  }

  /**
   * Check if a k-point lies on this segment.
   *
   * @param k The k-point.
   * @param half Half the grid period.
   * @return true if k lies on the segment.
   */
  public abstract boolean contains(KPoint k, int half);
}
