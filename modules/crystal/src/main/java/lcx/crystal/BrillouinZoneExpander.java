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
package lcx.crystal;

import static java.lang.String.format;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The BrillouinZoneExpander fills the full periodic momentum grid from values known only on an
 * irreducible Brillouin zone mesh, by applying every operation of a point group to every mesh
 * point.
 *
 * <p>Orbit images of different mesh points may coincide. The k-points are visited in input order
 * and, for each, the operations in group order; the last value written to a grid point wins.
 *
 * @author Lattice Correlation X Developers
 * @since 1.0
 */
public class BrillouinZoneExpander {

  private static final Logger logger = Logger.getLogger(BrillouinZoneExpander.class.getName());

  private final PointGroup pointGroup;

  /** Constructor using the cubic point group. */
  public BrillouinZoneExpander() {
    this(PointGroup.cubic());
  }

  /**
   * Constructor for BrillouinZoneExpander.
   *
   * @param pointGroup The point group whose orbits fill the grid.
   */
  public BrillouinZoneExpander(PointGroup pointGroup) {
    this.pointGroup = pointGroup;
  }

  /**
   * Expand values on irreducible k-points to the full grid.
   *
   * @param gridSize The grid period along each axis.
   * @param ibz The irreducible k-points.
   * @param func One value per k-point.
   * @return The expanded grid; points reached by no orbit are zero.
   * @throws ShapeMismatchException if func and ibz differ in length.
   * @throws IllegalArgumentException if gridSize is not positive.
   */
  public ExpandedGrid expand(int gridSize, List<KPoint> ibz, double[] func) {
    ShapeMismatchException.requireAligned(ibz, func);
    ExpandedGrid grid = new ExpandedGrid(gridSize);

    int[] mate = new int[3];
    int n = ibz.size();
    for (int i = 0; i < n; i++) {
      KPoint q = ibz.get(i);
      double value = func[i];
      for (RotationMatrix rotation : pointGroup) {
        rotation.applyPeriodic(q.getKx(), q.getKy(), q.getKz(), mate, gridSize);
        grid.set(mate[0], mate[1], mate[2], value);
      }
    }

    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Expanded %d k-points with %d operations onto a %d^3 grid.",
          n, pointGroup.getNumberOfOperators(), gridSize));
    }
    return grid;
  }
}
