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

import static java.lang.String.format;
import static lcx.numerics.math.ScalarMath.mod;
import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.cos;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import lcx.crystal.BrillouinZoneExpander;
import lcx.crystal.ExpandedGrid;
import lcx.crystal.KPoint;
import lcx.crystal.ShapeMismatchException;

/**
 * The InverseFourierProjector converts a momentum-space function known on an irreducible
 * Brillouin zone mesh into a real-space correlation profile along one lattice direction:
 *
 * <p><code>G(x) = Re[ 1/N^3 sum_k exp(-2 pi i k[axis] x / N) f(k) ]</code>
 *
 * <p>where f is the symmetry expanded function on the full N^3 grid. Because f is real, only the
 * cosine contributes, and the sum over the two transverse directions is taken first.
 *
 * @author Lattice Correlation X Developers
 * @since 1.0
 */
public class InverseFourierProjector {

  private static final Logger logger = Logger.getLogger(InverseFourierProjector.class.getName());

  /** Longest distance range that fits in a profile array. */
  public static final int MAX_RANGE = Integer.MAX_VALUE - 8;

  private final BrillouinZoneExpander expander;

  /** Constructor using the cubic point group. */
  public InverseFourierProjector() {
    this(new BrillouinZoneExpander());
  }

  /**
   * Constructor for InverseFourierProjector.
   *
   * @param expander Fills the full grid from the irreducible mesh.
   */
  public InverseFourierProjector(BrillouinZoneExpander expander) {
    this.expander = expander;
  }

  /**
   * Expand irreducible values to the full grid and transform them to real space.
   *
   * @param gridSize The grid period N along each axis.
   * @param ibz The irreducible k-points.
   * @param func One value per k-point.
   * @param xmin First real-space distance.
   * @param xmax Exclusive last real-space distance.
   * @param axis Lattice direction of the projection (0, 1 or 2).
   * @return The profile for x in [xmin, xmax).
   * @throws IllegalArgumentException for an axis outside {0, 1, 2}, a non-positive grid size, or
   *     a distance range that is empty or longer than {@link #MAX_RANGE}.
   * @throws ShapeMismatchException if func and ibz differ in length.
   */
  public RealSpaceProfile antifourier(int gridSize, List<KPoint> ibz, double[] func,
      int xmin, int xmax, int axis) {
    checkAxis(axis);
    ShapeMismatchException.requireAligned(ibz, func);
    checkRange(xmin, xmax);
    if (gridSize <= 0) {
      throw new IllegalArgumentException(format(" Grid size %d must be positive.", gridSize));
    }
    ExpandedGrid grid = expander.expand(gridSize, ibz, func);
    return project(grid, xmin, xmax, axis);
  }

  /**
   * Transform an already expanded grid to real space.
   *
   * @param grid The full grid.
   * @param xmin First real-space distance.
   * @param xmax Exclusive last real-space distance.
   * @param axis Lattice direction of the projection (0, 1 or 2).
   * @return The profile for x in [xmin, xmax).
   */
  public RealSpaceProfile project(ExpandedGrid grid, int xmin, int xmax, int axis) {
    checkAxis(axis);
    checkRange(xmin, xmax);
    int n = grid.getGridSize();
    double[] planeSums = grid.planeSums(axis);
    double norm = 1.0 / grid.size();

    double[] profile = new double[xmax - xmin];
    for (int x = xmin; x < xmax; x++) {
      int xmod = mod(x, n);
      double sum = 0.0;
      for (int m = 0; m < n; m++) {
        // The phase is periodic in m * x with period n; both factors are reduced first.
        sum += cos(2.0 * PI * mod(m * xmod, n) / n) * planeSums[m];
      }
      profile[x - xmin] = sum * norm;
    }

    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Projected a %d^3 grid along axis %d for x in [%d, %d).",
          n, axis, xmin, xmax));
    }
    return new RealSpaceProfile(xmin, profile);
  }

  private static void checkAxis(int axis) {
    if (axis < 0 || axis > 2) {
      throw new IllegalArgumentException(format(" Axis %d is not one of 0, 1 or 2.", axis));
    }
  }

  private static void checkRange(int xmin, int xmax) {
    if (xmin >= xmax) {
      throw new IllegalArgumentException(
          format(" The distance range [%d, %d) is empty.", xmin, xmax));
    }
    if ((long) xmax - xmin > MAX_RANGE) {
      throw new IllegalArgumentException(
          format(" The distance range [%d, %d) exceeds %d values.", xmin, xmax, MAX_RANGE));
    }
  }
}
