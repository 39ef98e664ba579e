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

/**
 * A dense, real-valued function on the full periodic momentum grid of gridSize^3 points, stored in
 * row-major order (kx slowest, kz fastest).
 *
 * @author Lattice Correlation X Developers
 * @see BrillouinZoneExpander
 * @since 1.0
 */
public class ExpandedGrid {

  private final int gridSize;
  private final double[] data;

  /**
   * Allocate a zero-filled grid.
   *
   * @param gridSize The grid period along each axis.
   */
  public ExpandedGrid(int gridSize) {
    if (gridSize <= 0) {
      throw new IllegalArgumentException(format(" Grid size %d must be positive.", gridSize));
    }
    this.gridSize = gridSize;
    data = new double[gridSize * gridSize * gridSize];
  }

  /**
   * The grid period along each axis.
   *
   * @return gridSize.
   */
  public int getGridSize() {
    return gridSize;
  }

  /**
   * Total number of grid points.
   *
   * @return gridSize^3.
   */
  public int size() {
    return data.length;
  }

  /**
   * Value at a grid index; each index must lie in [0, gridSize).
   *
   * @param kx The kx-index.
   * @param ky The ky-index.
   * @param kz The kz-index.
   * @return the value.
   */
  public double get(int kx, int ky, int kz) {
    return data[index(kx, ky, kz)];
  }

  void set(int kx, int ky, int kz, double value) {
    data[index(kx, ky, kz)] = value;
  }

  private int index(int kx, int ky, int kz) {
    return (kx * gridSize + ky) * gridSize + kz;
  }

  /**
   * Sum the grid over each plane of constant index along one axis.
   *
   * @param axis 0, 1 or 2.
   * @return An array of length gridSize whose entry m is the sum over all points with k[axis] = m.
   */
  public double[] planeSums(int axis) {
    if (axis < 0 || axis > 2) {
      throw new IllegalArgumentException(format(" Axis %d is not one of 0, 1 or 2.", axis));
    }
    double[] sums = new double[gridSize];
    int i = 0;
    for (int kx = 0; kx < gridSize; kx++) {
      for (int ky = 0; ky < gridSize; ky++) {
        for (int kz = 0; kz < gridSize; kz++) {
          int m = (axis == 0) ? kx : (axis == 1) ? ky : kz;
          sums[m] += data[i++];
        }
      }
    }
    return sums;
  }

  /**
   * Return a copy of the grid values in row-major order.
   *
   * @return a newly allocated array of length gridSize^3.
   */
  public double[] toArray() {
    return data.clone();
  }
}
