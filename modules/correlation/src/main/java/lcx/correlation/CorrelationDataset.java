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

import java.util.List;
import lcx.crystal.KPoint;
import lcx.crystal.ShapeMismatchException;

/**
 * The correlation data of one simulation: the authoritative grid period, the irreducible k-points
 * and the diagonal and off-diagonal correlators aligned with them. Instances are immutable.
 *
 * @author Lattice Correlation X Developers
 * @since 1.0
 */
public class CorrelationDataset {

  private final String name;
  private final int gridSize;
  private final List<KPoint> ibz;
  private final double[] diagonal;
  private final double[] offDiagonal;

  /**
   * Constructor for CorrelationDataset.
   *
   * @param name Dataset name, usually the simulation file name without extension.
   * @param gridSize The grid period along each axis.
   * @param ibz The irreducible k-points.
   * @param diagonal Diagonal correlator, one value per k-point.
   * @param offDiagonal Off-diagonal correlator, one value per k-point.
   * @throws ShapeMismatchException if a correlator is not aligned with the k-points.
   * @throws IllegalArgumentException if gridSize is not positive.
   */
  public CorrelationDataset(String name, int gridSize, List<KPoint> ibz, double[] diagonal,
      double[] offDiagonal) {
    if (gridSize <= 0) {
      throw new IllegalArgumentException(
          format(" Dataset %s has a non-positive grid size %d.", name, gridSize));
    }
    ShapeMismatchException.requireAligned(ibz, diagonal);
    ShapeMismatchException.requireAligned(ibz, offDiagonal);
    this.name = name;
    this.gridSize = gridSize;
    this.ibz = List.copyOf(ibz);
    this.diagonal = diagonal.clone();
    this.offDiagonal = offDiagonal.clone();
  }

  /**
   * Build a dataset from the raw arrays of a simulation output container.
   *
   * @param name Dataset name.
   * @param gridSize The grid period along each axis.
   * @param ibz An N x 3 array of irreducible k-points.
   * @param diagonal Diagonal correlator.
   * @param offDiagonal Off-diagonal correlator.
   * @return the dataset.
   */
  public static CorrelationDataset fromArrays(String name, int gridSize, int[][] ibz,
      double[] diagonal, double[] offDiagonal) {
    return new CorrelationDataset(name, gridSize, KPoint.fromTriples(ibz), diagonal, offDiagonal);
  }

  /**
   * Getter for the field <code>name</code>.
   *
   * @return the dataset name.
   */
  public String getName() {
    return name;
  }

  /**
   * Getter for the field <code>gridSize</code>.
   *
   * @return the grid period along each axis.
   */
  public int getGridSize() {
    return gridSize;
  }

  /**
   * Getter for the field <code>ibz</code>.
   *
   * @return an unmodifiable list of the irreducible k-points.
   */
  public List<KPoint> getIrreducibleKPoints() {
    return ibz;
  }

  /**
   * Getter for the field <code>diagonal</code>.
   *
   * @return a copy of the diagonal correlator.
   */
  public double[] getDiagonal() {
    return diagonal.clone();
  }

  /**
   * Getter for the field <code>offDiagonal</code>.
   *
   * @return a copy of the off-diagonal correlator.
   */
  public double[] getOffDiagonal() {
    return offDiagonal.clone();
  }

  /**
   * The values of one correlation channel at each irreducible k-point.
   *
   * @param channel The channel.
   * @return a newly allocated array.
   */
  public double[] channel(CorrelationChannel channel) {
    return channel.combine(diagonal, offDiagonal);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format("%s (grid %d, %d irreducible k-points)", name, gridSize, ibz.size());
  }
}
