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

/**
 * A function sampled along the Γ-X-M-Γ-R-X-M-R high-symmetry path, with the cumulative path length
 * of each sample in units where the full grid period corresponds to 2π.
 *
 * @author Lattice Correlation X Developers
 * @see HighSymmetryPathExtractor
 * @since 1.0
 */
public class HighSymmetryPath {

  /** Labels of the high-symmetry points along the path. */
  public static final List<String> TICK_LABELS = List.of("Γ", "X", "M", "Γ", "R", "X", "M", "R");

  private final int gridSize;
  private final double[] distances;
  private final double[] values;
  private final List<KPoint> points;

  /**
   * Constructor for HighSymmetryPath.
   *
   * @param gridSize The grid period used to normalize distances.
   * @param distances Cumulative normalized distances.
   * @param values Function values.
   * @param points The k-points of the path.
   */
  HighSymmetryPath(int gridSize, double[] distances, double[] values, List<KPoint> points) {
    if (distances.length != values.length || values.length != points.size()) {
      throw new MalformedBrillouinZoneException(format(
          " %d distances, %d values and %d k-points are not aligned.",
          distances.length, values.length, points.size()));
    }
    this.gridSize = gridSize;
    this.distances = distances;
    this.values = values;
    this.points = List.copyOf(points);
  }

  /**
   * Number of samples along the path.
   *
   * @return the number of samples.
   */
  public int size() {
    return values.length;
  }

  /**
   * The grid period.
   *
   * @return gridSize.
   */
  public int getGridSize() {
    return gridSize;
  }

  /**
   * Cumulative distance along the path; the first entry is 0.
   *
   * @return a copy of the distances.
   */
  public double[] getDistances() {
    return distances.clone();
  }

  /**
   * The function along the path.
   *
   * @return a copy of the values.
   */
  public double[] getValues() {
    return values.clone();
  }

  /**
   * The k-points along the path.
   *
   * @return an unmodifiable list.
   */
  public List<KPoint> getPoints() {
    return points;
  }

  /**
   * Path distance of each high-symmetry point in {@link #TICK_LABELS}. The ith label sits at
   * sample i * gridSize / 2.
   *
   * @return eight distances.
   * @throws MalformedBrillouinZoneException if the path is too short to hold all eight points.
   */
  public double[] getTickDistances() {
    int half = gridSize / 2;
    int n = TICK_LABELS.size();
    int last = (n - 1) * half;
    if (last >= distances.length) {
      throw new MalformedBrillouinZoneException(format(
          " the path has %d samples, but the R point should be sample %d.",
          distances.length, last));
    }
    double[] ticks = new double[n];
    for (int i = 0; i < n; i++) {
      ticks[i] = distances[i * half];
    }
    return ticks;
  }
}
