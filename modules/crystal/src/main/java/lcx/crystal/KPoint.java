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

import java.util.ArrayList;
import java.util.List;
import lcx.numerics.math.DoubleMath;

/**
 * The KPoint class represents a single momentum grid index (kx, ky, kz). Points of an irreducible
 * Brillouin zone mesh conventionally satisfy 0 &lt;= component &lt;= gridSize / 2.
 *
 * @author Lattice Correlation X Developers
 * @author Timothy D. Fenn
 * @see BrillouinZoneExpander
 * @since 1.0
 */
public final class KPoint {

  /** The kx-index of the point. */
  private final int kx;
  /** The ky-index of the point. */
  private final int ky;
  /** The kz-index of the point. */
  private final int kz;

  /**
   * Constructor for KPoint.
   *
   * @param kx The kx-index of the point.
   * @param ky The ky-index of the point.
   * @param kz The kz-index of the point.
   */
  public KPoint(int kx, int ky, int kz) {
    this.kx = kx;
    this.ky = ky;
    this.kz = kz;
  }

  /**
   * Convert rows of integer triples, as stored by a simulation output container, into KPoints.
   *
   * @param triples An N x 3 array.
   * @return The points in row order.
   * @throws IllegalArgumentException if a row does not hold exactly three entries.
   */
  public static List<KPoint> fromTriples(int[][] triples) {
    List<KPoint> points = new ArrayList<>(triples.length);
    for (int i = 0; i < triples.length; i++) {
      int[] t = triples[i];
      if (t == null || t.length != 3) {
        throw new IllegalArgumentException(format(" Row %d of the k-point array is not a triple.", i));
      }
      points.add(new KPoint(t[0], t[1], t[2]));
    }
    return points;
  }

  /**
   * Getter for the field <code>kx</code>.
   *
   * @return the kx-index.
   */
  public int getKx() {
    return kx;
  }

  /**
   * Getter for the field <code>ky</code>.
   *
   * @return the ky-index.
   */
  public int getKy() {
    return ky;
  }

  /**
   * Getter for the field <code>kz</code>.
   *
   * @return the kz-index.
   */
  public int getKz() {
    return kz;
  }

  /**
   * Return the index along one lattice direction.
   *
   * @param axis 0, 1 or 2.
   * @return the component.
   */
  public int get(int axis) {
    switch (axis) {
      case 0:
        return kx;
      case 1:
        return ky;
      case 2:
        return kz;
      default:
        throw new IllegalArgumentException(format(" Axis %d is not one of 0, 1 or 2.", axis));
    }
  }

  /**
   * The largest of the three components.
   *
   * @return max(kx, ky, kz).
   */
  public int maxComponent() {
    return Math.max(kx, Math.max(ky, kz));
  }

  /**
   * Euclidean distance to another point in grid units.
   *
   * @param other The other point.
   * @return the distance.
   */
  public double distance(KPoint other) {
    return DoubleMath.dist(toDoubleArray(), other.toDoubleArray());
  }

  private double[] toDoubleArray() {
    return new double[] {kx, ky, kz};
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    KPoint kPoint = (KPoint) o;
    return kx == kPoint.kx && ky == kPoint.ky && kz == kPoint.kz;
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return (kx * 31 + ky) * 31 + kz;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format("(%d, %d, %d)", kx, ky, kz);
  }
}
