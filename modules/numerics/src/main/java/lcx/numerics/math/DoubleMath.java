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
package lcx.numerics.math;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.sqrt;

/**
 * The DoubleMath class is a simple math library that operates on 3-coordinate double arrays.
 *
 * <p>All methods are thread-safe and static.
 *
 * @author Lattice Correlation X Developers
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class DoubleMath {

  private DoubleMath() {
    // Prevent instantiation.
  }

  /**
   * Cross product of a and b, returned in newly allocated memory.
   *
   * @param a First vector.
   * @param b Second vector.
   * @return Returns a x b.
   */
  public static double[] X(double[] a, double[] b) {
    return new double[] {
        a[1] * b[2] - a[2] * b[1],
        a[2] * b[0] - a[0] * b[2],
        a[0] * b[1] - a[1] * b[0]};
  }

  /**
   * Finds the distance between two vectors.
   *
   * @param a First vector.
   * @param b Second vector.
   * @return Returns the distance between vectors a and b.
   */
  public static double dist(double[] a, double[] b) {
    return sqrt(dist2(a, b));
  }

  /**
   * Finds the squared distance between two vectors
   *
   * @param a First vector.
   * @param b Second vector.
   * @return Returns the squared distance between vectors a and b.
   */
  public static double dist2(double[] a, double[] b) {
    var dx = a[0] - b[0];
    var dy = a[1] - b[1];
    var dz = a[2] - b[2];
    return dx * dx + dy * dy + dz * dz;
  }

  /**
   * Computes the dot product of a and b
   *
   * @param a First vector.
   * @param b Second vector.
   * @return Returns the dot product of a and b.
   */
  public static double dot(double[] a, double[] b) {
    return a[0] * b[0] + a[1] * b[1] + a[2] * b[2];
  }

  /**
   * Returns the length of a vector.
   *
   * @param d A vector to find the length of.
   * @return Length of vector d.
   */
  public static double length(double[] d) {
    return sqrt(dot(d, d));
  }

  /**
   * Normalizes a vector into newly allocated memory.
   *
   * @param n A vector to be normalized.
   * @return Returns the normalized vector.
   * @throws IllegalArgumentException if n has zero length.
   */
  public static double[] normalize(double[] n) {
    double len = length(n);
    if (len == 0.0) {
      throw new IllegalArgumentException(format(" Cannot normalize a zero vector %s.", toString(n)));
    }
    return new double[] {n[0] / len, n[1] / len, n[2] / len};
  }

  /**
   * Formats a vector for logging.
   *
   * @param v The vector.
   * @return A space separated String.
   */
  public static String toString(double[] v) {
    return format("%g %g %g", v[0], v[1], v[2]);
  }
}
