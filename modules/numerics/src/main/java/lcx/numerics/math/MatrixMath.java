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

/**
 * The MatrixMath class is a simple 3x3 matrix math library used mainly by the crystal package.
 * <p>
 * Integer variants operate on the exact symmetry operators of a point group; double variants are
 * used while those operators are being constructed.
 * <p>
 * All methods are thread-safe and static.
 *
 * @author Lattice Correlation X Developers
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class MatrixMath {

  private MatrixMath() {
    // Prevent instantiation.
  }

  /**
   * Calculate the determinant of an integer 3x3 matrix.
   *
   * @param m input matrix.
   * @return The determinant.
   */
  public static int mat3Determinant(int[][] m) {
    return m[0][0] * m[1][1] * m[2][2] - m[0][0] * m[1][2] * m[2][1]
        + m[0][1] * m[1][2] * m[2][0] - m[0][1] * m[1][0] * m[2][2]
        + m[0][2] * m[1][0] * m[2][1] - m[0][2] * m[1][1] * m[2][0];
  }

  /**
   * Returns a newly allocated 3x3 identity matrix.
   *
   * @return The identity.
   */
  public static double[][] mat3Identity() {
    return new double[][] {{1.0, 0.0, 0.0}, {0.0, 1.0, 0.0}, {0.0, 0.0, 1.0}};
  }

  /**
   * Multiply a 3x3 matrix m and a 3x3 matrix n. The output is returned in a newly allocated 3x3
   * matrix.
   *
   * @param m an input 3x3 matrix.
   * @param n an input 3x3 matrix
   * @return Returns the 3x3 matrix result.
   */
  public static double[][] mat3Mat3Multiply(double[][] m, double[][] n) {
    double[][] result = new double[3][3];
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < 3; j++) {
        result[i][j] = m[i][0] * n[0][j] + m[i][1] * n[1][j] + m[i][2] * n[2][j];
      }
    }
    return result;
  }

  /**
   * Multiply an integer 3x3 matrix m and an integer 3x3 matrix n. The output is returned in a newly
   * allocated 3x3 matrix.
   *
   * @param m an input 3x3 matrix.
   * @param n an input 3x3 matrix
   * @return Returns the 3x3 matrix result.
   */
  public static int[][] mat3Mat3Multiply(int[][] m, int[][] n) {
    int[][] result = new int[3][3];
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < 3; j++) {
        result[i][j] = m[i][0] * n[0][j] + m[i][1] * n[1][j] + m[i][2] * n[2][j];
      }
    }
    return result;
  }

  /**
   * Returns the transpose of an integer 3x3 matrix m in newly allocated memory.
   *
   * @param m The input matrix.
   * @return An allocated a 3x3 matrix with transpose of m.
   */
  public static int[][] mat3Transpose(int[][] m) {
    return new int[][] {
        {m[0][0], m[1][0], m[2][0]},
        {m[0][1], m[1][1], m[2][1]},
        {m[0][2], m[1][2], m[2][2]}};
  }

  /**
   * Multiply an integer 3x3 matrix and a 3x1 column vector. If the vector v is also used for the
   * output, the result will overwrite the input values of v.
   *
   * @param m input 3x3 matrix.
   * @param v input 3x1 vector.
   * @param output output 3x1 vector.
   * @return Returns the output vector.
   */
  public static int[] mat3Vec3(int[][] m, int[] v, int[] output) {
    int r0 = m[0][0] * v[0] + m[0][1] * v[1] + m[0][2] * v[2];
    int r1 = m[1][0] * v[0] + m[1][1] * v[1] + m[1][2] * v[2];
    int r2 = m[2][0] * v[0] + m[2][1] * v[1] + m[2][2] * v[2];
    output[0] = r0;
    output[1] = r1;
    output[2] = r2;
    return output;
  }

  /**
   * Check if an integer 3x3 matrix is the identity.
   *
   * @param m input 3x3 matrix.
   * @return True if m is the identity.
   */
  public static boolean isIdentity(int[][] m) {
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < 3; j++) {
        if (m[i][j] != (i == j ? 1 : 0)) {
          return false;
        }
      }
    }
    return true;
  }
}
