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

import static lcx.numerics.math.MatrixMath.isIdentity;
import static lcx.numerics.math.MatrixMath.mat3Determinant;
import static lcx.numerics.math.MatrixMath.mat3Mat3Multiply;
import static lcx.numerics.math.MatrixMath.mat3Transpose;
import static lcx.numerics.math.MatrixMath.mat3Vec3;
import static lcx.numerics.math.ScalarMath.mod;

import java.util.Arrays;

/**
 * The RotationMatrix class defines a single point group operation as an exact integer 3x3 matrix.
 * Instances are immutable.
 *
 * @author Lattice Correlation X Developers
 * @author Michael J. Schnieders
 * @see PointGroup
 * @since 1.0
 */
public final class RotationMatrix {

  /** The identity operation. */
  public static final RotationMatrix IDENTITY =
      new RotationMatrix(new int[][] {{1, 0, 0}, {0, 1, 0}, {0, 0, 1}});

  /** The rotation matrix; never exposed. */
  private final int[][] rot;

  /**
   * The RotationMatrix constructor. The input is copied.
   *
   * @param rot The 3x3 rotation matrix.
   * @throws IllegalArgumentException if rot is not 3x3.
   */
  public RotationMatrix(int[][] rot) {
    if (rot == null || rot.length != 3) {
      throw new IllegalArgumentException(" A rotation matrix must have three rows.");
    }
    this.rot = new int[3][];
    for (int i = 0; i < 3; i++) {
      if (rot[i] == null || rot[i].length != 3) {
        throw new IllegalArgumentException(" A rotation matrix must have three columns.");
      }
      this.rot[i] = rot[i].clone();
    }
  }

  /**
   * Return one matrix entry.
   *
   * @param i Row.
   * @param j Column.
   * @return The entry.
   */
  public int get(int i, int j) {
    return rot[i][j];
  }

  /**
   * Return a copy of the matrix.
   *
   * @return a newly allocated 3x3 array.
   */
  public int[][] toArray() {
    return new int[][] {rot[0].clone(), rot[1].clone(), rot[2].clone()};
  }

  /**
   * The determinant, +1 for a proper rotation and -1 for an improper one.
   *
   * @return the determinant.
   */
  public int determinant() {
    return mat3Determinant(rot);
  }

  /**
   * Check that R.R^T is the identity and that the determinant is +1 or -1.
   *
   * @return true for an orthogonal matrix.
   */
  public boolean isOrthogonal() {
    int det = determinant();
    return (det == 1 || det == -1) && isIdentity(mat3Mat3Multiply(rot, mat3Transpose(rot)));
  }

  /**
   * Check if this operation includes the inversion.
   *
   * @return true if the determinant is -1.
   */
  public boolean isImproper() {
    return determinant() == -1;
  }

  /**
   * Return the operation equivalent to first applying the argument and then <code>this</code>.
   * <code>X' = R_this(R_arg(X))</code>
   *
   * @param other The operation applied first.
   * @return The combined operation.
   */
  public RotationMatrix multiply(RotationMatrix other) {
    return new RotationMatrix(mat3Mat3Multiply(rot, other.rot));
  }

  /**
   * The transpose, which for an orthogonal matrix is also the inverse.
   *
   * @return R^T.
   */
  public RotationMatrix transpose() {
    return new RotationMatrix(mat3Transpose(rot));
  }

  /**
   * Compose this operation with the inversion.
   *
   * @return -R.
   */
  public RotationMatrix negate() {
    int[][] neg = new int[3][3];
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < 3; j++) {
        neg[i][j] = -rot[i][j];
      }
    }
    return new RotationMatrix(neg);
  }

  /**
   * Apply the operation to one grid index and wrap the result into a periodic grid.
   *
   * @param kx Input index.
   * @param ky Input index.
   * @param kz Input index.
   * @param mate Output indices, each in the range [0, gridSize).
   * @param gridSize The grid period along each axis.
   */
  public void applyPeriodic(int kx, int ky, int kz, int[] mate, int gridSize) {
    mate[0] = kx;
    mate[1] = ky;
    mate[2] = kz;
    mat3Vec3(rot, mate, mate);
    for (int i = 0; i < 3; i++) {
      mate[i] = mod(mate[i], gridSize);
    }
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
    return Arrays.deepEquals(rot, ((RotationMatrix) o).rot);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return Arrays.deepHashCode(rot);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (int[] row : rot) {
      sb.append(String.format(" [%2d %2d %2d]", row[0], row[1], row[2]));
    }
    return sb.toString();
  }
}
