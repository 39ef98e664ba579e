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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

/**
 * Test the integer and double 3x3 operations of MatrixMath.
 *
 * @author Lattice Correlation X Developers
 */
public class MatrixMathTest {

  private static final int[][] ROT_Z_90 = {{0, -1, 0}, {1, 0, 0}, {0, 0, 1}};
  private static final int[][] MIRROR_X = {{-1, 0, 0}, {0, 1, 0}, {0, 0, 1}};

  @Test
  public void testDeterminant() {
    assertEquals(1, MatrixMath.mat3Determinant(ROT_Z_90));
    assertEquals(-1, MatrixMath.mat3Determinant(MIRROR_X));
    assertEquals(6, MatrixMath.mat3Determinant(new int[][] {{1, 0, 0}, {0, 2, 0}, {0, 0, 3}}));
  }

  @Test
  public void testTransposeIsInverseOfRotation() {
    int[][] product = MatrixMath.mat3Mat3Multiply(ROT_Z_90, MatrixMath.mat3Transpose(ROT_Z_90));
    assertTrue(MatrixMath.isIdentity(product));
    assertFalse(MatrixMath.isIdentity(ROT_Z_90));
  }

  @Test
  public void testMat3Vec3() {
    int[] out = new int[3];
    assertArrayEquals(new int[] {-2, 1, 3},
        MatrixMath.mat3Vec3(ROT_Z_90, new int[] {1, 2, 3}, out));
    int[] v = {1, 2, 3};
    MatrixMath.mat3Vec3(MIRROR_X, v, v);
    assertArrayEquals(new int[] {-1, 2, 3}, v);
  }

  @Test
  public void testDoubleMultiply() {
    double[][] k = {{0.0, -1.0, 0.0}, {1.0, 0.0, 0.0}, {0.0, 0.0, 0.0}};
    double[][] k2 = MatrixMath.mat3Mat3Multiply(k, k);
    double[][] expected = {{-1.0, 0.0, 0.0}, {0.0, -1.0, 0.0}, {0.0, 0.0, 0.0}};
    for (int i = 0; i < 3; i++) {
      assertArrayEquals(expected[i], k2[i], 0.0);
    }
    assertArrayEquals(new double[] {0.0, 1.0, 0.0}, MatrixMath.mat3Identity()[1], 0.0);
  }
}
