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
import static lcx.numerics.math.MatrixMath.mat3Identity;
import static lcx.numerics.math.MatrixMath.mat3Mat3Multiply;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.rint;
import static org.apache.commons.math3.util.FastMath.sin;
import static org.apache.commons.math3.util.FastMath.toRadians;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import lcx.numerics.math.DoubleMath;
import lcx.utilities.LcxProperties;
import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * The PointGroupGenerator builds exact integer rotation matrices from angle/axis pairs using the
 * Rodrigues rotation formula, and assembles the 48 operations of the cubic point group Oh.
 *
 * <p>The order of the generated operations is fixed. Symmetry expansion resolves overlapping
 * orbit images by the last write, so the order is part of the contract.
 *
 * @author Lattice Correlation X Developers
 * @see PointGroup
 * @since 1.0
 */
public class PointGroupGenerator {

  private static final Logger logger = Logger.getLogger(PointGroupGenerator.class.getName());

  /** Default tolerance between a Rodrigues matrix entry and its nearest integer. */
  public static final double DEFAULT_TOLERANCE = 1.0e-6;

  /**
   * The proper rotations of O as {angle in degrees, axis x, axis y, axis z}: the identity, 180
   * degrees about the principal axes, 180 degrees about the face diagonals, 90 degrees about the
   * positive then negative principal axes, and 120 degrees about the body diagonals.
   */
  private static final double[][] CUBIC_GENERATORS = {
      {0, 1, 0, 0},
      {180, 1, 0, 0}, {180, 0, 1, 0}, {180, 0, 0, 1},
      {180, 1, 1, 0}, {180, -1, 1, 0}, {180, 1, 0, 1},
      {180, 1, 0, -1}, {180, 0, -1, -1}, {180, 0, -1, 1},
      {90, 1, 0, 0}, {90, 0, 1, 0}, {90, 0, 0, 1},
      {90, -1, 0, 0}, {90, 0, -1, 0}, {90, 0, 0, -1},
      {120, 1, 1, 1}, {120, -1, 1, 1}, {120, 1, -1, 1}, {120, 1, 1, -1},
      {120, 1, -1, -1}, {120, -1, 1, -1}, {120, -1, -1, 1}, {120, -1, -1, -1}};

  /** Maximum distance between a matrix entry and its rounded value. */
  private final double tolerance;

  /** Constructor using the default tolerance. */
  public PointGroupGenerator() {
    this(DEFAULT_TOLERANCE);
  }

  /**
   * Constructor reading the tolerance from the <code>lcx.rotation.tolerance</code> property.
   *
   * @param properties The configuration.
   */
  public PointGroupGenerator(CompositeConfiguration properties) {
    this(properties.getDouble(LcxProperties.ROTATION_TOLERANCE, DEFAULT_TOLERANCE));
  }

  /**
   * Constructor for PointGroupGenerator.
   *
   * @param tolerance Maximum distance between a matrix entry and its rounded value.
   */
  public PointGroupGenerator(double tolerance) {
    if (!(tolerance > 0.0 && tolerance < 0.5)) {
      throw new IllegalArgumentException(
          format(" The rotation tolerance %g must lie in (0, 0.5).", tolerance));
    }
    this.tolerance = tolerance;
  }

  /**
   * Build the integer rotation matrix for a rotation of theta degrees about an axis:
   * <code>R = I + sin(theta) K + (1 - cos(theta)) K^2</code>, where K is the cross-product matrix
   * of the normalized axis.
   *
   * @param thetaDegrees Rotation angle in degrees.
   * @param axis The rotation axis; it need not be normalized.
   * @return The rounded rotation matrix.
   * @throws GroupGenerationException if the axis has zero length, an entry is farther than the
   *     tolerance from an integer, or the rounded matrix is not orthogonal.
   */
  public RotationMatrix rotation(double thetaDegrees, double[] axis) {
    if (axis == null || axis.length != 3) {
      throw new GroupGenerationException(" A rotation axis must have three components.");
    }
    double[] u;
    try {
      u = DoubleMath.normalize(axis);
    } catch (IllegalArgumentException e) {
      throw new GroupGenerationException(
          format(" Rotation axis (%s) has zero length.", DoubleMath.toString(axis)));
    }
    double theta = toRadians(thetaDegrees);

    // Row i of the cross-product matrix is e_i x u.
    double[][] r = mat3Identity();
    double[][] k = new double[3][];
    for (int i = 0; i < 3; i++) {
      k[i] = DoubleMath.X(r[i], u);
    }
    double[][] k2 = mat3Mat3Multiply(k, k);
    double s = sin(theta);
    double c = 1.0 - cos(theta);

    int[][] rounded = new int[3][3];
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < 3; j++) {
        r[i][j] += s * k[i][j] + c * k2[i][j];
        double nearest = rint(r[i][j]);
        if (abs(r[i][j] - nearest) > tolerance) {
          throw new GroupGenerationException(format(
              " Rotation of %g degrees about (%s) is not an integer matrix: entry [%d][%d] = %g.",
              thetaDegrees, DoubleMath.toString(axis), i, j, r[i][j]));
        }
        rounded[i][j] = (int) nearest;
      }
    }

    RotationMatrix rotation = new RotationMatrix(rounded);
    if (!rotation.isOrthogonal()) {
      throw new GroupGenerationException(format(
          " Rotation of %g degrees about (%s) rounds to a non-orthogonal matrix:%s",
          thetaDegrees, DoubleMath.toString(axis), rotation));
    }
    return rotation;
  }

  /**
   * The 24 proper rotations of the cubic group O in generation order.
   *
   * @return An unmodifiable list of 24 operations.
   */
  public List<RotationMatrix> properCubicRotations() {
    List<RotationMatrix> rotations = new ArrayList<>(CUBIC_GENERATORS.length);
    for (double[] generator : CUBIC_GENERATORS) {
      double[] axis = {generator[1], generator[2], generator[3]};
      RotationMatrix rotation = rotation(generator[0], axis);
      if (logger.isLoggable(Level.FINEST)) {
        logger.finest(format(" %5.1f degrees about (%s):%s",
            generator[0], DoubleMath.toString(axis), rotation));
      }
      rotations.add(rotation);
    }
    return Collections.unmodifiableList(rotations);
  }

  /**
   * The 48 operations of the full cubic group Oh: the proper rotations followed by each of them
   * composed with the inversion, in the same relative order.
   *
   * @return An unmodifiable list of 48 operations.
   */
  public List<RotationMatrix> cubicOperations() {
    List<RotationMatrix> proper = properCubicRotations();
    List<RotationMatrix> operations = new ArrayList<>(2 * proper.size());
    operations.addAll(proper);
    for (RotationMatrix rotation : proper) {
      operations.add(rotation.negate());
    }
    logger.fine(format(" Generated %d cubic point group operations.", operations.size()));
    return Collections.unmodifiableList(operations);
  }
}
