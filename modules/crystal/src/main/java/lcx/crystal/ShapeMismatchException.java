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

import java.util.List;

/**
 * Thrown when per-point values are not aligned 1:1 with the k-points they describe.
 *
 * @author Lattice Correlation X Developers
 * @since 1.0
 */
public class ShapeMismatchException extends IllegalArgumentException {

  /** The number of entries that were expected. */
  public final int expected;
  /** The number of entries that were supplied. */
  public final int actual;

  /**
   * Constructor for ShapeMismatchException.
   *
   * @param description What was being aligned.
   * @param expected The number of entries that were expected.
   * @param actual The number of entries that were supplied.
   */
  public ShapeMismatchException(String description, int expected, int actual) {
    super(format(" %s: expected %d values but found %d.", description, expected, actual));
    this.expected = expected;
    this.actual = actual;
  }

  /**
   * Check that a value array is aligned with a list of k-points.
   *
   * @param points The k-points.
   * @param values The values, one per k-point.
   * @throws ShapeMismatchException if the lengths differ.
   */
  public static void requireAligned(List<KPoint> points, double[] values) {
    if (points.size() != values.length) {
      throw new ShapeMismatchException("Function values do not match the k-points",
          points.size(), values.length);
    }
  }
}
