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

/**
 * A real-space correlation profile: one value per integer distance x in [xmin, xmax).
 *
 * @author Lattice Correlation X Developers
 * @see InverseFourierProjector
 * @since 1.0
 */
public class RealSpaceProfile {

  private final int xmin;
  private final double[] values;

  /**
   * Constructor for RealSpaceProfile.
   *
   * @param xmin The first distance.
   * @param values The profile, where values[i] belongs to distance xmin + i.
   */
  public RealSpaceProfile(int xmin, double[] values) {
    this.xmin = xmin;
    this.values = values.clone();
  }

  /**
   * Number of distances.
   *
   * @return xmax - xmin.
   */
  public int size() {
    return values.length;
  }

  /**
   * The distance of the ith entry.
   *
   * @param i Entry index.
   * @return xmin + i.
   */
  public int getX(int i) {
    return xmin + i;
  }

  /**
   * The value of the ith entry.
   *
   * @param i Entry index.
   * @return the profile at distance xmin + i.
   */
  public double getValue(int i) {
    return values[i];
  }

  /**
   * All distances.
   *
   * @return a newly allocated array {xmin, ..., xmax - 1}.
   */
  public int[] getDistances() {
    int[] x = new int[values.length];
    for (int i = 0; i < x.length; i++) {
      x[i] = xmin + i;
    }
    return x;
  }

  /**
   * All values.
   *
   * @return a copy of the profile.
   */
  public double[] getValues() {
    return values.clone();
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(format(" %6s %16s\n", "x", "G(x)"));
    for (int i = 0; i < values.length; i++) {
      sb.append(format(" %6d %16.10f\n", xmin + i, values[i]));
    }
    return sb.toString();
  }
}
