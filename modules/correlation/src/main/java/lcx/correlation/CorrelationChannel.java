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

import lcx.crystal.ShapeMismatchException;

/**
 * Correlation channels built from the diagonal and off-diagonal orbital correlators of a
 * simulation, as fixed linear combinations <code>a * diag + b * offd</code>.
 *
 * @author Lattice Correlation X Developers
 * @since 1.0
 */
public enum CorrelationChannel {
  /** Orbital charge correlation &lt;δT δT&gt; = 4 (diag - offd). */
  ORBITAL("orbital", 4.0, -4.0),
  /** Spin-orbital correlation &lt;δW δW&gt; = 2 (3 diag + offd). */
  SPIN_ORBITAL("spin-orbital", 6.0, 2.0),
  /** Spin exchange correlation &lt;δn↑ δn↓&gt; = 4 offd. */
  SPIN_EXCHANGE("spin-exchange", 0.0, 4.0);

  /** Short name used in file names and logs. */
  public final String label;
  private final double diagonalWeight;
  private final double offDiagonalWeight;

  CorrelationChannel(String label, double diagonalWeight, double offDiagonalWeight) {
    this.label = label;
    this.diagonalWeight = diagonalWeight;
    this.offDiagonalWeight = offDiagonalWeight;
  }

  /**
   * Combine the two correlators point by point.
   *
   * @param diag Diagonal correlator.
   * @param offd Off-diagonal correlator.
   * @return A newly allocated array of the channel values.
   * @throws ShapeMismatchException if the arrays differ in length.
   */
  public double[] combine(double[] diag, double[] offd) {
    if (diag.length != offd.length) {
      throw new ShapeMismatchException("Off-diagonal correlator does not match the diagonal one",
          diag.length, offd.length);
    }
    double[] func = new double[diag.length];
    for (int i = 0; i < func.length; i++) {
      func[i] = diagonalWeight * diag[i] + offDiagonalWeight * offd[i];
    }
    return func;
  }
}
