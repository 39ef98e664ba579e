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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertThrows;

import java.util.Arrays;
import java.util.Collection;
import lcx.crystal.ShapeMismatchException;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

/**
 * Test the linear combinations of the correlation channels.
 *
 * @author Lattice Correlation X Developers
 */
@RunWith(Parameterized.class)
public class CorrelationChannelTest {

  private static final double[] diag = {0.5, 0.25, -1.0};
  private static final double[] offd = {0.125, 0.5, 2.0};

  @Parameters
  public static Collection<Object[]> data() {
    return Arrays.asList(new Object[][] {
        {CorrelationChannel.ORBITAL, new double[] {1.5, -1.0, -12.0}},
        {CorrelationChannel.SPIN_ORBITAL, new double[] {3.25, 2.5, -2.0}},
        {CorrelationChannel.SPIN_EXCHANGE, new double[] {0.5, 2.0, 8.0}}
    });
  }

  private final CorrelationChannel channel;
  private final double[] expected;

  public CorrelationChannelTest(CorrelationChannel channel, double[] expected) {
    this.channel = channel;
    this.expected = expected;
  }

  @Test
  public void testCombine() {
    assertArrayEquals(channel.label, expected, channel.combine(diag, offd), 0.0);
  }

  @Test
  public void testShapeMismatch() {
    assertThrows(ShapeMismatchException.class,
        () -> channel.combine(diag, new double[] {1.0}));
  }
}
