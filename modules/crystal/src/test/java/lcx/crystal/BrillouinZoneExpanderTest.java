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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import java.util.Collections;
import java.util.List;
import lcx.utilities.LcxTest;
import org.junit.Test;

/**
 * Test symmetry expansion of irreducible k-points onto the full periodic grid.
 *
 * @author Lattice Correlation X Developers
 */
public class BrillouinZoneExpanderTest extends LcxTest {

  private final BrillouinZoneExpander expander = new BrillouinZoneExpander();

  @Test
  public void testAxisOrbits() {
    List<KPoint> ibz = List.of(new KPoint(0, 0, 0), new KPoint(1, 0, 0), new KPoint(2, 0, 0));
    ExpandedGrid grid = expander.expand(4, ibz, new double[] {1.0, 2.0, 3.0});

    assertEquals(64, grid.size());
    assertEquals(1.0, grid.get(0, 0, 0), 0.0);
    for (KPoint k : List.of(new KPoint(1, 0, 0), new KPoint(3, 0, 0), new KPoint(0, 1, 0),
        new KPoint(0, 3, 0), new KPoint(0, 0, 1), new KPoint(0, 0, 3))) {
      assertEquals(k.toString(), 2.0, grid.get(k.getKx(), k.getKy(), k.getKz()), 0.0);
    }
    for (KPoint k : List.of(new KPoint(2, 0, 0), new KPoint(0, 2, 0), new KPoint(0, 0, 2))) {
      assertEquals(k.toString(), 3.0, grid.get(k.getKx(), k.getKy(), k.getKz()), 0.0);
    }
    // Points off the axes are reached by no orbit.
    assertEquals(0.0, grid.get(1, 1, 0), 0.0);
    assertEquals(0.0, grid.get(2, 2, 2), 0.0);

    double total = 0.0;
    for (double v : grid.toArray()) {
      total += v;
    }
    assertEquals(1.0 + 6 * 2.0 + 3 * 3.0, total, 0.0);
  }

  @Test
  public void testLastWriteWins() {
    // (1,0,0) and (3,0,0) share an orbit on a period of 4; the later point overwrites.
    List<KPoint> ibz = List.of(new KPoint(1, 0, 0), new KPoint(3, 0, 0));
    ExpandedGrid grid = expander.expand(4, ibz, new double[] {5.0, 7.0});
    assertEquals(7.0, grid.get(1, 0, 0), 0.0);
    assertEquals(7.0, grid.get(0, 3, 0), 0.0);

    ExpandedGrid swapped = expander.expand(4, List.of(ibz.get(1), ibz.get(0)),
        new double[] {7.0, 5.0});
    assertEquals(5.0, swapped.get(1, 0, 0), 0.0);
  }

  @Test
  public void testPlaneSums() {
    List<KPoint> ibz = List.of(new KPoint(0, 0, 0), new KPoint(1, 0, 0), new KPoint(2, 0, 0));
    ExpandedGrid grid = expander.expand(4, ibz, new double[] {1.0, 2.0, 3.0});
    double[] expected = {15.0, 2.0, 3.0, 2.0};
    for (int axis = 0; axis < 3; axis++) {
      double[] sums = grid.planeSums(axis);
      for (int m = 0; m < 4; m++) {
        assertEquals(expected[m], sums[m], 0.0);
      }
    }
    assertThrows(IllegalArgumentException.class, () -> grid.planeSums(3));
  }

  @Test
  public void testEmptyMesh() {
    ExpandedGrid grid = expander.expand(6, Collections.emptyList(), new double[0]);
    for (double v : grid.toArray()) {
      assertEquals(0.0, v, 0.0);
    }
  }

  @Test
  public void testShapeMismatch() {
    List<KPoint> ibz = List.of(new KPoint(0, 0, 0), new KPoint(1, 0, 0));
    ShapeMismatchException e = assertThrows(ShapeMismatchException.class,
        () -> expander.expand(4, ibz, new double[] {1.0}));
    assertEquals(2, e.expected);
    assertEquals(1, e.actual);
  }

  @Test
  public void testNonPositiveGridSize() {
    assertThrows(IllegalArgumentException.class,
        () -> expander.expand(0, List.of(new KPoint(0, 0, 0)), new double[] {1.0}));
  }
}
