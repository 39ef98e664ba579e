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
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertThrows;

import java.util.List;
import org.junit.Test;

/**
 * Test the KPoint value class.
 *
 * @author Lattice Correlation X Developers
 */
public class KPointTest {

  @Test
  public void testFromTriples() {
    List<KPoint> points = KPoint.fromTriples(new int[][] {{0, 0, 0}, {2, 1, 0}});
    assertEquals(2, points.size());
    assertEquals(new KPoint(2, 1, 0), points.get(1));
    assertEquals(2, points.get(1).maxComponent());
    assertEquals(1, points.get(1).get(1));
    assertThrows(IllegalArgumentException.class,
        () -> KPoint.fromTriples(new int[][] {{0, 0}}));
  }

  @Test
  public void testEquality() {
    assertEquals(new KPoint(1, 2, 3).hashCode(), new KPoint(1, 2, 3).hashCode());
    assertNotEquals(new KPoint(1, 2, 3), new KPoint(3, 2, 1));
    assertEquals("(1, 2, 3)", new KPoint(1, 2, 3).toString());
  }

  @Test
  public void testDistance() {
    assertEquals(Math.sqrt(2.0), new KPoint(2, 2, 0).distance(new KPoint(1, 1, 0)), 1.0e-15);
    assertThrows(IllegalArgumentException.class, () -> new KPoint(0, 0, 0).get(3));
  }
}
