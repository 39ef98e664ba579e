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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lcx.utilities.LcxProperties;
import lcx.utilities.LcxTest;
import org.junit.Test;

/**
 * Test the group properties of the cubic point group Oh.
 *
 * @author Lattice Correlation X Developers
 */
public class PointGroupTest extends LcxTest {

  private final PointGroup oh = PointGroup.cubic();

  @Test
  public void testOrder() {
    assertEquals(48, oh.getNumberOfOperators());
    Set<RotationMatrix> distinct = new HashSet<>(oh.getOperators());
    assertEquals(" Operations should be distinct", 48, distinct.size());
  }

  @Test
  public void testOrthogonality() {
    for (RotationMatrix rotation : oh) {
      assertTrue(rotation.toString(), rotation.isOrthogonal());
      int det = rotation.determinant();
      assertTrue(rotation.toString(), det == 1 || det == -1);
    }
  }

  @Test
  public void testClosure() {
    assertTrue(oh.isClosed());
    for (RotationMatrix rotation : oh) {
      assertTrue(oh.contains(rotation.transpose()));
    }
  }

  @Test
  public void testGenerationOrder() {
    assertEquals(RotationMatrix.IDENTITY, oh.getOperator(0));
    for (int i = 0; i < 24; i++) {
      assertFalse(oh.getOperator(i).isImproper());
      assertEquals(oh.getOperator(i).negate(), oh.getOperator(i + 24));
    }
  }

  @Test
  public void testSharedAndImmutable() {
    assertSame(oh, PointGroup.cubic());
    List<RotationMatrix> operators = oh.getOperators();
    assertThrows(UnsupportedOperationException.class,
        () -> operators.add(RotationMatrix.IDENTITY));
  }

  @Test
  public void testConfiguredTolerance() {
    assertSame(oh, PointGroup.cubic(LcxProperties.loadProperties()));

    System.setProperty(LcxProperties.ROTATION_TOLERANCE, "1.0e-9");
    PointGroup configured = PointGroup.cubic(LcxProperties.loadProperties());
    assertNotSame(oh, configured);
    assertEquals(oh.getOperators(), configured.getOperators());

    // The shared group ignores the configured tolerance.
    System.setProperty(LcxProperties.ROTATION_TOLERANCE, "0.7");
    assertThrows(IllegalArgumentException.class,
        () -> PointGroup.cubic(LcxProperties.loadProperties()));
    assertEquals(48, PointGroup.cubic().getNumberOfOperators());
  }

  @Test
  public void testOrbitSizes() {
    int gridSize = 8;
    assertEquals(1, oh.orbit(new KPoint(0, 0, 0), gridSize).size());
    assertEquals(6, oh.orbit(new KPoint(1, 0, 0), gridSize).size());
    assertEquals(12, oh.orbit(new KPoint(1, 1, 0), gridSize).size());
    assertEquals(8, oh.orbit(new KPoint(1, 1, 1), gridSize).size());
    assertEquals(24, oh.orbit(new KPoint(2, 1, 0), gridSize).size());
    assertEquals(48, oh.orbit(new KPoint(3, 2, 1), gridSize).size());
    // -4 and 4 are the same index on a period of 8.
    assertEquals(3, oh.orbit(new KPoint(4, 0, 0), gridSize).size());
  }

  @Test
  public void testOrbitIsWrapped() {
    List<KPoint> orbit = oh.orbit(new KPoint(1, 0, 0), 4);
    assertEquals(new KPoint(1, 0, 0), orbit.get(0));
    assertTrue(orbit.contains(new KPoint(3, 0, 0)));
    assertTrue(orbit.contains(new KPoint(0, 0, 3)));
  }
}
