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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import lcx.utilities.LcxProperties;
import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * The PointGroup class holds the ordered operations of a crystallographic point group.
 *
 * <p>Immutable PointGroup instances are made available through factory methods. The cubic group is
 * built on first use and then shared read-only by every caller.
 *
 * @author Lattice Correlation X Developers
 * @author Michael J. Schnieders
 * @see <a href="http://it.iucr.org/Ab/" target="_blank"> International Tables for Crystallography
 *     Volume A: Space-group symmetry </a>
 * @since 1.0
 */
public final class PointGroup implements Iterable<RotationMatrix> {

  private static final Logger logger = Logger.getLogger(PointGroup.class.getName());

  /** Schoenflies symbol of the point group. */
  public final String name;
  /** The operations in generation order. */
  private final List<RotationMatrix> operations;

  /**
   * Constructor for PointGroup.
   *
   * @param name Schoenflies symbol.
   * @param operations The operations in generation order; the list is copied.
   */
  public PointGroup(String name, List<RotationMatrix> operations) {
    this.name = name;
    this.operations = List.copyOf(operations);
  }

  /**
   * The full cubic point group Oh (order 48), generated with the default rotation tolerance.
   * No configuration is read.
   *
   * @return The shared Oh instance.
   * @throws ExceptionInInitializerError wrapping a {@link GroupGenerationException} if the group
   *     could not be generated.
   */
  public static PointGroup cubic() {
    return CubicHolder.OH;
  }

  /**
   * The cubic point group Oh, generated with the <code>lcx.rotation.tolerance</code> property
   * when it is set. Without that property the shared instance is returned.
   *
   * @param properties The configuration.
   * @return Oh.
   * @throws IllegalArgumentException if the configured tolerance is outside (0, 0.5).
   * @throws GroupGenerationException if the group could not be generated.
   */
  public static PointGroup cubic(CompositeConfiguration properties) {
    if (!properties.containsKey(LcxProperties.ROTATION_TOLERANCE)) {
      return cubic();
    }
    return new PointGroup("Oh", new PointGroupGenerator(properties).cubicOperations());
  }

  /** Initialization-on-demand holder for the cubic group. */
  private static final class CubicHolder {

    private static final PointGroup OH =
        new PointGroup("Oh", new PointGroupGenerator().cubicOperations());

    static {
      logger.info(format(" Point group %s built with %d operations.",
          OH.name, OH.getNumberOfOperators()));
    }
  }

  /**
   * Return the number of operations.
   *
   * @return the number of operations.
   */
  public int getNumberOfOperators() {
    return operations.size();
  }

  /**
   * Return the ith operation.
   *
   * @param i the operation number.
   * @return the RotationMatrix
   */
  public RotationMatrix getOperator(int i) {
    return operations.get(i);
  }

  /**
   * The operations in generation order.
   *
   * @return an unmodifiable list.
   */
  public List<RotationMatrix> getOperators() {
    return operations;
  }

  /**
   * Check if an operation belongs to the group.
   *
   * @param rotation The operation.
   * @return true if present.
   */
  public boolean contains(RotationMatrix rotation) {
    return operations.contains(rotation);
  }

  /**
   * Check closure: every product of two operations is again an operation.
   *
   * @return true if the operations form a closed set.
   */
  public boolean isClosed() {
    Set<RotationMatrix> members = Set.copyOf(operations);
    for (RotationMatrix a : operations) {
      for (RotationMatrix b : operations) {
        if (!members.contains(a.multiply(b))) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * The distinct images of a k-point on a periodic grid, in the order they are first reached while
   * applying the operations in generation order.
   *
   * @param k The k-point.
   * @param gridSize The grid period along each axis.
   * @return The orbit, wrapped into [0, gridSize) along each axis.
   */
  public List<KPoint> orbit(KPoint k, int gridSize) {
    if (gridSize <= 0) {
      throw new IllegalArgumentException(format(" Grid size %d must be positive.", gridSize));
    }
    Set<KPoint> images = new LinkedHashSet<>();
    int[] mate = new int[3];
    for (RotationMatrix rotation : operations) {
      rotation.applyPeriodic(k.getKx(), k.getKy(), k.getKz(), mate, gridSize);
      images.add(new KPoint(mate[0], mate[1], mate[2]));
    }
    return new ArrayList<>(images);
  }

  /** {@inheritDoc} */
  @Override
  public Iterator<RotationMatrix> iterator() {
    return operations.iterator();
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format("%s (%d operations)", name, operations.size());
  }
}
