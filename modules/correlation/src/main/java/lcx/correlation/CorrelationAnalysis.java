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

import java.util.logging.Level;
import java.util.logging.Logger;
import lcx.crystal.BrillouinZoneExpander;
import lcx.crystal.PointGroup;
import lcx.utilities.LcxProperties;
import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * The CorrelationAnalysis turns a {@link CorrelationDataset} into the two plotted quantities of a
 * correlation channel: its values along the high-symmetry path, and its real-space profile.
 *
 * <p>Default projection settings are read from the <code>lcx.antifourier.xmin</code>,
 * <code>lcx.antifourier.xmax</code> and <code>lcx.antifourier.axis</code> properties.
 *
 * @author Lattice Correlation X Developers
 * @since 1.0
 */
public class CorrelationAnalysis {

  private static final Logger logger = Logger.getLogger(CorrelationAnalysis.class.getName());

  /** Default first real-space distance. */
  public static final int DEFAULT_XMIN = 0;
  /** Default exclusive last real-space distance. */
  public static final int DEFAULT_XMAX = 16;
  /** Default projection axis. */
  public static final int DEFAULT_AXIS = 0;

  private final InverseFourierProjector projector;
  private final HighSymmetryPathExtractor pathExtractor;
  private final int xmin;
  private final int xmax;
  private final int axis;

  /** Constructor using the layered LCX properties. */
  public CorrelationAnalysis() {
    this(LcxProperties.loadProperties());
  }

  /**
   * Constructor for CorrelationAnalysis.
   *
   * @param properties The configuration.
   * @throws IllegalArgumentException if a configured value is out of range.
   */
  public CorrelationAnalysis(CompositeConfiguration properties) {
    this(new InverseFourierProjector(new BrillouinZoneExpander(PointGroup.cubic(properties))),
        new HighSymmetryPathExtractor(properties),
        properties.getInt(LcxProperties.ANTIFOURIER_XMIN, DEFAULT_XMIN),
        properties.getInt(LcxProperties.ANTIFOURIER_XMAX, DEFAULT_XMAX),
        properties.getInt(LcxProperties.ANTIFOURIER_AXIS, DEFAULT_AXIS));
  }

  /**
   * Constructor for CorrelationAnalysis.
   *
   * @param projector Real-space projector.
   * @param pathExtractor High-symmetry path extractor.
   * @param xmin Default first real-space distance.
   * @param xmax Default exclusive last real-space distance.
   * @param axis Default projection axis.
   */
  public CorrelationAnalysis(InverseFourierProjector projector,
      HighSymmetryPathExtractor pathExtractor, int xmin, int xmax, int axis) {
    if (xmin >= xmax) {
      throw new IllegalArgumentException(
          format(" The default distance range [%d, %d) is empty.", xmin, xmax));
    }
    if (axis < 0 || axis > 2) {
      throw new IllegalArgumentException(format(" Axis %d is not one of 0, 1 or 2.", axis));
    }
    this.projector = projector;
    this.pathExtractor = pathExtractor;
    this.xmin = xmin;
    this.xmax = xmax;
    this.axis = axis;
  }

  /**
   * A correlation channel along the Γ-X-M-Γ-R-X-M-R path.
   *
   * @param dataset The dataset.
   * @param channel The channel.
   * @return The sampled path.
   */
  public HighSymmetryPath momentumPath(CorrelationDataset dataset, CorrelationChannel channel) {
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" %s path for %s.", channel.label, dataset));
    }
    return pathExtractor.extract(dataset.getGridSize(), dataset.getIrreducibleKPoints(),
        dataset.channel(channel));
  }

  /**
   * A correlation channel in real space over the default range and axis.
   *
   * @param dataset The dataset.
   * @param channel The channel.
   * @return The profile.
   */
  public RealSpaceProfile realSpaceProfile(CorrelationDataset dataset,
      CorrelationChannel channel) {
    return realSpaceProfile(dataset, channel, xmin, xmax, axis);
  }

  /**
   * A correlation channel in real space.
   *
   * @param dataset The dataset.
   * @param channel The channel.
   * @param xmin First real-space distance.
   * @param xmax Exclusive last real-space distance.
   * @param axis Projection axis.
   * @return The profile.
   */
  public RealSpaceProfile realSpaceProfile(CorrelationDataset dataset, CorrelationChannel channel,
      int xmin, int xmax, int axis) {
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" %s real-space profile for %s.", channel.label, dataset));
    }
    return projector.antifourier(dataset.getGridSize(), dataset.getIrreducibleKPoints(),
        dataset.channel(channel), xmin, xmax, axis);
  }

  /**
   * Getter for the field <code>xmin</code>.
   *
   * @return the default first real-space distance.
   */
  public int getXmin() {
    return xmin;
  }

  /**
   * Getter for the field <code>xmax</code>.
   *
   * @return the default exclusive last real-space distance.
   */
  public int getXmax() {
    return xmax;
  }

  /**
   * Getter for the field <code>axis</code>.
   *
   * @return the default projection axis.
   */
  public int getAxis() {
    return axis;
  }
}
