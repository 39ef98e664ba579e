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
import static org.apache.commons.math3.util.FastMath.PI;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;
import lcx.crystal.KPoint;
import lcx.crystal.ShapeMismatchException;
import lcx.utilities.LcxProperties;
import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * The HighSymmetryPathExtractor selects the irreducible k-points that lie on the
 * Γ-X-M-Γ-R-X-M-R path, orders them along the path and computes the cumulative path length.
 *
 * <p>The path is assembled from seven pieces. Points of each segment are taken in input order,
 * trimmed, then optionally reversed, so that shared corners appear exactly once:
 * <pre>
 *   Γ-X  drop last
 *   X-M  drop last
 *   Γ-M  drop first, reversed (M to Γ)
 *   Γ-R  drop last
 *   X-R  drop first, reversed (R to X)
 *   X-M  drop last
 *   M-R  keep all
 * </pre>
 *
 * @author Lattice Correlation X Developers
 * @since 1.0
 */
public class HighSymmetryPathExtractor {

  private static final Logger logger = Logger.getLogger(HighSymmetryPathExtractor.class.getName());

  /** One piece of the assembled path. */
  private record Piece(PathSegment segment, boolean reverse, boolean dropFirst, boolean dropLast) {

  }

  private static final List<Piece> PATH = List.of(
      new Piece(PathSegment.GAMMA_X, false, false, true),
      new Piece(PathSegment.X_M, false, false, true),
      new Piece(PathSegment.GAMMA_M, true, true, false),
      new Piece(PathSegment.GAMMA_R, false, false, true),
      new Piece(PathSegment.X_R, true, true, false),
      new Piece(PathSegment.X_M, false, false, true),
      new Piece(PathSegment.M_R, false, false, false));

  /** Reject an explicit grid size that disagrees with the one inferred from the mesh. */
  private final boolean strictGridSize;

  /** Constructor that rejects grid size mismatches. */
  public HighSymmetryPathExtractor() {
    this(true);
  }

  /**
   * Constructor reading the <code>lcx.path.strict-grid-size</code> property.
   *
   * @param properties The configuration.
   */
  public HighSymmetryPathExtractor(CompositeConfiguration properties) {
    this(properties.getBoolean(LcxProperties.STRICT_GRID_SIZE, true));
  }

  /**
   * Constructor for HighSymmetryPathExtractor.
   *
   * @param strictGridSize If true, a grid size mismatch is an error; otherwise it is logged.
   */
  public HighSymmetryPathExtractor(boolean strictGridSize) {
    this.strictGridSize = strictGridSize;
  }

  /**
   * Infer the grid period as twice the largest component of any irreducible k-point. This assumes
   * the mesh reaches the zone boundary at N/2.
   *
   * @param ibz The irreducible k-points.
   * @return 2 * max component.
   * @throws MalformedBrillouinZoneException if the mesh is empty.
   */
  public static int inferGridSize(List<KPoint> ibz) {
    if (ibz.isEmpty()) {
      throw new MalformedBrillouinZoneException(" the irreducible mesh is empty.");
    }
    int max = Integer.MIN_VALUE;
    for (KPoint k : ibz) {
      max = Math.max(max, k.maxComponent());
    }
    return 2 * max;
  }

  /**
   * Extract the path using a grid period inferred from the mesh.
   *
   * @param ibz The irreducible k-points.
   * @param func One value per k-point.
   * @return The sampled path.
   */
  public HighSymmetryPath extract(List<KPoint> ibz, double[] func) {
    ShapeMismatchException.requireAligned(ibz, func);
    return assemble(inferGridSize(ibz), ibz, func);
  }

  /**
   * Extract the path using the authoritative grid period of the dataset.
   *
   * @param gridSize The grid period N along each axis.
   * @param ibz The irreducible k-points.
   * @param func One value per k-point.
   * @return The sampled path.
   * @throws MalformedBrillouinZoneException if the largest mesh component differs from
   *     gridSize / 2 and grid sizes are checked strictly, or if a path segment is empty.
   */
  public HighSymmetryPath extract(int gridSize, List<KPoint> ibz, double[] func) {
    ShapeMismatchException.requireAligned(ibz, func);
    // Odd periods reach only gridSize / 2, so compare zone boundaries rather than periods.
    int boundary = inferGridSize(ibz) / 2;
    if (boundary != gridSize / 2) {
      String message = format(
          " the dataset grid size %d has its zone boundary at %d but the mesh reaches %d.",
          gridSize, gridSize / 2, boundary);
      if (strictGridSize) {
        throw new MalformedBrillouinZoneException(message);
      }
      logger.warning(message);
    }
    return assemble(gridSize, ibz, func);
  }

  private HighSymmetryPath assemble(int gridSize, List<KPoint> ibz, double[] func) {
    if (gridSize < 2) {
      throw new MalformedBrillouinZoneException(
          format(" a grid size of %d has no zone boundary.", gridSize));
    }
    int half = gridSize / 2;

    List<Integer> path = new ArrayList<>();
    for (Piece piece : PATH) {
      appendSegment(piece, ibz, half, path);
    }

    int n = path.size();
    List<KPoint> points = new ArrayList<>(n);
    double[] values = new double[n];
    for (int j = 0; j < n; j++) {
      int index = path.get(j);
      points.add(ibz.get(index));
      values[j] = func[index];
    }

    // Cumulative path length, scaled so that one grid period is 2 pi.
    double[] distances = new double[n];
    double cumulative = 0.0;
    for (int j = 1; j < n; j++) {
      cumulative += points.get(j).distance(points.get(j - 1));
      distances[j] = cumulative / gridSize * 2.0 * PI;
    }

    return new HighSymmetryPath(gridSize, distances, values, points);
  }

  /**
   * Append the indices of one path piece.
   *
   * @param piece The segment and its trim rules.
   * @param ibz The irreducible k-points.
   * @param half Half the grid period.
   * @param path The indices assembled so far.
   */
  private static void appendSegment(Piece piece, List<KPoint> ibz, int half, List<Integer> path) {
    PathSegment segment = piece.segment();
    List<Integer> matches = new ArrayList<>();
    for (int i = 0; i < ibz.size(); i++) {
      if (segment.contains(ibz.get(i), half)) {
        matches.add(i);
      }
    }
    if (matches.isEmpty()) {
      throw new MalformedBrillouinZoneException(
          format(" no k-points lie on the %s segment.", segment.label));
    }
    if (matches.size() != half + 1) {
      logger.warning(format(" The %s segment has %d k-points; a dense mesh has %d.",
          segment.label, matches.size(), half + 1));
    }

    int from = piece.dropFirst() ? 1 : 0;
    int to = piece.dropLast() ? matches.size() - 1 : matches.size();
    if (from >= to) {
      throw new MalformedBrillouinZoneException(
          format(" the %s segment is empty once its end point is removed.", segment.label));
    }
    List<Integer> kept = new ArrayList<>(matches.subList(from, to));
    if (piece.reverse()) {
      Collections.reverse(kept);
    }
    path.addAll(kept);
  }
}
