package com.floorplan.positioning.algorithm;

import com.floorplan.positioning.algorithm.impl.AffineTransform;
import com.floorplan.positioning.algorithm.impl.SimilarityTransform;
import com.floorplan.positioning.dto.Calibration;
import com.floorplan.positioning.dto.CalibrationPoint;
import java.util.Optional;
import org.apache.commons.math3.geometry.euclidean.twod.Vector2D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives a {@link WorldToPixelTransform} from a calibration.
 *
 * <p>Selection order:
 *
 * <ol>
 *   <li>Affine solve over all three points.
 *   <li>If the world points are collinear, a similarity transform through the pair of points with
 *       the largest world separation. Candidate pairs are compared in the order (1,2), (1,3),
 *       (2,3) and the earlier pair wins a tie.
 *   <li>If even that pair coincides, no transform.
 * </ol>
 *
 * <p>Stateless; the result is never cached so it always reflects the calibration passed in.
 */
public final class TransformSolver {

  private static final Logger logger = LoggerFactory.getLogger(TransformSolver.class);

  private TransformSolver() {}

  /**
   * Solves the transform for a calibration.
   *
   * @param calibration Three reference pairs
   * @return The transform, or empty if the calibration is degenerate
   */
  public static Optional<WorldToPixelTransform> solve(Calibration calibration) {
    Optional<AffineTransform> affine = AffineTransform.solve(calibration);
    if (affine.isPresent()) {
      return Optional.of(affine.get());
    }

    CalibrationPoint[] pair = bestSeparatedPair(calibration);
    logger.debug("World points are collinear, falling back to similarity transform");
    return SimilarityTransform.fromPoints(pair[0], pair[1]).map(WorldToPixelTransform.class::cast);
  }

  /**
   * Finds the two calibration points whose world coordinates are furthest apart.
   *
   * @param calibration Three reference pairs
   * @return The selected pair, in calibration order
   */
  static CalibrationPoint[] bestSeparatedPair(Calibration calibration) {
    CalibrationPoint p1 = calibration.first();
    CalibrationPoint p2 = calibration.second();
    CalibrationPoint p3 = calibration.third();

    CalibrationPoint[] best = {p1, p2};
    double bestDistSq = worldDistanceSq(p1, p2);

    double d13 = worldDistanceSq(p1, p3);
    if (d13 > bestDistSq) {
      best = new CalibrationPoint[] {p1, p3};
      bestDistSq = d13;
    }

    double d23 = worldDistanceSq(p2, p3);
    if (d23 > bestDistSq) {
      best = new CalibrationPoint[] {p2, p3};
    }
    return best;
  }

  private static double worldDistanceSq(CalibrationPoint p, CalibrationPoint q) {
    return new Vector2D(p.world().x(), p.world().y())
        .distanceSq(new Vector2D(q.world().x(), q.world().y()));
  }
}
