package com.floorplan.positioning.algorithm.impl;

import com.floorplan.positioning.algorithm.TransformType;
import com.floorplan.positioning.algorithm.WorldToPixelTransform;
import com.floorplan.positioning.dto.CalibrationPoint;
import com.floorplan.positioning.dto.PixelPoint;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Four-parameter similarity transform (uniform scale, rotation, translation, no shear) fitted to
 * two point correspondences.
 *
 * <p>(A, B) are the real and imaginary parts of the complex scale-rotation factor mapping the
 * world delta onto the pixel delta:
 *
 * <pre>
 *   distSq = dx² + dy²
 *   A  = (du·dx + dv·dy) / distSq
 *   B  = (dv·dx − du·dy) / distSq
 *   tx = u_A − (A·x_A − B·y_A)
 *   ty = v_A − (B·x_A + A·y_A)
 * </pre>
 *
 * The fit is exact at both defining points.
 */
public final class SimilarityTransform implements WorldToPixelTransform {

  private static final Logger logger = LoggerFactory.getLogger(SimilarityTransform.class);

  /** Squared world distance below which the two points are treated as identical. */
  public static final double MIN_DISTANCE_SQUARED = 1e-20;

  private final double scaleCos;
  private final double scaleSin;
  private final double tx;
  private final double ty;

  SimilarityTransform(double scaleCos, double scaleSin, double tx, double ty) {
    this.scaleCos = scaleCos;
    this.scaleSin = scaleSin;
    this.tx = tx;
    this.ty = ty;
  }

  /**
   * Fits a similarity transform through two calibration points.
   *
   * @param anchor First defining point; the translation is solved against it
   * @param other Second defining point
   * @return The transform, or empty if the two world points coincide
   */
  public static Optional<SimilarityTransform> fromPoints(CalibrationPoint anchor, CalibrationPoint other) {
    double xA = anchor.world().x();
    double yA = anchor.world().y();
    double uA = anchor.pixel().x();
    double vA = anchor.pixel().y();

    double dx = other.world().x() - xA;
    double dy = other.world().y() - yA;
    double du = other.pixel().x() - uA;
    double dv = other.pixel().y() - vA;

    double distSq = dx * dx + dy * dy;
    if (distSq < MIN_DISTANCE_SQUARED) {
      logger.debug("Similarity fit rejected: squared world distance {} below {}", distSq, MIN_DISTANCE_SQUARED);
      return Optional.empty();
    }

    double scaleCos = (du * dx + dv * dy) / distSq;
    double scaleSin = (dv * dx - du * dy) / distSq;
    double tx = uA - (scaleCos * xA - scaleSin * yA);
    double ty = vA - (scaleSin * xA + scaleCos * yA);

    return Optional.of(new SimilarityTransform(scaleCos, scaleSin, tx, ty));
  }

  @Override
  public PixelPoint apply(double latitude, double longitude) {
    double pixelX = scaleCos * longitude - scaleSin * latitude + tx;
    double pixelY = scaleSin * longitude + scaleCos * latitude + ty;
    return new PixelPoint(pixelX, pixelY);
  }

  /** Pixel x moves by −B per degree of latitude and pixel y by +A, so north is (−B, A). */
  @Override
  public double northAngle() {
    return Math.atan2(scaleCos, -scaleSin);
  }

  @Override
  public TransformType getType() {
    return TransformType.SIMILARITY;
  }

  /** Pixels per degree; the magnitude of (A, B). */
  public double getScale() {
    return Math.hypot(scaleCos, scaleSin);
  }

  /** Rotation from world to pixel space in radians; the argument of (A, B). */
  public double getRotation() {
    return Math.atan2(scaleSin, scaleCos);
  }

  @Override
  public String toString() {
    return String.format(
        "SimilarityTransform[A=%.6g, B=%.6g, tx=%.6g, ty=%.6g]", scaleCos, scaleSin, tx, ty);
  }
}
