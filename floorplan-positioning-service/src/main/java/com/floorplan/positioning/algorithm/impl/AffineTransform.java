package com.floorplan.positioning.algorithm.impl;

import com.floorplan.positioning.algorithm.TransformType;
import com.floorplan.positioning.algorithm.WorldToPixelTransform;
import com.floorplan.positioning.dto.Calibration;
import com.floorplan.positioning.dto.PixelPoint;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Six-parameter affine transform solved exactly from three calibration points.
 *
 * <p>Solves the system
 *
 * <pre>
 *   u = a·x + b·y + tx
 *   v = c·x + d·y + ty
 * </pre>
 *
 * where (x, y) is (longitude, latitude) and (u, v) is the pixel, using closed-form Cramer's rule
 * expansions over the determinant
 *
 * <pre>
 *   det = x1(y2 − y3) − y1(x2 − x3) + (x2·y3 − x3·y2)
 * </pre>
 *
 * <p>When |det| is below {@link #DETERMINANT_EPSILON} the world points are collinear (or nearly
 * so) and no transform is produced; dividing by a near-zero determinant would turn rounding noise
 * into a wildly wrong mapping.
 */
public final class AffineTransform implements WorldToPixelTransform {

  private static final Logger logger = LoggerFactory.getLogger(AffineTransform.class);

  /** Minimum determinant magnitude for a well-conditioned solve. */
  public static final double DETERMINANT_EPSILON = 1e-10;

  private final double a;
  private final double b;
  private final double tx;
  private final double c;
  private final double d;
  private final double ty;

  AffineTransform(double a, double b, double tx, double c, double d, double ty) {
    this.a = a;
    this.b = b;
    this.tx = tx;
    this.c = c;
    this.d = d;
    this.ty = ty;
  }

  /**
   * Solves the affine transform for a calibration.
   *
   * @param calibration Three reference pairs
   * @return The transform, or empty if the world points are collinear
   */
  public static Optional<AffineTransform> solve(Calibration calibration) {
    double x1 = calibration.first().world().x();
    double y1 = calibration.first().world().y();
    double x2 = calibration.second().world().x();
    double y2 = calibration.second().world().y();
    double x3 = calibration.third().world().x();
    double y3 = calibration.third().world().y();

    double u1 = calibration.first().pixel().x();
    double v1 = calibration.first().pixel().y();
    double u2 = calibration.second().pixel().x();
    double v2 = calibration.second().pixel().y();
    double u3 = calibration.third().pixel().x();
    double v3 = calibration.third().pixel().y();

    double det = x1 * (y2 - y3) - y1 * (x2 - x3) + (x2 * y3 - x3 * y2);
    if (Math.abs(det) < DETERMINANT_EPSILON) {
      logger.debug("Affine solve rejected: determinant {} below {}", det, DETERMINANT_EPSILON);
      return Optional.empty();
    }

    double a = (u1 * (y2 - y3) + u2 * (y3 - y1) + u3 * (y1 - y2)) / det;
    double b = (u1 * (x3 - x2) + u2 * (x1 - x3) + u3 * (x2 - x1)) / det;
    double tx = (u1 * (x2 * y3 - x3 * y2) + u2 * (x3 * y1 - x1 * y3) + u3 * (x1 * y2 - x2 * y1)) / det;

    double c = (v1 * (y2 - y3) + v2 * (y3 - y1) + v3 * (y1 - y2)) / det;
    double d = (v1 * (x3 - x2) + v2 * (x1 - x3) + v3 * (x2 - x1)) / det;
    double ty = (v1 * (x2 * y3 - x3 * y2) + v2 * (x3 * y1 - x1 * y3) + v3 * (x1 * y2 - x2 * y1)) / det;

    return Optional.of(new AffineTransform(a, b, tx, c, d, ty));
  }

  @Override
  public PixelPoint apply(double latitude, double longitude) {
    double pixelX = a * longitude + b * latitude + tx;
    double pixelY = c * longitude + d * latitude + ty;
    return new PixelPoint(pixelX, pixelY);
  }

  /**
   * The latitude column (b, d) is the pixel displacement per degree of latitude, i.e. the north
   * vector.
   */
  @Override
  public double northAngle() {
    return Math.atan2(d, b);
  }

  @Override
  public TransformType getType() {
    return TransformType.AFFINE;
  }

  /**
   * Returns the coefficients in the order a, b, tx, c, d, ty.
   *
   * @return Coefficient array (a copy)
   */
  public double[] getCoefficients() {
    return new double[] {a, b, tx, c, d, ty};
  }

  @Override
  public String toString() {
    return String.format(
        "AffineTransform[a=%.6g, b=%.6g, tx=%.6g, c=%.6g, d=%.6g, ty=%.6g]", a, b, tx, c, d, ty);
  }
}
