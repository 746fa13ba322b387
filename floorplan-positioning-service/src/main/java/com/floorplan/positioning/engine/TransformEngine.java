package com.floorplan.positioning.engine;

import com.floorplan.positioning.algorithm.TransformSolver;
import com.floorplan.positioning.algorithm.WorldToPixelTransform;
import com.floorplan.positioning.algorithm.util.GeodesicDistance;
import com.floorplan.positioning.dto.Calibration;
import com.floorplan.positioning.dto.CalibrationPoint;
import com.floorplan.positioning.dto.PixelPoint;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the calibration of the loaded plan and answers transform queries against it.
 *
 * <p>State is either uncalibrated or one immutable {@link Calibration}. The transform is never
 * cached: every query solves it again from the current calibration, so queries can never see a
 * transform that is out of date.
 *
 * <p>Thread safety: mutations are serialized under one lock and publish a new immutable state
 * snapshot; queries read the snapshot without locking and therefore never observe a mix of old
 * and new points. Listeners run on the mutating thread, inside the lock, after the new state is
 * visible, so they are notified in version order.
 *
 * <p>One instance serves one loaded plan. Callers must {@link #clearCalibration()} before a
 * different plan is loaded.
 */
public class TransformEngine {

  private static final Logger logger = LoggerFactory.getLogger(TransformEngine.class);

  private static final double NORTH_ANGLE_DEFAULT = 0.0;

  private record State(Calibration calibration, long version) {}

  private final GeodesicDistance geodesicDistance;
  private final Object mutationLock = new Object();
  private final List<CalibrationChangeListener> listeners = new CopyOnWriteArrayList<>();

  private volatile State state = new State(null, 0L);

  public TransformEngine(GeodesicDistance geodesicDistance) {
    this.geodesicDistance = Objects.requireNonNull(geodesicDistance, "geodesicDistance must not be null");
  }

  // ============================================================================
  // CALIBRATION STATE
  // ============================================================================

  public boolean isCalibrated() {
    return state.calibration() != null;
  }

  /**
   * Replaces the calibration. No geometric validation happens here; degenerate points surface as
   * {@link TransformStatus#DEGENERATE} results from the queries.
   */
  public void setCalibration(CalibrationPoint first, CalibrationPoint second, CalibrationPoint third) {
    setCalibration(new Calibration(first, second, third));
  }

  /**
   * Replaces the calibration atomically and notifies listeners.
   *
   * @param calibration The new calibration
   */
  public void setCalibration(Calibration calibration) {
    Objects.requireNonNull(calibration, "calibration must not be null");
    synchronized (mutationLock) {
      State next = new State(calibration, state.version() + 1);
      state = next;
      logger.info("Calibration set (version {})", next.version());
      notifyListeners(CalibrationChangeEvent.set(next.version(), calibration));
    }
  }

  /** Resets to uncalibrated. Clearing an engine that holds no calibration does nothing. */
  public void clearCalibration() {
    synchronized (mutationLock) {
      State current = state;
      if (current.calibration() == null) {
        logger.debug("Calibration already clear (version {})", current.version());
        return;
      }
      State next = new State(null, current.version() + 1);
      state = next;
      logger.info("Calibration cleared (version {})", next.version());
      notifyListeners(CalibrationChangeEvent.cleared(next.version()));
    }
  }

  /** The stored reference points, for persistence. */
  public Optional<Calibration> getCalibration() {
    return Optional.ofNullable(state.calibration());
  }

  /** Incremented on every effective change; consumers may poll it instead of listening. */
  public long getVersion() {
    return state.version();
  }

  public void addListener(CalibrationChangeListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
  }

  public void removeListener(CalibrationChangeListener listener) {
    listeners.remove(listener);
  }

  // ============================================================================
  // QUERIES
  // ============================================================================

  /**
   * Captures the calibration, version, transform and scale of one engine state. Use this when a
   * response combines several derived values so they all belong to the same calibration.
   */
  public CalibrationSnapshot snapshot() {
    State current = state;
    return new CalibrationSnapshot(
        current.calibration(),
        current.version(),
        transformOf(current.calibration()),
        pixelsPerMeterOf(current.calibration()));
  }

  /**
   * Solves the transform for the current calibration.
   *
   * @return The transform, NOT_CALIBRATED, or DEGENERATE if the reference points coincide
   */
  public TransformResult<WorldToPixelTransform> currentTransform() {
    return transformOf(state.calibration());
  }

  /**
   * Maps a GPS fix to the plan.
   *
   * @param latitude Latitude in decimal degrees
   * @param longitude Longitude in decimal degrees
   * @return The pixel, NOT_CALIBRATED, or DEGENERATE
   */
  public TransformResult<PixelPoint> worldToPixel(double latitude, double longitude) {
    return currentTransform().map(transform -> transform.apply(latitude, longitude));
  }

  /**
   * Pixel-space direction of geographic north in radians, 0 being the pixel +x axis.
   *
   * <p>Returns 0.0 when uncalibrated or degenerate. Use {@link #isCalibrated()} or
   * {@link #northAngleResult()} to tell those apart from north along +x.
   */
  public double northAngle() {
    return northAngleResult().orElse(NORTH_ANGLE_DEFAULT);
  }

  public TransformResult<Double> northAngleResult() {
    return currentTransform().map(WorldToPixelTransform::northAngle);
  }

  /**
   * Plan pixels per real-world meter, measured between calibration points 1 and 2 only.
   *
   * @return The scale, NOT_CALIBRATED, or DEGENERATE when the two points coincide either
   *     geodesically or on the plan
   */
  public TransformResult<Double> pixelsPerMeter() {
    return pixelsPerMeterOf(state.calibration());
  }

  private TransformResult<WorldToPixelTransform> transformOf(Calibration calibration) {
    if (calibration == null) {
      return TransformResult.notCalibrated();
    }
    return TransformSolver.solve(calibration)
        .map(transform -> TransformResult.success(transform, transform.getType()))
        .orElseGet(
            () -> {
              logger.debug("No transform can be derived from calibration {}", calibration);
              return TransformResult.degenerate();
            });
  }

  private TransformResult<Double> pixelsPerMeterOf(Calibration calibration) {
    if (calibration == null) {
      return TransformResult.notCalibrated();
    }

    CalibrationPoint first = calibration.first();
    CalibrationPoint second = calibration.second();

    double distanceMeters = geodesicDistance.distanceMeters(first.world(), second.world());
    if (distanceMeters == 0) {
      logger.debug("Scale unavailable: calibration points 1 and 2 are geodesically coincident");
      return TransformResult.degenerate();
    }

    double distancePixels = first.pixel().distanceTo(second.pixel());
    if (distancePixels == 0) {
      logger.debug("Scale unavailable: calibration points 1 and 2 share a pixel");
      return TransformResult.degenerate();
    }

    return TransformResult.success(distancePixels / distanceMeters);
  }

  private void notifyListeners(CalibrationChangeEvent event) {
    for (CalibrationChangeListener listener : listeners) {
      try {
        listener.onCalibrationChanged(event);
      } catch (RuntimeException e) {
        logger.warn("Calibration listener {} failed for version {}", listener, event.version(), e);
      }
    }
  }
}
