package com.floorplan.positioning.service;

import com.floorplan.positioning.algorithm.WorldToPixelTransform;
import com.floorplan.positioning.dto.ActivePlan;
import com.floorplan.positioning.dto.Calibration;
import com.floorplan.positioning.dto.CalibrationPoint;
import com.floorplan.positioning.dto.CalibrationPointDto;
import com.floorplan.positioning.dto.CalibrationStatusResponse;
import com.floorplan.positioning.dto.MarkerOrientationResponse;
import com.floorplan.positioning.dto.OrientationRequest;
import com.floorplan.positioning.dto.PixelPoint;
import com.floorplan.positioning.dto.PlanPositionResponse;
import com.floorplan.positioning.dto.SavedPlan;
import com.floorplan.positioning.dto.SavedPlanSummary;
import com.floorplan.positioning.dto.ViewportRequest;
import com.floorplan.positioning.dto.ViewportResponse;
import com.floorplan.positioning.engine.CalibrationSnapshot;
import com.floorplan.positioning.engine.TransformEngine;
import com.floorplan.positioning.engine.TransformResult;
import com.floorplan.positioning.exception.CalibrationRequiredException;
import com.floorplan.positioning.exception.PlanNotLoadedException;
import com.floorplan.positioning.exception.PlanPersistenceException;
import com.floorplan.positioning.exception.SavedPlanNotFoundException;
import com.floorplan.positioning.repository.SavedPlanRepository;
import com.floorplan.positioning.service.HeadingResolver.MarkerOrientation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Implementation of the PlanSessionService interface.
 *
 * Plan switches and calibration changes are serialized on one lock so a calibration can never be
 * applied to a plan other than the one it was collected for. Each query reads one engine snapshot
 * so its response describes a single calibration version.
 */
@Slf4j
@Service
public class PlanSessionServiceImpl implements PlanSessionService {

    private static final String NOT_CALIBRATED_MESSAGE = "Plan is not calibrated";
    private static final String DEGENERATE_MESSAGE = "Calibration points are coincident; no transform can be derived";

    private final TransformEngine transformEngine;
    private final CalibrationPointValidator calibrationPointValidator;
    private final HeadingResolver headingResolver;
    private final ViewportCalculator viewportCalculator;
    private final SavedPlanRepository savedPlanRepository;
    private final TransformMetrics transformMetrics;
    private final Clock clock;

    private final Object sessionLock = new Object();
    private final AtomicReference<ActivePlan> activePlan = new AtomicReference<>();

    public PlanSessionServiceImpl(
            TransformEngine transformEngine,
            CalibrationPointValidator calibrationPointValidator,
            HeadingResolver headingResolver,
            ViewportCalculator viewportCalculator,
            SavedPlanRepository savedPlanRepository,
            TransformMetrics transformMetrics,
            Clock clock) {
        this.transformEngine = transformEngine;
        this.calibrationPointValidator = calibrationPointValidator;
        this.headingResolver = headingResolver;
        this.viewportCalculator = viewportCalculator;
        this.savedPlanRepository = savedPlanRepository;
        this.transformMetrics = transformMetrics;
        this.clock = clock;
    }

    @Override
    public ActivePlan loadPlan(String name, String filePath) {
        synchronized (sessionLock) {
            return switchTo(new ActivePlan(name, filePath, null));
        }
    }

    @Override
    public CalibrationStatusResponse calibrate(List<CalibrationPoint> points) {
        synchronized (sessionLock) {
            ActivePlan plan = requireActivePlan();
            Calibration calibration = calibrationPointValidator.validate(points);
            transformEngine.setCalibration(calibration);
            log.info("Calibrated plan '{}'", plan.name());
        }
        return currentStatus();
    }

    @Override
    public CalibrationStatusResponse clearCalibration() {
        synchronized (sessionLock) {
            transformEngine.clearCalibration();
        }
        return currentStatus();
    }

    @Override
    public CalibrationStatusResponse currentStatus() {
        ActivePlan plan = activePlan.get();
        CalibrationSnapshot snapshot = transformEngine.snapshot();
        TransformResult<WorldToPixelTransform> transform = snapshot.transform();

        return CalibrationStatusResponse.builder()
                .planName(plan != null ? plan.name() : null)
                .filePath(plan != null ? plan.filePath() : null)
                .savedPlanId(plan != null ? plan.savedPlanId() : null)
                .calibrated(snapshot.isCalibrated())
                .calibrationVersion(snapshot.version())
                .points(snapshot.getCalibration()
                        .map(c -> c.points().stream().map(CalibrationPointDto::from).toList())
                        .orElse(List.of()))
                .transformType(transform.isSuccess() ? transform.transformType().getDisplayName() : null)
                .pixelsPerMeter(snapshot.pixelsPerMeter().orElse(null))
                .northAngle(snapshot.northAngle())
                .build();
    }

    @Override
    public Optional<ActivePlan> activePlan() {
        return Optional.ofNullable(activePlan.get());
    }

    @Override
    public PlanPositionResponse locate(double latitude, double longitude) {
        CalibrationSnapshot snapshot = transformEngine.snapshot();
        long version = snapshot.version();
        TransformResult<PixelPoint> result = snapshot.worldToPixel(latitude, longitude);
        transformMetrics.recordTransform(result);

        Instant now = clock.instant();
        return switch (result.status()) {
            case SUCCESS -> new PlanPositionResponse(
                    result.status(),
                    "Position mapped",
                    result.value().x(),
                    result.value().y(),
                    result.transformType().getDisplayName(),
                    version,
                    now);
            case NOT_CALIBRATED -> new PlanPositionResponse(
                    result.status(), NOT_CALIBRATED_MESSAGE, null, null, null, version, now);
            case DEGENERATE -> new PlanPositionResponse(
                    result.status(), DEGENERATE_MESSAGE, null, null, null, version, now);
        };
    }

    @Override
    public MarkerOrientationResponse orientation(OrientationRequest request) {
        TransformResult<Double> northAngle = transformEngine.northAngleResult();
        MarkerOrientation orientation = headingResolver.resolve(request, northAngle.orElse(0.0));
        return new MarkerOrientationResponse(
                northAngle.status(),
                orientation.headingDegrees(),
                orientation.source(),
                northAngle.orElse(0.0),
                orientation.rotation());
    }

    @Override
    public ViewportResponse viewport(ViewportRequest request) {
        CalibrationSnapshot snapshot = transformEngine.snapshot();
        double scale = request.getCurrentScale();
        if (request.isZoom()) {
            TransformResult<Double> pixelsPerMeter = snapshot.pixelsPerMeter();
            scale = viewportCalculator.targetScale(
                    pixelsPerMeter.isSuccess() ? OptionalDouble.of(pixelsPerMeter.value()) : OptionalDouble.empty(),
                    request.getScreenWidth(),
                    request.getCurrentScale());
        }

        TransformResult<PixelPoint> position =
                snapshot.worldToPixel(request.getLatitude(), request.getLongitude());
        transformMetrics.recordTransform(position);
        if (!position.isSuccess()) {
            return new ViewportResponse(position.status(), scale, null, null);
        }

        PixelPoint translation = viewportCalculator.centerOn(
                position.value(), scale, request.getScreenWidth(), request.getScreenHeight());
        return new ViewportResponse(position.status(), scale, translation.x(), translation.y());
    }

    @Override
    public SavedPlanSummary saveActivePlan() {
        synchronized (sessionLock) {
            ActivePlan plan = requireActivePlan();
            Calibration calibration = transformEngine.getCalibration()
                    .orElseThrow(() -> new CalibrationRequiredException(
                            "Plan '" + plan.name() + "' must be calibrated before it can be saved"));

            String id = plan.savedPlanId() != null ? plan.savedPlanId() : UUID.randomUUID().toString();
            SavedPlan saved = savedPlanRepository.save(
                    SavedPlan.of(id, plan.name(), plan.filePath(), calibration, clock.instant()));
            activePlan.set(plan.withSavedPlanId(id));

            log.info("Saved plan '{}' as {}", plan.name(), id);
            return SavedPlanSummary.from(saved);
        }
    }

    @Override
    public CalibrationStatusResponse restorePlan(String id) {
        synchronized (sessionLock) {
            SavedPlan saved = savedPlanRepository.findById(id)
                    .orElseThrow(() -> new SavedPlanNotFoundException("Saved plan not found: " + id));

            Calibration calibration;
            try {
                calibration = saved.toCalibration();
            } catch (IllegalStateException | IllegalArgumentException e) {
                log.error("Saved plan {} holds an unusable calibration", id, e);
                throw new PlanPersistenceException("Saved plan " + id + " holds an unusable calibration", e);
            }

            switchTo(new ActivePlan(saved.getName(), saved.getFilePath(), saved.getId()));
            transformEngine.setCalibration(calibration);
            log.info("Restored plan '{}' from {}", saved.getName(), id);
        }
        return currentStatus();
    }

    @Override
    public List<SavedPlanSummary> listSavedPlans() {
        return savedPlanRepository.findAll().stream()
                .map(SavedPlanSummary::from)
                .toList();
    }

    @Override
    public void deleteSavedPlan(String id) {
        if (!savedPlanRepository.deleteById(id)) {
            throw new SavedPlanNotFoundException("Saved plan not found: " + id);
        }
        log.info("Deleted saved plan {}", id);
    }

    /**
     * Must be called under the session lock.
     */
    private ActivePlan switchTo(ActivePlan plan) {
        transformEngine.clearCalibration();
        activePlan.set(plan);
        log.info("Loaded plan '{}' from {}", plan.name(), plan.filePath());
        return plan;
    }

    private ActivePlan requireActivePlan() {
        ActivePlan plan = activePlan.get();
        if (plan == null) {
            throw new PlanNotLoadedException("No plan is loaded");
        }
        return plan;
    }
}
