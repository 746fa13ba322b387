package com.floorplan.positioning.engine;

import com.floorplan.positioning.algorithm.TransformType;
import com.floorplan.positioning.algorithm.util.HaversineDistanceCalculator;
import com.floorplan.positioning.dto.Calibration;
import com.floorplan.positioning.dto.CalibrationPoint;
import com.floorplan.positioning.dto.PixelPoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Transform Engine Tests")
class TransformEngineTest {

    private static final double DELTA = 0.001;

    private static final Calibration DIAGONAL = new Calibration(
        CalibrationPoint.of(0.0, 0.0, 0.0, 0.0),
        CalibrationPoint.of(1.0, 1.0, 100.0, 100.0),
        CalibrationPoint.of(0.0, 1.0, 0.0, 100.0));

    private TransformEngine engine;

    @BeforeEach
    void setUp() {
        engine = new TransformEngine(new HaversineDistanceCalculator());
    }

    @Nested
    @DisplayName("Uncalibrated Tests")
    class UncalibratedTests {

        @Test
        @DisplayName("should report NOT_CALIBRATED for every query")
        void shouldReportNotCalibrated() {
            assertFalse(engine.isCalibrated());
            assertEquals(TransformStatus.NOT_CALIBRATED, engine.worldToPixel(0.5, 0.5).status());
            assertEquals(TransformStatus.NOT_CALIBRATED, engine.pixelsPerMeter().status());
            assertEquals(TransformStatus.NOT_CALIBRATED, engine.northAngleResult().status());
            assertTrue(engine.getCalibration().isEmpty());
        }

        @Test
        @DisplayName("should default the north angle to zero")
        void shouldDefaultNorthAngle() {
            assertEquals(0.0, engine.northAngle());
        }

        @Test
        @DisplayName("should start at version zero")
        void shouldStartAtVersionZero() {
            assertEquals(0L, engine.getVersion());
        }
    }

    @Nested
    @DisplayName("World To Pixel Tests")
    class WorldToPixelTests {

        @Test
        @DisplayName("should map the diagonal midpoint to (50, 50)")
        void shouldMapMidpoint() {
            engine.setCalibration(DIAGONAL);

            TransformResult<PixelPoint> result = engine.worldToPixel(0.5, 0.5);

            assertTrue(result.isSuccess());
            assertEquals(TransformType.AFFINE, result.transformType());
            assertEquals(50.0, result.value().x(), DELTA);
            assertEquals(50.0, result.value().y(), DELTA);
        }

        @Test
        @DisplayName("should follow a plan rotated by 90 degrees")
        void shouldFollowQuarterTurn() {
            engine.setCalibration(
                CalibrationPoint.of(0.0, 0.0, 0.0, 0.0),
                CalibrationPoint.of(1.0, 0.0, 100.0, 0.0),
                CalibrationPoint.of(0.0, 1.0, 0.0, -100.0));

            PixelPoint pixel = engine.worldToPixel(0.0, 1.0).value();

            assertEquals(0.0, pixel.x(), DELTA);
            assertEquals(-100.0, pixel.y(), DELTA);
        }

        @Test
        @DisplayName("should use the similarity fallback for collinear points")
        void shouldFallBackForCollinearPoints() {
            engine.setCalibration(
                CalibrationPoint.of(0.0, 0.0, 0.0, 0.0),
                CalibrationPoint.of(0.0, 1.0, 100.0, 0.0),
                CalibrationPoint.of(0.0, 2.0, 200.0, 0.0));

            TransformResult<PixelPoint> result = engine.worldToPixel(0.0, 2.0);

            assertEquals(TransformType.SIMILARITY, result.transformType());
            assertEquals(200.0, result.value().x(), DELTA);
        }

        @Test
        @DisplayName("should report DEGENERATE when all points coincide")
        void shouldReportDegenerate() {
            engine.setCalibration(
                CalibrationPoint.of(5.0, 5.0, 0.0, 0.0),
                CalibrationPoint.of(5.0, 5.0, 10.0, 0.0),
                CalibrationPoint.of(5.0, 5.0, 0.0, 10.0));

            TransformResult<PixelPoint> result = engine.worldToPixel(5.0, 5.0);

            assertEquals(TransformStatus.DEGENERATE, result.status());
            assertNull(result.value());
            assertEquals(0.0, engine.northAngle());
            assertEquals(TransformStatus.DEGENERATE, engine.northAngleResult().status());
        }

        @Test
        @DisplayName("should answer from the latest calibration")
        void shouldUseLatestCalibration() {
            engine.setCalibration(DIAGONAL);
            engine.setCalibration(
                CalibrationPoint.of(0.0, 0.0, 0.0, 0.0),
                CalibrationPoint.of(1.0, 1.0, 200.0, 200.0),
                CalibrationPoint.of(0.0, 1.0, 0.0, 200.0));

            assertEquals(100.0, engine.worldToPixel(0.5, 0.5).value().x(), DELTA);
        }
    }

    @Nested
    @DisplayName("Scale Tests")
    class ScaleTests {

        @Test
        @DisplayName("should divide pixel distance by geodesic distance of points 1 and 2")
        void shouldDeriveScaleFromFirstTwoPoints() {
            TransformEngine fixedDistance = new TransformEngine((from, to) -> 50.0);
            fixedDistance.setCalibration(
                CalibrationPoint.of(0.0, 0.0, 0.0, 0.0),
                CalibrationPoint.of(0.001, 0.0, 300.0, 400.0),
                CalibrationPoint.of(0.0, 0.001, 9999.0, 9999.0));

            TransformResult<Double> scale = fixedDistance.pixelsPerMeter();

            assertTrue(scale.isSuccess());
            assertEquals(10.0, scale.value(), DELTA);
        }

        @Test
        @DisplayName("should use haversine meters by default")
        void shouldUseHaversineMeters() {
            double meters = HaversineDistanceCalculator.EARTH_RADIUS_METERS * Math.toRadians(0.001);
            engine.setCalibration(
                CalibrationPoint.of(0.0, 0.0, 0.0, 0.0),
                CalibrationPoint.of(0.001, 0.0, meters * 4, 0.0),
                CalibrationPoint.of(0.0, 0.001, 0.0, 1.0));

            assertEquals(4.0, engine.pixelsPerMeter().value(), 1e-6);
        }

        @Test
        @DisplayName("should report DEGENERATE when points 1 and 2 share a GPS position")
        void shouldRejectCoincidentGps() {
            engine.setCalibration(
                CalibrationPoint.of(1.0, 1.0, 0.0, 0.0),
                CalibrationPoint.of(1.0, 1.0, 100.0, 0.0),
                CalibrationPoint.of(2.0, 2.0, 0.0, 100.0));

            assertEquals(TransformStatus.DEGENERATE, engine.pixelsPerMeter().status());
        }

        @Test
        @DisplayName("should report DEGENERATE when points 1 and 2 share a pixel")
        void shouldRejectCoincidentPixels() {
            engine.setCalibration(
                CalibrationPoint.of(1.0, 1.0, 40.0, 40.0),
                CalibrationPoint.of(1.001, 1.0, 40.0, 40.0),
                CalibrationPoint.of(1.0, 1.001, 0.0, 100.0));

            assertEquals(TransformStatus.DEGENERATE, engine.pixelsPerMeter().status());
        }
    }

    @Nested
    @DisplayName("Calibration State Tests")
    class StateTests {

        @Test
        @DisplayName("should return the stored points")
        void shouldReturnStoredPoints() {
            engine.setCalibration(DIAGONAL);

            assertTrue(engine.isCalibrated());
            assertEquals(DIAGONAL, engine.getCalibration().orElseThrow());
        }

        @Test
        @DisplayName("should bump the version on every effective change")
        void shouldBumpVersion() {
            engine.setCalibration(DIAGONAL);
            engine.setCalibration(DIAGONAL);
            engine.clearCalibration();

            assertEquals(3L, engine.getVersion());
        }

        @Test
        @DisplayName("should treat a second clear as a no-op")
        void shouldClearIdempotently() {
            List<CalibrationChangeEvent> events = new ArrayList<>();
            engine.addListener(events::add);
            engine.setCalibration(DIAGONAL);

            engine.clearCalibration();
            engine.clearCalibration();

            assertFalse(engine.isCalibrated());
            assertEquals(2L, engine.getVersion());
            assertEquals(2, events.size());
            assertEquals(TransformStatus.NOT_CALIBRATED, engine.worldToPixel(0.5, 0.5).status());
        }

        @Test
        @DisplayName("should keep a snapshot on its own version after recalibration")
        void shouldKeepSnapshotStable() {
            Calibration doubled = new Calibration(
                CalibrationPoint.of(0.0, 0.0, 0.0, 0.0),
                CalibrationPoint.of(1.0, 1.0, 200.0, 200.0),
                CalibrationPoint.of(0.0, 1.0, 0.0, 200.0));
            engine.setCalibration(DIAGONAL);

            CalibrationSnapshot snapshot = engine.snapshot();
            engine.setCalibration(doubled);

            assertEquals(1L, snapshot.version());
            assertEquals(DIAGONAL, snapshot.getCalibration().orElseThrow());
            assertEquals(50.0, snapshot.worldToPixel(0.5, 0.5).value().x(), DELTA);
            assertEquals(100.0, engine.worldToPixel(0.5, 0.5).value().x(), DELTA);
            assertEquals(
                engine.pixelsPerMeter().value() / 2, snapshot.pixelsPerMeter().value(), 1e-12);
        }

        @Test
        @DisplayName("should report an uncalibrated snapshot")
        void shouldSnapshotUncalibrated() {
            CalibrationSnapshot snapshot = engine.snapshot();

            assertFalse(snapshot.isCalibrated());
            assertEquals(0L, snapshot.version());
            assertEquals(TransformStatus.NOT_CALIBRATED, snapshot.transform().status());
            assertEquals(TransformStatus.NOT_CALIBRATED, snapshot.pixelsPerMeter().status());
            assertEquals(0.0, snapshot.northAngle());
        }
    }

    @Nested
    @DisplayName("Listener Tests")
    class ListenerTests {

        @Test
        @DisplayName("should notify listeners with type, version and calibration")
        void shouldNotifyListeners() {
            List<CalibrationChangeEvent> events = new ArrayList<>();
            engine.addListener(events::add);

            engine.setCalibration(DIAGONAL);
            engine.clearCalibration();

            assertEquals(2, events.size());
            assertEquals(CalibrationChangeEvent.ChangeType.SET, events.get(0).type());
            assertEquals(1L, events.get(0).version());
            assertEquals(DIAGONAL, events.get(0).getCalibration().orElseThrow());
            assertEquals(CalibrationChangeEvent.ChangeType.CLEARED, events.get(1).type());
            assertEquals(2L, events.get(1).version());
            assertTrue(events.get(1).getCalibration().isEmpty());
        }

        @Test
        @DisplayName("should see the new state from inside the listener")
        void shouldExposeNewStateToListener() {
            List<Boolean> observed = new ArrayList<>();
            engine.addListener(event -> observed.add(engine.worldToPixel(0.5, 0.5).isSuccess()));

            engine.setCalibration(DIAGONAL);

            assertEquals(List.of(true), observed);
        }

        @Test
        @DisplayName("should keep notifying after a listener fails")
        void shouldSurviveFailingListener() {
            List<CalibrationChangeEvent> events = new ArrayList<>();
            engine.addListener(event -> {
                throw new IllegalStateException("listener failure");
            });
            engine.addListener(events::add);

            engine.setCalibration(DIAGONAL);

            assertTrue(engine.isCalibrated());
            assertEquals(1, events.size());
        }

        @Test
        @DisplayName("should stop notifying a removed listener")
        void shouldRemoveListener() {
            List<CalibrationChangeEvent> events = new ArrayList<>();
            CalibrationChangeListener listener = events::add;
            engine.addListener(listener);
            engine.removeListener(listener);

            engine.setCalibration(DIAGONAL);

            assertTrue(events.isEmpty());
        }
    }

    @Nested
    @DisplayName("Concurrency Tests")
    class ConcurrencyTests {

        @Test
        @DisplayName("should never expose a mix of two calibrations to concurrent readers")
        void shouldNeverTearCalibration() throws Exception {
            Calibration doubled = new Calibration(
                CalibrationPoint.of(0.0, 0.0, 0.0, 0.0),
                CalibrationPoint.of(1.0, 1.0, 200.0, 200.0),
                CalibrationPoint.of(0.0, 1.0, 0.0, 200.0));
            engine.setCalibration(DIAGONAL);

            ExecutorService executor = Executors.newFixedThreadPool(2);
            CountDownLatch start = new CountDownLatch(1);
            try {
                Future<?> writer = executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 2_000; i++) {
                        engine.setCalibration(i % 2 == 0 ? doubled : DIAGONAL);
                    }
                    return null;
                });
                Future<List<Double>> reader = executor.submit(() -> {
                    start.await();
                    List<Double> seen = new ArrayList<>();
                    for (int i = 0; i < 2_000; i++) {
                        seen.add(engine.worldToPixel(0.5, 0.5).value().x());
                    }
                    return seen;
                });
                start.countDown();
                writer.get(10, TimeUnit.SECONDS);

                for (double x : reader.get(10, TimeUnit.SECONDS)) {
                    assertTrue(Math.abs(x - 50.0) < DELTA || Math.abs(x - 100.0) < DELTA,
                        "Unexpected mapped x " + x);
                }
                assertEquals(2_001L, engine.getVersion());
            } finally {
                executor.shutdownNow();
            }
        }
    }
}
