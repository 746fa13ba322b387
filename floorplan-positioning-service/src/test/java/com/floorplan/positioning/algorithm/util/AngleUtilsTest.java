package com.floorplan.positioning.algorithm.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Angle Utils Tests")
class AngleUtilsTest {

    private static final double DELTA = 1e-9;

    @Test
    @DisplayName("should leave differences within [-pi, pi] unchanged")
    void shouldKeepSmallDifferences() {
        assertEquals(0.5, AngleUtils.normalizeDifference(0.5), DELTA);
        assertEquals(-2.0, AngleUtils.normalizeDifference(-2.0), DELTA);
    }

    @Test
    @DisplayName("should wrap differences beyond half a turn")
    void shouldWrapLargeDifferences() {
        assertEquals(-Math.PI / 2, AngleUtils.normalizeDifference(3 * Math.PI / 2), DELTA);
        assertEquals(Math.PI / 2, AngleUtils.normalizeDifference(-3 * Math.PI / 2), DELTA);
        assertEquals(0.25, AngleUtils.normalizeDifference(4 * Math.PI + 0.25), DELTA);
    }

    @Test
    @DisplayName("should turn the short way across the wrap-around")
    void shouldFollowShortestArc() {
        double current = Math.toRadians(350);
        double target = Math.toRadians(10);

        double next = AngleUtils.shortestArcTarget(current, target);

        assertEquals(Math.toRadians(370), next, DELTA);
    }
}
