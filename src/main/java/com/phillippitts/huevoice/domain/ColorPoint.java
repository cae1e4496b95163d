package com.phillippitts.huevoice.domain;

/**
 * CIE xy chromaticity coordinate of a colour light.
 */
public record ColorPoint(double x, double y) {

    public ColorPoint {
        if (x < 0.0 || x > 1.0 || y < 0.0 || y > 1.0) {
            throw new IllegalArgumentException("Color point must lie in [0,1]x[0,1], got: (" + x + ", " + y + ")");
        }
    }
}
