package com.seqdecision.server.ai.model;

import com.seqdecision.util.MathUtil;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;

/**
 * Ordered belief values spanning [0, 1] with both endpoints included.
 */
public class BeliefGrid {

    private final double[] points;

    private BeliefGrid(double[] points) {
        this.points = points;
    }

    public static BeliefGrid uniform(int m) {
        if (m < 2) {
            throw new IllegalArgumentException("Grid resolution must be at least 2, got " + m);
        }
        return new BeliefGrid(MathUtil.linspace(0.0, 1.0, m));
    }

    public int size() {
        return points.length;
    }

    public double get(int i) {
        return points[i];
    }

    public double first() {
        return points[0];
    }

    public double last() {
        return points[points.length - 1];
    }

    public double[] getPoints() {
        return points.clone();
    }

    /**
     * Piecewise-linear interpolant of one value per grid point. Defined on
     * [0, 1] exactly; posteriors are clipped so nothing outside is requested.
     */
    public UnivariateFunction interpolant(double[] values) {
        if (values.length != points.length) {
            throw new IllegalArgumentException("Expected " + points.length + " values, got " + values.length);
        }
        return new LinearInterpolator().interpolate(points, values);
    }

    public double interpolate(double[] values, double p) {
        return interpolant(values).value(p);
    }
}
