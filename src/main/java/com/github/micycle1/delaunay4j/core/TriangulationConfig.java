package com.github.micycle1.delaunay4j.core;

import com.github.micycle1.delaunay4j.geom.Geom;

/**
 * Tunable parameters of a triangulation run.
 *
 * @param angleTolerance merge candidates whose angle to the base edge exceeds
 *                       {@code PI - angleTolerance} are ignored (radians)
 */
public record TriangulationConfig(double angleTolerance) {

	public static final TriangulationConfig DEFAULT = new TriangulationConfig(Geom.ANGLE_EPS);

	public TriangulationConfig {
		if (!Double.isFinite(angleTolerance) || angleTolerance < 0 || angleTolerance >= Math.PI / 2) {
			throw new IllegalArgumentException("angleTolerance must be finite and in [0, PI/2): " + angleTolerance);
		}
	}

	public TriangulationConfig withAngleTolerance(double angleTolerance) {
		return new TriangulationConfig(angleTolerance);
	}
}
