package com.github.micycle1.delaunay4j.input;

import java.util.List;

import org.locationtech.jts.geom.Coordinate;

import com.github.micycle1.delaunay4j.model.Triangulation.Edge;

/**
 * Intermediate input consumed by the triangulator: vertices plus required edges
 * between them.
 */
public class PointSet {

	public final List<Coordinate> vertices;
	public final List<Edge> constraints;

	public PointSet(List<Coordinate> vertices, List<Edge> constraints) {
		this.vertices = List.copyOf(vertices);
		this.constraints = List.copyOf(constraints);
	}

	public PointSet(List<Coordinate> vertices) {
		this(vertices, List.of());
	}

	public boolean isEmpty() {
		return vertices.isEmpty();
	}
}
