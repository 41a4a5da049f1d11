package com.github.micycle1.delaunay4j;

import java.util.List;
import java.util.Objects;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;

import com.github.micycle1.delaunay4j.core.DelaunayTriangulator;
import com.github.micycle1.delaunay4j.core.TriangulationConfig;
import com.github.micycle1.delaunay4j.input.Adapter;
import com.github.micycle1.delaunay4j.input.GeometryAdapter;
import com.github.micycle1.delaunay4j.input.PointSet;
import com.github.micycle1.delaunay4j.model.Triangulation;
import com.github.micycle1.delaunay4j.model.Triangulation.Edge;

/**
 * One-shot entry points for (constrained) Delaunay triangulation.
 * <p>
 * Adapters map external geometry formats into a {@link PointSet}; the
 * triangulator then consumes that intermediate representation. Use
 * {@link DelaunayTriangulator} directly to reuse an instance or to read flat
 * index arrays.
 */
public class Delaunay {

	private Delaunay() {
	}

	/**
	 * Triangulates interleaved coordinates {@code x0, y0, x1, y1, ...}.
	 */
	public static Triangulation triangulate(double[] xy) {
		return new DelaunayTriangulator().setVertices(xy).triangulate().result();
	}

	/**
	 * Triangulates interleaved coordinates, forcing the edges given as interleaved
	 * index pairs {@code u0, v0, u1, v1, ...}.
	 */
	public static Triangulation triangulate(double[] xy, int[] constraints) {
		return new DelaunayTriangulator().setVertices(xy).setConstraints(constraints).triangulate().result();
	}

	public static Triangulation triangulate(List<Coordinate> points) {
		return triangulate(points, List.of());
	}

	/**
	 * Triangulates {@code points}, forcing each constraint edge into the result.
	 *
	 * @param points      input vertices; indices below refer to this list
	 * @param constraints required edges, enforced in list order
	 * @return the constrained Delaunay triangulation
	 * @throws TriangulationException if the input is malformed or a constraint
	 *                                cannot be enforced
	 */
	public static Triangulation triangulate(List<Coordinate> points, List<Edge> constraints) {
		return triangulate(new PointSet(points, constraints), TriangulationConfig.DEFAULT);
	}

	/**
	 * Triangulates the coordinates of a JTS {@link Geometry}; its linework
	 * segments become constraints.
	 */
	public static Triangulation triangulate(Geometry geometry) {
		return triangulate(geometry, new GeometryAdapter());
	}

	/**
	 * Triangulates user-supplied input via an adapter.
	 *
	 * @param <T>     source input type
	 * @param input   source input object
	 * @param adapter input adapter that converts {@code input} into
	 *                {@link PointSet}
	 */
	public static <T> Triangulation triangulate(T input, Adapter<T> adapter) {
		Objects.requireNonNull(adapter, "adapter");
		return triangulate(adapter.toPointSet(input), TriangulationConfig.DEFAULT);
	}

	public static Triangulation triangulate(PointSet pointSet, TriangulationConfig config) {
		Objects.requireNonNull(pointSet, "pointSet");
		return new DelaunayTriangulator(config).setVertices(pointSet.vertices).setConstraints(pointSet.constraints).triangulate().result();
	}
}
