package com.github.micycle1.delaunay4j.model;

import java.util.List;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.MultiLineString;
import org.locationtech.jts.geom.Polygon;

/**
 * Immutable result of a triangulation run.
 * <p>
 * All vertex indices refer to positions in the caller's input sequence.
 * Triangles are listed in clockwise winding; {@link #asTriangles()} reverses
 * them into counter-clockwise JTS shells.
 */
public final class Triangulation {

	/**
	 * An undirected edge between two vertex indices.
	 */
	public record Edge(int a, int b) {
		public Edge {
			if (a < 0 || b < 0) {
				throw new IllegalArgumentException("Edge indices must be non-negative");
			}
			if (a == b) {
				throw new IllegalArgumentException("Edge endpoints must be distinct");
			}
		}

		/**
		 * @return true if this edge joins the same two vertices as {@code other},
		 *         in either direction
		 */
		public boolean sameAs(Edge other) {
			return (a == other.a && b == other.b) || (a == other.b && b == other.a);
		}
	}

	/**
	 * A triangle by its three vertex indices.
	 */
	public record Triangle(int a, int b, int c) {
		public Triangle {
			if (a < 0 || b < 0 || c < 0) {
				throw new IllegalArgumentException("Triangle indices must be non-negative");
			}
			if (a == b || b == c || a == c) {
				throw new IllegalArgumentException("Triangle vertices must be distinct");
			}
		}
	}

	private final List<Coordinate> coordinates;
	private final List<Edge> edges;
	private final List<Triangle> triangles;

	public Triangulation(List<Coordinate> coordinates, List<Edge> edges, List<Triangle> triangles) {
		this.coordinates = List.copyOf(coordinates);
		this.edges = List.copyOf(edges);
		this.triangles = List.copyOf(triangles);
	}

	/**
	 * Input vertices, in input order.
	 */
	public List<Coordinate> coordinates() {
		return coordinates;
	}

	public List<Edge> edges() {
		return edges;
	}

	public List<Triangle> triangles() {
		return triangles;
	}

	public Coordinate coordinate(int index) {
		return coordinates.get(index);
	}

	public MultiLineString asEdges() {
		return asEdges(new GeometryFactory());
	}

	/**
	 * Returns the triangulation edges as a JTS {@link MultiLineString}, one
	 * two-point line per edge.
	 *
	 * @param geometryFactory geometry factory used to build the output geometry
	 */
	public MultiLineString asEdges(GeometryFactory geometryFactory) {
		LineString[] lines = new LineString[edges.size()];
		for (int i = 0; i < edges.size(); i++) {
			Edge e = edges.get(i);
			lines[i] = geometryFactory.createLineString(new Coordinate[] { coordinate(e.a()).copy(), coordinate(e.b()).copy() });
		}
		return geometryFactory.createMultiLineString(lines);
	}

	public GeometryCollection asTriangles() {
		return asTriangles(new GeometryFactory());
	}

	/**
	 * Returns the triangles as a collection of counter-clockwise JTS polygons.
	 *
	 * @param geometryFactory geometry factory used to build the output geometry
	 */
	public GeometryCollection asTriangles(GeometryFactory geometryFactory) {
		Polygon[] polygons = new Polygon[triangles.size()];
		for (int i = 0; i < triangles.size(); i++) {
			Triangle t = triangles.get(i);
			Coordinate first = coordinate(t.a());
			polygons[i] = geometryFactory.createPolygon(new Coordinate[] { first.copy(), coordinate(t.c()).copy(), coordinate(t.b()).copy(), first.copy() });
		}
		return geometryFactory.createGeometryCollection(polygons);
	}

	@Override
	public String toString() {
		return "Triangulation[vertices=" + coordinates.size() + ", edges=" + edges.size() + ", triangles=" + triangles.size() + "]";
	}
}
