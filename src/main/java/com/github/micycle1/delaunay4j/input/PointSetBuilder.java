package com.github.micycle1.delaunay4j.input;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.locationtech.jts.geom.Coordinate;

import com.github.micycle1.delaunay4j.model.Triangulation.Edge;

/**
 * Helper for building a {@link PointSet} from coordinates that may repeat.
 * <p>
 * Equal coordinates map to one vertex, numbered in order of first appearance.
 * Constraints are kept once per vertex pair regardless of direction, and
 * zero-length constraints (both ends on the same vertex) are dropped.
 */
public final class PointSetBuilder {

	private record Key(double x, double y) {
	}

	private record EdgeRef(int a, int b) {
		EdgeRef {
			if (a > b) {
				int t = a;
				a = b;
				b = t;
			}
		}
	}

	private final List<Coordinate> vertices = new ArrayList<>();
	private final Map<Key, Integer> index = new HashMap<>();
	private final Set<EdgeRef> constraints = new LinkedHashSet<>();

	/**
	 * Adds a vertex unless an equal one exists.
	 *
	 * @return index of the vertex at {@code c}
	 */
	public int addVertex(Coordinate c) {
		// + 0.0 so that -0.0 and 0.0 share a key
		Key key = new Key(c.x + 0.0, c.y + 0.0);
		return index.computeIfAbsent(key, k -> {
			vertices.add(new Coordinate(k.x(), k.y()));
			return vertices.size() - 1;
		});
	}

	/**
	 * Adds a required edge between two vertex indices.
	 *
	 * @return false if the constraint was dropped as zero-length or duplicate
	 */
	public boolean addConstraint(int a, int b) {
		if (a < 0 || b < 0 || a >= vertices.size() || b >= vertices.size()) {
			throw new IllegalArgumentException("Constraint " + a + "-" + b + " is outside vertex range [0, " + vertices.size() + ")");
		}
		if (a == b) {
			return false;
		}
		return constraints.add(new EdgeRef(a, b));
	}

	/**
	 * Adds both endpoints and the required edge between them.
	 */
	public boolean addSegment(Coordinate p, Coordinate q) {
		return addConstraint(addVertex(p), addVertex(q));
	}

	public int vertexCount() {
		return vertices.size();
	}

	public PointSet build() {
		List<Edge> edges = new ArrayList<>(constraints.size());
		for (EdgeRef e : constraints) {
			edges.add(new Edge(e.a(), e.b()));
		}
		return new PointSet(vertices, edges);
	}
}
