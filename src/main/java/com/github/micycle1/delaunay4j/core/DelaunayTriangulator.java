package com.github.micycle1.delaunay4j.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.delaunay4j.TriangulationException;
import com.github.micycle1.delaunay4j.TriangulationException.Reason;
import com.github.micycle1.delaunay4j.geom.Geom;
import com.github.micycle1.delaunay4j.graph.ConnectivityGraph;
import com.github.micycle1.delaunay4j.model.Triangulation;
import com.github.micycle1.delaunay4j.model.Triangulation.Edge;
import com.github.micycle1.delaunay4j.model.Triangulation.Triangle;

/**
 * Stateful divide-and-conquer Delaunay triangulator with constraint
 * enforcement.
 * <p>
 * Typical use:
 *
 * <pre>{@code
 * DelaunayTriangulator dt = new DelaunayTriangulator();
 * dt.setVertices(xy).setConstraints(pairs).triangulate();
 * List<Triangle> triangles = dt.triangles();
 * }</pre>
 *
 * Vertex and constraint indices passed in and returned refer to positions in
 * the caller's vertex sequence. Each {@link #setVertices} call discards the
 * previous constraints and triangulation. Fewer than three vertices triangulate
 * to an empty graph. Instances are not thread-safe.
 */
public class DelaunayTriangulator {

	private static final Logger LOGGER = LoggerFactory.getLogger(DelaunayTriangulator.class);

	private final TriangulationConfig config;

	private Coordinate[] points;
	private IndexSort sort;
	private int[] constraints = new int[0];
	private ConnectivityGraph graph;

	public DelaunayTriangulator() {
		this(TriangulationConfig.DEFAULT);
	}

	public DelaunayTriangulator(TriangulationConfig config) {
		this.config = Objects.requireNonNull(config, "config");
	}

	/**
	 * Supplies vertices as interleaved coordinates {@code x0, y0, x1, y1, ...}.
	 *
	 * @throws TriangulationException if the array has odd length, holds a
	 *                                non-finite value or two equal points
	 */
	public DelaunayTriangulator setVertices(double[] xy) {
		Objects.requireNonNull(xy, "xy");
		if (xy.length % 2 != 0) {
			throw new TriangulationException(Reason.MALFORMED_INPUT, "Coordinate array has odd length " + xy.length);
		}
		Coordinate[] coordinates = new Coordinate[xy.length / 2];
		for (int i = 0; i < coordinates.length; i++) {
			coordinates[i] = new Coordinate(xy[2 * i], xy[2 * i + 1]);
		}
		return setVertices(coordinates);
	}

	public DelaunayTriangulator setVertices(List<Coordinate> coordinates) {
		Objects.requireNonNull(coordinates, "coordinates");
		return setVertices(coordinates.toArray(new Coordinate[0]));
	}

	/**
	 * Supplies vertices and sorts them. Only x and y are used.
	 *
	 * @throws TriangulationException if a coordinate is null, non-finite, or
	 *                                equal to another
	 */
	public DelaunayTriangulator setVertices(Coordinate[] coordinates) {
		Objects.requireNonNull(coordinates, "coordinates");
		IndexSort sorted = IndexSort.of(coordinates);
		this.points = new Coordinate[coordinates.length];
		for (int i = 0; i < coordinates.length; i++) {
			points[i] = new Coordinate(coordinates[i].x, coordinates[i].y);
		}
		this.sort = sorted;
		this.constraints = new int[0];
		this.graph = null;
		return this;
	}

	/**
	 * Supplies required edges as interleaved vertex index pairs
	 * {@code u0, v0, u1, v1, ...}, replacing earlier constraints. Any existing
	 * triangulation is discarded; call {@link #triangulate()} again.
	 *
	 * @throws IllegalStateException  if no vertices were supplied
	 * @throws TriangulationException if the array has odd length, an index is out
	 *                                of range or a pair joins a vertex to itself
	 */
	public DelaunayTriangulator setConstraints(int[] pairs) {
		Objects.requireNonNull(pairs, "pairs");
		requireVertices();
		if (pairs.length % 2 != 0) {
			throw new TriangulationException(Reason.MALFORMED_INPUT, "Constraint array has odd length " + pairs.length);
		}
		for (int i = 0; i < pairs.length; i += 2) {
			checkConstraint(pairs[i], pairs[i + 1]);
		}
		this.constraints = pairs.clone();
		this.graph = null;
		return this;
	}

	public DelaunayTriangulator setConstraints(List<Edge> edges) {
		Objects.requireNonNull(edges, "edges");
		int[] pairs = new int[edges.size() * 2];
		for (int i = 0; i < edges.size(); i++) {
			Edge e = Objects.requireNonNull(edges.get(i), "edge");
			pairs[2 * i] = e.a();
			pairs[2 * i + 1] = e.b();
		}
		return setConstraints(pairs);
	}

	/**
	 * Triangulates the supplied vertices and enforces the constraints in the order
	 * given.
	 *
	 * @throws IllegalStateException  if no vertices were supplied, or if this
	 *                                vertex set was already triangulated
	 * @throws TriangulationException if a constraint cannot be enforced
	 */
	public DelaunayTriangulator triangulate() {
		requireVertices();
		if (graph != null) {
			throw new IllegalStateException("Vertices already triangulated; supply vertices again to rerun");
		}
		int n = sort.size();
		ConnectivityGraph g = new ConnectivityGraph(n);
		if (n < 3) {
			if (constraints.length > 0) {
				LOGGER.warn("Ignoring {} constraints: {} vertices cannot be triangulated", constraints.length / 2, n);
			}
			this.graph = g;
			return this;
		}

		Coordinate[] vertices = sort.sortedVertices();
		int[] bounds = StripTriangulator.triangulate(vertices, g);
		LOGGER.debug("Triangulating {} vertices from {} initial fragments", n, bounds.length - 1);
		new FragmentMerger(vertices, g, config).mergeAll(bounds);

		if (constraints.length > 0) {
			ConstraintEnforcer enforcer = new ConstraintEnforcer(sort, g);
			int changed = 0;
			for (int i = 0; i < constraints.length; i += 2) {
				if (enforcer.enforce(sort.toSorted(constraints[i]), sort.toSorted(constraints[i + 1]))) {
					changed++;
				}
			}
			LOGGER.debug("Enforced {} constraints, {} of them missing from the triangulation", constraints.length / 2, changed);
		}
		this.graph = g;
		return this;
	}

	/**
	 * @return true once {@link #triangulate()} has completed for the current
	 *         vertices
	 */
	public boolean isTriangulated() {
		return graph != null;
	}

	/**
	 * Each undirected edge once, as a pair of input indices.
	 */
	public List<Edge> edges() {
		requireTriangulated();
		List<Edge> out = new ArrayList<>(graph.edgeCount());
		for (int s = 0; s < graph.vertexCount(); s++) {
			int[] neighbors = graph.listConnections(s);
			Arrays.sort(neighbors);
			for (int j : neighbors) {
				if (j > s) {
					out.add(new Edge(sort.toOriginal(s), sort.toOriginal(j)));
				}
			}
		}
		return out;
	}

	/**
	 * @return {@link #edges()} flattened to {@code a0, b0, a1, b1, ...}
	 */
	public int[] edgeArray() {
		List<Edge> edges = edges();
		int[] out = new int[edges.size() * 2];
		for (int i = 0; i < edges.size(); i++) {
			out[2 * i] = edges.get(i).a();
			out[2 * i + 1] = edges.get(i).b();
		}
		return out;
	}

	/**
	 * Each triangle once, as input indices in clockwise order.
	 * <p>
	 * A triangle is reported from its lowest sorted vertex {@code s}: the
	 * neighbours of {@code s} above it in sorted order are swept by polar angle,
	 * and every consecutive connected pair closes a triangle.
	 */
	public List<Triangle> triangles() {
		requireTriangulated();
		Coordinate[] vertices = sort.sortedVertices();
		List<Triangle> out = new ArrayList<>();
		for (int s = 0; s < graph.vertexCount() - 1; s++) {
			Coordinate origin = vertices[s];
			final int base = s;
			Integer[] upper = Arrays.stream(graph.listConnections(s)).filter(j -> j > base).boxed().toArray(Integer[]::new);
			Arrays.sort(upper, Comparator.comparingDouble((Integer j) -> Geom.polarAngle(origin, vertices[j])));
			for (int k = 0; k + 1 < upper.length; k++) {
				int v1 = upper[k];
				int v2 = upper[k + 1];
				if (graph.isConnected(v1, v2)) {
					out.add(new Triangle(sort.toOriginal(s), sort.toOriginal(v2), sort.toOriginal(v1)));
				}
			}
		}
		return out;
	}

	/**
	 * @return {@link #triangles()} flattened to {@code a0, b0, c0, a1, ...}
	 */
	public int[] triangleArray() {
		List<Triangle> triangles = triangles();
		int[] out = new int[triangles.size() * 3];
		for (int i = 0; i < triangles.size(); i++) {
			Triangle t = triangles.get(i);
			out[3 * i] = t.a();
			out[3 * i + 1] = t.b();
			out[3 * i + 2] = t.c();
		}
		return out;
	}

	/**
	 * Snapshot of the current triangulation with its input coordinates.
	 */
	public Triangulation result() {
		requireTriangulated();
		return new Triangulation(Arrays.asList(points), edges(), triangles());
	}

	public TriangulationConfig config() {
		return config;
	}

	private void checkConstraint(int u, int v) {
		int n = points.length;
		if (u < 0 || u >= n || v < 0 || v >= n) {
			throw new TriangulationException(Reason.INDEX_OUT_OF_RANGE, "Constraint " + u + "-" + v + " is outside vertex range [0, " + n + ")");
		}
		if (u == v) {
			throw new TriangulationException(Reason.MALFORMED_CONSTRAINT, "Constraint " + u + "-" + v + " joins a vertex to itself");
		}
	}

	private void requireVertices() {
		if (sort == null) {
			throw new IllegalStateException("No vertices supplied");
		}
	}

	private void requireTriangulated() {
		if (graph == null) {
			throw new IllegalStateException("Not triangulated; call triangulate() first");
		}
	}
}
