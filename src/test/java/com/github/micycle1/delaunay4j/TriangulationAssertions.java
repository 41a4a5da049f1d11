package com.github.micycle1.delaunay4j;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.algorithm.RobustLineIntersector;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.strtree.STRtree;

import com.github.micycle1.delaunay4j.geom.Geom;
import com.github.micycle1.delaunay4j.model.Triangulation.Edge;
import com.github.micycle1.delaunay4j.model.Triangulation.Triangle;

/**
 * Structural checks shared by the triangulation tests.
 */
public final class TriangulationAssertions {

	public record EdgeKey(int a, int b) {
		public EdgeKey {
			if (a > b) {
				int t = a;
				a = b;
				b = t;
			}
		}

		public static EdgeKey of(Edge e) {
			return new EdgeKey(e.a(), e.b());
		}
	}

	private TriangulationAssertions() {
	}

	public static Set<EdgeKey> edgeKeys(List<Edge> edges) {
		Set<EdgeKey> keys = new HashSet<>();
		for (Edge e : edges) {
			assertTrue(keys.add(EdgeKey.of(e)), "Edge reported twice: " + e);
		}
		return keys;
	}

	/**
	 * Runs every structural check that holds for any (constrained) triangulation
	 * of {@code points}.
	 */
	public static void assertValidTriangulation(List<Coordinate> points, List<Edge> edges, List<Triangle> triangles) {
		int n = points.size();
		Set<EdgeKey> keys = edgeKeys(edges);
		for (Edge e : edges) {
			assertTrue(e.a() < n && e.b() < n, "Edge index out of range: " + e);
		}
		assertPlanar(points, edges);
		assertClockwise(points, triangles);
		for (Triangle t : triangles) {
			assertTrue(keys.contains(new EdgeKey(t.a(), t.b())) && keys.contains(new EdgeKey(t.b(), t.c())) && keys.contains(new EdgeKey(t.a(), t.c())),
					"Triangle " + t + " uses a missing edge");
		}
		if (n >= 3 && !allCollinear(points)) {
			int b = hullSize(points);
			assertEquals(2 * n - 2 - b, triangles.size(), "Triangle count");
			assertEquals(3 * n - 3 - b, edges.size(), "Edge count");
		} else {
			assertTrue(triangles.isEmpty(), "Degenerate input produced triangles");
		}
	}

	/**
	 * No point strictly inside the circumcircle of any triangle, up to a
	 * tolerance on the in-circle determinant.
	 */
	public static void assertDelaunay(List<Coordinate> points, List<Triangle> triangles, double tolerance) {
		for (Triangle t : triangles) {
			// triangles are clockwise; swap b and c for the counter-clockwise predicate
			Coordinate a = points.get(t.a());
			Coordinate b = points.get(t.c());
			Coordinate c = points.get(t.b());
			for (int p = 0; p < points.size(); p++) {
				if (p == t.a() || p == t.b() || p == t.c()) {
					continue;
				}
				double det = Geom.inCircle(a, b, c, points.get(p));
				assertTrue(det <= tolerance, "Point " + p + " lies inside the circumcircle of " + t + " (" + det + ")");
			}
		}
	}

	public static void assertClockwise(List<Coordinate> points, List<Triangle> triangles) {
		for (Triangle t : triangles) {
			assertEquals(Orientation.CLOCKWISE, Orientation.index(points.get(t.a()), points.get(t.b()), points.get(t.c())), "Winding of " + t);
		}
	}

	/**
	 * No two edges meet anywhere but at a shared endpoint.
	 */
	public static void assertPlanar(List<Coordinate> points, List<Edge> edges) {
		STRtree tree = new STRtree();
		for (int i = 0; i < edges.size(); i++) {
			tree.insert(envelope(points, edges.get(i)), Integer.valueOf(i));
		}
		tree.build();

		RobustLineIntersector intersector = new RobustLineIntersector();
		for (int i = 0; i < edges.size(); i++) {
			Edge e1 = edges.get(i);
			@SuppressWarnings("unchecked")
			List<Integer> candidates = tree.query(envelope(points, e1));
			for (Integer candidate : candidates) {
				int j = candidate.intValue();
				if (j <= i) {
					continue;
				}
				Edge e2 = edges.get(j);
				intersector.computeIntersection(points.get(e1.a()), points.get(e1.b()), points.get(e2.a()), points.get(e2.b()));
				boolean shared = e1.a() == e2.a() || e1.a() == e2.b() || e1.b() == e2.a() || e1.b() == e2.b();
				if (shared) {
					assertFalse(intersector.getIntersectionNum() == RobustLineIntersector.COLLINEAR_INTERSECTION, "Edges overlap: " + e1 + " and " + e2);
				} else {
					assertFalse(intersector.hasIntersection(), "Edges intersect: " + e1 + " and " + e2);
				}
			}
		}
	}

	/**
	 * Number of input points on the convex hull boundary, collinear boundary
	 * points included.
	 */
	public static int hullSize(List<Coordinate> points) {
		List<Coordinate> sorted = new ArrayList<>(points);
		sorted.sort(Comparator.comparingDouble((Coordinate c) -> c.x).thenComparingDouble(c -> c.y));
		Set<Coordinate> hull = new HashSet<>(halfHull(sorted));
		List<Coordinate> reversed = new ArrayList<>(sorted);
		Collections.reverse(reversed);
		hull.addAll(halfHull(reversed));
		return hull.size();
	}

	public static boolean allCollinear(List<Coordinate> points) {
		for (Coordinate p : points) {
			if (Orientation.index(points.get(0), points.get(1), p) != Orientation.COLLINEAR) {
				return false;
			}
		}
		return true;
	}

	private static List<Coordinate> halfHull(List<Coordinate> sorted) {
		List<Coordinate> chain = new ArrayList<>();
		for (Coordinate p : sorted) {
			while (chain.size() >= 2 && Orientation.index(chain.get(chain.size() - 2), chain.get(chain.size() - 1), p) == Orientation.CLOCKWISE) {
				chain.remove(chain.size() - 1);
			}
			chain.add(p);
		}
		return chain;
	}

	private static Envelope envelope(List<Coordinate> points, Edge e) {
		return new Envelope(points.get(e.a()), points.get(e.b()));
	}
}
