package com.github.micycle1.delaunay4j.core;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.delaunay4j.TriangulationException;
import com.github.micycle1.delaunay4j.TriangulationException.Reason;
import com.github.micycle1.delaunay4j.geom.Geom;
import com.github.micycle1.delaunay4j.graph.ConnectivityGraph;

/**
 * Forces required edges into a finished triangulation.
 * <p>
 * For a missing edge {@code u-v} the triangles crossed by segment {@code uv}
 * are located by walking two boundary chains from {@code u} to {@code v}: the
 * vertices of the crossed triangles left of the segment, and those right of it.
 * The crossed edges (each joining the two chains) are removed, {@code u-v} is
 * added, and the polygon on each side is retriangulated recursively, always
 * splitting at the chain vertex that sees its base under the widest angle. The
 * result is the constrained Delaunay triangulation of the enforced edges.
 * <p>
 * Enforced edges are remembered; a later constraint crossing one of them is
 * rejected.
 */
public final class ConstraintEnforcer {

	private static final Logger LOGGER = LoggerFactory.getLogger(ConstraintEnforcer.class);

	private record Key(int a, int b) {
		static Key of(int u, int v) {
			return u < v ? new Key(u, v) : new Key(v, u);
		}
	}

	private final IndexSort sort;
	private final Coordinate[] vertices;
	private final ConnectivityGraph graph;
	private final Set<Key> enforced = new HashSet<>();

	public ConstraintEnforcer(IndexSort sort, ConnectivityGraph graph) {
		this.sort = sort;
		this.vertices = sort.sortedVertices();
		this.graph = graph;
	}

	/**
	 * Makes {@code u-v} an edge of the triangulation and marks it as enforced.
	 *
	 * @param u sorted position of one endpoint
	 * @param v sorted position of the other endpoint
	 * @return true if the graph was modified, false if the edge already existed
	 * @throws TriangulationException ({@link Reason#MALFORMED_CONSTRAINT}) if
	 *                                {@code u == v}, if the segment passes through
	 *                                another vertex or crosses an enforced edge, or
	 *                                if its boundary chains cannot be completed
	 */
	public boolean enforce(int u, int v) {
		if (u == v) {
			throw malformed(u, v, "endpoints are the same vertex");
		}
		if (graph.isConnected(u, v)) {
			enforced.add(Key.of(u, v));
			return false;
		}

		List<Integer> leftChain = new ArrayList<>();
		List<Integer> rightChain = new ArrayList<>();
		walkChains(u, v, leftChain, rightChain);

		int removed = 0;
		for (int l : leftChain) {
			for (int r : rightChain) {
				if (graph.isConnected(l, r) && Geom.segmentsCross(vertices[l], vertices[r], vertices[u], vertices[v])) {
					if (enforced.contains(Key.of(l, r))) {
						throw malformed(u, v, "crosses the enforced edge " + sort.toOriginal(l) + "-" + sort.toOriginal(r));
					}
					graph.disconnect(l, r);
					removed++;
				}
			}
		}

		graph.connect(u, v);
		enforced.add(Key.of(u, v));

		// each chain must run from the base's first endpoint with the polygon on its left
		int[] left = leftChain.stream().mapToInt(Integer::intValue).toArray();
		retriangulate(left, 0, left.length, u, v);
		int[] right = rightChain.stream().mapToInt(Integer::intValue).toArray();
		reverse(right);
		retriangulate(right, 0, right.length, v, u);

		LOGGER.debug("Enforced edge {}-{}: replaced {} crossing edges", sort.toOriginal(u), sort.toOriginal(v), removed);
		return true;
	}

	/**
	 * Collects the vertices of the triangles crossed by segment {@code uv},
	 * ordered from {@code u} towards {@code v}, into the two chains.
	 */
	private void walkChains(int u, int v, List<Integer> leftChain, List<Integer> rightChain) {
		Coordinate pu = vertices[u];
		Coordinate pv = vertices[v];

		// the two neighbours of u that bound the wedge containing the segment
		int lCon = -1, rCon = -1;
		double lAngle = 0, rAngle = 0;
		for (int w : graph.listConnections(u)) {
			int side = Geom.orientation(pu, pv, vertices[w]);
			double angle = Geom.angleBetween(pv, pu, vertices[w]);
			if (side == Orientation.COLLINEAR) {
				if (angle < Math.PI / 2) {
					throw malformed(u, v, "passes through vertex " + sort.toOriginal(w));
				}
			} else if (side == Orientation.COUNTERCLOCKWISE) {
				if (lCon < 0 || angle < lAngle) {
					lCon = w;
					lAngle = angle;
				}
			} else if (rCon < 0 || angle < rAngle) {
				rCon = w;
				rAngle = angle;
			}
		}
		if (lCon < 0 || rCon < 0 || !graph.isConnected(lCon, rCon)) {
			throw malformed(u, v, "no triangle at " + sort.toOriginal(u) + " opens towards " + sort.toOriginal(v));
		}
		leftChain.add(lCon);
		rightChain.add(rCon);

		int a = lCon, b = rCon, previous = u;
		for (int steps = 0;; steps++) {
			if (steps > vertices.length) {
				throw malformed(u, v, "boundary chains do not close");
			}
			int next = faceAcross(a, b, previous);
			if (next < 0) {
				throw malformed(u, v, "boundary chains cannot be completed");
			}
			if (next == v) {
				return;
			}
			int side = Geom.orientation(pu, pv, vertices[next]);
			if (side == Orientation.COLLINEAR) {
				throw malformed(u, v, "passes through vertex " + sort.toOriginal(next));
			}
			if (side == Orientation.COUNTERCLOCKWISE) {
				previous = a;
				a = next;
				leftChain.add(next);
			} else {
				previous = b;
				b = next;
				rightChain.add(next);
			}
		}
	}

	/**
	 * Apex of the triangle on the other side of edge {@code a-b} from
	 * {@code previous}: among the common neighbours on that side, the one closest
	 * in angle to the edge at {@code a}.
	 *
	 * @return the apex, or {@code -1} if {@code a-b} is a hull edge on that side
	 */
	private int faceAcross(int a, int b, int previous) {
		Coordinate pa = vertices[a];
		Coordinate pb = vertices[b];
		int from = Geom.orientation(pa, pb, vertices[previous]);
		int best = -1;
		double bestAngle = 0;
		for (int w : graph.commonConnections(a, b, previous)) {
			if (Geom.orientation(pa, pb, vertices[w]) != -from) {
				continue;
			}
			double angle = Geom.angleBetween(pb, pa, vertices[w]);
			if (best < 0 || angle < bestAngle) {
				best = w;
				bestAngle = angle;
			}
		}
		return best;
	}

	/**
	 * Triangulates the polygon {@code a, chain[from..to), b}, whose chain lies left
	 * of {@code a -> b} and whose edge {@code a-b} is already present.
	 */
	private void retriangulate(int[] chain, int from, int to, int a, int b) {
		if (from >= to) {
			return;
		}
		int apex = from;
		for (int k = from + 1; k < to; k++) {
			if (Geom.isInCircle(vertices[a], vertices[b], vertices[chain[apex]], vertices[chain[k]])) {
				apex = k;
			}
		}
		int c = chain[apex];
		if (apex > from) {
			graph.connect(a, c);
		}
		if (apex < to - 1) {
			graph.connect(c, b);
		}
		retriangulate(chain, from, apex, a, c);
		retriangulate(chain, apex + 1, to, c, b);
	}

	private TriangulationException malformed(int u, int v, String detail) {
		return new TriangulationException(Reason.MALFORMED_CONSTRAINT,
				"Constraint " + sort.toOriginal(u) + "-" + sort.toOriginal(v) + " " + detail);
	}

	private static void reverse(int[] values) {
		for (int i = 0, j = values.length - 1; i < j; i++, j--) {
			int t = values[i];
			values[i] = values[j];
			values[j] = t;
		}
	}
}
