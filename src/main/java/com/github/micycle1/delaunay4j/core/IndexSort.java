package com.github.micycle1.delaunay4j.core;

import java.util.Arrays;
import java.util.Comparator;

import org.locationtech.jts.geom.Coordinate;

import com.github.micycle1.delaunay4j.TriangulationException;
import com.github.micycle1.delaunay4j.TriangulationException.Reason;

/**
 * Lexicographic (x, then y) ordering of an input point sequence.
 * <p>
 * Sorted positions identify vertices throughout the triangulation; the two
 * index maps translate between sorted positions and positions in the caller's
 * sequence.
 */
public final class IndexSort {

	private static final Comparator<Coordinate> XY_ORDER = Comparator.comparingDouble((Coordinate c) -> c.x).thenComparingDouble(c -> c.y);

	private final Coordinate[] sorted;
	private final int[] reverse;
	private final int[] forward;

	private IndexSort(Coordinate[] sorted, int[] reverse, int[] forward) {
		this.sorted = sorted;
		this.reverse = reverse;
		this.forward = forward;
	}

	/**
	 * Sorts {@code points} without modifying the array.
	 *
	 * @throws TriangulationException if a point is null or non-finite, or if two
	 *                                points coincide
	 */
	public static IndexSort of(Coordinate[] points) {
		int n = points.length;
		Coordinate[] copy = new Coordinate[n];
		for (int i = 0; i < n; i++) {
			Coordinate c = points[i];
			if (c == null) {
				throw new TriangulationException(Reason.MALFORMED_INPUT, "Point " + i + " is null");
			}
			if (!Double.isFinite(c.x) || !Double.isFinite(c.y)) {
				throw new TriangulationException(Reason.NON_FINITE_COORDINATE, "Point " + i + " has a non-finite coordinate: " + c);
			}
			// + 0.0 folds -0.0 into 0.0 so that sort order agrees with ==
			copy[i] = new Coordinate(c.x + 0.0, c.y + 0.0);
		}

		Integer[] order = new Integer[n];
		for (int i = 0; i < n; i++) {
			order[i] = i;
		}
		Arrays.sort(order, Comparator.comparing((Integer i) -> copy[i], XY_ORDER));

		Coordinate[] sorted = new Coordinate[n];
		int[] reverse = new int[n];
		int[] forward = new int[n];
		for (int s = 0; s < n; s++) {
			int o = order[s];
			reverse[s] = o;
			forward[o] = s;
			sorted[s] = copy[o];
			if (s > 0 && sorted[s - 1].equals2D(sorted[s])) {
				throw new TriangulationException(Reason.DUPLICATE_VERTEX,
						"Points " + reverse[s - 1] + " and " + o + " coincide at " + sorted[s]);
			}
		}
		return new IndexSort(sorted, reverse, forward);
	}

	public int size() {
		return sorted.length;
	}

	/**
	 * @return coordinate of the vertex at sorted position {@code s}
	 */
	public Coordinate vertex(int s) {
		return sorted[s];
	}

	/**
	 * Vertex coordinates in sorted order. The array is shared, not copied.
	 */
	Coordinate[] sortedVertices() {
		return sorted;
	}

	/**
	 * @return original index of the vertex at sorted position {@code s}
	 */
	public int toOriginal(int s) {
		return reverse[s];
	}

	/**
	 * @return sorted position of the vertex at original index {@code o}
	 */
	public int toSorted(int o) {
		return forward[o];
	}
}
