package com.github.micycle1.delaunay4j.core;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.delaunay4j.geom.Geom;
import com.github.micycle1.delaunay4j.graph.ConnectivityGraph;

/**
 * Bottom-up divide-and-conquer merge of adjacent Delaunay fragments.
 * <p>
 * Each pass doubles the number of seed fragments per merged fragment. A merge
 * of {@code [left, middle)} with {@code [middle, right)} starts at their lower
 * common tangent and sews cross edges upwards: at each step the candidate
 * neighbours above the current base edge are pruned by the in-circle test and
 * the side whose candidate keeps the next triangle empty advances, until
 * neither side has a candidate and the base has become the upper tangent.
 */
public final class FragmentMerger {

	private static final Logger LOGGER = LoggerFactory.getLogger(FragmentMerger.class);

	private record Candidate(double angle, int vertex) {
	}

	private static final Comparator<Candidate> BY_ANGLE = Comparator.comparingDouble(Candidate::angle);

	private final Coordinate[] vertices;
	private final ConnectivityGraph graph;
	private final double maxAngle;

	/**
	 * @param vertices vertex coordinates in lexicographic (x, y) order
	 * @param graph    connectivity over the same indices
	 * @param config   supplies the angular tolerance for candidate selection
	 */
	public FragmentMerger(Coordinate[] vertices, ConnectivityGraph graph, TriangulationConfig config) {
		this.vertices = vertices;
		this.graph = graph;
		this.maxAngle = Math.PI - config.angleTolerance();
	}

	/**
	 * Merges all fragments into one triangulation.
	 *
	 * @param bounds fragment start positions followed by the vertex count, as
	 *               produced by {@link StripTriangulator#triangulate}
	 */
	public void mergeAll(int[] bounds) {
		int fragments = bounds.length - 1;
		int passes = 0;
		for (int n = 2; (n >> 1) < fragments; n <<= 1) {
			for (int m = 0; m + n / 2 < fragments; m += n) {
				int left = bounds[m];
				int middle = bounds[m + n / 2];
				int right = m + n >= fragments ? bounds[fragments] : bounds[m + n];
				merge(left, middle, right);
			}
			passes++;
		}
		LOGGER.debug("Merged {} fragments in {} passes", fragments, passes);
	}

	/**
	 * Merges the triangulations of the vertex ranges {@code [left, middle)} and
	 * {@code [middle, right)}, both non-empty.
	 */
	void merge(int left, int middle, int right) {
		int[] tangent = lowerTangent(left, middle, right);
		int l = tangent[0];
		int r = tangent[1];

		// every sewing step adds a cross edge; a planar graph has fewer than 3n
		int guard = 3 * (right - left);
		while (true) {
			if (guard-- < 0) {
				throw new IllegalStateException("Merge of [" + left + ", " + middle + ", " + right + ") did not terminate");
			}
			int lCand = pruneCandidates(l, leftCandidates(l, r, middle), l, r);
			int rCand = pruneCandidates(r, rightCandidates(l, r, middle), l, r);

			graph.connect(l, r);

			if (lCand >= 0) {
				if (rCand >= 0 && Geom.isInCircle(vertices[l], vertices[r], vertices[lCand], vertices[rCand])) {
					r = rCand;
				} else {
					l = lCand;
				}
			} else if (rCand >= 0) {
				r = rCand;
			} else {
				break;
			}
		}
	}

	/**
	 * Lower common tangent of two consecutive vertex ranges.
	 * <p>
	 * Builds the lower monotone chain of {@code [left, right)}; because the
	 * vertices are sorted the chain visits the left range first, and the edge where
	 * it crosses into the right range is the tangent. Collinear chain vertices are
	 * retained so that the tangent joins the innermost pair.
	 *
	 * @return {@code {l, r}} with {@code l < middle <= r}
	 */
	int[] lowerTangent(int left, int middle, int right) {
		int[] chain = new int[right - left];
		int size = 0;
		for (int p = left; p < right; p++) {
			while (size >= 2 && Geom.orientation(vertices[chain[size - 2]], vertices[chain[size - 1]], vertices[p]) == Orientation.CLOCKWISE) {
				size--;
			}
			chain[size++] = p;
		}
		for (int k = 0; k + 1 < size; k++) {
			if (chain[k] < middle && chain[k + 1] >= middle) {
				return new int[] { chain[k], chain[k + 1] };
			}
		}
		throw new IllegalStateException("No lower tangent between [" + left + ", " + middle + ") and [" + middle + ", " + right + ")");
	}

	/**
	 * Left-range neighbours of {@code l} above base {@code l -> r}, by increasing
	 * counter-clockwise angle from the base.
	 */
	private List<Candidate> leftCandidates(int l, int r, int middle) {
		List<Candidate> out = new ArrayList<>();
		for (int c : graph.listConnections(l)) {
			if (c >= middle || !Geom.isLeftOf(vertices[l], vertices[r], vertices[c])) {
				continue;
			}
			double angle = Geom.orientedAngle(vertices[r], vertices[l], vertices[c]);
			if (angle < maxAngle) {
				out.add(new Candidate(angle, c));
			}
		}
		out.sort(BY_ANGLE);
		return out;
	}

	/**
	 * Right-range neighbours of {@code r} above base {@code l -> r}, by increasing
	 * clockwise angle from the reversed base.
	 */
	private List<Candidate> rightCandidates(int l, int r, int middle) {
		List<Candidate> out = new ArrayList<>();
		for (int c : graph.listConnections(r)) {
			if (c < middle || !Geom.isLeftOf(vertices[l], vertices[r], vertices[c])) {
				continue;
			}
			double angle = -Geom.orientedAngle(vertices[l], vertices[r], vertices[c]);
			if (angle < maxAngle) {
				out.add(new Candidate(angle, c));
			}
		}
		out.sort(BY_ANGLE);
		return out;
	}

	/**
	 * Walks the sorted candidates of {@code origin}, deleting each edge whose
	 * successor lies strictly inside the circle through the base and the
	 * candidate.
	 *
	 * @return the surviving candidate, or {@code -1} if there were none
	 */
	private int pruneCandidates(int origin, List<Candidate> candidates, int l, int r) {
		if (candidates.isEmpty()) {
			return -1;
		}
		int k = 0;
		while (k + 1 < candidates.size()) {
			int current = candidates.get(k).vertex();
			int next = candidates.get(k + 1).vertex();
			if (!Geom.isInCircle(vertices[l], vertices[r], vertices[current], vertices[next])) {
				break;
			}
			graph.disconnect(origin, current);
			k++;
		}
		return candidates.get(k).vertex();
	}
}
