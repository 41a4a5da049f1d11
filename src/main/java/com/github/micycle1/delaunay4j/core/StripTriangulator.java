package com.github.micycle1.delaunay4j.core;

import java.util.Arrays;

import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.Coordinate;

import com.github.micycle1.delaunay4j.geom.Geom;
import com.github.micycle1.delaunay4j.graph.ConnectivityGraph;

/**
 * Seeds the divide-and-conquer merge with small triangulated fragments.
 * <p>
 * Scans the sorted vertices left to right and cuts them into consecutive
 * fragments of two or three vertices, each triangulated in place:
 * <ul>
 * <li>three collinear vertices become a path, three others a triangle;</li>
 * <li>a run of vertices sharing one x coordinate becomes a vertical path, fanned
 * from the next vertex to its right when there is one;</li>
 * <li>a lone vertex directly followed by such a run fans to the whole run;</li>
 * <li>the last one or two vertices form their own fragment (an edge, or a single
 * unconnected vertex).</li>
 * </ul>
 * Every fragment is the unique triangulation of its vertices, hence Delaunay.
 */
public final class StripTriangulator {

	private StripTriangulator() {
	}

	/**
	 * Triangulates fragments of {@code vertices} into {@code graph}.
	 *
	 * @param vertices vertex coordinates in lexicographic (x, y) order
	 * @param graph    empty graph over the same vertex indices
	 * @return fragment start positions in ascending order, followed by
	 *         {@code vertices.length}; fragment {@code i} spans
	 *         {@code [bounds[i], bounds[i + 1])}
	 */
	public static int[] triangulate(Coordinate[] vertices, ConnectivityGraph graph) {
		int n = vertices.length;
		int[] bounds = new int[n + 1];
		int count = 0;

		int i = 0;
		while (i < n) {
			bounds[count++] = i;

			int run = verticalRun(vertices, i);
			if (run >= 2) {
				int end = i + run;
				connectPath(graph, i, end);
				if (end < n) {
					connectFan(graph, end, i, end);
					i = end + 1;
				} else {
					i = end;
				}
				continue;
			}

			int remaining = n - i;
			if (remaining == 1) {
				i++;
				continue;
			}
			if (remaining == 2) {
				graph.connect(i, i + 1);
				i += 2;
				continue;
			}

			int next = verticalRun(vertices, i + 1);
			if (next >= 2) {
				int end = i + 1 + next;
				connectPath(graph, i + 1, end);
				connectFan(graph, i, i + 1, end);
				i = end;
				continue;
			}

			// keep the vertical run that starts at i + 2 in one piece
			if (i + 3 < n && vertices[i + 2].x == vertices[i + 3].x) {
				graph.connect(i, i + 1);
				i += 2;
				continue;
			}

			graph.connect(i, i + 1);
			graph.connect(i + 1, i + 2);
			if (Geom.orientation(vertices[i], vertices[i + 1], vertices[i + 2]) != Orientation.COLLINEAR) {
				graph.connect(i, i + 2);
			}
			i += 3;
		}

		bounds[count] = n;
		return Arrays.copyOf(bounds, count + 1);
	}

	/**
	 * Number of consecutive vertices from {@code start} sharing its x coordinate.
	 */
	static int verticalRun(Coordinate[] vertices, int start) {
		int end = start + 1;
		while (end < vertices.length && vertices[end].x == vertices[start].x) {
			end++;
		}
		return end - start;
	}

	private static void connectPath(ConnectivityGraph graph, int from, int to) {
		for (int m = from; m < to - 1; m++) {
			graph.connect(m, m + 1);
		}
	}

	private static void connectFan(ConnectivityGraph graph, int apex, int from, int to) {
		for (int m = from; m < to; m++) {
			graph.connect(apex, m);
		}
	}
}
