package com.github.micycle1.delaunay4j.graph;

import java.util.Arrays;
import java.util.Objects;

/**
 * Undirected vertex adjacency over a fixed arena of {@code n} vertex indices.
 * <p>
 * Every mutation keeps adjacency symmetric: {@code connect(a, b)} records
 * {@code b} in the neighbour set of {@code a} and {@code a} in that of
 * {@code b}. Self-loops and parallel edges are rejected, so each undirected
 * edge is stored exactly once per endpoint.
 */
public final class ConnectivityGraph {

	private final NeighborSet[] nodes;
	private int edgeCount;

	public ConnectivityGraph(int vertexCount) {
		if (vertexCount < 0) {
			throw new IllegalArgumentException("Vertex count must be non-negative: " + vertexCount);
		}
		nodes = new NeighborSet[vertexCount];
		for (int i = 0; i < vertexCount; i++) {
			nodes[i] = new NeighborSet();
		}
	}

	public int vertexCount() {
		return nodes.length;
	}

	public int edgeCount() {
		return edgeCount;
	}

	public int degree(int a) {
		return node(a).size();
	}

	/**
	 * Adds the undirected edge {@code a-b}.
	 *
	 * @throws IllegalArgumentException if {@code a == b} or the edge already exists
	 */
	public void connect(int a, int b) {
		NeighborSet na = node(a);
		NeighborSet nb = node(b);
		if (a == b) {
			throw new IllegalArgumentException("Cannot connect vertex " + a + " to itself");
		}
		if (na.contains(b)) {
			throw new IllegalArgumentException("Vertices " + a + " and " + b + " are already connected");
		}
		na.add(b);
		nb.add(a);
		edgeCount++;
	}

	/**
	 * Removes the undirected edge {@code a-b}.
	 *
	 * @throws IllegalArgumentException if the edge does not exist
	 */
	public void disconnect(int a, int b) {
		NeighborSet na = node(a);
		NeighborSet nb = node(b);
		if (!na.remove(b)) {
			throw new IllegalArgumentException("Vertices " + a + " and " + b + " are not connected");
		}
		nb.remove(a);
		edgeCount--;
	}

	/**
	 * Removes every edge incident to {@code a}.
	 */
	public void disconnectAll(int a) {
		NeighborSet na = node(a);
		for (int n : na.toArray()) {
			nodes[n].remove(a);
		}
		edgeCount -= na.size();
		na.clear();
	}

	public boolean isConnected(int a, int b) {
		Objects.checkIndex(b, nodes.length);
		return node(a).contains(b);
	}

	/**
	 * @return a copy of the neighbour indices of {@code a}, in unspecified order
	 */
	public int[] listConnections(int a) {
		return node(a).toArray();
	}

	/**
	 * Finds a vertex adjacent to both {@code a} and {@code b}.
	 *
	 * @param excluding vertex to skip, or {@code -1}
	 * @return the first common neighbour found, or {@code -1} if there is none
	 */
	public int commonConnection(int a, int b, int excluding) {
		NeighborSet na = node(a);
		NeighborSet nb = node(b);
		for (int i = 0; i < na.size(); i++) {
			int c = na.get(i);
			if (c != excluding && nb.contains(c)) {
				return c;
			}
		}
		return -1;
	}

	/**
	 * All vertices adjacent to both {@code a} and {@code b}, other than
	 * {@code excluding}. In a triangulation these are the apexes of the faces on
	 * either side of edge {@code a-b}, plus the apexes of any separating
	 * triangles through it.
	 */
	public int[] commonConnections(int a, int b, int excluding) {
		NeighborSet na = node(a);
		NeighborSet nb = node(b);
		int[] out = new int[Math.min(na.size(), nb.size())];
		int n = 0;
		for (int i = 0; i < na.size(); i++) {
			int c = na.get(i);
			if (c != excluding && nb.contains(c)) {
				out[n++] = c;
			}
		}
		return n == out.length ? out : Arrays.copyOf(out, n);
	}

	private NeighborSet node(int a) {
		return nodes[Objects.checkIndex(a, nodes.length)];
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("ConnectivityGraph[");
		for (int i = 0; i < nodes.length; i++) {
			if (i > 0) {
				sb.append(", ");
			}
			sb.append(i).append("->").append(nodes[i]);
		}
		return sb.append(']').toString();
	}
}
