package com.github.micycle1.delaunay4j.graph;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

class ConnectivityGraphTest {

	@Test
	void connectIsSymmetric() {
		ConnectivityGraph g = new ConnectivityGraph(4);
		g.connect(0, 1);
		g.connect(2, 0);
		assertTrue(g.isConnected(0, 1));
		assertTrue(g.isConnected(1, 0));
		assertTrue(g.isConnected(0, 2));
		assertFalse(g.isConnected(1, 2));
		assertEquals(2, g.edgeCount());
		assertEquals(2, g.degree(0));
		assertEquals(0, g.degree(3));
	}

	@Test
	void rejectsSelfLoopAndDuplicate() {
		ConnectivityGraph g = new ConnectivityGraph(3);
		assertThrows(IllegalArgumentException.class, () -> g.connect(1, 1));
		g.connect(0, 1);
		assertThrows(IllegalArgumentException.class, () -> g.connect(0, 1));
		assertThrows(IllegalArgumentException.class, () -> g.connect(1, 0));
		assertEquals(1, g.edgeCount());
	}

	@Test
	void disconnectRemovesBothDirections() {
		ConnectivityGraph g = new ConnectivityGraph(3);
		g.connect(0, 1);
		g.connect(1, 2);
		g.disconnect(1, 0);
		assertFalse(g.isConnected(0, 1));
		assertFalse(g.isConnected(1, 0));
		assertTrue(g.isConnected(1, 2));
		assertEquals(1, g.edgeCount());
		assertThrows(IllegalArgumentException.class, () -> g.disconnect(0, 1));
	}

	@Test
	void disconnectAllIsolatesVertex() {
		ConnectivityGraph g = new ConnectivityGraph(12);
		for (int v = 1; v < 12; v++) {
			g.connect(0, v);
		}
		g.connect(1, 2);
		g.disconnectAll(0);
		assertEquals(0, g.degree(0));
		for (int v = 1; v < 12; v++) {
			assertFalse(g.isConnected(v, 0));
		}
		assertEquals(1, g.edgeCount());
	}

	@Test
	void commonConnections() {
		// two triangles 0-1-2 and 0-1-3 sharing edge 0-1
		ConnectivityGraph g = new ConnectivityGraph(5);
		g.connect(0, 1);
		g.connect(0, 2);
		g.connect(1, 2);
		g.connect(0, 3);
		g.connect(1, 3);
		g.connect(3, 4);

		int[] common = g.commonConnections(0, 1, -1);
		Arrays.sort(common);
		assertArrayEquals(new int[] { 2, 3 }, common);
		assertArrayEquals(new int[] { 3 }, g.commonConnections(0, 1, 2));
		assertEquals(3, g.commonConnection(0, 1, 2));
		assertEquals(1, g.commonConnection(2, 3, 0));
		assertEquals(-1, g.commonConnection(2, 4, -1));
		assertEquals(0, g.commonConnections(2, 4, -1).length);
	}

	@Test
	void listConnectionsReturnsCopy() {
		ConnectivityGraph g = new ConnectivityGraph(3);
		g.connect(0, 1);
		int[] list = g.listConnections(0);
		list[0] = 2;
		assertTrue(g.isConnected(0, 1));
		assertFalse(g.isConnected(0, 2));
	}

	@Test
	void rejectsBadIndices() {
		ConnectivityGraph g = new ConnectivityGraph(2);
		assertThrows(IndexOutOfBoundsException.class, () -> g.connect(0, 2));
		assertThrows(IndexOutOfBoundsException.class, () -> g.isConnected(-1, 0));
		assertThrows(IndexOutOfBoundsException.class, () -> g.isConnected(0, 5));
		assertThrows(IllegalArgumentException.class, () -> new ConnectivityGraph(-1));
	}
}
