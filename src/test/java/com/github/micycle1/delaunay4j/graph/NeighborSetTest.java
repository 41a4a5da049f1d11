package com.github.micycle1.delaunay4j.graph;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;

class NeighborSetTest {

	@Test
	void growsPastInlineCapacity() {
		NeighborSet set = new NeighborSet();
		int count = 3 * NeighborSet.INLINE_CAPACITY + 1;
		for (int v = 0; v < count; v++) {
			set.add(v * 10);
		}
		assertEquals(count, set.size());
		for (int v = 0; v < count; v++) {
			assertTrue(set.contains(v * 10), "missing " + v * 10);
			assertEquals(v * 10, set.get(v));
		}
		assertFalse(set.contains(5));
		assertArrayEquals(IntStream.range(0, count).map(v -> v * 10).toArray(), set.toArray());
	}

	@Test
	void removeMovesLastIntoFreedSlot() {
		NeighborSet set = new NeighborSet();
		for (int v = 0; v < 10; v++) {
			set.add(v);
		}
		assertTrue(set.remove(2));
		assertEquals(9, set.size());
		assertEquals(9, set.get(2));
		assertFalse(set.contains(2));

		// removal from the overflow part
		assertTrue(set.remove(8));
		assertFalse(set.contains(8));
		assertEquals(8, set.size());

		assertFalse(set.remove(42));
		int[] remaining = set.toArray();
		Arrays.sort(remaining);
		assertArrayEquals(new int[] { 0, 1, 3, 4, 5, 6, 7, 9 }, remaining);
	}

	@Test
	void clearEmptiesSet() {
		NeighborSet set = new NeighborSet();
		for (int v = 0; v < 12; v++) {
			set.add(v);
		}
		set.clear();
		assertTrue(set.isEmpty());
		assertEquals(0, set.toArray().length);
		set.add(3);
		assertArrayEquals(new int[] { 3 }, set.toArray());
	}

	@Test
	void getRejectsOutOfRange() {
		NeighborSet set = new NeighborSet();
		set.add(1);
		assertThrows(IndexOutOfBoundsException.class, () -> set.get(1));
		assertThrows(IndexOutOfBoundsException.class, () -> set.get(-1));
	}
}
