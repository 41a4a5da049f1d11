package com.github.micycle1.delaunay4j.graph;

import java.util.Arrays;

/**
 * Small set of vertex indices.
 * <p>
 * The first {@link #INLINE_CAPACITY} entries live in a fixed array allocated
 * with the set; further entries spill into an overflow array that grows by
 * doubling. Planar triangulations average six neighbours per vertex, so most
 * sets never allocate overflow storage.
 * <p>
 * Element order is unspecified: removal moves the last element into the freed
 * slot.
 */
public final class NeighborSet {

	public static final int INLINE_CAPACITY = 8;

	private final int[] inline = new int[INLINE_CAPACITY];
	private int[] overflow;
	private int size;

	public int size() {
		return size;
	}

	public boolean isEmpty() {
		return size == 0;
	}

	public int get(int i) {
		if (i < 0 || i >= size) {
			throw new IndexOutOfBoundsException("Index " + i + " out of bounds for size " + size);
		}
		return i < INLINE_CAPACITY ? inline[i] : overflow[i - INLINE_CAPACITY];
	}

	public boolean contains(int v) {
		return indexOf(v) >= 0;
	}

	/**
	 * Appends {@code v} without checking for an existing entry.
	 */
	void add(int v) {
		if (size < INLINE_CAPACITY) {
			inline[size++] = v;
			return;
		}
		int o = size - INLINE_CAPACITY;
		if (overflow == null) {
			overflow = new int[INLINE_CAPACITY];
		} else if (o == overflow.length) {
			overflow = Arrays.copyOf(overflow, overflow.length * 2);
		}
		overflow[o] = v;
		size++;
	}

	/**
	 * @return true if {@code v} was present
	 */
	boolean remove(int v) {
		int i = indexOf(v);
		if (i < 0) {
			return false;
		}
		int last = size - 1;
		set(i, get(last));
		size = last;
		return true;
	}

	void clear() {
		size = 0;
		overflow = null;
	}

	public int[] toArray() {
		int[] out = new int[size];
		System.arraycopy(inline, 0, out, 0, Math.min(size, INLINE_CAPACITY));
		if (size > INLINE_CAPACITY) {
			System.arraycopy(overflow, 0, out, INLINE_CAPACITY, size - INLINE_CAPACITY);
		}
		return out;
	}

	private int indexOf(int v) {
		int n = Math.min(size, INLINE_CAPACITY);
		for (int i = 0; i < n; i++) {
			if (inline[i] == v) {
				return i;
			}
		}
		for (int i = INLINE_CAPACITY; i < size; i++) {
			if (overflow[i - INLINE_CAPACITY] == v) {
				return i;
			}
		}
		return -1;
	}

	private void set(int i, int v) {
		if (i < INLINE_CAPACITY) {
			inline[i] = v;
		} else {
			overflow[i - INLINE_CAPACITY] = v;
		}
	}

	@Override
	public String toString() {
		return Arrays.toString(toArray());
	}
}
