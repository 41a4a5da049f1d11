package com.github.micycle1.delaunay4j.input;

/**
 * Converts an external input type into the triangulator's intermediate
 * {@link PointSet} representation.
 * <p>
 * Constraint indices of the returned point set must refer to positions in its
 * vertex list. Implementations may build the point set directly, or use
 * {@link PointSetBuilder} to deduplicate vertices and constraint pairs.
 *
 * @param <T> source input type
 */
public interface Adapter<T> {

	PointSet toPointSet(T input);
}
