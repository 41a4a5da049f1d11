package com.github.micycle1.delaunay4j;

/**
 * Signals input that cannot be triangulated, or a constraint that cannot be
 * forced into the triangulation.
 */
public class TriangulationException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public enum Reason {
		/** Odd-length coordinate or index arrays, null elements. */
		MALFORMED_INPUT,
		/** A NaN or infinite coordinate. */
		NON_FINITE_COORDINATE,
		/** Two input points with identical coordinates. */
		DUPLICATE_VERTEX,
		/** A constraint endpoint outside the supplied vertex range. */
		INDEX_OUT_OF_RANGE,
		/**
		 * A constraint that is a self-loop, passes through another vertex, crosses
		 * an already enforced constraint, or whose boundary chains cannot be
		 * completed.
		 */
		MALFORMED_CONSTRAINT
	}

	private final Reason reason;

	public TriangulationException(Reason reason, String message) {
		super(message);
		this.reason = reason;
	}

	public Reason getReason() {
		return reason;
	}
}
