package com.github.micycle1.delaunay4j.geom;

import org.locationtech.jts.algorithm.Angle;
import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.Coordinate;

/**
 * Geometric predicates shared by the triangulation stages.
 * <p>
 * Side tests delegate to JTS {@link Orientation} (robust); angle measurements
 * delegate to JTS {@link Angle} and are only ever used for ordering. The
 * in-circle test is a plain floating-point determinant.
 */
public final class Geom {

	/**
	 * Default angular tolerance (radians) by which merge candidates nearly
	 * opposite the base edge are discarded.
	 */
	public static final double ANGLE_EPS = 1e-6;

	private Geom() {
	}

	/**
	 * Lifted in-circle determinant.
	 * <p>
	 * With {@code a, b, c} in counter-clockwise order the result is positive iff
	 * {@code d} lies strictly inside their circumcircle, zero when the four points
	 * are cocircular and negative when {@code d} is outside. The sign flips for a
	 * clockwise triangle.
	 */
	public static double inCircle(Coordinate a, Coordinate b, Coordinate c, Coordinate d) {
		double adx = a.x - d.x, ady = a.y - d.y;
		double bdx = b.x - d.x, bdy = b.y - d.y;
		double cdx = c.x - d.x, cdy = c.y - d.y;
		double alift = adx * adx + ady * ady;
		double blift = bdx * bdx + bdy * bdy;
		double clift = cdx * cdx + cdy * cdy;
		return adx * (bdy * clift - blift * cdy) - ady * (bdx * clift - blift * cdx) + alift * (bdx * cdy - bdy * cdx);
	}

	/**
	 * @return true if {@code d} lies strictly inside the circumcircle of the
	 *         counter-clockwise triangle {@code (a, b, c)}
	 */
	public static boolean isInCircle(Coordinate a, Coordinate b, Coordinate c, Coordinate d) {
		return inCircle(a, b, c, d) > 0;
	}

	/**
	 * Orientation of {@code q} relative to the directed line {@code p1 -> p2}: one
	 * of {@link Orientation#COUNTERCLOCKWISE} (left), {@link Orientation#CLOCKWISE}
	 * (right) or {@link Orientation#COLLINEAR}.
	 */
	public static int orientation(Coordinate p1, Coordinate p2, Coordinate q) {
		return Orientation.index(p1, p2, q);
	}

	public static boolean isLeftOf(Coordinate p1, Coordinate p2, Coordinate q) {
		return Orientation.index(p1, p2, q) == Orientation.COUNTERCLOCKWISE;
	}

	/**
	 * Signed angle at {@code tail} from the ray towards {@code from} to the ray
	 * towards {@code to}, in {@code (-PI, PI]}; positive when counter-clockwise.
	 */
	public static double orientedAngle(Coordinate from, Coordinate tail, Coordinate to) {
		return Angle.angleBetweenOriented(from, tail, to);
	}

	/**
	 * Unsigned angle at {@code tail} between the rays towards {@code a} and
	 * {@code b}, in {@code [0, PI]}.
	 */
	public static double angleBetween(Coordinate a, Coordinate tail, Coordinate b) {
		return Angle.angleBetween(a, tail, b);
	}

	/**
	 * Polar angle of {@code p} around {@code origin}, in {@code (-PI, PI]}.
	 */
	public static double polarAngle(Coordinate origin, Coordinate p) {
		return Angle.angle(origin, p);
	}

	/**
	 * @return true if the open segments {@code p1-p2} and {@code q1-q2} cross at a
	 *         single interior point
	 */
	public static boolean segmentsCross(Coordinate p1, Coordinate p2, Coordinate q1, Coordinate q2) {
		int o1 = Orientation.index(p1, p2, q1);
		int o2 = Orientation.index(p1, p2, q2);
		if (o1 == Orientation.COLLINEAR || o2 == Orientation.COLLINEAR || o1 == o2) {
			return false;
		}
		int o3 = Orientation.index(q1, q2, p1);
		int o4 = Orientation.index(q1, q2, p2);
		return o3 != Orientation.COLLINEAR && o4 != Orientation.COLLINEAR && o3 != o4;
	}
}
