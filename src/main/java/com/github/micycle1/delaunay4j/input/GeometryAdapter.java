package com.github.micycle1.delaunay4j.input;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

/**
 * Adapter that converts any JTS {@link Geometry} into a {@link PointSet}.
 * <p>
 * Every distinct coordinate becomes a vertex. Each segment of a
 * {@link LineString}, including polygon shells and holes, becomes a constraint;
 * points contribute vertices only. Components of collections are visited in
 * order.
 */
public class GeometryAdapter implements Adapter<Geometry> {

	@Override
	public PointSet toPointSet(Geometry geometry) {
		PointSetBuilder builder = new PointSetBuilder();
		if (geometry != null) {
			add(geometry, builder);
		}
		return builder.build();
	}

	private static void add(Geometry geometry, PointSetBuilder builder) {
		if (geometry.isEmpty()) {
			return;
		}
		if (geometry instanceof Point point) {
			builder.addVertex(point.getCoordinate());
		} else if (geometry instanceof LineString line) {
			addLine(line, builder);
		} else if (geometry instanceof Polygon polygon) {
			addLine(polygon.getExteriorRing(), builder);
			for (int i = 0; i < polygon.getNumInteriorRing(); i++) {
				addLine(polygon.getInteriorRingN(i), builder);
			}
		} else {
			for (int i = 0; i < geometry.getNumGeometries(); i++) {
				add(geometry.getGeometryN(i), builder);
			}
		}
	}

	private static void addLine(LineString line, PointSetBuilder builder) {
		Coordinate[] coords = line.getCoordinates();
		if (coords.length == 1) {
			builder.addVertex(coords[0]);
			return;
		}
		for (int i = 0; i + 1 < coords.length; i++) {
			builder.addSegment(coords[i], coords[i + 1]);
		}
	}
}
