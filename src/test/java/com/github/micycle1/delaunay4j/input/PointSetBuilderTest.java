package com.github.micycle1.delaunay4j.input;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import com.github.micycle1.delaunay4j.model.Triangulation.Edge;

class PointSetBuilderTest {

	@Test
	void deduplicatesVertices() {
		PointSetBuilder builder = new PointSetBuilder();
		assertEquals(0, builder.addVertex(new Coordinate(1, 2)));
		assertEquals(1, builder.addVertex(new Coordinate(3, 4)));
		assertEquals(0, builder.addVertex(new Coordinate(1, 2, 7)));
		assertEquals(2, builder.addVertex(new Coordinate(0.0, 5)));
		assertEquals(2, builder.addVertex(new Coordinate(-0.0, 5)));
		assertEquals(3, builder.vertexCount());
	}

	@Test
	void deduplicatesConstraints() {
		PointSetBuilder builder = new PointSetBuilder();
		assertTrue(builder.addSegment(new Coordinate(0, 0), new Coordinate(1, 0)));
		assertFalse(builder.addSegment(new Coordinate(1, 0), new Coordinate(0, 0)));
		assertFalse(builder.addSegment(new Coordinate(1, 0), new Coordinate(1, 0)));
		assertTrue(builder.addSegment(new Coordinate(1, 0), new Coordinate(1, 1)));

		PointSet set = builder.build();
		assertEquals(3, set.vertices.size());
		assertEquals(List.of(new Edge(0, 1), new Edge(1, 2)), set.constraints);
	}

	@Test
	void rejectsUnknownIndices() {
		PointSetBuilder builder = new PointSetBuilder();
		builder.addVertex(new Coordinate(0, 0));
		assertThrows(IllegalArgumentException.class, () -> builder.addConstraint(0, 1));
	}
}
