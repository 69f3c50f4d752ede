package com.bpmntool.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DiagramModelTest {

    @Test
    public void testCopyIsDeep() {
        final DiagramModel model = new DiagramModel();
        model.setHasExplicitCoordinates(true);
        final Shape task = model.addShape(new Shape("t1", ShapeTypes.TASK));
        task.getProperties().put("color", "red");
        model.addConnector(new Connector("f1", Connector.SEQUENCE_FLOW, "t1", "t1"));
        final Pool pool = model.addPool(new Pool("p1"));
        pool.getLaneIds().add("l1");
        final Lane lane = model.addLane(new Lane("l1", "p1"));
        lane.getMemberIds().add("t1");

        final DiagramModel copy = model.copy();
        copy.getShape("t1").setPosition(10, 20);
        copy.getShape("t1").getProperties().put("color", "blue");
        copy.getPool("p1").getLaneIds().clear();
        copy.getLane("l1").getMemberIds().clear();
        copy.getConnectors().get(0).getWaypoints().add(new Waypoint(1, 2));

        assertNotSame(task, copy.getShape("t1"));
        assertNull(task.getX());
        assertEquals("red", task.getProperties().get("color"));
        assertEquals(1, pool.getLaneIds().size());
        assertEquals(1, lane.getMemberIds().size());
        assertTrue(model.getConnectors().get(0).getWaypoints().isEmpty());
        assertTrue(copy.hasExplicitCoordinates());
    }

    @Test
    public void testLookups() {
        final DiagramModel model = new DiagramModel();
        model.addShape(new Shape("a", ShapeTypes.START_EVENT));
        model.addShape(new Shape("b", ShapeTypes.TASK));
        model.addConnector(new Connector("f1", Connector.SEQUENCE_FLOW, "a", "b"));
        model.addPool(new Pool("p1"));
        model.addLane(new Lane("l1", "p1"));
        model.addLane(new Lane("l2", "other"));

        assertEquals(1, model.getOutgoing("a").size());
        assertEquals(1, model.getIncoming("b").size());
        assertEquals(1, model.getShapesOfType(ShapeTypes.START_EVENT).size());
        assertEquals(1, model.getLanesOfPool("p1").size());
        assertNull(model.getShape("zzz"));
    }

    @Test
    public void testShapeDefaultsAndBounds() {
        assertEquals(36, ShapeTypes.defaultWidth(ShapeTypes.START_EVENT));
        assertEquals(200, ShapeTypes.defaultWidth(ShapeTypes.SUB_PROCESS));
        assertEquals(80, ShapeTypes.defaultHeight("unknownType"));

        final Shape shape = new Shape("s", ShapeTypes.TASK);
        assertNull(shape.getBoundsOrNull());
        assertThrows(IllegalStateException.class, shape::getBounds);
        shape.setPosition(1, 2);
        shape.setSize(3, 4);
        assertEquals(new Bounds(1, 2, 3, 4), shape.getBounds());
    }

    @Test
    public void testBoundsGeometry() {
        final Bounds a = new Bounds(0, 0, 10, 10);
        final Bounds touching = new Bounds(10, 0, 10, 10);

        assertTrue(!a.intersects(touching));
        assertEquals(0, a.overlapArea(touching));
        assertEquals(new Bounds(0, 0, 20, 10), a.union(touching));
    }
}
