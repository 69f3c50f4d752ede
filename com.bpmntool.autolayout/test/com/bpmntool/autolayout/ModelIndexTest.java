package com.bpmntool.autolayout;

import org.junit.jupiter.api.Test;

import com.bpmntool.model.DiagramModel;
import com.bpmntool.model.Lane;
import com.bpmntool.model.Pool;
import com.bpmntool.model.Shape;
import com.bpmntool.model.ShapeTypes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ModelIndexTest {

    @Test
    public void testLookups() {
        final DiagramModel model = new DiagramModel();
        final Shape task = model.addShape(new Shape("t", ShapeTypes.TASK));
        final Pool pool = model.addPool(new Pool("p"));
        final Lane first = model.addLane(new Lane("l1", "p"));
        final Lane second = model.addLane(new Lane("l2", "p"));
        model.addLane(new Lane("other", "q"));

        final ModelIndex index = new ModelIndex(model);

        assertSame(task, index.shape("t"));
        assertSame(pool, index.pool("p"));
        assertSame(second, index.lane("l2"));
        assertTrue(index.hasShape("t"));
        assertFalse(index.hasShape("p"));
        assertNull(index.shape("missing"));
        assertEquals(2, index.lanesOfPool("p").size());
        assertSame(first, index.lanesOfPool("p").get(0));
        assertTrue(index.lanesOfPool("missing").isEmpty());
    }

    @Test
    public void testFirstShapeWinsOnDuplicateIds() {
        final DiagramModel model = new DiagramModel();
        final Shape first = model.addShape(new Shape("dup", ShapeTypes.TASK));
        model.addShape(new Shape("dup", ShapeTypes.END_EVENT));

        final ModelIndex index = new ModelIndex(model);

        assertSame(first, index.shape("dup"));
        assertSame(model.getShape("dup"), index.shape("dup"));
        assertEquals(1, index.shapeMap().size());
    }
}
