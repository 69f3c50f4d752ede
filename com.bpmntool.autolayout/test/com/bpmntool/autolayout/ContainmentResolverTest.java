package com.bpmntool.autolayout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.bpmntool.model.Bounds;
import com.bpmntool.model.DiagramModel;
import com.bpmntool.model.Lane;
import com.bpmntool.model.Pool;
import com.bpmntool.model.Shape;
import com.bpmntool.model.ShapeTypes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ContainmentResolverTest {

    private final ContainmentResolver layoutResolver = new ContainmentResolver(LayoutSettings.defaults());

    private final ContainmentResolver preserveResolver = new ContainmentResolver(
            LayoutSettings.builder().mode(LayoutMode.PRESERVE).build());

    private static Shape shape(DiagramModel model, String id, String type, double x, double y, double w, double h) {
        final Shape shape = model.addShape(new Shape(id, type));
        shape.setPosition(x, y);
        shape.setSize(w, h);
        return shape;
    }

    private static Lane lane(DiagramModel model, Pool pool, String id, String... members) {
        final Lane lane = model.addLane(new Lane(id, pool.getId()));
        pool.getLaneIds().add(id);
        for (String member : members) {
            lane.getMemberIds().add(member);
        }
        return lane;
    }

    @Test
    public void testAnalyzePrecedence() {
        final DiagramModel model = new DiagramModel();
        final Pool pool = model.addPool(new Pool("P"));
        model.addPool(new Pool("P2"));
        shape(model, "T", ShapeTypes.TASK, 0, 0, 120, 80);
        shape(model, "T_timer", ShapeTypes.BOUNDARY_EVENT, 0, 0, 36, 36).getProperties()
                .put(ShapeTypes.ATTACHED_TO_REF, "T");
        shape(model, "S", ShapeTypes.SUB_PROCESS, 0, 0, 200, 150);
        shape(model, "child", ShapeTypes.TASK, 0, 0, 120, 80).setSubContainerId("S");
        shape(model, "member", ShapeTypes.TASK, 0, 0, 120, 80);
        shape(model, "byParent", ShapeTypes.TASK, 0, 0, 120, 80).setParentId("L1");
        shape(model, "inPool", ShapeTypes.TASK, 0, 0, 120, 80).setParentId("P2");
        shape(model, "orphan", ShapeTypes.TASK, 0, 0, 120, 80).setParentId("ghost");
        shape(model, "free", ShapeTypes.TASK, 0, 0, 120, 80);
        lane(model, pool, "L1", "member", "child");

        final Map<String, ParentRef> parents = layoutResolver.analyze(model);

        assertEquals(ParentRef.host("T"), parents.get("T_timer"));
        assertEquals(ParentRef.subContainer("S"), parents.get("child"));
        assertEquals(ParentRef.lane("L1"), parents.get("member"));
        assertEquals(ParentRef.lane("L1"), parents.get("byParent"));
        assertEquals(ParentRef.pool("P2"), parents.get("inPool"));
        assertEquals(ParentRef.none(), parents.get("orphan"));
        // P2 is laneless but has no process reference, so nothing is adopted
        assertEquals(ParentRef.none(), parents.get("free"));
    }

    @Test
    public void testSingleLanelessPoolAdoptsUnparentedShapes() {
        final DiagramModel model = new DiagramModel();
        model.addPool(new Pool("P")).setProcessRef("process_1");
        shape(model, "a", ShapeTypes.TASK, 0, 0, 120, 80);

        assertEquals(ParentRef.pool("P"), layoutResolver.analyze(model).get("a"));
    }

    @Test
    public void testAttachedHostFoundByIdSubstring() {
        final DiagramModel model = new DiagramModel();
        shape(model, "Task_1", ShapeTypes.TASK, 0, 0, 120, 80);
        shape(model, "Task_1_Boundary", ShapeTypes.BOUNDARY_EVENT, 0, 0, 36, 36);
        shape(model, "Orphan_Boundary", ShapeTypes.BOUNDARY_EVENT, 0, 0, 36, 36);

        final Map<String, ParentRef> parents = layoutResolver.analyze(model);

        assertEquals(ParentRef.host("Task_1"), parents.get("Task_1_Boundary"));
        assertEquals(ParentRef.none(), parents.get("Orphan_Boundary"));
    }

    @Test
    public void testLaneHeightsAndPoolSize() {
        final DiagramModel model = new DiagramModel();
        final Pool pool = model.addPool(new Pool("P"));
        shape(model, "a", ShapeTypes.START_EVENT, 100, 100, 36, 36);
        shape(model, "b", ShapeTypes.TASK, 200, 80, 120, 80);
        shape(model, "c", ShapeTypes.END_EVENT, 400, 100, 36, 36);
        final Lane busy = lane(model, pool, "L1", "a", "b", "c");
        final Lane empty = lane(model, pool, "L2");

        layoutResolver.resolve(model, Collections.emptySet());

        assertEquals(140, busy.getHeight());
        assertEquals(LayoutConstants.LANE_MIN_HEIGHT, empty.getHeight());
        assertEquals(busy.getHeight() + empty.getHeight(), pool.getHeight());
        assertEquals(140, empty.getY());
        assertEquals(LayoutConstants.POOL_HEADER_WIDTH, busy.getX());
        assertEquals(376, busy.getWidth());
        assertEquals(416, pool.getWidth());

        // X translated by the global minimum, Y remapped into the lane band
        assertEquals(20, model.getShape("a").getX());
        assertEquals(120, model.getShape("b").getX());
        assertEquals(320, model.getShape("c").getX());
        assertEquals(40, model.getShape("a").getY());
        assertEquals(20, model.getShape("b").getY());
        assertEquals("L1", model.getShape("a").getParentId());
    }

    @Test
    public void testLaneMemberVerticalOrderIsPreserved() {
        final DiagramModel model = new DiagramModel();
        final Pool pool = model.addPool(new Pool("P"));
        shape(model, "top", ShapeTypes.TASK, 100, 100, 120, 80);
        shape(model, "bottom", ShapeTypes.TASK, 300, 300, 120, 80);
        shape(model, "middle", ShapeTypes.TASK, 500, 200, 120, 80);
        final Lane lane = lane(model, pool, "L1", "top", "bottom", "middle");

        layoutResolver.resolve(model, Collections.emptySet());

        final double top = model.getShape("top").getY();
        final double middle = model.getShape("middle").getY();
        final double bottom = model.getShape("bottom").getY();
        assertTrue(top < middle);
        assertTrue(middle < bottom);
        assertTrue(top >= 0 && bottom + 80 <= lane.getHeight());
    }

    @Test
    public void testEqualYIsCentredInLane() {
        final DiagramModel model = new DiagramModel();
        final Pool pool = model.addPool(new Pool("P"));
        shape(model, "a", ShapeTypes.TASK, 100, 100, 120, 80);
        shape(model, "b", ShapeTypes.TASK, 300, 100, 120, 80);
        final Lane lane = lane(model, pool, "L1", "a", "b");
        lane(model, pool, "L2");

        layoutResolver.resolve(model, Collections.emptySet());

        assertEquals((lane.getHeight() - 80) / 2, model.getShape("a").getY());
        assertEquals(model.getShape("a").getY(), model.getShape("b").getY());
    }

    @Test
    public void testSubContainerChildrenAreClampedInside() {
        final DiagramModel model = new DiagramModel();
        shape(model, "S", ShapeTypes.SUB_PROCESS, 100, 100, 200, 150);
        shape(model, "outside", ShapeTypes.TASK, 500, 500, 120, 80).setSubContainerId("S");
        shape(model, "above", ShapeTypes.TASK, 110, 110, 50, 50).getProperties()
                .put(ShapeTypes.SUB_CONTAINER_REF, "S");

        layoutResolver.resolve(model, Collections.emptySet());

        final Shape outside = model.getShape("outside");
        assertEquals(80, outside.getX());
        assertEquals(44, outside.getY());
        assertEquals("S", outside.getParentId());

        final Shape above = model.getShape("above");
        assertEquals(10, above.getX());
        assertEquals(0, above.getY());

        // The container itself stays on the canvas with its size
        assertEquals(new Bounds(100, 100, 200, 150), model.getShape("S").getBounds());
    }

    @Test
    public void testOverlappingSubContainerChildrenAreSeparated() {
        final DiagramModel model = new DiagramModel();
        shape(model, "S", ShapeTypes.SUB_PROCESS, 100, 100, 200, 150);
        shape(model, "first", ShapeTypes.TASK, 500, 500, 120, 80).setSubContainerId("S");
        shape(model, "second", ShapeTypes.TASK, 150, 160, 50, 50).setSubContainerId("S");

        layoutResolver.resolve(model, Collections.emptySet());

        final Bounds first = model.getShape("first").getBounds();
        final Bounds second = model.getShape("second").getBounds();
        assertEquals(new Bounds(80, 44, 120, 80), first);
        assertEquals(new Bounds(50, 154, 50, 50), second);
        assertFalse(first.intersects(second));
        assertEquals(230, model.getShape("S").getHeight());
    }

    @Test
    public void testPreserveModeKeepsOverlappingChildrenAsGiven() {
        final DiagramModel model = new DiagramModel();
        model.setHasExplicitCoordinates(true);
        shape(model, "S", ShapeTypes.SUB_PROCESS, 100, 100, 200, 150);
        shape(model, "first", ShapeTypes.TASK, 120, 140, 120, 80).setSubContainerId("S");
        shape(model, "second", ShapeTypes.TASK, 150, 160, 50, 50).setSubContainerId("S");

        preserveResolver.resolve(model, Collections.emptySet());

        assertEquals(new Bounds(20, 14, 120, 80), model.getShape("first").getBounds());
        assertEquals(new Bounds(50, 34, 50, 50), model.getShape("second").getBounds());
        assertEquals(150, model.getShape("S").getHeight());
    }

    @Test
    public void testNestedContainerGrowsBeforeItIsPlacedInItsParent() {
        final DiagramModel model = new DiagramModel();
        shape(model, "outer", ShapeTypes.SUB_PROCESS, 0, 0, 200, 200);
        shape(model, "inner", ShapeTypes.SUB_PROCESS, 20, 86, 140, 126).setSubContainerId("outer");
        shape(model, "i1", ShapeTypes.TASK, 20, 112, 120, 80).setSubContainerId("inner");
        shape(model, "i2", ShapeTypes.TASK, 20, 112, 120, 80).setSubContainerId("inner");

        layoutResolver.resolve(model, Collections.emptySet());

        assertEquals(new Bounds(0, 0, 120, 80), model.getShape("i1").getBounds());
        assertEquals(new Bounds(0, 80, 120, 80), model.getShape("i2").getBounds());
        assertEquals(new Bounds(20, 0, 140, 186), model.getShape("inner").getBounds());
        assertEquals(new Bounds(0, 0, 200, 212), model.getShape("outer").getBounds());
    }

    @Test
    public void testAttachedShapesHaveDistinctOffsets() {
        final DiagramModel model = new DiagramModel();
        shape(model, "T", ShapeTypes.TASK, 100, 100, 120, 80);
        shape(model, "b1", ShapeTypes.BOUNDARY_EVENT, 0, 0, 36, 36).getProperties()
                .put(ShapeTypes.ATTACHED_TO_REF, "T");
        shape(model, "b2", ShapeTypes.BOUNDARY_EVENT, 0, 0, 36, 36).getProperties()
                .put(ShapeTypes.ATTACHED_TO_REF, "T");

        layoutResolver.resolve(model, Collections.emptySet());

        final Shape first = model.getShape("b1");
        final Shape second = model.getShape("b2");
        assertEquals(new Bounds(20, 62, 36, 36), first.getBounds());
        assertEquals(new Bounds(70, 62, 36, 36), second.getBounds());
        assertEquals("T", first.getParentId());
    }

    @Test
    public void testPreserveModeOnlyConvertsCoordinateSpaces() {
        final DiagramModel model = new DiagramModel();
        model.setHasExplicitCoordinates(true);
        final Pool pool = model.addPool(new Pool("P"));
        pool.setPosition(10, 20);
        pool.setSize(800, 400);
        final Lane first = lane(model, pool, "L1", "a");
        first.setBounds(40, 20, 770, 200);
        final Lane second = lane(model, pool, "L2", "b");
        second.setBounds(40, 220, 770, 200);
        shape(model, "a", ShapeTypes.TASK, 100, 50, 120, 80);
        shape(model, "b", ShapeTypes.TASK, 200, 250, 120, 80);

        final Pool laneless = model.addPool(new Pool("Q"));
        laneless.setPosition(0, 500);
        laneless.setSize(600, 200);
        shape(model, "q", ShapeTypes.TASK, 100, 600, 120, 80).setParentId("Q");

        preserveResolver.resolve(model, Collections.emptySet());

        assertEquals(30, first.getX());
        assertEquals(0, first.getY());
        assertEquals(200, second.getY());
        assertEquals(770, first.getWidth());
        assertEquals(new Bounds(60, 30, 120, 80), model.getShape("a").getBounds());
        assertEquals(new Bounds(160, 30, 120, 80), model.getShape("b").getBounds());
        assertEquals(new Bounds(100, 100, 120, 80), model.getShape("q").getBounds());
        assertEquals(800, pool.getWidth());
        assertEquals(400, pool.getHeight());
    }

    @Test
    public void testPreserveFallsBackToLayoutWhenLaneGeometryIsIncomplete() {
        final DiagramModel model = new DiagramModel();
        model.setHasExplicitCoordinates(true);
        final Pool pool = model.addPool(new Pool("P"));
        lane(model, pool, "L1", "a");
        shape(model, "a", ShapeTypes.TASK, 300, 300, 120, 80);

        assertTrue(!preserveResolver.shouldPreserve(model));

        preserveResolver.resolve(model, Collections.emptySet());

        assertEquals(LayoutConstants.LANE_PADDING, model.getShape("a").getX());
    }

    @Test
    public void testLanelessPoolMembersAreCentredBlock() {
        final DiagramModel model = new DiagramModel();
        final Pool pool = model.addPool(new Pool("P"));
        pool.setProcessRef("process_1");
        shape(model, "a", ShapeTypes.TASK, 100, 100, 120, 80);
        shape(model, "b", ShapeTypes.TASK, 300, 140, 120, 80);

        layoutResolver.resolve(model, Collections.emptySet());

        // Bounding box 320 x 120 plus padding and header, floored
        assertEquals(400, pool.getWidth());
        assertEquals(160, pool.getHeight());
        assertEquals(new Bounds(60, 20, 120, 80), model.getShape("a").getBounds());
        assertEquals(new Bounds(260, 60, 120, 80), model.getShape("b").getBounds());
        assertEquals("P", model.getShape("a").getParentId());
    }

    @Test
    public void testCoincidentSiblingsAreSeparated() {
        final DiagramModel model = new DiagramModel();
        shape(model, "a", ShapeTypes.TASK, 100, 100, 120, 80);
        shape(model, "b", ShapeTypes.TASK, 100, 100, 120, 80);

        layoutResolver.resolve(model, Collections.emptySet());

        assertNotEquals(model.getShape("a").getBounds(), model.getShape("b").getBounds());
        assertEquals(new Bounds(110, 100, 120, 80), model.getShape("b").getBounds());
    }

    @Test
    public void testCoincidentSiblingsStayInsideTheirContainer() {
        final DiagramModel model = new DiagramModel();
        shape(model, "S", ShapeTypes.SUB_PROCESS, 0, 0, 140, 126);
        for (String id : new String[] { "c1", "c2", "c3" }) {
            shape(model, id, ShapeTypes.TASK, 0, 26, 120, 80).setSubContainerId("S");
        }

        layoutResolver.resolve(model, Collections.emptySet());

        final Shape container = model.getShape("S");
        assertEquals(266, container.getHeight());
        final List<Bounds> children = new ArrayList<>();
        for (String id : new String[] { "c1", "c2", "c3" }) {
            final Bounds b = model.getShape(id).getBounds();
            assertTrue(b.x >= 0 && b.getRight() <= container.getWidth());
            assertTrue(b.y >= 0 && b.getBottom() <= container.getHeight() - LayoutConstants.SUB_CONTAINER_HEADER);
            for (Bounds other : children) {
                assertFalse(b.intersects(other), b + " overlaps " + other);
            }
            children.add(b);
        }
    }

    @Test
    public void testAutoPlacedPoolsAreRestacked() {
        final DiagramModel model = new DiagramModel();
        final Pool fixed = model.addPool(new Pool("fixed"));
        fixed.setPosition(50, 50);
        fixed.setSize(600, 300);
        final Pool first = model.addPool(new Pool("auto1"));
        first.setPosition(50, 400);
        first.setSize(600, 200);
        final Pool second = model.addPool(new Pool("auto2"));
        second.setPosition(50, 650);
        second.setSize(600, 200);
        shape(model, "a", ShapeTypes.TASK, 100, 100, 120, 80);
        shape(model, "b", ShapeTypes.TASK, 100, 600, 120, 80);
        lane(model, first, "L1", "a");
        lane(model, second, "L2", "b");

        layoutResolver.resolve(model, new HashSet<>(Set.of("auto1", "auto2")));

        assertEquals(400, first.getY());
        assertEquals(first.getY() + first.getHeight() + LayoutConstants.POOL_GAP, second.getY());
    }
}
