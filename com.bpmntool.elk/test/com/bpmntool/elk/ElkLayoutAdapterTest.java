package com.bpmntool.elk;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.eclipse.elk.core.options.Direction;
import org.junit.jupiter.api.Test;

import com.bpmntool.autolayout.FlowDirection;
import com.bpmntool.autolayout.FlowGraph;
import com.bpmntool.autolayout.GraphBuilder;
import com.bpmntool.autolayout.LayoutConstants;
import com.bpmntool.autolayout.RawLayout;
import com.bpmntool.model.Connector;
import com.bpmntool.model.Shape;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ElkLayoutAdapterTest {

    private static final double DELTA = 0.0001;

    private final ElkLayoutAdapter adapter = new ElkLayoutAdapter();

    private static FlowGraph chain(int length) {
        final List<Shape> shapes = new ArrayList<>();
        final List<Connector> connectors = new ArrayList<>();
        for (int i = 0; i < length; i++) {
            shapes.add(new Shape("n" + i, "task"));
            if (i > 0) {
                connectors.add(new Connector("f" + i, Connector.SEQUENCE_FLOW, "n" + (i - 1), "n" + i));
            }
        }
        return new GraphBuilder().build(shapes, connectors);
    }

    private static Map<String, double[]> sizes(FlowGraph graph) {
        final Map<String, double[]> sizes = new LinkedHashMap<>();
        for (String id : graph.getNodes()) {
            sizes.put(id, new double[] { 120, 80 });
        }
        return sizes;
    }

    @Test
    public void testLeftToRightChain() throws Exception {
        final FlowGraph graph = chain(4);

        final RawLayout raw = adapter.layout(graph, sizes(graph), FlowDirection.LEFT_TO_RIGHT);

        assertFalse(raw.isYAxisUp());
        assertFalse(raw.isForeignUnits());
        assertEquals(4, raw.getPositions().size());
        for (int i = 1; i < 4; i++) {
            final double previous = raw.getPositions().get("n" + (i - 1))[0];
            final double current = raw.getPositions().get("n" + i)[0];
            assertTrue(current >= previous + 120, "n" + i + " not right of its predecessor");
        }
    }

    @Test
    public void testTopToBottomChain() throws Exception {
        final FlowGraph graph = chain(3);

        final RawLayout raw = adapter.layout(graph, sizes(graph), FlowDirection.TOP_TO_BOTTOM);

        assertTrue(raw.getPositions().get("n1")[1] > raw.getPositions().get("n0")[1]);
        assertTrue(raw.getPositions().get("n2")[1] > raw.getPositions().get("n1")[1]);
    }

    @Test
    public void testDisconnectedNodesArePositioned() throws Exception {
        final FlowGraph graph = new GraphBuilder().build(
                List.of(new Shape("a", "task"), new Shape("b", "task"), new Shape("c", "dataObject")),
                List.of(new Connector("f", Connector.SEQUENCE_FLOW, "a", "b")));

        final RawLayout raw = adapter.layout(graph, sizes(graph), FlowDirection.LEFT_TO_RIGHT);

        assertEquals(3, raw.getPositions().size());
    }

    @Test
    public void testEmptyGraph() throws Exception {
        assertTrue(adapter.layout(new GraphBuilder().build(List.of(), List.of()), Map.of(),
                FlowDirection.LEFT_TO_RIGHT).isEmpty());
    }

    @Test
    public void testMissingNodesContinueRightOfPlacedNodes() {
        final Map<String, double[]> positions = new LinkedHashMap<>();
        positions.put("a", new double[] { 0, 10 });
        positions.put("b", new double[] { 200, 30 });
        final Map<String, double[]> sizes = new LinkedHashMap<>();
        sizes.put("a", new double[] { 120, 80 });
        sizes.put("b", new double[] { 100, 50 });
        final List<String> missing = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            missing.add("m" + i);
        }

        ElkLayoutAdapter.placeMissing(positions, missing, sizes);

        final double startX = 300 + LayoutConstants.NODE_HORIZONTAL_GAP;
        assertArrayEquals(new double[] { startX, 10 }, positions.get("m0"), DELTA);
        assertArrayEquals(new double[] { startX + 180, 10 }, positions.get("m1"), DELTA);
        assertArrayEquals(new double[] { startX, 10 + 80 + LayoutConstants.NODE_VERTICAL_GAP }, positions.get("m5"),
                DELTA);
    }

    @Test
    public void testDirectionAndPriorityMapping() {
        assertEquals(Direction.RIGHT, ElkGraphBuilder.toElkDirection(FlowDirection.LEFT_TO_RIGHT));
        assertEquals(Direction.DOWN, ElkGraphBuilder.toElkDirection(FlowDirection.TOP_TO_BOTTOM));
        assertEquals(Direction.LEFT, ElkGraphBuilder.toElkDirection(FlowDirection.RIGHT_TO_LEFT));
        assertEquals(Direction.UP, ElkGraphBuilder.toElkDirection(FlowDirection.BOTTOM_TO_TOP));

        assertEquals(10, ElkGraphBuilder.priorityOf(Connector.SEQUENCE_FLOW));
        assertEquals(5, ElkGraphBuilder.priorityOf(Connector.MESSAGE_FLOW));
        assertEquals(1, ElkGraphBuilder.priorityOf(Connector.ASSOCIATION));
    }

    @Test
    public void testGraphBuilderCopiesSizesAndEdges() {
        final FlowGraph graph = chain(2);
        final Map<String, double[]> sizes = sizes(graph);
        sizes.put("n1", new double[] { 36, 36 });

        final ElkGraphBuilder builder = new ElkGraphBuilder();
        builder.buildGraph(graph, sizes, FlowDirection.LEFT_TO_RIGHT);

        assertEquals(36, builder.getElkNode("n1").getWidth(), DELTA);
        assertEquals(1, builder.getElkNode("n0").getOutgoingEdges().size());
        assertEquals("f1", builder.getElkNode("n0").getOutgoingEdges().get(0).getIdentifier());
    }
}
