package com.bpmntool.autolayout;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.bpmntool.model.Connector;
import com.bpmntool.model.Shape;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GraphBuilderTest {

    private final GraphBuilder graphBuilder = new GraphBuilder();

    @Test
    public void testNodePerShapeAndEdgePerConnector() {
        final List<Shape> shapes = List.of(new Shape("a", "task"), new Shape("b", "task"), new Shape("c", "task"));
        final List<Connector> connectors = List.of(
                new Connector("f1", Connector.SEQUENCE_FLOW, "a", "b"),
                new Connector("f2", Connector.MESSAGE_FLOW, "b", "c"));

        final FlowGraph graph = graphBuilder.build(shapes, connectors);

        assertEquals(3, graph.getNodeCount());
        assertEquals(2, graph.getEdges().size());
        assertEquals(Connector.MESSAGE_FLOW, graph.getEdges().get(1).kind);
        assertTrue(graph.getSuccessors("a").contains("b"));
        assertTrue(graph.getPredecessors("c").contains("b"));
        assertEquals(0, graph.getInDegree("a"));
    }

    @Test
    public void testConnectorsWithUnknownEndpointsAreSkipped() {
        final List<Shape> shapes = List.of(new Shape("a", "task"), new Shape("b", "task"));
        final List<Connector> connectors = List.of(
                new Connector("f1", Connector.SEQUENCE_FLOW, "a", "missing"),
                new Connector("f2", Connector.SEQUENCE_FLOW, "ghost", "b"),
                new Connector("f3", Connector.SEQUENCE_FLOW, "a", "b"));

        final FlowGraph graph = graphBuilder.build(shapes, connectors);

        assertEquals(2, graph.getNodeCount());
        assertEquals(1, graph.getEdges().size());
        assertEquals("f3", graph.getEdges().get(0).connectorId);
        assertFalse(graph.contains("missing"));
    }

    @Test
    public void testIsConnected() {
        final List<Shape> shapes = List.of(new Shape("a", "task"), new Shape("b", "task"), new Shape("lonely", "task"));
        final FlowGraph graph = graphBuilder.build(shapes,
                List.of(new Connector("f1", Connector.SEQUENCE_FLOW, "a", "b")));

        assertTrue(graph.isConnected("a"));
        assertTrue(graph.isConnected("b"));
        assertFalse(graph.isConnected("lonely"));
    }
}
