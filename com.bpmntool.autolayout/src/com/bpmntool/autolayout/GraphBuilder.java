package com.bpmntool.autolayout;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.bpmntool.model.Connector;
import com.bpmntool.model.Shape;

/**
 * Builds the {@link FlowGraph} for a set of shapes: one node per shape and
 * one edge per connector whose endpoints are both known.
 */
public class GraphBuilder {

    private static final Logger logger = LoggerFactory.getLogger(GraphBuilder.class);

    public FlowGraph build(List<Shape> shapes, List<Connector> connectors) {
        FlowGraph graph = new FlowGraph();

        for (Shape shape : shapes) {
            graph.addNode(shape.getId());
        }

        for (Connector connector : connectors) {
            if (!graph.contains(connector.getSourceId())) {
                logger.warn("Skipping connector '{}': unknown source '{}'", connector.getId(), connector.getSourceId());
                continue;
            }
            if (!graph.contains(connector.getTargetId())) {
                logger.warn("Skipping connector '{}': unknown target '{}'", connector.getId(), connector.getTargetId());
                continue;
            }
            graph.addEdge(connector.getId(), connector.getKind(), connector.getSourceId(), connector.getTargetId());
        }

        return graph;
    }
}
