package com.bpmntool.elk;

import java.util.LinkedHashMap;
import java.util.Map;

import org.eclipse.elk.alg.layered.options.LayeredOptions;
import org.eclipse.elk.alg.layered.options.NodePlacementStrategy;
import org.eclipse.elk.core.options.CoreOptions;
import org.eclipse.elk.core.options.Direction;
import org.eclipse.elk.core.options.EdgeRouting;
import org.eclipse.elk.core.options.PortConstraints;
import org.eclipse.elk.graph.ElkEdge;
import org.eclipse.elk.graph.ElkNode;
import org.eclipse.elk.graph.util.ElkGraphUtil;

import com.bpmntool.autolayout.FlowDirection;
import com.bpmntool.autolayout.FlowGraph;
import com.bpmntool.autolayout.LayoutConstants;
import com.bpmntool.model.Connector;
import com.bpmntool.model.ShapeTypes;

/**
 * ELK Graph Builder for process flows.
 *
 * Translates a {@link FlowGraph} into a flat ELK graph laid out by the
 * layered (Sugiyama) algorithm:
 *
 * LAYERS (ranks along the flow direction):
 * LR → Direction.RIGHT
 * TB → Direction.DOWN
 * RL → Direction.LEFT
 * BT → Direction.UP
 *
 * SPACING:
 * - within a layer: {@link LayoutConstants#NODE_HORIZONTAL_GAP}
 * - between layers: {@link LayoutConstants#RANK_SEPARATION}
 *
 * EDGE ROUTING:
 * - Orthogonal (90-degree angles)
 * - Sequence flows (10) outrank message flows (5), which outrank
 * associations and anything else (1), so the main flow is kept straight
 *
 * Containers are not modelled: pools, lanes and sub-containers are resolved
 * after layout from absolute positions.
 */
public class ElkGraphBuilder {

    /** Diagram pixels per ELK unit; ELK works in pixels */
    static final double UNIT_FACTOR = 1.0;

    private final Map<String, ElkNode> nodeMap = new LinkedHashMap<>();

    public ElkNode buildGraph(FlowGraph graph, Map<String, double[]> sizes, FlowDirection direction) {
        ElkNode rootNode = ElkGraphUtil.createGraph();

        // ── 1. Global Layout Algorithm ──────────────────────────────────────
        rootNode.setProperty(CoreOptions.ALGORITHM, "org.eclipse.elk.layered");
        rootNode.setProperty(CoreOptions.DIRECTION, toElkDirection(direction));

        // Orthogonal edge routing: strict 90-degree angles
        rootNode.setProperty(CoreOptions.EDGE_ROUTING, EdgeRouting.ORTHOGONAL);

        // Allow ELK to freely assign ports for cleanest routing
        rootNode.setProperty(CoreOptions.PORT_CONSTRAINTS, PortConstraints.FREE);

        // BRANDES_KOEPF: balanced node placement within layers
        rootNode.setProperty(LayeredOptions.NODE_PLACEMENT_STRATEGY, NodePlacementStrategy.BRANDES_KOEPF);

        // ── 2. Spacing ─────────────────────────────────────────────────────
        rootNode.setProperty(CoreOptions.SPACING_NODE_NODE, LayoutConstants.NODE_HORIZONTAL_GAP / UNIT_FACTOR);
        rootNode.setProperty(LayeredOptions.SPACING_NODE_NODE_BETWEEN_LAYERS,
                LayoutConstants.RANK_SEPARATION / UNIT_FACTOR);

        // ── 3. Build Graph ──────────────────────────────────────────────────
        for (String id : graph.getNodes()) {
            createNode(rootNode, id, sizes.get(id));
        }
        for (FlowGraph.Edge edge : graph.getEdges()) {
            createEdge(edge);
        }

        return rootNode;
    }

    private void createNode(ElkNode parentGraph, String id, double[] size) {
        ElkNode elkNode = ElkGraphUtil.createNode(parentGraph);
        elkNode.setIdentifier(id);

        double width = size != null && size[0] > 0 ? size[0] : ShapeTypes.DEFAULT_WIDTH;
        double height = size != null && size[1] > 0 ? size[1] : ShapeTypes.DEFAULT_HEIGHT;
        elkNode.setWidth(width / UNIT_FACTOR);
        elkNode.setHeight(height / UNIT_FACTOR);

        nodeMap.put(id, elkNode);
    }

    private void createEdge(FlowGraph.Edge edge) {
        ElkNode sourceNode = nodeMap.get(edge.sourceId);
        ElkNode targetNode = nodeMap.get(edge.targetId);
        if (sourceNode == null || targetNode == null) {
            return;
        }
        ElkEdge elkEdge = ElkGraphUtil.createSimpleEdge(sourceNode, targetNode);
        if (edge.connectorId != null) {
            elkEdge.setIdentifier(edge.connectorId);
        }
        elkEdge.setProperty(LayeredOptions.PRIORITY, priorityOf(edge.kind));
    }

    static Direction toElkDirection(FlowDirection direction) {
        switch (direction) {
            case TOP_TO_BOTTOM:
                return Direction.DOWN;
            case RIGHT_TO_LEFT:
                return Direction.LEFT;
            case BOTTOM_TO_TOP:
                return Direction.UP;
            case LEFT_TO_RIGHT:
            default:
                return Direction.RIGHT;
        }
    }

    static int priorityOf(String connectorKind) {
        if (Connector.SEQUENCE_FLOW.equals(connectorKind)) {
            return 10;
        }
        if (Connector.MESSAGE_FLOW.equals(connectorKind)) {
            return 5;
        }
        return 1;
    }

    public ElkNode getElkNode(String id) {
        return nodeMap.get(id);
    }
}
