package com.bpmntool.elk;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.eclipse.elk.alg.layered.options.LayeredOptions;
import org.eclipse.elk.core.RecursiveGraphLayoutEngine;
import org.eclipse.elk.core.data.LayoutMetaDataService;
import org.eclipse.elk.core.util.BasicProgressMonitor;
import org.eclipse.elk.graph.ElkNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.bpmntool.autolayout.ExternalLayoutTool;
import com.bpmntool.autolayout.FlowDirection;
import com.bpmntool.autolayout.FlowGraph;
import com.bpmntool.autolayout.LayoutConstants;
import com.bpmntool.autolayout.LayoutException;
import com.bpmntool.autolayout.RawLayout;
import com.bpmntool.model.ShapeTypes;

/**
 * {@link ExternalLayoutTool} backed by the Eclipse Layout Kernel's layered
 * algorithm, run in-process without the Eclipse platform.
 *
 * Registered through {@code META-INF/services}; the layout engine picks it
 * up whenever this module is on the classpath.
 */
public class ElkLayoutAdapter implements ExternalLayoutTool {

    private static final Logger logger = LoggerFactory.getLogger(ElkLayoutAdapter.class);

    private static boolean algorithmsRegistered;

    /**
     * Outside Eclipse the layout algorithms are not discovered as plug-ins
     * and have to be registered once per class loader.
     */
    private static synchronized void registerLayoutAlgorithms() {
        if (!algorithmsRegistered) {
            LayoutMetaDataService.getInstance().registerLayoutMetaDataProviders(new LayeredOptions());
            algorithmsRegistered = true;
        }
    }

    @Override
    public String getName() {
        return "ELK Layered";
    }

    @Override
    public RawLayout layout(FlowGraph graph, Map<String, double[]> sizes, FlowDirection direction)
            throws LayoutException {
        if (graph.isEmpty()) {
            return RawLayout.pixels(Collections.emptyMap());
        }

        ElkGraphBuilder builder = new ElkGraphBuilder();
        try {
            registerLayoutAlgorithms();

            // 1. Build ELK Graph
            ElkNode rootNode = builder.buildGraph(graph, sizes, direction);

            // 2. Execute Layout
            RecursiveGraphLayoutEngine engine = new RecursiveGraphLayoutEngine();
            engine.layout(rootNode, new BasicProgressMonitor());
        } catch (RuntimeException e) {
            throw new LayoutException("ELK layout failed: " + e.getMessage(), e);
        }

        // 3. Read back absolute coordinates
        Map<String, double[]> positions = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        for (String id : graph.getNodes()) {
            double[] position = absolutePosition(builder.getElkNode(id));
            if (position != null) {
                positions.put(id, position);
            } else {
                missing.add(id);
            }
        }

        if (!missing.isEmpty()) {
            logger.debug("ELK left {} nodes unplaced, appending them", missing.size());
            placeMissing(positions, missing, sizes);
        }
        return RawLayout.pixels(positions);
    }

    private static double[] absolutePosition(ElkNode elkNode) {
        if (elkNode == null) {
            return null;
        }
        // Calculate absolute coordinates by traversing up the parent hierarchy
        double x = elkNode.getX();
        double y = elkNode.getY();
        ElkNode parent = elkNode.getParent();
        while (parent != null && parent.getParent() != null) { // rootNode has no parent
            x += parent.getX();
            y += parent.getY();
            parent = parent.getParent();
        }
        if (Double.isNaN(x) || Double.isNaN(y)) {
            return null;
        }
        return new double[] { x * ElkGraphBuilder.UNIT_FACTOR, y * ElkGraphBuilder.UNIT_FACTOR };
    }

    /**
     * Continues to the right of the placed nodes' bounding box, top aligned,
     * starting a new row below every {@link LayoutConstants#GRID_COLUMNS}
     * nodes.
     */
    static void placeMissing(Map<String, double[]> positions, List<String> missing, Map<String, double[]> sizes) {
        double startX = 0;
        double startY = 0;
        if (!positions.isEmpty()) {
            double maxX = -Double.MAX_VALUE;
            double minY = Double.MAX_VALUE;
            for (Map.Entry<String, double[]> entry : positions.entrySet()) {
                maxX = Math.max(maxX, entry.getValue()[0] + sizeOf(sizes, entry.getKey())[0]);
                minY = Math.min(minY, entry.getValue()[1]);
            }
            startX = maxX + LayoutConstants.NODE_HORIZONTAL_GAP;
            startY = minY;
        }

        double x = startX;
        double y = startY;
        double rowHeight = 0;
        for (int i = 0; i < missing.size(); i++) {
            double[] size = sizeOf(sizes, missing.get(i));
            positions.put(missing.get(i), new double[] { x, y });
            x += size[0] + LayoutConstants.NODE_HORIZONTAL_GAP;
            rowHeight = Math.max(rowHeight, size[1]);
            if ((i + 1) % LayoutConstants.GRID_COLUMNS == 0) {
                x = startX;
                y += rowHeight + LayoutConstants.NODE_VERTICAL_GAP;
                rowHeight = 0;
            }
        }
    }

    private static double[] sizeOf(Map<String, double[]> sizes, String id) {
        double[] size = sizes.get(id);
        return size != null ? size : new double[] { ShapeTypes.DEFAULT_WIDTH, ShapeTypes.DEFAULT_HEIGHT };
    }
}
