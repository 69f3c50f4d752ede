package com.bpmntool.autolayout;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.bpmntool.model.ShapeTypes;

/**
 * In-process rank-based flow layout, used whenever no external layout tool
 * is available or the tool fails.
 *
 * Each rank becomes one slice across the flow direction:
 *
 *   LEFT_TO_RIGHT              TOP_TO_BOTTOM
 *
 *   r0    r1    r2             r0:      [a]
 *         [b]                  r1:   [b]   [c]
 *   [a]         [d]            r2:      [d]
 *         [c]
 *
 * PRIMARY AXIS (flow direction): ranks are walked in order (reversed for
 * right-to-left and bottom-to-top), advancing by the largest extent in the
 * rank plus {@link LayoutConstants#RANK_SEPARATION}.
 *
 * SECONDARY AXIS (across the flow): nodes of one rank are stacked in
 * encounter order, each advancing by its own cross extent plus a fixed node
 * gap, and the stack is centred on a common axis.
 *
 * Output is in pixels with Y growing downward; positions still need
 * normalizing to the diagram margin.
 */
public class FallbackFlowLayout {

    /**
     * @param graph flow graph
     * @param sizes node id to {width, height}
     * @param ranks node id to rank, as produced by {@link RankAssigner}
     * @param direction flow direction
     * @param allIds every id that needs a position; ids absent from the graph
     *        are placed on a row-wrapping grid below the flow
     */
    public RawLayout layout(FlowGraph graph, Map<String, double[]> sizes, Map<String, Integer> ranks,
            FlowDirection direction, Collection<String> allIds) {

        Map<String, double[]> positions = new LinkedHashMap<>();

        // ── 1. Group nodes by rank, keeping encounter order ─────────────────
        TreeMap<Integer, List<String>> byRank = new TreeMap<>();
        for (String node : graph.getNodes()) {
            int rank = ranks.getOrDefault(node, 0);
            byRank.computeIfAbsent(rank, k -> new ArrayList<>()).add(node);
        }

        List<Integer> rankOrder = new ArrayList<>(byRank.keySet());
        if (direction.isReversed()) {
            Collections.reverse(rankOrder);
        }

        boolean horizontal = direction.isHorizontal();
        double secondaryGap = horizontal ? LayoutConstants.NODE_VERTICAL_GAP : LayoutConstants.NODE_HORIZONTAL_GAP;

        // ── 2. Walk ranks along the primary axis ────────────────────────────
        double primary = 0;
        for (int rank : rankOrder) {
            List<String> members = byRank.get(rank);

            double maxPrimaryExtent = 0;
            double span = 0;
            for (int i = 0; i < members.size(); i++) {
                double[] size = sizeOf(sizes, members.get(i));
                maxPrimaryExtent = Math.max(maxPrimaryExtent, horizontal ? size[0] : size[1]);
                span += horizontal ? size[1] : size[0];
                if (i > 0) {
                    span += secondaryGap;
                }
            }

            // Centre the stack on the secondary axis
            double secondary = -span / 2.0;
            for (String node : members) {
                double[] size = sizeOf(sizes, node);
                // Centre each node within the rank's primary extent
                if (horizontal) {
                    double x = primary + (maxPrimaryExtent - size[0]) / 2.0;
                    positions.put(node, new double[] { x, secondary });
                    secondary += size[1] + secondaryGap;
                } else {
                    double y = primary + (maxPrimaryExtent - size[1]) / 2.0;
                    positions.put(node, new double[] { secondary, y });
                    secondary += size[0] + secondaryGap;
                }
            }

            primary += maxPrimaryExtent + LayoutConstants.RANK_SEPARATION;
        }

        // ── 3. Grid for anything the graph did not cover ────────────────────
        List<String> leftovers = new ArrayList<>();
        for (String id : allIds) {
            if (!positions.containsKey(id)) {
                leftovers.add(id);
            }
        }
        if (!leftovers.isEmpty()) {
            double startX = 0;
            double startY = 0;
            if (!positions.isEmpty()) {
                double minX = Double.MAX_VALUE;
                double maxY = -Double.MAX_VALUE;
                for (Map.Entry<String, double[]> entry : positions.entrySet()) {
                    double[] size = sizeOf(sizes, entry.getKey());
                    minX = Math.min(minX, entry.getValue()[0]);
                    maxY = Math.max(maxY, entry.getValue()[1] + size[1]);
                }
                startX = minX;
                startY = maxY + LayoutConstants.NODE_VERTICAL_GAP;
            }
            positions.putAll(gridLayout(leftovers, sizes, startX, startY));
        }

        return RawLayout.pixels(positions);
    }

    /**
     * Row-wrapping grid: {@link LayoutConstants#GRID_COLUMNS} nodes per row,
     * each row as tall as its tallest node.
     */
    public Map<String, double[]> gridLayout(List<String> ids, Map<String, double[]> sizes, double startX,
            double startY) {
        Map<String, double[]> positions = new LinkedHashMap<>();
        double x = startX;
        double y = startY;
        double rowHeight = 0;

        for (int i = 0; i < ids.size(); i++) {
            String id = ids.get(i);
            double[] size = sizeOf(sizes, id);
            positions.put(id, new double[] { x, y });

            x += size[0] + LayoutConstants.NODE_HORIZONTAL_GAP;
            rowHeight = Math.max(rowHeight, size[1]);

            if ((i + 1) % LayoutConstants.GRID_COLUMNS == 0) {
                x = startX;
                y += rowHeight + LayoutConstants.NODE_VERTICAL_GAP;
                rowHeight = 0;
            }
        }
        return positions;
    }

    private static double[] sizeOf(Map<String, double[]> sizes, String id) {
        double[] size = sizes.get(id);
        return size != null ? size : new double[] { ShapeTypes.DEFAULT_WIDTH, ShapeTypes.DEFAULT_HEIGHT };
    }
}
