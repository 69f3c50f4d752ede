package com.bpmntool.autolayout;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.bpmntool.model.Bounds;
import com.bpmntool.model.DiagramModel;
import com.bpmntool.model.Lane;
import com.bpmntool.model.Pool;
import com.bpmntool.model.Shape;
import com.bpmntool.model.ShapeTypes;

/**
 * Guarantees every shape, lane and pool of a diagram a concrete rectangle.
 *
 * ╔══════════════════════════════════════════════════════════════════════╗
 * ║  Step   What                        Notes                           ║
 * ╠══════════════════════════════════════════════════════════════════════╣
 * ║  1      Pool positions              explicit kept, others stacked   ║
 * ║  2      Default dimensions          per shape type                  ║
 * ║  3      Partition                   positioned / needs layout       ║
 * ║  4a     Full layout                 external tool, else fallback    ║
 * ║  4b     Neighbour placement         beside positioned neighbours    ║
 * ║  5      Disconnected shapes         data sidebar, row beneath       ║
 * ║  6      Leftovers                   row-wrapping grid beneath       ║
 * ║  7      Containment                 ContainmentResolver             ║
 * ╚══════════════════════════════════════════════════════════════════════╝
 *
 * The input model is never modified; {@link #resolve} works on a deep copy
 * and returns it. A failing or missing external layout tool is never
 * surfaced to the caller: the in-process {@link FallbackFlowLayout} takes
 * over.
 */
public class PositionResolver {

    private static final Logger logger = LoggerFactory.getLogger(PositionResolver.class);

    private final LayoutSettings settings;
    private final ExternalLayoutTool externalTool;

    private final GraphBuilder graphBuilder = new GraphBuilder();
    private final RankAssigner rankAssigner = new RankAssigner();
    private final FallbackFlowLayout fallbackLayout = new FallbackFlowLayout();
    private final CoordinateNormalizer normalizer = new CoordinateNormalizer();
    private final OverlapAvoider overlapAvoider = new OverlapAvoider();
    private final ContainmentResolver containmentResolver;

    public PositionResolver() {
        this(LayoutSettings.defaults());
    }

    public PositionResolver(LayoutSettings settings) {
        this(settings, ExternalLayoutTool.discover().orElse(null));
    }

    /**
     * @param externalTool external layout tool, or null to always use the
     *        in-process fallback
     */
    public PositionResolver(LayoutSettings settings, ExternalLayoutTool externalTool) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.externalTool = externalTool;
        this.containmentResolver = new ContainmentResolver(settings);
    }

    public LayoutSettings getSettings() {
        return settings;
    }

    /**
     * Resolves positions and sizes.
     *
     * @return a copy of the model in which every shape has x, y, width and
     *         height, and every pool and lane has a rectangle; coordinates of
     *         contained shapes are relative to their container
     */
    public DiagramModel resolve(DiagramModel model) {
        Objects.requireNonNull(model, "model");
        DiagramModel working = model.copy();
        ModelIndex index = new ModelIndex(working);

        // ── 1. Pool positions ───────────────────────────────────────────────
        Set<String> autoPlacedPools = resolvePoolPositions(working, index);

        // ── 2. Default dimensions ───────────────────────────────────────────
        for (Shape shape : working.getShapes()) {
            if (shape.getWidth() == null) {
                shape.setWidth(ShapeTypes.defaultWidth(shape.getType()));
            }
            if (shape.getHeight() == null) {
                shape.setHeight(ShapeTypes.defaultHeight(shape.getType()));
            }
        }

        Map<String, ParentRef> parents = containmentResolver.analyze(working, index);

        // ── 3. Partition ────────────────────────────────────────────────────
        List<Shape> needsLayout = new ArrayList<>();
        for (Shape shape : working.getShapes()) {
            if (!shape.hasPosition()) {
                needsLayout.add(shape);
            }
        }
        boolean anyPositioned = needsLayout.size() < working.getShapes().size();

        if (!needsLayout.isEmpty()) {
            FlowGraph graph = graphBuilder.build(working.getShapes(), working.getConnectors());

            // ── 4. Flow placement ───────────────────────────────────────────
            if (!working.hasExplicitCoordinates() || !anyPositioned) {
                applyFullLayout(working, parents, graph, anyPositioned);
            } else {
                placeByNeighbours(working, index, parents, graph);
            }

            // ── 5. Disconnected shapes ──────────────────────────────────────
            placeDisconnected(working, index, graph);

            // ── 6. Leftovers ────────────────────────────────────────────────
            placeLeftovers(working, index);
        }

        // ── 7. Containment ──────────────────────────────────────────────────
        containmentResolver.resolve(working, autoPlacedPools, index, parents);

        logger.debug("Resolved {} shapes ({} laid out), {} pools, {} lanes", working.getShapes().size(),
                needsLayout.size(), working.getPools().size(), working.getLanes().size());
        return working;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Step 1: Pools
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Keeps explicit pool positions, derives the rectangle of a pool whose
     * lanes are all fully positioned, and stacks the remaining pools below.
     *
     * @return ids of the pools whose position was computed here
     */
    Set<String> resolvePoolPositions(DiagramModel model, ModelIndex index) {
        Set<String> autoPlaced = new LinkedHashSet<>();

        for (Pool pool : model.getPools()) {
            if (!pool.hasPosition()) {
                deriveFromLanes(pool, index.lanesOfPool(pool.getId()));
            }
        }

        double currentY = LayoutConstants.DIAGRAM_MARGIN;
        boolean anyPositioned = false;
        for (Pool pool : model.getPools()) {
            if (pool.hasPosition()) {
                double height = pool.getHeight() != null ? pool.getHeight() : LayoutConstants.POOL_DEFAULT_HEIGHT;
                double bottom = pool.getY() + height + LayoutConstants.POOL_GAP;
                currentY = anyPositioned ? Math.max(currentY, bottom) : bottom;
                anyPositioned = true;
            }
        }

        for (Pool pool : model.getPools()) {
            if (pool.hasPosition()) {
                continue;
            }
            if (pool.getWidth() == null) {
                pool.setWidth(LayoutConstants.POOL_DEFAULT_WIDTH);
            }
            if (pool.getHeight() == null) {
                pool.setHeight(LayoutConstants.POOL_DEFAULT_HEIGHT);
            }
            pool.setPosition(LayoutConstants.DIAGRAM_MARGIN, currentY);
            currentY += pool.getHeight() + LayoutConstants.POOL_GAP;
            autoPlaced.add(pool.getId());
        }
        return autoPlaced;
    }

    private static void deriveFromLanes(Pool pool, List<Lane> lanes) {
        if (lanes.isEmpty()) {
            return;
        }
        double minX = Double.MAX_VALUE;
        double minY = Double.MAX_VALUE;
        double maxX = -Double.MAX_VALUE;
        double maxY = -Double.MAX_VALUE;
        for (Lane lane : lanes) {
            if (!lane.hasCompleteBounds()) {
                return;
            }
            minX = Math.min(minX, lane.getX());
            minY = Math.min(minY, lane.getY());
            maxX = Math.max(maxX, lane.getX() + lane.getWidth());
            maxY = Math.max(maxY, lane.getY() + lane.getHeight());
        }
        double x = minX - LayoutConstants.POOL_HEADER_WIDTH;
        pool.setPosition(x, minY);
        if (!pool.hasSize()) {
            pool.setSize(maxX - x, maxY - minY);
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Step 4a: Full layout
    // ═══════════════════════════════════════════════════════════════════════

    private void applyFullLayout(DiagramModel model, Map<String, ParentRef> parents, FlowGraph graph,
            boolean anyPositioned) {
        Map<String, double[]> sizes = sizesOf(model);
        Map<String, double[]> positions = runExternalTool(graph, sizes);

        if (positions == null) {
            List<String> ids = new ArrayList<>(sizes.keySet());
            Map<String, Integer> ranks = rankAssigner.assign(graph);
            RawLayout raw = fallbackLayout.layout(graph, sizes, ranks, settings.getDirection(), ids);
            positions = normalizer.normalize(raw.getPositions(), false, false);
        }

        Obstacles placed = Obstacles.of(model, parents);
        for (Shape shape : model.getShapes()) {
            double[] p = positions.get(shape.getId());
            if (p == null || shape.hasPosition()) {
                continue;
            }
            double x = shape.getX() != null ? shape.getX() : p[0];
            double y = shape.getY() != null ? shape.getY() : p[1];
            Bounds candidate = new Bounds(x, y, shape.getWidth(), shape.getHeight());
            if (anyPositioned) {
                List<Bounds> siblings = placed.around(shape, parents);
                candidate = overlapAvoider.findFreeSpot(candidate, siblings);
                siblings.add(candidate);
            }
            shape.setPosition(candidate.x, candidate.y);
        }
    }

    /**
     * @return normalized positions, or null when the external tool is not
     *         to be used, is unavailable or failed
     */
    private Map<String, double[]> runExternalTool(FlowGraph graph, Map<String, double[]> sizes) {
        if (settings.isPreserve()) {
            return null;
        }
        if (externalTool == null) {
            logger.debug("No external layout tool available, using fallback layout");
            return null;
        }
        try {
            RawLayout raw = externalTool.layout(graph, sizes, settings.getDirection());
            if (raw == null || (raw.isEmpty() && !graph.isEmpty())) {
                logger.warn("External layout tool {} returned no positions, using fallback layout",
                        externalTool.getName());
                return null;
            }
            return normalizer.normalize(raw);
        } catch (LayoutException | RuntimeException | LinkageError e) {
            logger.warn("External layout tool {} failed, using fallback layout: {}", externalTool.getName(),
                    e.toString());
            return null;
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Step 4b: Neighbour placement
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Places connected shapes next to an already positioned neighbour: to the
     * right of a predecessor (wrapping below past the right bound), else to
     * the left of a successor (wrapping above past the left bound). Shapes
     * whose neighbours are all unpositioned wait for a later pass.
     *
     * A child of a positioned sub-container wraps at the container's edges
     * and only avoids its siblings, never the container box around it.
     */
    private void placeByNeighbours(DiagramModel model, ModelIndex index, Map<String, ParentRef> parents,
            FlowGraph graph) {
        Set<Shape> pending = new LinkedHashSet<>();
        for (Shape shape : model.getShapes()) {
            if (!shape.hasPosition() && graph.isConnected(shape.getId())) {
                pending.add(shape);
            }
        }
        if (pending.isEmpty()) {
            return;
        }

        double rightBound = LayoutConstants.DIAGRAM_MARGIN + settings.getWrapWidth();
        double leftBound = LayoutConstants.DIAGRAM_MARGIN;
        for (Bounds b : positionedBounds(model)) {
            rightBound = Math.max(rightBound, b.getRight());
            leftBound = Math.min(leftBound, b.x);
        }
        Obstacles placed = Obstacles.of(model, parents);

        int maxPasses = model.getShapes().size() * 2;
        for (int pass = 0; pass < maxPasses && !pending.isEmpty(); pass++) {
            boolean progress = false;
            for (Shape shape : new ArrayList<>(pending)) {
                double right = rightBound;
                double left = leftBound;
                Bounds container = containerBox(shape, index, parents);
                if (container != null) {
                    right = container.getRight();
                    left = container.x;
                }

                Bounds candidate = besidePredecessor(index, graph, shape, right);
                if (candidate == null) {
                    candidate = besideSuccessor(index, graph, shape, left);
                }
                if (candidate == null) {
                    continue;
                }
                List<Bounds> siblings = placed.around(shape, parents);
                Bounds free = overlapAvoider.findFreeSpot(candidate, siblings);
                shape.setPosition(free.x, free.y);
                siblings.add(free);
                pending.remove(shape);
                progress = true;
            }
            if (!progress) {
                break;
            }
        }

        if (!pending.isEmpty()) {
            logger.debug("{} connected shapes have no positioned neighbour", pending.size());
        }
    }

    /** Absolute box of the shape's sub-container, or null when it has none placed yet. */
    private static Bounds containerBox(Shape shape, ModelIndex index, Map<String, ParentRef> parents) {
        String containerId = Obstacles.containerIdOf(shape, parents);
        if (containerId == null) {
            return null;
        }
        Shape container = index.shape(containerId);
        return container != null ? container.getBoundsOrNull() : null;
    }

    private static Bounds besidePredecessor(ModelIndex index, FlowGraph graph, Shape shape, double rightBound) {
        for (String predecessorId : graph.getPredecessors(shape.getId())) {
            Shape predecessor = index.shape(predecessorId);
            if (predecessor == null || !predecessor.hasPosition()) {
                continue;
            }
            Bounds pred = predecessor.getBounds();
            double x = pred.getRight() + LayoutConstants.NODE_HORIZONTAL_GAP;
            double y = pred.getCenterY() - shape.getHeight() / 2;
            if (x + shape.getWidth() > rightBound) {
                x = pred.x;
                y = pred.getBottom() + LayoutConstants.NODE_VERTICAL_GAP;
            }
            return new Bounds(x, y, shape.getWidth(), shape.getHeight());
        }
        return null;
    }

    private static Bounds besideSuccessor(ModelIndex index, FlowGraph graph, Shape shape, double leftBound) {
        for (String successorId : graph.getSuccessors(shape.getId())) {
            Shape successor = index.shape(successorId);
            if (successor == null || !successor.hasPosition()) {
                continue;
            }
            Bounds succ = successor.getBounds();
            double x = succ.x - LayoutConstants.NODE_HORIZONTAL_GAP - shape.getWidth();
            double y = succ.getCenterY() - shape.getHeight() / 2;
            if (x < leftBound) {
                x = succ.x;
                y = succ.y - LayoutConstants.NODE_VERTICAL_GAP - shape.getHeight();
            }
            return new Bounds(x, y, shape.getWidth(), shape.getHeight());
        }
        return null;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Step 5 and 6: Disconnected shapes and leftovers
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Unpositioned shapes without connectors: data shapes stack in a sidebar
     * left of the diagram, everything else goes in a wrapping row beneath it.
     * A sidebar that would cross the left margin goes right of the diagram
     * instead.
     */
    private void placeDisconnected(DiagramModel model, ModelIndex index, FlowGraph graph) {
        List<Shape> dataShapes = new ArrayList<>();
        List<String> others = new ArrayList<>();
        for (Shape shape : model.getShapes()) {
            if (shape.hasPosition() || graph.isConnected(shape.getId())) {
                continue;
            }
            if (ShapeTypes.isDataType(shape.getType())) {
                dataShapes.add(shape);
            } else {
                others.add(shape.getId());
            }
        }
        if (dataShapes.isEmpty() && others.isEmpty()) {
            return;
        }

        List<Bounds> placed = positionedBounds(model);
        Bounds main = unionOf(placed);

        // Sidebar
        double sidebarWidth = 0;
        for (Shape shape : dataShapes) {
            sidebarWidth = Math.max(sidebarWidth, shape.getWidth());
        }
        double sidebarX = main.x - LayoutConstants.NODE_HORIZONTAL_GAP - sidebarWidth;
        if (sidebarX < Math.min(LayoutConstants.DIAGRAM_MARGIN, main.x)) {
            sidebarX = main.getRight() + LayoutConstants.NODE_HORIZONTAL_GAP;
        }
        double y = main.y;
        for (Shape shape : dataShapes) {
            Bounds candidate = new Bounds(sidebarX, y, shape.getWidth(), shape.getHeight());
            Bounds free = overlapAvoider.findFreeSpot(candidate, placed);
            shape.setPosition(free.x, free.y);
            placed.add(free);
            y = free.getBottom() + LayoutConstants.NODE_VERTICAL_GAP / 2;
        }

        // Row beneath
        if (!others.isEmpty()) {
            double startY = main.getBottom() + LayoutConstants.NODE_VERTICAL_GAP;
            Map<String, double[]> grid = fallbackLayout.gridLayout(others, sizesOf(model), main.x, startY);
            for (Map.Entry<String, double[]> entry : grid.entrySet()) {
                Shape shape = index.shape(entry.getKey());
                Bounds candidate = new Bounds(entry.getValue()[0], entry.getValue()[1], shape.getWidth(),
                        shape.getHeight());
                Bounds free = overlapAvoider.findFreeSpot(candidate, placed);
                shape.setPosition(free.x, free.y);
                placed.add(free);
            }
        }
    }

    /**
     * Anything still unpositioned goes on a row-wrapping grid beneath
     * everything placed so far. Values already set are kept.
     */
    private void placeLeftovers(DiagramModel model, ModelIndex index) {
        List<String> leftovers = new ArrayList<>();
        for (Shape shape : model.getShapes()) {
            if (!shape.hasPosition()) {
                leftovers.add(shape.getId());
            }
        }
        if (leftovers.isEmpty()) {
            return;
        }
        logger.debug("Placing {} remaining shapes beneath the diagram", leftovers.size());

        Bounds main = unionOf(positionedBounds(model));
        double startY = main.height > 0 ? main.getBottom() + LayoutConstants.NODE_VERTICAL_GAP : main.y;
        Map<String, double[]> grid = fallbackLayout.gridLayout(leftovers, sizesOf(model), main.x, startY);
        for (Map.Entry<String, double[]> entry : grid.entrySet()) {
            Shape shape = index.shape(entry.getKey());
            if (shape.getX() == null) {
                shape.setX(entry.getValue()[0]);
            }
            if (shape.getY() == null) {
                shape.setY(entry.getValue()[1]);
            }
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Helpers
    // ═══════════════════════════════════════════════════════════════════════

    private static Map<String, double[]> sizesOf(DiagramModel model) {
        Map<String, double[]> sizes = new LinkedHashMap<>();
        for (Shape shape : model.getShapes()) {
            sizes.put(shape.getId(), new double[] { shape.getWidth(), shape.getHeight() });
        }
        return sizes;
    }

    private static List<Bounds> positionedBounds(DiagramModel model) {
        List<Bounds> result = new ArrayList<>();
        for (Shape shape : model.getShapes()) {
            Bounds b = shape.getBoundsOrNull();
            if (b != null) {
                result.add(b);
            }
        }
        return result;
    }

    /** Union of the rectangles; an empty box at the margin when there are none. */
    private static Bounds unionOf(List<Bounds> bounds) {
        Bounds result = null;
        for (Bounds b : bounds) {
            result = result == null ? b : result.union(b);
        }
        return result != null ? result
                : new Bounds(LayoutConstants.DIAGRAM_MARGIN, LayoutConstants.DIAGRAM_MARGIN, 0, 0);
    }

    /**
     * Rectangles placed so far, grouped by the space they compete for:
     * children of a sub-container collide with their siblings only,
     * everything else with the other top-level shapes.
     */
    private static final class Obstacles {

        private final List<Bounds> topLevel = new ArrayList<>();
        private final Map<String, List<Bounds>> nested = new HashMap<>();

        static Obstacles of(DiagramModel model, Map<String, ParentRef> parents) {
            Obstacles obstacles = new Obstacles();
            for (Shape shape : model.getShapes()) {
                Bounds b = shape.getBoundsOrNull();
                if (b != null) {
                    obstacles.around(shape, parents).add(b);
                }
            }
            return obstacles;
        }

        static String containerIdOf(Shape shape, Map<String, ParentRef> parents) {
            ParentRef parent = parents.get(shape.getId());
            return parent != null && parent.getKind() == ParentRef.Kind.SUB_CONTAINER ? parent.getId() : null;
        }

        /** The live list the shape has to stay clear of. */
        List<Bounds> around(Shape shape, Map<String, ParentRef> parents) {
            String containerId = containerIdOf(shape, parents);
            return containerId == null ? topLevel : nested.computeIfAbsent(containerId, k -> new ArrayList<>());
        }
    }
}
