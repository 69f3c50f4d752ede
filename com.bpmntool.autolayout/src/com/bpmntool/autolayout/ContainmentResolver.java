package com.bpmntool.autolayout;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
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
 * Converts fully positioned, absolute shape coordinates into
 * container-relative coordinates and sizes pools and lanes around them.
 *
 * CONTAINMENT HIERARCHY:
 *
 *   canvas
 *     └── Pool                  (absolute)
 *           └── Lane            (pool-relative, after the pool header)
 *                 └── Shape     (lane-relative)
 *                       └── Sub-container child (container-relative, below its header)
 *                       └── Attached shape      (host-relative, on the bottom edge)
 *
 * Phases, in order:
 *   1. ANALYZE  : resolve a {@link ParentRef} for every shape
 *   2. SNAPSHOT : record absolute bounds before anything is converted
 *   3. NESTED   : sub-container children become container-relative, clamped,
 *                  and kept apart from each other in layout mode
 *   4. LANES    : organize lanes and laneless pools, or convert preserved
 *                  coordinates in preserve mode
 *   5. ATTACHED : boundary shapes move onto their host's bottom edge
 *   6. POOLS    : auto-placed pools re-stacked, missing geometry filled
 *   7. SIBLINGS : shapes sharing a parent never share a bounding box
 */
public class ContainmentResolver {

    private static final Logger logger = LoggerFactory.getLogger(ContainmentResolver.class);

    private final LayoutSettings settings;
    private final SwimlaneSizer sizer;
    private final OverlapAvoider overlapAvoider = new OverlapAvoider();

    public ContainmentResolver(LayoutSettings settings) {
        this(settings, new SwimlaneSizer());
    }

    public ContainmentResolver(LayoutSettings settings, SwimlaneSizer sizer) {
        this.settings = settings;
        this.sizer = sizer;
    }

    /**
     * Resolves containment for a model whose shapes all carry absolute
     * positions and sizes.
     *
     * @param model working model, modified in place
     * @param autoPlacedPools ids of pools whose position was computed rather
     *        than supplied; they are re-stacked once their size is known
     * @return the parent of every shape
     */
    public Map<String, ParentRef> resolve(DiagramModel model, Set<String> autoPlacedPools) {
        ModelIndex index = new ModelIndex(model);
        return resolve(model, autoPlacedPools, index, analyze(model, index));
    }

    /**
     * Same as {@link #resolve(DiagramModel, Set)} with lookups and parents
     * already computed for this model by the caller.
     */
    Map<String, ParentRef> resolve(DiagramModel model, Set<String> autoPlacedPools, ModelIndex index,
            Map<String, ParentRef> parents) {
        // ── 1. ANALYZE (done by the caller) ─────────────────────────────────

        // ── 2. SNAPSHOT ─────────────────────────────────────────────────────
        Map<String, Bounds> absolute = new HashMap<>();
        for (Shape shape : model.getShapes()) {
            absolute.put(shape.getId(), shape.getBounds());
        }
        boolean preserve = shouldPreserve(model);

        // ── 3. NESTED ───────────────────────────────────────────────────────
        convertSubContainerChildren(model, index, parents, absolute, !preserve);

        // ── 4. LANES ────────────────────────────────────────────────────────
        if (preserve) {
            preserveLanePositions(model, index, parents, absolute);
        } else {
            double[] extent = horizontalExtent(absolute);
            organizeLanes(model, index, parents, absolute, extent);
            positionLanelessPoolShapes(model, parents, absolute, extent[0]);
        }

        // ── 5. ATTACHED ─────────────────────────────────────────────────────
        positionAttachedShapes(model, index, parents);

        for (Shape shape : model.getShapes()) {
            shape.setParentId(parents.get(shape.getId()).getId());
        }

        // ── 6. POOLS ────────────────────────────────────────────────────────
        fillMissingSwimlaneGeometry(model, index, parents);
        restackAutoPlacedPools(model, autoPlacedPools);

        // ── 7. SIBLINGS ─────────────────────────────────────────────────────
        separateCoincidentSiblings(model, index, parents);

        return parents;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Phase 1: ANALYZE
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Resolves the container of every shape.
     *
     * Precedence:
     * - attached shapes whose host can be found → HOST
     * - an existing sub-container reference → SUB_CONTAINER
     * - membership in a lane's member list → LANE
     * - parent id naming a lane, pool or shape → LANE / POOL / SUB_CONTAINER
     * - no parent, exactly one laneless pool with a process → POOL
     * - anything else (including parent ids naming nothing) → NONE
     */
    public Map<String, ParentRef> analyze(DiagramModel model) {
        return analyze(model, new ModelIndex(model));
    }

    Map<String, ParentRef> analyze(DiagramModel model, ModelIndex index) {
        Map<String, String> laneOfMember = new HashMap<>();
        for (Lane lane : model.getLanes()) {
            for (String memberId : lane.getMemberIds()) {
                laneOfMember.putIfAbsent(memberId, lane.getId());
            }
        }

        List<Pool> lanelessPools = findLanelessPools(model);
        Pool adoptingPool = lanelessPools.size() == 1 && lanelessPools.get(0).getProcessRef() != null
                ? lanelessPools.get(0)
                : null;

        Map<String, ParentRef> parents = new LinkedHashMap<>();
        for (Shape shape : model.getShapes()) {
            String id = shape.getId();

            if (ShapeTypes.isAttached(shape.getType())) {
                String hostId = findHostId(shape, index.shapeMap());
                if (hostId != null) {
                    parents.put(id, ParentRef.host(hostId));
                    continue;
                }
                logger.warn("No host found for attached shape '{}'", id);
            }

            String containerId = subContainerIdOf(shape);
            if (containerId != null && !containerId.equals(id)) {
                if (index.hasShape(containerId)) {
                    parents.put(id, ParentRef.subContainer(containerId));
                    continue;
                }
                logger.warn("Shape '{}' refers to unknown sub-container '{}'", id, containerId);
            }

            String laneId = laneOfMember.get(id);
            if (laneId != null) {
                parents.put(id, ParentRef.lane(laneId));
                continue;
            }

            String parentId = shape.getParentId();
            if (parentId != null) {
                if (index.hasLane(parentId)) {
                    parents.put(id, ParentRef.lane(parentId));
                } else if (index.hasPool(parentId)) {
                    parents.put(id, ParentRef.pool(parentId));
                } else if (index.hasShape(parentId) && !parentId.equals(id)) {
                    parents.put(id, ParentRef.subContainer(parentId));
                } else {
                    logger.warn("Invalid parent '{}' for shape '{}', placing it on the canvas", parentId, id);
                    parents.put(id, ParentRef.none());
                }
                continue;
            }

            parents.put(id, adoptingPool != null ? ParentRef.pool(adoptingPool.getId()) : ParentRef.none());
        }
        return parents;
    }

    private static String subContainerIdOf(Shape shape) {
        if (shape.getSubContainerId() != null && !shape.getSubContainerId().isBlank()) {
            return shape.getSubContainerId();
        }
        return shape.getStringProperty(ShapeTypes.SUB_CONTAINER_REF);
    }

    /**
     * Host of an attached shape: the {@code attachedToRef} property when it
     * names a shape, otherwise the first attachable shape whose id contains,
     * or is contained in, the attached shape's id.
     */
    static String findHostId(Shape attached, Map<String, Shape> shapeIndex) {
        String ref = attached.getStringProperty(ShapeTypes.ATTACHED_TO_REF);
        if (ref != null) {
            if (shapeIndex.containsKey(ref)) {
                return ref;
            }
            logger.warn("Attached shape '{}' refers to unknown host '{}'", attached.getId(), ref);
        }

        String stripped = attached.getId().replace("Boundary", "");
        for (Shape other : shapeIndex.values()) {
            if (other == attached || !ShapeTypes.isAttachable(other.getType())) {
                continue;
            }
            if (attached.getId().contains(other.getId())
                    || (!stripped.isEmpty() && other.getId().contains(stripped))) {
                return other.getId();
            }
        }
        return null;
    }

    private static List<Pool> findLanelessPools(DiagramModel model) {
        Set<String> poolsWithLanes = new HashSet<>();
        for (Lane lane : model.getLanes()) {
            if (lane.getPoolId() != null) {
                poolsWithLanes.add(lane.getPoolId());
            }
        }
        List<Pool> result = new ArrayList<>();
        for (Pool pool : model.getPools()) {
            if (!poolsWithLanes.contains(pool.getId())) {
                result.add(pool);
            }
        }
        return result;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Phase 3a: PRESERVE (coordinate-space conversion only)
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Preserve mode applies when requested, the source carried coordinates
     * and every lane has complete bounds.
     */
    boolean shouldPreserve(DiagramModel model) {
        if (!settings.isPreserve() || !model.hasExplicitCoordinates()) {
            return false;
        }
        for (Lane lane : model.getLanes()) {
            if (!lane.hasCompleteBounds()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Absolute source coordinates become pool-relative (lanes) and
     * lane-relative (lane members); members of laneless pools become
     * pool-relative. Nothing is recomputed.
     */
    private void preserveLanePositions(DiagramModel model, ModelIndex index, Map<String, ParentRef> parents,
            Map<String, Bounds> absolute) {
        Map<String, Lane> laneAbsolute = new HashMap<>();
        for (Lane lane : model.getLanes()) {
            laneAbsolute.put(lane.getId(), lane.copy());
        }

        for (Pool pool : model.getPools()) {
            if (!pool.hasPosition()) {
                continue;
            }
            for (Lane lane : index.lanesOfPool(pool.getId())) {
                lane.setX(lane.getX() - pool.getX());
                lane.setY(lane.getY() - pool.getY());
            }
        }

        for (Shape shape : model.getShapes()) {
            ParentRef parent = parents.get(shape.getId());
            Bounds abs = absolute.get(shape.getId());
            switch (parent.getKind()) {
                case LANE: {
                    Lane lane = laneAbsolute.get(parent.getId());
                    shape.setPosition(abs.x - lane.getX(), abs.y - lane.getY());
                    break;
                }
                case POOL: {
                    Pool pool = index.pool(parent.getId());
                    if (pool.hasPosition() && index.lanesOfPool(pool.getId()).isEmpty()) {
                        shape.setPosition(abs.x - pool.getX(), abs.y - pool.getY());
                    }
                    break;
                }
                case NONE:
                case SUB_CONTAINER:
                case HOST:
                    break;
                default:
                    throw new IllegalStateException("Unhandled parent kind " + parent.getKind());
            }
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Phase 3b: LANES (layout mode)
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Horizontal extent {minX, maxX} over every shape; a default band when
     * there are no shapes.
     */
    private static double[] horizontalExtent(Map<String, Bounds> absolute) {
        if (absolute.isEmpty()) {
            return new double[] { LayoutConstants.DIAGRAM_MARGIN, 800 };
        }
        double minX = Double.MAX_VALUE;
        double maxX = -Double.MAX_VALUE;
        for (Bounds b : absolute.values()) {
            minX = Math.min(minX, b.x);
            maxX = Math.max(maxX, b.getRight());
        }
        return new double[] { minX, maxX };
    }

    /**
     * Lays lanes out inside their pools and moves lane members into them.
     *
     * - lane height: tallest member + 3 x padding, floored at
     *   {@link LayoutConstants#LANE_MIN_HEIGHT}
     * - lanes stack from y=0 after the pool header, in declared order
     * - all lanes share one width: the extent of every shape + 2 x padding
     * - member X: translated by the global minimum X
     * - member Y: remapped from the lane's original Y range into its band,
     *   keeping vertical order
     */
    private void organizeLanes(DiagramModel model, ModelIndex index, Map<String, ParentRef> parents,
            Map<String, Bounds> absolute, double[] extent) {
        if (model.getLanes().isEmpty()) {
            return;
        }
        double padding = LayoutConstants.LANE_PADDING;
        double minX = extent[0];
        double laneWidth = extent[1] - extent[0] + padding * 2;

        // Members per lane, in model order
        Map<String, List<Shape>> laneShapes = new LinkedHashMap<>();
        for (Lane lane : model.getLanes()) {
            laneShapes.put(lane.getId(), new ArrayList<>());
        }
        for (Shape shape : model.getShapes()) {
            ParentRef parent = parents.get(shape.getId());
            if (parent.getKind() == ParentRef.Kind.LANE) {
                laneShapes.get(parent.getId()).add(shape);
            }
        }

        Map<String, Double> laneHeights = new HashMap<>();
        for (Map.Entry<String, List<Shape>> entry : laneShapes.entrySet()) {
            laneHeights.put(entry.getKey(), laneHeight(entry.getValue()));
        }

        // Stack lanes per pool
        for (Map.Entry<String, List<Lane>> entry : groupLanesByPool(model, index).entrySet()) {
            List<Lane> lanes = entry.getValue();
            double poolMinHeight = LayoutConstants.POOL_MIN_HEIGHT;

            double total = 0;
            for (Lane lane : lanes) {
                total += laneHeights.get(lane.getId());
            }
            if (total < poolMinHeight && !lanes.isEmpty()) {
                // Let the last lane fill the pool's minimum height
                Lane last = lanes.get(lanes.size() - 1);
                laneHeights.put(last.getId(), laneHeights.get(last.getId()) + poolMinHeight - total);
                total = poolMinHeight;
            }

            double currentY = 0;
            for (Lane lane : lanes) {
                double height = laneHeights.get(lane.getId());
                lane.setBounds(LayoutConstants.POOL_HEADER_WIDTH, currentY, laneWidth, height);
                positionShapesInLane(laneShapes.get(lane.getId()), absolute, height, minX);
                currentY += height;
            }

            Pool pool = index.pool(entry.getKey());
            if (pool != null) {
                pool.setSize(laneWidth + LayoutConstants.POOL_HEADER_WIDTH, total);
            }
        }
    }

    private static double laneHeight(List<Shape> shapes) {
        if (shapes.isEmpty()) {
            return LayoutConstants.LANE_MIN_HEIGHT;
        }
        double maxHeight = 0;
        for (Shape shape : shapes) {
            maxHeight = Math.max(maxHeight, shape.getHeight());
        }
        return Math.max(LayoutConstants.LANE_MIN_HEIGHT, maxHeight + LayoutConstants.LANE_PADDING * 3);
    }

    /**
     * Lanes grouped by owning pool: the pool's declared lane order first,
     * then any remaining lanes of that pool in model order. Lanes without a
     * known pool are grouped by their pool id as given.
     */
    private static Map<String, List<Lane>> groupLanesByPool(DiagramModel model, ModelIndex index) {
        Map<String, List<Lane>> result = new LinkedHashMap<>();
        Set<String> assigned = new HashSet<>();

        for (Pool pool : model.getPools()) {
            List<Lane> ordered = new ArrayList<>();
            for (String laneId : pool.getLaneIds()) {
                Lane lane = index.lane(laneId);
                if (lane != null && pool.getId().equals(lane.getPoolId()) && assigned.add(lane.getId())) {
                    ordered.add(lane);
                }
            }
            for (Lane lane : index.lanesOfPool(pool.getId())) {
                if (assigned.add(lane.getId())) {
                    ordered.add(lane);
                }
            }
            if (!ordered.isEmpty()) {
                result.put(pool.getId(), ordered);
            }
        }

        for (Lane lane : model.getLanes()) {
            if (assigned.add(lane.getId())) {
                String key = lane.getPoolId() != null ? lane.getPoolId() : "";
                result.computeIfAbsent(key, k -> new ArrayList<>()).add(lane);
            }
        }
        return result;
    }

    private static void positionShapesInLane(List<Shape> shapes, Map<String, Bounds> absolute, double laneHeight,
            double minX) {
        if (shapes.isEmpty()) {
            return;
        }
        double padding = LayoutConstants.LANE_PADDING;

        double minY = Double.MAX_VALUE;
        double maxY = -Double.MAX_VALUE;
        double maxHeight = 0;
        for (Shape shape : shapes) {
            Bounds abs = absolute.get(shape.getId());
            minY = Math.min(minY, abs.y);
            maxY = Math.max(maxY, abs.y);
            maxHeight = Math.max(maxHeight, abs.height);
        }
        double range = maxY - minY;
        double usable = Math.max(laneHeight - padding * 2 - maxHeight, 0);

        for (Shape shape : shapes) {
            Bounds abs = absolute.get(shape.getId());
            double x = abs.x - minX + padding;
            double y;
            if (range > 0) {
                double normalized = (abs.y - minY) / range;
                y = padding + normalized * usable;
            } else {
                y = (laneHeight - abs.height) / 2;
            }
            shape.setPosition(x, y);
        }
    }

    /**
     * Members of pools without lanes: X translated like lane members (plus
     * the pool header), the members as a block centred vertically. The pool
     * grows when its contents would not fit.
     */
    private void positionLanelessPoolShapes(DiagramModel model, Map<String, ParentRef> parents,
            Map<String, Bounds> absolute, double minX) {
        double padding = LayoutConstants.LANE_PADDING;
        double header = LayoutConstants.POOL_HEADER_WIDTH;

        for (Pool pool : findLanelessPools(model)) {
            List<Shape> members = new ArrayList<>();
            for (Shape shape : model.getShapes()) {
                if (parents.get(shape.getId()).equals(ParentRef.pool(pool.getId()))) {
                    members.add(shape);
                }
            }
            if (members.isEmpty()) {
                continue;
            }

            Bounds block = null;
            for (Shape shape : members) {
                Bounds abs = absolute.get(shape.getId());
                block = block == null ? abs : block.union(abs);
            }

            double[] size = sizer.calculatePoolSize(pool, members);
            double width = Math.max(size[0], block.getRight() - minX + padding * 2 + header);
            double height = Math.max(size[1], block.height + padding * 2);
            pool.setSize(width, height);

            double top = (height - block.height) / 2;
            for (Shape shape : members) {
                Bounds abs = absolute.get(shape.getId());
                shape.setPosition(abs.x - minX + padding + header, top + (abs.y - block.y));
            }
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Phase 4: NESTED
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Children of a sub-container are placed relative to the container's
     * absolute origin, below its header, and clamped so they never render
     * outside it.
     *
     * With {@code separate} set, a child that would overlap an earlier
     * sibling moves to a free spot, and the container grows around any
     * child that does not fit.
     * Innermost containers go first, so a container's final size is known
     * before it is placed inside its own parent. Grown sizes are written
     * back to {@code absolute} for the lane phase.
     */
    private void convertSubContainerChildren(DiagramModel model, ModelIndex index, Map<String, ParentRef> parents,
            Map<String, Bounds> absolute, boolean separate) {
        Map<String, List<Shape>> children = new LinkedHashMap<>();
        for (Shape shape : model.getShapes()) {
            ParentRef parent = parents.get(shape.getId());
            if (parent.getKind() == ParentRef.Kind.SUB_CONTAINER) {
                children.computeIfAbsent(parent.getId(), k -> new ArrayList<>()).add(shape);
            }
        }

        Map<String, Integer> depths = new HashMap<>();
        for (String containerId : children.keySet()) {
            depths.put(containerId, nestingDepth(containerId, parents));
        }
        List<String> containerIds = new ArrayList<>(children.keySet());
        containerIds.sort((a, b) -> Integer.compare(depths.get(b), depths.get(a)));

        double header = LayoutConstants.SUB_CONTAINER_HEADER;
        for (String containerId : containerIds) {
            Shape container = index.shape(containerId);
            Bounds origin = absolute.get(containerId);
            double width = container.getWidth();
            double height = container.getHeight();

            List<Bounds> placed = new ArrayList<>();
            for (Shape shape : children.get(containerId)) {
                Bounds child = absolute.get(shape.getId());
                double x = child.x - origin.x;
                double y = child.y - origin.y - header;
                Bounds relative = clampIntoContainer(new Bounds(x, y, shape.getWidth(), shape.getHeight()), width,
                        height);
                if (separate) {
                    if (collides(relative, placed)) {
                        relative = freeSpotAmong(relative, placed);
                    }
                    // also covers children larger than the container
                    width = Math.max(width, relative.getRight());
                    height = Math.max(height, relative.getBottom() + header);
                }
                shape.setPosition(relative.x, relative.y);
                placed.add(relative);
            }

            if (width != container.getWidth() || height != container.getHeight()) {
                logger.debug("Sub-container '{}' grows to {} x {} to keep its children apart", containerId, width,
                        height);
                container.setSize(width, height);
                absolute.put(containerId, new Bounds(origin.x, origin.y, width, height));
            }
        }
    }

    /** Number of sub-containers above the given one, capped on cyclic references. */
    private static int nestingDepth(String containerId, Map<String, ParentRef> parents) {
        int depth = 0;
        ParentRef parent = parents.get(containerId);
        while (parent != null && parent.getKind() == ParentRef.Kind.SUB_CONTAINER && depth < parents.size()) {
            depth++;
            parent = parents.get(parent.getId());
        }
        return depth;
    }

    private static boolean collides(Bounds bounds, List<Bounds> placed) {
        return OverlapAvoider.totalOverlap(bounds, placed) > 0 || placed.contains(bounds);
    }

    /**
     * A spot near the candidate that overlaps no placed sibling: the overlap
     * search first, else a new row beneath every sibling.
     */
    private Bounds freeSpotAmong(Bounds candidate, List<Bounds> placed) {
        Bounds free = overlapAvoider.findFreeSpot(candidate, placed);
        if (!collides(free, placed)) {
            return free;
        }
        double bottom = 0;
        for (Bounds b : placed) {
            bottom = Math.max(bottom, b.getBottom());
        }
        return candidate.moveTo(0, bottom + LayoutConstants.SUB_CONTAINER_PADDING);
    }

    private static Bounds clampIntoContainer(Bounds child, double containerWidth, double containerHeight) {
        double maxX = containerWidth - child.width;
        double maxY = containerHeight - LayoutConstants.SUB_CONTAINER_HEADER - child.height;
        double x = Math.max(0, Math.min(child.x, maxX));
        double y = Math.max(0, Math.min(child.y, maxY));
        return child.moveTo(x, y);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Phase 5: ATTACHED
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Attached shapes sit on the bottom edge of their host, spread out
     * sideways by a per-host running index.
     */
    private void positionAttachedShapes(DiagramModel model, ModelIndex index, Map<String, ParentRef> parents) {
        Map<String, Integer> countPerHost = new HashMap<>();
        for (Shape shape : model.getShapes()) {
            ParentRef parent = parents.get(shape.getId());
            if (parent.getKind() != ParentRef.Kind.HOST) {
                continue;
            }
            Shape host = index.shape(parent.getId());
            int slot = countPerHost.merge(parent.getId(), 1, Integer::sum) - 1;

            double x = LayoutConstants.ATTACHED_OFFSET_X + slot * LayoutConstants.ATTACHED_SPACING;
            double y = host.getHeight() - shape.getHeight() / 2;
            shape.setPosition(x, y);
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Phase 6: POOLS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Pools still missing a size are sized around their members; lanes still
     * missing geometry get an even share of their pool.
     */
    private void fillMissingSwimlaneGeometry(DiagramModel model, ModelIndex index, Map<String, ParentRef> parents) {
        for (Pool pool : model.getPools()) {
            if (!pool.hasSize()) {
                List<Shape> members = new ArrayList<>();
                for (Shape shape : model.getShapes()) {
                    ParentRef parent = parents.get(shape.getId());
                    if (parent.equals(ParentRef.pool(pool.getId()))) {
                        members.add(shape);
                    }
                }
                double[] size = sizer.calculatePoolSize(pool, members);
                pool.setSize(size[0], size[1]);
            }

            List<Lane> lanes = index.lanesOfPool(pool.getId());
            boolean incomplete = false;
            for (Lane lane : lanes) {
                incomplete |= !lane.hasCompleteBounds();
            }
            if (incomplete) {
                Map<String, Bounds> sizes = sizer.calculateLaneSizes(pool, lanes);
                for (Lane lane : lanes) {
                    Bounds b = sizes.get(lane.getId());
                    if (lane.getX() == null) {
                        lane.setX(b.x);
                    }
                    if (lane.getY() == null) {
                        lane.setY(b.y);
                    }
                    if (lane.getWidth() == null) {
                        lane.setWidth(b.width);
                    }
                    if (lane.getHeight() == null) {
                        lane.setHeight(b.height);
                    }
                }
            }
        }
    }

    /**
     * Pools whose position was computed are stacked again beneath the
     * explicitly positioned ones now that their final height is known.
     */
    private void restackAutoPlacedPools(DiagramModel model, Set<String> autoPlacedPools) {
        if (autoPlacedPools.isEmpty()) {
            return;
        }
        double currentY = LayoutConstants.DIAGRAM_MARGIN;
        boolean anyExplicit = false;
        for (Pool pool : model.getPools()) {
            if (!autoPlacedPools.contains(pool.getId()) && pool.hasPosition()) {
                double bottom = pool.getY() + (pool.getHeight() != null ? pool.getHeight()
                        : LayoutConstants.POOL_DEFAULT_HEIGHT);
                currentY = anyExplicit ? Math.max(currentY, bottom) : bottom;
                anyExplicit = true;
            }
        }
        if (anyExplicit) {
            currentY += LayoutConstants.POOL_GAP;
        }

        for (Pool pool : model.getPools()) {
            if (autoPlacedPools.contains(pool.getId())) {
                pool.setPosition(LayoutConstants.DIAGRAM_MARGIN, currentY);
                currentY += pool.getHeight() + LayoutConstants.POOL_GAP;
            }
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Phase 7: SIBLINGS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Nudges a shape that would share its exact bounding box with an earlier
     * sibling, alternating right and down, staying inside sub-containers.
     */
    private void separateCoincidentSiblings(DiagramModel model, ModelIndex index, Map<String, ParentRef> parents) {
        Map<ParentRef, List<Shape>> siblings = new LinkedHashMap<>();
        for (Shape shape : model.getShapes()) {
            siblings.computeIfAbsent(parents.get(shape.getId()), k -> new ArrayList<>()).add(shape);
        }

        for (Map.Entry<ParentRef, List<Shape>> entry : siblings.entrySet()) {
            List<Shape> group = entry.getValue();
            if (group.size() < 2) {
                continue;
            }
            Bounds container = null;
            if (entry.getKey().getKind() == ParentRef.Kind.SUB_CONTAINER) {
                container = index.shape(entry.getKey().getId()).getBounds();
            }

            Set<Bounds> seen = new HashSet<>();
            int maxSteps = group.size() * 4 + 4;
            for (Shape shape : group) {
                Bounds original = shape.getBounds();
                Bounds b = original;
                int step = 0;
                while (seen.contains(b) && step < maxSteps) {
                    step++;
                    double offset = ((step + 1) / 2) * LayoutConstants.COINCIDENT_NUDGE;
                    b = step % 2 == 1
                            ? original.moveTo(original.x + offset, original.y)
                            : original.moveTo(original.x, original.y + offset);
                    if (container != null) {
                        b = clampIntoContainer(b, container.width, container.height);
                    }
                }
                if (seen.contains(b)) {
                    logger.debug("Could not separate '{}' from a sibling with identical bounds", shape.getId());
                } else if (!b.equals(original)) {
                    shape.setPosition(b.x, b.y);
                }
                seen.add(b);
            }
        }
    }
}
