package com.bpmntool.autolayout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.bpmntool.model.DiagramModel;
import com.bpmntool.model.Lane;
import com.bpmntool.model.Pool;
import com.bpmntool.model.Shape;

/**
 * Id lookup tables over one working model, built once per resolution call.
 *
 * Only element identity is indexed, so positions and sizes may change
 * freely afterwards. Adding or removing elements invalidates the index.
 * When ids repeat, the first element in model order wins.
 */
final class ModelIndex {

    private final Map<String, Shape> shapes = new LinkedHashMap<>();
    private final Map<String, Lane> lanes = new HashMap<>();
    private final Map<String, Pool> pools = new HashMap<>();
    private final Map<String, List<Lane>> lanesByPool = new HashMap<>();

    ModelIndex(DiagramModel model) {
        for (Shape shape : model.getShapes()) {
            shapes.putIfAbsent(shape.getId(), shape);
        }
        for (Pool pool : model.getPools()) {
            pools.putIfAbsent(pool.getId(), pool);
        }
        for (Lane lane : model.getLanes()) {
            lanes.putIfAbsent(lane.getId(), lane);
            if (lane.getPoolId() != null) {
                lanesByPool.computeIfAbsent(lane.getPoolId(), k -> new ArrayList<>()).add(lane);
            }
        }
    }

    Shape shape(String id) {
        return shapes.get(id);
    }

    Lane lane(String id) {
        return lanes.get(id);
    }

    Pool pool(String id) {
        return pools.get(id);
    }

    boolean hasShape(String id) {
        return shapes.containsKey(id);
    }

    boolean hasLane(String id) {
        return lanes.containsKey(id);
    }

    boolean hasPool(String id) {
        return pools.containsKey(id);
    }

    /** Lanes of a pool in model order; empty when it has none. */
    List<Lane> lanesOfPool(String poolId) {
        List<Lane> result = lanesByPool.get(poolId);
        return result != null ? Collections.unmodifiableList(result) : Collections.emptyList();
    }

    /** Shapes by id, in model order. */
    Map<String, Shape> shapeMap() {
        return Collections.unmodifiableMap(shapes);
    }
}
