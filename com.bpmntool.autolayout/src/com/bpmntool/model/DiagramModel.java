package com.bpmntool.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A complete parsed process diagram: shapes, connectors, pools and lanes.
 *
 * Built by a parser, consumed by the layout engine, handed to a serializer.
 * The layout engine works on a {@link #copy()} and never mutates the
 * instance it is given.
 */
public class DiagramModel {

    private final List<Shape> shapes = new ArrayList<>();
    private final List<Connector> connectors = new ArrayList<>();
    private final List<Pool> pools = new ArrayList<>();
    private final List<Lane> lanes = new ArrayList<>();

    /** True when the source carried diagram interchange coordinates for any shape */
    private boolean hasExplicitCoordinates;

    private String processId;
    private String processName;

    public List<Shape> getShapes() {
        return shapes;
    }

    public List<Connector> getConnectors() {
        return connectors;
    }

    public List<Pool> getPools() {
        return pools;
    }

    public List<Lane> getLanes() {
        return lanes;
    }

    public boolean hasExplicitCoordinates() {
        return hasExplicitCoordinates;
    }

    public void setHasExplicitCoordinates(boolean hasExplicitCoordinates) {
        this.hasExplicitCoordinates = hasExplicitCoordinates;
    }

    public String getProcessId() {
        return processId;
    }

    public void setProcessId(String processId) {
        this.processId = processId;
    }

    public String getProcessName() {
        return processName;
    }

    public void setProcessName(String processName) {
        this.processName = processName;
    }

    public Shape addShape(Shape shape) {
        shapes.add(shape);
        return shape;
    }

    public Connector addConnector(Connector connector) {
        connectors.add(connector);
        return connector;
    }

    public Pool addPool(Pool pool) {
        pools.add(pool);
        return pool;
    }

    public Lane addLane(Lane lane) {
        lanes.add(lane);
        return lane;
    }

    /** Linear scan; callers looking up many ids should index the model first. */
    public Shape getShape(String id) {
        for (Shape shape : shapes) {
            if (shape.getId().equals(id)) {
                return shape;
            }
        }
        return null;
    }

    public Pool getPool(String id) {
        for (Pool pool : pools) {
            if (pool.getId().equals(id)) {
                return pool;
            }
        }
        return null;
    }

    public Lane getLane(String id) {
        for (Lane lane : lanes) {
            if (lane.getId().equals(id)) {
                return lane;
            }
        }
        return null;
    }

    public List<Lane> getLanesOfPool(String poolId) {
        List<Lane> result = new ArrayList<>();
        for (Lane lane : lanes) {
            if (poolId.equals(lane.getPoolId())) {
                result.add(lane);
            }
        }
        return result;
    }

    public List<Connector> getOutgoing(String shapeId) {
        List<Connector> result = new ArrayList<>();
        for (Connector connector : connectors) {
            if (connector.getSourceId().equals(shapeId)) {
                result.add(connector);
            }
        }
        return result;
    }

    public List<Connector> getIncoming(String shapeId) {
        List<Connector> result = new ArrayList<>();
        for (Connector connector : connectors) {
            if (connector.getTargetId().equals(shapeId)) {
                result.add(connector);
            }
        }
        return result;
    }

    public List<Shape> getShapesOfType(String type) {
        List<Shape> result = new ArrayList<>();
        for (Shape shape : shapes) {
            if (shape.getType().equals(type)) {
                result.add(shape);
            }
        }
        return result;
    }

    /**
     * Deep copy of the whole model. Mutating the copy never affects this
     * instance.
     */
    public DiagramModel copy() {
        DiagramModel copy = new DiagramModel();
        for (Shape shape : shapes) {
            copy.shapes.add(shape.copy());
        }
        for (Connector connector : connectors) {
            copy.connectors.add(connector.copy());
        }
        for (Pool pool : pools) {
            copy.pools.add(pool.copy());
        }
        for (Lane lane : lanes) {
            copy.lanes.add(lane.copy());
        }
        copy.hasExplicitCoordinates = hasExplicitCoordinates;
        copy.processId = processId;
        copy.processName = processName;
        return copy;
    }
}
