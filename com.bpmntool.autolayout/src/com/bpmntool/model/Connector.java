package com.bpmntool.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A directed connection between two shapes (sequence flow, message flow,
 * association). The layout engine only reads connectors.
 */
public class Connector {

    public static final String SEQUENCE_FLOW = "sequenceFlow";
    public static final String MESSAGE_FLOW = "messageFlow";
    public static final String ASSOCIATION = "association";

    private final String id;
    private final String kind;
    private final String sourceId;
    private final String targetId;
    private String name;
    private final List<Waypoint> waypoints = new ArrayList<>();

    public Connector(String id, String kind, String sourceId, String targetId) {
        this.id = id;
        this.kind = kind;
        this.sourceId = sourceId;
        this.targetId = targetId;
    }

    public String getId() {
        return id;
    }

    public String getKind() {
        return kind;
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getTargetId() {
        return targetId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<Waypoint> getWaypoints() {
        return waypoints;
    }

    public boolean hasWaypoints() {
        return !waypoints.isEmpty();
    }

    public Connector copy() {
        Connector copy = new Connector(id, kind, sourceId, targetId);
        copy.name = name;
        copy.waypoints.addAll(waypoints);
        return copy;
    }

    @Override
    public String toString() {
        return kind + "[" + id + ": " + sourceId + " -> " + targetId + "]";
    }
}
