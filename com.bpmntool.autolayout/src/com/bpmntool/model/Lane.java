package com.bpmntool.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A lane inside a pool. Member shape ids are kept in declaration order.
 */
public class Lane {

    private final String id;
    private String name;
    private String poolId;

    private Double x;
    private Double y;
    private Double width;
    private Double height;

    private final List<String> memberIds = new ArrayList<>();

    public Lane(String id, String poolId) {
        this.id = id;
        this.poolId = poolId;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getPoolId() {
        return poolId;
    }

    public void setPoolId(String poolId) {
        this.poolId = poolId;
    }

    public Double getX() {
        return x;
    }

    public void setX(Double x) {
        this.x = x;
    }

    public Double getY() {
        return y;
    }

    public void setY(Double y) {
        this.y = y;
    }

    public Double getWidth() {
        return width;
    }

    public void setWidth(Double width) {
        this.width = width;
    }

    public Double getHeight() {
        return height;
    }

    public void setHeight(Double height) {
        this.height = height;
    }

    public void setBounds(double x, double y, double width, double height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public List<String> getMemberIds() {
        return memberIds;
    }

    public boolean hasPosition() {
        return x != null && y != null;
    }

    /** True when position and size are all present. */
    public boolean hasCompleteBounds() {
        return x != null && y != null && width != null && height != null;
    }

    public Lane copy() {
        Lane copy = new Lane(id, poolId);
        copy.name = name;
        copy.x = x;
        copy.y = y;
        copy.width = width;
        copy.height = height;
        copy.memberIds.addAll(memberIds);
        return copy;
    }

    @Override
    public String toString() {
        return "Lane[" + id + " in " + poolId + " @ " + x + "," + y + " " + width + "x" + height + "]";
    }
}
