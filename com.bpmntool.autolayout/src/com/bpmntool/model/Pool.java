package com.bpmntool.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A pool (participant). Owns an ordered list of lanes and optionally refers
 * to the process it contains.
 */
public class Pool {

    private final String id;
    private String name;
    private String processRef;

    private Double x;
    private Double y;
    private Double width;
    private Double height;

    private final List<String> laneIds = new ArrayList<>();
    private boolean horizontal = true;

    public Pool(String id) {
        this.id = id;
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

    public String getProcessRef() {
        return processRef;
    }

    public void setProcessRef(String processRef) {
        this.processRef = processRef;
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

    public void setPosition(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public void setSize(double width, double height) {
        this.width = width;
        this.height = height;
    }

    public List<String> getLaneIds() {
        return laneIds;
    }

    public boolean isHorizontal() {
        return horizontal;
    }

    public void setHorizontal(boolean horizontal) {
        this.horizontal = horizontal;
    }

    public boolean hasPosition() {
        return x != null && y != null;
    }

    public boolean hasSize() {
        return width != null && height != null;
    }

    public Pool copy() {
        Pool copy = new Pool(id);
        copy.name = name;
        copy.processRef = processRef;
        copy.x = x;
        copy.y = y;
        copy.width = width;
        copy.height = height;
        copy.laneIds.addAll(laneIds);
        copy.horizontal = horizontal;
        return copy;
    }

    @Override
    public String toString() {
        return "Pool[" + id + " @ " + x + "," + y + " " + width + "x" + height + "]";
    }
}
