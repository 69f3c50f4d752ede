package com.bpmntool.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A typed diagram shape (task, event, gateway, data object, ...).
 *
 * Position and size are optional: a shape parsed from a source without
 * diagram interchange data carries no coordinates until the layout engine
 * resolves them. Once resolved, x and y are relative to the shape's
 * immediate container.
 */
public class Shape {

    private final String id;
    private final String type;
    private String name;

    private Double x;
    private Double y;
    private Double width;
    private Double height;

    /** Lane, pool, sub-container or host the shape belongs to */
    private String parentId;
    /** Sub-container (collapsible sub-process) this shape is drawn inside */
    private String subContainerId;

    private final Map<String, Object> properties = new LinkedHashMap<>();

    public Shape(String id, String type) {
        this.id = id;
        this.type = type;
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
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

    public String getParentId() {
        return parentId;
    }

    public void setParentId(String parentId) {
        this.parentId = parentId;
    }

    public String getSubContainerId() {
        return subContainerId;
    }

    public void setSubContainerId(String subContainerId) {
        this.subContainerId = subContainerId;
    }

    public Map<String, Object> getProperties() {
        return properties;
    }

    /**
     * Returns a string property, or null when absent or blank.
     */
    public String getStringProperty(String key) {
        Object value = properties.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }

    public boolean hasPosition() {
        return x != null && y != null;
    }

    public boolean hasSize() {
        return width != null && height != null;
    }

    /**
     * Current bounds of the shape. Only valid once position and size are set.
     */
    public Bounds getBounds() {
        if (!hasPosition() || !hasSize()) {
            throw new IllegalStateException("Shape '" + id + "' has no complete bounds");
        }
        return new Bounds(x, y, width, height);
    }

    public Bounds getBoundsOrNull() {
        return hasPosition() && hasSize() ? new Bounds(x, y, width, height) : null;
    }

    /**
     * Deep copy. Property values are copied by reference; they are treated as
     * immutable by the layout engine.
     */
    public Shape copy() {
        Shape copy = new Shape(id, type);
        copy.name = name;
        copy.x = x;
        copy.y = y;
        copy.width = width;
        copy.height = height;
        copy.parentId = parentId;
        copy.subContainerId = subContainerId;
        copy.properties.putAll(properties);
        return copy;
    }

    @Override
    public String toString() {
        return type + "[" + id + " @ " + x + "," + y + " " + width + "x" + height + "]";
    }
}
