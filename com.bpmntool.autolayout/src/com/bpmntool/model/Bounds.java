package com.bpmntool.model;

/**
 * Immutable axis-aligned rectangle.
 */
public final class Bounds {

    public final double x, y, width, height;

    public Bounds(double x, double y, double width, double height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public double getRight() {
        return x + width;
    }

    public double getBottom() {
        return y + height;
    }

    public double getCenterX() {
        return x + width / 2.0;
    }

    public double getCenterY() {
        return y + height / 2.0;
    }

    public Bounds moveTo(double newX, double newY) {
        return new Bounds(newX, newY, width, height);
    }

    /**
     * Strict intersection test: rectangles that only touch along an edge do
     * not intersect.
     */
    public boolean intersects(Bounds other) {
        return x < other.getRight() && other.x < getRight()
                && y < other.getBottom() && other.y < getBottom();
    }

    /** Area of the intersection with another rectangle, 0 when disjoint. */
    public double overlapArea(Bounds other) {
        double w = Math.min(getRight(), other.getRight()) - Math.max(x, other.x);
        double h = Math.min(getBottom(), other.getBottom()) - Math.max(y, other.y);
        return w > 0 && h > 0 ? w * h : 0;
    }

    /** Smallest rectangle covering both. */
    public Bounds union(Bounds other) {
        double minX = Math.min(x, other.x);
        double minY = Math.min(y, other.y);
        double maxX = Math.max(getRight(), other.getRight());
        double maxY = Math.max(getBottom(), other.getBottom());
        return new Bounds(minX, minY, maxX - minX, maxY - minY);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Bounds)) {
            return false;
        }
        Bounds other = (Bounds) obj;
        return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0
                && Double.compare(width, other.width) == 0 && Double.compare(height, other.height) == 0;
    }

    @Override
    public int hashCode() {
        int result = Double.hashCode(x);
        result = 31 * result + Double.hashCode(y);
        result = 31 * result + Double.hashCode(width);
        result = 31 * result + Double.hashCode(height);
        return result;
    }

    @Override
    public String toString() {
        return "Bounds[" + x + "," + y + " " + width + "x" + height + "]";
    }
}
