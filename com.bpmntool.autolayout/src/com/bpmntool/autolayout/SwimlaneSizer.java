package com.bpmntool.autolayout;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.bpmntool.model.Bounds;
import com.bpmntool.model.Lane;
import com.bpmntool.model.Pool;
import com.bpmntool.model.Shape;

/**
 * Calculates pool and lane rectangles from their contents.
 */
public class SwimlaneSizer {

    private final double padding;
    private final double poolHeaderWidth;

    public SwimlaneSizer() {
        this(LayoutConstants.LANE_PADDING);
    }

    public SwimlaneSizer(double padding) {
        this.padding = padding;
        this.poolHeaderWidth = LayoutConstants.POOL_HEADER_WIDTH;
    }

    /**
     * Size that contains all positioned shapes plus padding and the pool
     * header, floored at {@link LayoutConstants#POOL_MIN_WIDTH} x
     * {@link LayoutConstants#POOL_MIN_HEIGHT}. An explicitly sized pool keeps
     * its size.
     *
     * @return {width, height}
     */
    public double[] calculatePoolSize(Pool pool, List<Shape> shapes) {
        if (pool.hasSize() && pool.getWidth() > 0 && pool.getHeight() > 0) {
            return new double[] { pool.getWidth(), pool.getHeight() };
        }

        double minX = Double.MAX_VALUE;
        double minY = Double.MAX_VALUE;
        double maxX = -Double.MAX_VALUE;
        double maxY = -Double.MAX_VALUE;

        for (Shape shape : shapes) {
            if (!shape.hasPosition()) {
                continue;
            }
            double w = shape.getWidth() != null ? shape.getWidth() : 120;
            double h = shape.getHeight() != null ? shape.getHeight() : 80;
            minX = Math.min(minX, shape.getX());
            minY = Math.min(minY, shape.getY());
            maxX = Math.max(maxX, shape.getX() + w);
            maxY = Math.max(maxY, shape.getY() + h);
        }

        double width;
        double height;
        if (minX == Double.MAX_VALUE) {
            width = LayoutConstants.POOL_DEFAULT_WIDTH;
            height = LayoutConstants.POOL_DEFAULT_HEIGHT;
        } else {
            width = maxX - minX + padding * 2 + poolHeaderWidth;
            height = maxY - minY + padding * 2;
        }

        return new double[] {
                Math.max(width, LayoutConstants.POOL_MIN_WIDTH),
                Math.max(height, LayoutConstants.POOL_MIN_HEIGHT) };
    }

    /**
     * Rectangles (pool-relative) for each lane: the pool height is split
     * evenly, lanes with explicit dimensions keep them, and every lane starts
     * after the pool header.
     */
    public Map<String, Bounds> calculateLaneSizes(Pool pool, List<Lane> lanes) {
        Map<String, Bounds> result = new LinkedHashMap<>();
        if (lanes.isEmpty()) {
            return result;
        }

        double poolWidth = pool.getWidth() != null ? pool.getWidth() : LayoutConstants.POOL_DEFAULT_WIDTH;
        double poolHeight = pool.getHeight() != null ? pool.getHeight() : LayoutConstants.POOL_DEFAULT_HEIGHT;

        double laneWidth = poolWidth - poolHeaderWidth;
        double laneHeight = poolHeight / lanes.size();

        double yOffset = 0;
        for (Lane lane : lanes) {
            if (lane.getWidth() != null && lane.getHeight() != null) {
                result.put(lane.getId(), new Bounds(poolHeaderWidth, yOffset, lane.getWidth(), lane.getHeight()));
            } else {
                result.put(lane.getId(), new Bounds(poolHeaderWidth, yOffset, laneWidth, laneHeight));
            }
            yOffset += laneHeight;
        }
        return result;
    }
}
