package com.bpmntool.autolayout;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Brings raw layout positions into the diagram convention: origin at
 * {@link LayoutConstants#DIAGRAM_MARGIN}, pixels, Y growing downward.
 */
public class CoordinateNormalizer {

    public Map<String, double[]> normalize(RawLayout raw) {
        return normalize(raw.getPositions(), raw.isYAxisUp(), raw.isForeignUnits());
    }

    /**
     * @param positions node id to {x, y}
     * @param flipY invert Y as {@code maxY - y}; for tools whose Y grows upward
     * @param applyScale multiply by {@link LayoutConstants#SCALE_X} /
     *        {@link LayoutConstants#SCALE_Y}; for tools using another unit
     * @return normalized positions, in the iteration order of the input
     */
    public Map<String, double[]> normalize(Map<String, double[]> positions, boolean flipY, boolean applyScale) {
        Map<String, double[]> normalized = new LinkedHashMap<>();
        if (positions.isEmpty()) {
            return normalized;
        }

        double minX = Double.MAX_VALUE;
        double minY = Double.MAX_VALUE;
        double maxY = -Double.MAX_VALUE;
        for (double[] p : positions.values()) {
            minX = Math.min(minX, p[0]);
            minY = Math.min(minY, p[1]);
            maxY = Math.max(maxY, p[1]);
        }

        double scaleX = applyScale ? LayoutConstants.SCALE_X : 1;
        double scaleY = applyScale ? LayoutConstants.SCALE_Y : 1;

        for (Map.Entry<String, double[]> entry : positions.entrySet()) {
            double[] p = entry.getValue();
            double x = (p[0] - minX) * scaleX + LayoutConstants.DIAGRAM_MARGIN;
            double dy = flipY ? maxY - p[1] : p[1] - minY;
            double y = dy * scaleY + LayoutConstants.DIAGRAM_MARGIN;
            normalized.put(entry.getKey(), new double[] { x, y });
        }
        return normalized;
    }
}
