package com.bpmntool.autolayout;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unnormalized node positions as produced by a layout strategy, together
 * with the coordinate conventions they are expressed in.
 */
public class RawLayout {

    private final Map<String, double[]> positions;
    private final boolean yAxisUp;
    private final boolean foreignUnits;

    /**
     * @param positions node id to {x, y} (top-left corner)
     * @param yAxisUp true when Y grows upward and must be flipped
     * @param foreignUnits true when values are not in pixels and must be scaled
     */
    public RawLayout(Map<String, double[]> positions, boolean yAxisUp, boolean foreignUnits) {
        this.positions = Collections.unmodifiableMap(new LinkedHashMap<>(positions));
        this.yAxisUp = yAxisUp;
        this.foreignUnits = foreignUnits;
    }

    /** Positions already in pixels with Y growing downward. */
    public static RawLayout pixels(Map<String, double[]> positions) {
        return new RawLayout(positions, false, false);
    }

    public Map<String, double[]> getPositions() {
        return positions;
    }

    public boolean isYAxisUp() {
        return yAxisUp;
    }

    public boolean isForeignUnits() {
        return foreignUnits;
    }

    public boolean isEmpty() {
        return positions.isEmpty();
    }
}
