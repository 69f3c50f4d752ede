package com.bpmntool.autolayout;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Direction in which the process flows across the canvas.
 */
public enum FlowDirection {

    LEFT_TO_RIGHT("LR"),
    TOP_TO_BOTTOM("TB"),
    RIGHT_TO_LEFT("RL"),
    BOTTOM_TO_TOP("BT");

    private final String code;

    FlowDirection(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /** Horizontal flows advance ranks along X, vertical flows along Y. */
    public boolean isHorizontal() {
        return this == LEFT_TO_RIGHT || this == RIGHT_TO_LEFT;
    }

    /** Right-to-left and bottom-to-top walk the ranks backwards. */
    public boolean isReversed() {
        return this == RIGHT_TO_LEFT || this == BOTTOM_TO_TOP;
    }

    /**
     * Parses a two-letter code (LR, TB, RL, BT) or the constant name,
     * case-insensitively.
     */
    public static FlowDirection fromCode(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (FlowDirection direction : values()) {
            if (direction.code.equals(normalized) || direction.name().equals(normalized)) {
                return direction;
            }
        }
        String accepted = Arrays.stream(values()).map(FlowDirection::getCode).collect(Collectors.joining(", "));
        throw new IllegalArgumentException("Unknown flow direction '" + value + "', expected one of " + accepted);
    }
}
