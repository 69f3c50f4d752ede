package com.bpmntool.autolayout;

import java.util.Map;
import java.util.Properties;

/**
 * Settings consumed by the layout engine: layout mode, flow direction and the
 * width at which neighbour placement wraps to a new row.
 *
 * Loading settings from files or command lines belongs to the caller; this
 * class only interprets already-loaded key/value pairs.
 */
public final class LayoutSettings {

    public static final String KEY_MODE = "layout.mode";
    public static final String KEY_DIRECTION = "layout.direction";
    public static final String KEY_WRAP_WIDTH = "layout.wrapWidth";

    public static final String ENV_LAYOUT = "BPMNTOOL_LAYOUT";
    public static final String ENV_DIRECTION = "BPMNTOOL_DIRECTION";

    /** Default width of the drawing area before neighbour placement wraps */
    public static final double DEFAULT_WRAP_WIDTH = 1600;

    private final LayoutMode mode;
    private final FlowDirection direction;
    private final double wrapWidth;

    private LayoutSettings(Builder builder) {
        this.mode = builder.mode;
        this.direction = builder.direction;
        this.wrapWidth = builder.wrapWidth;
    }

    public LayoutMode getMode() {
        return mode;
    }

    public FlowDirection getDirection() {
        return direction;
    }

    public double getWrapWidth() {
        return wrapWidth;
    }

    public boolean isPreserve() {
        return mode == LayoutMode.PRESERVE;
    }

    public static LayoutSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder().mode(mode).direction(direction).wrapWidth(wrapWidth);
    }

    /**
     * Reads {@code layout.mode}, {@code layout.direction} and
     * {@code layout.wrapWidth}; absent keys keep their defaults.
     *
     * @throws IllegalArgumentException for unknown modes, directions or a
     *         non-positive wrap width
     */
    public static LayoutSettings fromProperties(Properties properties) {
        Builder builder = builder();
        String mode = properties.getProperty(KEY_MODE);
        if (mode != null && !mode.isBlank()) {
            builder.mode(LayoutMode.fromCode(mode));
        }
        String direction = properties.getProperty(KEY_DIRECTION);
        if (direction != null && !direction.isBlank()) {
            builder.direction(FlowDirection.fromCode(direction));
        }
        String wrapWidth = properties.getProperty(KEY_WRAP_WIDTH);
        if (wrapWidth != null && !wrapWidth.isBlank()) {
            try {
                builder.wrapWidth(Double.parseDouble(wrapWidth.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + KEY_WRAP_WIDTH + " '" + wrapWidth + "'", e);
            }
        }
        return builder.build();
    }

    /**
     * Overlays {@code BPMNTOOL_LAYOUT} and {@code BPMNTOOL_DIRECTION} from an
     * environment map (typically {@link System#getenv()}) on these settings.
     */
    public LayoutSettings withEnvironment(Map<String, String> environment) {
        Builder builder = toBuilder();
        String layout = environment.get(ENV_LAYOUT);
        if (layout != null && !layout.isBlank()) {
            builder.mode(LayoutMode.fromCode(layout));
        }
        String direction = environment.get(ENV_DIRECTION);
        if (direction != null && !direction.isBlank()) {
            builder.direction(FlowDirection.fromCode(direction));
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return "LayoutSettings[mode=" + mode + ", direction=" + direction.getCode() + ", wrapWidth=" + wrapWidth + "]";
    }

    public static final class Builder {

        private LayoutMode mode = LayoutMode.USE_EXTERNAL_TOOL;
        private FlowDirection direction = FlowDirection.LEFT_TO_RIGHT;
        private double wrapWidth = DEFAULT_WRAP_WIDTH;

        private Builder() {
        }

        public Builder mode(LayoutMode mode) {
            if (mode == null) {
                throw new IllegalArgumentException("Layout mode must not be null");
            }
            this.mode = mode;
            return this;
        }

        public Builder direction(FlowDirection direction) {
            if (direction == null) {
                throw new IllegalArgumentException("Flow direction must not be null");
            }
            this.direction = direction;
            return this;
        }

        public Builder wrapWidth(double wrapWidth) {
            if (!(wrapWidth > 0)) {
                throw new IllegalArgumentException("Wrap width must be positive: " + wrapWidth);
            }
            this.wrapWidth = wrapWidth;
            return this;
        }

        public LayoutSettings build() {
            return new LayoutSettings(this);
        }
    }
}
