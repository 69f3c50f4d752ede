package com.bpmntool.autolayout;

import java.util.Locale;

/**
 * How positions are produced for a diagram.
 */
public enum LayoutMode {

    /** Compute missing positions, delegating to an external hierarchical layout tool when one is available */
    USE_EXTERNAL_TOOL,

    /** Keep upstream coordinates and only convert them between coordinate spaces */
    PRESERVE;

    /**
     * Parses a mode name. {@code graphviz}, {@code elk} and {@code external}
     * all select {@link #USE_EXTERNAL_TOOL}.
     */
    public static LayoutMode fromCode(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        switch (normalized) {
            case "graphviz":
            case "elk":
            case "external":
            case "use-external-tool":
                return USE_EXTERNAL_TOOL;
            case "preserve":
                return PRESERVE;
            default:
                throw new IllegalArgumentException("Unknown layout mode '" + value
                        + "', expected one of graphviz, elk, external, preserve");
        }
    }
}
