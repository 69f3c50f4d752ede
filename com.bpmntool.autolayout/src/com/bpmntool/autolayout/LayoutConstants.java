package com.bpmntool.autolayout;

/**
 * Fixed spacing and sizing constants shared by the layout phases, in pixels
 * unless noted otherwise.
 */
public final class LayoutConstants {

    // ═══════════════════════════════════════════════════════════════════════
    // Diagram
    // ═══════════════════════════════════════════════════════════════════════

    /** Space between the canvas origin and the first shape */
    public static final double DIAGRAM_MARGIN = 50;

    /** Horizontal gap between neighbouring shapes */
    public static final double NODE_HORIZONTAL_GAP = 60;
    /** Vertical gap between neighbouring shapes */
    public static final double NODE_VERTICAL_GAP = 80;
    /** Gap between consecutive ranks along the flow direction */
    public static final double RANK_SEPARATION = 120;

    /** Shapes per row in the grid placements */
    public static final int GRID_COLUMNS = 5;

    // ═══════════════════════════════════════════════════════════════════════
    // External tool coordinate conventions
    // ═══════════════════════════════════════════════════════════════════════

    /** Pixels per foreign unit when a tool reports in another unit system */
    public static final double SCALE_X = 100;
    public static final double SCALE_Y = 100;

    // ═══════════════════════════════════════════════════════════════════════
    // Overlap avoidance
    // ═══════════════════════════════════════════════════════════════════════

    /** Vertical shift per collision */
    public static final double OVERLAP_STEP_Y = 40;
    /** Horizontal shift once the vertical headroom is used up */
    public static final double OVERLAP_STEP_X = 80;
    /** Vertical headroom before shifting right */
    public static final double OVERLAP_MAX_SHIFT_Y = 160;
    /** Candidate positions tried per shape */
    public static final int OVERLAP_MAX_ATTEMPTS = 12;

    // ═══════════════════════════════════════════════════════════════════════
    // Swimlanes and containers
    // ═══════════════════════════════════════════════════════════════════════

    public static final double POOL_HEADER_WIDTH = 40;
    public static final double LANE_HEADER_HEIGHT = 30;
    public static final double LANE_PADDING = 20;
    public static final double LANE_MIN_HEIGHT = 120;

    public static final double POOL_GAP = 50;
    public static final double POOL_DEFAULT_WIDTH = 600;
    public static final double POOL_DEFAULT_HEIGHT = 200;
    public static final double POOL_MIN_WIDTH = 400;
    public static final double POOL_MIN_HEIGHT = 150;

    /** Header band of a collapsible sub-container */
    public static final double SUB_CONTAINER_HEADER = 26;
    /** Gap above a sub-container child that had to start a new row */
    public static final double SUB_CONTAINER_PADDING = 20;

    /** First attached shape's offset from the host's left edge */
    public static final double ATTACHED_OFFSET_X = 20;
    /** Lateral spacing between shapes attached to the same host */
    public static final double ATTACHED_SPACING = 50;

    /** Nudge applied to siblings that would otherwise share a bounding box */
    public static final double COINCIDENT_NUDGE = 10;

    private LayoutConstants() {
    }
}
