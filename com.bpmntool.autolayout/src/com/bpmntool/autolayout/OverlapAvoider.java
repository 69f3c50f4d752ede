package com.bpmntool.autolayout;

import java.util.Collection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.bpmntool.model.Bounds;

/**
 * Moves a candidate rectangle away from already-placed rectangles.
 *
 * Candidates are tried on a fixed search path: first straight down in
 * {@link LayoutConstants#OVERLAP_STEP_Y} steps until
 * {@link LayoutConstants#OVERLAP_MAX_SHIFT_Y} is used up, then one
 * {@link LayoutConstants#OVERLAP_STEP_X} to the right with the vertical
 * offset reset, and so on. The search is best-effort: after
 * {@link LayoutConstants#OVERLAP_MAX_ATTEMPTS} candidates the one with the
 * smallest overlap area is accepted even if it still overlaps.
 */
public class OverlapAvoider {

    private static final Logger logger = LoggerFactory.getLogger(OverlapAvoider.class);

    public Bounds findFreeSpot(Bounds candidate, Collection<Bounds> placed) {
        Bounds best = candidate;
        double bestOverlap = Double.MAX_VALUE;

        double offsetX = 0;
        double offsetY = 0;

        for (int attempt = 0; attempt < LayoutConstants.OVERLAP_MAX_ATTEMPTS; attempt++) {
            Bounds trial = candidate.moveTo(candidate.x + offsetX, candidate.y + offsetY);
            double overlap = totalOverlap(trial, placed);
            if (overlap == 0 && !coincidesWithAny(trial, placed)) {
                return trial;
            }
            if (overlap < bestOverlap) {
                best = trial;
                bestOverlap = overlap;
            }

            offsetY += LayoutConstants.OVERLAP_STEP_Y;
            if (offsetY > LayoutConstants.OVERLAP_MAX_SHIFT_Y) {
                offsetY = 0;
                offsetX += LayoutConstants.OVERLAP_STEP_X;
            }
        }

        logger.debug("No free spot near {} after {} attempts; accepting {}", candidate,
                LayoutConstants.OVERLAP_MAX_ATTEMPTS, best);
        return best;
    }

    /**
     * Sum of the overlap areas with every placed rectangle.
     */
    static double totalOverlap(Bounds bounds, Collection<Bounds> placed) {
        double total = 0;
        for (Bounds other : placed) {
            if (bounds.intersects(other)) {
                total += bounds.overlapArea(other);
            }
        }
        return total;
    }

    /** Zero-area shapes never intersect but may still sit on top of each other. */
    private static boolean coincidesWithAny(Bounds bounds, Collection<Bounds> placed) {
        for (Bounds other : placed) {
            if (bounds.equals(other)) {
                return true;
            }
        }
        return false;
    }
}
