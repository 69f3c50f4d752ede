package com.bpmntool.autolayout;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;

import com.bpmntool.model.Bounds;
import com.bpmntool.model.Connector;
import com.bpmntool.model.DiagramModel;
import com.bpmntool.model.Shape;
import com.bpmntool.model.ShapeTypes;

/**
 * Reports structural problems of a diagram model without changing it.
 *
 * Checks:
 * - start and end events present (WARNING)
 * - connector endpoints refer to existing shapes (ERROR)
 * - every shape connected to a start event, ignoring direction (INFO)
 * - positioned shapes with the same parent do not overlap (WARNING)
 * - tasks carry a name (INFO)
 */
public class ModelValidator {

    public List<ValidationWarning> validate(DiagramModel model) {
        List<ValidationWarning> warnings = new ArrayList<>();
        checkStartEndEvents(model, warnings);
        checkConnectorReferences(model, new ModelIndex(model), warnings);
        checkReachability(model, warnings);
        checkOverlappingSiblings(model, warnings);
        checkMissingLabels(model, warnings);
        return warnings;
    }

    private void checkStartEndEvents(DiagramModel model, List<ValidationWarning> warnings) {
        if (model.getShapesOfType(ShapeTypes.START_EVENT).isEmpty()) {
            warnings.add(new ValidationWarning(ValidationWarning.Level.WARNING, null, "Process has no start event"));
        }
        if (model.getShapesOfType(ShapeTypes.END_EVENT).isEmpty()) {
            warnings.add(new ValidationWarning(ValidationWarning.Level.WARNING, null, "Process has no end event"));
        }
    }

    private void checkConnectorReferences(DiagramModel model, ModelIndex index, List<ValidationWarning> warnings) {
        for (Connector connector : model.getConnectors()) {
            if (!index.hasShape(connector.getSourceId())) {
                warnings.add(new ValidationWarning(ValidationWarning.Level.ERROR, connector.getId(),
                        "Connector '" + connector.getId() + "' has invalid source reference '"
                                + connector.getSourceId() + "'"));
            }
            if (!index.hasShape(connector.getTargetId())) {
                warnings.add(new ValidationWarning(ValidationWarning.Level.ERROR, connector.getId(),
                        "Connector '" + connector.getId() + "' has invalid target reference '"
                                + connector.getTargetId() + "'"));
            }
        }
    }

    /**
     * Undirected breadth-first search from every start event. Skipped when
     * the model has no start event; that is reported separately.
     */
    private void checkReachability(DiagramModel model, List<ValidationWarning> warnings) {
        List<Shape> starts = model.getShapesOfType(ShapeTypes.START_EVENT);
        if (starts.isEmpty()) {
            return;
        }

        Map<String, Set<String>> adjacency = new LinkedHashMap<>();
        for (Shape shape : model.getShapes()) {
            adjacency.put(shape.getId(), new LinkedHashSet<>());
        }
        for (Connector connector : model.getConnectors()) {
            Set<String> fromSource = adjacency.get(connector.getSourceId());
            Set<String> fromTarget = adjacency.get(connector.getTargetId());
            if (fromSource != null && fromTarget != null) {
                fromSource.add(connector.getTargetId());
                fromTarget.add(connector.getSourceId());
            }
        }

        Set<String> visited = new HashSet<>();
        Queue<String> queue = new ArrayDeque<>();
        for (Shape start : starts) {
            queue.add(start.getId());
        }
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!visited.add(current)) {
                continue;
            }
            for (String next : adjacency.get(current)) {
                if (!visited.contains(next)) {
                    queue.add(next);
                }
            }
        }

        for (Shape shape : model.getShapes()) {
            if (!visited.contains(shape.getId())) {
                warnings.add(new ValidationWarning(ValidationWarning.Level.INFO, shape.getId(),
                        "Shape '" + shape.getId() + "' is not connected to the main flow"));
            }
        }
    }

    /**
     * Attached shapes straddle their host's edge and are not compared.
     */
    private void checkOverlappingSiblings(DiagramModel model, List<ValidationWarning> warnings) {
        List<Shape> positioned = new ArrayList<>();
        for (Shape shape : model.getShapes()) {
            if (shape.getBoundsOrNull() != null && !ShapeTypes.isAttached(shape.getType())) {
                positioned.add(shape);
            }
        }

        for (int i = 0; i < positioned.size(); i++) {
            Shape first = positioned.get(i);
            Bounds firstBounds = first.getBounds();
            for (int j = i + 1; j < positioned.size(); j++) {
                Shape second = positioned.get(j);
                if (!Objects.equals(first.getParentId(), second.getParentId())) {
                    continue;
                }
                if (firstBounds.intersects(second.getBounds())) {
                    warnings.add(new ValidationWarning(ValidationWarning.Level.WARNING, first.getId(),
                            "Shape '" + first.getId() + "' overlaps with '" + second.getId() + "'"));
                }
            }
        }
    }

    private void checkMissingLabels(DiagramModel model, List<ValidationWarning> warnings) {
        for (Shape shape : model.getShapes()) {
            if (ShapeTypes.LABELED_TYPES.contains(shape.getType())
                    && (shape.getName() == null || shape.getName().isBlank())) {
                warnings.add(new ValidationWarning(ValidationWarning.Level.INFO, shape.getId(),
                        "Shape '" + shape.getId() + "' of type " + shape.getType() + " has no name"));
            }
        }
    }
}
