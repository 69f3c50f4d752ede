package com.bpmntool.model;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Shape type tags, their categories and default dimensions.
 *
 * ╔════════════════╦══════════════════════════════════════════╦══════════╗
 * ║ Category       ║ Types                                    ║ Size     ║
 * ╠════════════════╬══════════════════════════════════════════╬══════════╣
 * ║ Events         ║ start, end, intermediate, boundary       ║ 36 x 36  ║
 * ║ Tasks          ║ task, user, service, script, send, ...   ║ 120 x 80 ║
 * ║ Sub-process    ║ subProcess                               ║ 200 x 150║
 * ║ Gateways       ║ exclusive, parallel, inclusive, ...      ║ 50 x 50  ║
 * ║ Data           ║ dataObject(Ref) 40x50, dataStore(Ref)    ║ 50 x 50  ║
 * ║ Artifacts      ║ textAnnotation 100x40, group             ║ 200 x 150║
 * ╚════════════════╩══════════════════════════════════════════╩══════════╝
 *
 * Unknown types fall back to task size.
 */
public final class ShapeTypes {

    public static final String START_EVENT = "startEvent";
    public static final String END_EVENT = "endEvent";
    public static final String BOUNDARY_EVENT = "boundaryEvent";
    public static final String TASK = "task";
    public static final String SUB_PROCESS = "subProcess";

    /** Property naming the host of an attached (boundary) shape */
    public static final String ATTACHED_TO_REF = "attachedToRef";
    /** Property naming the sub-container, for parsers that do not set it on the shape */
    public static final String SUB_CONTAINER_REF = "subprocess_id";

    public static final double DEFAULT_WIDTH = 120;
    public static final double DEFAULT_HEIGHT = 80;

    public static final Set<String> EVENT_TYPES = Set.of(
            "startEvent", "endEvent", "intermediateCatchEvent", "intermediateThrowEvent", "boundaryEvent");

    public static final Set<String> TASK_TYPES = Set.of(
            "task", "userTask", "serviceTask", "scriptTask", "sendTask", "receiveTask",
            "businessRuleTask", "manualTask", "callActivity", "subProcess");

    public static final Set<String> GATEWAY_TYPES = Set.of(
            "exclusiveGateway", "parallelGateway", "inclusiveGateway", "eventBasedGateway", "complexGateway");

    public static final Set<String> DATA_TYPES = Set.of(
            "dataObject", "dataObjectReference", "dataStore", "dataStoreReference");

    public static final Set<String> ARTIFACT_TYPES = Set.of("textAnnotation", "group");

    /** Types a boundary shape may be attached to */
    public static final Set<String> ATTACHABLE_TYPES = Set.of(
            "subProcess", "task", "userTask", "serviceTask", "scriptTask", "callActivity");

    /** Task types that are expected to carry a label */
    public static final Set<String> LABELED_TYPES = Set.of(
            "task", "userTask", "serviceTask", "scriptTask", "sendTask", "receiveTask",
            "businessRuleTask", "manualTask", "callActivity");

    private static final Map<String, double[]> DIMENSIONS = new HashMap<>();

    static {
        for (String type : EVENT_TYPES) {
            DIMENSIONS.put(type, new double[] { 36, 36 });
        }
        for (String type : TASK_TYPES) {
            DIMENSIONS.put(type, new double[] { 120, 80 });
        }
        DIMENSIONS.put(SUB_PROCESS, new double[] { 200, 150 });
        for (String type : GATEWAY_TYPES) {
            DIMENSIONS.put(type, new double[] { 50, 50 });
        }
        DIMENSIONS.put("dataObject", new double[] { 40, 50 });
        DIMENSIONS.put("dataObjectReference", new double[] { 40, 50 });
        DIMENSIONS.put("dataStore", new double[] { 50, 50 });
        DIMENSIONS.put("dataStoreReference", new double[] { 50, 50 });
        DIMENSIONS.put("textAnnotation", new double[] { 100, 40 });
        DIMENSIONS.put("group", new double[] { 200, 150 });
    }

    private ShapeTypes() {
    }

    public static double defaultWidth(String type) {
        double[] dims = DIMENSIONS.get(type);
        return dims != null ? dims[0] : DEFAULT_WIDTH;
    }

    public static double defaultHeight(String type) {
        double[] dims = DIMENSIONS.get(type);
        return dims != null ? dims[1] : DEFAULT_HEIGHT;
    }

    public static boolean isDataType(String type) {
        return DATA_TYPES.contains(type);
    }

    public static boolean isAttached(String type) {
        return BOUNDARY_EVENT.equals(type);
    }

    public static boolean isAttachable(String type) {
        return ATTACHABLE_TYPES.contains(type);
    }
}
