package com.bpmntool.autolayout;

import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An external hierarchical graph-layout tool.
 *
 * Implementations translate the flow graph into the tool's own input, run it
 * and hand back raw positions. Implementations are located with
 * {@link ServiceLoader}; when none is on the classpath the engine falls back
 * to its in-process layout.
 */
public interface ExternalLayoutTool {

    /**
     * Short name used in log messages.
     */
    String getName();

    /**
     * Lays out the graph.
     *
     * @param graph nodes and validated edges
     * @param sizes node id to {width, height} in pixels
     * @param direction flow direction
     * @return raw positions; nodes the tool could not place may be missing
     * @throws LayoutException when the tool fails
     */
    RawLayout layout(FlowGraph graph, Map<String, double[]> sizes, FlowDirection direction) throws LayoutException;

    /**
     * Finds the first tool registered under
     * {@code META-INF/services/com.bpmntool.autolayout.ExternalLayoutTool}.
     */
    static Optional<ExternalLayoutTool> discover() {
        Logger logger = LoggerFactory.getLogger(ExternalLayoutTool.class);
        try {
            Iterator<ExternalLayoutTool> tools = ServiceLoader.load(ExternalLayoutTool.class).iterator();
            if (tools.hasNext()) {
                ExternalLayoutTool tool = tools.next();
                logger.debug("Using external layout tool {}", tool.getName());
                return Optional.of(tool);
            }
        } catch (ServiceConfigurationError | LinkageError e) {
            logger.warn("External layout tool could not be loaded: {}", e.toString());
        }
        return Optional.empty();
    }
}
