package com.bpmntool.autolayout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph of shape ids, built fresh for one resolve call.
 *
 * Nodes and adjacency keep insertion order so every traversal over the graph
 * is deterministic.
 */
public class FlowGraph {

    /** A validated connector between two known nodes */
    public static class Edge {
        public final String connectorId;
        public final String kind;
        public final String sourceId;
        public final String targetId;

        Edge(String connectorId, String kind, String sourceId, String targetId) {
            this.connectorId = connectorId;
            this.kind = kind;
            this.sourceId = sourceId;
            this.targetId = targetId;
        }
    }

    private final Map<String, Set<String>> successors = new LinkedHashMap<>();
    private final Map<String, Set<String>> predecessors = new LinkedHashMap<>();
    private final List<Edge> edges = new ArrayList<>();

    void addNode(String id) {
        successors.putIfAbsent(id, new LinkedHashSet<>());
        predecessors.putIfAbsent(id, new LinkedHashSet<>());
    }

    void addEdge(String connectorId, String kind, String sourceId, String targetId) {
        addNode(sourceId);
        addNode(targetId);
        successors.get(sourceId).add(targetId);
        predecessors.get(targetId).add(sourceId);
        edges.add(new Edge(connectorId, kind, sourceId, targetId));
    }

    public Set<String> getNodes() {
        return Collections.unmodifiableSet(successors.keySet());
    }

    public int getNodeCount() {
        return successors.size();
    }

    public boolean isEmpty() {
        return successors.isEmpty();
    }

    public boolean contains(String id) {
        return successors.containsKey(id);
    }

    public List<Edge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    public Set<String> getSuccessors(String id) {
        Set<String> result = successors.get(id);
        return result != null ? Collections.unmodifiableSet(result) : Collections.emptySet();
    }

    public Set<String> getPredecessors(String id) {
        Set<String> result = predecessors.get(id);
        return result != null ? Collections.unmodifiableSet(result) : Collections.emptySet();
    }

    public int getInDegree(String id) {
        return getPredecessors(id).size();
    }

    /** True when the node takes part in at least one edge. */
    public boolean isConnected(String id) {
        return !getSuccessors(id).isEmpty() || !getPredecessors(id).isEmpty();
    }
}
