package com.bpmntool.autolayout;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns every graph node a topological rank: the length of the longest
 * path from a source.
 *
 * Works as a bounded fixpoint over a rank map with a FIFO work queue, so
 * cyclic input neither recurses nor loops forever:
 * - ranks never exceed {@code nodeCount - 1}
 * - at most {@code nodeCount²} queue entries are processed
 *
 * When the iteration cap is reached the best ranks found so far are returned.
 */
public class RankAssigner {

    private static final Logger logger = LoggerFactory.getLogger(RankAssigner.class);

    /** A pending rank proposal for a node */
    private static class Candidate {
        final String node;
        final int rank;

        Candidate(String node, int rank) {
            this.node = node;
            this.rank = rank;
        }
    }

    public Map<String, Integer> assign(FlowGraph graph) {
        Map<String, Integer> ranks = new LinkedHashMap<>();
        int nodeCount = graph.getNodeCount();
        if (nodeCount == 0) {
            return ranks;
        }

        // ── 1. Sources ──────────────────────────────────────────────────────
        List<String> sources = new ArrayList<>();
        for (String node : graph.getNodes()) {
            if (graph.getInDegree(node) == 0) {
                sources.add(node);
            }
        }
        if (sources.isEmpty()) {
            // Fully cyclic: every node is a candidate source
            sources.addAll(graph.getNodes());
        }

        // ── 2. Propagate longest-path ranks ─────────────────────────────────
        Map<String, Integer> recorded = new LinkedHashMap<>();
        Queue<Candidate> queue = new ArrayDeque<>();
        for (String source : sources) {
            queue.add(new Candidate(source, 0));
        }

        int maxRank = nodeCount - 1;
        long maxIterations = (long) nodeCount * nodeCount;
        long iterations = 0;

        while (!queue.isEmpty()) {
            if (iterations >= maxIterations) {
                logger.warn("Rank assignment stopped after {} iterations on {} nodes; the graph is likely cyclic",
                        iterations, nodeCount);
                break;
            }
            iterations++;

            Candidate candidate = queue.poll();
            Integer current = recorded.get(candidate.node);
            if (current != null && candidate.rank <= current) {
                continue;
            }
            recorded.put(candidate.node, candidate.rank);

            int nextRank = Math.min(candidate.rank + 1, maxRank);
            for (String successor : graph.getSuccessors(candidate.node)) {
                queue.add(new Candidate(successor, nextRank));
            }
        }

        // ── 3. Report in node order; unreached nodes default to rank 0 ─────
        for (String node : graph.getNodes()) {
            ranks.put(node, recorded.getOrDefault(node, 0));
        }
        return ranks;
    }
}
