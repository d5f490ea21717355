package org.ascenoria.content.derived;

import org.ascenoria.content.merge.MergedCollection;
import org.ascenoria.content.merge.MergedContent;
import org.ascenoria.content.model.ContentCollections;
import org.ascenoria.content.model.Technology;
import org.ascenoria.content.model.TechnologyPrerequisite;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Research tree metrics. Expects an acyclic prerequisite graph.
 * <p>
 * Nodes are processed in topological order, so depth and ancestry are computed without recursion.
 * Endpoints that name no technology take part in depth but add nothing to cumulative cost.
 */
class TechnologyStatDeriver implements StatDeriver<Technology, TechnologyStats> {

    @Override
    public Map<String, TechnologyStats> derive(MergedCollection<Technology> technologies, MergedContent content) {
        final Map<String, List<String>> prerequisites = new HashMap<>();
        final Map<String, List<String>> unlocks = new HashMap<>();
        final Map<String, Integer> index = new LinkedHashMap<>();
        technologies.records().keySet().forEach(id -> index.putIfAbsent(id, index.size()));
        for (TechnologyPrerequisite edge : content.collection(ContentCollections.TECHNOLOGY_PREREQUISITES)
                .records().values()) {
            prerequisites.computeIfAbsent(edge.to(), k -> new ArrayList<>()).add(edge.from());
            unlocks.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge.to());
            index.putIfAbsent(edge.from(), index.size());
            index.putIfAbsent(edge.to(), index.size());
        }

        final int size = index.size();
        final String[] ids = index.keySet().toArray(new String[0]);
        final long[] costs = new long[size];
        final int[] pendingParents = new int[size];
        for (int i = 0; i < size; i++) {
            final Technology technology = technologies.records().get(ids[i]);
            costs[i] = technology != null ? technology.scienceCost() : 0;
            pendingParents[i] = prerequisites.getOrDefault(ids[i], List.of()).size();
        }

        final int[] depths = new int[size];
        final BitSet[] ancestors = new BitSet[size];
        final Deque<Integer> ready = new ArrayDeque<>();
        for (int i = 0; i < size; i++) {
            ancestors[i] = new BitSet();
            if (pendingParents[i] == 0) {
                ready.add(i);
            }
        }
        int processed = 0;
        while (!ready.isEmpty()) {
            final int node = ready.poll();
            processed++;
            for (String child : unlocks.getOrDefault(ids[node], List.of())) {
                final int c = index.get(child);
                depths[c] = Math.max(depths[c], depths[node] + 1);
                ancestors[c].or(ancestors[node]);
                ancestors[c].set(node);
                if (--pendingParents[c] == 0) {
                    ready.add(c);
                }
            }
        }
        if (processed < size) {
            throw new IllegalStateException("prerequisite cycle among " + (size - processed) + " technologies");
        }

        final Map<String, TechnologyStats> stats = new LinkedHashMap<>();
        for (Technology technology : technologies.records().values()) {
            final String id = technology.id();
            final int node = index.get(id);
            long cumulative = costs[node];
            for (int a = ancestors[node].nextSetBit(0); a >= 0; a = ancestors[node].nextSetBit(a + 1)) {
                cumulative += costs[a];
            }
            stats.put(id, new TechnologyStats(
                    prerequisites.getOrDefault(id, List.of()),
                    unlocks.getOrDefault(id, List.of()),
                    depths[node],
                    cumulative));
        }
        return stats;
    }
}
