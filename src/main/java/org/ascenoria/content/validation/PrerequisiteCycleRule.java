package org.ascenoria.content.validation;

import org.ascenoria.content.diagnostics.DiagnosticCode;
import org.ascenoria.content.diagnostics.DiagnosticsEngine;
import org.ascenoria.content.merge.MergedCollection;
import org.ascenoria.content.merge.MergedContent;
import org.ascenoria.content.model.ContentCollections;
import org.ascenoria.content.model.TechnologyPrerequisite;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rejects cycles in the research tree, including a technology requiring itself.
 * <p>
 * Each cycle is reported once, anchored at the technology where the depth-first search closed it.
 */
public class PrerequisiteCycleRule implements ValidationRule {

    private enum Mark { VISITING, DONE }

    @Override
    public void validate(MergedContent content, DiagnosticsEngine diagnostics) {
        final MergedCollection<TechnologyPrerequisite> prerequisites =
                content.collection(ContentCollections.TECHNOLOGY_PREREQUISITES);
        final Map<String, List<String>> edges = new LinkedHashMap<>();
        for (TechnologyPrerequisite edge : prerequisites.records().values()) {
            edges.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge.to());
        }

        final Map<String, Mark> marks = new HashMap<>();
        for (String start : edges.keySet()) {
            if (!marks.containsKey(start)) {
                search(start, edges, marks, prerequisites, diagnostics);
            }
        }
    }

    /**
     * Depth-first search with an explicit stack, so chain length is bounded by heap rather than
     * by the thread stack.
     */
    private void search(String start, Map<String, List<String>> edges, Map<String, Mark> marks,
                        MergedCollection<TechnologyPrerequisite> prerequisites, DiagnosticsEngine diagnostics) {
        final Deque<String> path = new ArrayDeque<>();
        final Deque<Iterator<String>> pending = new ArrayDeque<>();
        enter(start, edges, marks, path, pending);
        while (!pending.isEmpty()) {
            final Iterator<String> successors = pending.peek();
            if (!successors.hasNext()) {
                pending.pop();
                marks.put(path.removeLast(), Mark.DONE);
                continue;
            }
            final String next = successors.next();
            final Mark mark = marks.get(next);
            if (mark == Mark.VISITING) {
                reportCycle(path.peekLast(), next, path, prerequisites, diagnostics);
            } else if (mark == null) {
                enter(next, edges, marks, path, pending);
            }
        }
    }

    private static void enter(String node, Map<String, List<String>> edges, Map<String, Mark> marks,
                              Deque<String> path, Deque<Iterator<String>> pending) {
        marks.put(node, Mark.VISITING);
        path.addLast(node);
        pending.push(edges.getOrDefault(node, List.of()).iterator());
    }

    private void reportCycle(String from, String to, Deque<String> path,
                             MergedCollection<TechnologyPrerequisite> prerequisites, DiagnosticsEngine diagnostics) {
        final List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (String step : path) {
            if (step.equals(to)) {
                inCycle = true;
            }
            if (inCycle) {
                cycle.add(step);
            }
        }
        cycle.add(to);
        final String key = TechnologyPrerequisite.keyOf(from, to);
        diagnostics.reportFatal(DiagnosticCode.INVARIANT_VIOLATION, ContentCollections.TECHNOLOGY_PREREQUISITES.name(),
                key, prerequisites.lastWriter(key), "prerequisite cycle: " + String.join(" -> ", cycle));
    }
}
