package com.formulagrid.app.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A set of ordered pairs (s, t) meaning "t depends on s": s must be evaluated before t.
 * For example, with {("a","b"), ("a","c"), ("b","d"), ("d","d")}:
 * <pre>
 *     dependents("a") = {"b", "c"}     dependees("a") = {}
 *     dependents("b") = {"d"}          dependees("b") = {"a"}
 *     dependents("c") = {}             dependees("c") = {"a"}
 *     dependents("d") = {"d"}          dependees("d") = {"b", "d"}
 * </pre>
 * The edge set is the single source of truth. The forward index (s to its dependents) and the
 * reverse index (t to its dependees) are only ever changed together with it, in
 * {@link #link} and {@link #unlink}, so each index is always the exact transpose of the other.
 * <p>
 * Not thread-safe; callers serialize access.
 */
public class DependencyGraph {

    private final Set<Edge> edges = new LinkedHashSet<>();
    // s -> {t : (s, t) in edges}
    private final Map<String, Set<String>> dependents = new LinkedHashMap<>();
    // t -> {s : (s, t) in edges}
    private final Map<String, Set<String>> dependees = new LinkedHashMap<>();

    /**
     * Number of ordered pairs in the graph.
     */
    public int size() {
        return edges.size();
    }

    /**
     * Number of dependees of s, i.e. how many cells s reads.
     */
    public int dependeeCount(String s) {
        return dependees.getOrDefault(s, Collections.emptySet()).size();
    }

    public boolean hasDependents(String s) {
        return dependents.containsKey(s);
    }

    public boolean hasDependees(String s) {
        return dependees.containsKey(s);
    }

    /**
     * Snapshot of the cells that depend on s; empty if none.
     */
    public Set<String> getDependents(String s) {
        return snapshot(dependents.get(s));
    }

    /**
     * Snapshot of the cells s depends on; empty if none.
     */
    public Set<String> getDependees(String s) {
        return snapshot(dependees.get(s));
    }

    /**
     * Adds (s, t). Does nothing if the pair is already present.
     */
    public void addDependency(String s, String t) {
        link(new Edge(s, t));
    }

    /**
     * Removes (s, t). Does nothing if the pair is absent.
     */
    public void removeDependency(String s, String t) {
        unlink(new Edge(s, t));
    }

    /**
     * Replaces every pair (s, r) with a pair (s, t) for each t in newDependents.
     */
    public void replaceDependents(String s, Iterable<String> newDependents) {
        for (String r : getDependents(s)) {
            unlink(new Edge(s, r));
        }
        for (String t : newDependents) {
            link(new Edge(s, t));
        }
    }

    /**
     * Replaces every pair (r, s) with a pair (t, s) for each t in newDependees.
     */
    public void replaceDependees(String s, Iterable<String> newDependees) {
        for (String r : getDependees(s)) {
            unlink(new Edge(r, s));
        }
        for (String t : newDependees) {
            link(new Edge(t, s));
        }
    }

    /**
     * Every cell that appears in the graph, mapped to the sorted cells it depends on.
     */
    public Map<String, Set<String>> toDependeeMap() {
        return adjacency(dependees);
    }

    /**
     * Every cell that appears in the graph, mapped to the sorted cells depending on it.
     */
    public Map<String, Set<String>> toDependentMap() {
        return adjacency(dependents);
    }

    private Map<String, Set<String>> adjacency(Map<String, Set<String>> index) {
        Map<String, Set<String>> result = new TreeMap<>();
        for (Edge edge : edges) {
            result.putIfAbsent(edge.source, new TreeSet<>());
            result.putIfAbsent(edge.target, new TreeSet<>());
        }
        for (Map.Entry<String, Set<String>> entry : index.entrySet()) {
            result.get(entry.getKey()).addAll(entry.getValue());
        }
        return result;
    }

    private void link(Edge edge) {
        if (edges.add(edge)) {
            dependents.computeIfAbsent(edge.source, k -> new LinkedHashSet<>()).add(edge.target);
            dependees.computeIfAbsent(edge.target, k -> new LinkedHashSet<>()).add(edge.source);
        }
    }

    private void unlink(Edge edge) {
        if (edges.remove(edge)) {
            detach(dependents, edge.source, edge.target);
            detach(dependees, edge.target, edge.source);
        }
    }

    // Drops empty sets so that hasDependents/hasDependees reduce to key lookups
    private static void detach(Map<String, Set<String>> index, String key, String value) {
        Set<String> set = index.get(key);
        set.remove(value);
        if (set.isEmpty()) {
            index.remove(key);
        }
    }

    private static Set<String> snapshot(Set<String> set) {
        if (set == null) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(set));
    }

    private static final class Edge {
        private final String source;
        private final String target;

        Edge(String source, String target) {
            this.source = Objects.requireNonNull(source);
            this.target = Objects.requireNonNull(target);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Edge)) {
                return false;
            }
            Edge other = (Edge) o;
            return source.equals(other.source) && target.equals(other.target);
        }

        @Override
        public int hashCode() {
            return Objects.hash(source, target);
        }
    }
}
