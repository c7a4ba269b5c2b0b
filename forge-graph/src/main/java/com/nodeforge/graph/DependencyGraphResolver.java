package com.nodeforge.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.ToIntFunction;

/**
 * Orders nodes so that every node comes after its prerequisites, using a depth-first
 * topological sort with three-colour marking. Used for plugins (edges from declared plugin
 * dependencies) and for hooks of one lifecycle event (edges from hook dependencies).
 * <p>
 * The order is deterministic: roots and prerequisites are visited by ascending priority, then by
 * position in the input list, and each node is emitted when its traversal finishes. Unconstrained
 * nodes therefore come out in (priority, declaration) order.
 *
 * @param <T> node type
 */
public final class DependencyGraphResolver<T> {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphResolver.class);

    private enum Mark { WHITE, GRAY, BLACK }

    private final String scope;
    private final Function<T, String> keyFn;
    private final Function<T, ? extends Collection<String>> prerequisitesFn;
    private final ToIntFunction<T> priorityFn;

    /**
     * @param scope           label used in cycle messages (e.g. {@code category api})
     * @param keyFn           unique key of a node
     * @param prerequisitesFn keys of the nodes that must come first
     * @param priorityFn      tie-break priority; lower comes first
     */
    public DependencyGraphResolver(String scope,
                                   Function<T, String> keyFn,
                                   Function<T, ? extends Collection<String>> prerequisitesFn,
                                   ToIntFunction<T> priorityFn) {
        this.scope = Objects.requireNonNull(scope, "scope");
        this.keyFn = Objects.requireNonNull(keyFn, "keyFn");
        this.prerequisitesFn = Objects.requireNonNull(prerequisitesFn, "prerequisitesFn");
        this.priorityFn = Objects.requireNonNull(priorityFn, "priorityFn");
    }

    /**
     * Returns the nodes in dependency order.
     *
     * @throws CycleException           if the prerequisites form a cycle
     * @throws IllegalArgumentException if two nodes share a key or a prerequisite names no node
     */
    public List<T> order(List<T> nodes) {
        Objects.requireNonNull(nodes, "nodes");
        Map<String, Integer> indexByKey = new LinkedHashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            String key = Objects.requireNonNull(keyFn.apply(nodes.get(i)), "node key");
            if (indexByKey.putIfAbsent(key, i) != null) {
                throw new IllegalArgumentException("Duplicate node in " + scope + ": " + key);
            }
        }
        Comparator<Integer> byPriority = Comparator
                .<Integer>comparingInt(i -> priorityFn.applyAsInt(nodes.get(i)))
                .thenComparingInt(i -> i);

        Map<Integer, Mark> marks = new HashMap<>();
        List<Integer> path = new ArrayList<>();
        List<T> out = new ArrayList<>(nodes.size());

        List<Integer> roots = new ArrayList<>(indexByKey.values());
        roots.sort(byPriority);
        for (Integer root : roots) {
            visit(root, nodes, indexByKey, byPriority, marks, path, out);
        }
        if (log.isDebugEnabled()) {
            List<String> keys = new ArrayList<>(out.size());
            for (T n : out) keys.add(keyFn.apply(n));
            log.debug("Resolved order for {}: {}", scope, keys);
        }
        return out;
    }

    private void visit(int index, List<T> nodes, Map<String, Integer> indexByKey, Comparator<Integer> byPriority,
                       Map<Integer, Mark> marks, List<Integer> path, List<T> out) {
        Mark mark = marks.getOrDefault(index, Mark.WHITE);
        if (mark == Mark.BLACK) {
            return;
        }
        if (mark == Mark.GRAY) {
            List<String> participants = new ArrayList<>();
            for (int i = path.indexOf(index); i < path.size(); i++) {
                participants.add(keyFn.apply(nodes.get(path.get(i))));
            }
            throw new CycleException(scope, participants);
        }
        marks.put(index, Mark.GRAY);
        path.add(index);

        T node = nodes.get(index);
        Collection<String> prerequisites = prerequisitesFn.apply(node);
        if (prerequisites != null && !prerequisites.isEmpty()) {
            List<Integer> next = new ArrayList<>(prerequisites.size());
            for (String key : prerequisites) {
                Integer i = indexByKey.get(key);
                if (i == null) {
                    throw new IllegalArgumentException(String.format(
                            "Unknown prerequisite '%s' of '%s' in %s", key, keyFn.apply(node), scope));
                }
                next.add(i);
            }
            next.sort(byPriority);
            for (Integer i : next) {
                visit(i, nodes, indexByKey, byPriority, marks, path, out);
            }
        }

        path.remove(path.size() - 1);
        marks.put(index, Mark.BLACK);
        out.add(node);
    }
}
