package com.nodeforge.graph;

import java.util.List;

/**
 * Thrown when a dependency graph contains a cycle. {@link #getParticipants()} lists every node on
 * the cycle in traversal order, starting at the node that closed it.
 */
public final class CycleException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final List<String> participants;

    public CycleException(String scope, List<String> participants) {
        super(String.format("Dependency cycle detected in %s: %s -> %s",
                scope, String.join(" -> ", participants), participants.isEmpty() ? "" : participants.get(0)));
        this.participants = List.copyOf(participants);
    }

    public List<String> getParticipants() {
        return participants;
    }
}
