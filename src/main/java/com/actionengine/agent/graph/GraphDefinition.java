package com.actionengine.agent.graph;

import com.actionengine.agent.exception.RoutingException;
import com.actionengine.agent.state.WorkflowState;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validated, immutable workflow graph. Shared by every thread.
 */
@Slf4j
public class GraphDefinition {

    private final Map<NodeId, Node> nodes;
    private final Map<NodeId, List<Route>> routing;
    private final NodeId entry;
    private final NodeId errorNode;

    GraphDefinition(Map<NodeId, Node> nodes, Map<NodeId, List<Route>> routing, NodeId entry, NodeId errorNode) {
        this.nodes = Collections.unmodifiableMap(new EnumMap<>(nodes));
        this.routing = Collections.unmodifiableMap(new EnumMap<>(routing));
        this.entry = entry;
        this.errorNode = errorNode;
    }

    public NodeId entry() {
        return entry;
    }

    public Optional<NodeId> errorNode() {
        return Optional.ofNullable(errorNode);
    }

    public Node node(NodeId id) {
        Node node = nodes.get(id);
        if (node == null) {
            throw new RoutingException("No node registered for " + id);
        }
        return node;
    }

    public List<Route> routes(NodeId from) {
        return routing.getOrDefault(from, List.of());
    }

    /**
     * Picks the next node after {@code from} for the given merged state.
     *
     * @throws RoutingException when no route matches and there is no default
     */
    public NodeId next(NodeId from, WorkflowState state) {
        for (Route route : routes(from)) {
            if (route.matches(state)) {
                log.debug("Route {} -> {} [{}]", from, route.target(), route.label());
                return route.target();
            }
        }
        throw new RoutingException("No route out of " + from + " matches the current state");
    }
}
