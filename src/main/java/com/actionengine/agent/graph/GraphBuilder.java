package com.actionengine.agent.graph;

import com.actionengine.agent.exception.ConfigurationException;
import com.actionengine.agent.state.WorkflowState;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Assembles a {@link GraphDefinition}:
 *
 * <pre>
 * GraphBuilder.create()
 *     .node(PLANNING, planning)
 *     .node(TOOL_GENERATOR, toolGenerator)
 *     .entry(PLANNING)
 *     .when(PLANNING, "exiting", WorkflowState::isExiting, END)
 *     .otherwise(PLANNING, TOOL_GENERATOR)
 *     .edge(TOOL_GENERATOR, END)
 *     .build();
 * </pre>
 *
 * Conditional routes of a node are evaluated in declaration order; the
 * {@link #otherwise} route, or a lone {@link #edge}, is taken when none match.
 * {@link #build()} rejects malformed graphs with a {@link ConfigurationException}.
 */
public class GraphBuilder {

    private final Map<NodeId, Node> nodes = new EnumMap<>(NodeId.class);
    private final Map<NodeId, List<Route>> conditional = new EnumMap<>(NodeId.class);
    private final Map<NodeId, List<Route>> unconditional = new EnumMap<>(NodeId.class);
    private final Map<NodeId, Route> defaults = new EnumMap<>(NodeId.class);
    private NodeId entry;
    private NodeId errorNode;

    public static GraphBuilder create() {
        return new GraphBuilder();
    }

    public GraphBuilder node(NodeId id, Node node) {
        if (id == NodeId.END) {
            throw new ConfigurationException("END is a terminal marker and cannot be defined as a node");
        }
        if (nodes.putIfAbsent(id, node) != null) {
            throw new ConfigurationException("Node defined twice: " + id);
        }
        return this;
    }

    public GraphBuilder entry(NodeId id) {
        this.entry = id;
        return this;
    }

    /** Node that receives control when another node fails */
    public GraphBuilder errorNode(NodeId id) {
        this.errorNode = id;
        return this;
    }

    public GraphBuilder edge(NodeId from, NodeId to) {
        unconditional.computeIfAbsent(from, k -> new ArrayList<>()).add(Route.unconditional(to));
        return this;
    }

    public GraphBuilder when(NodeId from, String label, Predicate<WorkflowState> condition, NodeId to) {
        conditional.computeIfAbsent(from, k -> new ArrayList<>()).add(new Route(to, label, condition));
        return this;
    }

    public GraphBuilder otherwise(NodeId from, NodeId to) {
        if (defaults.put(from, new Route(to, "otherwise", null)) != null) {
            throw new ConfigurationException("Node " + from + " declares more than one default route");
        }
        return this;
    }

    public GraphDefinition build() {
        if (entry == null) {
            throw new ConfigurationException("Graph has no entry node");
        }
        requireDefined(entry, "entry");
        if (errorNode != null) {
            requireDefined(errorNode, "error node");
        }

        Map<NodeId, List<Route>> routing = new EnumMap<>(NodeId.class);
        Set<NodeId> sources = EnumSet.noneOf(NodeId.class);
        sources.addAll(conditional.keySet());
        sources.addAll(unconditional.keySet());
        sources.addAll(defaults.keySet());

        for (NodeId from : sources) {
            if (from == NodeId.END) {
                throw new ConfigurationException("END cannot have outgoing edges");
            }
            requireDefined(from, "edge source");

            List<Route> plain = unconditional.getOrDefault(from, List.of());
            if (plain.size() > 1) {
                throw new ConfigurationException("Node " + from + " has " + plain.size() + " unconditional edges");
            }
            if (!plain.isEmpty() && defaults.containsKey(from)) {
                throw new ConfigurationException(
                        "Node " + from + " combines an unconditional edge with a conditional default");
            }

            List<Route> routes = new ArrayList<>(conditional.getOrDefault(from, List.of()));
            if (!plain.isEmpty()) {
                routes.add(plain.get(0));
            } else if (defaults.containsKey(from)) {
                routes.add(defaults.get(from));
            }
            for (Route route : routes) {
                if (route.target() != NodeId.END) {
                    requireDefined(route.target(), "edge target of " + from);
                }
            }
            routing.put(from, List.copyOf(routes));
        }

        validateReachability(routing);
        return new GraphDefinition(nodes, routing, entry, errorNode);
    }

    private void validateReachability(Map<NodeId, List<Route>> routing) {
        Set<NodeId> visited = EnumSet.noneOf(NodeId.class);
        Deque<NodeId> queue = new ArrayDeque<>();
        queue.add(entry);
        if (errorNode != null) {
            queue.add(errorNode);
        }
        boolean endReachable = false;

        while (!queue.isEmpty()) {
            NodeId current = queue.poll();
            if (current == NodeId.END) {
                endReachable = true;
                continue;
            }
            if (!visited.add(current)) continue;

            List<Route> routes = routing.getOrDefault(current, List.of());
            if (routes.isEmpty()) {
                throw new ConfigurationException("Node " + current + " is reachable but has no outgoing edge");
            }
            routes.forEach(route -> queue.add(route.target()));
        }

        if (!endReachable) {
            throw new ConfigurationException("No path from " + entry + " to END");
        }
    }

    private void requireDefined(NodeId id, String role) {
        if (!nodes.containsKey(id)) {
            throw new ConfigurationException("Undefined node " + id + " used as " + role);
        }
    }
}
