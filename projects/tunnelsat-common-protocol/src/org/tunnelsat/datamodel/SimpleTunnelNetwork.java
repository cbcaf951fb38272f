package org.tunnelsat.datamodel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.tunnelsat.common.TunnelSatException;
import org.tunnelsat.common.TunnelSatObjectMapper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;


/**
 * <p>An immutable, in-memory tunnel network.</p>
 *
 * <p>Edges given between the same ordered pair of nodes are merged, so each
 * (source, target) pair appears once with the union of its capabilities.
 * Networks can be assembled with a {@link Builder} or read from JSON of the
 * form:</p>
 *
 * <pre>
 * {"nodes": ["s", "d"], "initial": 0, "final": 1,
 *  "edges": [{"source": 0, "target": 1, "actions": ["TRANSMIT_A"]}]}
 * </pre>
 */
public class SimpleTunnelNetwork implements TunnelNetwork {

    private static final String NODES_VAR = "nodes";

    private static final String INITIAL_VAR = "initial";

    private static final String FINAL_VAR = "final";

    private static final String EDGES_VAR = "edges";

    private final List<String> _nodeNames;

    private final int _initialNode;

    private final int _finalNode;

    private final List<NetworkEdge> _edges;

    private final List<List<NetworkEdge>> _outgoing;

    @JsonCreator
    public SimpleTunnelNetwork(
            @JsonProperty(NODES_VAR) List<String> nodeNames,
            @JsonProperty(INITIAL_VAR) int initialNode,
            @JsonProperty(FINAL_VAR) int finalNode,
            @JsonProperty(EDGES_VAR) List<NetworkEdge> edges) {
        if (nodeNames == null || nodeNames.isEmpty()) {
            throw new TunnelSatException("A tunnel network needs at least one node");
        }
        _nodeNames = Collections.unmodifiableList(new ArrayList<>(nodeNames));
        _initialNode = checkNode(initialNode, INITIAL_VAR);
        _finalNode = checkNode(finalNode, FINAL_VAR);

        // merge parallel edges, keeping first-seen order
        Map<List<Integer>, Set<Action>> merged = new LinkedHashMap<>();
        if (edges != null) {
            for (NetworkEdge e : edges) {
                checkNode(e.getSource(), "edge source");
                checkNode(e.getTarget(), "edge target");
                List<Integer> key = Arrays.asList(e.getSource(), e.getTarget());
                merged.computeIfAbsent(key, k -> EnumSet.noneOf(Action.class))
                      .addAll(e.getActions());
            }
        }

        List<NetworkEdge> all = new ArrayList<>();
        _outgoing = new ArrayList<>();
        for (int i = 0; i < _nodeNames.size(); i++) {
            _outgoing.add(new ArrayList<>());
        }
        merged.forEach((key, actions) -> {
            NetworkEdge e = new NetworkEdge(key.get(0), key.get(1), actions);
            all.add(e);
            _outgoing.get(e.getSource()).add(e);
        });
        _edges = Collections.unmodifiableList(all);
    }

    /**
     * Reads a network from its JSON description.
     */
    public static SimpleTunnelNetwork fromJson(String json) {
        try {
            return new TunnelSatObjectMapper().readValue(json, SimpleTunnelNetwork.class);
        } catch (JsonProcessingException e) {
            throw new TunnelSatException("Could not parse tunnel network", e);
        }
    }

    public String toJson() {
        try {
            return new TunnelSatObjectMapper().writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new TunnelSatException("Could not serialize tunnel network", e);
        }
    }

    private int checkNode(int node, String what) {
        if (node < 0 || node >= _nodeNames.size()) {
            throw new TunnelSatException("Invalid node index for " + what + ": " + node);
        }
        return node;
    }

    @JsonIgnore
    @Override
    public int getNumNodes() {
        return _nodeNames.size();
    }

    @JsonProperty(NODES_VAR)
    public List<String> getNodeNames() {
        return _nodeNames;
    }

    @JsonProperty(INITIAL_VAR)
    @Override
    public int getInitialNode() {
        return _initialNode;
    }

    @JsonProperty(FINAL_VAR)
    @Override
    public int getFinalNode() {
        return _finalNode;
    }

    @Override
    public String getNodeName(int node) {
        return _nodeNames.get(node);
    }

    @JsonProperty(EDGES_VAR)
    @Override
    public List<NetworkEdge> getEdges() {
        return _edges;
    }

    @Override
    public List<NetworkEdge> getOutgoingEdges(int node) {
        return Collections.unmodifiableList(_outgoing.get(node));
    }

    @Override
    public boolean hasAction(int source, int target, Action action) {
        for (NetworkEdge e : _outgoing.get(source)) {
            if (e.getTarget() == target && e.hasAction(action)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("=======================================================\n");
        sb.append("---------- Nodes ----------\n");
        for (int i = 0; i < _nodeNames.size(); i++) {
            sb.append(i).append(": ").append(_nodeNames.get(i));
            if (i == _initialNode) {
                sb.append(" (initial)");
            }
            if (i == _finalNode) {
                sb.append(" (final)");
            }
            sb.append("\n");
        }
        sb.append("---------- Edges ----------\n");
        for (NetworkEdge e : _edges) {
            sb.append(_nodeNames.get(e.getSource())).append(" --> ")
              .append(_nodeNames.get(e.getTarget())).append(" ")
              .append(e.getActions()).append("\n");
        }
        sb.append("=======================================================\n");
        return sb.toString();
    }

    public static class Builder {

        private final List<String> _names = new ArrayList<>();

        private final List<NetworkEdge> _edges = new ArrayList<>();

        private int _initial;

        private int _final;

        public int addNode(String name) {
            _names.add(name);
            return _names.size() - 1;
        }

        public Builder setInitialNode(int node) {
            _initial = node;
            return this;
        }

        public Builder setFinalNode(int node) {
            _final = node;
            return this;
        }

        public Builder addEdge(int source, int target, Action... actions) {
            _edges.add(new NetworkEdge(source, target, Arrays.asList(actions)));
            return this;
        }

        public SimpleTunnelNetwork build() {
            return new SimpleTunnelNetwork(_names, _initial, _final, _edges);
        }
    }

}
