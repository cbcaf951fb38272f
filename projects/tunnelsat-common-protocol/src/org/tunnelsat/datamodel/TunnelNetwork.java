package org.tunnelsat.datamodel;

import java.util.List;

/**
 * <p>A network of nodes whose edges carry tunnel capabilities.</p>
 *
 * <p>The encoding only ever queries a network through this interface, so any
 * graph backend can be plugged in. Nodes are the integers
 * {@code 0 .. getNumNodes() - 1}.</p>
 */
public interface TunnelNetwork {

    int getNumNodes();

    int getInitialNode();

    int getFinalNode();

    String getNodeName(int node);

    List<NetworkEdge> getEdges();

    List<NetworkEdge> getOutgoingEdges(int node);

    boolean hasAction(int source, int target, Action action);

    default boolean isTransmission(StackSymbol top, int source, int target) {
        return hasAction(source, target, Action.transmit(top));
    }

    default boolean isPush(StackSymbol top, StackSymbol pushed, int source, int target) {
        return hasAction(source, target, Action.push(top, pushed));
    }

    default boolean isPop(StackSymbol revealed, StackSymbol popped, int source, int target) {
        return hasAction(source, target, Action.pop(revealed, popped));
    }

}
