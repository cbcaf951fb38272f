package org.tunnelsat.smt;

import org.tunnelsat.datamodel.Action;
import org.tunnelsat.datamodel.StackSymbol;
import org.tunnelsat.datamodel.Step;
import org.tunnelsat.datamodel.TunnelNetwork;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;


/**
 * <p>Replays a decoded path on the network, independently of the encoding.</p>
 *
 * <p>The replay starts from the stack {@code [A]} on the initial node and
 * checks every step against the network capabilities and the simulated stack.
 * Each problem found is reported as one message; an empty list means the path
 * is a valid simple tunnel path of the expected length.</p>
 */
public class PathValidator {

    private final TunnelNetwork _network;

    private final int _length;

    private final int _stackSize;

    public PathValidator(TunnelNetwork network, int length) {
        _network = network;
        _length = length;
        _stackSize = Encoder.stackSize(length);
    }

    public List<String> validate(List<Step> path) {
        List<String> violations = new ArrayList<>();
        if (path.size() != _length) {
            violations.add("Expected " + _length + " steps but got " + path.size());
        }
        if (path.isEmpty()) {
            if (_network.getInitialNode() != _network.getFinalNode()) {
                violations.add("Empty path but the initial and final nodes differ");
            }
            return violations;
        }

        if (path.get(0).getSource() != _network.getInitialNode()) {
            violations.add("Path starts at " + name(path.get(0).getSource())
                    + " instead of " + name(_network.getInitialNode()));
        }
        Step last = path.get(path.size() - 1);
        if (last.getTarget() != _network.getFinalNode()) {
            violations.add("Path ends at " + name(last.getTarget()) + " instead of "
                    + name(_network.getFinalNode()));
        }

        Set<Integer> visited = new HashSet<>();
        visited.add(path.get(0).getSource());

        List<StackSymbol> stack = new ArrayList<>();
        stack.add(StackSymbol.A);

        for (int i = 0; i < path.size(); i++) {
            Step step = path.get(i);
            String where = "Step " + i + " (" + step.toString(_network) + ")";

            if (i > 0 && path.get(i - 1).getTarget() != step.getSource()) {
                violations.add(where + " does not start where step " + (i - 1) + " ended");
            }
            if (!visited.add(step.getTarget())) {
                violations.add(where + " revisits " + name(step.getTarget()));
            }
            if (!_network.hasAction(step.getSource(), step.getTarget(), step.getAction())) {
                violations.add(where + " is not offered by the network");
            }
            if (step.getSourceHeight() != stack.size() - 1) {
                violations.add(where + " claims height " + step.getSourceHeight()
                        + " but the stack has height " + (stack.size() - 1));
            }

            apply(step.getAction(), stack, where, violations);

            if (step.getTargetHeight() != stack.size() - 1) {
                violations.add(where + " claims target height " + step.getTargetHeight()
                        + " but the stack has height " + (stack.size() - 1));
            }
        }

        if (stack.size() != 1 || stack.get(0) != StackSymbol.A) {
            violations.add("Path ends with stack " + stack + " instead of [A]");
        }
        return violations;
    }

    private void apply(Action a, List<StackSymbol> stack, String where,
            List<String> violations) {
        StackSymbol top = stack.get(stack.size() - 1);
        if (top != a.getTopBefore()) {
            violations.add(where + " needs " + a.getTopBefore() + " on top but finds " + top);
        }
        switch (a.getKind()) {
            case TRANSMIT:
                break;
            case PUSH:
                if (stack.size() + 1 > _stackSize) {
                    violations.add(where + " overflows a stack of " + _stackSize + " cells");
                }
                stack.add(a.getTopAfter());
                break;
            case POP:
                if (stack.size() < 2) {
                    violations.add(where + " pops the last symbol of the stack");
                    break;
                }
                stack.remove(stack.size() - 1);
                StackSymbol revealed = stack.get(stack.size() - 1);
                if (revealed != a.getTopAfter()) {
                    violations.add(where + " should reveal " + a.getTopAfter() + " but reveals "
                            + revealed);
                }
                break;
            default:
                throw new IllegalStateException("Unknown action kind " + a.getKind());
        }
    }

    private String name(int node) {
        return _network.getNodeName(node);
    }

}
