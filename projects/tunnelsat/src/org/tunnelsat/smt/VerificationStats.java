package org.tunnelsat.smt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;


/**
 * Size of an encoding and the time Z3 spent on it.
 */
public class VerificationStats {

    private static final String NUM_NODES_VAR = "numNodes";

    private static final String NUM_EDGES_VAR = "numEdges";

    private static final String STACK_SIZE_VAR = "stackSize";

    private static final String NUM_VARIABLES_VAR = "numVariables";

    private static final String NUM_CONSTRAINTS_VAR = "numConstraints";

    private static final String TIME_VAR = "time";

    private final int _numNodes;

    private final int _numEdges;

    private final int _stackSize;

    private final int _numVariables;

    private final int _numConstraints;

    private final long _time;

    @JsonCreator
    public VerificationStats(
            @JsonProperty(NUM_NODES_VAR) int numNodes,
            @JsonProperty(NUM_EDGES_VAR) int numEdges,
            @JsonProperty(STACK_SIZE_VAR) int stackSize,
            @JsonProperty(NUM_VARIABLES_VAR) int numVariables,
            @JsonProperty(NUM_CONSTRAINTS_VAR) int numConstraints,
            @JsonProperty(TIME_VAR) long time) {
        _numNodes = numNodes;
        _numEdges = numEdges;
        _stackSize = stackSize;
        _numVariables = numVariables;
        _numConstraints = numConstraints;
        _time = time;
    }

    @JsonProperty(NUM_NODES_VAR)
    public int getNumNodes() {
        return _numNodes;
    }

    @JsonProperty(NUM_EDGES_VAR)
    public int getNumEdges() {
        return _numEdges;
    }

    @JsonProperty(STACK_SIZE_VAR)
    public int getStackSize() {
        return _stackSize;
    }

    @JsonProperty(NUM_VARIABLES_VAR)
    public int getNumVariables() {
        return _numVariables;
    }

    @JsonProperty(NUM_CONSTRAINTS_VAR)
    public int getNumConstraints() {
        return _numConstraints;
    }

    // milliseconds
    @JsonProperty(TIME_VAR)
    public long getTime() {
        return _time;
    }

}
