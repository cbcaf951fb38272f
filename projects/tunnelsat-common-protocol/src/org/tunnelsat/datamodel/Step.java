package org.tunnelsat.datamodel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;


/**
 * One decoded move of a tunnel path: the action taken and the
 * (node, stack height) pairs it goes from and to.
 */
public class Step {

    private static final String ACTION_VAR = "action";

    private static final String SOURCE_VAR = "source";

    private static final String TARGET_VAR = "target";

    private static final String SOURCE_HEIGHT_VAR = "sourceHeight";

    private static final String TARGET_HEIGHT_VAR = "targetHeight";

    private final Action _action;

    private final int _source;

    private final int _target;

    private final int _sourceHeight;

    private final int _targetHeight;

    @JsonCreator
    public Step(
            @JsonProperty(ACTION_VAR) Action action,
            @JsonProperty(SOURCE_VAR) int source,
            @JsonProperty(TARGET_VAR) int target,
            @JsonProperty(SOURCE_HEIGHT_VAR) int sourceHeight,
            @JsonProperty(TARGET_HEIGHT_VAR) int targetHeight) {
        _action = action;
        _source = source;
        _target = target;
        _sourceHeight = sourceHeight;
        _targetHeight = targetHeight;
    }

    @JsonProperty(ACTION_VAR)
    public Action getAction() {
        return _action;
    }

    @JsonProperty(SOURCE_VAR)
    public int getSource() {
        return _source;
    }

    @JsonProperty(TARGET_VAR)
    public int getTarget() {
        return _target;
    }

    @JsonProperty(SOURCE_HEIGHT_VAR)
    public int getSourceHeight() {
        return _sourceHeight;
    }

    @JsonProperty(TARGET_HEIGHT_VAR)
    public int getTargetHeight() {
        return _targetHeight;
    }

    public String toString(TunnelNetwork network) {
        return _action + ": " + network.getNodeName(_source) + " -> "
                + network.getNodeName(_target);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Step step = (Step) o;

        if (_source != step._source) return false;
        if (_target != step._target) return false;
        if (_sourceHeight != step._sourceHeight) return false;
        if (_targetHeight != step._targetHeight) return false;
        return _action == step._action;
    }

    @Override
    public int hashCode() {
        int result = _action != null ? _action.hashCode() : 0;
        result = 31 * result + _source;
        result = 31 * result + _target;
        result = 31 * result + _sourceHeight;
        result = 31 * result + _targetHeight;
        return result;
    }

    @Override
    public String toString() {
        return _action + ": " + _source + "," + _sourceHeight + " -> " + _target + ","
                + _targetHeight;
    }

}
