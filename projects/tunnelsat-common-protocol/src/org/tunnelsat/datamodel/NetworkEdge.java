package org.tunnelsat.datamodel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;


/**
 * A directed edge between two nodes together with the moves it supports.
 */
public class NetworkEdge {

    private static final String SOURCE_VAR = "source";

    private static final String TARGET_VAR = "target";

    private static final String ACTIONS_VAR = "actions";

    private final int _source;

    private final int _target;

    private final Set<Action> _actions;

    @JsonCreator
    public NetworkEdge(
            @JsonProperty(SOURCE_VAR) int source,
            @JsonProperty(TARGET_VAR) int target,
            @JsonProperty(ACTIONS_VAR) Collection<Action> actions) {
        _source = source;
        _target = target;
        _actions = (actions == null || actions.isEmpty()
                ? EnumSet.noneOf(Action.class) : EnumSet.copyOf(actions));
    }

    @JsonProperty(SOURCE_VAR)
    public int getSource() {
        return _source;
    }

    @JsonProperty(TARGET_VAR)
    public int getTarget() {
        return _target;
    }

    @JsonProperty(ACTIONS_VAR)
    public Set<Action> getActions() {
        return Collections.unmodifiableSet(_actions);
    }

    public boolean hasAction(Action a) {
        return _actions.contains(a);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        NetworkEdge that = (NetworkEdge) o;

        if (_source != that._source) return false;
        if (_target != that._target) return false;
        return _actions.equals(that._actions);
    }

    @Override
    public int hashCode() {
        int result = _source;
        result = 31 * result + _target;
        result = 31 * result + _actions.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return _source + " --> " + _target + " " + _actions;
    }

}
