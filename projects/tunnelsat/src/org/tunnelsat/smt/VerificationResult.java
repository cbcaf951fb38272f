package org.tunnelsat.smt;


import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.tunnelsat.datamodel.Step;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class VerificationResult {

    private static final String SATISFIABLE_VAR = "satisfiable";

    private static final String BOUND_VAR = "bound";

    private static final String PATH_VAR = "path";

    private static final String VIOLATIONS_VAR = "violations";

    private static final String TRACE_VAR = "trace";

    private static final String STATISTICS_VAR = "statistics";

    private final boolean _satisfiable;

    private final int _bound;

    private final List<Step> _path;

    private final List<String> _violations;

    private final String _trace;

    private final VerificationStats _statistics;

    @JsonCreator
    public VerificationResult(
            @JsonProperty(SATISFIABLE_VAR) boolean satisfiable,
            @JsonProperty(BOUND_VAR) int bound,
            @JsonProperty(PATH_VAR) List<Step> path,
            @JsonProperty(VIOLATIONS_VAR) List<String> violations,
            @JsonProperty(TRACE_VAR) String trace,
            @JsonProperty(STATISTICS_VAR) VerificationStats statistics) {
        _satisfiable = satisfiable;
        _bound = bound;
        _path = (path == null ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(path)));
        _violations = (violations == null ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(violations)));
        _trace = trace;
        _statistics = statistics;
    }

    @JsonProperty(SATISFIABLE_VAR)
    public boolean getSatisfiable() {
        return _satisfiable;
    }

    @JsonProperty(BOUND_VAR)
    public int getBound() {
        return _bound;
    }

    @JsonProperty(PATH_VAR)
    public List<Step> getPath() {
        return _path;
    }

    @JsonProperty(VIOLATIONS_VAR)
    public List<String> getViolations() {
        return _violations;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty(TRACE_VAR)
    public String getTrace() {
        return _trace;
    }

    @JsonProperty(STATISTICS_VAR)
    public VerificationStats getStatistics() {
        return _statistics;
    }

    @JsonIgnore
    public boolean isValidPath() {
        return _satisfiable && _violations.isEmpty();
    }

}
