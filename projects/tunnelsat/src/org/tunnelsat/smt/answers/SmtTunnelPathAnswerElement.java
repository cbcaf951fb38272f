package org.tunnelsat.smt.answers;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.tunnelsat.common.TunnelSatObjectMapper;
import org.tunnelsat.datamodel.Step;
import org.tunnelsat.datamodel.TunnelNetwork;
import org.tunnelsat.datamodel.answers.AnswerElement;
import org.tunnelsat.smt.VerificationResult;

public class SmtTunnelPathAnswerElement implements AnswerElement {

    private static final String RESULT_VAR = "result";

    private final TunnelNetwork _network;

    private final VerificationResult _result;

    public SmtTunnelPathAnswerElement(TunnelNetwork network, VerificationResult result) {
        _network = network;
        _result = result;
    }

    @JsonProperty(RESULT_VAR)
    public VerificationResult getResult() {
        return _result;
    }

    @JsonIgnore
    public TunnelNetwork getNetwork() {
        return _network;
    }

    public String toJson() throws JsonProcessingException {
        return new TunnelSatObjectMapper().writeValueAsString(this);
    }

    @Override
    public String prettyPrint() throws JsonProcessingException {
        StringBuilder sb = new StringBuilder();
        if (!_result.getSatisfiable()) {
            sb.append("No tunnel path of length ").append(_result.getBound()).append("\n");
            return sb.toString();
        }
        sb.append("Tunnel path of length ").append(_result.getBound()).append(":\n");
        for (Step step : _result.getPath()) {
            sb.append("  ").append(step.toString(_network)).append("\n");
        }
        for (String v : _result.getViolations()) {
            sb.append("Warning: ").append(v).append("\n");
        }
        if (_result.getTrace() != null) {
            sb.append(_result.getTrace());
        }
        return sb.toString();
    }
}
