package org.tunnelsat.question.smt;


import com.fasterxml.jackson.annotation.JsonProperty;
import org.codehaus.jettison.json.JSONException;
import org.codehaus.jettison.json.JSONObject;
import org.tunnelsat.common.TunnelSatException;
import org.tunnelsat.datamodel.questions.Question;

import java.util.Iterator;

/**
 * Parameters shared by every question that decodes a path from a model.
 */
public abstract class PathQuestion extends Question {

    private static final String STRICT_DECODING_VAR = "strictDecoding";

    private static final String RENDER_TRACE_VAR = "renderTrace";

    private boolean _strictDecoding;

    private boolean _renderTrace;

    public PathQuestion() {
        _strictDecoding = false;
        _renderTrace = false;
    }

    @Override
    protected boolean isBaseKey(String paramKey) {
        if (super.isBaseKey(paramKey)) {
            return true;
        }
        switch (paramKey) {
            case STRICT_DECODING_VAR:
                return true;
            case RENDER_TRACE_VAR:
                return true;
            default:
                return false;
        }
    }

    @JsonProperty(STRICT_DECODING_VAR)
    public boolean getStrictDecoding() {
        return _strictDecoding;
    }

    @JsonProperty(RENDER_TRACE_VAR)
    public boolean getRenderTrace() {
        return _renderTrace;
    }

    @JsonProperty(STRICT_DECODING_VAR)
    public void setStrictDecoding(boolean strictDecoding) {
        _strictDecoding = strictDecoding;
    }

    @JsonProperty(RENDER_TRACE_VAR)
    public void setRenderTrace(boolean renderTrace) {
        _renderTrace = renderTrace;
    }

    @Override
    public void setJsonParameters(JSONObject parameters) {
        Iterator<?> paramKeys = parameters.keys();

        while (paramKeys.hasNext()) {
            String paramKey = (String) paramKeys.next();

            try {
                switch (paramKey) {
                    case STRICT_DECODING_VAR:
                        setStrictDecoding(parameters.getBoolean(paramKey));
                        break;
                    case RENDER_TRACE_VAR:
                        setRenderTrace(parameters.getBoolean(paramKey));
                        break;
                    default:
                        break;
                }
            }
            catch (JSONException e) {
                throw new TunnelSatException("JSONException in parameters", e);
            }
        }
    }
}
