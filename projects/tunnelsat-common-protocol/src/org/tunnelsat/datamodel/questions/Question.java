package org.tunnelsat.datamodel.questions;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.codehaus.jettison.json.JSONObject;

/**
 * <p>A question asked about a tunnel network. Concrete questions read their
 * parameters from a JSON object and expose them back through Jackson
 * properties, so a question can be echoed alongside its answer.</p>
 *
 * <p>Subclasses extend {@link #isBaseKey(String)} with the keys they consume
 * so that their own subclasses can reject anything they do not recognise.</p>
 */
public abstract class Question {

    @JsonIgnore
    public abstract String getName();

    protected boolean isBaseKey(String paramKey) {
        return false;
    }

    public abstract void setJsonParameters(JSONObject parameters);

}
