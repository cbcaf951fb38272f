package org.tunnelsat.question.smt;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.codehaus.jettison.json.JSONException;
import org.codehaus.jettison.json.JSONObject;
import org.tunnelsat.common.Answerer;
import org.tunnelsat.common.TunnelSatException;
import org.tunnelsat.common.plugin.ITunnelSat;
import org.tunnelsat.datamodel.answers.AnswerElement;
import org.tunnelsat.datamodel.questions.Question;
import org.tunnelsat.question.QuestionPlugin;

import java.util.Iterator;


public class TunnelPathQuestionPlugin extends QuestionPlugin {

    public static class TunnelPathAnswerer extends Answerer {

        public TunnelPathAnswerer(Question question, ITunnelSat tunnelSat) {
            super(question, tunnelSat);
        }

        @Override
        public AnswerElement answer() {
            TunnelPathQuestion q = (TunnelPathQuestion) _question;

            if (q.getShortest()) {
                return _tunnelSat.smtShortestTunnelPath(q.getMaxBound(),
                        q.getStrictDecoding(), q.getRenderTrace());
            }
            if (q.getBound() == null) {
                throw new TunnelSatException("Missing parameter: bound");
            }
            return _tunnelSat.smtTunnelPath(q.getBound(), q.getStrictDecoding(),
                    q.getRenderTrace());
        }
    }

    public static class TunnelPathQuestion extends PathQuestion {

        private static final int DEFAULT_MAX_BOUND = 10;

        private static final String BOUND_VAR = "bound";

        private static final String MAX_BOUND_VAR = "maxBound";

        private static final String SHORTEST_VAR = "shortest";

        private Integer _bound;

        private int _maxBound;

        private boolean _shortest;

        public TunnelPathQuestion() {
            _bound = null;
            _maxBound = DEFAULT_MAX_BOUND;
            _shortest = false;
        }

        @Override
        public void setJsonParameters(JSONObject parameters) {
            super.setJsonParameters(parameters);

            Iterator<?> paramKeys = parameters.keys();

            while (paramKeys.hasNext()) {
                String paramKey = (String) paramKeys.next();

                if (isBaseKey(paramKey)) {
                    continue;
                }

                try {
                    switch (paramKey) {
                        case BOUND_VAR:
                            setBound(parameters.getInt(paramKey));
                            break;
                        case MAX_BOUND_VAR:
                            setMaxBound(parameters.getInt(paramKey));
                            break;
                        case SHORTEST_VAR:
                            setShortest(parameters.getBoolean(paramKey));
                            break;
                        default:
                            throw new TunnelSatException("Unknown key: " + paramKey);
                    }
                }
                catch (JSONException e) {
                    throw new TunnelSatException("JSONException in parameters", e);
                }
            }

        }

        @JsonProperty(BOUND_VAR)
        public Integer getBound() {
            return _bound;
        }

        @JsonProperty(MAX_BOUND_VAR)
        public int getMaxBound() {
            return _maxBound;
        }

        @JsonProperty(SHORTEST_VAR)
        public boolean getShortest() {
            return _shortest;
        }

        public void setBound(int i) {
            _bound = i;
        }

        public void setMaxBound(int i) {
            _maxBound = i;
        }

        public void setShortest(boolean shortest) {
            _shortest = shortest;
        }

        @Override
        public String getName() {
            return "smt-tunnel-path";
        }
    }


    @Override
    protected Answerer createAnswerer(Question question, ITunnelSat tunnelSat) {
        return new TunnelPathAnswerer(question, tunnelSat);
    }

    @Override
    protected Question createQuestion() {
        return new TunnelPathQuestion();
    }
}
