package org.tunnelsat.question;

import org.codehaus.jettison.json.JSONObject;
import org.tunnelsat.common.Answerer;
import org.tunnelsat.common.plugin.ITunnelSat;
import org.tunnelsat.datamodel.answers.AnswerElement;
import org.tunnelsat.datamodel.questions.Question;


public abstract class QuestionPlugin {

    protected abstract Answerer createAnswerer(Question question, ITunnelSat tunnelSat);

    protected abstract Question createQuestion();

    public String getQuestionName() {
        return createQuestion().getName();
    }

    /**
     * Builds the question from its JSON parameters and answers it.
     */
    public AnswerElement answer(JSONObject parameters, ITunnelSat tunnelSat) {
        Question question = createQuestion();
        question.setJsonParameters(parameters);
        return createAnswerer(question, tunnelSat).answer();
    }

}
