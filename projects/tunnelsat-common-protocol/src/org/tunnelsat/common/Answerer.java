package org.tunnelsat.common;

import org.tunnelsat.common.plugin.ITunnelSat;
import org.tunnelsat.datamodel.answers.AnswerElement;
import org.tunnelsat.datamodel.questions.Question;


public abstract class Answerer {

    protected final Question _question;

    protected final ITunnelSat _tunnelSat;

    public Answerer(Question question, ITunnelSat tunnelSat) {
        _question = question;
        _tunnelSat = tunnelSat;
    }

    public abstract AnswerElement answer();

}
