package org.tunnelsat.datamodel.answers;

import com.fasterxml.jackson.core.JsonProcessingException;

public interface AnswerElement {

    String prettyPrint() throws JsonProcessingException;

}
