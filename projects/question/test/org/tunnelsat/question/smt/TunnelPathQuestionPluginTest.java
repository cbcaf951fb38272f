package org.tunnelsat.question.smt;

import org.codehaus.jettison.json.JSONObject;
import org.junit.Before;
import org.junit.Test;
import org.tunnelsat.common.TunnelSatException;
import org.tunnelsat.common.plugin.ITunnelSat;
import org.tunnelsat.datamodel.TunnelNetwork;
import org.tunnelsat.datamodel.answers.AnswerElement;
import org.tunnelsat.question.smt.TunnelPathQuestionPlugin.TunnelPathQuestion;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class TunnelPathQuestionPluginTest {

    /*
     * Records the last call instead of solving anything.
     */
    private static class RecordingTunnelSat implements ITunnelSat {

        private String _lastCall;

        @Override
        public TunnelNetwork getNetwork() {
            return null;
        }

        @Override
        public AnswerElement smtTunnelPath(int bound, boolean strictDecoding,
                boolean renderTrace) {
            _lastCall = "path " + bound + " " + strictDecoding + " " + renderTrace;
            return () -> _lastCall;
        }

        @Override
        public AnswerElement smtShortestTunnelPath(int maxBound, boolean strictDecoding,
                boolean renderTrace) {
            _lastCall = "shortest " + maxBound + " " + strictDecoding + " " + renderTrace;
            return () -> _lastCall;
        }
    }

    private TunnelPathQuestionPlugin _plugin;

    private RecordingTunnelSat _tunnelSat;

    @Before
    public void setup() {
        _plugin = new TunnelPathQuestionPlugin();
        _tunnelSat = new RecordingTunnelSat();
    }

    @Test
    public void name() {
        assertEquals("smt-tunnel-path", _plugin.getQuestionName());
    }

    @Test
    public void defaults() throws Exception {
        TunnelPathQuestion q = new TunnelPathQuestion();
        q.setJsonParameters(new JSONObject("{}"));
        assertNull(q.getBound());
        assertEquals(10, q.getMaxBound());
        assertFalse(q.getShortest());
        assertFalse(q.getStrictDecoding());
        assertFalse(q.getRenderTrace());
    }

    @Test
    public void readsParameters() throws Exception {
        TunnelPathQuestion q = new TunnelPathQuestion();
        q.setJsonParameters(new JSONObject(
                "{\"bound\": 4, \"maxBound\": 7, \"shortest\": true, \"renderTrace\": true}"));
        assertEquals(Integer.valueOf(4), q.getBound());
        assertEquals(7, q.getMaxBound());
        assertTrue(q.getShortest());
        assertTrue(q.getRenderTrace());
        assertFalse(q.getStrictDecoding());
    }

    @Test
    public void answersFixedBound() throws Exception {
        AnswerElement answer = _plugin.answer(
                new JSONObject("{\"bound\": 3, \"strictDecoding\": true}"), _tunnelSat);
        assertEquals("path 3 true false", answer.prettyPrint());
    }

    @Test
    public void answersShortest() throws Exception {
        AnswerElement answer = _plugin.answer(
                new JSONObject("{\"shortest\": true, \"maxBound\": 6, \"renderTrace\": true}"),
                _tunnelSat);
        assertEquals("shortest 6 false true", answer.prettyPrint());
    }

    @Test(expected = TunnelSatException.class)
    public void missingBound() throws Exception {
        _plugin.answer(new JSONObject("{\"renderTrace\": true}"), _tunnelSat);
    }

    @Test(expected = TunnelSatException.class)
    public void unknownKey() throws Exception {
        _plugin.answer(new JSONObject("{\"bound\": 3, \"depth\": 2}"), _tunnelSat);
    }
}
