package org.tunnelsat.smt;

import org.tunnelsat.common.plugin.ITunnelSat;
import org.tunnelsat.datamodel.TunnelNetwork;
import org.tunnelsat.datamodel.answers.AnswerElement;
import org.tunnelsat.smt.answers.SmtTunnelPathAnswerElement;


/**
 * Answers tunnel path questions about a single network.
 */
public class TunnelSat implements ITunnelSat {

    private final TunnelNetwork _network;

    public TunnelSat(TunnelNetwork network) {
        _network = network;
    }

    @Override
    public TunnelNetwork getNetwork() {
        return _network;
    }

    @Override
    public AnswerElement smtTunnelPath(int bound, boolean strictDecoding, boolean renderTrace) {
        VerificationResult res = PropertyChecker.computeTunnelPath(_network, bound,
                settings(strictDecoding, renderTrace));
        return new SmtTunnelPathAnswerElement(_network, res);
    }

    @Override
    public AnswerElement smtShortestTunnelPath(int maxBound, boolean strictDecoding,
            boolean renderTrace) {
        VerificationResult res = PropertyChecker.computeShortestTunnelPath(_network, maxBound,
                settings(strictDecoding, renderTrace));
        return new SmtTunnelPathAnswerElement(_network, res);
    }

    private static EncoderSettings settings(boolean strictDecoding, boolean renderTrace) {
        return new EncoderSettings()
                .setStrictDecoding(strictDecoding)
                .setRenderTrace(renderTrace);
    }
}
